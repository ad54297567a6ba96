package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The call of an action by name. The action itself is resolved and executed by an
 * {@link ActionExecutor}. Two calls with the same name and parameters are interchangeable.
 */
public final class ActionCall {
  private final String name;
  private final List<Parameter> parameters;

  public ActionCall(final String name, final List<Parameter> parameters) {
    this.name = Objects.requireNonNull(name);
    this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  public static ActionCall fromValidatedValue(final ValidatedValue value)
      throws StateChartException {
    final String name = value.getMandatory("name").asString();
    return new ActionCall(name,
        Parameter.listFromValidatedValue(value.getMandatory("parameters")));
  }

  public String getName() {
    return name;
  }

  public List<Parameter> getParameters() {
    return parameters;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ActionCall)) {
      return false;
    }
    ActionCall other = (ActionCall) obj;
    return name.equals(other.name) && parameters.equals(other.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameters);
  }

  @Override
  public String toString() {
    return "ActionCall [name=" + name + ", parameters=" + parameters + "]";
  }
}
