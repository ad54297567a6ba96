package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The call of a predicate, used as the guard of a transition. Predicates guarding the transitions
 * of the current state are evaluated whenever a variable value was modified.
 */
public final class PredicateCall {
  private final String name;
  private final List<Parameter> parameters;

  public PredicateCall(final String name, final List<Parameter> parameters) {
    this.name = Objects.requireNonNull(name);
    this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  public static PredicateCall fromValidatedValue(final ValidatedValue value)
      throws StateChartException {
    final String name = value.getMandatory("name").asString();
    return new PredicateCall(name,
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
    if (!(obj instanceof PredicateCall)) {
      return false;
    }
    PredicateCall other = (PredicateCall) obj;
    return name.equals(other.name) && parameters.equals(other.parameters);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameters);
  }

  @Override
  public String toString() {
    return "PredicateCall [name=" + name + ", parameters=" + parameters + "]";
  }
}
