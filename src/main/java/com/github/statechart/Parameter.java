package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named argument of an action or predicate call, e.g. {@code {name: "email", value: "a.b@c.d"}}.
 */
public final class Parameter {
  private final String name;
  private final VariableValue value;

  public Parameter(final String name, final VariableValue value) {
    this.name = Objects.requireNonNull(name);
    this.value = Objects.requireNonNull(value);
  }

  public static Parameter fromValidatedValue(final ValidatedValue value)
      throws StateChartException {
    final String name = value.getMandatory("name").asString();
    return new Parameter(name, VariableValue.fromValidatedValue(value.getMandatory("value")));
  }

  /**
   * Derives the parameter list from an array value; the first bad element aborts.
   */
  static List<Parameter> listFromValidatedValue(final ValidatedValue values)
      throws StateChartException {
    final List<Parameter> parameters = new ArrayList<>();
    for (final ValidatedValue value : values.asArray()) {
      parameters.add(fromValidatedValue(value));
    }
    return Collections.unmodifiableList(parameters);
  }

  public String getName() {
    return name;
  }

  public VariableValue getValue() {
    return value;
  }

  Parameter withValue(final VariableValue newValue) {
    return new Parameter(name, newValue);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Parameter)) {
      return false;
    }
    Parameter other = (Parameter) obj;
    return name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
