package com.github.statechart;

import java.util.Objects;

import com.github.statechart.StateChartException.Code;

/**
 * Declares a variable inside of a state chart node. The variable is visible in the node and in
 * all its descendants.
 */
public final class VariableDeclaration {
  private final String name;
  private final String type;
  private final VariableValue value;

  public VariableDeclaration(final String name, final String type, final VariableValue value) {
    this.name = Objects.requireNonNull(name);
    this.type = Objects.requireNonNull(type);
    this.value = Objects.requireNonNull(value);
  }

  /**
   * Fails with {@link Code#UNEXPECTED_TYPE} if the type tag is unknown or the initial value
   * doesn't fit it. Integer initial values of {@code number} variables are widened.
   */
  public static VariableDeclaration fromValidatedValue(final ValidatedValue value)
      throws StateChartException {
    final String name = value.getMandatory("name").asString();
    final String type = value.getMandatory("type").asString();
    if (VariableValue.Type.fromTag(type) == VariableValue.Type.NONE) {
      throw new StateChartException(Code.UNEXPECTED_TYPE,
          "Variable " + name + " cannot be declared of type " + type);
    }
    final VariableValue initial =
        VariableValue.fromValidatedValue(value.getMandatory("value")).coerceTo(type);
    return new VariableDeclaration(name, type, initial);
  }

  public String getName() {
    return name;
  }

  /**
   * One of {@code string}, {@code integer}, {@code number} or {@code boolean}.
   */
  public String getType() {
    return type;
  }

  /**
   * The initial value.
   */
  public VariableValue getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof VariableDeclaration)) {
      return false;
    }
    VariableDeclaration other = (VariableDeclaration) obj;
    return name.equals(other.name) && type.equals(other.type) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, value);
  }

  @Override
  public String toString() {
    return "VariableDeclaration [name=" + name + ", type=" + type + ", value=" + value + "]";
  }
}
