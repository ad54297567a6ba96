package com.github.statechart;

import java.util.Objects;

import com.github.statechart.StateChartException.Code;

/**
 * The variable value holds the value of a variable or of a call parameter. It is one of a closed
 * set of cases, see {@link Type}. The default is {@link #none()}.
 */
public final class VariableValue {
  private static final VariableValue NONE = new VariableValue(Type.NONE, null);
  private static final VariableValue TRUE = new VariableValue(Type.BOOLEAN, Boolean.TRUE);
  private static final VariableValue FALSE = new VariableValue(Type.BOOLEAN, Boolean.FALSE);

  private final Type type;
  private final Object value;

  private VariableValue(final Type type, final Object value) {
    this.type = type;
    this.value = value;
  }

  public static VariableValue ofString(final String value) {
    return new VariableValue(Type.STRING, Objects.requireNonNull(value));
  }

  public static VariableValue ofInteger(final long value) {
    return new VariableValue(Type.INTEGER, value);
  }

  public static VariableValue ofNumber(final double value) {
    return new VariableValue(Type.NUMBER, value);
  }

  public static VariableValue ofBoolean(final boolean value) {
    return value ? TRUE : FALSE;
  }

  public static VariableValue none() {
    return NONE;
  }

  /**
   * Converts a scalar of the generic value tree. Arrays and objects are rejected.
   */
  public static VariableValue fromValidatedValue(final ValidatedValue value)
      throws StateChartException {
    switch (value.getKind()) {
      case STRING:
        return ofString(value.asString());
      case INTEGER:
        return ofInteger(value.asInteger());
      case NUMBER:
        return ofNumber(value.asNumber());
      case BOOL:
        return ofBoolean(value.asBool());
      case NONE:
        return none();
      default:
        throw new StateChartException(Code.UNEXPECTED_TYPE,
            "Expected a scalar value but was " + value.getKind());
    }
  }

  public Type getType() {
    return type;
  }

  public boolean isNone() {
    return type == Type.NONE;
  }

  public String asString() throws StateChartException {
    expect(Type.STRING);
    return (String) value;
  }

  public long asInteger() throws StateChartException {
    expect(Type.INTEGER);
    return (Long) value;
  }

  /**
   * Integers are widened.
   */
  public double asNumber() throws StateChartException {
    if (type == Type.INTEGER) {
      return ((Long) value).doubleValue();
    }
    expect(Type.NUMBER);
    return (Double) value;
  }

  public boolean asBoolean() throws StateChartException {
    expect(Type.BOOLEAN);
    return (Boolean) value;
  }

  /**
   * Checks this value against a declared type tag and returns the value to bind. NONE is accepted
   * for every tag and integers are widened for {@code number} declarations.
   */
  public VariableValue coerceTo(final String typeTag) throws StateChartException {
    final Type declared = Type.fromTag(typeTag);
    if (type == Type.NONE || type == declared) {
      return this;
    }
    if (declared == Type.NUMBER && type == Type.INTEGER) {
      return ofNumber(((Long) value).doubleValue());
    }
    throw new StateChartException(Code.UNEXPECTED_TYPE,
        "Value of type " + type.getTag() + " cannot be assigned to " + typeTag);
  }

  /**
   * Textual rendering used by the operational log.
   */
  public String toText() {
    return value == null ? "" : String.valueOf(value);
  }

  private void expect(final Type expected) throws StateChartException {
    if (type != expected) {
      throw new StateChartException(Code.UNEXPECTED_TYPE,
          "Unexpected type provided: expected " + expected.getTag() + " but was " + type.getTag());
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof VariableValue)) {
      return false;
    }
    VariableValue other = (VariableValue) obj;
    return type == other.type && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return type == Type.NONE ? "None" : type.getTag() + "(" + value + ")";
  }

  public static enum Type {
    STRING("string"), INTEGER("integer"), NUMBER("number"), BOOLEAN("boolean"), NONE("none");

    private final String tag;

    private Type(final String tag) {
      this.tag = tag;
    }

    public String getTag() {
      return tag;
    }

    static Type fromTag(final String tag) throws StateChartException {
      for (Type type : values()) {
        if (type.tag.equals(tag)) {
          return type;
        }
      }
      throw new StateChartException(Code.UNEXPECTED_TYPE, "Unknown variable type: " + tag);
    }
  }
}
