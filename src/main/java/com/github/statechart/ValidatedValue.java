package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.github.statechart.StateChartException.Code;

/**
 * Generic value tree handed over by the validating front end. The tree is guaranteed to conform to
 * the schema of a state chart, but not to be a semantically valid state chart.
 *
 * Object keys keep their insertion order.
 */
public final class ValidatedValue {
  private static final ValidatedValue NONE = new ValidatedValue(Kind.NONE, null);

  private final Kind kind;
  // scalar payload, null for NONE, ARRAY and OBJECT
  private final Object value;
  private final List<ValidatedValue> elements;
  private final Map<String, ValidatedValue> attributes;

  private ValidatedValue(final Kind kind, final Object value) {
    this(kind, value, null, null);
  }

  private ValidatedValue(final Kind kind, final Object value,
      final List<ValidatedValue> elements, final Map<String, ValidatedValue> attributes) {
    this.kind = kind;
    this.value = value;
    this.elements = elements;
    this.attributes = attributes;
  }

  public static ValidatedValue ofString(final String value) {
    return new ValidatedValue(Kind.STRING, Objects.requireNonNull(value));
  }

  public static ValidatedValue ofInteger(final long value) {
    return new ValidatedValue(Kind.INTEGER, value);
  }

  public static ValidatedValue ofNumber(final double value) {
    return new ValidatedValue(Kind.NUMBER, value);
  }

  public static ValidatedValue ofBool(final boolean value) {
    return new ValidatedValue(Kind.BOOL, value);
  }

  public static ValidatedValue none() {
    return NONE;
  }

  public static ValidatedValue ofArray(final List<ValidatedValue> elements) {
    return new ValidatedValue(Kind.ARRAY, null,
        Collections.unmodifiableList(new ArrayList<>(elements)), null);
  }

  public static ValidatedValue ofObject(final Map<String, ValidatedValue> attributes) {
    return new ValidatedValue(Kind.OBJECT, null, null,
        Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
  }

  public Kind getKind() {
    return kind;
  }

  public String asString() throws StateChartException {
    expect(Kind.STRING);
    return (String) value;
  }

  public long asInteger() throws StateChartException {
    expect(Kind.INTEGER);
    return (Long) value;
  }

  public double asNumber() throws StateChartException {
    expect(Kind.NUMBER);
    return (Double) value;
  }

  public boolean asBool() throws StateChartException {
    expect(Kind.BOOL);
    return (Boolean) value;
  }

  public List<ValidatedValue> asArray() throws StateChartException {
    expect(Kind.ARRAY);
    return elements;
  }

  public Map<String, ValidatedValue> asObject() throws StateChartException {
    expect(Kind.OBJECT);
    return attributes;
  }

  /**
   * Retrieves a mandatory attribute of an object value.
   */
  public ValidatedValue getMandatory(final String name) throws StateChartException {
    final ValidatedValue attribute = asObject().get(name);
    if (attribute == null) {
      throw StateChartException.missing(name);
    }
    return attribute;
  }

  /**
   * Retrieves an optional attribute of an object value, null if absent.
   */
  public ValidatedValue getOptional(final String name) throws StateChartException {
    return asObject().get(name);
  }

  private void expect(final Kind expected) throws StateChartException {
    if (kind != expected) {
      throw new StateChartException(Code.UNEXPECTED_TYPE,
          "Unexpected type provided: expected " + expected + " but was " + kind);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ValidatedValue)) {
      return false;
    }
    ValidatedValue other = (ValidatedValue) obj;
    return kind == other.kind && Objects.equals(value, other.value)
        && Objects.equals(elements, other.elements)
        && Objects.equals(attributes, other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value, elements, attributes);
  }

  @Override
  public String toString() {
    switch (kind) {
      case NONE:
        return kind.toString();
      case ARRAY:
        return kind + "(" + elements + ")";
      case OBJECT:
        return kind + "(" + attributes + ")";
      default:
        return kind + "(" + value + ")";
    }
  }

  public static enum Kind {
    STRING, INTEGER, NUMBER, BOOL, NONE, ARRAY, OBJECT;
  }
}
