package com.github.statechart;

import java.util.Objects;

import com.github.statechart.StateChartException.Code;

/**
 * The guard on a transition holds the condition under which the transition is activated: either an
 * event with an exact id or a predicate over the variables of the machine.
 */
public final class Guard {
  private final Kind kind;
  private final String eventId;
  private final PredicateCall predicate;

  private Guard(final Kind kind, final String eventId, final PredicateCall predicate) {
    this.kind = kind;
    this.eventId = eventId;
    this.predicate = predicate;
  }

  public static Guard event(final String eventId) {
    return new Guard(Kind.EVENT, Objects.requireNonNull(eventId), null);
  }

  public static Guard predicate(final PredicateCall predicate) {
    return new Guard(Kind.PREDICATE, null, Objects.requireNonNull(predicate));
  }

  /**
   * Accepts a plain string (the event id), {@code {event: ...}}, {@code {predicate: {...}}} or the
   * predicate call object itself.
   */
  public static Guard fromValidatedValue(final ValidatedValue value) throws StateChartException {
    switch (value.getKind()) {
      case STRING:
        return event(value.asString());
      case OBJECT:
        final ValidatedValue eventValue = value.getOptional("event");
        if (eventValue != null) {
          return event(eventValue.asString());
        }
        final ValidatedValue predicateValue = value.getOptional("predicate");
        if (predicateValue != null) {
          return predicate(PredicateCall.fromValidatedValue(predicateValue));
        }
        return predicate(PredicateCall.fromValidatedValue(value));
      default:
        throw new StateChartException(Code.UNEXPECTED_TYPE,
            "Guard must be an event id or a predicate call but was " + value.getKind());
    }
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isEvent() {
    return kind == Kind.EVENT;
  }

  public boolean isPredicate() {
    return kind == Kind.PREDICATE;
  }

  /**
   * Null unless this is an event guard.
   */
  public String getEventId() {
    return eventId;
  }

  /**
   * Null unless this is a predicate guard.
   */
  public PredicateCall getPredicate() {
    return predicate;
  }

  public boolean matchesEvent(final String candidate) {
    return kind == Kind.EVENT && eventId.equals(candidate);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Guard)) {
      return false;
    }
    Guard other = (Guard) obj;
    return kind == other.kind && Objects.equals(eventId, other.eventId)
        && Objects.equals(predicate, other.predicate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, eventId, predicate);
  }

  @Override
  public String toString() {
    return kind == Kind.EVENT ? "Guard [event=" + eventId + "]"
        : "Guard [predicate=" + predicate + "]";
  }

  public static enum Kind {
    EVENT, PREDICATE;
  }
}
