package com.github.statechart;

import java.util.Objects;

/**
 * The transition from the node it is declared on to another node of the same chart. The optional
 * action runs after the exit actions of the vacated nodes and before the entry actions of the
 * entered ones.
 */
public final class Transition {
  private final Guard guard;
  private final NodeId to;
  private final ActionCall action;

  public Transition(final Guard guard, final NodeId to, final ActionCall action) {
    this.guard = Objects.requireNonNull(guard);
    this.to = Objects.requireNonNull(to);
    this.action = action;
  }

  public static Transition fromValidatedValue(final ValidatedValue value)
      throws StateChartException {
    final Guard guard = Guard.fromValidatedValue(value.getMandatory("guard"));
    final NodeId to = NodeId.fromValidatedValue(value.getMandatory("to"));
    final ValidatedValue action = value.getOptional("action");
    return new Transition(guard, to, action == null ? null : ActionCall.fromValidatedValue(action));
  }

  public Guard getGuard() {
    return guard;
  }

  public NodeId getTo() {
    return to;
  }

  /**
   * Null if the transition has no action.
   */
  public ActionCall getAction() {
    return action;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition other = (Transition) obj;
    return guard.equals(other.guard) && to.equals(other.to)
        && Objects.equals(action, other.action);
  }

  @Override
  public int hashCode() {
    return Objects.hash(guard, to, action);
  }

  @Override
  public String toString() {
    return "Transition [guard=" + guard + ", to=" + to + ", action=" + action + "]";
  }
}
