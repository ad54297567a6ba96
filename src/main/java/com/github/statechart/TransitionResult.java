package com.github.statechart;

/**
 * This object encapsulates the outcome of sending an event or setting a variable on a
 * {@link StateMachine}.
 *
 * If no transition was selected, {@link #isFired()} is false and both {@link #getFrom()} and
 * {@link #getTo()} report the unchanged current state. {@link #isTerminated()} is true when the
 * machine rests in a leaf without out transitions, from where it cannot move any more.
 *
 * Failures are not encoded here; they are thrown as {@link StateChartException}.
 */
public final class TransitionResult {
  private final boolean fired;
  private final StateId from;
  private final StateId to;
  private final boolean terminated;

  TransitionResult(final boolean fired, final StateId from, final StateId to,
      final boolean terminated) {
    this.fired = fired;
    this.from = from;
    this.to = to;
    this.terminated = terminated;
  }

  static TransitionResult unchanged(final StateId current, final boolean terminated) {
    return new TransitionResult(false, current, current, terminated);
  }

  public boolean isFired() {
    return fired;
  }

  public StateId getFrom() {
    return from;
  }

  public StateId getTo() {
    return to;
  }

  public boolean isTerminated() {
    return terminated;
  }

  @Override
  public String toString() {
    return "TransitionResult [fired=" + fired + ", from=" + from + ", to=" + to + ", terminated="
        + terminated + "]";
  }
}
