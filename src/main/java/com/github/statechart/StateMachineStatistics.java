package com.github.statechart;

/**
 * Simple statistics holder for a state machine.
 */
public final class StateMachineStatistics {
  private final long startTstampMillis = System.currentTimeMillis();
  private final StateId machineId;
  int eventsReceived;
  int variablesSet;
  int transitionsFired;
  int transitionFailures;
  // used to track activity level of a machine
  long lastTouchTimeMillis;

  StateMachineStatistics(final StateId machineId) {
    this.machineId = machineId;
    this.lastTouchTimeMillis = startTstampMillis;
  }

  public StateId getMachineId() {
    return machineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getEventsReceived() {
    return eventsReceived;
  }

  public int getVariablesSet() {
    return variablesSet;
  }

  public int getTransitionsFired() {
    return transitionsFired;
  }

  public int getTransitionFailures() {
    return transitionFailures;
  }

  public long getLastTouchTimeMillis() {
    return lastTouchTimeMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startTstampMillis;
  }

  void touch() {
    lastTouchTimeMillis = System.currentTimeMillis();
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [machineId=" + machineId + ", eventsReceived=" + eventsReceived
        + ", variablesSet=" + variablesSet + ", transitionsFired=" + transitionsFired
        + ", transitionFailures=" + transitionFailures + ", lastTouchTimeMillis="
        + lastTouchTimeMillis + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

}
