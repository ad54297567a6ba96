package com.github.statechart;

/**
 * This class encapsulates all the configuration parameters for state machines and the
 * {@link StateChartService}. Use the {@code StateChartConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. If the guard scopes are not set, only the transitions of the innermost active node are
 * scanned for both events and predicates.<br>
 * 2. If lockAcquisitionMillis is not set, callers wait up to 100 millis for exclusive access to a
 * machine before giving up.<br>
 * 3. If maxLogEntries is not set, the latest 100 log entries of every machine are retained.<br>
 */
public final class StateChartConfiguration {
  static final long defaultLockAcquisitionMillis = 100L;
  static final int defaultMaxLogEntries = 100;

  private final GuardScope eventScope;
  private final GuardScope predicateScope;
  private final long lockAcquisitionMillis;
  private final int maxLogEntries;

  public GuardScope getEventScope() {
    return eventScope;
  }

  public GuardScope getPredicateScope() {
    return predicateScope;
  }

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public int getMaxLogEntries() {
    return maxLogEntries;
  }

  public static StateChartConfiguration defaults() {
    return new StateChartConfiguration(GuardScope.ACTIVE_NODE, GuardScope.ACTIVE_NODE,
        defaultLockAcquisitionMillis, defaultMaxLogEntries);
  }

  public final static class StateChartConfigurationBuilder {
    private GuardScope eventScope = GuardScope.ACTIVE_NODE;
    private GuardScope predicateScope = GuardScope.ACTIVE_NODE;
    private long lockAcquisitionMillis = defaultLockAcquisitionMillis;
    private int maxLogEntries = defaultMaxLogEntries;

    public static StateChartConfigurationBuilder newBuilder() {
      return new StateChartConfigurationBuilder();
    }

    public StateChartConfigurationBuilder eventScope(final GuardScope eventScope) {
      this.eventScope = eventScope;
      return this;
    }

    public StateChartConfigurationBuilder predicateScope(final GuardScope predicateScope) {
      this.predicateScope = predicateScope;
      return this;
    }

    public StateChartConfigurationBuilder lockAcquisitionMillis(long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public StateChartConfigurationBuilder maxLogEntries(int maxLogEntries) {
      this.maxLogEntries = maxLogEntries;
      return this;
    }

    public StateChartConfiguration build() throws StateChartException {
      final StateChartConfiguration config = new StateChartConfiguration(eventScope,
          predicateScope, lockAcquisitionMillis, maxLogEntries);
      config.validate();
      return config;
    }

    private StateChartConfigurationBuilder() {}
  }

  private void validate() throws StateChartException {
    StringBuilder messages = new StringBuilder();
    if (eventScope == null) {
      messages.append("Event GuardScope cannot be null. ");
    }
    if (predicateScope == null) {
      messages.append("Predicate GuardScope cannot be null. ");
    }
    if (lockAcquisitionMillis <= 0L) {
      messages.append("lockAcquisitionMillis must be positive. ");
    }
    if (maxLogEntries <= 0) {
      messages.append("maxLogEntries must be positive. ");
    }
    if (messages.length() > 0) {
      throw new StateChartException(StateChartException.Code.INVALID_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "StateChartConfiguration [eventScope=" + eventScope + ", predicateScope="
        + predicateScope + ", lockAcquisitionMillis=" + lockAcquisitionMillis
        + ", maxLogEntries=" + maxLogEntries + "]";
  }

  private StateChartConfiguration(final GuardScope eventScope, final GuardScope predicateScope,
      final long lockAcquisitionMillis, final int maxLogEntries) {
    this.eventScope = eventScope;
    this.predicateScope = predicateScope;
    this.lockAcquisitionMillis = lockAcquisitionMillis;
    this.maxLogEntries = maxLogEntries;
  }

}
