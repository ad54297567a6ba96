package com.github.statechart;

/**
 * One timestamped entry of the operational log of a state machine. There is one entry per
 * externally observable change: a received event, a variable setting or a transition.
 */
public final class LogEntry {
  private final long timestampMillis;
  private final Type type;
  // event name or variable name
  private final String name;
  // textual value of a variable setting
  private final String value;
  private final NodeId from;
  private final NodeId to;

  private LogEntry(final Type type, final String name, final String value, final NodeId from,
      final NodeId to) {
    this.timestampMillis = System.currentTimeMillis();
    this.type = type;
    this.name = name;
    this.value = value;
    this.from = from;
    this.to = to;
  }

  public static LogEntry event(final String eventId) {
    return new LogEntry(Type.EVENT, eventId, null, null, null);
  }

  public static LogEntry variableSetting(final String variable, final String value) {
    return new LogEntry(Type.VARIABLE_SETTING, variable, value, null, null);
  }

  public static LogEntry transition(final NodeId from, final NodeId to) {
    return new LogEntry(Type.TRANSITION, null, null, from, to);
  }

  public long getTimestampMillis() {
    return timestampMillis;
  }

  public Type getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  public NodeId getFrom() {
    return from;
  }

  public NodeId getTo() {
    return to;
  }

  @Override
  public String toString() {
    switch (type) {
      case EVENT:
        return "LogEntry [" + timestampMillis + ", event=" + name + "]";
      case VARIABLE_SETTING:
        return "LogEntry [" + timestampMillis + ", variable=" + name + ", value=" + value + "]";
      default:
        return "LogEntry [" + timestampMillis + ", transition=" + from + "->" + to + "]";
    }
  }

  public static enum Type {
    EVENT, VARIABLE_SETTING, TRANSITION;
  }
}
