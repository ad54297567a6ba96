package com.github.statechart;

import java.util.List;

/**
 * The append-only log of all events, variable changes and transitions of a particular state
 * machine.
 */
public interface StateMachineLog {

  void append(final LogEntry entry);

  /**
   * Snapshot of the retained entries, oldest first.
   */
  List<LogEntry> entries();

}
