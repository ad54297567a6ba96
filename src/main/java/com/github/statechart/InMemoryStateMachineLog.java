package com.github.statechart;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the latest entries of a machine's log in memory. The log is bounded; once full, the oldest
 * entry is dropped for every new one.
 */
public final class InMemoryStateMachineLog implements StateMachineLog {
  private final int maxEntries;
  private final Deque<LogEntry> boundedEntries = new ArrayDeque<>();

  public InMemoryStateMachineLog(final int maxEntries) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.maxEntries = maxEntries;
  }

  @Override
  public synchronized void append(final LogEntry entry) {
    if (boundedEntries.size() == maxEntries) {
      boundedEntries.removeFirst();
    }
    boundedEntries.addLast(entry);
  }

  @Override
  public synchronized List<LogEntry> entries() {
    return new ArrayList<>(boundedEntries);
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  @Override
  public synchronized String toString() {
    return "InMemoryStateMachineLog [maxEntries=" + maxEntries + ", entries=" + boundedEntries
        + "]";
  }
}
