package com.github.statechart;

import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.statechart.StateChartException.Code;

/**
 * The id of a state within one running state machine, e.g.
 * {@code sms:///0b7c.../Bug/fixing}. The first segment is the instance id, minted once when the
 * machine is started and shared by every state id of that machine. The rest is the path of the
 * node the state belongs to.
 */
public final class StateId {
  static final String SCHEME = "sms:///";
  private static final Pattern PATTERN = Pattern.compile(
      "^sms:///(?<instance>\\w[\\w.\\-]*)(?<path>(/\\w[\\w.\\-]*)*)$",
      Pattern.UNICODE_CHARACTER_CLASS);

  private final String id;

  private StateId(final String id) {
    this.id = id;
  }

  /**
   * Creates the root state id of a new machine for the given chart node, with a fresh instance id.
   */
  public static StateId create(final NodeId chartId) throws StateChartException {
    return new StateId(SCHEME + UUID.randomUUID() + "/" + chartId.path());
  }

  /**
   * Addresses the given node within the machine owning {@code machine}.
   */
  public static StateId withNode(final StateId machine, final NodeId nodeId)
      throws StateChartException {
    return new StateId(SCHEME + machine.instance() + "/" + nodeId.path());
  }

  /**
   * Wraps the full text of a state id; validated on first access.
   */
  public static StateId parse(final String id) {
    return new StateId(id);
  }

  public String instance() throws StateChartException {
    return matcher().group("instance");
  }

  /**
   * The node path of this state, empty for a bare instance address.
   */
  public String path() throws StateChartException {
    final String path = matcher().group("path");
    return path.isEmpty() ? path : path.substring(1);
  }

  /**
   * Checks whether this state belongs to the same machine as {@code other}.
   */
  public boolean sameInstance(final StateId other) throws StateChartException {
    return instance().equals(other.instance());
  }

  public boolean isValid() {
    return PATTERN.matcher(id).matches();
  }

  public String getId() {
    return id;
  }

  private Matcher matcher() throws StateChartException {
    final Matcher matcher = PATTERN.matcher(id);
    if (!matcher.matches()) {
      throw new StateChartException(Code.INVALID_STATE_ID, "StateId isn't valid: " + id);
    }
    return matcher;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StateId)) {
      return false;
    }
    return id.equals(((StateId) obj).id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id;
  }
}
