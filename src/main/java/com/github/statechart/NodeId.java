package com.github.statechart;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.statechart.StateChartException.Code;

/**
 * A system wide unique id of a node within a state chart definition, e.g. {@code scn:///Bug/fixing}.
 * The id is shared by all state machines running the same chart.
 *
 * The text is not validated on construction, so that untrusted input can be held as is. The
 * structure is checked on first access to {@link #path()}.
 */
public final class NodeId {
  static final String SCHEME = "scn:///";
  private static final Pattern PATTERN = Pattern.compile(
      "^scn:///(?<path>\\p{L}[\\w.\\-]*(/\\w[\\w.\\-]*)*)$", Pattern.UNICODE_CHARACTER_CLASS);

  private final String id;

  private NodeId(final String id) {
    this.id = id;
  }

  /**
   * Creates a node id from a node path, e.g. {@code Bug/fixing}.
   */
  public static NodeId of(final String path) {
    return new NodeId(SCHEME + path);
  }

  /**
   * Wraps the full text of a node id, e.g. {@code scn:///Bug/fixing}.
   */
  public static NodeId parse(final String id) {
    return new NodeId(id);
  }

  /**
   * Reads a node id from the generic value tree. Only the kind of the value is checked here.
   */
  static NodeId fromValidatedValue(final ValidatedValue value) throws StateChartException {
    return parse(value.asString());
  }

  public String path() throws StateChartException {
    final Matcher matcher = PATTERN.matcher(id);
    if (!matcher.matches()) {
      throw new StateChartException(Code.INVALID_NODE_ID, "NodeId isn't valid: " + id);
    }
    return matcher.group("path");
  }

  public boolean isValid() {
    return PATTERN.matcher(id).matches();
  }

  public String getId() {
    return id;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof NodeId)) {
      return false;
    }
    return id.equals(((NodeId) obj).id);
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
