package com.github.statechart;

/**
 * This represents which transitions are scanned when a guard is checked.
 */
public enum GuardScope {
  // only the out transitions of the innermost active node
  ACTIVE_NODE,
  // the innermost active node first, then its ancestors outwards up to the root
  ACTIVE_PATH;
}
