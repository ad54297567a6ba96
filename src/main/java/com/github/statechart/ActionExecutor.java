package com.github.statechart;

/**
 * Executes the actions named by {@link ActionCall}s. The state machine only sequences the calls;
 * what an action does is up to the implementation.
 *
 * Parameters referring to variables visible from the calling state are already substituted with
 * their bound values when the call reaches the executor.
 */
public interface ActionExecutor {

  /**
   * Execute the action. A thrown exception aborts the enclosing transition.
   *
   * @param state the state the call is made for, e.g. the node being entered or exited
   */
  void execute(final StateId state, final ActionCall call) throws StateChartException;

}
