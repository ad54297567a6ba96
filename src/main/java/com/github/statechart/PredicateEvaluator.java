package com.github.statechart;

/**
 * Evaluates the predicates guarding transitions.
 */
public interface PredicateEvaluator {

  /**
   * Returns true iff the predicate holds. Parameters referring to variables are already
   * substituted with their bound values.
   */
  boolean evaluate(final StateId state, final PredicateCall call) throws StateChartException;

}
