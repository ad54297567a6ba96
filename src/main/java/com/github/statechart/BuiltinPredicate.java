package com.github.statechart;

import java.util.List;

import com.github.statechart.CallRegistry.PredicateHandler;
import com.github.statechart.StateChartException.Code;

/**
 * Predicates every {@link CallRegistry#withBuiltins()} registry knows. Operands are taken from the
 * parameters by position, so {@code {name: "gt", parameters: [{name: "count", value: 0},
 * {name: "limit", value: 10}]}} compares the bound value of {@code count} against 10.
 */
enum BuiltinPredicate implements PredicateHandler {
  TRUE("true") {
    @Override
    public boolean test(final StateId state, final List<Parameter> parameters) {
      return true;
    }
  },
  FALSE("false") {
    @Override
    public boolean test(final StateId state, final List<Parameter> parameters) {
      return false;
    }
  },
  IS_TRUE("is_true") {
    @Override
    public boolean test(final StateId state, final List<Parameter> parameters)
        throws StateChartException {
      return operand(parameters, 0).asBoolean();
    }
  },
  EQ("eq") {
    @Override
    public boolean test(final StateId state, final List<Parameter> parameters)
        throws StateChartException {
      return sameValue(operand(parameters, 0), operand(parameters, 1));
    }
  },
  NE("ne") {
    @Override
    public boolean test(final StateId state, final List<Parameter> parameters)
        throws StateChartException {
      return !sameValue(operand(parameters, 0), operand(parameters, 1));
    }
  },
  GT("gt") {
    @Override
    public boolean test(final StateId state, final List<Parameter> parameters)
        throws StateChartException {
      return operand(parameters, 0).asNumber() > operand(parameters, 1).asNumber();
    }
  },
  LT("lt") {
    @Override
    public boolean test(final StateId state, final List<Parameter> parameters)
        throws StateChartException {
      return operand(parameters, 0).asNumber() < operand(parameters, 1).asNumber();
    }
  };

  private final String predicateName;

  private BuiltinPredicate(final String predicateName) {
    this.predicateName = predicateName;
  }

  String getPredicateName() {
    return predicateName;
  }

  static void registerAll(final CallRegistry registry) {
    for (final BuiltinPredicate predicate : values()) {
      registry.registerPredicate(predicate.predicateName, predicate);
    }
  }

  // integers and numbers compare by numeric value
  private static boolean sameValue(final VariableValue left, final VariableValue right)
      throws StateChartException {
    if (isNumeric(left) && isNumeric(right)) {
      return left.asNumber() == right.asNumber();
    }
    return left.equals(right);
  }

  private static boolean isNumeric(final VariableValue value) {
    return value.getType() == VariableValue.Type.INTEGER
        || value.getType() == VariableValue.Type.NUMBER;
  }

  private static VariableValue operand(final List<Parameter> parameters, final int position)
      throws StateChartException {
    if (parameters.size() <= position) {
      throw new StateChartException(Code.PREDICATE_FAILURE,
          "Expected at least " + (position + 1) + " parameters but got " + parameters.size());
    }
    return parameters.get(position).getValue();
  }
}
