package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StateChartException.Code;

/**
 * Resolves action and predicate calls by name against the handlers registered with it. Create one
 * registry per service or test; it is not meant to be a process wide singleton.
 */
public final class CallRegistry implements ActionExecutor, PredicateEvaluator {
  private static final Logger logger = LogManager.getLogger(CallRegistry.class.getSimpleName());

  // K=action name, V=handler and its info
  private final ConcurrentMap<String, RegisteredAction> actions = new ConcurrentHashMap<>();
  // K=predicate name, V=handler
  private final ConcurrentMap<String, PredicateHandler> predicates = new ConcurrentHashMap<>();

  /**
   * A registry knowing the built-in predicates only.
   */
  public static CallRegistry withBuiltins() {
    final CallRegistry registry = new CallRegistry();
    BuiltinPredicate.registerAll(registry);
    return registry;
  }

  public CallRegistry registerAction(final ActionInfo info, final ActionHandler handler) {
    actions.put(info.getName(), new RegisteredAction(info, handler));
    logger.info("Registered action " + info.getName());
    return this;
  }

  public CallRegistry registerAction(final String name, final ActionHandler handler) {
    return registerAction(new ActionInfo(name, "", Collections.<VariableDeclaration>emptyList()),
        handler);
  }

  public CallRegistry registerPredicate(final String name, final PredicateHandler handler) {
    predicates.put(name, handler);
    logger.info("Registered predicate " + name);
    return this;
  }

  @Override
  public void execute(final StateId state, final ActionCall call) throws StateChartException {
    final RegisteredAction action = actions.get(call.getName());
    if (action == null) {
      throw new StateChartException(Code.ACTION_FAILURE, "Unknown action: " + call.getName());
    }
    action.handler.execute(state, call.getParameters());
  }

  @Override
  public boolean evaluate(final StateId state, final PredicateCall call)
      throws StateChartException {
    final PredicateHandler predicate = predicates.get(call.getName());
    if (predicate == null) {
      throw new StateChartException(Code.PREDICATE_FAILURE,
          "Unknown predicate: " + call.getName());
    }
    return predicate.test(state, call.getParameters());
  }

  /**
   * Information about all registered actions, ordered by name.
   */
  public List<ActionInfo> listActions() {
    final List<ActionInfo> infos = new ArrayList<>();
    for (final RegisteredAction action : new TreeMap<>(actions).values()) {
      infos.add(action.info);
    }
    return infos;
  }

  public boolean hasPredicate(final String name) {
    return predicates.containsKey(name);
  }

  /**
   * The implementation of a named action.
   */
  public interface ActionHandler {
    void execute(final StateId state, final List<Parameter> parameters)
        throws StateChartException;
  }

  /**
   * The implementation of a named predicate.
   */
  public interface PredicateHandler {
    boolean test(final StateId state, final List<Parameter> parameters)
        throws StateChartException;
  }

  private static final class RegisteredAction {
    private final ActionInfo info;
    private final ActionHandler handler;

    private RegisteredAction(final ActionInfo info, final ActionHandler handler) {
      this.info = info;
      this.handler = handler;
    }
  }
}
