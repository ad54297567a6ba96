package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StateChartException.Code;

/**
 * A state machine is a running state chart: one execution with its own active state and its own
 * variable bindings.
 *
 * Notes for users:<br>
 * 1. this machine is NOT thread-safe. Callers must make sure that at most one {@link #send} or
 * {@link #setVariable} call is in flight per machine, e.g. by holding a lock per machine id as
 * the {@link StateChartService} does<br>
 *
 * 2. distinct machines share no mutable state and may be driven in parallel. The chart definition
 * is immutable, so a machine keeps running the chart it was started with even if the catalog
 * entry is replaced later<br>
 *
 * 3. every call is all-or-nothing: a failing action, predicate, unresolvable target or malformed
 * id aborts the call and leaves the current state and the variable bindings as they were.
 * Actions that already ran before the failure are not undone<br>
 *
 * 4. actions and predicates are executed by the injected collaborators; the machine only decides
 * which to call and in which order<br>
 */
public final class StateMachine {
  private static final Logger logger = LogManager.getLogger(StateMachine.class.getSimpleName());

  private final StateId id;
  private final StateChart stateChart;
  private final ActionExecutor actionExecutor;
  private final PredicateEvaluator predicateEvaluator;
  private final StateMachineLog log;
  private final StateChartConfiguration config;
  private final StateMachineStatistics machineStats;

  // K=declaring node, V=(K=variable name, V=bound value)
  private final Map<NodeId, Map<String, VariableValue>> bindings = new HashMap<>();

  private Node currentNode;
  private StateId currentState;

  private StateMachine(final StateId id, final StateChart stateChart,
      final ActionExecutor actionExecutor, final PredicateEvaluator predicateEvaluator,
      final StateMachineLog log, final StateChartConfiguration config) {
    this.id = id;
    this.stateChart = stateChart;
    this.actionExecutor = actionExecutor;
    this.predicateEvaluator = predicateEvaluator;
    this.log = log;
    this.config = config;
    this.machineStats = new StateMachineStatistics(id);
    for (final Node node : stateChart.nodes()) {
      final Map<String, VariableValue> scope = new LinkedHashMap<>();
      for (final VariableDeclaration variable : node.getVariables()) {
        scope.put(variable.getName(), variable.getValue());
      }
      bindings.put(node.getId(), scope);
    }
  }

  /**
   * Creates a new state machine, based on the provided state chart, with a freshly minted instance
   * id. The root and then the chain of start nodes below it are entered, running their entry
   * actions ancestor first, until a leaf is reached.
   *
   * Fails with {@link Code#NO_ROOT} if the root or a composite on the default entry chain has no
   * start node.
   */
  public static StateMachine start(final StateChart stateChart,
      final ActionExecutor actionExecutor, final PredicateEvaluator predicateEvaluator,
      final StateMachineLog log, final StateChartConfiguration config)
      throws StateChartException {
    final Node root = stateChart.getRoot();
    if (root.getStartNode() == null) {
      throw new StateChartException(Code.NO_ROOT,
          "State chart " + root.getId() + " has no start node");
    }
    final List<Node> entered = new ArrayList<>();
    entered.add(root);
    entered.addAll(stateChart.defaultEntryChain(root.getId()));

    final StateMachine machine = new StateMachine(StateId.create(root.getId()), stateChart,
        actionExecutor, predicateEvaluator, log, config);
    for (final Node node : entered) {
      machine.runAction(node.getOnEntry(), node);
    }
    final Node leaf = entered.get(entered.size() - 1);
    machine.currentNode = leaf;
    machine.currentState = StateId.withNode(machine.id, leaf.getId());
    machine.logInfo("Started state machine in " + machine.currentState);
    return machine;
  }

  /**
   * Sends an event to the machine. The out transitions of the current node are scanned in their
   * declared order and the first one guarded by exactly this event fires. Later transitions are
   * not looked at. An event without a matching transition changes nothing, but is logged all the
   * same.
   */
  public TransitionResult send(final String eventId) throws StateChartException {
    machineStats.touch();
    machineStats.eventsReceived++;
    appendLog(LogEntry.event(eventId));
    for (final Node node : scope(config.getEventScope())) {
      for (final Transition transition : node.getOutTransitions()) {
        if (transition.getGuard().matchesEvent(eventId)) {
          logDebug("Event " + eventId + " selected " + transition);
          final Node from = currentNode;
          final TransitionResult result = commit(transition);
          appendLog(LogEntry.transition(from.getId(), currentNode.getId()));
          return result;
        }
      }
    }
    logDebug("Event " + eventId + " matched no transition in " + currentState);
    return TransitionResult.unchanged(currentState, isTerminated());
  }

  /**
   * Sets a variable declared in the current node or one of its ancestors, the nearest declaration
   * wins. Afterwards the predicates guarding the out transitions of the current node are evaluated
   * in declared order and the first one holding fires.
   *
   * Fails with {@link Code#UNDECLARED_VARIABLE} if no enclosing scope declares the name and with
   * {@link Code#UNEXPECTED_TYPE} if the value doesn't fit the declared type. If the triggered
   * transition fails, the variable keeps its previous value.
   */
  public TransitionResult setVariable(final String name, final VariableValue value)
      throws StateChartException {
    machineStats.touch();
    final Node declaringNode = findDeclaringNode(name);
    final VariableValue coerced = value.coerceTo(findDeclaration(declaringNode, name).getType());
    final Map<String, VariableValue> scope = bindings.get(declaringNode.getId());
    final VariableValue previous = scope.put(name, coerced);

    final Node from = currentNode;
    final TransitionResult result;
    try {
      final Transition transition = selectByPredicate();
      result = transition == null ? TransitionResult.unchanged(currentState, isTerminated())
          : commit(transition);
    } catch (StateChartException problem) {
      scope.put(name, previous);
      throw problem;
    }
    machineStats.variablesSet++;
    appendLog(LogEntry.variableSetting(name, coerced.toText()));
    if (result.isFired()) {
      appendLog(LogEntry.transition(from.getId(), currentNode.getId()));
    }
    return result;
  }

  private Transition selectByPredicate() throws StateChartException {
    for (final Node node : scope(config.getPredicateScope())) {
      for (final Transition transition : node.getOutTransitions()) {
        if (transition.getGuard().isPredicate()
            && evaluate(transition.getGuard().getPredicate())) {
          logDebug("Predicate selected " + transition);
          return transition;
        }
      }
    }
    return null;
  }

  private boolean evaluate(final PredicateCall call) throws StateChartException {
    final PredicateCall resolved =
        new PredicateCall(call.getName(), resolveParameters(call.getParameters(), currentNode));
    try {
      return predicateEvaluator.evaluate(currentState, resolved);
    } catch (RuntimeException problem) {
      throw new StateChartException(Code.PREDICATE_FAILURE,
          "Predicate " + call.getName() + " failed in " + currentState, problem);
    }
  }

  /**
   * Fires the transition. Everything that can fail without side effects, i.e. target resolution
   * and the default entry chain below the target, is worked out before the first action runs.
   *
   * Order of calls:<br>
   * 1. exit actions from the current node outwards, up to but excluding the nearest common
   * ancestor of current node and target<br>
   * 2. the action of the transition<br>
   * 3. entry actions from below the common ancestor down to the target<br>
   * 4. entry actions of the default entry chain below the target, if it is a composite<br>
   *
   * A target that is the current node or one of its ancestors is exited and entered again.
   */
  private TransitionResult commit(final Transition transition) throws StateChartException {
    final Node source = currentNode;
    final StateId sourceState = currentState;
    try {
      final Node target = stateChart.resolve(transition.getTo());
      final List<Node> defaultEntries = stateChart.defaultEntryChain(target.getId());
      final List<Node> sourcePath = stateChart.pathToRoot(source.getId());
      final List<Node> targetPath = stateChart.pathToRoot(target.getId());
      final Node commonAncestor = nearestCommonAncestor(sourcePath, targetPath, target);

      final List<Node> exits = new ArrayList<>();
      for (final Node node : sourcePath) {
        if (node == commonAncestor) {
          break;
        }
        exits.add(node);
      }
      final List<Node> entries = new ArrayList<>();
      for (final Node node : targetPath) {
        if (node == commonAncestor) {
          break;
        }
        entries.add(node);
      }
      Collections.reverse(entries);
      entries.addAll(defaultEntries);
      final Node leaf = entries.get(entries.size() - 1);
      final StateId nextState = StateId.withNode(id, leaf.getId());

      for (final Node node : exits) {
        runAction(node.getOnExit(), node);
      }
      runAction(transition.getAction(), source);
      for (final Node node : entries) {
        runAction(node.getOnEntry(), node);
      }

      currentNode = leaf;
      currentState = nextState;
      machineStats.transitionsFired++;
      logInfo("Transitioned " + sourceState + "->" + nextState);
      return new TransitionResult(true, sourceState, nextState, isTerminated());
    } catch (StateChartException problem) {
      machineStats.transitionFailures++;
      logError("Failed to fire " + transition + " from " + sourceState, problem);
      throw problem;
    }
  }

  // null stands for "above the root": everything up to and including the root is exited
  private Node nearestCommonAncestor(final List<Node> sourcePath, final List<Node> targetPath,
      final Node target) throws StateChartException {
    for (final Node node : sourcePath) {
      for (final Node candidate : targetPath) {
        if (candidate == node) {
          return node == target ? stateChart.parentOf(target.getId()) : node;
        }
      }
    }
    return null;
  }

  private void runAction(final ActionCall call, final Node node) throws StateChartException {
    if (call == null) {
      return;
    }
    final ActionCall resolved =
        new ActionCall(call.getName(), resolveParameters(call.getParameters(), node));
    final StateId state = StateId.withNode(id, node.getId());
    logDebug("Calling " + resolved + " for " + state);
    try {
      actionExecutor.execute(state, resolved);
    } catch (RuntimeException problem) {
      throw new StateChartException(Code.ACTION_FAILURE,
          "Action " + call.getName() + " failed in " + state, problem);
    }
  }

  /**
   * Parameters named like a variable visible from {@code node} carry the variable's current value.
   */
  private List<Parameter> resolveParameters(final List<Parameter> parameters, final Node node)
      throws StateChartException {
    if (parameters.isEmpty()) {
      return parameters;
    }
    final List<Node> path = stateChart.pathToRoot(node.getId());
    final List<Parameter> resolved = new ArrayList<>(parameters.size());
    for (final Parameter parameter : parameters) {
      Parameter substitute = parameter;
      for (final Node scopeNode : path) {
        final VariableValue bound = bindings.get(scopeNode.getId()).get(parameter.getName());
        if (bound != null) {
          substitute = parameter.withValue(bound);
          break;
        }
      }
      resolved.add(substitute);
    }
    return resolved;
  }

  private Node findDeclaringNode(final String name) throws StateChartException {
    for (final Node node : stateChart.pathToRoot(currentNode.getId())) {
      if (bindings.get(node.getId()).containsKey(name)) {
        return node;
      }
    }
    throw new StateChartException(Code.UNDECLARED_VARIABLE,
        "Variable " + name + " isn't declared in any enclosing scope of " + currentState);
  }

  // the last declaration of a name within a node wins, matching the initial bindings
  private static VariableDeclaration findDeclaration(final Node node, final String name) {
    VariableDeclaration declaration = null;
    for (final VariableDeclaration variable : node.getVariables()) {
      if (variable.getName().equals(name)) {
        declaration = variable;
      }
    }
    return declaration;
  }

  private List<Node> scope(final GuardScope guardScope) throws StateChartException {
    if (guardScope == GuardScope.ACTIVE_PATH) {
      return stateChart.pathToRoot(currentNode.getId());
    }
    return Collections.singletonList(currentNode);
  }

  private void appendLog(final LogEntry entry) {
    try {
      log.append(entry);
    } catch (RuntimeException problem) {
      logWarning("Ignoring failure to append " + entry + " to the state machine log: "
          + problem.getMessage());
    }
  }

  public StateId getId() {
    return id;
  }

  public StateChart getStateChart() {
    return stateChart;
  }

  public StateId getCurrentState() {
    return currentState;
  }

  public NodeId getCurrentNode() {
    return currentNode.getId();
  }

  /**
   * The value of the variable as seen from the current node.
   */
  public VariableValue getVariable(final String name) throws StateChartException {
    return bindings.get(findDeclaringNode(name).getId()).get(name);
  }

  /**
   * All variables visible from the current node, inner declarations hiding outer ones.
   */
  public Map<String, VariableValue> getVisibleVariables() throws StateChartException {
    final List<Node> path = stateChart.pathToRoot(currentNode.getId());
    Collections.reverse(path);
    final Map<String, VariableValue> visible = new LinkedHashMap<>();
    for (final Node node : path) {
      visible.putAll(bindings.get(node.getId()));
    }
    return visible;
  }

  /**
   * The events that would fire a transition in the current state, in scan order.
   */
  public List<String> enabledEvents() throws StateChartException {
    final Set<String> events = new LinkedHashSet<>();
    for (final Node node : scope(config.getEventScope())) {
      for (final Transition transition : node.getOutTransitions()) {
        if (transition.getGuard().isEvent()) {
          events.add(transition.getGuard().getEventId());
        }
      }
    }
    return new ArrayList<>(events);
  }

  /**
   * True once the machine rests in a leaf from where no transition can fire.
   */
  public boolean isTerminated() throws StateChartException {
    if (!currentNode.isLeaf()) {
      return false;
    }
    for (final GuardScope guardScope : GuardScope.values()) {
      if (guardScope == config.getEventScope() || guardScope == config.getPredicateScope()) {
        for (final Node node : scope(guardScope)) {
          if (!node.getOutTransitions().isEmpty()) {
            return false;
          }
        }
      }
    }
    return true;
  }

  public StateMachineLog getLog() {
    return log;
  }

  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  @Override
  public String toString() {
    return "StateMachine [id=" + id + ", stateChart=" + stateChart.getId() + ", currentState="
        + currentState + "]";
  }

  private void logError(final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[m:").append(id).append("] ").append(message)
        .toString(), error);
  }

  private void logWarning(final String message) {
    logger.warn(new StringBuilder().append("[m:").append(id).append("] ").append(message)
        .toString());
  }

  private void logInfo(final String message) {
    logger.info(new StringBuilder().append("[m:").append(id).append("] ").append(message)
        .toString());
  }

  private void logDebug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(id).append("] ").append(message)
          .toString());
    }
  }
}
