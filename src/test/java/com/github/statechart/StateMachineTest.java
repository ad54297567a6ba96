package com.github.statechart;

import static com.github.statechart.TestValues.array;
import static com.github.statechart.TestValues.call;
import static com.github.statechart.TestValues.node;
import static com.github.statechart.TestValues.transition;
import static com.github.statechart.TestValues.variable;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.github.statechart.StateChartConfiguration.StateChartConfigurationBuilder;
import com.github.statechart.StateChartException.Code;

/**
 * Tests to maintain the sanity and correctness of StateMachine.
 */
public class StateMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  private final RecordingCalls calls = new RecordingCalls();
  private final InMemoryStateMachineLog log = new InMemoryStateMachineLog(100);

  private static ValidatedValue bugChart() {
    return node("Bug", "start-node", "scn:///Bug/open",
        "on-entry", call("enter-bug"), "on-exit", call("exit-bug"),
        "attributes", array(variable("severity", "integer", 1)),
        "out-transitions", array(transition("cancel", "Bug/closed")),
        "nodes", array(
            node("Bug/open", "on-entry", call("enter-open"), "on-exit", call("exit-open"),
                "out-transitions", array(
                    transition(call("is_severe", "severity", 0), "Bug/fixing"),
                    transition("assign", "Bug/fixing",
                        call("notify", "severity", 0, "note", "assigned")),
                    transition("assign", "Bug/closed"),
                    transition("broken", "Bug/closed", call("explode")),
                    transition("reopen", "Bug/open"))),
            node("Bug/fixing", "start-node", "scn:///Bug/fixing/analysis",
                "on-entry", call("enter-fixing"), "on-exit", call("exit-fixing"),
                "attributes", array(variable("assignee", "string", null)),
                "nodes", array(
                    node("Bug/fixing/analysis", "on-entry", call("enter-analysis"),
                        "on-exit", call("exit-analysis"),
                        "out-transitions", array(
                            transition("done", "Bug/closed"),
                            transition("restart", "Bug/fixing"),
                            transition("lost", "Bug/nowhere"))),
                    node("Bug/fixing/coding"))),
            node("Bug/closed", "on-entry", call("enter-closed"))));
  }

  private StateMachine startMachine(final StateChartConfiguration config)
      throws StateChartException {
    final StateMachine machine = StateMachine.start(StateChart.fromValidatedValue(bugChart()),
        calls, calls, log, config);
    calls.clear();
    return machine;
  }

  private StateMachine startMachine() throws StateChartException {
    return startMachine(StateChartConfiguration.defaults());
  }

  @Test
  public void testStartEntersDefaultChain() throws StateChartException {
    final StateMachine machine = StateMachine.start(StateChart.fromValidatedValue(bugChart()),
        calls, calls, log, StateChartConfiguration.defaults());
    assertEquals(Arrays.asList("enter-bug@Bug", "enter-open@Bug/open"), calls.actions);
    assertEquals("Bug", machine.getId().path());
    assertEquals(NodeId.of("Bug"), machine.getStateChart().getId());
    assertEquals("Bug/open", machine.getCurrentState().path());
    assertTrue(machine.getCurrentState().sameInstance(machine.getId()));
    assertEquals(NodeId.of("Bug/open"), machine.getCurrentNode());
    assertFalse(machine.isTerminated());
    assertTrue(log.entries().isEmpty());
  }

  @Test
  public void testEveryStartMintsNewInstance() throws StateChartException {
    final StateMachine first = startMachine();
    final StateMachine second = startMachine();
    assertFalse(first.getId().equals(second.getId()));
    assertFalse(first.getCurrentState().sameInstance(second.getCurrentState()));
  }

  @Test
  public void testStartWithoutStartNode() throws StateChartException {
    final StateChart chart =
        StateChart.fromValidatedValue(node("Bug", "on-entry", call("enter-bug"),
            "nodes", array(node("Bug/open"))));
    try {
      StateMachine.start(chart, calls, calls, log, StateChartConfiguration.defaults());
      fail("Expected NO_ROOT");
    } catch (StateChartException problem) {
      assertEquals(Code.NO_ROOT, problem.getCode());
    }
    assertTrue(calls.actions.isEmpty());
  }

  @Test
  public void testStartFailsOnFailingEntryAction() throws StateChartException {
    calls.failingAction = "enter-open";
    try {
      startMachine();
      fail("Expected ACTION_FAILURE");
    } catch (StateChartException problem) {
      assertEquals(Code.ACTION_FAILURE, problem.getCode());
      assertTrue(problem.getCause() instanceof IllegalStateException);
    }
  }

  @Test
  public void testSendFiresFirstMatchingTransition() throws StateChartException {
    final StateMachine machine = startMachine();
    final StateId before = machine.getCurrentState();
    final TransitionResult result = machine.send("assign");

    assertTrue(result.isFired());
    assertEquals(before, result.getFrom());
    assertEquals("Bug/fixing/analysis", result.getTo().path());
    assertEquals(result.getTo(), machine.getCurrentState());
    assertFalse(result.isTerminated());
    assertEquals(Arrays.asList("exit-open@Bug/open", "notify@Bug/open", "enter-fixing@Bug/fixing",
        "enter-analysis@Bug/fixing/analysis"), calls.actions);
    // events never evaluate predicates
    assertTrue(calls.predicates.isEmpty());
  }

  @Test
  public void testParametersCarryVariableValues() throws StateChartException {
    final StateMachine machine = startMachine();
    calls.predicateResults.put("is_severe", false);
    machine.setVariable("severity", VariableValue.ofInteger(3L));
    machine.send("assign");

    final ActionCall notify = calls.actionCalls.get(1);
    assertEquals("notify", notify.getName());
    assertEquals(new Parameter("severity", VariableValue.ofInteger(3L)),
        notify.getParameters().get(0));
    assertEquals(new Parameter("note", VariableValue.ofString("assigned")),
        notify.getParameters().get(1));
  }

  @Test
  public void testUnmatchedEventChangesNothing() throws StateChartException {
    final StateMachine machine = startMachine();
    final StateId before = machine.getCurrentState();
    final TransitionResult result = machine.send("unknown");

    assertFalse(result.isFired());
    assertEquals(before, result.getFrom());
    assertEquals(before, result.getTo());
    assertEquals(before, machine.getCurrentState());
    assertTrue(calls.actions.isEmpty());

    final List<LogEntry> entries = log.entries();
    assertEquals(1, entries.size());
    assertEquals(LogEntry.Type.EVENT, entries.get(0).getType());
    assertEquals("unknown", entries.get(0).getName());
  }

  @Test
  public void testEventAndTransitionAreLogged() throws StateChartException {
    final StateMachine machine = startMachine();
    machine.send("assign");
    final List<LogEntry> entries = log.entries();
    assertEquals(2, entries.size());
    assertEquals(LogEntry.Type.EVENT, entries.get(0).getType());
    assertEquals(LogEntry.Type.TRANSITION, entries.get(1).getType());
    assertEquals(NodeId.of("Bug/open"), entries.get(1).getFrom());
    assertEquals(NodeId.of("Bug/fixing/analysis"), entries.get(1).getTo());
    assertTrue(entries.get(0).getTimestampMillis() <= entries.get(1).getTimestampMillis());
  }

  @Test
  public void testSelfTransitionExitsAndReenters() throws StateChartException {
    final StateMachine machine = startMachine();
    final TransitionResult result = machine.send("reopen");
    assertTrue(result.isFired());
    assertEquals(result.getFrom(), result.getTo());
    assertEquals(Arrays.asList("exit-open@Bug/open", "enter-open@Bug/open"), calls.actions);
  }

  @Test
  public void testTransitionToAncestorReentersDefaultChain() throws StateChartException {
    final StateMachine machine = startMachine();
    machine.send("assign");
    calls.clear();
    machine.send("restart");
    assertEquals(Arrays.asList("exit-analysis@Bug/fixing/analysis", "exit-fixing@Bug/fixing",
        "enter-fixing@Bug/fixing", "enter-analysis@Bug/fixing/analysis"), calls.actions);
    assertEquals("Bug/fixing/analysis", machine.getCurrentState().path());
  }

  @Test
  public void testTerminalLeaf() throws StateChartException {
    final StateMachine machine = startMachine();
    machine.send("assign");
    calls.clear();
    final TransitionResult result = machine.send("done");
    assertTrue(result.isFired());
    assertTrue(result.isTerminated());
    assertTrue(machine.isTerminated());
    assertEquals(Arrays.asList("exit-analysis@Bug/fixing/analysis", "exit-fixing@Bug/fixing",
        "enter-closed@Bug/closed"), calls.actions);
    assertTrue(machine.enabledEvents().isEmpty());
    assertFalse(machine.send("assign").isFired());
  }

  @Test
  public void testFailingActionLeavesStateUnchanged() throws StateChartException {
    final StateMachine machine = startMachine();
    final StateId before = machine.getCurrentState();
    calls.failingAction = "explode";
    try {
      machine.send("broken");
      fail("Expected ACTION_FAILURE");
    } catch (StateChartException problem) {
      assertEquals(Code.ACTION_FAILURE, problem.getCode());
    }
    assertEquals(before, machine.getCurrentState());
    assertEquals(1, machine.getStatistics().getTransitionFailures());
    assertEquals(0, machine.getStatistics().getTransitionsFired());
    // the machine keeps working afterwards
    calls.failingAction = null;
    assertTrue(machine.send("assign").isFired());
  }

  @Test
  public void testUnknownTargetRunsNoAction() throws StateChartException {
    final StateMachine machine = startMachine();
    machine.send("assign");
    final StateId before = machine.getCurrentState();
    calls.clear();
    try {
      machine.send("lost");
      fail("Expected UNKNOWN_TARGET");
    } catch (StateChartException problem) {
      assertEquals(Code.UNKNOWN_TARGET, problem.getCode());
    }
    assertEquals(before, machine.getCurrentState());
    assertTrue(calls.actions.isEmpty());
  }

  @Test
  public void testSetVariableFiresPredicateTransition() throws StateChartException {
    final StateMachine machine = startMachine();
    calls.predicateResults.put("is_severe", true);
    final TransitionResult result = machine.setVariable("severity", VariableValue.ofInteger(5L));

    assertTrue(result.isFired());
    assertEquals("Bug/fixing/analysis", machine.getCurrentState().path());
    assertEquals(Arrays.asList("is_severe@Bug/open"), calls.predicates);
    assertEquals(VariableValue.ofInteger(5L), machine.getVariable("severity"));

    final List<LogEntry> entries = log.entries();
    assertEquals(2, entries.size());
    assertEquals(LogEntry.Type.VARIABLE_SETTING, entries.get(0).getType());
    assertEquals("severity", entries.get(0).getName());
    assertEquals("5", entries.get(0).getValue());
    assertEquals(LogEntry.Type.TRANSITION, entries.get(1).getType());
  }

  @Test
  public void testSetVariableWithoutTransition() throws StateChartException {
    final StateMachine machine = startMachine();
    final StateId before = machine.getCurrentState();
    calls.predicateResults.put("is_severe", false);
    final TransitionResult result = machine.setVariable("severity", VariableValue.ofInteger(2L));

    assertFalse(result.isFired());
    assertEquals(before, machine.getCurrentState());
    assertEquals(VariableValue.ofInteger(2L), machine.getVariable("severity"));
    assertEquals(1, log.entries().size());
    assertEquals(1, machine.getStatistics().getVariablesSet());
  }

  @Test
  public void testUndeclaredVariable() throws StateChartException {
    final StateMachine machine = startMachine();
    final StateId before = machine.getCurrentState();
    try {
      // declared by Bug/fixing, which isn't active
      machine.setVariable("assignee", VariableValue.ofString("ann"));
      fail("Expected UNDECLARED_VARIABLE");
    } catch (StateChartException problem) {
      assertEquals(Code.UNDECLARED_VARIABLE, problem.getCode());
    }
    assertEquals(before, machine.getCurrentState());
    assertEquals(VariableValue.ofInteger(1L), machine.getVariable("severity"));
    assertTrue(log.entries().isEmpty());
    assertTrue(calls.predicates.isEmpty());
  }

  @Test
  public void testVariableOfWrongType() throws StateChartException {
    final StateMachine machine = startMachine();
    try {
      machine.setVariable("severity", VariableValue.ofString("high"));
      fail("Expected UNEXPECTED_TYPE");
    } catch (StateChartException problem) {
      assertEquals(Code.UNEXPECTED_TYPE, problem.getCode());
    }
    assertEquals(VariableValue.ofInteger(1L), machine.getVariable("severity"));
  }

  @Test
  public void testFailingPredicateRestoresVariable() throws StateChartException {
    final StateMachine machine = startMachine();
    final StateId before = machine.getCurrentState();
    try {
      machine.setVariable("severity", VariableValue.ofInteger(9L));
      fail("Expected PREDICATE_FAILURE");
    } catch (StateChartException problem) {
      assertEquals(Code.PREDICATE_FAILURE, problem.getCode());
    }
    assertEquals(before, machine.getCurrentState());
    assertEquals(VariableValue.ofInteger(1L), machine.getVariable("severity"));
    assertTrue(log.entries().isEmpty());
  }

  @Test
  public void testVisibleVariables() throws StateChartException {
    final StateMachine machine = startMachine();
    assertEquals(Collections.singletonList("severity"),
        new ArrayList<>(machine.getVisibleVariables().keySet()));
    machine.send("assign");
    machine.setVariable("assignee", VariableValue.ofString("ann"));
    final Map<String, VariableValue> visible = machine.getVisibleVariables();
    assertEquals(Arrays.asList("severity", "assignee"), new ArrayList<>(visible.keySet()));
    assertEquals(VariableValue.ofString("ann"), visible.get("assignee"));
  }

  @Test
  public void testEnabledEvents() throws StateChartException {
    final StateMachine machine = startMachine();
    assertEquals(Arrays.asList("assign", "broken", "reopen"), machine.enabledEvents());
  }

  @Test
  public void testActivePathScope() throws StateChartException {
    final StateChartConfiguration config = StateChartConfigurationBuilder.newBuilder()
        .eventScope(GuardScope.ACTIVE_PATH).build();
    final StateMachine machine = startMachine(config);
    assertEquals(Arrays.asList("assign", "broken", "reopen", "cancel"), machine.enabledEvents());

    final TransitionResult result = machine.send("cancel");
    assertTrue(result.isFired());
    assertEquals("Bug/closed", machine.getCurrentState().path());
    assertEquals(Arrays.asList("exit-open@Bug/open", "enter-closed@Bug/closed"), calls.actions);
    // the root transition stays reachable from the leaf
    assertFalse(machine.isTerminated());
  }

  @Test
  public void testActiveNodeScopeIgnoresAncestors() throws StateChartException {
    final StateMachine machine = startMachine();
    assertFalse(machine.send("cancel").isFired());
    assertEquals("Bug/open", machine.getCurrentState().path());
  }

  @Test
  public void testLogFailuresAreIgnored() throws StateChartException {
    final StateMachineLog brokenLog = new StateMachineLog() {
      @Override
      public void append(final LogEntry entry) {
        throw new IllegalStateException("log is gone");
      }

      @Override
      public List<LogEntry> entries() {
        return Collections.emptyList();
      }
    };
    final StateMachine machine = StateMachine.start(StateChart.fromValidatedValue(bugChart()),
        calls, calls, brokenLog, StateChartConfiguration.defaults());
    assertTrue(machine.send("assign").isFired());
    assertEquals("Bug/fixing/analysis", machine.getCurrentState().path());
  }

  @Test
  public void testStatistics() throws StateChartException {
    final StateMachine machine = startMachine();
    calls.predicateResults.put("is_severe", false);
    machine.send("nothing");
    machine.setVariable("severity", VariableValue.ofInteger(2L));
    machine.send("assign");
    final StateMachineStatistics stats = machine.getStatistics();
    assertEquals(machine.getId(), stats.getMachineId());
    assertEquals(2, stats.getEventsReceived());
    assertEquals(1, stats.getVariablesSet());
    assertEquals(1, stats.getTransitionsFired());
    assertEquals(0, stats.getTransitionFailures());
    assertTrue(stats.getLastTouchTimeMillis() >= stats.getStartTimeMillis());
  }
}
