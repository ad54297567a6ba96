package com.github.statechart;

import static com.github.statechart.TestValues.array;
import static com.github.statechart.TestValues.call;
import static com.github.statechart.TestValues.node;
import static com.github.statechart.TestValues.object;
import static com.github.statechart.TestValues.transition;
import static com.github.statechart.TestValues.variable;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import com.github.statechart.StateChartException.Code;

/**
 * Tests for building nodes and their parts from the generic value tree.
 */
public class NodeTest {

  @Test
  public void testMinimalNodeDefaults() throws StateChartException {
    final Node node = Node.fromValidatedValue(object("id", "scn:///X"));
    assertEquals(NodeId.of("X"), node.getId());
    assertNull(node.getDescription());
    assertNull(node.getOnEntry());
    assertNull(node.getOnExit());
    assertNull(node.getStartNode());
    assertTrue(node.getOutTransitions().isEmpty());
    assertTrue(node.getVariables().isEmpty());
    assertTrue(node.getNodes().isEmpty());
    assertTrue(node.isLeaf());
  }

  @Test
  public void testMissingId() {
    try {
      Node.fromValidatedValue(object("description", "no id"));
      fail("Expected MANDATORY_ATTRIBUTE_MISSING");
    } catch (StateChartException problem) {
      assertEquals(Code.MANDATORY_ATTRIBUTE_MISSING, problem.getCode());
      assertTrue(problem.getMessage().contains("'id'"));
      assertEquals(1000, problem.toErrorReport().getId());
    }
  }

  @Test
  public void testNotAnObject() {
    try {
      Node.fromValidatedValue(ValidatedValue.ofString("scn:///X"));
      fail("Expected UNEXPECTED_TYPE");
    } catch (StateChartException problem) {
      assertEquals(Code.UNEXPECTED_TYPE, problem.getCode());
    }
  }

  @Test
  public void testFullNode() throws StateChartException {
    final ValidatedValue value = node("Bug", "description", "bug life cycle",
        "on-entry", call("log", "message", "hello"),
        "on-exit", call("log"),
        "start-node", "scn:///Bug/open",
        "out-transitions", array(transition("close", "Bug/closed"),
            transition(call("eq", "a", 1, "b", 1), "Bug/open", call("notify"))),
        "attributes", array(variable("severity", "integer", 1)),
        "nodes", array(node("Bug/open"), node("Bug/closed")));
    final Node node = Node.fromValidatedValue(value);

    assertEquals("bug life cycle", node.getDescription());
    assertEquals(new ActionCall("log",
        Arrays.asList(new Parameter("message", VariableValue.ofString("hello")))),
        node.getOnEntry());
    assertEquals("log", node.getOnExit().getName());
    assertTrue(node.getOnExit().getParameters().isEmpty());
    assertEquals(NodeId.of("Bug/open"), node.getStartNode());
    assertFalse(node.isLeaf());
    assertEquals(2, node.getNodes().size());
    assertEquals(NodeId.of("Bug/closed"), node.getNodes().get(1).getId());

    final Transition close = node.getOutTransitions().get(0);
    assertTrue(close.getGuard().matchesEvent("close"));
    assertNull(close.getAction());
    final Transition guarded = node.getOutTransitions().get(1);
    assertTrue(guarded.getGuard().isPredicate());
    assertEquals("eq", guarded.getGuard().getPredicate().getName());
    assertEquals(2, guarded.getGuard().getPredicate().getParameters().size());
    assertEquals("notify", guarded.getAction().getName());

    final VariableDeclaration severity = node.getVariables().get(0);
    assertEquals("severity", severity.getName());
    assertEquals("integer", severity.getType());
    assertEquals(VariableValue.ofInteger(1L), severity.getValue());

    // the same definition yields an equal node
    assertEquals(node, Node.fromValidatedValue(value));
  }

  @Test
  public void testUnderscoreAliases() throws StateChartException {
    final Node node = Node.fromValidatedValue(node("Bug", "start_node", "scn:///Bug/open",
        "on_entry", call("log"), "out_transitions", array(transition("close", "Bug")),
        "variables", array(variable("owner", "string", null)), "nodes", array(node("Bug/open"))));
    assertEquals(NodeId.of("Bug/open"), node.getStartNode());
    assertEquals("log", node.getOnEntry().getName());
    assertEquals(1, node.getOutTransitions().size());
    assertTrue(node.getVariables().get(0).getValue().isNone());
  }

  @Test
  public void testGuardForms() throws StateChartException {
    assertTrue(Guard.fromValidatedValue(ValidatedValue.ofString("go")).matchesEvent("go"));
    assertTrue(Guard.fromValidatedValue(object("event", "go")).matchesEvent("go"));
    assertFalse(Guard.fromValidatedValue(object("event", "go")).matchesEvent("stop"));
    assertEquals("ready",
        Guard.fromValidatedValue(object("predicate", call("ready"))).getPredicate().getName());
    assertEquals("ready", Guard.fromValidatedValue(call("ready")).getPredicate().getName());
    try {
      Guard.fromValidatedValue(ValidatedValue.ofInteger(1L));
      fail("Expected UNEXPECTED_TYPE");
    } catch (StateChartException problem) {
      assertEquals(Code.UNEXPECTED_TYPE, problem.getCode());
    }
  }

  @Test
  public void testFirstBadChildAborts() {
    try {
      Node.fromValidatedValue(node("Bug", "nodes",
          array(node("Bug/open"), object("description", "no id"), node("Bug/closed"))));
      fail("Expected MANDATORY_ATTRIBUTE_MISSING");
    } catch (StateChartException problem) {
      assertEquals(Code.MANDATORY_ATTRIBUTE_MISSING, problem.getCode());
    }
  }

  @Test
  public void testTransitionNeedsTarget() {
    try {
      Transition.fromValidatedValue(object("guard", "go"));
      fail("Expected MANDATORY_ATTRIBUTE_MISSING");
    } catch (StateChartException problem) {
      assertEquals(Code.MANDATORY_ATTRIBUTE_MISSING, problem.getCode());
      assertTrue(problem.getMessage().contains("'to'"));
    }
  }

  @Test
  public void testVariableValueMustBeScalar() {
    try {
      VariableDeclaration.fromValidatedValue(variable("tags", "string", array("a")));
      fail("Expected UNEXPECTED_TYPE");
    } catch (StateChartException problem) {
      assertEquals(Code.UNEXPECTED_TYPE, problem.getCode());
    }
  }

  @Test
  public void testVariableTypeMustBeKnown() {
    for (final String type : Arrays.asList("float", "none")) {
      try {
        VariableDeclaration.fromValidatedValue(variable("ratio", type, 1.5d));
        fail("Expected UNEXPECTED_TYPE for " + type);
      } catch (StateChartException problem) {
        assertEquals(Code.UNEXPECTED_TYPE, problem.getCode());
      }
    }
  }

  @Test
  public void testInitialValueMustFitType() throws StateChartException {
    try {
      VariableDeclaration.fromValidatedValue(variable("count", "integer", "abc"));
      fail("Expected UNEXPECTED_TYPE");
    } catch (StateChartException problem) {
      assertEquals(Code.UNEXPECTED_TYPE, problem.getCode());
    }
    final VariableDeclaration widened =
        VariableDeclaration.fromValidatedValue(variable("ratio", "number", 1));
    assertEquals(VariableValue.ofNumber(1.0d), widened.getValue());
    final VariableDeclaration unset =
        VariableDeclaration.fromValidatedValue(variable("owner", "string", null));
    assertEquals(VariableValue.none(), unset.getValue());
  }

  @Test
  public void testValueTreeAccessors() throws StateChartException {
    final ValidatedValue list = array("a", 1);
    assertEquals(Arrays.asList(ValidatedValue.ofString("a"), ValidatedValue.ofInteger(1L)),
        list.asArray());
    final ValidatedValue map = object("id", "scn:///X", "nodes", list);
    assertEquals(Arrays.asList("id", "nodes"), new ArrayList<>(map.asObject().keySet()));
    assertEquals(list, map.getMandatory("nodes"));
    assertEquals(map, object("id", "scn:///X", "nodes", array("a", 1)));
    try {
      list.asObject();
      fail("Expected UNEXPECTED_TYPE");
    } catch (StateChartException problem) {
      assertEquals(Code.UNEXPECTED_TYPE, problem.getCode());
    }
    try {
      map.asArray();
      fail("Expected UNEXPECTED_TYPE");
    } catch (StateChartException problem) {
      assertEquals(Code.UNEXPECTED_TYPE, problem.getCode());
    }
  }
}
