package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The node is the heart of the state chart definition. A node is either a single state (a leaf) or
 * a state chart of its own (a composite), entered through its start node.
 *
 * Nodes are immutable once built. Construction from the generic value tree is eager and fails on
 * the first problem found; it doesn't check chart semantics like the start node being a child,
 * see {@link StateChart#of(Node)} for that.
 */
public final class Node {
  private final NodeId id;
  private final String description;
  private final ActionCall onEntry;
  private final ActionCall onExit;
  private final NodeId startNode;
  private final List<Transition> outTransitions;
  private final List<VariableDeclaration> variables;
  private final List<Node> nodes;

  private Node(final NodeBuilder builder) {
    this.id = Objects.requireNonNull(builder.id);
    this.description = builder.description;
    this.onEntry = builder.onEntry;
    this.onExit = builder.onExit;
    this.startNode = builder.startNode;
    this.outTransitions = Collections.unmodifiableList(new ArrayList<>(builder.outTransitions));
    this.variables = Collections.unmodifiableList(new ArrayList<>(builder.variables));
    this.nodes = Collections.unmodifiableList(new ArrayList<>(builder.nodes));
  }

  /**
   * Constructs a node, and recursively all its children, from the validated value.
   */
  public static Node fromValidatedValue(final ValidatedValue value) throws StateChartException {
    final NodeBuilder builder = newBuilder(NodeId.fromValidatedValue(value.getMandatory("id")));
    final ValidatedValue description = value.getOptional("description");
    if (description != null) {
      builder.description(description.asString());
    }
    final ValidatedValue onEntry = attribute(value, "on-entry", "on_entry");
    if (onEntry != null) {
      builder.onEntry(ActionCall.fromValidatedValue(onEntry));
    }
    final ValidatedValue onExit = attribute(value, "on-exit", "on_exit");
    if (onExit != null) {
      builder.onExit(ActionCall.fromValidatedValue(onExit));
    }
    final ValidatedValue startNode = attribute(value, "start-node", "start_node");
    if (startNode != null) {
      builder.startNode(NodeId.fromValidatedValue(startNode));
    }
    final ValidatedValue outTransitions = attribute(value, "out-transitions", "out_transitions");
    if (outTransitions != null) {
      for (final ValidatedValue transition : outTransitions.asArray()) {
        builder.outTransition(Transition.fromValidatedValue(transition));
      }
    }
    final ValidatedValue variables = attribute(value, "variables", "attributes");
    if (variables != null) {
      for (final ValidatedValue variable : variables.asArray()) {
        builder.variable(VariableDeclaration.fromValidatedValue(variable));
      }
    }
    final ValidatedValue nodes = value.getOptional("nodes");
    if (nodes != null) {
      for (final ValidatedValue node : nodes.asArray()) {
        builder.node(fromValidatedValue(node));
      }
    }
    return builder.build();
  }

  // the first key present wins
  private static ValidatedValue attribute(final ValidatedValue value, final String key,
      final String alias) throws StateChartException {
    final ValidatedValue attribute = value.getOptional(key);
    return attribute != null ? attribute : value.getOptional(alias);
  }

  public static NodeBuilder newBuilder(final NodeId id) {
    return new NodeBuilder(id);
  }

  public NodeId getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public ActionCall getOnEntry() {
    return onEntry;
  }

  public ActionCall getOnExit() {
    return onExit;
  }

  /**
   * The child entered by default when this node is entered, null if none was declared.
   */
  public NodeId getStartNode() {
    return startNode;
  }

  public List<Transition> getOutTransitions() {
    return outTransitions;
  }

  public List<VariableDeclaration> getVariables() {
    return variables;
  }

  public List<Node> getNodes() {
    return nodes;
  }

  public boolean isLeaf() {
    return nodes.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Node)) {
      return false;
    }
    Node other = (Node) obj;
    return id.equals(other.id) && Objects.equals(description, other.description)
        && Objects.equals(onEntry, other.onEntry) && Objects.equals(onExit, other.onExit)
        && Objects.equals(startNode, other.startNode)
        && outTransitions.equals(other.outTransitions) && variables.equals(other.variables)
        && nodes.equals(other.nodes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, description, onEntry, onExit, startNode, outTransitions, variables,
        nodes);
  }

  @Override
  public String toString() {
    return "Node [id=" + id + ", startNode=" + startNode + ", outTransitions="
        + outTransitions.size() + ", variables=" + variables.size() + ", nodes=" + nodes.size()
        + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build nodes in code.
   */
  public final static class NodeBuilder {
    private final NodeId id;
    private String description;
    private ActionCall onEntry;
    private ActionCall onExit;
    private NodeId startNode;
    private final List<Transition> outTransitions = new ArrayList<>();
    private final List<VariableDeclaration> variables = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();

    private NodeBuilder(final NodeId id) {
      this.id = id;
    }

    public NodeBuilder description(final String description) {
      this.description = description;
      return this;
    }

    public NodeBuilder onEntry(final ActionCall onEntry) {
      this.onEntry = onEntry;
      return this;
    }

    public NodeBuilder onExit(final ActionCall onExit) {
      this.onExit = onExit;
      return this;
    }

    public NodeBuilder startNode(final NodeId startNode) {
      this.startNode = startNode;
      return this;
    }

    public NodeBuilder outTransition(final Transition transition) {
      this.outTransitions.add(transition);
      return this;
    }

    public NodeBuilder variable(final VariableDeclaration variable) {
      this.variables.add(variable);
      return this;
    }

    public NodeBuilder node(final Node node) {
      this.nodes.add(node);
      return this;
    }

    public Node build() {
      return new Node(this);
    }
  }
}
