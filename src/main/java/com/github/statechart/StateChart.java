package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StateChartException.Code;

/**
 * A validated state chart: the root node plus a lookup table from node id to node and parent,
 * built once per chart so that transition targets resolve without walking the tree.
 *
 * Validation runs once after construction of the node tree:<br>
 * 1. every node id is a well formed {@link NodeId}<br>
 * 2. node ids are unique within the chart<br>
 * 3. a start node names a direct child of the node declaring it<br>
 * 4. default entry chains are acyclic<br>
 *
 * Transition targets are not checked here. An unresolvable target surfaces when the transition
 * fires.
 */
public final class StateChart {
  private static final Logger logger = LogManager.getLogger(StateChart.class.getSimpleName());

  private final Node root;
  // K=node id, V=node and its parent; insertion order is depth-first pre-order
  private final Map<NodeId, Entry> nodeTable;

  private StateChart(final Node root, final Map<NodeId, Entry> nodeTable) {
    this.root = root;
    this.nodeTable = Collections.unmodifiableMap(nodeTable);
  }

  public static StateChart of(final Node root) throws StateChartException {
    final Map<NodeId, Entry> nodeTable = new LinkedHashMap<>();
    index(root, null, nodeTable);
    for (final Entry entry : nodeTable.values()) {
      checkStartNode(entry.node);
    }
    checkDefaultEntryChains(nodeTable);
    logger.info("Validated state chart " + root.getId() + " with " + nodeTable.size() + " nodes");
    return new StateChart(root, nodeTable);
  }

  public static StateChart fromValidatedValue(final ValidatedValue value)
      throws StateChartException {
    return of(Node.fromValidatedValue(value));
  }

  private static void index(final Node node, final NodeId parent,
      final Map<NodeId, Entry> nodeTable) throws StateChartException {
    node.getId().path();
    if (nodeTable.containsKey(node.getId())) {
      throw new StateChartException(Code.DUPLICATE_NODE_ID,
          "Node id is used more than once: " + node.getId());
    }
    nodeTable.put(node.getId(), new Entry(node, parent));
    for (final Node child : node.getNodes()) {
      index(child, node.getId(), nodeTable);
    }
  }

  private static void checkStartNode(final Node node) throws StateChartException {
    final NodeId startNode = node.getStartNode();
    if (startNode == null) {
      return;
    }
    for (final Node child : node.getNodes()) {
      if (child.getId().equals(startNode)) {
        return;
      }
    }
    throw new StateChartException(Code.INVALID_START_NODE,
        "Start node " + startNode + " isn't a child of " + node.getId());
  }

  // With start nodes restricted to direct children and unique ids, every chain descends the tree
  // and cannot revisit a node. This check keeps defaultEntryChain terminating even if the start
  // node rule is ever relaxed to any descendant.
  private static void checkDefaultEntryChains(final Map<NodeId, Entry> nodeTable)
      throws StateChartException {
    final Set<NodeId> acyclic = new HashSet<>();
    for (final NodeId head : nodeTable.keySet()) {
      final Set<NodeId> visited = new HashSet<>();
      NodeId current = head;
      while (current != null && !acyclic.contains(current)) {
        if (!visited.add(current)) {
          throw new StateChartException(Code.CYCLIC_DEFAULT_ENTRY,
              "Default entry chain starting at " + head + " revisits " + current);
        }
        final Entry entry = nodeTable.get(current);
        current = entry == null ? null : entry.node.getStartNode();
      }
      acyclic.addAll(visited);
    }
  }

  public NodeId getId() {
    return root.getId();
  }

  public Node getRoot() {
    return root;
  }

  public boolean contains(final NodeId nodeId) {
    return nodeTable.containsKey(nodeId);
  }

  /**
   * Null if the chart has no such node.
   */
  public Node find(final NodeId nodeId) {
    final Entry entry = nodeTable.get(nodeId);
    return entry == null ? null : entry.node;
  }

  /**
   * Resolves a transition target.
   */
  public Node resolve(final NodeId nodeId) throws StateChartException {
    final Node node = find(nodeId);
    if (node == null) {
      throw new StateChartException(Code.UNKNOWN_TARGET,
          "Node " + nodeId + " cannot be resolved within state chart " + getId());
    }
    return node;
  }

  /**
   * Null for the root.
   */
  public Node parentOf(final NodeId nodeId) throws StateChartException {
    final NodeId parent = nodeTable.get(resolve(nodeId).getId()).parent;
    return parent == null ? null : find(parent);
  }

  /**
   * The given node followed by all its ancestors, innermost first, ending with the root.
   */
  public List<Node> pathToRoot(final NodeId nodeId) throws StateChartException {
    final List<Node> path = new ArrayList<>();
    Node node = resolve(nodeId);
    while (node != null) {
      path.add(node);
      node = parentOf(node.getId());
    }
    return path;
  }

  /**
   * The nodes entered by default below {@code nodeId}, outermost first, ending with a leaf. Empty
   * when the node is a leaf itself. Fails with {@link Code#NO_ROOT} when a composite on the way
   * has no start node.
   */
  public List<Node> defaultEntryChain(final NodeId nodeId) throws StateChartException {
    final List<Node> chain = new ArrayList<>();
    Node node = resolve(nodeId);
    while (!node.isLeaf()) {
      if (node.getStartNode() == null) {
        throw new StateChartException(Code.NO_ROOT,
            "Composite node " + node.getId() + " has no start node");
      }
      node = resolve(node.getStartNode());
      chain.add(node);
    }
    return chain;
  }

  /**
   * All nodes of the chart in depth-first pre-order.
   */
  public List<Node> nodes() {
    final List<Node> nodes = new ArrayList<>(nodeTable.size());
    for (final Entry entry : nodeTable.values()) {
      nodes.add(entry.node);
    }
    return nodes;
  }

  @Override
  public String toString() {
    return "StateChart [id=" + getId() + ", nodes=" + nodeTable.size() + "]";
  }

  private static final class Entry {
    private final Node node;
    private final NodeId parent;

    private Entry(final Node node, final NodeId parent) {
      this.node = node;
      this.parent = parent;
    }
  }

}
