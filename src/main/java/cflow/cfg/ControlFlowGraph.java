package cflow.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Control flow graph owning all of its nodes.
 *
 * Nodes are created through the factory methods, get ids {@code node_1},
 * {@code node_2}, ... in creation order and are never removed. Edges are
 * stored on both endpoints, so {@code b} is a successor of {@code a} exactly
 * when {@code a} is a predecessor of {@code b}. A graph may have several END
 * nodes, one per return statement.
 */
public final class ControlFlowGraph {
	public static final String START_CONTENT = "Program Start";
	public static final String END_CONTENT = "Program End";

	private final Map<String, CfgNode> nodes = new LinkedHashMap<>();
	private final List<CfgNode> endNodes = new ArrayList<>();
	private CfgNode startNode;
	private int counter;

	/**
	 * Creates a node. START and END nodes get their fixed content and are
	 * registered as the start node and as an end node respectively.
	 *
	 * @throws IllegalStateException when a second START node is requested
	 */
	public CfgNode createNode(CfgNodeType type, String content) {
		Objects.requireNonNull(type, "type");
		switch (type) {
			case START:
				if (startNode != null) {
					throw new IllegalStateException("graph already has a start node: " + startNode.id());
				}
				startNode = add(type, START_CONTENT, false);
				return startNode;
			case END:
				CfgNode end = add(type, END_CONTENT, false);
				endNodes.add(end);
				return end;
			default:
				return add(type, Objects.requireNonNull(content, "content"), false);
		}
	}

	/**
	 * Creates a FUNCTION node for a call to {@code calleeName}.
	 */
	public CfgNode createCallNode(String calleeName) {
		Objects.requireNonNull(calleeName, "calleeName");
		return add(CfgNodeType.FUNCTION, "Call " + calleeName + "()", true);
	}

	private CfgNode add(CfgNodeType type, String content, boolean callSite) {
		counter++;
		CfgNode node = new CfgNode("node_" + counter, type, content, callSite);
		nodes.put(node.id(), node);
		return node;
	}

	/**
	 * Adds the edge {@code fromId -> toId}. Unknown ids and already present edges are ignored.
	 */
	public void connect(String fromId, String toId) {
		CfgNode from = nodes.get(fromId);
		CfgNode to = nodes.get(toId);
		if (from == null || to == null) {
			return;
		}
		if (from.addSuccessor(toId)) {
			to.addPredecessor(fromId);
		}
	}

	public void connect(CfgNode from, CfgNode to) {
		connect(from.id(), to.id());
	}

	public Optional<CfgNode> findNode(String id) {
		return Optional.ofNullable(nodes.get(id));
	}

	public CfgNode startNode() {
		return startNode;
	}

	public List<CfgNode> endNodes() {
		return Collections.unmodifiableList(endNodes);
	}

	/**
	 * All nodes in creation order.
	 */
	public List<CfgNode> getAllNodes() {
		return List.copyOf(nodes.values());
	}

	/**
	 * All edges, grouped by source node in creation order, then by insertion order.
	 */
	public List<CfgEdge> getEdges() {
		List<CfgEdge> edges = new ArrayList<>();
		for (CfgNode node : nodes.values()) {
			for (String to : node.successorIds()) {
				edges.add(new CfgEdge(node.id(), to));
			}
		}
		return edges;
	}

	public List<CfgNode> successors(CfgNode node) {
		return resolve(node.successorIds());
	}

	public List<CfgNode> predecessors(CfgNode node) {
		return resolve(node.predecessorIds());
	}

	private List<CfgNode> resolve(List<String> ids) {
		List<CfgNode> out = new ArrayList<>(ids.size());
		for (String id : ids) {
			out.add(nodes.get(id));
		}
		return out;
	}

	public int size() {
		return nodes.size();
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}
}
