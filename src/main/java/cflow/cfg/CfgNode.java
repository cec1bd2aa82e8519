package cflow.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of a {@link ControlFlowGraph}.
 *
 * Adjacency is kept as node ids in insertion order; resolve them through the
 * owning graph. Only the graph mutates a node, and only by adding edges.
 */
public final class CfgNode {
	private final String id;
	private final CfgNodeType type;
	private final String content;
	private final boolean callSite;
	private final List<String> successorIds = new ArrayList<>();
	private final List<String> predecessorIds = new ArrayList<>();

	CfgNode(String id, CfgNodeType type, String content, boolean callSite) {
		this.id = Objects.requireNonNull(id, "id");
		this.type = Objects.requireNonNull(type, "type");
		this.content = Objects.requireNonNull(content, "content");
		this.callSite = callSite;
	}

	public String id() {
		return id;
	}

	public CfgNodeType type() {
		return type;
	}

	public String content() {
		return content;
	}

	/**
	 * True for {@link CfgNodeType#FUNCTION} nodes standing for a call rather than a definition.
	 */
	public boolean isCallSite() {
		return callSite;
	}

	public List<String> successorIds() {
		return Collections.unmodifiableList(successorIds);
	}

	public List<String> predecessorIds() {
		return Collections.unmodifiableList(predecessorIds);
	}

	// both sides are updated by ControlFlowGraph.connect
	boolean addSuccessor(String toId) {
		if (successorIds.contains(toId)) {
			return false;
		}
		successorIds.add(toId);
		return true;
	}

	void addPredecessor(String fromId) {
		if (!predecessorIds.contains(fromId)) {
			predecessorIds.add(fromId);
		}
	}

	@Override
	public String toString() {
		return type + "(" + id + "): " + content;
	}
}
