package cflow.print;

import cflow.cfg.CfgEdge;
import cflow.cfg.CfgNode;
import cflow.cfg.ControlFlowGraph;

/**
 * Plain text listing of a graph's nodes and edges.
 */
public final class CfgTextRenderer {
	public static final String EMPTY = "No flowchart data available.";

	public String render(ControlFlowGraph cfg) {
		if (cfg == null || cfg.isEmpty()) {
			return EMPTY;
		}

		StringBuilder out = new StringBuilder();
		out.append("Control Flow Graph:\n");
		out.append("=".repeat(40)).append("\n\n");

		out.append("Nodes:\n");
		out.append("-".repeat(20)).append('\n');
		for (CfgNode node : cfg.getAllNodes()) {
			out.append(node.id()).append(": [").append(node.type()).append("] ").append(node.content()).append('\n');
		}

		out.append("\nEdges:\n");
		out.append("-".repeat(20)).append('\n');
		for (CfgEdge edge : cfg.getEdges()) {
			String from = cfg.findNode(edge.fromId()).map(CfgNode::content).orElse("?");
			String to = cfg.findNode(edge.toId()).map(CfgNode::content).orElse("?");
			out.append(edge.fromId()).append(" -> ").append(edge.toId()).append('\n');
			out.append("  (").append(from).append(" -> ").append(to).append(")\n");
		}
		return out.toString();
	}
}
