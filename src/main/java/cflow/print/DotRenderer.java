package cflow.print;

import cflow.cfg.CfgEdge;
import cflow.cfg.CfgNode;
import cflow.cfg.CfgNodeType;
import cflow.cfg.ControlFlowGraph;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Graphviz DOT source for a control flow graph.
 *
 * Decision nodes with exactly two successors get their edges labelled: the
 * first successor is the {@code True} branch, the second the {@code False} one.
 */
public final class DotRenderer {
	private static final int MAX_LABEL = 30;

	private static final Map<CfgNodeType, String> STYLES = new EnumMap<>(CfgNodeType.class);

	static {
		STYLES.put(CfgNodeType.START, "shape=\"ellipse\" style=\"filled\" fillcolor=\"lightgreen\" fontweight=\"bold\"");
		STYLES.put(CfgNodeType.END, "shape=\"ellipse\" style=\"filled\" fillcolor=\"lightcoral\" fontweight=\"bold\"");
		STYLES.put(CfgNodeType.PROCESS, "shape=\"box\" style=\"filled\" fillcolor=\"lightblue\"");
		STYLES.put(CfgNodeType.DECISION, "shape=\"diamond\" style=\"filled\" fillcolor=\"lightyellow\"");
		STYLES.put(CfgNodeType.FUNCTION, "shape=\"box\" style=\"filled,rounded\" fillcolor=\"lightpink\"");
		STYLES.put(CfgNodeType.RETURN, "shape=\"box\" style=\"filled\" fillcolor=\"orange\"");
		STYLES.put(CfgNodeType.LOOP, "shape=\"hexagon\" style=\"filled\" fillcolor=\"lightcyan\"");
		STYLES.put(CfgNodeType.ASSIGNMENT, "shape=\"parallelogram\" style=\"filled\" fillcolor=\"wheat\"");
	}

	public String render(ControlFlowGraph cfg) {
		if (cfg == null || cfg.isEmpty()) {
			return "digraph {\n"
					+ "\terror [label=\"No flowchart data available\" shape=\"box\" style=\"filled\" fillcolor=\"lightgray\"]\n"
					+ "}\n";
		}

		StringBuilder out = new StringBuilder();
		out.append("digraph CFG {\n");
		out.append("\t// Control Flow Graph\n");
		out.append("\trankdir=TB\n");
		out.append("\tnode [fontname=\"Arial\" fontsize=\"10\"]\n");
		out.append("\tedge [fontname=\"Arial\" fontsize=\"8\"]\n");

		for (CfgNode node : cfg.getAllNodes()) {
			out.append('\t').append(node.id())
					.append(" [label=\"").append(label(node.content())).append("\" ")
					.append(STYLES.get(node.type()))
					.append("]\n");
		}

		for (CfgEdge edge : cfg.getEdges()) {
			out.append('\t').append(edge.fromId()).append(" -> ").append(edge.toId());
			CfgNode from = cfg.findNode(edge.fromId()).orElseThrow();
			List<String> successors = from.successorIds();
			if (from.type() == CfgNodeType.DECISION && successors.size() == 2) {
				out.append(successors.get(0).equals(edge.toId())
						? " [label=\"True\" color=\"green\"]"
						: " [label=\"False\" color=\"red\"]");
			}
			out.append('\n');
		}
		return out.append("}\n").toString();
	}

	static String label(String content) {
		String text = content.length() > MAX_LABEL ? content.substring(0, MAX_LABEL - 3) + "..." : content;
		return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
	}
}
