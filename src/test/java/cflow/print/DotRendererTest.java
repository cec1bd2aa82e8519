package cflow.print;

import cflow.cfg.CfgGenerator;
import cflow.cfg.ControlFlowGraph;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DotRendererTest {
	@Test
	void labelsDecisionBranches() {
		ControlFlowGraph cfg = new CfgGenerator().generateCfg("void f() { if (a) x = 1; }");

		String dot = new DotRenderer().render(cfg);

		assertTrue(dot.startsWith("digraph CFG {\n"));
		assertTrue(dot.contains("\tnode_3 [label=\"if condition\" shape=\"diamond\""));
		assertTrue(dot.contains("\tnode_3 -> node_4 [label=\"True\" color=\"green\"]\n"));
		assertTrue(dot.contains("\tnode_3 -> node_5 [label=\"False\" color=\"red\"]\n"));
		assertTrue(dot.contains("\tnode_4 -> node_5\n"));
		assertTrue(dot.endsWith("}\n"));
	}

	@Test
	void emptyGraphRendersPlaceholder() {
		String expected = "digraph {\n"
				+ "\terror [label=\"No flowchart data available\" shape=\"box\" style=\"filled\" fillcolor=\"lightgray\"]\n"
				+ "}\n";

		assertEquals(expected, new DotRenderer().render(new ControlFlowGraph()));
		assertEquals(expected, new DotRenderer().render(null));
	}

	@Test
	void truncatesAndEscapesLabels() {
		assertEquals("short", DotRenderer.label("short"));
		assertEquals("abcdefghijklmnopqrstuvwxyz0...", DotRenderer.label("abcdefghijklmnopqrstuvwxyz0123456789"));
		assertEquals("say \\\"hi\\\"", DotRenderer.label("say \"hi\""));
	}
}
