package cflow.print;

import cflow.cfg.CfgGenerator;
import cflow.cfg.ControlFlowGraph;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CfgTextRendererTest {
	@Test
	void listsNodesThenEdges() {
		ControlFlowGraph cfg = new CfgGenerator().generateCfg("int main() { return 0; }");

		assertEquals("Control Flow Graph:\n"
				+ "========================================\n"
				+ "\n"
				+ "Nodes:\n"
				+ "--------------------\n"
				+ "node_1: [START] Program Start\n"
				+ "node_2: [FUNCTION] int main()\n"
				+ "node_3: [RETURN] return 0\n"
				+ "node_4: [END] Program End\n"
				+ "\n"
				+ "Edges:\n"
				+ "--------------------\n"
				+ "node_1 -> node_2\n"
				+ "  (Program Start -> int main())\n"
				+ "node_2 -> node_3\n"
				+ "  (int main() -> return 0)\n"
				+ "node_3 -> node_4\n"
				+ "  (return 0 -> Program End)\n", new CfgTextRenderer().render(cfg));
	}

	@Test
	void emptyGraphRendersPlaceholder() {
		assertEquals(CfgTextRenderer.EMPTY, new CfgTextRenderer().render(new ControlFlowGraph()));
		assertEquals(CfgTextRenderer.EMPTY, new CfgTextRenderer().render(null));
	}
}
