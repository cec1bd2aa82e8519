package cflow;

import cflow.ast.c.Program;
import cflow.cfg.CfgGenerator;
import cflow.cfg.ControlFlowGraph;
import cflow.parse.c.CLexer;
import cflow.parse.c.CParser;
import cflow.parse.c.CToken;

import java.util.List;

/**
 * Entry points of the analysis pipeline. Each call works on fresh lexer,
 * parser and generator instances, so these methods may be called from any
 * thread.
 */
public final class CAnalyzer {
	private CAnalyzer() {
	}

	public static List<CToken> tokenize(String source) {
		return new CLexer().lex(source);
	}

	public static Program parse(String source) {
		return new CParser().parse(source);
	}

	/**
	 * @return the control flow graph, or {@code null} when none could be built
	 */
	public static ControlFlowGraph generateCfg(String source) {
		return new CfgGenerator().generateCfg(source);
	}
}
