package cflow.cfg;

import cflow.ast.c.AssignmentStatement;
import cflow.ast.c.AstNode;
import cflow.ast.c.AstVisitor;
import cflow.ast.c.BinaryOp;
import cflow.ast.c.Block;
import cflow.ast.c.Declaration;
import cflow.ast.c.ForStatement;
import cflow.ast.c.Function;
import cflow.ast.c.FunctionCall;
import cflow.ast.c.Identifier;
import cflow.ast.c.IfStatement;
import cflow.ast.c.Literal;
import cflow.ast.c.PreprocessorDirective;
import cflow.ast.c.Program;
import cflow.ast.c.ReturnStatement;
import cflow.ast.c.SourceText;
import cflow.ast.c.WhileStatement;
import cflow.parse.c.CParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lowers a parsed C program into a {@link ControlFlowGraph}.
 *
 * Each lowering step receives the node control arrives from and returns the
 * node control leaves through. The graph under construction is the only
 * mutable state, and it is replaced on every {@link #generateCfg(String)} call.
 */
public final class CfgGenerator {
	private static final Logger logger = LoggerFactory.getLogger(CfgGenerator.class);

	static final String DECISION_CONTENT = "if condition";
	static final String MERGE_CONTENT = "merge";

	private final CParser parser;
	private ControlFlowGraph cfg;

	public CfgGenerator() {
		this(new CParser());
	}

	public CfgGenerator(CParser parser) {
		this.parser = parser;
	}

	/**
	 * @return the graph, or {@code null} if parsing or lowering failed
	 */
	public ControlFlowGraph generateCfg(String source) {
		try {
			return generate(parser.parse(source));
		} catch (RuntimeException | StackOverflowError e) {
			logger.warn("Error generating CFG: {}", e.toString(), e);
			return null;
		} finally {
			cfg = null;
		}
	}

	/**
	 * Lowers an already parsed program. Unlike {@link #generateCfg(String)} this lets failures propagate.
	 */
	public ControlFlowGraph generate(Program program) {
		cfg = new ControlFlowGraph();
		program.accept(new Lowering(), null);
		return cfg;
	}

	private final class Lowering implements AstVisitor<CfgNode, CfgNode> {
		private CfgNode lower(AstNode node, CfgNode cursor) {
			return node == null ? cursor : node.accept(this, cursor);
		}

		private CfgNode link(CfgNode cursor, CfgNode node) {
			if (cursor != null) {
				cfg.connect(cursor, node);
			}
			return node;
		}

		private CfgNode chain(Iterable<AstNode> nodes, CfgNode cursor) {
			CfgNode current = cursor;
			for (AstNode n : nodes) {
				current = lower(n, current);
			}
			return current;
		}

		@Override
		public CfgNode visitProgram(Program node, CfgNode cursor) {
			CfgNode start = cfg.createNode(CfgNodeType.START, null);
			CfgNode last = chain(node.items(), start);
			if (cfg.endNodes().isEmpty()) {
				link(last, cfg.createNode(CfgNodeType.END, null));
			}
			return last;
		}

		@Override
		public CfgNode visitFunction(Function node, CfgNode cursor) {
			CfgNode entry = link(cursor,
					cfg.createNode(CfgNodeType.FUNCTION, node.returnType() + " " + node.name() + "()"));
			return chain(node.children(), entry);
		}

		@Override
		public CfgNode visitDeclaration(Declaration node, CfgNode cursor) {
			return link(cursor, cfg.createNode(CfgNodeType.PROCESS, node.dataType() + " " + node.name()));
		}

		@Override
		public CfgNode visitBlock(Block node, CfgNode cursor) {
			return chain(node.statements(), cursor);
		}

		@Override
		public CfgNode visitIf(IfStatement node, CfgNode cursor) {
			CfgNode decision = link(cursor, cfg.createNode(CfgNodeType.DECISION, DECISION_CONTENT));
			CfgNode thenExit = lower(node.thenBranch(), decision);
			CfgNode elseExit = node.elseBranch() == null ? decision : lower(node.elseBranch(), decision);

			CfgNode merge = cfg.createNode(CfgNodeType.PROCESS, MERGE_CONTENT);
			cfg.connect(thenExit, merge);
			// without an else branch the decision itself is the false exit
			cfg.connect(elseExit, merge);
			return merge;
		}

		@Override
		public CfgNode visitWhile(WhileStatement node, CfgNode cursor) {
			return loop("while (" + SourceText.of(node.condition()) + ")", node.body(), cursor);
		}

		@Override
		public CfgNode visitFor(ForStatement node, CfgNode cursor) {
			return loop("for (" + node.header() + ")", node.body(), cursor);
		}

		// the loop node is the exit: its first successor enters the body, the next one leaves the loop
		private CfgNode loop(String content, AstNode body, CfgNode cursor) {
			CfgNode head = link(cursor, cfg.createNode(CfgNodeType.LOOP, content));
			CfgNode bodyExit = lower(body, head);
			if (bodyExit != head && bodyExit.type() != CfgNodeType.RETURN) {
				cfg.connect(bodyExit, head);
			}
			return head;
		}

		@Override
		public CfgNode visitReturn(ReturnStatement node, CfgNode cursor) {
			CfgNode ret = link(cursor, cfg.createNode(CfgNodeType.RETURN, SourceText.of(node)));
			cfg.connect(ret, cfg.createNode(CfgNodeType.END, null));
			return ret;
		}

		@Override
		public CfgNode visitAssignment(AssignmentStatement node, CfgNode cursor) {
			return link(cursor, cfg.createNode(CfgNodeType.ASSIGNMENT, "assignment " + node.operator()));
		}

		@Override
		public CfgNode visitFunctionCall(FunctionCall node, CfgNode cursor) {
			return link(cursor, cfg.createCallNode(node.functionName()));
		}

		@Override
		public CfgNode visitPreprocessor(PreprocessorDirective node, CfgNode cursor) {
			String content = "#" + node.directive() + " " + (node.content() == null ? "" : node.content());
			return link(cursor, cfg.createNode(CfgNodeType.PROCESS, content.trim()));
		}

		@Override
		public CfgNode visitIdentifier(Identifier node, CfgNode cursor) {
			return generic(node, cursor);
		}

		@Override
		public CfgNode visitLiteral(Literal node, CfgNode cursor) {
			return generic(node, cursor);
		}

		@Override
		public CfgNode visitBinaryOp(BinaryOp node, CfgNode cursor) {
			return generic(node, cursor);
		}

		private CfgNode generic(AstNode node, CfgNode cursor) {
			String content = node.nodeType();
			Map<String, Object> attrs = node.attributes();
			if (!attrs.isEmpty()) {
				content += attrs.entrySet().stream()
						.map(e -> e.getKey() + "=" + e.getValue())
						.collect(Collectors.joining(", ", "(", ")"));
			}
			return link(cursor, cfg.createNode(CfgNodeType.PROCESS, content));
		}
	}
}
