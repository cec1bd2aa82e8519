package cflow.print;

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
import cflow.ast.c.Parameter;
import cflow.ast.c.PreprocessorDirective;
import cflow.ast.c.Program;
import cflow.ast.c.ReturnStatement;
import cflow.ast.c.WhileStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a syntax tree as indented text with box-drawing connectors. The tree is only read.
 */
public final class AstFormatter {
	private static final Label LABEL = new Label();

	public String format(AstNode root) {
		if (root == null) {
			return "Empty AST";
		}
		StringBuilder out = new StringBuilder();
		out.append("Abstract Syntax Tree (AST):\n");
		out.append("=".repeat(40)).append("\n\n");
		formatNode(root, "", true, out);
		return out.toString();
	}

	private void formatNode(AstNode node, String prefix, boolean isLast, StringBuilder out) {
		out.append(prefix)
				.append(isLast ? "└── " : "├── ")
				.append(node.accept(LABEL, null))
				.append('\n');

		List<AstNode> children = node.children();
		String childPrefix = prefix + (isLast ? "    " : "│   ");
		for (int k = 0; k < children.size(); k++) {
			formatNode(children.get(k), childPrefix, k == children.size() - 1, out);
		}
	}

	private static final class Label implements AstVisitor<String, Void> {
		@Override
		public String visitProgram(Program node, Void arg) {
			return "Program";
		}

		@Override
		public String visitFunction(Function node, Void arg) {
			String params = node.parameters().stream()
					.map(Label::parameter)
					.collect(Collectors.joining(", "));
			return "Function: " + node.returnType() + " " + node.name() + "(" + params + ")";
		}

		private static String parameter(Parameter p) {
			return p.name() == null ? p.type() : p.type() + " " + p.name();
		}

		@Override
		public String visitDeclaration(Declaration node, Void arg) {
			return "Declaration: " + node.dataType() + " " + node.name() + " (" + node.declType() + ")";
		}

		@Override
		public String visitBlock(Block node, Void arg) {
			return "Block (" + node.statements().size() + " statements)";
		}

		@Override
		public String visitIf(IfStatement node, Void arg) {
			List<String> missing = new ArrayList<>();
			if (node.condition() == null) {
				missing.add("condition");
			}
			if (node.thenBranch() == null) {
				missing.add("then");
			}
			return missing.isEmpty() ? "If Statement" : "If Statement (missing " + String.join(", ", missing) + ")";
		}

		@Override
		public String visitWhile(WhileStatement node, Void arg) {
			return "While Statement";
		}

		@Override
		public String visitFor(ForStatement node, Void arg) {
			return "For Statement: " + node.header();
		}

		@Override
		public String visitReturn(ReturnStatement node, Void arg) {
			return "Return Statement";
		}

		@Override
		public String visitAssignment(AssignmentStatement node, Void arg) {
			return "Assignment: " + node.operator();
		}

		@Override
		public String visitFunctionCall(FunctionCall node, Void arg) {
			return "Function Call: " + node.functionName() + "() (" + node.arguments().size() + " args)";
		}

		@Override
		public String visitIdentifier(Identifier node, Void arg) {
			return "Identifier: " + node.name();
		}

		@Override
		public String visitLiteral(Literal node, Void arg) {
			return "Literal: " + node.value() + " (" + node.literalType() + ")";
		}

		@Override
		public String visitBinaryOp(BinaryOp node, Void arg) {
			return "Binary Operation: " + node.operator();
		}

		@Override
		public String visitPreprocessor(PreprocessorDirective node, Void arg) {
			if (node.content() == null) {
				return "Preprocessor: #" + node.directive();
			}
			return "Preprocessor: #" + node.directive() + " " + node.content();
		}
	}
}
