package cflow.ast.c;

import java.util.stream.Collectors;

/**
 * Renders a node back to compact C-like text, e.g. {@code x > 0} or {@code printf()}.
 * Statements render as a short summary rather than full source.
 */
public final class SourceText implements AstVisitor<String, Void> {
	private static final SourceText INSTANCE = new SourceText();

	private SourceText() {
	}

	public static String of(AstNode node) {
		return node == null ? "" : node.accept(INSTANCE, null);
	}

	@Override
	public String visitProgram(Program node, Void arg) {
		return "program";
	}

	@Override
	public String visitFunction(Function node, Void arg) {
		return node.returnType() + " " + node.name() + "()";
	}

	@Override
	public String visitDeclaration(Declaration node, Void arg) {
		return node.dataType() + " " + node.name();
	}

	@Override
	public String visitBlock(Block node, Void arg) {
		return "{ ... }";
	}

	@Override
	public String visitIf(IfStatement node, Void arg) {
		return "if (" + of(node.condition()) + ")";
	}

	@Override
	public String visitWhile(WhileStatement node, Void arg) {
		return "while (" + of(node.condition()) + ")";
	}

	@Override
	public String visitFor(ForStatement node, Void arg) {
		return "for (" + node.header() + ")";
	}

	@Override
	public String visitReturn(ReturnStatement node, Void arg) {
		return node.value() == null ? "return" : "return " + of(node.value());
	}

	@Override
	public String visitAssignment(AssignmentStatement node, Void arg) {
		if (node.value() == null) {
			return of(node.target()) + node.operator();
		}
		return of(node.target()) + " " + node.operator() + " " + of(node.value());
	}

	@Override
	public String visitFunctionCall(FunctionCall node, Void arg) {
		return node.functionName() + "(" + node.arguments().stream().map(SourceText::of)
				.collect(Collectors.joining(", ")) + ")";
	}

	@Override
	public String visitIdentifier(Identifier node, Void arg) {
		return node.name();
	}

	@Override
	public String visitLiteral(Literal node, Void arg) {
		return String.valueOf(node.value());
	}

	@Override
	public String visitBinaryOp(BinaryOp node, Void arg) {
		return of(node.left()) + " " + node.operator() + " " + of(node.right());
	}

	@Override
	public String visitPreprocessor(PreprocessorDirective node, Void arg) {
		return node.content() == null ? "#" + node.directive() : "#" + node.directive() + " " + node.content();
	}
}
