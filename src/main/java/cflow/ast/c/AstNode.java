package cflow.ast.c;

import java.util.List;
import java.util.Map;

/**
 * Node of the C syntax tree.
 *
 * Every variant exposes the same generic view ({@link #nodeType()},
 * {@link #attributes()}, {@link #children()}) for tree walkers such as
 * formatters, and a closed set of visitor callbacks for consumers that must
 * handle each variant explicitly.
 */
public sealed interface AstNode permits Program, Function, Declaration, Block, IfStatement, WhileStatement,
		ForStatement, ReturnStatement, AssignmentStatement, FunctionCall, Identifier, Literal, BinaryOp,
		PreprocessorDirective {
	String nodeType();

	/**
	 * Read-only attributes in declaration order. Values may be {@code null}.
	 */
	Map<String, Object> attributes();

	/**
	 * Owned children, in appearance order.
	 */
	List<AstNode> children();

	int line();

	<R, A> R accept(AstVisitor<R, A> visitor, A arg);
}
