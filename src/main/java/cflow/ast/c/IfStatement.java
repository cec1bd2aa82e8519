package cflow.ast.c;

import java.util.List;
import java.util.Map;

/**
 * {@code if (condition) thenBranch [else elseBranch]}. Any part may be {@code null} when it did not parse.
 */
public record IfStatement(AstNode condition, AstNode thenBranch, AstNode elseBranch, int line) implements AstNode {
	@Override
	public String nodeType() {
		return "IfStatement";
	}

	@Override
	public Map<String, Object> attributes() {
		return Map.of();
	}

	/**
	 * Present parts only, so positions shift when a part is missing; read the record fields to tell them apart.
	 */
	@Override
	public List<AstNode> children() {
		return Nodes.children(condition, thenBranch, elseBranch);
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitIf(this, arg);
	}
}
