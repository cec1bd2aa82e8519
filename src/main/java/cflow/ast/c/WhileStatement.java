package cflow.ast.c;

import java.util.List;
import java.util.Map;

public record WhileStatement(AstNode condition, AstNode body, int line) implements AstNode {
	@Override
	public String nodeType() {
		return "WhileStatement";
	}

	@Override
	public Map<String, Object> attributes() {
		return Map.of();
	}

	@Override
	public List<AstNode> children() {
		return Nodes.children(condition, body);
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitWhile(this, arg);
	}
}
