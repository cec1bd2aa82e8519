package cflow.ast.c;

import java.util.List;
import java.util.Map;

public record ReturnStatement(AstNode value, int line) implements AstNode {
	@Override
	public String nodeType() {
		return "ReturnStatement";
	}

	@Override
	public Map<String, Object> attributes() {
		return Map.of();
	}

	@Override
	public List<AstNode> children() {
		return Nodes.children(value);
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitReturn(this, arg);
	}
}
