package cflow.ast.c;

import java.util.List;
import java.util.Map;

public record Block(List<AstNode> statements, int line) implements AstNode {
	public Block {
		statements = List.copyOf(statements);
	}

	@Override
	public String nodeType() {
		return "Block";
	}

	@Override
	public Map<String, Object> attributes() {
		return Map.of();
	}

	@Override
	public List<AstNode> children() {
		return statements;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitBlock(this, arg);
	}
}
