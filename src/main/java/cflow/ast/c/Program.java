package cflow.ast.c;

import java.util.List;
import java.util.Map;

/**
 * Root of a parsed translation unit. An empty source yields an empty program.
 */
public record Program(List<AstNode> items) implements AstNode {
	public Program {
		items = List.copyOf(items);
	}

	@Override
	public String nodeType() {
		return "Program";
	}

	@Override
	public Map<String, Object> attributes() {
		return Map.of();
	}

	@Override
	public List<AstNode> children() {
		return items;
	}

	@Override
	public int line() {
		return 0;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitProgram(this, arg);
	}
}
