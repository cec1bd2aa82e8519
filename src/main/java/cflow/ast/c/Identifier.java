package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Identifier(String name, int line) implements AstNode {
	public Identifier {
		Objects.requireNonNull(name, "name");
	}

	@Override
	public String nodeType() {
		return "Identifier";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("name", name);
	}

	@Override
	public List<AstNode> children() {
		return List.of();
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitIdentifier(this, arg);
	}
}
