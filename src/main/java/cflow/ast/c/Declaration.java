package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Variable declaration. Initializers are not kept.
 */
public record Declaration(String declType, String name, String dataType, int line) implements AstNode {
	public Declaration {
		Objects.requireNonNull(name, "name");
	}

	@Override
	public String nodeType() {
		return "Declaration";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("decl_type", declType, "name", name, "data_type", dataType);
	}

	@Override
	public List<AstNode> children() {
		return List.of();
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitDeclaration(this, arg);
	}
}
