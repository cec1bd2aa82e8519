package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code target op value;} or, for {@code ++}/{@code --}, {@code target op;} with a {@code null} value.
 */
public record AssignmentStatement(String operator, AstNode target, AstNode value, int line) implements AstNode {
	public AssignmentStatement {
		Objects.requireNonNull(operator, "operator");
		Objects.requireNonNull(target, "target");
	}

	@Override
	public String nodeType() {
		return "AssignmentStatement";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("operator", operator);
	}

	@Override
	public List<AstNode> children() {
		return Nodes.children(target, value);
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitAssignment(this, arg);
	}
}
