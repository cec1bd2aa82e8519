package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record BinaryOp(String operator, AstNode left, AstNode right, int line) implements AstNode {
	public BinaryOp {
		Objects.requireNonNull(operator, "operator");
		Objects.requireNonNull(left, "left");
		Objects.requireNonNull(right, "right");
	}

	@Override
	public String nodeType() {
		return "BinaryOp";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("operator", operator);
	}

	@Override
	public List<AstNode> children() {
		return List.of(left, right);
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitBinaryOp(this, arg);
	}
}
