package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Literal constant. {@code literalType} is one of {@code integer}, {@code float}, {@code string} or
 * {@code char}; string and char values keep their quotes.
 */
public record Literal(Object value, String literalType, int line) implements AstNode {
	public Literal {
		Objects.requireNonNull(value, "value");
		Objects.requireNonNull(literalType, "literalType");
	}

	@Override
	public String nodeType() {
		return "Literal";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("value", value, "literal_type", literalType);
	}

	@Override
	public List<AstNode> children() {
		return List.of();
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitLiteral(this, arg);
	}
}
