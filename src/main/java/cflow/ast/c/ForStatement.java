package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code for (header) body}. The header is kept as text, its three clauses are not parsed.
 */
public record ForStatement(String header, AstNode body, int line) implements AstNode {
	public ForStatement {
		Objects.requireNonNull(header, "header");
	}

	@Override
	public String nodeType() {
		return "ForStatement";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("header", header);
	}

	@Override
	public List<AstNode> children() {
		return Nodes.children(body);
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitFor(this, arg);
	}
}
