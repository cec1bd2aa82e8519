package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Function definition. {@code body} is {@code null} when no block followed the parameter list.
 */
public record Function(String name, String returnType, List<Parameter> parameters, Block body, int line)
		implements AstNode {
	public Function {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(returnType, "returnType");
		parameters = List.copyOf(parameters);
	}

	@Override
	public String nodeType() {
		return "Function";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("name", name, "return_type", returnType);
	}

	@Override
	public List<AstNode> children() {
		return Nodes.children(body);
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitFunction(this, arg);
	}
}
