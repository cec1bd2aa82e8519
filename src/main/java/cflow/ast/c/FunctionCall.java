package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record FunctionCall(String functionName, List<AstNode> arguments, int line) implements AstNode {
	public FunctionCall {
		Objects.requireNonNull(functionName, "functionName");
		arguments = List.copyOf(arguments);
	}

	@Override
	public String nodeType() {
		return "FunctionCall";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("function_name", functionName);
	}

	@Override
	public List<AstNode> children() {
		return arguments;
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitFunctionCall(this, arg);
	}
}
