package cflow.ast.c;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code #directive content}, e.g. directive {@code include} with content {@code <stdio.h>}.
 * {@code content} is {@code null} when nothing follows the directive on its line.
 */
public record PreprocessorDirective(String directive, String content, int line) implements AstNode {
	public PreprocessorDirective {
		Objects.requireNonNull(directive, "directive");
	}

	@Override
	public String nodeType() {
		return "PreprocessorDirective";
	}

	@Override
	public Map<String, Object> attributes() {
		return Nodes.attrs("directive", directive, "content", content);
	}

	@Override
	public List<AstNode> children() {
		return List.of();
	}

	@Override
	public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
		return visitor.visitPreprocessor(this, arg);
	}
}
