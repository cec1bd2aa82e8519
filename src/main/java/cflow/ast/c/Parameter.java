package cflow.ast.c;

import java.util.Objects;

/**
 * Function parameter. {@code name} is {@code null} for unnamed parameters such as {@code int f(void)}.
 */
public record Parameter(String type, String name) {
	public Parameter {
		Objects.requireNonNull(type, "type");
	}
}
