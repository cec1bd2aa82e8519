package cflow;

import java.util.Objects;

/**
 * A recovered problem found while analysing source text. Diagnostics never
 * abort the pipeline; they only explain a degraded result.
 */
public record Diagnostic(Kind kind, String message, int line) {
	public enum Kind {
		LEXICAL,
		SYNTACTIC
	}

	public Diagnostic {
		Objects.requireNonNull(kind, "kind");
		Objects.requireNonNull(message, "message");
	}

	@Override
	public String toString() {
		return kind + " line " + line + ": " + message;
	}
}
