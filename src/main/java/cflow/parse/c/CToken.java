package cflow.parse.c;

import java.util.Objects;

/**
 * A lexical unit.
 *
 * {@code value} is a {@link java.math.BigInteger} for integer literals, a
 * {@link Double} for float literals and the lexeme itself otherwise.
 * {@code line} is 1-based, {@code position} a 0-based character offset.
 */
public record CToken(CTokenKind kind, String lexeme, Object value, int line, int position) {
	public CToken {
		Objects.requireNonNull(kind, "kind");
		Objects.requireNonNull(lexeme, "lexeme");
		Objects.requireNonNull(value, "value");
	}

	public boolean is(CTokenKind k) {
		return kind == k;
	}

	@Override
	public String toString() {
		return kind + "(" + lexeme + ")@" + line + ":" + position;
	}
}
