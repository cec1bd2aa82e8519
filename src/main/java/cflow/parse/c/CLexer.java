package cflow.parse.c;

import cflow.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Hand-written lexer for the C subset understood by the analyzer.
 *
 * Notes:
 * - Spaces, tabs and carriage returns are skipped; newlines only bump the line counter.
 * - Comments are kept as {@link CTokenKind#COMMENT} / {@link CTokenKind#MULTILINE_COMMENT}
 * tokens; the parser drops them.
 * - Never throws: characters that start no token are reported as diagnostics and skipped.
 * - Not reentrant. Every call to {@link #lex(String)} starts from a clean state.
 */
public final class CLexer {
	private static final Logger logger = LoggerFactory.getLogger(CLexer.class);

	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private String input;
	private int i;
	private int line;

	public List<CToken> lex(String source) {
		input = source == null ? "" : source;
		i = 0;
		line = 1;
		diagnostics.clear();

		List<CToken> tokens = new ArrayList<>();
		while (i < input.length()) {
			char c = input.charAt(i);

			if (c == ' ' || c == '\t' || c == '\r') {
				i++;
				continue;
			}
			if (c == '\n') {
				line++;
				i++;
				continue;
			}

			// <name.h> has to win over '<'
			if (c == '<') {
				int end = headerFileEnd(i);
				if (end > 0) {
					tokens.add(token(CTokenKind.HEADER_FILE, end));
					continue;
				}
			}

			if (isDigit(c)) {
				tokens.add(number());
				continue;
			}

			if (c == '\'' || c == '"') {
				int end = quotedEnd(i, c);
				if (end > 0) {
					tokens.add(token(c == '"' ? CTokenKind.STRING_LITERAL : CTokenKind.CHAR_LITERAL, end));
					continue;
				}
				// unterminated quote: falls through to the illegal character report
			}

			if (isIdentStart(c)) {
				int end = i + 1;
				while (end < input.length() && isIdentPart(input.charAt(end))) {
					end++;
				}
				tokens.add(token(CTokenKind.forWord(input.substring(i, end)), end));
				continue;
			}

			// comments (must be checked before operators)
			if (c == '/' && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (n == '*') {
					int end = input.indexOf("*/", i + 2);
					if (end >= 0) {
						tokens.add(token(CTokenKind.MULTILINE_COMMENT, end + 2));
						continue;
					}
				}
				if (n == '/') {
					int end = input.indexOf('\n', i);
					tokens.add(token(CTokenKind.COMMENT, end < 0 ? input.length() : end));
					continue;
				}
			}

			CTokenKind op = twoCharOperator();
			if (op != null) {
				tokens.add(token(op, i + 2));
				continue;
			}
			op = oneCharOperator(c);
			if (op != null) {
				tokens.add(token(op, i + 1));
				continue;
			}

			String message = "Illegal character '" + c + "' at line " + line;
			logger.warn(message);
			diagnostics.add(new Diagnostic(Diagnostic.Kind.LEXICAL, message, line));
			i++;
		}
		return tokens;
	}

	/**
	 * Diagnostics recorded by the last {@link #lex(String)} call.
	 */
	public List<Diagnostic> diagnostics() {
		return List.copyOf(diagnostics);
	}

	private CToken token(CTokenKind kind, int end) {
		String lexeme = input.substring(i, end);
		CToken t = new CToken(kind, lexeme, lexeme, line, i);
		advanceTo(end);
		return t;
	}

	private void advanceTo(int end) {
		for (int k = i; k < end; k++) {
			if (input.charAt(k) == '\n') {
				line++;
			}
		}
		i = end;
	}

	private CToken number() {
		int start = i;
		int end = digitsEnd(start);
		boolean isFloat = false;

		if (end + 1 < input.length() && input.charAt(end) == '.' && isDigit(input.charAt(end + 1))) {
			end = digitsEnd(end + 1);
			isFloat = true;
			end = exponentEnd(end);
		} else {
			int exp = exponentEnd(end);
			if (exp != end) {
				end = exp;
				isFloat = true;
			}
		}

		if (!isFloat) {
			String lexeme = input.substring(start, end);
			CToken t = new CToken(CTokenKind.INTEGER_LITERAL, lexeme, new BigInteger(lexeme), line, start);
			i = end;
			return t;
		}

		if (end < input.length() && (input.charAt(end) == 'f' || input.charAt(end) == 'F')) {
			end++;
		}
		String lexeme = input.substring(start, end);
		String digits = lexeme.endsWith("f") || lexeme.endsWith("F") ? lexeme.substring(0, lexeme.length() - 1) : lexeme;
		CToken t = new CToken(CTokenKind.FLOAT_LITERAL, lexeme, Double.parseDouble(digits), line, start);
		i = end;
		return t;
	}

	private int digitsEnd(int from) {
		int k = from;
		while (k < input.length() && isDigit(input.charAt(k))) {
			k++;
		}
		return k;
	}

	// [eE][+-]?\d+ starting at from, or from itself when absent/incomplete
	private int exponentEnd(int from) {
		if (from >= input.length() || (input.charAt(from) != 'e' && input.charAt(from) != 'E')) {
			return from;
		}
		int k = from + 1;
		if (k < input.length() && (input.charAt(k) == '+' || input.charAt(k) == '-')) {
			k++;
		}
		if (k >= input.length() || !isDigit(input.charAt(k))) {
			return from;
		}
		return digitsEnd(k);
	}

	private int headerFileEnd(int start) {
		int k = start + 1;
		if (k >= input.length() || !isIdentStart(input.charAt(k))) {
			return -1;
		}
		while (k < input.length() && isIdentPart(input.charAt(k))) {
			k++;
		}
		if (input.startsWith(".h>", k)) {
			return k + 3;
		}
		return -1;
	}

	// end offset (exclusive) of the literal starting at start, or -1 when unterminated
	private int quotedEnd(int start, char quote) {
		int k = start + 1;
		while (k < input.length()) {
			char c = input.charAt(k);
			if (c == '\\') {
				k += 2;
				continue;
			}
			if (c == quote) {
				return k + 1;
			}
			k++;
		}
		return -1;
	}

	private CTokenKind twoCharOperator() {
		if (i + 1 >= input.length()) {
			return null;
		}
		switch (input.substring(i, i + 2)) {
			case "+=":
				return CTokenKind.PLUS_ASSIGN;
			case "-=":
				return CTokenKind.MINUS_ASSIGN;
			case "*=":
				return CTokenKind.MULTIPLY_ASSIGN;
			case "/=":
				return CTokenKind.DIVIDE_ASSIGN;
			case "%=":
				return CTokenKind.MODULO_ASSIGN;
			case "++":
				return CTokenKind.INCREMENT;
			case "--":
				return CTokenKind.DECREMENT;
			case "<<":
				return CTokenKind.LEFT_SHIFT;
			case ">>":
				return CTokenKind.RIGHT_SHIFT;
			case "==":
				return CTokenKind.EQ;
			case "!=":
				return CTokenKind.NE;
			case "<=":
				return CTokenKind.LE;
			case ">=":
				return CTokenKind.GE;
			case "&&":
				return CTokenKind.AND;
			case "||":
				return CTokenKind.OR;
			case "->":
				return CTokenKind.ARROW;
			default:
				return null;
		}
	}

	private static CTokenKind oneCharOperator(char c) {
		switch (c) {
			case '+':
				return CTokenKind.PLUS;
			case '-':
				return CTokenKind.MINUS;
			case '*':
				return CTokenKind.MULTIPLY;
			case '/':
				return CTokenKind.DIVIDE;
			case '%':
				return CTokenKind.MODULO;
			case '=':
				return CTokenKind.ASSIGN;
			case '<':
				return CTokenKind.LT;
			case '>':
				return CTokenKind.GT;
			case '!':
				return CTokenKind.NOT;
			case '&':
				return CTokenKind.BITWISE_AND;
			case '|':
				return CTokenKind.BITWISE_OR;
			case '^':
				return CTokenKind.BITWISE_XOR;
			case '~':
				return CTokenKind.BITWISE_NOT;
			case '?':
				return CTokenKind.QUESTION;
			case ':':
				return CTokenKind.COLON;
			case '(':
				return CTokenKind.LPAREN;
			case ')':
				return CTokenKind.RPAREN;
			case '{':
				return CTokenKind.LBRACE;
			case '}':
				return CTokenKind.RBRACE;
			case '[':
				return CTokenKind.LBRACKET;
			case ']':
				return CTokenKind.RBRACKET;
			case ';':
				return CTokenKind.SEMICOLON;
			case ',':
				return CTokenKind.COMMA;
			case '.':
				return CTokenKind.DOT;
			case '#':
				return CTokenKind.HASH;
			default:
				return null;
		}
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentPart(char c) {
		return isIdentStart(c) || isDigit(c);
	}
}
