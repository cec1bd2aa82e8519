package cflow.parse.c;

import java.util.HashMap;
import java.util.Map;

public enum CTokenKind {
	IDENTIFIER,
	INTEGER_LITERAL,
	FLOAT_LITERAL,
	CHAR_LITERAL,
	STRING_LITERAL,

	// operators
	PLUS,
	MINUS,
	MULTIPLY,
	DIVIDE,
	MODULO,
	ASSIGN,
	PLUS_ASSIGN,
	MINUS_ASSIGN,
	MULTIPLY_ASSIGN,
	DIVIDE_ASSIGN,
	MODULO_ASSIGN,
	INCREMENT,
	DECREMENT,
	EQ,
	NE,
	LT,
	LE,
	GT,
	GE,
	AND,
	OR,
	NOT,
	BITWISE_AND,
	BITWISE_OR,
	BITWISE_XOR,
	BITWISE_NOT,
	LEFT_SHIFT,
	RIGHT_SHIFT,

	// delimiters
	LPAREN,
	RPAREN,
	LBRACE,
	RBRACE,
	LBRACKET,
	RBRACKET,
	SEMICOLON,
	COMMA,
	DOT,
	ARROW,
	QUESTION,
	COLON,

	// preprocessor
	HASH,
	HEADER_FILE,

	COMMENT,
	MULTILINE_COMMENT,

	// reserved words
	AUTO("auto"),
	BREAK("break"),
	CASE("case"),
	CHAR("char"),
	CONST("const"),
	CONTINUE("continue"),
	DEFAULT("default"),
	DO("do"),
	DOUBLE("double"),
	ELSE("else"),
	ENUM("enum"),
	EXTERN("extern"),
	FLOAT("float"),
	FOR("for"),
	GOTO("goto"),
	IF("if"),
	INT("int"),
	LONG("long"),
	REGISTER("register"),
	RETURN("return"),
	SHORT("short"),
	SIGNED("signed"),
	SIZEOF("sizeof"),
	STATIC("static"),
	STRUCT("struct"),
	SWITCH("switch"),
	TYPEDEF("typedef"),
	UNION("union"),
	UNSIGNED("unsigned"),
	VOID("void"),
	VOLATILE("volatile"),
	WHILE("while"),
	INCLUDE("include"),
	DEFINE("define"),
	IFDEF("ifdef"),
	IFNDEF("ifndef"),
	ENDIF("endif"),
	PRINTF("printf"),
	SCANF("scanf");

	private static final Map<String, CTokenKind> RESERVED = new HashMap<>();

	static {
		for (CTokenKind kind : values()) {
			if (kind.word != null) {
				RESERVED.put(kind.word, kind);
			}
		}
	}

	private final String word;

	CTokenKind() {
		this(null);
	}

	CTokenKind(String word) {
		this.word = word;
	}

	/**
	 * Kind for an identifier-shaped lexeme: the matching reserved word, or
	 * {@link #IDENTIFIER}.
	 */
	public static CTokenKind forWord(String lexeme) {
		return RESERVED.getOrDefault(lexeme, IDENTIFIER);
	}

	public boolean isKeyword() {
		return word != null;
	}

	public boolean isComment() {
		return this == COMMENT || this == MULTILINE_COMMENT;
	}
}
