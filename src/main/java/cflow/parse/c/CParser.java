package cflow.parse.c;

import cflow.Diagnostic;
import cflow.ast.c.AssignmentStatement;
import cflow.ast.c.AstNode;
import cflow.ast.c.BinaryOp;
import cflow.ast.c.Block;
import cflow.ast.c.Declaration;
import cflow.ast.c.ForStatement;
import cflow.ast.c.Function;
import cflow.ast.c.FunctionCall;
import cflow.ast.c.Identifier;
import cflow.ast.c.IfStatement;
import cflow.ast.c.Literal;
import cflow.ast.c.Parameter;
import cflow.ast.c.PreprocessorDirective;
import cflow.ast.c.Program;
import cflow.ast.c.ReturnStatement;
import cflow.ast.c.WhileStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Best-effort recursive-descent parser for a small C subset.
 *
 * Never fails: tokens that fit no rule are skipped and reported through
 * {@link #diagnostics()}. Binary expressions are folded left-to-right (no
 * precedence). Declaration initializers and call arguments are skipped, not
 * parsed.
 *
 * Not reentrant. Every call to {@link #parse(String)} starts from a clean state.
 */
public final class CParser {
	private static final Logger logger = LoggerFactory.getLogger(CParser.class);

	public static final int DEFAULT_MAX_DEPTH = 200;

	private static final Set<CTokenKind> TYPES = Set.of(
			CTokenKind.INT, CTokenKind.FLOAT, CTokenKind.DOUBLE, CTokenKind.CHAR, CTokenKind.VOID);

	private static final Set<CTokenKind> DIRECTIVES = Set.of(
			CTokenKind.INCLUDE, CTokenKind.DEFINE, CTokenKind.IFDEF, CTokenKind.IFNDEF, CTokenKind.ENDIF);

	private static final Set<CTokenKind> BINARY_OPS = Set.of(
			CTokenKind.PLUS, CTokenKind.MINUS, CTokenKind.MULTIPLY, CTokenKind.DIVIDE, CTokenKind.MODULO,
			CTokenKind.EQ, CTokenKind.NE, CTokenKind.LT, CTokenKind.LE, CTokenKind.GT, CTokenKind.GE,
			CTokenKind.AND, CTokenKind.OR, CTokenKind.BITWISE_AND, CTokenKind.BITWISE_OR, CTokenKind.BITWISE_XOR,
			CTokenKind.LEFT_SHIFT, CTokenKind.RIGHT_SHIFT);

	private static final Set<CTokenKind> ASSIGN_OPS = Set.of(
			CTokenKind.ASSIGN, CTokenKind.PLUS_ASSIGN, CTokenKind.MINUS_ASSIGN, CTokenKind.MULTIPLY_ASSIGN,
			CTokenKind.DIVIDE_ASSIGN, CTokenKind.MODULO_ASSIGN);

	// callee names: printf and scanf lex as pseudo-keywords
	private static final Set<CTokenKind> CALLABLES = Set.of(
			CTokenKind.IDENTIFIER, CTokenKind.PRINTF, CTokenKind.SCANF);

	private static final Map<CTokenKind, String> LITERAL_TYPES = Map.of(
			CTokenKind.INTEGER_LITERAL, "integer",
			CTokenKind.FLOAT_LITERAL, "float",
			CTokenKind.STRING_LITERAL, "string",
			CTokenKind.CHAR_LITERAL, "char");

	private final int maxDepth;
	private final CLexer lexer = new CLexer();
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private Cursor c;
	private int depth;

	public CParser() {
		this(DEFAULT_MAX_DEPTH);
	}

	public CParser(int maxDepth) {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive but was " + maxDepth);
		}
		this.maxDepth = maxDepth;
	}

	public Program parse(String source) {
		diagnostics.clear();
		depth = 0;

		List<CToken> tokens = new ArrayList<>();
		for (CToken t : lexer.lex(source)) {
			if (!t.kind().isComment()) {
				tokens.add(t);
			}
		}
		diagnostics.addAll(lexer.diagnostics());
		c = new Cursor(tokens);

		List<AstNode> items = new ArrayList<>();
		while (!c.isAtEnd()) {
			if (c.peekIs(CTokenKind.HASH)) {
				addIfPresent(items, parsePreprocessor());
				continue;
			}
			if (isFunctionDefinition()) {
				addIfPresent(items, parseFunction());
				continue;
			}
			if (isType()) {
				addIfPresent(items, parseDeclaration());
				continue;
			}

			// skip unexpected tokens
			skip("unexpected token at top level");
		}
		return new Program(items);
	}

	/**
	 * Lexical and syntactic diagnostics recorded by the last {@link #parse(String)} call.
	 */
	public List<Diagnostic> diagnostics() {
		return List.copyOf(diagnostics);
	}

	private static void addIfPresent(List<AstNode> list, AstNode node) {
		if (node != null) {
			list.add(node);
		}
	}

	private PreprocessorDirective parsePreprocessor() {
		CToken hash = c.next();
		if (c.isAtEnd() || !DIRECTIVES.contains(c.peek().kind())) {
			report("unsupported preprocessor directive", hash.line());
			return null;
		}
		CToken directive = c.next();

		// the directive runs to the end of its line
		StringBuilder content = new StringBuilder();
		while (!c.isAtEnd() && c.peek().line() == directive.line()) {
			if (content.length() > 0) {
				content.append(' ');
			}
			content.append(c.next().lexeme());
		}
		return new PreprocessorDirective(directive.lexeme(), content.length() == 0 ? null : content.toString(),
				hash.line());
	}

	/**
	 * Bounded lookahead: a type keyword, an identifier within the next two
	 * tokens followed by {@code (}, a balanced parameter list, then {@code {}.
	 */
	private boolean isFunctionDefinition() {
		if (!isType()) {
			return false;
		}

		for (int i = 1; i < 3 && c.peek(i) != null; i++) {
			if (!c.peek(i).is(CTokenKind.IDENTIFIER)) {
				continue;
			}
			CToken next = c.peek(i + 1);
			if (next == null || !next.is(CTokenKind.LPAREN)) {
				return false;
			}
			int j = i + 2;
			int parens = 1;
			while (parens > 0 && c.peek(j) != null) {
				CToken t = c.peek(j);
				if (t.is(CTokenKind.LPAREN)) {
					parens++;
				} else if (t.is(CTokenKind.RPAREN)) {
					parens--;
				}
				j++;
			}
			CToken brace = c.peek(j);
			return parens == 0 && brace != null && brace.is(CTokenKind.LBRACE);
		}
		return false;
	}

	private boolean isType() {
		return !c.isAtEnd() && TYPES.contains(c.peek().kind());
	}

	private Function parseFunction() {
		CToken returnType = c.next();
		if (!c.peekIs(CTokenKind.IDENTIFIER)) {
			report("expected function name after '" + returnType.lexeme() + "'", returnType.line());
			return null;
		}
		String name = c.next().lexeme();
		if (!c.consume(CTokenKind.LPAREN)) {
			report("expected '(' after function name " + name, returnType.line());
			return null;
		}

		List<Parameter> params = new ArrayList<>();
		while (!c.isAtEnd() && !c.peekIs(CTokenKind.RPAREN)) {
			if (isType()) {
				String type = c.next().lexeme();
				String paramName = c.peekIs(CTokenKind.IDENTIFIER) ? c.next().lexeme() : null;
				params.add(new Parameter(type, paramName));
				continue;
			}
			if (c.peekIs(CTokenKind.COMMA)) {
				c.next();
				continue;
			}
			skip("unexpected token in parameter list of " + name);
		}
		if (!c.consume(CTokenKind.RPAREN)) {
			report("unterminated parameter list of " + name, returnType.line());
			return null;
		}

		Block body = c.peekIs(CTokenKind.LBRACE) ? parseBlock() : null;
		return new Function(name, returnType.lexeme(), params, body, returnType.line());
	}

	private Declaration parseDeclaration() {
		CToken type = c.next();
		if (!c.peekIs(CTokenKind.IDENTIFIER)) {
			report("expected a name after '" + type.lexeme() + "'", type.line());
			return null;
		}
		String name = c.next().lexeme();

		// initializer is skipped
		if (c.consume(CTokenKind.ASSIGN)) {
			while (!c.isAtEnd() && !c.peekIs(CTokenKind.SEMICOLON)) {
				c.next();
			}
		}
		c.consume(CTokenKind.SEMICOLON);
		return new Declaration("variable", name, type.lexeme(), type.line());
	}

	private Block parseBlock() {
		CToken open = c.next();
		List<AstNode> stmts = new ArrayList<>();
		while (!c.isAtEnd() && !c.peekIs(CTokenKind.RBRACE)) {
			int before = c.position();
			AstNode stmt = parseStatement();
			if (stmt != null) {
				stmts.add(stmt);
				continue;
			}
			if (c.position() == before && !c.peekIs(CTokenKind.RBRACE)) {
				skip("unparsable statement");
			}
		}
		if (!c.consume(CTokenKind.RBRACE)) {
			report("block opened here is never closed", open.line());
		}
		return new Block(stmts, open.line());
	}

	private AstNode parseStatement() {
		if (c.isAtEnd()) {
			return null;
		}
		if (depth >= maxDepth) {
			report("nesting deeper than " + maxDepth, c.peek().line());
			skipTo(CTokenKind.SEMICOLON);
			return null;
		}
		depth++;
		try {
			return parseStatementInner();
		} finally {
			depth--;
		}
	}

	private AstNode parseStatementInner() {
		CToken t = c.peek();
		switch (t.kind()) {
			case RETURN:
				return parseReturn();
			case IF:
				return parseIf();
			case WHILE:
				return parseWhile();
			case FOR:
				return parseFor();
			case LBRACE:
				return parseBlock();
			default:
				break;
		}
		if (isType()) {
			return parseDeclaration();
		}
		if (c.peekIs(CTokenKind.IDENTIFIER) && c.peek(1) != null) {
			CTokenKind after = c.peek(1).kind();
			if (ASSIGN_OPS.contains(after) || after == CTokenKind.INCREMENT || after == CTokenKind.DECREMENT) {
				return parseAssignment();
			}
		}
		return parseExpressionStatement();
	}

	private ReturnStatement parseReturn() {
		CToken ret = c.next();
		AstNode value = null;
		if (!c.peekIs(CTokenKind.SEMICOLON)) {
			value = parseExpression();
		}
		if (!c.consume(CTokenKind.SEMICOLON)) {
			report("expected ';' after return", ret.line());
			return null;
		}
		return new ReturnStatement(value, ret.line());
	}

	private IfStatement parseIf() {
		CToken ifTok = c.next();
		if (!c.consume(CTokenKind.LPAREN)) {
			report("expected '(' after if", ifTok.line());
			return null;
		}
		AstNode condition = parseExpression();
		if (!c.consume(CTokenKind.RPAREN)) {
			report("expected ')' after if condition", ifTok.line());
			return null;
		}
		AstNode thenBranch = parseStatement();
		AstNode elseBranch = null;
		if (c.consume(CTokenKind.ELSE)) {
			elseBranch = parseStatement();
		}
		return new IfStatement(condition, thenBranch, elseBranch, ifTok.line());
	}

	private WhileStatement parseWhile() {
		CToken whileTok = c.next();
		if (!c.consume(CTokenKind.LPAREN)) {
			report("expected '(' after while", whileTok.line());
			return null;
		}
		AstNode condition = parseExpression();
		if (!c.consume(CTokenKind.RPAREN)) {
			report("expected ')' after while condition", whileTok.line());
			return null;
		}
		return new WhileStatement(condition, parseStatement(), whileTok.line());
	}

	private ForStatement parseFor() {
		CToken forTok = c.next();
		if (!c.consume(CTokenKind.LPAREN)) {
			report("expected '(' after for", forTok.line());
			return null;
		}

		// header clauses are kept as text
		StringBuilder header = new StringBuilder();
		int parens = 1;
		while (!c.isAtEnd()) {
			CToken t = c.next();
			if (t.is(CTokenKind.LPAREN)) {
				parens++;
			} else if (t.is(CTokenKind.RPAREN) && --parens == 0) {
				return new ForStatement(header.toString(), parseStatement(), forTok.line());
			}
			if (header.length() > 0) {
				header.append(' ');
			}
			header.append(t.lexeme());
		}
		report("unterminated for header", forTok.line());
		return null;
	}

	private AssignmentStatement parseAssignment() {
		CToken target = c.next();
		CToken op = c.next();
		AstNode value = null;
		if (!op.is(CTokenKind.INCREMENT) && !op.is(CTokenKind.DECREMENT)) {
			value = parseExpression();
			if (value == null) {
				report("missing value after '" + op.lexeme() + "'", op.line());
				return null;
			}
		}
		if (!c.consume(CTokenKind.SEMICOLON)) {
			report("expected ';' after assignment to " + target.lexeme(), target.line());
			return null;
		}
		return new AssignmentStatement(op.lexeme(), new Identifier(target.lexeme(), target.line()), value,
				target.line());
	}

	private AstNode parseExpressionStatement() {
		AstNode expr = parseExpression();
		if (expr != null && c.consume(CTokenKind.SEMICOLON)) {
			return expr;
		}
		return null;
	}

	private AstNode parseExpression() {
		if (depth >= maxDepth) {
			if (!c.isAtEnd()) {
				report("nesting deeper than " + maxDepth, c.peek().line());
			}
			return null;
		}
		depth++;
		try {
			AstNode left = parsePrimary();
			while (left != null && !c.isAtEnd() && BINARY_OPS.contains(c.peek().kind())) {
				CToken op = c.next();
				AstNode right = parsePrimary();
				if (right == null) {
					report("missing right operand of '" + op.lexeme() + "'", op.line());
					return null;
				}
				left = new BinaryOp(op.lexeme(), left, right, op.line());
			}
			return left;
		} finally {
			depth--;
		}
	}

	private AstNode parsePrimary() {
		if (c.isAtEnd()) {
			return null;
		}
		CToken t = c.peek();
		if (CALLABLES.contains(t.kind())) {
			c.next();
			if (!c.consume(CTokenKind.LPAREN)) {
				return new Identifier(t.lexeme(), t.line());
			}
			// arguments are skipped
			int parens = 1;
			while (!c.isAtEnd()) {
				CToken a = c.next();
				if (a.is(CTokenKind.LPAREN)) {
					parens++;
				} else if (a.is(CTokenKind.RPAREN) && --parens == 0) {
					return new FunctionCall(t.lexeme(), List.of(), t.line());
				}
			}
			report("unterminated call to " + t.lexeme(), t.line());
			return new Identifier(t.lexeme(), t.line());
		}
		String literalType = LITERAL_TYPES.get(t.kind());
		if (literalType != null) {
			c.next();
			return new Literal(t.value(), literalType, t.line());
		}
		if (t.is(CTokenKind.LPAREN)) {
			c.next();
			AstNode inner = parseExpression();
			if (inner == null || !c.consume(CTokenKind.RPAREN)) {
				report("unbalanced parenthesised expression", t.line());
				return null;
			}
			return inner;
		}

		// the enclosing block owns its closing brace
		if (t.is(CTokenKind.RBRACE)) {
			report("expected expression before '}'", t.line());
			return null;
		}
		skip("unexpected token in expression");
		return null;
	}

	private void skip(String why) {
		CToken t = c.next();
		report(why + ": " + t.kind() + "(" + t.lexeme() + ")", t.line());
	}

	private void skipTo(CTokenKind kind) {
		while (!c.isAtEnd() && !c.peekIs(kind)) {
			c.next();
		}
		c.consume(kind);
	}

	private void report(String message, int line) {
		logger.debug("line {}: {}", line, message);
		diagnostics.add(new Diagnostic(Diagnostic.Kind.SYNTACTIC, message, line));
	}

	private static final class Cursor {
		private final List<CToken> tokens;
		private int pos;

		Cursor(List<CToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return pos >= tokens.size();
		}

		int position() {
			return pos;
		}

		CToken peek() {
			return tokens.get(pos);
		}

		// null past the end
		CToken peek(int offset) {
			int k = pos + offset;
			return k < tokens.size() ? tokens.get(k) : null;
		}

		CToken next() {
			return tokens.get(pos++);
		}

		boolean peekIs(CTokenKind kind) {
			return !isAtEnd() && peek().is(kind);
		}

		boolean consume(CTokenKind kind) {
			if (peekIs(kind)) {
				pos++;
				return true;
			}
			return false;
		}
	}
}
