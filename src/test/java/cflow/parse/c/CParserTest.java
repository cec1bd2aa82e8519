package cflow.parse.c;

import cflow.Diagnostic;
import cflow.ast.c.AssignmentStatement;
import cflow.ast.c.BinaryOp;
import cflow.ast.c.Block;
import cflow.ast.c.Declaration;
import cflow.ast.c.ForStatement;
import cflow.ast.c.Function;
import cflow.ast.c.FunctionCall;
import cflow.ast.c.Identifier;
import cflow.ast.c.IfStatement;
import cflow.ast.c.Literal;
import cflow.ast.c.PreprocessorDirective;
import cflow.ast.c.Program;
import cflow.ast.c.ReturnStatement;
import cflow.ast.c.WhileStatement;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CParserTest {
	private static Block body(Program program) {
		Function fn = assertInstanceOf(Function.class, program.items().get(program.items().size() - 1));
		return fn.body();
	}

	private static boolean hasDiagnostic(CParser parser, String fragment) {
		return parser.diagnostics().stream().anyMatch(d -> d.message().contains(fragment));
	}

	@Test
	void emptySourceGivesEmptyProgram() {
		assertEquals(0, new CParser().parse("").children().size());
		assertEquals(0, new CParser().parse("  \n\t").children().size());
		assertEquals("Program", new CParser().parse("").nodeType());
	}

	@Test
	void parsesFunctionWithParametersAndBody() {
		Program program = new CParser().parse("int add(int a, int b) { return a + b; }");

		assertEquals(1, program.items().size());
		Function fn = assertInstanceOf(Function.class, program.items().get(0));
		assertEquals("add", fn.name());
		assertEquals("int", fn.returnType());
		assertEquals(2, fn.parameters().size());
		assertEquals("a", fn.parameters().get(0).name());
		assertEquals("b", fn.parameters().get(1).name());
		assertEquals("add", fn.attributes().get("name"));
		assertEquals("int", fn.attributes().get("return_type"));

		ReturnStatement ret = assertInstanceOf(ReturnStatement.class, fn.body().statements().get(0));
		BinaryOp sum = assertInstanceOf(BinaryOp.class, ret.value());
		assertEquals("+", sum.operator());
		assertEquals("a", assertInstanceOf(Identifier.class, sum.left()).name());
	}

	@Test
	void unnamedParameterIsKept() {
		Function fn = assertInstanceOf(Function.class, new CParser().parse("void f(int, char c) {}").items().get(0));

		assertEquals(2, fn.parameters().size());
		assertNull(fn.parameters().get(0).name());
		assertEquals("char", fn.parameters().get(1).type());
	}

	@Test
	void parsesPreprocessorDirectives() {
		Program program = new CParser().parse("#include <stdio.h>\n#define MAX 10\n#endif\nint x;");

		assertEquals(4, program.items().size());
		PreprocessorDirective include = assertInstanceOf(PreprocessorDirective.class, program.items().get(0));
		assertEquals("include", include.directive());
		assertEquals("<stdio.h>", include.content());
		assertEquals("MAX 10", ((PreprocessorDirective) program.items().get(1)).content());
		assertNull(((PreprocessorDirective) program.items().get(2)).content());
		assertInstanceOf(Declaration.class, program.items().get(3));
	}

	@Test
	void declarationKeepsOnlyTypeAndName() {
		Program program = new CParser().parse("float ratio = a + f(3) * 2;");

		Declaration decl = assertInstanceOf(Declaration.class, program.items().get(0));
		assertEquals("ratio", decl.name());
		assertEquals("float", decl.dataType());
		assertEquals("variable", decl.declType());
		assertTrue(decl.children().isEmpty());
	}

	@Test
	void prototypeIsNotAFunctionDefinition() {
		Program program = new CParser().parse("int f(int a);");

		Declaration decl = assertInstanceOf(Declaration.class, program.items().get(0));
		assertEquals("f", decl.name());
	}

	@Test
	void lookaheadOnlyProbesTwoTokensForTheName() {
		CParser parser = new CParser();
		Program program = parser.parse("int * * f() { return 0; }");

		assertTrue(program.items().stream().noneMatch(n -> n instanceof Function));
		assertFalse(parser.diagnostics().isEmpty());
	}

	@Test
	void parsesIfElseWithBlocks() {
		Program program = new CParser().parse("int main() { if (x > 0) { printf(\"p\"); } else y = 1; }");

		IfStatement ifStmt = assertInstanceOf(IfStatement.class, body(program).statements().get(0));
		assertEquals(">", assertInstanceOf(BinaryOp.class, ifStmt.condition()).operator());
		Block then = assertInstanceOf(Block.class, ifStmt.thenBranch());
		FunctionCall call = assertInstanceOf(FunctionCall.class, then.statements().get(0));
		assertEquals("printf", call.functionName());
		assertTrue(call.arguments().isEmpty());
		AssignmentStatement assign = assertInstanceOf(AssignmentStatement.class, ifStmt.elseBranch());
		assertEquals("=", assign.operator());
		assertEquals(3, ifStmt.children().size());
	}

	@Test
	void binaryOperatorsFoldLeftToRight() {
		Program program = new CParser().parse("int main() { return a - b * c; }");

		ReturnStatement ret = (ReturnStatement) body(program).statements().get(0);
		BinaryOp outer = assertInstanceOf(BinaryOp.class, ret.value());
		assertEquals("*", outer.operator());
		assertEquals("-", assertInstanceOf(BinaryOp.class, outer.left()).operator());
		assertEquals("c", assertInstanceOf(Identifier.class, outer.right()).name());
	}

	@Test
	void parsesAssignmentsAndIncrements() {
		Program program = new CParser().parse("void f() { x = 5; y += x; i++; j--; }");

		List<String> ops = body(program).statements().stream()
				.map(s -> assertInstanceOf(AssignmentStatement.class, s).operator())
				.toList();
		assertEquals(List.of("=", "+=", "++", "--"), ops);
		AssignmentStatement inc = (AssignmentStatement) body(program).statements().get(2);
		assertNull(inc.value());
		assertEquals(1, inc.children().size());
	}

	@Test
	void parsesLiteralsOfEveryKind() {
		Program program = new CParser().parse("void f() { 7; 2.5; \"s\"; 'c'; }");

		List<Literal> literals = body(program).statements().stream()
				.map(s -> assertInstanceOf(Literal.class, s))
				.toList();
		assertEquals(BigInteger.valueOf(7), literals.get(0).value());
		assertEquals(List.of("integer", "float", "string", "char"),
				literals.stream().map(Literal::literalType).toList());
		assertEquals("\"s\"", literals.get(2).value());
	}

	@Test
	void parsesLoops() {
		Program program = new CParser().parse(
				"int main() { while (i < 10) i++; for (i = 0; i < 3; i++) { sum += i; } }");

		WhileStatement loop = assertInstanceOf(WhileStatement.class, body(program).statements().get(0));
		assertEquals("<", ((BinaryOp) loop.condition()).operator());
		assertInstanceOf(AssignmentStatement.class, loop.body());
		ForStatement forLoop = assertInstanceOf(ForStatement.class, body(program).statements().get(1));
		assertEquals("i = 0 ; i < 3 ; i ++", forLoop.header());
		assertInstanceOf(Block.class, forLoop.body());
	}

	@Test
	void commentsAreIgnored() {
		Program program = new CParser().parse("int main() { // hi\n return 0; /* bye */ }");

		assertEquals(1, body(program).statements().size());
	}

	@Test
	void recoversFromUnknownTokensAndRecordsThem() {
		CParser parser = new CParser();
		Program program = parser.parse("int main() { @ ; return 1; }");

		assertEquals(1, body(program).statements().size());
		assertInstanceOf(ReturnStatement.class, body(program).statements().get(0));
		assertTrue(parser.diagnostics().stream().anyMatch(d -> d.kind() == Diagnostic.Kind.LEXICAL));
		assertTrue(parser.diagnostics().stream().anyMatch(d -> d.kind() == Diagnostic.Kind.SYNTACTIC));
	}

	@Test
	void missingSemicolonDoesNotSwallowClosingBrace() {
		CParser parser = new CParser();
		Program program = parser.parse("int main() { return 0 } int y;");

		assertEquals(2, program.items().size());
		assertTrue(body(new CParser().parse("int main() { return 0 }")).statements().isEmpty());
		assertTrue(hasDiagnostic(parser, "expected ';' after return"));
	}

	@Test
	void missingExpressionLeavesClosingBraceToTheBlock() {
		CParser parser = new CParser();
		Program program = parser.parse("int main() { x = } int y;");

		assertEquals(2, program.items().size());
		assertTrue(body(program).statements().isEmpty());
		assertInstanceOf(Declaration.class, program.items().get(1));
		assertTrue(hasDiagnostic(parser, "expected expression before '}'"));
		assertFalse(hasDiagnostic(parser, "never closed"));

		program = parser.parse("int main() { if (a) } int y;");

		assertEquals(2, program.items().size());
		IfStatement ifStmt = assertInstanceOf(IfStatement.class, body(program).statements().get(0));
		assertNull(ifStmt.thenBranch());
		assertFalse(hasDiagnostic(parser, "never closed"));

		assertEquals(2, parser.parse("int f() { return a + } int g;").items().size());
	}

	@Test
	void unclosedBlockIsStillReturned() {
		CParser parser = new CParser();
		Program program = parser.parse("int main() { int x;");

		assertEquals(1, body(program).statements().size());
		assertTrue(hasDiagnostic(parser, "never closed"));
	}

	@Test
	void strayTopLevelTokensAreSkipped() {
		CParser parser = new CParser();
		Program program = parser.parse("; ) x int y;");

		assertEquals(1, program.items().size());
		assertEquals(3, parser.diagnostics().size());
	}

	@Test
	void nestingIsBounded() {
		CParser shallow = new CParser(5);
		shallow.parse("int main() { if (a) if (a) if (a) if (a) if (a) if (a) if (a) x = 1; }");
		assertTrue(hasDiagnostic(shallow, "nesting deeper than 5"));

		CParser parser = new CParser();
		String deep = "int main() { return " + "(".repeat(5000) + "1" + ")".repeat(5000) + "; }";
		Program program = parser.parse(deep);
		assertInstanceOf(Function.class, program.items().get(0));
		assertTrue(hasDiagnostic(parser, "nesting deeper than " + CParser.DEFAULT_MAX_DEPTH));
	}
}
