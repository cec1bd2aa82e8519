package cflow.print;

import cflow.ast.c.Program;
import cflow.parse.c.CParser;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AstFormatterTest {
	@Test
	void formatsGoldenSample() throws Exception {
		String source = Files.readString(Path.of("src", "test", "resources", "golden", "branching.c"));
		String expected = Files.readString(Path.of("src", "test", "resources", "golden", "branching.ast.txt"));

		String actual = new AstFormatter().format(new CParser().parse(source));

		assertEquals(normalize(expected), normalize(actual));
	}

	@Test
	void labelsIfWithMissingThenBranch() {
		String actual = new AstFormatter().format(new CParser().parse("void f() { if (a) ; else x = 1; }"));

		assertTrue(actual.contains("└── If Statement (missing then)\n"), actual);
		assertTrue(actual.contains("    ├── Identifier: a\n"), actual);
		assertTrue(actual.contains("    └── Assignment: =\n"), actual);
	}

	@Test
	void formatsParametersAndLoops() {
		String actual = new AstFormatter().format(
				new CParser().parse("void f(int a, char) { while (a) a--; for (;;) { } }"));

		assertEquals("Abstract Syntax Tree (AST):\n"
				+ "========================================\n"
				+ "\n"
				+ "└── Program\n"
				+ "    └── Function: void f(int a, char)\n"
				+ "        └── Block (2 statements)\n"
				+ "            ├── While Statement\n"
				+ "            │   ├── Identifier: a\n"
				+ "            │   └── Assignment: --\n"
				+ "            │       └── Identifier: a\n"
				+ "            └── For Statement: ; ;\n"
				+ "                └── Block (0 statements)\n", actual);
	}

	@Test
	void emptyInputs() {
		assertEquals("Empty AST", new AstFormatter().format(null));
		assertEquals("Abstract Syntax Tree (AST):\n"
				+ "========================================\n"
				+ "\n"
				+ "└── Program\n", new AstFormatter().format(new Program(List.of())));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
