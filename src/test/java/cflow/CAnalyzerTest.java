package cflow;

import cflow.parse.c.CToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

public class CAnalyzerTest {
	@Test
	void exposesTheThreeStages() {
		List<CToken> tokens = CAnalyzer.tokenize("int a = 5;");
		assertEquals("INT IDENTIFIER ASSIGN INTEGER_LITERAL SEMICOLON",
				tokens.stream().map(t -> t.kind().name()).collect(Collectors.joining(" ")));

		assertEquals(0, CAnalyzer.parse("").children().size());

		assertNotNull(CAnalyzer.generateCfg("int main() { return 0; }"));
	}

	@Test
	void everyStageToleratesGarbage() {
		String[] inputs = {"", "}{", "#", "int", "if (", "\"\\", "int f(((((( {", "return return;;", "\u0000ÿ"};
		for (String input : inputs) {
			CAnalyzer.tokenize(input);
			assertNotNull(CAnalyzer.parse(input));
			assertNotNull(CAnalyzer.generateCfg(input), input);
		}
	}
}
