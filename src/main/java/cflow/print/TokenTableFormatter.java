package cflow.print;

import cflow.parse.c.CToken;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary and detail table of a token stream.
 */
public final class TokenTableFormatter {
	private static final int MAX_VALUE_WIDTH = 18;

	public String format(List<CToken> tokens) {
		StringBuilder out = new StringBuilder();
		out.append("Lexical Analysis Results:\n");
		out.append("=".repeat(50)).append("\n\n");

		if (tokens.isEmpty()) {
			return out.append("No tokens found.\n").toString();
		}

		Map<String, Integer> counts = new TreeMap<>();
		for (CToken t : tokens) {
			counts.merge(t.kind().name(), 1, Integer::sum);
		}
		out.append("Token Summary:\n");
		out.append("-".repeat(20)).append('\n');
		counts.forEach((kind, count) -> out.append(kind).append(": ").append(count).append('\n'));

		out.append("\nDetailed Token List:\n");
		out.append("-".repeat(30)).append('\n');
		out.append(String.format("%-6s %-20s %-20s %-10s", "Line", "Type", "Value", "Position")).append('\n');
		out.append("-".repeat(60)).append('\n');
		for (CToken t : tokens) {
			String value = String.valueOf(t.value());
			if (value.length() > MAX_VALUE_WIDTH) {
				value = value.substring(0, 15) + "...";
			}
			out.append(String.format("%-6d %-20s %-20s %-10d", t.line(), t.kind().name(), value, t.position()))
					.append('\n');
		}
		return out.toString();
	}
}
