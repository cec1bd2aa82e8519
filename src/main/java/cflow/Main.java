package cflow;

import cflow.cfg.ControlFlowGraph;
import cflow.print.AstFormatter;
import cflow.print.CfgTextRenderer;
import cflow.print.DotRenderer;
import cflow.print.TokenTableFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line front end: {@code Main <tokens|ast|cfg|dot> <file>}.
 */
public class Main {
	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	static final int OK = 0;
	static final int USAGE = 1;
	static final int IO_ERROR = 2;
	static final int NO_GRAPH = 3;

	private static final List<String> MODES = List.of("tokens", "ast", "cfg", "dot");

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		if (args.length != 2) {
			err.println("Usage: Main <tokens|ast|cfg|dot> <file>");
			return USAGE;
		}

		String mode = args[0];
		if (!MODES.contains(mode)) {
			err.println("Unknown mode '" + mode + "', expected tokens, ast, cfg or dot");
			return USAGE;
		}

		String source;
		try {
			source = Files.readString(Path.of(args[1]));
		} catch (IOException e) {
			logger.error("Cannot read {}: {}", args[1], e.toString());
			return IO_ERROR;
		}

		switch (mode) {
			case "tokens":
				out.print(new TokenTableFormatter().format(CAnalyzer.tokenize(source)));
				return OK;
			case "ast":
				out.print(new AstFormatter().format(CAnalyzer.parse(source)));
				return OK;
			case "cfg":
			case "dot": {
				ControlFlowGraph cfg = CAnalyzer.generateCfg(source);
				if (cfg == null) {
					logger.error("No control flow graph could be built for {}", args[1]);
					return NO_GRAPH;
				}
				out.print(mode.equals("cfg") ? new CfgTextRenderer().render(cfg) : new DotRenderer().render(cfg));
				return OK;
			}
			default:
				throw new IllegalStateException("Unhandled mode " + mode);
		}
	}
}
