package rtt.cli;

import java.nio.file.Path;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
	static final String USAGE = String.join("\n",
			"Usage: rtt [options]",
			"  --source <file>       Py source file (default: original.py)",
			"  --outdir <dir>        directory for generated files (default: build)",
			"  --func, --fn <name>   function to translate (default: first function)",
			"  --run-tests           verify both round trips with the test suites",
			"  --tests <dir>         directory holding test*.json suites (default: tests)",
			"  --help                show this message");

	private CliParsers() {
	}

	static CliOptions parse(String[] args) {
		Path source = null;
		Path outDir = null;
		String functionName = null;
		boolean runTests = false;
		Path testsDir = null;
		boolean help = false;

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			String option = arg;
			String inline = null;
			int eq = arg.indexOf('=');
			if (arg.startsWith("--") && eq > 0) {
				option = arg.substring(0, eq);
				inline = arg.substring(eq + 1);
			}
			switch (option) {
				case "--source" -> {
					String value = inline != null ? inline : nextValue(args, ++i, option);
					source = Path.of(value);
				}
				case "--outdir" -> {
					String value = inline != null ? inline : nextValue(args, ++i, option);
					outDir = Path.of(value);
				}
				case "--func", "--fn" -> functionName = inline != null ? inline : nextValue(args, ++i, option);
				case "--tests" -> {
					String value = inline != null ? inline : nextValue(args, ++i, option);
					testsDir = Path.of(value);
				}
				case "--run-tests" -> {
					rejectValue(option, inline);
					runTests = true;
				}
				case "--help", "-h" -> {
					rejectValue(option, inline);
					help = true;
				}
				default -> throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}
		return new CliOptions(source, outDir, functionName, runTests, testsDir, help);
	}

	static String nextValue(String[] args, int index, String option) {
		if (index >= args.length) {
			throw new IllegalArgumentException("Missing value for " + option);
		}
		return args[index];
	}

	private static void rejectValue(String option, String inline) {
		if (inline != null) {
			throw new IllegalArgumentException(option + " does not take a value");
		}
	}
}
