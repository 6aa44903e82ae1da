package rtt.cli;

import java.nio.file.Path;

/**
 * Validated command line.
 *
 * @param functionName null selects the first function in the source
 */
record CliOptions(Path source, Path outDir, String functionName, boolean runTests, Path testsDir, boolean help) {
	static final Path DEFAULT_SOURCE = Path.of("original.py");
	static final Path DEFAULT_OUT_DIR = Path.of("build");
	static final Path DEFAULT_TESTS_DIR = Path.of("tests");

	CliOptions {
		source = source == null ? DEFAULT_SOURCE : source;
		outDir = outDir == null ? DEFAULT_OUT_DIR : outDir;
		testsDir = testsDir == null ? DEFAULT_TESTS_DIR : testsDir;
		if (functionName != null && functionName.isBlank()) {
			throw new IllegalArgumentException("Function name must not be blank");
		}
		if (stemOf(source).isEmpty()) {
			throw new IllegalArgumentException("Source file has no name: " + source);
		}
	}

	/**
	 * File name without extension; doubles as the module name.
	 */
	String stem() {
		return stemOf(source);
	}

	private static String stemOf(Path path) {
		Path fileName = path.getFileName();
		if (fileName == null) {
			return "";
		}
		String name = fileName.toString();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}
}
