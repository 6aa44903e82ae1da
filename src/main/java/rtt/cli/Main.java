package rtt.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtt.ArtifactWriter;
import rtt.PipelineException;
import rtt.RoundTripPipeline;
import rtt.TranslationRun;
import rtt.model.TargetSyntax;
import rtt.verify.ModuleRegistry;
import rtt.verify.OracleReport;
import rtt.verify.PreservationResult;
import rtt.verify.ScenarioSuiteOracle;
import rtt.verify.VerificationEngine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Entry point: translate one Py function through C and Java and back, optionally verifying the round trips.
 *
 * <p>Exit status: 0 when translated (and preserved, if tests ran), 2 when a round trip is not preserved, 1 on
 * any usage or pipeline error.
 */
public final class Main {
	private static final Logger LOG = LoggerFactory.getLogger(Main.class);

	static final int EXIT_OK = 0;
	static final int EXIT_ERROR = 1;
	static final int EXIT_NOT_PRESERVED = 2;

	private final PrintStream out;
	private final ModuleRegistry registry = new ModuleRegistry();

	Main(PrintStream out) {
		this.out = out;
	}

	public static void main(String[] args) {
		System.exit(new Main(System.out).run(args));
	}

	int run(String[] args) {
		CliOptions options;
		try {
			options = CliParsers.parse(args);
		} catch (IllegalArgumentException e) {
			LOG.error(e.getMessage());
			out.println(CliParsers.USAGE);
			return EXIT_ERROR;
		}
		if (options.help()) {
			out.println(CliParsers.USAGE);
			return EXIT_OK;
		}

		try {
			return execute(options);
		} catch (PipelineException e) {
			LOG.error("{} ({})", e.getMessage(), e.kind());
			return EXIT_ERROR;
		} catch (IOException e) {
			LOG.error("I/O failure: {}", e.getMessage());
			return EXIT_ERROR;
		}
	}

	private int execute(CliOptions options) throws IOException {
		if (!Files.isRegularFile(options.source())) {
			LOG.error("Source file not found: {}", options.source());
			return EXIT_ERROR;
		}
		String source = Files.readString(options.source());
		String stem = options.stem();

		TranslationRun run = new RoundTripPipeline(ArtifactWriter.javaClassName(stem))
				.translate(source, options.functionName());
		List<Path> written = new ArtifactWriter().write(options.outDir(), stem, run);
		out.println("Generated C: " + written.get(0));
		out.println("Generated Java: " + written.get(1));
		out.println("Round-tripped Py (from C): " + written.get(2));
		out.println("Round-tripped Py (from Java): " + written.get(3));

		if (!options.runTests()) {
			return EXIT_OK;
		}

		VerificationEngine engine = new VerificationEngine(stem, new ScenarioSuiteOracle(options.testsDir()),
				registry);
		OracleReport baseline = engine.verifyBaseline(source);
		out.println("Baseline: " + summary(baseline));

		PreservationResult result = engine.verifyAll(source, run.roundTrips(), run.functionName());
		for (Map.Entry<TargetSyntax, OracleReport> e : result.reports().entrySet()) {
			out.println(e.getKey().displayName() + " round trip: " + summary(e.getValue()));
			e.getValue().failures().forEach(f -> out.println("    " + f));
		}
		out.println("Overall semantic preservation: " + result.overall());
		return result.overall() ? EXIT_OK : EXIT_NOT_PRESERVED;
	}

	private static String summary(OracleReport report) {
		return (report.success() ? "OK" : "FAILED") + " (" + report.testsRun() + " tests, "
				+ report.failureCount() + " failed)";
	}
}
