package rtt.verify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtt.model.TargetSyntax;
import rtt.runtime.ModuleHandle;
import rtt.runtime.ModuleLoader;

import java.util.EnumMap;
import java.util.Map;

/**
 * Checks that a round-tripped function behaves like the original inside its module.
 *
 * Every run loads the base module afresh, overwrites the one named member with the round-tripped definition
 * and hands the result to the oracle while it is installed in the registry.
 */
public final class VerificationEngine {
	private static final Logger LOG = LoggerFactory.getLogger(VerificationEngine.class);

	private final String moduleName;
	private final TestOracle oracle;
	private final ModuleRegistry registry;
	private final ModuleLoader loader = new ModuleLoader();

	public VerificationEngine(String moduleName, TestOracle oracle, ModuleRegistry registry) {
		this.moduleName = moduleName;
		this.oracle = oracle;
		this.registry = registry;
	}

	public OracleReport verify(String baseSource, String roundTripSource, String functionName) {
		ModuleHandle patched = loader.load(moduleName, baseSource);
		loader.patchFunction(patched, roundTripSource, functionName);
		return runInstalled(patched);
	}

	/**
	 * Verifies each target in declaration order; the verdict is the AND of the reports.
	 *
	 * @throws IllegalArgumentException if {@code roundTrips} has no source for some target
	 */
	public PreservationResult verifyAll(String baseSource, Map<TargetSyntax, String> roundTrips, String functionName) {
		for (TargetSyntax target : TargetSyntax.values()) {
			if (roundTrips.get(target) == null) {
				throw new IllegalArgumentException("no round-trip source for the " + target.displayName() + " target");
			}
		}
		Map<TargetSyntax, OracleReport> reports = new EnumMap<>(TargetSyntax.class);
		for (TargetSyntax target : TargetSyntax.values()) {
			OracleReport report = verify(baseSource, roundTrips.get(target), functionName);
			LOG.info("{} round trip of {}: {} ({} tests, {} failed)", target.displayName(), functionName,
					report.success() ? "preserved" : "NOT preserved", report.testsRun(), report.failureCount());
			reports.put(target, report);
		}
		PreservationResult result = new PreservationResult(reports);
		LOG.info("Overall semantic preservation for {}: {}", functionName, result.overall());
		return result;
	}

	/**
	 * Runs the oracle against the unmodified module.
	 */
	public OracleReport verifyBaseline(String baseSource) {
		OracleReport report = runInstalled(loader.load(moduleName, baseSource));
		if (!report.success()) {
			LOG.warn("Baseline module {} already fails {} of {} tests", moduleName, report.failureCount(),
					report.testsRun());
		}
		return report;
	}

	private OracleReport runInstalled(ModuleHandle module) {
		try (ModuleRegistry.Registration registration = registry.install(moduleName, module)) {
			return oracle.runSuite(registration.module());
		}
	}
}
