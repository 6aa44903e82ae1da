package rtt.verify;

import rtt.model.TargetSyntax;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Oracle reports per target plus the combined verdict. Built once per run.
 */
public record PreservationResult(Map<TargetSyntax, OracleReport> reports) {
	public PreservationResult {
		reports = reports.isEmpty()
				? Map.of()
				: Collections.unmodifiableMap(new EnumMap<>(reports));
	}

	public Map<TargetSyntax, Boolean> perTarget() {
		Map<TargetSyntax, Boolean> verdicts = new EnumMap<>(TargetSyntax.class);
		reports.forEach((target, report) -> verdicts.put(target, report.success()));
		return Collections.unmodifiableMap(verdicts);
	}

	/**
	 * True iff every target was verified and succeeded.
	 */
	public boolean overall() {
		return !reports.isEmpty() && reports.values().stream().allMatch(OracleReport::success);
	}

	public boolean succeeded(TargetSyntax target) {
		OracleReport report = reports.get(target);
		return report != null && report.success();
	}
}
