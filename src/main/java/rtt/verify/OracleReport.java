package rtt.verify;

import java.util.List;

/**
 * Outcome of one oracle run.
 *
 * @param failures one line per failed case, empty on success
 */
public record OracleReport(boolean success, int testsRun, List<String> failures) {
	public OracleReport {
		failures = List.copyOf(failures);
		if (testsRun < 0) {
			throw new IllegalArgumentException("testsRun must not be negative");
		}
	}

	public int failureCount() {
		return failures.size();
	}
}
