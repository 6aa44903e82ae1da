package rtt.verify;

import rtt.runtime.ModuleHandle;

/**
 * Runs a fixed behavioural test suite against a loaded module.
 */
public interface TestOracle {
	OracleReport runSuite(ModuleHandle module);
}
