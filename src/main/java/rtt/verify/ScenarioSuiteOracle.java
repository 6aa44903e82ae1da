package rtt.verify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtt.parse.py.PyParser;
import rtt.parse.py.SourceSyntaxException;
import rtt.runtime.Arithmetic;
import rtt.runtime.EvaluationException;
import rtt.runtime.Evaluator;
import rtt.runtime.ModuleHandle;
import rtt.runtime.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Oracle backed by JSON suite files named {@code test*.json} under a directory.
 *
 * A suite looks like:
 *
 * <pre>
 * {"suite": "add_mul", "cases": [{"name": "greater", "call": "add_mul(5, 2)", "expected": "5 * 2 + 1"}]}
 * </pre>
 *
 * Both {@code call} and {@code expected} are Py expressions evaluated against the module under test.
 */
public final class ScenarioSuiteOracle implements TestOracle {
	private static final Logger LOG = LoggerFactory.getLogger(ScenarioSuiteOracle.class);
	private static final ObjectMapper M = new ObjectMapper();

	private final Path testsDir;
	private final PyParser parser = new PyParser();

	public ScenarioSuiteOracle(Path testsDir) {
		this.testsDir = testsDir;
	}

	@Override
	public OracleReport runSuite(ModuleHandle module) {
		List<ScenarioCase> cases = loadCases();
		if (cases.isEmpty()) {
			LOG.warn("No test suites found under {}", testsDir);
			return new OracleReport(true, 0, List.of());
		}

		List<String> failures = new ArrayList<>();
		for (ScenarioCase c : cases) {
			runCase(c, module).ifPresent(failures::add);
		}
		LOG.debug("Ran {} cases against {}: {} failed", cases.size(), module.name(), failures.size());
		return new OracleReport(failures.isEmpty(), cases.size(), failures);
	}

	private Optional<String> runCase(ScenarioCase c, ModuleHandle module) {
		try {
			Evaluator evaluator = new Evaluator();
			Value actual = evaluator.evaluate(parser.parseExpression(c.call()), module);
			Value expected = evaluator.evaluate(parser.parseExpression(c.expected()), module);
			if (Arithmetic.valueEquals(actual, expected)) {
				return Optional.empty();
			}
			String failure = c.label() + ": " + actual.repr() + " != " + expected.repr();
			LOG.debug("FAIL {}", failure);
			return Optional.of(failure);
		} catch (EvaluationException | SourceSyntaxException e) {
			String failure = c.label() + ": error: " + e.getMessage();
			LOG.debug("ERROR {}", failure);
			return Optional.of(failure);
		}
	}

	private List<ScenarioCase> loadCases() {
		if (!Files.isDirectory(testsDir)) {
			throw new OracleInvocationException("tests directory not found: " + testsDir);
		}
		List<Path> suites;
		try (Stream<Path> paths = Files.walk(testsDir)) {
			suites = paths
					.filter(Files::isRegularFile)
					.filter(p -> {
						String name = p.getFileName().toString();
						return name.startsWith("test") && name.endsWith(".json");
					})
					.sorted()
					.collect(Collectors.toList());
		} catch (IOException e) {
			throw new OracleInvocationException("could not list " + testsDir, e);
		}

		List<ScenarioCase> cases = new ArrayList<>();
		for (Path suite : suites) {
			cases.addAll(readSuite(suite));
		}
		return cases;
	}

	private List<ScenarioCase> readSuite(Path file) {
		JsonNode root;
		try {
			root = M.readTree(file.toFile());
		} catch (JsonProcessingException e) {
			throw new OracleInvocationException("malformed suite " + file + ": " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new OracleInvocationException("could not read suite " + file, e);
		}
		if (root == null || !root.isObject()) {
			throw new OracleInvocationException("suite " + file + " is not a JSON object");
		}

		String fileName = file.getFileName().toString();
		String suiteName = root.path("suite").asText(fileName.substring(0, fileName.length() - ".json".length()));
		JsonNode arr = req(file, root, "cases");
		if (!arr.isArray()) {
			throw new OracleInvocationException("'cases' in " + file + " must be an array");
		}

		List<ScenarioCase> cases = new ArrayList<>();
		int index = 0;
		for (JsonNode c : arr) {
			String name = c.path("name").asText("case" + index);
			String call = req(file, c, "call").asText();
			String expected = req(file, c, "expected").asText();
			cases.add(new ScenarioCase(suiteName, name, call, expected));
			index++;
		}
		return cases;
	}

	private static JsonNode req(Path file, JsonNode n, String field) {
		if (!n.has(field)) {
			throw new OracleInvocationException("missing required field '" + field + "' in " + file);
		}
		return n.get(field);
	}

	private record ScenarioCase(String suite, String name, String call, String expected) {
		String label() {
			return suite + "." + name;
		}
	}
}
