package rtt.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtt.ast.py.PyFunctionDef;
import rtt.ast.py.PyModule;
import rtt.parse.py.PyParser;
import rtt.parse.py.SourceSyntaxException;

/**
 * Turns Py source text into a live {@link ModuleHandle}, and replaces single members of one.
 */
public final class ModuleLoader {
	private static final Logger LOG = LoggerFactory.getLogger(ModuleLoader.class);

	private final PyParser parser = new PyParser();

	public ModuleHandle load(String moduleName, String source) {
		PyModule module = parse(moduleName, source);
		ModuleHandle handle = new ModuleHandle(moduleName);
		try {
			new Evaluator().execModule(module.body(), handle);
		} catch (EvaluationException e) {
			throw new ModuleLoadException("module '" + moduleName + "' failed to initialise: " + e.getMessage(), e);
		}
		LOG.debug("Loaded module {} with members {}", moduleName, handle.memberNames());
		return handle;
	}

	/**
	 * Defines {@code functionName} from {@code source} into {@code target}, overwriting exactly that member.
	 *
	 * The source is executed in a scratch module first so that nothing else it defines leaks into the target.
	 * The patched function resolves globals through {@code target}.
	 */
	public void patchFunction(ModuleHandle target, String source, String functionName) {
		PyModule module = parse(target.name() + "$patch", source);
		PyFunctionDef def = module.function(functionName)
				.orElseThrow(() -> new ModuleLoadException("round-trip source does not define '" + functionName + "'"));
		FunctionValue replacement;
		try {
			// defaults are evaluated against the target so they see its globals
			replacement = new Evaluator().define(def, Scope.moduleLevel(target));
		} catch (EvaluationException e) {
			throw new ModuleLoadException("could not define '" + functionName + "': " + e.getMessage(), e);
		}
		target.define(functionName, replacement);
		LOG.debug("Patched {}.{}", target.name(), functionName);
	}

	private PyModule parse(String moduleName, String source) {
		try {
			return parser.parseModule(source);
		} catch (SourceSyntaxException e) {
			throw new ModuleLoadException("module '" + moduleName + "' has a syntax error: " + e.getMessage(), e);
		}
	}
}
