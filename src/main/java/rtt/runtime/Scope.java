package rtt.runtime;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name resolution for one frame: locals (absent at module level), then module globals, then builtins.
 */
final class Scope {
	private final Map<String, Value> locals;
	private final ModuleHandle module;

	private Scope(Map<String, Value> locals, ModuleHandle module) {
		this.locals = locals;
		this.module = module;
	}

	static Scope moduleLevel(ModuleHandle module) {
		return new Scope(null, module);
	}

	static Scope functionLevel(ModuleHandle module, Map<String, Value> arguments) {
		return new Scope(new HashMap<>(arguments), module);
	}

	boolean isModuleLevel() {
		return locals == null;
	}

	ModuleHandle module() {
		return module;
	}

	Optional<Value> lookup(String name) {
		if (locals != null && locals.containsKey(name)) {
			return Optional.of(locals.get(name));
		}
		Optional<Value> global = module.lookup(name);
		if (global.isPresent()) {
			return global;
		}
		return Builtins.lookup(name);
	}

	void assign(String name, Value value) {
		if (locals != null) {
			locals.put(name, value);
		} else {
			module.define(name, value);
		}
	}
}
