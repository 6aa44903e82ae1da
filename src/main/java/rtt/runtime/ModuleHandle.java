package rtt.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A loaded module: a name plus a mutable member table.
 *
 * Functions defined in the module resolve global names through this table at call time, so replacing a
 * member is visible to every sibling that calls it.
 */
public final class ModuleHandle {
	private final String name;
	private final Map<String, Value> members = new LinkedHashMap<>();

	public ModuleHandle(String name) {
		this.name = name;
	}

	public String name() {
		return name;
	}

	public Optional<Value> lookup(String member) {
		return Optional.ofNullable(members.get(member));
	}

	public void define(String member, Value value) {
		members.put(member, value);
	}

	public Set<String> memberNames() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(members.keySet()));
	}

	@Override
	public String toString() {
		return "<module '" + name + "'>";
	}
}
