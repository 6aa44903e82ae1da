package rtt.ast.py;

import rtt.ast.SourceSpan;

import java.util.List;
import java.util.Optional;

public record PyModule(List<PyStmt> body, SourceSpan span) implements PyNode {
	public List<PyFunctionDef> functions() {
		return body.stream()
				.filter(PyFunctionDef.class::isInstance)
				.map(PyFunctionDef.class::cast)
				.toList();
	}

	public Optional<PyFunctionDef> function(String name) {
		return functions().stream().filter(f -> f.name().equals(name)).findFirst();
	}
}
