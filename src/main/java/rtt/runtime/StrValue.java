package rtt.runtime;

public record StrValue(String value) implements Value {
	@Override
	public String typeName() {
		return "str";
	}

	@Override
	public String repr() {
		return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
	}
}
