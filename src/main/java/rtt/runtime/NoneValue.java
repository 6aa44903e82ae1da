package rtt.runtime;

public record NoneValue() implements Value {
	public static final NoneValue INSTANCE = new NoneValue();

	@Override
	public String typeName() {
		return "NoneType";
	}

	@Override
	public String repr() {
		return "None";
	}
}
