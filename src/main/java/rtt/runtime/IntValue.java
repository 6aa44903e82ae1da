package rtt.runtime;

import java.math.BigInteger;

public record IntValue(BigInteger value) implements Value {
	public static IntValue of(long value) {
		return new IntValue(BigInteger.valueOf(value));
	}

	@Override
	public String typeName() {
		return "int";
	}

	@Override
	public String repr() {
		return value.toString();
	}
}
