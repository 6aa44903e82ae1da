package rtt.runtime;

import java.util.Locale;

public record FloatValue(double value) implements Value {
	@Override
	public String typeName() {
		return "float";
	}

	@Override
	public String repr() {
		if (Double.isNaN(value)) {
			return "nan";
		}
		if (Double.isInfinite(value)) {
			return value > 0 ? "inf" : "-inf";
		}
		if (value == Math.rint(value) && Math.abs(value) < 1e16) {
			return String.format(Locale.ROOT, "%.1f", value);
		}
		return Double.toString(value).replace("E", "e");
	}
}
