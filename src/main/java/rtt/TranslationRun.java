package rtt;

import rtt.model.FunctionShape;
import rtt.model.GeneratedText;
import rtt.model.RecoveredShape;
import rtt.model.TargetSyntax;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything one translation produced, keyed by target in {@link TargetSyntax} order.
 */
public record TranslationRun(FunctionShape shape, Map<TargetSyntax, GeneratedText> generated,
		Map<TargetSyntax, RecoveredShape> recovered, Map<TargetSyntax, String> roundTrips) {
	public TranslationRun {
		generated = copy(generated);
		recovered = copy(recovered);
		roundTrips = copy(roundTrips);
	}

	public String functionName() {
		return shape.name();
	}

	public String generatedText(TargetSyntax target) {
		return generated.get(target).text();
	}

	public String roundTrip(TargetSyntax target) {
		return roundTrips.get(target);
	}

	private static <V> Map<TargetSyntax, V> copy(Map<TargetSyntax, V> m) {
		return m.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(m));
	}
}
