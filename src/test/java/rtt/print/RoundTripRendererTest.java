package rtt.print;

import org.junit.jupiter.api.Test;
import rtt.model.RecoveredShape;
import rtt.parse.py.PyParser;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RoundTripRendererTest {
	@Test
	void rendersFixedIfElseFunction() throws Exception {
		String expected = Files.readString(Path.of("src", "test", "resources", "golden", "add_mul_round_trip.py"));

		String actual = new RoundTripRenderer().render(new RecoveredShape("add_mul", "a > b", "a * b + 1", "a + b"));

		assertEquals(expected.replace("\r\n", "\n"), actual);
	}

	@Test
	void alwaysDeclaresFixedParameters() {
		String actual = new RoundTripRenderer().render(new RecoveredShape("pick", "x > y", "x", "y"));

		assertEquals("def pick(a, b):", actual.lines().findFirst().orElseThrow());
	}

	@Test
	void outputParsesAsPy() {
		String actual = new RoundTripRenderer().render(new RecoveredShape("f", "(a > b) == (b < 0)", "a / 2", "-1"));

		assertEquals(1, new PyParser().parseModule(actual).functions().size());
	}
}
