package rtt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import rtt.model.TargetSyntax;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ArtifactWriterTest {
	@Test
	void writesAllFourArtifacts(@TempDir Path dir) throws Exception {
		String source = Files.readString(Path.of("src", "test", "resources", "scenarios", "original.py"));
		TranslationRun run = new RoundTripPipeline().translate(source, "add_mul");
		Path outDir = dir.resolve("build").resolve("nested");

		List<Path> written = new ArtifactWriter().write(outDir, "original", run);

		assertEquals(List.of(outDir.resolve("original.c"), outDir.resolve("Original.java"),
				outDir.resolve("original_from_c.py"), outDir.resolve("original_from_java.py")), written);
		assertEquals(run.generatedText(TargetSyntax.C), Files.readString(written.get(0)));
		assertEquals(run.generatedText(TargetSyntax.JAVA), Files.readString(written.get(1)));
		assertEquals(run.roundTrip(TargetSyntax.C), Files.readString(written.get(2)));
		assertEquals(run.roundTrip(TargetSyntax.JAVA), Files.readString(written.get(3)));
	}

	@Test
	void capitalisesJavaClassName() {
		assertEquals("Original", ArtifactWriter.javaClassName("original"));
		assertEquals("Shapes_v2", ArtifactWriter.javaClassName("shapes_v2"));
		assertEquals("", ArtifactWriter.javaClassName(""));
	}
}
