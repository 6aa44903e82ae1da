package rtt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtt.model.TargetSyntax;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the texts of a {@link TranslationRun} next to each other in one directory.
 */
public final class ArtifactWriter {
	private static final Logger LOG = LoggerFactory.getLogger(ArtifactWriter.class);

	/**
	 * @return the written files: C, Java, Py from C, Py from Java
	 */
	public List<Path> write(Path outDir, String stem, TranslationRun run) throws IOException {
		Files.createDirectories(outDir);
		List<Path> written = List.of(
				writeOne(outDir.resolve(stem + ".c"), run.generatedText(TargetSyntax.C)),
				writeOne(outDir.resolve(javaClassName(stem) + ".java"), run.generatedText(TargetSyntax.JAVA)),
				writeOne(outDir.resolve(stem + "_from_c.py"), run.roundTrip(TargetSyntax.C)),
				writeOne(outDir.resolve(stem + "_from_java.py"), run.roundTrip(TargetSyntax.JAVA)));
		LOG.debug("Wrote {}", written);
		return written;
	}

	/**
	 * Capitalises the first character: {@code original -> Original}.
	 */
	public static String javaClassName(String stem) {
		if (stem.isEmpty()) {
			return stem;
		}
		return Character.toUpperCase(stem.charAt(0)) + stem.substring(1);
	}

	private static Path writeOne(Path file, String text) throws IOException {
		Files.writeString(file, text);
		return file;
	}
}
