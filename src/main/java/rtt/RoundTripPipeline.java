package rtt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rtt.emit.CEmitter;
import rtt.emit.JavaEmitter;
import rtt.emit.TargetEmitter;
import rtt.extract.StructuralExtractor;
import rtt.model.FunctionShape;
import rtt.model.GeneratedText;
import rtt.model.RecoveredShape;
import rtt.model.TargetSyntax;
import rtt.print.RoundTripRenderer;
import rtt.reverse.CReverseExtractor;
import rtt.reverse.JavaReverseExtractor;
import rtt.reverse.ReverseExtractor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Py function -> C and Java text -> recovered shape -> Py function.
 *
 * Stages run strictly in order; the first {@link PipelineException} aborts the run.
 */
public final class RoundTripPipeline {
	private static final Logger LOG = LoggerFactory.getLogger(RoundTripPipeline.class);

	private final StructuralExtractor extractor = new StructuralExtractor();
	private final List<TargetEmitter> emitters;
	private final List<ReverseExtractor> reverseExtractors = List.of(new CReverseExtractor(), new JavaReverseExtractor());
	private final RoundTripRenderer renderer = new RoundTripRenderer();

	public RoundTripPipeline() {
		this(JavaEmitter.DEFAULT_CLASS_NAME);
	}

	public RoundTripPipeline(String javaClassName) {
		this.emitters = List.of(new CEmitter(), new JavaEmitter(javaClassName));
	}

	/**
	 * @param functionName the function to translate, or null for the first one in {@code source}
	 */
	public TranslationRun translate(String source, String functionName) {
		FunctionShape shape = extractor.extract(source, functionName);
		LOG.debug("Extracted {} with parameters {}", shape.name(), shape.parameters());

		Map<TargetSyntax, GeneratedText> generated = new EnumMap<>(TargetSyntax.class);
		for (TargetEmitter emitter : emitters) {
			generated.put(emitter.target(), emitter.emit(shape));
		}

		Map<TargetSyntax, RecoveredShape> recovered = new EnumMap<>(TargetSyntax.class);
		Map<TargetSyntax, String> roundTrips = new EnumMap<>(TargetSyntax.class);
		for (ReverseExtractor reverse : reverseExtractors) {
			TargetSyntax target = reverse.target();
			RecoveredShape shapeBack = reverse.extract(generated.get(target).text(), shape.name());
			LOG.debug("Recovered from {}: if ({}) {} else {}", target.displayName(), shapeBack.condition(),
					shapeBack.trueResult(), shapeBack.falseResult());
			recovered.put(target, shapeBack);
			roundTrips.put(target, renderer.render(shapeBack));
		}
		return new TranslationRun(shape, generated, recovered, roundTrips);
	}
}
