package rtt.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the original source text.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public SourceSpan to(SourceSpan end) {
		return new SourceSpan(startOffset, end.endOffset());
	}
}
