package rtt.model;

/**
 * Condition and branch results recovered from generated text, kept as opaque expression text.
 *
 * The name is supplied by the caller; parameters are not recovered.
 */
public record RecoveredShape(String name, String condition, String trueResult, String falseResult) {
}
