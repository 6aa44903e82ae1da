package rtt.model;

/**
 * Syntax-independent arithmetic/comparison expression tree.
 */
public sealed interface Expression permits Identifier, NumberLiteral, BinaryOp {
}
