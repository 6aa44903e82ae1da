package rtt.emit;

import rtt.model.BinaryOp;
import rtt.model.Expression;
import rtt.model.Identifier;
import rtt.model.NumberLiteral;

/**
 * Renders an {@link Expression} in the operator syntax shared by Py, C and Java.
 *
 * Parentheses are added only where the tree requires them. Comparisons nested in comparisons are always
 * parenthesised because Py chains them while C and Java do not.
 */
public final class ExpressionRenderer {
	public String render(Expression expr) {
		if (expr instanceof Identifier id) {
			return id.name();
		}
		if (expr instanceof NumberLiteral num) {
			return num.text();
		}
		BinaryOp bin = (BinaryOp) expr;
		return operand(bin, bin.left(), false) + " " + bin.operator().token() + " " + operand(bin, bin.right(), true);
	}

	private String operand(BinaryOp parent, Expression child, boolean right) {
		String text = render(child);
		if (child instanceof BinaryOp nested && needsParens(parent, nested, right)) {
			return "(" + text + ")";
		}
		return text;
	}

	private static boolean needsParens(BinaryOp parent, BinaryOp child, boolean right) {
		if (parent.operator().isComparison() && child.operator().isComparison()) {
			return true;
		}
		int parentStrength = parent.operator().strength();
		int childStrength = child.operator().strength();
		return childStrength < parentStrength || (right && childStrength == parentStrength);
	}
}
