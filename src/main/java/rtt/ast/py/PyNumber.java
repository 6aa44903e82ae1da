package rtt.ast.py;

import rtt.ast.SourceSpan;

/**
 * A numeric literal exactly as written, including any radix prefix, '_' separators or imaginary suffix.
 */
public record PyNumber(String text, SourceSpan span) implements PyExpr {
	public int radix() {
		if (text.length() < 3 || text.charAt(0) != '0') {
			return 10;
		}
		return switch (Character.toLowerCase(text.charAt(1))) {
			case 'x' -> 16;
			case 'o' -> 8;
			case 'b' -> 2;
			default -> 10;
		};
	}

	public boolean isImaginary() {
		char last = text.charAt(text.length() - 1);
		return radix() == 10 && (last == 'j' || last == 'J');
	}

	public boolean isFloat() {
		return radix() == 10 && !isImaginary()
				&& (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0);
	}

	/**
	 * True for the plain decimal spellings C and Java read the same way Py does.
	 */
	public boolean isPlainDecimal() {
		return radix() == 10 && !isImaginary() && text.indexOf('_') < 0;
	}

	/**
	 * The literal's digits with separators and any radix prefix removed.
	 */
	public String digits() {
		String digits = text.replace("_", "");
		return radix() == 10 ? digits : digits.substring(2);
	}
}
