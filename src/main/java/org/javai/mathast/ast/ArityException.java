package org.javai.mathast.ast;

/**
 * Thrown when an operator node is given the wrong number of children.
 */
public class ArityException extends ExpressionException {

	private final String operator;
	private final int expected;
	private final int actual;

	public ArityException(String operator, int expected, int actual) {
		super("Operator '" + operator + "' requires exactly " + expected
				+ (expected == 1 ? " child" : " children") + " but was given " + actual);
		this.operator = operator;
		this.expected = expected;
		this.actual = actual;
	}

	public String operator() {
		return operator;
	}

	public int expected() {
		return expected;
	}

	public int actual() {
		return actual;
	}
}
