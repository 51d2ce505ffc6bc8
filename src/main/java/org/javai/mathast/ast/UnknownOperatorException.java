package org.javai.mathast.ast;

/**
 * Thrown when an operator or symbol tag is outside the closed set the tree supports.
 */
public class UnknownOperatorException extends ExpressionException {

	private final String tag;

	public UnknownOperatorException(String kind, String tag) {
		super("Unknown " + kind + " tag: " + (tag == null ? "<null>" : "'" + tag + "'"));
		this.tag = tag;
	}

	/**
	 * The rejected tag, or {@code null} if none was given.
	 */
	public String tag() {
		return tag;
	}
}
