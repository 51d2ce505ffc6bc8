package org.javai.mathast.ast;

/**
 * Thrown when a leaf value cannot be represented: a non-finite decimal, unparsable
 * numeric text, or a blank identifier.
 */
public class MalformedLiteralException extends ExpressionException {

	public MalformedLiteralException(String message) {
		super(message);
	}

	public MalformedLiteralException(String message, Throwable cause) {
		super(message, cause);
	}
}
