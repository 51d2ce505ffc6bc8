package org.javai.mathast.ast;

/**
 * Base type for every failure raised while constructing an {@link Expression}.
 * <p>
 * Construction failures are reported synchronously to the caller and are never
 * retried or recovered inside this library.
 */
public abstract class ExpressionException extends RuntimeException {

	protected ExpressionException(String message) {
		super(message);
	}

	protected ExpressionException(String message, Throwable cause) {
		super(message, cause);
	}
}
