package org.javai.mathast.symbols;

/**
 * Exception thrown when a symbol catalog cannot be loaded or is incomplete.
 */
public class SymbolCatalogException extends RuntimeException {

	public SymbolCatalogException(String message) {
		super(message);
	}

	public SymbolCatalogException(String message, Throwable cause) {
		super(message, cause);
	}
}
