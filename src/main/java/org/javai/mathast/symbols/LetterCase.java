package org.javai.mathast.symbols;

/**
 * Letter case for symbols that exist in both forms.
 */
public enum LetterCase {
	LOWERCASE,
	UPPERCASE
}
