package org.javai.mathast.ast;

/**
 * Broad family a binary operator belongs to.
 */
public enum OperatorCategory {
	ARITHMETIC,
	COMPARISON,
	SET_RELATION,
	LOGICAL
}
