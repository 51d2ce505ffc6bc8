package org.javai.mathast.ast;

/**
 * Where an operator is conventionally written relative to its operands.
 */
public enum Fixity {
	PREFIX,
	INFIX,
	POSTFIX
}
