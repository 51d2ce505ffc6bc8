package org.javai.mathast.ast;

import java.util.Locale;

/**
 * The closed set of unary operators.
 */
public enum UnaryOpKind {

	/** Arithmetic negation, {@code -x}. */
	NEGATE("negate"),
	/** Unary plus, {@code +x}. */
	IDENTITY("identity"),
	/** Logical negation. */
	NOT("not");

	private final String tag;

	UnaryOpKind(String tag) {
		this.tag = tag;
	}

	/**
	 * Resolves a tag. Besides the canonical names this accepts {@code -}, {@code +},
	 * {@code !} and {@code ¬}.
	 *
	 * @throws UnknownOperatorException if the tag is null or not recognised
	 */
	public static UnaryOpKind fromTag(String tag) {
		if (tag == null) {
			throw new UnknownOperatorException("unary operator", null);
		}
		return switch (tag.trim().toLowerCase(Locale.ROOT)) {
			case "negate", "-" -> NEGATE;
			case "identity", "+" -> IDENTITY;
			case "not", "!", "¬" -> NOT;
			default -> throw new UnknownOperatorException("unary operator", tag);
		};
	}

	public String tag() {
		return tag;
	}
}
