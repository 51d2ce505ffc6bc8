package org.javai.mathast.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of binary operators.
 * <p>
 * Operand order matters for every operator that is not {@link #commutative()}.
 * For {@link #LOGARITHM} the left operand is the base and the right operand the argument.
 * {@link #IMPLIES} is used both for logical implication and as an arrow between two
 * equations; consumers decide which reading applies from the operands.
 */
public enum BinaryOpKind {

	ADD("add", OperatorCategory.ARITHMETIC, true),
	SUBTRACT("subtract", OperatorCategory.ARITHMETIC, false),
	MULTIPLY("multiply", OperatorCategory.ARITHMETIC, true),
	DIVIDE("divide", OperatorCategory.ARITHMETIC, false),
	POWER("power", OperatorCategory.ARITHMETIC, false),
	LOGARITHM("logarithm", OperatorCategory.ARITHMETIC, false, Fixity.PREFIX),
	MODULO("modulo", OperatorCategory.ARITHMETIC, false),
	LE("le", OperatorCategory.COMPARISON, false),
	GE("ge", OperatorCategory.COMPARISON, false),
	LT("lt", OperatorCategory.COMPARISON, false),
	GT("gt", OperatorCategory.COMPARISON, false),
	EQ("eq", OperatorCategory.COMPARISON, true),
	NEQ("neq", OperatorCategory.COMPARISON, true),
	APPROX("approx", OperatorCategory.COMPARISON, true),
	SUBSET("subset", OperatorCategory.SET_RELATION, false),
	PROPER_SUBSET("proper-subset", OperatorCategory.SET_RELATION, false),
	AND("and", OperatorCategory.LOGICAL, true),
	OR("or", OperatorCategory.LOGICAL, true),
	XOR("xor", OperatorCategory.LOGICAL, true),
	IMPLIES("implies", OperatorCategory.LOGICAL, false);

	private static final Map<String, BinaryOpKind> BY_TAG;

	static {
		Map<String, BinaryOpKind> byTag = new LinkedHashMap<>();
		for (BinaryOpKind kind : values()) {
			byTag.put(kind.tag, kind);
		}
		BY_TAG = Collections.unmodifiableMap(byTag);
	}

	private final String tag;
	private final OperatorCategory category;
	private final boolean commutative;
	private final Fixity fixity;

	BinaryOpKind(String tag, OperatorCategory category, boolean commutative) {
		this(tag, category, commutative, Fixity.INFIX);
	}

	BinaryOpKind(String tag, OperatorCategory category, boolean commutative, Fixity fixity) {
		this.tag = tag;
		this.category = category;
		this.commutative = commutative;
		this.fixity = fixity;
	}

	/**
	 * Resolves a tag such as {@code "add"} or {@code "proper-subset"}.
	 * Lookup ignores case and treats {@code '_'} as {@code '-'}.
	 *
	 * @throws UnknownOperatorException if the tag is null or not in the closed set
	 */
	public static BinaryOpKind fromTag(String tag) {
		if (tag == null) {
			throw new UnknownOperatorException("binary operator", null);
		}
		BinaryOpKind kind = BY_TAG.get(tag.trim().toLowerCase(Locale.ROOT).replace('_', '-'));
		if (kind == null) {
			throw new UnknownOperatorException("binary operator", tag);
		}
		return kind;
	}

	public String tag() {
		return tag;
	}

	public OperatorCategory category() {
		return category;
	}

	public boolean commutative() {
		return commutative;
	}

	public Fixity fixity() {
		return fixity;
	}
}
