package org.javai.mathast.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.javai.mathast.ast.Expression.BinaryOp;
import org.javai.mathast.ast.Expression.Call;
import org.javai.mathast.ast.Expression.DecimalLiteral;
import org.javai.mathast.ast.Expression.IntegerLiteral;
import org.javai.mathast.ast.Expression.OpaqueSymbol;
import org.javai.mathast.ast.Expression.UnaryOp;
import org.javai.mathast.ast.Expression.Variable;

/**
 * Factory methods for building expression trees, one family per variant.
 * <p>
 * This is the entry point for parsers and for anything that restores trees from a
 * stored form: every method validates its input and fails with an
 * {@link ExpressionException} rather than producing a malformed node.
 * <ul>
 *   <li>{@link ArityException} - an operator given the wrong number of children</li>
 *   <li>{@link UnknownOperatorException} - a tag outside the supported set</li>
 *   <li>{@link MalformedLiteralException} - a value that cannot be represented</li>
 * </ul>
 */
public final class Expressions {

	private Expressions() {
		// Utility class - no instantiation
	}

	public static IntegerLiteral integer(long value) {
		return new IntegerLiteral(BigInteger.valueOf(value));
	}

	public static IntegerLiteral integer(BigInteger value) {
		return new IntegerLiteral(value);
	}

	/**
	 * Parses a base-10 integer such as {@code "-42"}.
	 *
	 * @throws MalformedLiteralException if the text is not an integer
	 */
	public static IntegerLiteral integer(String text) {
		Objects.requireNonNull(text, "text must not be null");
		try {
			return new IntegerLiteral(new BigInteger(text.trim()));
		}
		catch (NumberFormatException e) {
			throw new MalformedLiteralException("Not an integer literal: '" + text + "'", e);
		}
	}

	/**
	 * @throws MalformedLiteralException if the value is NaN or infinite
	 */
	public static DecimalLiteral decimal(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new MalformedLiteralException("Decimal literal must be finite but was " + value);
		}
		return new DecimalLiteral(BigDecimal.valueOf(value));
	}

	public static DecimalLiteral decimal(BigDecimal value) {
		return new DecimalLiteral(value);
	}

	/**
	 * Parses decimal text such as {@code "3.14"}. The scale of the text is kept.
	 *
	 * @throws MalformedLiteralException if the text is not a finite decimal number
	 */
	public static DecimalLiteral decimal(String text) {
		Objects.requireNonNull(text, "text must not be null");
		try {
			return new DecimalLiteral(new BigDecimal(text.trim()));
		}
		catch (NumberFormatException | ArithmeticException e) {
			throw new MalformedLiteralException("Not a finite decimal literal: '" + text + "'", e);
		}
	}

	public static Variable variable(String name) {
		return new Variable(name);
	}

	/**
	 * A subscripted variable, e.g. {@code subscripted("x", "1")} is {@code x_1}.
	 * Multi-character subscripts are braced: {@code x_{max}}.
	 */
	public static Variable subscripted(String base, String subscript) {
		Objects.requireNonNull(base, "base must not be null");
		Objects.requireNonNull(subscript, "subscript must not be null");
		if (base.isBlank() || subscript.isBlank()) {
			throw new MalformedLiteralException("Subscripted variable needs a base and a subscript");
		}
		String suffix = subscript.length() == 1 ? subscript : "{" + subscript + "}";
		return new Variable(base + "_" + suffix);
	}

	public static OpaqueSymbol symbol(SymbolTag tag) {
		return new OpaqueSymbol(tag);
	}

	/**
	 * @throws UnknownOperatorException if the tag names no known symbol
	 */
	public static OpaqueSymbol symbol(String tag) {
		return new OpaqueSymbol(SymbolTag.fromTag(tag));
	}

	public static BinaryOp binary(BinaryOpKind operator, Expression left, Expression right) {
		return new BinaryOp(operator, left, right);
	}

	/**
	 * Builds a binary node from a child sequence, which must hold exactly two children in
	 * left, right order.
	 *
	 * @throws ArityException if the sequence does not hold exactly two children
	 */
	public static BinaryOp binary(BinaryOpKind operator, List<Expression> children) {
		if (operator == null) {
			throw new UnknownOperatorException("binary operator", null);
		}
		Objects.requireNonNull(children, "children must not be null");
		if (children.size() != 2) {
			throw new ArityException(operator.tag(), 2, children.size());
		}
		return new BinaryOp(operator, children.get(0), children.get(1));
	}

	/**
	 * Builds a binary node from an operator tag such as {@code "subtract"}.
	 *
	 * @throws UnknownOperatorException if the tag is not a binary operator
	 * @throws ArityException if the sequence does not hold exactly two children
	 */
	public static BinaryOp binary(String tag, List<Expression> children) {
		return binary(BinaryOpKind.fromTag(tag), children);
	}

	public static UnaryOp unary(UnaryOpKind operator, Expression operand) {
		return new UnaryOp(operator, operand);
	}

	/**
	 * @throws ArityException if the sequence does not hold exactly one child
	 */
	public static UnaryOp unary(UnaryOpKind operator, List<Expression> children) {
		if (operator == null) {
			throw new UnknownOperatorException("unary operator", null);
		}
		Objects.requireNonNull(children, "children must not be null");
		if (children.size() != 1) {
			throw new ArityException(operator.tag(), 1, children.size());
		}
		return new UnaryOp(operator, children.get(0));
	}

	/**
	 * @throws UnknownOperatorException if the tag is not a unary operator
	 * @throws ArityException if the sequence does not hold exactly one child
	 */
	public static UnaryOp unary(String tag, List<Expression> children) {
		return unary(UnaryOpKind.fromTag(tag), children);
	}

	public static Call call(String function, Expression... arguments) {
		Objects.requireNonNull(arguments, "arguments must not be null");
		return new Call(function, Arrays.asList(arguments));
	}

	public static Call call(String function, List<Expression> arguments) {
		return new Call(function, arguments);
	}

	public static BinaryOp add(Expression left, Expression right) {
		return new BinaryOp(BinaryOpKind.ADD, left, right);
	}

	public static BinaryOp subtract(Expression left, Expression right) {
		return new BinaryOp(BinaryOpKind.SUBTRACT, left, right);
	}

	public static BinaryOp multiply(Expression left, Expression right) {
		return new BinaryOp(BinaryOpKind.MULTIPLY, left, right);
	}

	public static BinaryOp divide(Expression numerator, Expression denominator) {
		return new BinaryOp(BinaryOpKind.DIVIDE, numerator, denominator);
	}

	public static BinaryOp power(Expression base, Expression exponent) {
		return new BinaryOp(BinaryOpKind.POWER, base, exponent);
	}

	public static BinaryOp log(Expression base, Expression argument) {
		return new BinaryOp(BinaryOpKind.LOGARITHM, base, argument);
	}

	public static BinaryOp equalTo(Expression left, Expression right) {
		return new BinaryOp(BinaryOpKind.EQ, left, right);
	}

	public static BinaryOp implies(Expression premise, Expression conclusion) {
		return new BinaryOp(BinaryOpKind.IMPLIES, premise, conclusion);
	}

	public static UnaryOp negate(Expression operand) {
		return new UnaryOp(UnaryOpKind.NEGATE, operand);
	}

	public static UnaryOp not(Expression operand) {
		return new UnaryOp(UnaryOpKind.NOT, operand);
	}
}
