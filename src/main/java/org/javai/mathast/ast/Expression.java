package org.javai.mathast.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node in a mathematical expression tree. Sealed so that every consumer can
 * handle the full set of variants:
 * <ul>
 *   <li>{@link IntegerLiteral}, {@link DecimalLiteral}, {@link Variable} and
 *   {@link OpaqueSymbol} - leaves</li>
 *   <li>{@link BinaryOp} - exactly two ordered children</li>
 *   <li>{@link UnaryOp} - exactly one child</li>
 *   <li>{@link Call} - a function name applied to zero or more ordered arguments</li>
 * </ul>
 * Nodes are immutable. Equality and hashing are structural. Operator and call nodes
 * compute their hash once at construction, and equality never recurses, so very deep
 * trees are safe to compare, hash and use as map keys.
 */
public sealed interface Expression {

	/**
	 * The children of this node in traversal order. Leaves return an empty list.
	 */
	List<Expression> children();

	/**
	 * Creates a node of the same variant and tag/value with the given children.
	 *
	 * @throws ArityException if the number of children does not fit this variant
	 */
	Expression withChildren(List<Expression> children);

	/**
	 * Dispatches this node, and only this node, to the matching visitor case.
	 */
	<R> R accept(ExpressionVisitor<R> visitor);

	/**
	 * True for the variants that can never have children.
	 */
	default boolean isLeaf() {
		return false;
	}

	/**
	 * An exact, arbitrary-precision integer.
	 *
	 * @param value the integer value
	 */
	record IntegerLiteral(BigInteger value) implements Expression {

		public IntegerLiteral {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public List<Expression> children() {
			return List.of();
		}

		@Override
		public Expression withChildren(List<Expression> children) {
			requireNoChildren("integer", children);
			return new IntegerLiteral(value);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitInteger(this);
		}

		@Override
		public boolean isLeaf() {
			return true;
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof Expression expression && StructuralEquality.equal(this, expression);
		}

		@Override
		public int hashCode() {
			return StructuralEquality.leafHash(this);
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	/**
	 * A finite decimal. The scale is kept, so {@code 2.50} and {@code 2.5} are different
	 * literals, and a decimal never equals an {@link IntegerLiteral}.
	 *
	 * @param value the decimal value
	 */
	record DecimalLiteral(BigDecimal value) implements Expression {

		public DecimalLiteral {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public List<Expression> children() {
			return List.of();
		}

		@Override
		public Expression withChildren(List<Expression> children) {
			requireNoChildren("decimal", children);
			return new DecimalLiteral(value);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitDecimal(this);
		}

		@Override
		public boolean isLeaf() {
			return true;
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof Expression expression && StructuralEquality.equal(this, expression);
		}

		@Override
		public int hashCode() {
			return StructuralEquality.leafHash(this);
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	/**
	 * A named variable such as {@code x}, {@code θ} or {@code x_1}. Two variables are the
	 * same variable exactly when their names are equal strings.
	 *
	 * @param name the identifier, never blank
	 */
	record Variable(String name) implements Expression {

		public Variable {
			Objects.requireNonNull(name, "name must not be null");
			if (name.isBlank()) {
				throw new MalformedLiteralException("Variable name must not be blank");
			}
		}

		/**
		 * The name without its subscript: {@code x} for {@code x_1}.
		 */
		public String baseName() {
			int underscore = name.indexOf('_');
			return underscore > 0 ? name.substring(0, underscore) : name;
		}

		/**
		 * The subscript, if the name has one. Braces around the subscript are removed,
		 * so both {@code x_1} and {@code x_{1}} yield {@code 1}.
		 */
		public Optional<String> subscript() {
			int underscore = name.indexOf('_');
			if (underscore <= 0 || underscore == name.length() - 1) {
				return Optional.empty();
			}
			String subscript = name.substring(underscore + 1);
			if (subscript.length() > 1 && subscript.startsWith("{") && subscript.endsWith("}")) {
				subscript = subscript.substring(1, subscript.length() - 1);
			}
			return subscript.isEmpty() ? Optional.empty() : Optional.of(subscript);
		}

		@Override
		public List<Expression> children() {
			return List.of();
		}

		@Override
		public Expression withChildren(List<Expression> children) {
			requireNoChildren("variable", children);
			return new Variable(name);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitVariable(this);
		}

		@Override
		public boolean isLeaf() {
			return true;
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof Expression expression && StructuralEquality.equal(this, expression);
		}

		@Override
		public int hashCode() {
			return StructuralEquality.leafHash(this);
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	/**
	 * A non-variable symbol such as infinity or an ellipsis.
	 *
	 * @param tag which symbol this is
	 */
	record OpaqueSymbol(SymbolTag tag) implements Expression {

		public OpaqueSymbol {
			if (tag == null) {
				throw new UnknownOperatorException("symbol", null);
			}
		}

		@Override
		public List<Expression> children() {
			return List.of();
		}

		@Override
		public Expression withChildren(List<Expression> children) {
			requireNoChildren("symbol", children);
			return new OpaqueSymbol(tag);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitSymbol(this);
		}

		@Override
		public boolean isLeaf() {
			return true;
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof Expression expression && StructuralEquality.equal(this, expression);
		}

		@Override
		public int hashCode() {
			return StructuralEquality.leafHash(this);
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	/**
	 * A binary operation. Left and right are fixed roles, never reordered.
	 * <p>
	 * The structural hash is computed once, from the children's cached hashes.
	 */
	final class BinaryOp implements Expression {

		private final BinaryOpKind operator;
		private final Expression left;
		private final Expression right;
		private final int hash;

		/**
		 * @param operator the operator
		 * @param left the left operand (the base, for {@link BinaryOpKind#LOGARITHM})
		 * @param right the right operand
		 */
		public BinaryOp(BinaryOpKind operator, Expression left, Expression right) {
			if (operator == null) {
				throw new UnknownOperatorException("binary operator", null);
			}
			this.operator = operator;
			this.left = Objects.requireNonNull(left, "left must not be null");
			this.right = Objects.requireNonNull(right, "right must not be null");
			this.hash = StructuralEquality.binaryHash(operator, left.hashCode(), right.hashCode());
		}

		public BinaryOpKind operator() {
			return operator;
		}

		public Expression left() {
			return left;
		}

		public Expression right() {
			return right;
		}

		@Override
		public List<Expression> children() {
			return List.of(left, right);
		}

		@Override
		public Expression withChildren(List<Expression> children) {
			Objects.requireNonNull(children, "children must not be null");
			if (children.size() != 2) {
				throw new ArityException(operator.tag(), 2, children.size());
			}
			return new BinaryOp(operator, children.get(0), children.get(1));
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitBinary(this);
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof Expression expression && StructuralEquality.equal(this, expression);
		}

		@Override
		public int hashCode() {
			return hash;
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	/**
	 * A unary operation.
	 */
	final class UnaryOp implements Expression {

		private final UnaryOpKind operator;
		private final Expression operand;
		private final int hash;

		/**
		 * @param operator the operator
		 * @param operand the single operand
		 */
		public UnaryOp(UnaryOpKind operator, Expression operand) {
			if (operator == null) {
				throw new UnknownOperatorException("unary operator", null);
			}
			this.operator = operator;
			this.operand = Objects.requireNonNull(operand, "operand must not be null");
			this.hash = StructuralEquality.unaryHash(operator, operand.hashCode());
		}

		public UnaryOpKind operator() {
			return operator;
		}

		public Expression operand() {
			return operand;
		}

		@Override
		public List<Expression> children() {
			return List.of(operand);
		}

		@Override
		public Expression withChildren(List<Expression> children) {
			Objects.requireNonNull(children, "children must not be null");
			if (children.size() != 1) {
				throw new ArityException(operator.tag(), 1, children.size());
			}
			return new UnaryOp(operator, children.get(0));
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitUnary(this);
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof Expression expression && StructuralEquality.equal(this, expression);
		}

		@Override
		public int hashCode() {
			return hash;
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	/**
	 * A function application. The number of arguments is not checked against the
	 * function; that belongs to whoever knows the function's signature.
	 */
	final class Call implements Expression {

		private final String function;
		private final List<Expression> arguments;
		private final int hash;

		/**
		 * @param function the function name, never blank
		 * @param arguments the arguments in source order, possibly empty
		 */
		public Call(String function, List<Expression> arguments) {
			Objects.requireNonNull(function, "function must not be null");
			if (function.isBlank()) {
				throw new MalformedLiteralException("Function name must not be blank");
			}
			Objects.requireNonNull(arguments, "arguments must not be null");
			this.function = function;
			this.arguments = List.copyOf(arguments);
			this.hash = StructuralEquality.callHash(function, this.arguments);
		}

		public String function() {
			return function;
		}

		public List<Expression> arguments() {
			return arguments;
		}

		@Override
		public List<Expression> children() {
			return arguments;
		}

		@Override
		public Expression withChildren(List<Expression> children) {
			return new Call(function, children);
		}

		@Override
		public <R> R accept(ExpressionVisitor<R> visitor) {
			return visitor.visitCall(this);
		}

		@Override
		public boolean equals(Object other) {
			return other instanceof Expression expression && StructuralEquality.equal(this, expression);
		}

		@Override
		public int hashCode() {
			return hash;
		}

		@Override
		public String toString() {
			return ExpressionPrinter.printCompact(this);
		}
	}

	private static void requireNoChildren(String variant, List<Expression> children) {
		Objects.requireNonNull(children, "children must not be null");
		if (!children.isEmpty()) {
			throw new ArityException(variant, 0, children.size());
		}
	}
}
