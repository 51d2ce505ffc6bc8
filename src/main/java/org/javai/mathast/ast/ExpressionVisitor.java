package org.javai.mathast.ast;

import org.javai.mathast.ast.Expression.BinaryOp;
import org.javai.mathast.ast.Expression.Call;
import org.javai.mathast.ast.Expression.DecimalLiteral;
import org.javai.mathast.ast.Expression.IntegerLiteral;
import org.javai.mathast.ast.Expression.OpaqueSymbol;
import org.javai.mathast.ast.Expression.UnaryOp;
import org.javai.mathast.ast.Expression.Variable;

/**
 * Visitor over the {@link Expression} variants.
 * <p>
 * Binary and unary nodes are dispatched a second time on their operator: each
 * operator has its own case ({@link #visitAdd}, {@link #visitNegate}, ...) which by
 * default falls back to {@link #visitBinaryOperation} or {@link #visitUnaryOperation}.
 * Implementations override only the operator cases they treat differently.
 * <p>
 * A visitor handles a single node; use {@link ExpressionWalker} to apply it to a
 * whole tree.
 *
 * @param <R> the result type of the visitor
 */
public interface ExpressionVisitor<R> {

	R visitInteger(IntegerLiteral node);

	R visitDecimal(DecimalLiteral node);

	R visitVariable(Variable node);

	R visitSymbol(OpaqueSymbol node);

	/**
	 * Visits a function application. Arguments are available in source order.
	 */
	R visitCall(Call node);

	/**
	 * Fallback for every binary operator case that is not overridden.
	 */
	R visitBinaryOperation(BinaryOp node);

	/**
	 * Fallback for every unary operator case that is not overridden.
	 */
	R visitUnaryOperation(UnaryOp node);

	/**
	 * Routes a binary node to its operator case.
	 */
	default R visitBinary(BinaryOp node) {
		return switch (node.operator()) {
			case ADD -> visitAdd(node);
			case SUBTRACT -> visitSubtract(node);
			case MULTIPLY -> visitMultiply(node);
			case DIVIDE -> visitDivide(node);
			case POWER -> visitPower(node);
			case LOGARITHM -> visitLogarithm(node);
			case MODULO -> visitModulo(node);
			case LE -> visitLessOrEqual(node);
			case GE -> visitGreaterOrEqual(node);
			case LT -> visitLessThan(node);
			case GT -> visitGreaterThan(node);
			case EQ -> visitEquals(node);
			case NEQ -> visitNotEquals(node);
			case APPROX -> visitApprox(node);
			case SUBSET -> visitSubset(node);
			case PROPER_SUBSET -> visitProperSubset(node);
			case AND -> visitAnd(node);
			case OR -> visitOr(node);
			case XOR -> visitXor(node);
			case IMPLIES -> visitImplies(node);
		};
	}

	/**
	 * Routes a unary node to its operator case.
	 */
	default R visitUnary(UnaryOp node) {
		return switch (node.operator()) {
			case NEGATE -> visitNegate(node);
			case IDENTITY -> visitIdentity(node);
			case NOT -> visitNot(node);
		};
	}

	default R visitAdd(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitSubtract(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitMultiply(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitDivide(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitPower(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	/**
	 * Left is the base, right the argument.
	 */
	default R visitLogarithm(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitModulo(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitLessOrEqual(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitGreaterOrEqual(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitLessThan(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitGreaterThan(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitEquals(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitNotEquals(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitApprox(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitSubset(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitProperSubset(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitAnd(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitOr(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitXor(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	/**
	 * Operands may be propositions or whole equations; the visitor decides which.
	 */
	default R visitImplies(BinaryOp node) {
		return visitBinaryOperation(node);
	}

	default R visitNegate(UnaryOp node) {
		return visitUnaryOperation(node);
	}

	default R visitIdentity(UnaryOp node) {
		return visitUnaryOperation(node);
	}

	default R visitNot(UnaryOp node) {
		return visitUnaryOperation(node);
	}
}
