package org.javai.mathast.ast;

import java.util.ArrayDeque;
import java.util.Deque;
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
 * Structural equality and hashing for expression trees.
 * <p>
 * Two trees are equal when they have the same variant, the same tag or value, and
 * pairwise equal children in the same order. {@link #hash(Expression)} is consistent
 * with {@link #equal(Expression, Expression)}. Operator and call nodes combine the
 * hashes their children already hold, so hashing any node is constant time. Equality
 * does not recurse and rejects pairs whose hashes differ without descending.
 */
public final class StructuralEquality {

	private static final int INTEGER_SEED = "IntegerLiteral".hashCode();
	private static final int DECIMAL_SEED = "DecimalLiteral".hashCode();
	private static final int VARIABLE_SEED = "Variable".hashCode();
	private static final int SYMBOL_SEED = "OpaqueSymbol".hashCode();
	private static final int BINARY_SEED = "BinaryOp".hashCode();
	private static final int UNARY_SEED = "UnaryOp".hashCode();
	private static final int CALL_SEED = "Call".hashCode();

	private StructuralEquality() {
		// Utility class - no instantiation
	}

	/**
	 * Structural equality of two trees. Either argument may be null; two nulls are equal.
	 */
	public static boolean equal(Expression first, Expression second) {
		if (first == second) {
			return true;
		}
		if (first == null || second == null) {
			return false;
		}
		Deque<Expression> lefts = new ArrayDeque<>();
		Deque<Expression> rights = new ArrayDeque<>();
		lefts.push(first);
		rights.push(second);
		while (!lefts.isEmpty()) {
			Expression left = lefts.pop();
			Expression right = rights.pop();
			if (left == right) {
				continue;
			}
			if (left.hashCode() != right.hashCode() || !sameHead(left, right)) {
				return false;
			}
			List<Expression> leftChildren = left.children();
			List<Expression> rightChildren = right.children();
			for (int i = 0; i < leftChildren.size(); i++) {
				lefts.push(leftChildren.get(i));
				rights.push(rightChildren.get(i));
			}
		}
		return true;
	}

	/**
	 * Structural hash: equal trees always produce the same value.
	 */
	public static int hash(Expression expression) {
		Objects.requireNonNull(expression, "expression must not be null");
		return expression.hashCode();
	}

	static int binaryHash(BinaryOpKind operator, int leftHash, int rightHash) {
		return (31 * (31 * BINARY_SEED + operator.ordinal()) + leftHash) * 31 + rightHash;
	}

	static int unaryHash(UnaryOpKind operator, int operandHash) {
		return 31 * (31 * UNARY_SEED + operator.ordinal()) + operandHash;
	}

	static int callHash(String function, List<Expression> arguments) {
		int hash = 31 * CALL_SEED + function.hashCode();
		for (Expression argument : arguments) {
			hash = 31 * hash + argument.hashCode();
		}
		return hash;
	}

	static int leafHash(Expression leaf) {
		if (leaf instanceof IntegerLiteral integer) {
			return 31 * INTEGER_SEED + integer.value().hashCode();
		}
		if (leaf instanceof DecimalLiteral decimal) {
			return 31 * DECIMAL_SEED + decimal.value().hashCode();
		}
		if (leaf instanceof Variable variable) {
			return 31 * VARIABLE_SEED + variable.name().hashCode();
		}
		if (leaf instanceof OpaqueSymbol symbol) {
			return 31 * SYMBOL_SEED + symbol.tag().ordinal();
		}
		throw new IllegalStateException("Not a leaf: " + leaf.getClass().getName());
	}

	/**
	 * Compares variant, tag or value, and child count, ignoring the children themselves.
	 */
	private static boolean sameHead(Expression left, Expression right) {
		if (left.getClass() != right.getClass()) {
			return false;
		}
		if (left instanceof IntegerLiteral integer) {
			return integer.value().equals(((IntegerLiteral) right).value());
		}
		if (left instanceof DecimalLiteral decimal) {
			return decimal.value().equals(((DecimalLiteral) right).value());
		}
		if (left instanceof Variable variable) {
			return variable.name().equals(((Variable) right).name());
		}
		if (left instanceof OpaqueSymbol symbol) {
			return symbol.tag() == ((OpaqueSymbol) right).tag();
		}
		if (left instanceof BinaryOp binary) {
			return binary.operator() == ((BinaryOp) right).operator();
		}
		if (left instanceof UnaryOp unary) {
			return unary.operator() == ((UnaryOp) right).operator();
		}
		if (left instanceof Call call) {
			Call other = (Call) right;
			return call.function().equals(other.function())
					&& call.arguments().size() == other.arguments().size();
		}
		throw new IllegalStateException("Unexpected expression type: " + left.getClass().getName());
	}
}
