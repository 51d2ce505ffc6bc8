package org.javai.mathast.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.javai.mathast.ast.Expression.BinaryOp;
import org.javai.mathast.ast.Expression.Call;
import org.javai.mathast.ast.Expression.DecimalLiteral;
import org.javai.mathast.ast.Expression.IntegerLiteral;
import org.javai.mathast.ast.Expression.OpaqueSymbol;
import org.javai.mathast.ast.Expression.UnaryOp;
import org.javai.mathast.ast.Expression.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces new trees from existing ones. This is the only way to "modify" an expression:
 * the input tree is never touched, so any reference held to it, or to one of its
 * subtrees, keeps seeing the same value.
 * <p>
 * A rebuild works bottom-up. Each node is first re-created with its already rebuilt
 * children, then handed to the mapping, and whatever the mapping returns takes the
 * node's place in the parent. Nodes whose children did not change are reused rather
 * than copied.
 */
public final class ExpressionRebuilder {

	private static final Logger logger = LoggerFactory.getLogger(ExpressionRebuilder.class);

	private ExpressionRebuilder() {
		// Utility class - no instantiation
	}

	/**
	 * Rebuilds the tree, letting the mapping substitute any node.
	 *
	 * @param root the tree to transform
	 * @param mapping called once per node, children first; must not return null
	 * @return the transformed tree
	 */
	public static Expression rebuild(Expression root, UnaryOperator<Expression> mapping) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(mapping, "mapping must not be null");
		MappingFolder folder = new MappingFolder(mapping, false);
		Expression result = ExpressionWalker.fold(root, folder);
		if (logger.isDebugEnabled()) {
			logger.debug("Rebuilt expression: {} node(s) visited, {} substitution(s)",
					folder.visited, folder.substitutions);
		}
		return result;
	}

	/**
	 * A structurally equal copy in which every node is a new instance.
	 */
	public static Expression copy(Expression root) {
		Objects.requireNonNull(root, "root must not be null");
		return ExpressionWalker.fold(root, new MappingFolder(UnaryOperator.identity(), true));
	}

	/**
	 * Replaces every subtree equal to {@code target} with {@code replacement}.
	 */
	public static Expression replace(Expression root, Expression target, Expression replacement) {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(replacement, "replacement must not be null");
		return rebuild(root, node -> node.equals(target) ? replacement : node);
	}

	private static final class MappingFolder implements ExpressionFolder<Expression> {

		private final UnaryOperator<Expression> mapping;
		private final boolean alwaysCopy;
		private int visited;
		private int substitutions;

		private MappingFolder(UnaryOperator<Expression> mapping, boolean alwaysCopy) {
			this.mapping = mapping;
			this.alwaysCopy = alwaysCopy;
		}

		@Override
		public Expression foldInteger(IntegerLiteral node) {
			return map(alwaysCopy ? new IntegerLiteral(node.value()) : node);
		}

		@Override
		public Expression foldDecimal(DecimalLiteral node) {
			return map(alwaysCopy ? new DecimalLiteral(node.value()) : node);
		}

		@Override
		public Expression foldVariable(Variable node) {
			return map(alwaysCopy ? new Variable(node.name()) : node);
		}

		@Override
		public Expression foldSymbol(OpaqueSymbol node) {
			return map(alwaysCopy ? new OpaqueSymbol(node.tag()) : node);
		}

		@Override
		public Expression foldBinary(BinaryOp node, Expression left, Expression right) {
			boolean unchanged = left == node.left() && right == node.right();
			return map(unchanged && !alwaysCopy ? node : new BinaryOp(node.operator(), left, right));
		}

		@Override
		public Expression foldUnary(UnaryOp node, Expression operand) {
			boolean unchanged = operand == node.operand();
			return map(unchanged && !alwaysCopy ? node : new UnaryOp(node.operator(), operand));
		}

		@Override
		public Expression foldCall(Call node, List<Expression> arguments) {
			boolean unchanged = true;
			for (int i = 0; i < arguments.size(); i++) {
				if (arguments.get(i) != node.arguments().get(i)) {
					unchanged = false;
					break;
				}
			}
			return map(unchanged && !alwaysCopy ? node : new Call(node.function(), new ArrayList<>(arguments)));
		}

		private Expression map(Expression node) {
			visited++;
			Expression mapped = mapping.apply(node);
			if (mapped == null) {
				throw new NullPointerException("Rebuild mapping returned null for " + node);
			}
			if (mapped != node) {
				substitutions++;
			}
			return mapped;
		}
	}
}
