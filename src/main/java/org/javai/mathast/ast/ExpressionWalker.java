package org.javai.mathast.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
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
 * Utility class for walking expression trees.
 * <p>
 * Every walk uses an explicit work stack rather than recursion, so trees of any depth
 * can be traversed. Children are always visited in their stored order: left before
 * right for binary nodes, source order for call arguments.
 */
public final class ExpressionWalker {

	private ExpressionWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Callback for depth-aware pre-order walks.
	 */
	@FunctionalInterface
	public interface NodeCallback {

		/**
		 * @param node the node being entered
		 * @param depth nesting depth, 0 for the root
		 */
		void accept(Expression node, int depth);
	}

	/**
	 * Visits every node with the visitor, children before the node that owns them.
	 *
	 * @return the result of visiting the root
	 */
	public static <R> R walkPostOrder(Expression root, ExpressionVisitor<R> visitor) {
		Objects.requireNonNull(visitor, "visitor must not be null");
		R result = null;
		for (Expression node : postOrder(root)) {
			result = node.accept(visitor);
		}
		return result;
	}

	/**
	 * Visits every node with the visitor, each node before its children.
	 *
	 * @return the result of visiting the root
	 */
	public static <R> R walkPreOrder(Expression root, ExpressionVisitor<R> visitor) {
		Objects.requireNonNull(visitor, "visitor must not be null");
		List<Expression> nodes = preOrder(root);
		R rootResult = nodes.get(0).accept(visitor);
		for (int i = 1; i < nodes.size(); i++) {
			nodes.get(i).accept(visitor);
		}
		return rootResult;
	}

	/**
	 * Walks in pre-order, reporting each node together with its nesting depth.
	 */
	public static void forEachPreOrder(Expression root, NodeCallback callback) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(callback, "callback must not be null");
		Deque<Expression> nodes = new ArrayDeque<>();
		Deque<Integer> depths = new ArrayDeque<>();
		nodes.push(root);
		depths.push(0);
		while (!nodes.isEmpty()) {
			Expression node = nodes.pop();
			int depth = depths.pop();
			callback.accept(node, depth);
			List<Expression> children = node.children();
			for (int i = children.size() - 1; i >= 0; i--) {
				nodes.push(children.get(i));
				depths.push(depth + 1);
			}
		}
	}

	/**
	 * All nodes of the tree, each node before its children.
	 */
	public static List<Expression> preOrder(Expression root) {
		List<Expression> order = new ArrayList<>();
		forEachPreOrder(root, (node, depth) -> order.add(node));
		return Collections.unmodifiableList(order);
	}

	/**
	 * All nodes of the tree, children before the node that owns them.
	 */
	public static List<Expression> postOrder(Expression root) {
		Objects.requireNonNull(root, "root must not be null");
		List<Expression> order = new ArrayList<>();
		Deque<Frame> stack = new ArrayDeque<>();
		stack.push(new Frame(root));
		while (!stack.isEmpty()) {
			Frame frame = stack.peek();
			if (frame.hasNextChild()) {
				stack.push(new Frame(frame.nextChild()));
				continue;
			}
			stack.pop();
			order.add(frame.node);
		}
		return Collections.unmodifiableList(order);
	}

	/**
	 * Folds the tree bottom-up: every node is folded once, after all of its children.
	 *
	 * @return the folded result of the root
	 */
	public static <R> R fold(Expression root, ExpressionFolder<R> folder) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(folder, "folder must not be null");
		// results may legitimately be null, so they live in a list rather than a deque
		List<R> results = new ArrayList<>();
		Deque<Frame> stack = new ArrayDeque<>();
		stack.push(new Frame(root));
		while (!stack.isEmpty()) {
			Frame frame = stack.peek();
			if (frame.hasNextChild()) {
				stack.push(new Frame(frame.nextChild()));
				continue;
			}
			stack.pop();
			int arity = frame.children.size();
			List<R> tail = results.subList(results.size() - arity, results.size());
			List<R> childResults = new ArrayList<>(tail);
			tail.clear();
			results.add(foldNode(frame.node, childResults, folder));
		}
		return results.get(0);
	}

	private static <R> R foldNode(Expression node, List<R> childResults, ExpressionFolder<R> folder) {
		if (node instanceof IntegerLiteral integer) {
			return folder.foldInteger(integer);
		}
		if (node instanceof DecimalLiteral decimal) {
			return folder.foldDecimal(decimal);
		}
		if (node instanceof Variable variable) {
			return folder.foldVariable(variable);
		}
		if (node instanceof OpaqueSymbol symbol) {
			return folder.foldSymbol(symbol);
		}
		if (node instanceof BinaryOp binary) {
			return folder.foldBinary(binary, childResults.get(0), childResults.get(1));
		}
		if (node instanceof UnaryOp unary) {
			return folder.foldUnary(unary, childResults.get(0));
		}
		if (node instanceof Call call) {
			return folder.foldCall(call, Collections.unmodifiableList(childResults));
		}
		throw new IllegalStateException("Unexpected expression type: " + node.getClass().getName());
	}

	private static final class Frame {

		private final Expression node;
		private final List<Expression> children;
		private int next;

		private Frame(Expression node) {
			this.node = node;
			this.children = node.children();
		}

		private boolean hasNextChild() {
			return next < children.size();
		}

		private Expression nextChild() {
			return children.get(next++);
		}
	}
}
