package org.javai.mathast.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.mathast.ast.Expressions.add;
import static org.javai.mathast.ast.Expressions.call;
import static org.javai.mathast.ast.Expressions.integer;
import static org.javai.mathast.ast.Expressions.multiply;
import static org.javai.mathast.ast.Expressions.negate;
import static org.javai.mathast.ast.Expressions.subtract;
import static org.javai.mathast.ast.Expressions.variable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import java.util.ArrayList;
import java.util.List;
import org.javai.mathast.ast.Expression.BinaryOp;
import org.javai.mathast.ast.Expression.Call;
import org.javai.mathast.ast.Expression.UnaryOp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ExpressionWalkerTest {

	/**
	 * 2 + x * (y - 3)
	 */
	private static BinaryOp sourceExample() {
		return add(integer(2), multiply(variable("x"), subtract(variable("y"), integer(3))));
	}

	private static String label(Expression node) {
		if (node instanceof BinaryOp binary) {
			return binary.operator().tag();
		}
		if (node instanceof UnaryOp unary) {
			return unary.operator().tag();
		}
		if (node instanceof Call call) {
			return call.function() + "()";
		}
		return node.toString();
	}

	private static List<String> labels(List<Expression> nodes) {
		return nodes.stream().map(ExpressionWalkerTest::label).toList();
	}

	@Test
	@DisplayName("Post-order yields leaves then internal nodes for 2 + x * (y - 3)")
	void postOrderOfSourceExample() {
		assertThat(labels(ExpressionWalker.postOrder(sourceExample())))
				.containsExactly("2", "x", "y", "3", "subtract", "multiply", "add");
	}

	@Test
	void preOrderOfSourceExample() {
		assertThat(labels(ExpressionWalker.preOrder(sourceExample())))
				.containsExactly("add", "2", "multiply", "x", "subtract", "y", "3");
	}

	@Test
	@DisplayName("Left subtree is finished before the right subtree starts")
	void leftSubtreeCompletesBeforeRight() {
		BinaryOp tree = subtract(add(variable("a"), variable("b")), multiply(variable("c"), variable("d")));

		assertThat(labels(ExpressionWalker.postOrder(tree)))
				.containsExactly("a", "b", "add", "c", "d", "multiply", "subtract");
	}

	@Test
	void callArgumentsVisitedInStoredOrder() {
		Call tree = call("f", variable("A"), variable("B"), variable("C"));

		assertThat(labels(ExpressionWalker.postOrder(tree))).containsExactly("A", "B", "C", "f()");
		assertThat(labels(ExpressionWalker.preOrder(tree))).containsExactly("f()", "A", "B", "C");
	}

	@Test
	void zeroArgumentCallIsVisitedAlone() {
		assertThat(labels(ExpressionWalker.postOrder(call("f")))).containsExactly("f()");
	}

	@Test
	void visitorIsDispatchedPostOrder() {
		@SuppressWarnings("unchecked")
		ExpressionVisitor<String> visitor = mock(ExpressionVisitor.class);
		BinaryOp tree = sourceExample();
		BinaryOp product = (BinaryOp) tree.right();
		BinaryOp difference = (BinaryOp) product.right();

		ExpressionWalker.walkPostOrder(tree, visitor);

		InOrder order = inOrder(visitor);
		order.verify(visitor).visitInteger(integer(2));
		order.verify(visitor).visitVariable(variable("x"));
		order.verify(visitor).visitVariable(variable("y"));
		order.verify(visitor).visitInteger(integer(3));
		order.verify(visitor).visitBinary(difference);
		order.verify(visitor).visitBinary(product);
		order.verify(visitor).visitBinary(tree);
		verifyNoMoreInteractions(visitor);
	}

	@Test
	void everyNodeVisitedExactlyOnce() {
		@SuppressWarnings("unchecked")
		ExpressionVisitor<Void> visitor = mock(ExpressionVisitor.class);
		Expression tree = add(negate(variable("x")), call("g", variable("y"), integer(1)));

		ExpressionWalker.walkPreOrder(tree, visitor);

		verify(visitor, times(2)).visitVariable(any());
		verify(visitor).visitInteger(any());
		verify(visitor).visitUnary(any());
		verify(visitor).visitBinary(any());
		verify(visitor).visitCall(any());
		verifyNoMoreInteractions(visitor);
	}

	@Test
	void walkReturnsRootResult() {
		String result = ExpressionWalker.walkPostOrder(sourceExample(), new LabelVisitor());
		String preOrderResult = ExpressionWalker.walkPreOrder(sourceExample(), new LabelVisitor());

		assertThat(result).isEqualTo("add");
		assertThat(preOrderResult).isEqualTo("add");
	}

	@Test
	void preOrderReportsNestingDepth() {
		List<String> entries = new ArrayList<>();

		ExpressionWalker.forEachPreOrder(sourceExample(), (node, depth) -> entries.add(depth + ":" + label(node)));

		assertThat(entries).containsExactly("0:add", "1:2", "1:multiply", "2:x", "2:subtract", "3:y", "3:3");
	}

	@Test
	void foldEvaluatesBottomUp() {
		Integer value = ExpressionWalker.fold(
				add(integer(2), multiply(integer(4), subtract(integer(7), integer(3)))),
				new IntegerArithmetic());

		assertThat(value).isEqualTo(18);
	}

	@Test
	void foldPassesCallArgumentsInOrder() {
		List<String> seen = new ArrayList<>();
		ExpressionWalker.fold(call("max", integer(1), integer(5), integer(3)), new IntegerArithmetic() {
			@Override
			public Integer foldCall(Call node, List<Integer> arguments) {
				seen.add(node.function() + arguments);
				return super.foldCall(node, arguments);
			}
		});

		assertThat(seen).containsExactly("max[1, 5, 3]");
	}

	private static final class LabelVisitor implements ExpressionVisitor<String> {

		@Override
		public String visitInteger(Expression.IntegerLiteral node) {
			return node.value().toString();
		}

		@Override
		public String visitDecimal(Expression.DecimalLiteral node) {
			return node.value().toPlainString();
		}

		@Override
		public String visitVariable(Expression.Variable node) {
			return node.name();
		}

		@Override
		public String visitSymbol(Expression.OpaqueSymbol node) {
			return node.tag().tag();
		}

		@Override
		public String visitCall(Call node) {
			return node.function();
		}

		@Override
		public String visitBinaryOperation(BinaryOp node) {
			return node.operator().tag();
		}

		@Override
		public String visitUnaryOperation(UnaryOp node) {
			return node.operator().tag();
		}
	}

	/**
	 * Minimal integer evaluator over add, subtract, multiply and max.
	 */
	private static class IntegerArithmetic implements ExpressionFolder<Integer> {

		@Override
		public Integer foldInteger(Expression.IntegerLiteral node) {
			return node.value().intValueExact();
		}

		@Override
		public Integer foldDecimal(Expression.DecimalLiteral node) {
			throw new UnsupportedOperationException("decimal");
		}

		@Override
		public Integer foldVariable(Expression.Variable node) {
			throw new UnsupportedOperationException("variable");
		}

		@Override
		public Integer foldSymbol(Expression.OpaqueSymbol node) {
			throw new UnsupportedOperationException("symbol");
		}

		@Override
		public Integer foldBinary(BinaryOp node, Integer left, Integer right) {
			return switch (node.operator()) {
				case ADD -> left + right;
				case SUBTRACT -> left - right;
				case MULTIPLY -> left * right;
				default -> throw new UnsupportedOperationException(node.operator().tag());
			};
		}

		@Override
		public Integer foldUnary(UnaryOp node, Integer operand) {
			return node.operator() == UnaryOpKind.NEGATE ? -operand : operand;
		}

		@Override
		public Integer foldCall(Call node, List<Integer> arguments) {
			return arguments.stream().max(Integer::compare).orElseThrow();
		}
	}
}
