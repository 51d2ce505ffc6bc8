package org.javai.mathast.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.mathast.ast.Expressions.add;
import static org.javai.mathast.ast.Expressions.integer;
import static org.javai.mathast.ast.Expressions.variable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.javai.mathast.ast.Expression.BinaryOp;
import org.javai.mathast.ast.Expression.Call;
import org.javai.mathast.ast.Expression.DecimalLiteral;
import org.javai.mathast.ast.Expression.IntegerLiteral;
import org.javai.mathast.ast.Expression.OpaqueSymbol;
import org.javai.mathast.ast.Expression.UnaryOp;
import org.javai.mathast.ast.Expression.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Expression construction")
class ExpressionConstructionTest {

	@Nested
	@DisplayName("Binary operators")
	class BinaryConstruction {

		@Test
		@DisplayName("Children keep the roles given at construction")
		void childrenKeepConstructionOrder() {
			BinaryOp node = Expressions.binary(BinaryOpKind.SUBTRACT, List.of(variable("a"), variable("b")));

			assertThat(node.left()).isEqualTo(variable("a"));
			assertThat(node.right()).isEqualTo(variable("b"));
			assertThat(node.children()).containsExactly(variable("a"), variable("b"));
		}

		@ParameterizedTest(name = "{0} children")
		@ValueSource(ints = { 0, 1, 3, 4 })
		@DisplayName("Anything but two children is an arity error")
		void wrongChildCountFails(int count) {
			List<Expression> children = new ArrayList<>();
			for (int i = 0; i < count; i++) {
				children.add(integer(i));
			}

			assertThatThrownBy(() -> Expressions.binary(BinaryOpKind.ADD, children))
					.isInstanceOf(ArityException.class)
					.hasMessageContaining("'add'")
					.satisfies(e -> {
						ArityException arity = (ArityException) e;
						assertThat(arity.expected()).isEqualTo(2);
						assertThat(arity.actual()).isEqualTo(count);
					});
		}

		@Test
		void constructionByTag() {
			BinaryOp node = Expressions.binary("proper-subset", List.of(variable("A"), variable("B")));

			assertThat(node.operator()).isEqualTo(BinaryOpKind.PROPER_SUBSET);
		}

		@Test
		void unknownTagFailsBeforeArityIsChecked() {
			assertThatThrownBy(() -> Expressions.binary("cross", List.of()))
					.isInstanceOf(UnknownOperatorException.class)
					.hasMessageContaining("'cross'");
		}

		@Test
		void nullOperatorIsUnknown() {
			assertThatThrownBy(() -> new BinaryOp(null, integer(1), integer(2)))
					.isInstanceOf(UnknownOperatorException.class);
			assertThatThrownBy(() -> Expressions.binary((String) null, List.of(integer(1), integer(2))))
					.isInstanceOf(UnknownOperatorException.class);
		}

		@Test
		void nullChildIsRejected() {
			assertThatThrownBy(() -> add(integer(1), null))
					.isInstanceOf(NullPointerException.class)
					.hasMessageContaining("right");
		}
	}

	@Nested
	@DisplayName("Unary operators")
	class UnaryConstruction {

		@Test
		void singleOperand() {
			UnaryOp node = Expressions.unary("negate", List.of(variable("x")));

			assertThat(node.operator()).isEqualTo(UnaryOpKind.NEGATE);
			assertThat(node.operand()).isEqualTo(variable("x"));
			assertThat(node.children()).containsExactly(variable("x"));
		}

		@ParameterizedTest(name = "{0} children")
		@ValueSource(ints = { 0, 2, 3 })
		void wrongChildCountFails(int count) {
			List<Expression> children = new ArrayList<>();
			for (int i = 0; i < count; i++) {
				children.add(variable("v" + i));
			}

			assertThatThrownBy(() -> Expressions.unary(UnaryOpKind.NOT, children))
					.isInstanceOf(ArityException.class)
					.hasMessageContaining("exactly 1 child");
		}

		@Test
		void unknownTag() {
			assertThatThrownBy(() -> Expressions.unary("factorial", List.of(integer(3))))
					.isInstanceOf(UnknownOperatorException.class)
					.extracting(e -> ((UnknownOperatorException) e).tag())
					.isEqualTo("factorial");
		}
	}

	@Nested
	@DisplayName("Calls")
	class CallConstruction {

		@Test
		@DisplayName("A call with no arguments is allowed")
		void zeroArguments() {
			Call call = Expressions.call("f");

			assertThat(call.function()).isEqualTo("f");
			assertThat(call.arguments()).isEmpty();
			assertThat(call.children()).isEmpty();
			assertThat(call.isLeaf()).isFalse();
		}

		@Test
		void argumentsKeepSourceOrder() {
			Call call = Expressions.call("max", integer(3), integer(1), integer(2));

			assertThat(call.arguments()).containsExactly(integer(3), integer(1), integer(2));
		}

		@Test
		void argumentListIsCopied() {
			List<Expression> arguments = new ArrayList<>(List.of(variable("x")));
			Call call = Expressions.call("sin", arguments);

			arguments.add(variable("y"));

			assertThat(call.arguments()).containsExactly(variable("x"));
			assertThatThrownBy(() -> call.arguments().add(variable("z")))
					.isInstanceOf(UnsupportedOperationException.class);
		}

		@Test
		void nullArgumentIsRejected() {
			assertThatThrownBy(() -> Expressions.call("f", Arrays.asList(integer(1), null)))
					.isInstanceOf(NullPointerException.class);
		}

		@Test
		void blankFunctionName() {
			assertThatThrownBy(() -> Expressions.call("  "))
					.isInstanceOf(MalformedLiteralException.class);
		}
	}

	@Nested
	@DisplayName("Leaves")
	class LeafConstruction {

		@Test
		void integersAreExact() {
			IntegerLiteral big = integer("123456789012345678901234567890");

			assertThat(big.value()).isEqualTo(new BigInteger("123456789012345678901234567890"));
			assertThat(big.children()).isEmpty();
			assertThat(big.isLeaf()).isTrue();
		}

		@Test
		void malformedIntegerText() {
			assertThatThrownBy(() -> integer("12a"))
					.isInstanceOf(MalformedLiteralException.class)
					.hasCauseInstanceOf(NumberFormatException.class);
		}

		@ParameterizedTest
		@ValueSource(doubles = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY })
		@DisplayName("Non-finite decimals are malformed")
		void nonFiniteDecimal(double value) {
			assertThatThrownBy(() -> Expressions.decimal(value))
					.isInstanceOf(MalformedLiteralException.class)
					.hasMessageContaining("finite");
		}

		@Test
		void decimalKeepsScale() {
			DecimalLiteral decimal = Expressions.decimal("2.50");

			assertThat(decimal.value()).isEqualTo(new BigDecimal("2.50"));
			assertThat(decimal).isNotEqualTo(Expressions.decimal("2.5"));
		}

		@Test
		void malformedDecimalText() {
			assertThatThrownBy(() -> Expressions.decimal("1.2.3"))
					.isInstanceOf(MalformedLiteralException.class);
			assertThatThrownBy(() -> Expressions.decimal("NaN"))
					.isInstanceOf(MalformedLiteralException.class);
		}

		@Test
		void decimalIsNotAnInteger() {
			assertThat(Expressions.decimal("2")).isNotEqualTo(integer(2));
		}

		@Test
		void greekAndSubscriptedVariables() {
			Variable theta = variable("θ");
			Variable x1 = Expressions.subscripted("x", "1");
			Variable xMax = Expressions.subscripted("x", "max");

			assertThat(theta.subscript()).isEmpty();
			assertThat(x1.name()).isEqualTo("x_1");
			assertThat(x1.baseName()).isEqualTo("x");
			assertThat(x1.subscript()).contains("1");
			assertThat(xMax.name()).isEqualTo("x_{max}");
			assertThat(xMax.subscript()).contains("max");
		}

		@Test
		void blankVariableName() {
			assertThatThrownBy(() -> variable(""))
					.isInstanceOf(MalformedLiteralException.class);
		}

		@Test
		void opaqueSymbolByTag() {
			OpaqueSymbol infinity = Expressions.symbol("infinity");
			OpaqueSymbol dne = Expressions.symbol("DOES_NOT_EXIST");

			assertThat(infinity.tag()).isEqualTo(SymbolTag.INFINITY);
			assertThat(dne.tag()).isEqualTo(SymbolTag.DOES_NOT_EXIST);
			assertThatThrownBy(() -> Expressions.symbol("nan"))
					.isInstanceOf(UnknownOperatorException.class);
		}

		@Test
		void leavesRejectChildren() {
			assertThatThrownBy(() -> integer(1).withChildren(List.of(integer(2))))
					.isInstanceOf(ArityException.class);
		}
	}

	@Test
	@DisplayName("All construction failures share a common base type")
	void failuresShareBaseType() {
		assertThat(new ArityException("add", 2, 1)).isInstanceOf(ExpressionException.class);
		assertThat(new UnknownOperatorException("binary operator", "x")).isInstanceOf(ExpressionException.class);
		assertThat(new MalformedLiteralException("bad")).isInstanceOf(ExpressionException.class);
	}
}
