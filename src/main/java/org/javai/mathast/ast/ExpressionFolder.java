package org.javai.mathast.ast;

import java.util.List;
import org.javai.mathast.ast.Expression.BinaryOp;
import org.javai.mathast.ast.Expression.Call;
import org.javai.mathast.ast.Expression.DecimalLiteral;
import org.javai.mathast.ast.Expression.IntegerLiteral;
import org.javai.mathast.ast.Expression.OpaqueSymbol;
import org.javai.mathast.ast.Expression.UnaryOp;
import org.javai.mathast.ast.Expression.Variable;

/**
 * Bottom-up fold over an expression tree. Each composite case receives the already
 * folded results of its children, in child order.
 *
 * @param <R> the folded result type
 * @see ExpressionWalker#fold(Expression, ExpressionFolder)
 */
public interface ExpressionFolder<R> {

	R foldInteger(IntegerLiteral node);

	R foldDecimal(DecimalLiteral node);

	R foldVariable(Variable node);

	R foldSymbol(OpaqueSymbol node);

	R foldBinary(BinaryOp node, R left, R right);

	R foldUnary(UnaryOp node, R operand);

	/**
	 * @param arguments folded arguments in source order; empty for a zero-argument call
	 */
	R foldCall(Call node, List<R> arguments);
}
