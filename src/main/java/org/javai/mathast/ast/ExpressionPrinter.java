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
 * Prints an expression tree as an s-expression, for logs, test failures and debugging.
 * <p>
 * Operators print as their tags, calls as {@code (call name args...)}, opaque symbols as
 * {@code #tag}, and variable names that would be ambiguous are single-quoted:
 * <pre>
 * (add 2 (multiply x (subtract y 3)))
 * </pre>
 * This is not a display format; renderers produce markup from the tree themselves.
 * <p>
 * Output accumulates in one buffer during a single walk, so printing costs time in
 * proportion to the printed text, however deep the tree.
 */
public class ExpressionPrinter {

	private final StringBuilder output = new StringBuilder();
	private final boolean pretty;
	private final int indentSize;

	public ExpressionPrinter() {
		this(true, 2);
	}

	public ExpressionPrinter(boolean pretty, int indentSize) {
		if (indentSize < 0) {
			throw new IllegalArgumentException("indentSize must not be negative");
		}
		this.pretty = pretty;
		this.indentSize = indentSize;
	}

	/**
	 * Static convenience method to pretty-print a tree, one child per line.
	 */
	public static String print(Expression expression) {
		ExpressionPrinter printer = new ExpressionPrinter();
		printer.write(expression);
		return printer.toString();
	}

	/**
	 * Static convenience method to print a tree on a single line.
	 */
	public static String printCompact(Expression expression) {
		ExpressionPrinter printer = new ExpressionPrinter(false, 0);
		printer.write(expression);
		return printer.toString();
	}

	/**
	 * Appends the tree to this printer's output.
	 */
	public void write(Expression root) {
		Objects.requireNonNull(root, "root must not be null");
		Deque<Frame> open = new ArrayDeque<>();
		enter(root, open);
		while (!open.isEmpty()) {
			Frame frame = open.peek();
			if (frame.next < frame.children.size()) {
				Expression child = frame.children.get(frame.next++);
				if (pretty) {
					output.append('\n').append(" ".repeat(open.size() * indentSize));
				}
				else {
					output.append(' ');
				}
				enter(child, open);
				continue;
			}
			open.pop();
			output.append(')');
		}
	}

	/**
	 * Returns the printed output as a string.
	 */
	@Override
	public String toString() {
		return output.toString();
	}

	/**
	 * Writes a leaf completely, or the opening of a list whose children follow.
	 */
	private void enter(Expression node, Deque<Frame> open) {
		if (node instanceof IntegerLiteral integer) {
			output.append(integer.value());
		}
		else if (node instanceof DecimalLiteral decimal) {
			String text = decimal.value().toPlainString();
			output.append(text);
			// keep decimals distinguishable from integers
			if (text.indexOf('.') < 0) {
				output.append(".0");
			}
		}
		else if (node instanceof Variable variable) {
			appendName(variable.name());
		}
		else if (node instanceof OpaqueSymbol symbol) {
			output.append('#').append(symbol.tag().tag());
		}
		else if (node instanceof BinaryOp binary) {
			output.append('(').append(binary.operator().tag());
			open.push(new Frame(node.children()));
		}
		else if (node instanceof UnaryOp unary) {
			output.append('(').append(unary.operator().tag());
			open.push(new Frame(node.children()));
		}
		else if (node instanceof Call call) {
			output.append("(call ");
			appendName(call.function());
			open.push(new Frame(call.arguments()));
		}
		else {
			throw new IllegalStateException("Unexpected expression type: " + node.getClass().getName());
		}
	}

	private void appendName(String name) {
		if (needsQuoting(name)) {
			output.append('\'').append(escape(name)).append('\'');
		}
		else {
			output.append(name);
		}
	}

	private static boolean needsQuoting(String name) {
		if (name.startsWith("#") || name.startsWith("'")) {
			return true;
		}
		if (Character.isDigit(name.charAt(0)) || name.charAt(0) == '-' || name.charAt(0) == '.') {
			return true;
		}
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (Character.isWhitespace(c) || c == '(' || c == ')') {
				return true;
			}
		}
		return false;
	}

	private static String escape(String value) {
		return value.replace("\\", "\\\\")
			.replace("'", "\\'")
			.replace("\n", "\\n")
			.replace("\t", "\\t")
			.replace("\r", "\\r");
	}

	private static final class Frame {

		private final List<Expression> children;
		private int next;

		private Frame(List<Expression> children) {
			this.children = children;
		}
	}
}
