package org.metricshub.tinyscript.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * TinyScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.Objects;

/**
 * Expression node of the syntax tree.
 * <p>
 * The set of expressions is closed: a numeric literal, a variable
 * reference or a binary operation. Consumers dispatch through
 * {@link Visitor}, so adding a kind of expression breaks every
 * consumer at compile time until it handles the new kind.
 */
public abstract class Expression {

	private final int lineNumber;

	private Expression(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the 1-based source line where the expression starts
	 */
	public final int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Dispatches to the visitor method matching this node.
	 *
	 * @param <R> result type of the visitor
	 * @param visitor the visitor
	 * @return whatever the visitor returns
	 */
	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * Exhaustive handling of the expression kinds.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitNumber(NumberLiteral number);

		R visitVariable(VariableReference variable);

		R visitBinary(BinaryOperation binary);
	}

	/**
	 * Integer literal.
	 */
	public static final class NumberLiteral extends Expression {

		private final long value;

		public NumberLiteral(long value, int lineNumber) {
			super(lineNumber);
			this.value = value;
		}

		public long getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNumber(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof NumberLiteral && ((NumberLiteral) o).value == value;
		}

		@Override
		public int hashCode() {
			return Long.hashCode(value);
		}

		@Override
		public String toString() {
			return Long.toString(value);
		}
	}

	/**
	 * Read of a variable, by name.
	 */
	public static final class VariableReference extends Expression {

		private final String name;

		public VariableReference(String name, int lineNumber) {
			super(lineNumber);
			this.name = Objects.requireNonNull(name);
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitVariable(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof VariableReference && ((VariableReference) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Binary operation owning its two operands.
	 */
	public static final class BinaryOperation extends Expression {

		private final Expression left;
		private final BinaryOperator operator;
		private final Expression right;

		public BinaryOperation(Expression left, BinaryOperator operator, Expression right, int lineNumber) {
			super(lineNumber);
			this.left = Objects.requireNonNull(left);
			this.operator = Objects.requireNonNull(operator);
			this.right = Objects.requireNonNull(right);
		}

		public Expression getLeft() {
			return left;
		}

		public BinaryOperator getOperator() {
			return operator;
		}

		public Expression getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBinary(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof BinaryOperation)) {
				return false;
			}
			BinaryOperation other = (BinaryOperation) o;
			return operator == other.operator && left.equals(other.left) && right.equals(other.right);
		}

		@Override
		public int hashCode() {
			return Objects.hash(left, operator, right);
		}

		@Override
		public String toString() {
			return "(" + left + " " + operator.symbol() + " " + right + ")";
		}
	}
}
