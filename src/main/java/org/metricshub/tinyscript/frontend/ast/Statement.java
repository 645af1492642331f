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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Statement node of the syntax tree.
 * <p>
 * A program is an ordered list of statements. Conditionals and loops own
 * ordered lists of nested statements (their blocks). As for
 * {@link Expression}, the set of statements is closed and handled through
 * {@link Visitor}.
 */
public abstract class Statement {

	private final int lineNumber;

	private Statement(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the 1-based source line where the statement starts
	 */
	public final int getLineNumber() {
		return lineNumber;
	}

	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * Exhaustive handling of the statement kinds.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitLet(LetStatement let);

		R visitAssign(AssignStatement assign);

		R visitIf(IfStatement ifStatement);

		R visitWhile(WhileStatement whileStatement);

		R visitPrint(PrintStatement print);
	}

	private static List<Statement> copyOf(List<Statement> statements) {
		return Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	/**
	 * Common shape of <code>let NAME = EXPR;</code> and <code>NAME = EXPR;</code>.
	 */
	public abstract static class StoreStatement extends Statement {

		private final String name;
		private final Expression value;

		private StoreStatement(String name, Expression value, int lineNumber) {
			super(lineNumber);
			this.name = Objects.requireNonNull(name);
			this.value = Objects.requireNonNull(value);
		}

		public final String getName() {
			return name;
		}

		public final Expression getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			if (o == null || o.getClass() != getClass()) {
				return false;
			}
			StoreStatement other = (StoreStatement) o;
			return name.equals(other.name) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(getClass(), name, value);
		}
	}

	/**
	 * <code>let NAME = EXPR;</code>
	 */
	public static final class LetStatement extends StoreStatement {

		public LetStatement(String name, Expression value, int lineNumber) {
			super(name, value, lineNumber);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLet(this);
		}

		@Override
		public String toString() {
			return "let " + getName() + " = " + getValue() + ";";
		}
	}

	/**
	 * <code>NAME = EXPR;</code>
	 */
	public static final class AssignStatement extends StoreStatement {

		public AssignStatement(String name, Expression value, int lineNumber) {
			super(name, value, lineNumber);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAssign(this);
		}

		@Override
		public String toString() {
			return getName() + " = " + getValue() + ";";
		}
	}

	/**
	 * <code>if COND BLOCK [else BLOCK]</code>; the else block is empty when absent.
	 */
	public static final class IfStatement extends Statement {

		private final Expression condition;
		private final List<Statement> thenBlock;
		private final List<Statement> elseBlock;

		public IfStatement(Expression condition, List<Statement> thenBlock, List<Statement> elseBlock, int lineNumber) {
			super(lineNumber);
			this.condition = Objects.requireNonNull(condition);
			this.thenBlock = copyOf(thenBlock);
			this.elseBlock = copyOf(elseBlock);
		}

		public Expression getCondition() {
			return condition;
		}

		public List<Statement> getThenBlock() {
			return thenBlock;
		}

		public List<Statement> getElseBlock() {
			return elseBlock;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIf(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof IfStatement)) {
				return false;
			}
			IfStatement other = (IfStatement) o;
			return condition.equals(other.condition)
					&& thenBlock.equals(other.thenBlock)
					&& elseBlock.equals(other.elseBlock);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, thenBlock, elseBlock);
		}

		@Override
		public String toString() {
			return "if " + condition + " " + thenBlock + " else " + elseBlock;
		}
	}

	/**
	 * <code>while COND BLOCK</code>
	 */
	public static final class WhileStatement extends Statement {

		private final Expression condition;
		private final List<Statement> body;

		public WhileStatement(Expression condition, List<Statement> body, int lineNumber) {
			super(lineNumber);
			this.condition = Objects.requireNonNull(condition);
			this.body = copyOf(body);
		}

		public Expression getCondition() {
			return condition;
		}

		public List<Statement> getBody() {
			return body;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitWhile(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof WhileStatement)) {
				return false;
			}
			WhileStatement other = (WhileStatement) o;
			return condition.equals(other.condition) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash(condition, body);
		}

		@Override
		public String toString() {
			return "while " + condition + " " + body;
		}
	}

	/**
	 * <code>print EXPR;</code>
	 */
	public static final class PrintStatement extends Statement {

		private final Expression value;

		public PrintStatement(Expression value, int lineNumber) {
			super(lineNumber);
			this.value = Objects.requireNonNull(value);
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPrint(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof PrintStatement && ((PrintStatement) o).value.equals(value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return "print " + value + ";";
		}
	}
}
