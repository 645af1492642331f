package org.metricshub.tinyscript.frontend;

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

import java.io.PrintStream;
import java.util.List;
import org.metricshub.tinyscript.frontend.ast.Expression;
import org.metricshub.tinyscript.frontend.ast.Statement;

/**
 * Prints a syntax tree, one node per line, children indented below their
 * parent.
 */
public class AstDumper implements Statement.Visitor<Void>, Expression.Visitor<Void> {

	private final PrintStream ps;
	private int depth;

	private AstDumper(PrintStream ps) {
		this.ps = ps;
	}

	/**
	 * @param statements the program to print
	 * @param ps destination stream
	 */
	public static void dump(List<Statement> statements, PrintStream ps) {
		new AstDumper(ps).block(statements);
	}

	private void line(String s) {
		for (int i = 0; i < depth; i++) {
			ps.print("  ");
		}
		ps.println(s);
	}

	private void block(List<Statement> statements) {
		for (Statement statement : statements) {
			statement.accept(this);
		}
	}

	private void child(Expression expression) {
		depth++;
		expression.accept(this);
		depth--;
	}

	private void childBlock(String label, List<Statement> statements) {
		depth++;
		line(label);
		depth++;
		block(statements);
		depth -= 2;
	}

	@Override
	public Void visitLet(Statement.LetStatement let) {
		line("Let " + let.getName());
		child(let.getValue());
		return null;
	}

	@Override
	public Void visitAssign(Statement.AssignStatement assign) {
		line("Assign " + assign.getName());
		child(assign.getValue());
		return null;
	}

	@Override
	public Void visitIf(Statement.IfStatement ifStatement) {
		line("If");
		child(ifStatement.getCondition());
		childBlock("Then", ifStatement.getThenBlock());
		if (!ifStatement.getElseBlock().isEmpty()) {
			childBlock("Else", ifStatement.getElseBlock());
		}
		return null;
	}

	@Override
	public Void visitWhile(Statement.WhileStatement whileStatement) {
		line("While");
		child(whileStatement.getCondition());
		childBlock("Body", whileStatement.getBody());
		return null;
	}

	@Override
	public Void visitPrint(Statement.PrintStatement print) {
		line("Print");
		child(print.getValue());
		return null;
	}

	@Override
	public Void visitNumber(Expression.NumberLiteral number) {
		line("Number " + number.getValue());
		return null;
	}

	@Override
	public Void visitVariable(Expression.VariableReference variable) {
		line("Variable " + variable.getName());
		return null;
	}

	@Override
	public Void visitBinary(Expression.BinaryOperation binary) {
		line("Binary " + binary.getOperator().symbol());
		child(binary.getLeft());
		child(binary.getRight());
		return null;
	}
}
