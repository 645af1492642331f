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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.tinyscript.frontend.ast.Expression;
import org.metricshub.tinyscript.frontend.ast.SemanticException;
import org.metricshub.tinyscript.frontend.ast.Statement;

/**
 * Optional strict pass run between parsing and compilation.
 * <p>
 * Without it, the compiler allocates an address for any variable on first
 * reference and a never-written variable reads as zero. This pass instead
 * rejects a read of a variable that no statement before it, in source order,
 * declares or assigns. Assignments inside a block count for everything that
 * follows them in the text, whether or not the block runs.
 */
public class VariableChecker implements Statement.Visitor<Void>, Expression.Visitor<Void> {

	private final Set<String> defined = new HashSet<String>();

	/**
	 * @param statements the program
	 * @throws SemanticException on the first read of an undefined variable
	 */
	public static void check(List<Statement> statements) {
		new VariableChecker().checkAll(statements);
	}

	private void checkAll(List<Statement> statements) {
		for (Statement statement : statements) {
			statement.accept(this);
		}
	}

	@Override
	public Void visitLet(Statement.LetStatement let) {
		let.getValue().accept(this);
		defined.add(let.getName());
		return null;
	}

	@Override
	public Void visitAssign(Statement.AssignStatement assign) {
		assign.getValue().accept(this);
		defined.add(assign.getName());
		return null;
	}

	@Override
	public Void visitIf(Statement.IfStatement ifStatement) {
		ifStatement.getCondition().accept(this);
		checkAll(ifStatement.getThenBlock());
		checkAll(ifStatement.getElseBlock());
		return null;
	}

	@Override
	public Void visitWhile(Statement.WhileStatement whileStatement) {
		whileStatement.getCondition().accept(this);
		checkAll(whileStatement.getBody());
		return null;
	}

	@Override
	public Void visitPrint(Statement.PrintStatement print) {
		print.getValue().accept(this);
		return null;
	}

	@Override
	public Void visitNumber(Expression.NumberLiteral number) {
		return null;
	}

	@Override
	public Void visitVariable(Expression.VariableReference variable) {
		if (!defined.contains(variable.getName())) {
			throw new SemanticException(
					"Variable '" + variable.getName() + "' is read before being assigned (line "
							+ variable.getLineNumber() + ")",
					variable.getName());
		}
		return null;
	}

	@Override
	public Void visitBinary(Expression.BinaryOperation binary) {
		binary.getLeft().accept(this);
		binary.getRight().accept(this);
		return null;
	}
}
