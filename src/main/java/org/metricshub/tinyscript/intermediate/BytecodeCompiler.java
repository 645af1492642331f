package org.metricshub.tinyscript.intermediate;

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

import java.util.List;
import org.metricshub.tinyscript.frontend.ast.Expression;
import org.metricshub.tinyscript.frontend.ast.Statement;
import org.metricshub.tinyscript.util.TinyLogger;
import org.slf4j.Logger;

/**
 * Compiles a syntax tree into bytecode for the {@link org.metricshub.tinyscript.backend.VM}.
 * <p>
 * A single post-order walk: operands are emitted before the instruction
 * consuming them, left before right. Branch targets always travel through
 * the operand stack (<code>PUSH target; JUMP</code>), forward targets being
 * backpatched once known. The program always ends with HALT.
 * <p>
 * Compilation cannot fail: a variable gets an address on first reference,
 * whether it is declared, assigned or read.
 * <p>
 * An instance compiles one program.
 */
public class BytecodeCompiler implements Statement.Visitor<Void>, Expression.Visitor<Void> {

	private static final Logger LOG = TinyLogger.getLogger(BytecodeCompiler.class);

	private final Bytecode bytecode = new Bytecode();
	private final VariableTable variables = new VariableTable();
	private boolean compiled;

	/**
	 * Compiles a whole program.
	 *
	 * @param statements top-level statements of the program
	 * @return the program, terminated by HALT
	 */
	public byte[] compile(List<Statement> statements) {
		if (compiled) {
			throw new IllegalStateException("This compiler has already been used");
		}
		compiled = true;
		block(statements);
		bytecode.halt();
		byte[] program = bytecode.toByteArray();
		LOG.debug("Compiled {} statements into {} bytes, {} variables", statements.size(), program.length, variables.size());
		return program;
	}

	/**
	 * Compiles a lone expression: the program leaves the value of the
	 * expression on top of the stack when it halts.
	 *
	 * @param expression the expression to evaluate
	 * @return the program, terminated by HALT
	 */
	public byte[] compileForEval(Expression expression) {
		if (compiled) {
			throw new IllegalStateException("This compiler has already been used");
		}
		compiled = true;
		expression.accept(this);
		bytecode.halt();
		return bytecode.toByteArray();
	}

	/**
	 * @return the variables allocated so far, with their addresses
	 */
	public VariableTable getVariables() {
		return variables;
	}

	/**
	 * @return the buffer being emitted, for dumps
	 */
	public Bytecode getBytecode() {
		return bytecode;
	}

	private void block(List<Statement> statements) {
		for (Statement statement : statements) {
			statement.accept(this);
		}
	}

	// STORE pops the value first, so the address goes below it
	private void store(Statement.StoreStatement statement) {
		long address = variables.addressOf(statement.getName());
		bytecode.push(address);
		statement.getValue().accept(this);
		bytecode.store();
	}

	// JUMP_IF branches on a non-zero condition; conditionals and loops
	// leave their block when the condition is zero
	private void jumpIfFalse(Address target) {
		bytecode.push(0L);
		bytecode.equal();
		bytecode.pushAddress(target);
		bytecode.jumpIf();
	}

	private void jump(Address target) {
		bytecode.pushAddress(target);
		bytecode.jump();
	}

	@Override
	public Void visitLet(Statement.LetStatement let) {
		store(let);
		return null;
	}

	@Override
	public Void visitAssign(Statement.AssignStatement assign) {
		store(assign);
		return null;
	}

	@Override
	public Void visitIf(Statement.IfStatement ifStatement) {
		Address elseblock = bytecode.createAddress("elseblock");
		Address end = bytecode.createAddress("end");

		ifStatement.getCondition().accept(this);
		jumpIfFalse(elseblock);
		block(ifStatement.getThenBlock());
		jump(end);
		bytecode.address(elseblock);
		block(ifStatement.getElseBlock());
		bytecode.address(end);
		return null;
	}

	@Override
	public Void visitWhile(Statement.WhileStatement whileStatement) {
		Address breakAddress = bytecode.createAddress("breakAddress");

		// LOOP
		Address loop = bytecode.createAddress("loop");
		bytecode.address(loop);

		whileStatement.getCondition().accept(this);
		jumpIfFalse(breakAddress);
		block(whileStatement.getBody());
		jump(loop);

		bytecode.address(breakAddress);
		return null;
	}

	@Override
	public Void visitPrint(Statement.PrintStatement print) {
		print.getValue().accept(this);
		bytecode.print();
		return null;
	}

	@Override
	public Void visitNumber(Expression.NumberLiteral number) {
		bytecode.push(number.getValue());
		return null;
	}

	@Override
	public Void visitVariable(Expression.VariableReference variable) {
		bytecode.push(variables.addressOf(variable.getName()));
		bytecode.load();
		return null;
	}

	@Override
	public Void visitBinary(Expression.BinaryOperation binary) {
		switch (binary.getOperator()) {
		case ADD:
			operands(binary);
			bytecode.add();
			break;
		case SUB:
			operands(binary);
			bytecode.subtract();
			break;
		case MUL:
			operands(binary);
			bytecode.multiply();
			break;
		case DIV:
			operands(binary);
			bytecode.divide();
			break;
		case EQUALS:
			operands(binary);
			bytecode.equal();
			break;
		case LESS_THAN:
			operands(binary);
			bytecode.less();
			break;
		case GREATER_THAN:
			// a > b is b < a
			binary.getRight().accept(this);
			binary.getLeft().accept(this);
			bytecode.less();
			break;
		default:
			throw new Error("Unhandled op: " + binary.getOperator() + " / " + binary);
		}
		return null;
	}

	private void operands(Expression.BinaryOperation binary) {
		binary.getLeft().accept(this);
		binary.getRight().accept(this);
	}
}
