package org.metricshub.tinyscript.frontend;

import static org.junit.Assert.*;

import java.util.List;
import org.junit.Test;
import org.metricshub.tinyscript.frontend.ast.SemanticException;
import org.metricshub.tinyscript.frontend.ast.Statement;
import org.metricshub.tinyscript.util.ScriptSource;

public class VariableCheckerTest {

	private static void check(String script) throws Exception {
		List<Statement> statements = new TinyParser().parse(ScriptSource.fromString(script));
		VariableChecker.check(statements);
	}

	@Test
	public void testAssignedBeforeRead() throws Exception {
		check("let x = 1; let y = x + 1; print x * y;");
		check("x = 3; print x;");
		check("let i = 0; while i < 3 ( let j = i; print j; i = i + 1; )");
	}

	@Test
	public void testReadBeforeAssignment() throws Exception {
		SemanticException e = assertThrows(SemanticException.class, () -> check("let x = 1;\nprint y;"));
		assertEquals("y", e.getVariableName());
		assertEquals("Variable 'y' is read before being assigned (line 2)", e.getMessage());
	}

	@Test
	public void testSelfReference() throws Exception {
		SemanticException e = assertThrows(SemanticException.class, () -> check("let x = x + 1;"));
		assertEquals("x", e.getVariableName());
	}

	@Test
	public void testConditionChecked() throws Exception {
		assertThrows(SemanticException.class, () -> check("if z ( print 1; )"));
		assertThrows(SemanticException.class, () -> check("while 1 < z ( print 1; )"));
	}
}
