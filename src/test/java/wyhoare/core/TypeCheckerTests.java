// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wyhoare.core;

import static org.junit.jupiter.api.Assertions.*;
import static wyhoare.core.HoareFile.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import wyhoare.core.HoareFile.Decl;
import wyhoare.core.HoareFile.Expr;
import wyhoare.core.HoareFile.Type;
import wyhoare.io.HoareFileParser;
import wyhoare.io.HoareFilePrinter;

public class TypeCheckerTests {
	private static final Environment ENVIRONMENT = Environment.of(Arrays.asList(new Decl.Variable("x", Type.Int),
			new Decl.Variable("y", Type.Int), new Decl.Variable("b", Type.Bool), new Decl.Variable("c", Type.Bool)));

	@Test
	public void testWellTyped() {
		HoareTriple t = triple("x >= 0 && b", "x := x + 1; if b then y := x else y := 0 fi", "y >= 0 || !b");
		assertEquals(t, new TypeChecker(ENVIRONMENT).check(t));
	}

	@Test
	public void testBooleanEqualityBecomesEquivalence() {
		Expr.Logical f = new TypeChecker(ENVIRONMENT).checkFormula(HoareFileParser.parseFormula("b = (x > 0)"));
		assertTrue(f instanceof Expr.Iff);
		assertEquals("b <==> x > 0", HoareFilePrinter.toString(f));
		Expr.Logical g = new TypeChecker(ENVIRONMENT).checkFormula(HoareFileParser.parseFormula("b != c"));
		assertEquals("!(b <==> c)", HoareFilePrinter.toString(g));
	}

	@Test
	public void testQuantifiedVariableInScope() {
		Expr.Logical f = HoareFileParser.parseFormula("forall i:int. i * i >= 0 && x >= 0");
		assertEquals(f, new TypeChecker(ENVIRONMENT).checkFormula(f));
	}

	@Test
	public void testUndeclaredVariable() {
		ScopeError e = assertThrows(ScopeError.class,
				() -> new TypeChecker(ENVIRONMENT).checkFormula(HoareFileParser.parseFormula("z = 0")));
		assertEquals(SyntacticException.Kind.SCOPE, e.getKind());
	}

	@Test
	public void testUndeclaredAssignment() {
		HoareTriple t = triple("true", "z := 1", "true");
		assertThrows(ScopeError.class, () -> new TypeChecker(ENVIRONMENT).check(t));
	}

	@Test
	public void testQuantifiedVariableOutOfScope() {
		Expr.Logical f = HoareFileParser.parseFormula("(forall i:int. i >= i) && i = 0");
		assertThrows(ScopeError.class, () -> new TypeChecker(ENVIRONMENT).checkFormula(f));
	}

	@Test
	public void testArithmeticOnBoolean() {
		TypeError e = assertThrows(TypeError.class,
				() -> new TypeChecker(ENVIRONMENT).checkFormula(HoareFileParser.parseFormula("b + 1 = 2")));
		assertEquals(SyntacticException.Kind.TYPE, e.getKind());
	}

	@Test
	public void testIntegerAsFormula() {
		assertThrows(TypeError.class,
				() -> new TypeChecker(ENVIRONMENT).checkFormula(HoareFileParser.parseFormula("x && b")));
	}

	@Test
	public void testMixedEquality() {
		assertThrows(TypeError.class,
				() -> new TypeChecker(ENVIRONMENT).checkFormula(HoareFileParser.parseFormula("x = b")));
	}

	@Test
	public void testIllTypedAssignment() {
		HoareTriple t = triple("true", "x := b", "true");
		assertThrows(TypeError.class, () -> new TypeChecker(ENVIRONMENT).check(t));
	}

	@Test
	public void testQuantifiedLoopCondition() {
		HoareTriple t = new HoareTriple(CONST(true),
				WHILE(HoareFileParser.parseFormula("exists i:int. i = x"), CONST(true), SKIP()), CONST(true));
		assertThrows(TypeError.class, () -> new TypeChecker(ENVIRONMENT).check(t));
	}

	@Test
	public void testDuplicateDeclaration() {
		assertThrows(ScopeError.class, () -> Environment
				.of(Arrays.asList(new Decl.Variable("x", Type.Int), new Decl.Variable("x", Type.Bool))));
	}

	private static HoareTriple triple(String pre, String stmts, String post) {
		return new HoareTriple(HoareFileParser.parseFormula(pre), HoareFileParser.parseStatements(stmts),
				HoareFileParser.parseFormula(post));
	}
}
