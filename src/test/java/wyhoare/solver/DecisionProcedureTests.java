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
package wyhoare.solver;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import wyhoare.core.Environment;
import wyhoare.core.HoareFile.Decl;
import wyhoare.core.HoareFile.Expr;
import wyhoare.core.HoareFile.Type;
import wyhoare.io.HoareFileParser;
import wyhoare.logic.Normaliser;

public class DecisionProcedureTests {
	private static final Environment ENVIRONMENT = Environment.of(Arrays.asList(new Decl.Variable("x", Type.Int),
			new Decl.Variable("y", Type.Int), new Decl.Variable("z", Type.Int), new Decl.Variable("b", Type.Bool),
			new Decl.Variable("c", Type.Bool)));

	private final DecisionProcedure procedure = new DecisionProcedure(10000, 8);

	@Test
	public void testValidByNormalisation() {
		assertValid("x > 0 ==> x >= 1");
		assertValid("b || !b");
		assertValid("x + 1 - 1 = x");
	}

	@Test
	public void testValidByElimination() {
		assertValid("x < y && y < z ==> x + 1 < z");
		assertValid("x >= 0 && y >= 0 ==> x + y >= 0");
		assertValid("2 * x != 1");
	}

	@Test
	public void testValidByEquality() {
		assertValid("x = y + 1 && y = 2 ==> x = 3");
		assertValid("x <= y && y <= x ==> x = y");
		assertValid("x = y * y && y = z ==> x = z * z");
	}

	@Test
	public void testValidBooleans() {
		assertValid("b && (b ==> c) ==> c");
		assertValid("(b <==> c) ==> (c <==> b)");
		assertValid("b = (x > 0) && x > 0 ==> b");
	}

	@Test
	public void testInvalidWithCounterexample() {
		Outcome o = procedure.decide(HoareFileParser.parseFormula("x >= 0 ==> x >= 1"), ENVIRONMENT);
		assertEquals(Outcome.Kind.INVALID, o.getKind());
		assertEquals(BigInteger.ZERO, o.getCounterexample().get("x"));
		assertEquals("{x = 0}", o.getCounterexample().toString());
	}

	@Test
	public void testCounterexampleSearchOrder() {
		Outcome o = procedure.decide(HoareFileParser.parseFormula("b ==> c"), ENVIRONMENT);
		assertEquals(Outcome.Kind.INVALID, o.getKind());
		assertEquals("{b = true, c = false}", o.getCounterexample().toString());
		o = procedure.decide(HoareFileParser.parseFormula("x != -2"), ENVIRONMENT);
		assertEquals("{x = -2}", o.getCounterexample().toString());
	}

	@Test
	public void testGroundFalsehood() {
		Outcome o = procedure.decide(HoareFileParser.parseFormula("1 = 2"), ENVIRONMENT);
		assertEquals(Outcome.Kind.INVALID, o.getKind());
		assertTrue(o.getCounterexample().getNames().isEmpty());
	}

	@Test
	public void testCounterexampleOutsideBound() {
		Outcome o = procedure.decide(HoareFileParser.parseFormula("x <= 100"), ENVIRONMENT);
		assertEquals(Outcome.Kind.UNKNOWN, o.getKind());
		assertNull(o.getCounterexample());
		o = new DecisionProcedure(10000, 200).decide(HoareFileParser.parseFormula("x <= 100"), ENVIRONMENT);
		assertEquals(Outcome.Kind.INVALID, o.getKind());
		assertEquals(BigInteger.valueOf(101), o.getCounterexample().get("x"));
	}

	@Test
	public void testNonlinearIsUnknown() {
		Outcome o = procedure.decide(HoareFileParser.parseFormula("x * x >= 0"), ENVIRONMENT);
		assertEquals(Outcome.Kind.UNKNOWN, o.getKind());
		assertNotNull(o.getReason());
	}

	@Test
	public void testDivisionByZeroIsNotACounterexample() {
		Outcome o = procedure.decide(HoareFileParser.parseFormula("(x / y) * y <= x"), ENVIRONMENT);
		assertEquals(Outcome.Kind.UNKNOWN, o.getKind());
	}

	@Test
	public void testQuantifiedIsUnknown() {
		Outcome o = procedure.decide(HoareFileParser.parseFormula("forall i:int. i >= x"), ENVIRONMENT);
		assertEquals(Outcome.Kind.UNKNOWN, o.getKind());
		assertEquals("quantified formula", o.getReason());
		assertValid("forall i:int. x = x");
	}

	@Test
	public void testVacuousQuantifier() {
		Outcome o = procedure.decide(HoareFileParser.parseFormula("(forall k:int. x > 0) ==> x > 1"), ENVIRONMENT);
		assertEquals(Outcome.Kind.INVALID, o.getKind());
		assertEquals("{x = 1}", o.getCounterexample().toString());
	}

	@Test
	public void testGivenNormalForm() {
		Expr.Logical formula = HoareFileParser.parseFormula("x >= 0 ==> x >= 1");
		Expr.Logical normalised = new Normaliser(10000).normalise(formula);
		assertEquals("{x = 0}", procedure.decide(formula, normalised, ENVIRONMENT).getCounterexample().toString());
		// The normal form is trusted rather than recomputed
		Outcome o = procedure.decide(formula, HoareFileParser.parseFormula("true"), ENVIRONMENT);
		assertEquals(Outcome.Kind.VALID, o.getKind());
	}

	@Test
	public void testStepBound() {
		Outcome o = new DecisionProcedure(3, 8).decide(HoareFileParser.parseFormula("x < y && y < z ==> x + 1 < z"),
				ENVIRONMENT);
		assertEquals(Outcome.Kind.UNKNOWN, o.getKind());
		assertTrue(o.getReason().contains("exhausted"), o.getReason());
	}

	@Test
	public void testInvalidBounds() {
		assertThrows(IllegalArgumentException.class, () -> new DecisionProcedure(0, 8));
		assertThrows(IllegalArgumentException.class, () -> new DecisionProcedure(100, -1));
	}

	private void assertValid(String formula) {
		Outcome o = procedure.decide(HoareFileParser.parseFormula(formula), ENVIRONMENT);
		assertEquals(Outcome.Kind.VALID, o.getKind(), formula + ": " + o);
	}
}
