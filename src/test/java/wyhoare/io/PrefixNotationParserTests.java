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
package wyhoare.io;

import static org.junit.jupiter.api.Assertions.*;
import static wyhoare.core.HoareFile.*;

import org.junit.jupiter.api.Test;

import wyhoare.core.SourcePosition;
import wyhoare.core.SyntaxError;

public class PrefixNotationParserTests {

	@Test
	public void testRoundTrip() {
		String[] formulas = { "x = 0 ==> x + 1 = 1", "x > 0 && y > 0 && z > 0", "(a && b) && c", "a || b || !c",
				"exists i:int. i > x", "forall b:bool. b || !b", "-x * 2 - y / 3 % 4 >= -5", "x != y <==> !(x = y)",
				"x <= y ==> x < y + 1" };
		for (String text : formulas) {
			Expr.Logical formula = HoareFileParser.parseFormula(text);
			String prefix = PrefixNotation.toString(formula);
			Expr.Logical read = PrefixNotationParser.parseFormula(prefix);
			assertEquals(formula, read, prefix);
			assertEquals(prefix, PrefixNotation.toString(read));
		}
	}

	@Test
	public void testHandWritten() {
		assertEquals(HoareFileParser.parseFormula("x = 0 && n >= 0 ==> x + 1 = 1"),
				PrefixNotationParser.parseFormula("→ ∧ = x 0 ≥ n 0\n  = + x 1 1"));
		assertEquals(HoareFileParser.parseFormula("forall i:int. exists j:int. j > i"),
				PrefixNotationParser.parseFormula("∀ i ∃ j:int > j i"));
		assertEquals(CONST(false), PrefixNotationParser.parseFormula("⊥"));
	}

	@Test
	public void testNegativeLiteral() {
		assertEquals(ADD(VAR("x"), CONST(-3)), PrefixNotationParser.parseExpression("+ x -3"));
		assertEquals(SUB(VAR("x"), NEG(VAR("y"))), PrefixNotationParser.parseExpression("- x ~ y"));
	}

	@Test
	public void testMissingOperand() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> PrefixNotationParser.parseFormula("∧ a"));
		assertEquals("end of input", e.getFound());
		assertEquals(new SourcePosition(1, 4), e.getPosition());
	}

	@Test
	public void testTrailingInput() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> PrefixNotationParser.parseFormula("a b"));
		assertEquals("'b'", e.getFound());
		assertEquals(new SourcePosition(1, 3), e.getPosition());
	}

	@Test
	public void testTermWhereFormulaExpected() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> PrefixNotationParser.parseFormula("∧ a + x 1"));
		assertEquals("a formula", e.getExpected());
		assertEquals(new SourcePosition(1, 5), e.getPosition());
	}

	@Test
	public void testMalformedAtoms() {
		assertThrows(SyntaxError.class, () -> PrefixNotationParser.parseFormula("= result*fact(count) 1"));
		assertThrows(SyntaxError.class, () -> PrefixNotationParser.parseFormula("∀ int ⊤"));
		assertThrows(SyntaxError.class, () -> PrefixNotationParser.parseFormula("∀ b:real ⊤"));
		assertThrows(SyntaxError.class, () -> PrefixNotationParser.parseFormula(""));
	}
}
