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
package wyhoare.logic;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import wyhoare.io.HoareFileParser;

public class EvaluatorTests {

	@Test
	public void testArithmetic() {
		Evaluator e = new Evaluator(binding(3, 4, true));
		assertEquals(BigInteger.valueOf(15), e.evaluate(HoareFileParser.parseExpression("x * (y + 1)")));
		assertEquals(BigInteger.valueOf(-1), e.evaluate(HoareFileParser.parseExpression("x - y")));
		assertEquals(BigInteger.valueOf(-3), e.evaluate(HoareFileParser.parseExpression("-x")));
	}

	@Test
	public void testEuclideanDivision() {
		Evaluator e = new Evaluator(new HashMap<>());
		assertEquals(BigInteger.valueOf(-4), e.evaluate(HoareFileParser.parseExpression("-7 / 2")));
		assertEquals(BigInteger.valueOf(1), e.evaluate(HoareFileParser.parseExpression("-7 % 2")));
		assertEquals(BigInteger.valueOf(-3), e.evaluate(HoareFileParser.parseExpression("7 / -2")));
		assertEquals(BigInteger.valueOf(4), e.evaluate(HoareFileParser.parseExpression("-7 / -2")));
		assertEquals(BigInteger.valueOf(1), e.evaluate(HoareFileParser.parseExpression("-7 % -2")));
	}

	@Test
	public void testFormulas() {
		Evaluator e = new Evaluator(binding(3, 4, true));
		assertTrue(e.holds(HoareFileParser.parseFormula("x < y && b")));
		assertTrue(e.holds(HoareFileParser.parseFormula("x > y ==> !b")));
		assertFalse(e.holds(HoareFileParser.parseFormula("x >= y || !b")));
		assertTrue(e.holds(HoareFileParser.parseFormula("b <==> x != y")));
		assertFalse(e.holds(HoareFileParser.parseFormula("x = 3 ==> y <= 3")));
	}

	@Test
	public void testDivisionByZero() {
		Evaluator e = new Evaluator(binding(3, 0, false));
		assertThrows(ArithmeticException.class, () -> e.evaluate(HoareFileParser.parseExpression("x / y")));
		assertThrows(ArithmeticException.class, () -> e.holds(HoareFileParser.parseFormula("x % y = 0")));
	}

	@Test
	public void testUnboundVariable() {
		Evaluator e = new Evaluator(binding(3, 4, true));
		assertThrows(IllegalArgumentException.class, () -> e.holds(HoareFileParser.parseFormula("z = 0")));
	}

	@Test
	public void testQuantifier() {
		Evaluator e = new Evaluator(binding(3, 4, true));
		assertThrows(IllegalArgumentException.class,
				() -> e.holds(HoareFileParser.parseFormula("forall i:int. i = x")));
	}

	private static Map<String, Object> binding(int x, int y, boolean b) {
		HashMap<String, Object> binding = new HashMap<>();
		binding.put("x", BigInteger.valueOf(x));
		binding.put("y", BigInteger.valueOf(y));
		binding.put("b", b);
		return binding;
	}
}
