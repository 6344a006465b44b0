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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import wyhoare.core.HoareFile.Expr;
import wyhoare.io.HoareFileParser;
import wyhoare.io.HoareFilePrinter;

public class NormaliserTests {
	private final Normaliser normaliser = new Normaliser(100);

	@Test
	public void testLinearRelations() {
		assertNormalises("x = 0", "x + 1 = 1");
		assertNormalises("x - y <= -1", "x < y");
		assertNormalises("x >= 1", "x > 0");
		assertNormalises("x >= 1", "0 < x");
		assertNormalises("x - y = 0", "y = x");
	}

	@Test
	public void testCoefficientsAreTightened() {
		assertNormalises("x <= 1", "2 * x <= 3");
		assertNormalises("x >= -1", "2 * x >= -3");
		assertNormalises("false", "2 * x = 3");
		assertNormalises("true", "2 * x != 3");
		assertNormalises("x + 2 * y = 2", "2 * x + 4 * y = 4");
	}

	@Test
	public void testGroundAndCancellingArithmetic() {
		assertNormalises("true", "x + x = 2 * x");
		assertNormalises("true", "(x + y) * (x - y) = x * x - y * y");
		assertNormalises("false", "1 > 2");
		assertNormalises("true", "-7 / 2 = -4 && -7 % 2 = 1");
		assertNormalises("true", "(2 * x + 1) / 2 = x");
		assertNormalises("true", "(2 * x) % 2 = 0");
	}

	@Test
	public void testConnectives() {
		assertNormalises("x >= 1", "!(x <= 0)");
		assertNormalises("false", "x >= 0 && x < 0");
		assertNormalises("true", "x >= 0 || x < 0");
		assertNormalises("!b || !c", "!(b && c)");
		assertNormalises("b && c", "c && true && b");
		assertNormalises("b <==> c", "c <==> b");
		assertNormalises("!b", "b <==> false");
		assertNormalises("true", "b <==> b");
	}

	@Test
	public void testImplications() {
		assertNormalises("true", "x = 0 ==> x = 0");
		assertNormalises("true", "b ==> (c ==> b)");
		assertNormalises("true", "x >= 1 && y = 2 ==> y = 2");
		assertNormalises("x >= 1 ==> y = 2", "x > 0 ==> y = 2 && x >= 1");
		assertNormalises("!b", "b ==> false");
		assertNormalises("true", "b ==> c || b");
	}

	@Test
	public void testQuantifiers() {
		assertNormalises("x >= 0", "forall i:int. x >= 0");
		assertNormalises("exists i:int. i - x <= -1", "!(forall i:int. i >= x)");
	}

	@ParameterizedTest
	@ValueSource(strings = { "x + 1 = 1", "x * (y + 1) - 2 <= z", "(x * (x - 1)) / 2 = y", "b ==> x % 3 = 1 || c",
			"!(b <==> x > y)", "forall i:int. i >= 0 ==> i * i >= x", "x = 0 && (y = 1 || y = 2) ==> !(z != x)" })
	public void testIdempotent(String text) {
		Expr.Logical once = normaliser.normalise(HoareFileParser.parseFormula(text));
		assertEquals(once, normaliser.normalise(once));
	}

	@Test
	public void testNegationIsInvolution() {
		Expr.Logical e = normaliser.normalise(HoareFileParser.parseFormula("x < y && (b || z = 3)"));
		assertEquals(e, normaliser.negate(normaliser.negate(e)));
	}

	private void assertNormalises(String expected, String input) {
		Expr.Logical e = normaliser.normalise(HoareFileParser.parseFormula(input));
		assertEquals(expected, HoareFilePrinter.toString(e));
	}
}
