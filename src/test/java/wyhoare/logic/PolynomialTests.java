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

import org.junit.jupiter.api.Test;

import wyhoare.io.HoareFileParser;

public class PolynomialTests {

	@Test
	public void testCanonicalOrder() {
		assertEquals("2 * x - 3 * y + 4", of("4 - 3 * y + 2 * x").toString());
		assertEquals("x * x - 1", of("(x + 1) * (x - 1)").toString());
		assertEquals("x * y + x", of("x * (y + 1)").toString());
	}

	@Test
	public void testMultiplicationCommutes() {
		assertEquals(of("x * y * z"), of("z * (y * x)"));
	}

	@Test
	public void testCancellation() {
		Polynomial p = of("x + y - x");
		assertEquals(of("y"), p);
		assertTrue(of("x - x + 3").isConstant());
		assertEquals(BigInteger.valueOf(3), of("x - x + 3").getConstant());
	}

	@Test
	public void testCoefficients() {
		Polynomial p = of("4 * x + 6 * y + 1");
		assertEquals(BigInteger.valueOf(2), p.gcd());
		assertEquals(BigInteger.valueOf(4), p.getLeadingCoefficient());
		assertEquals(BigInteger.valueOf(-1), of("-x").getLeadingCoefficient());
		assertEquals("2 * x + 3 * y", p.getVariablePart().divideExactly(BigInteger.valueOf(2)).toString());
	}

	@Test
	public void testDivisionByConstant() {
		assertEquals("2 * x + 1", of("(4 * x + 3) / 2").toString());
		assertEquals("-x", of("x / -1").toString());
		assertEquals("x + (x * x + x) / 2", of("(x * x + 3 * x) / 2").toString());
		assertEquals("2", of("(3 * x + 5) % 3").toString());
		assertEquals("(x + 1) % 3", of("(4 * x + 1) % 3").toString());
	}

	@Test
	public void testOpaqueDivision() {
		assertEquals("x / y", of("x / y").toString());
		assertEquals("x % 0", of("x % 0").toString());
	}

	@Test
	public void testGroundDivision() {
		assertEquals("-4", of("-7 / 2").toString());
		assertEquals("-3", of("7 / -2").toString());
		assertEquals("1", of("-7 % 2").toString());
	}

	private static Polynomial of(String text) {
		return Polynomial.of(HoareFileParser.parseExpression(text));
	}
}
