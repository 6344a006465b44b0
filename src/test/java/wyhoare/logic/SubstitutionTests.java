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

import java.util.Arrays;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

import wyhoare.core.HoareFile.Expr;
import wyhoare.io.HoareFileParser;
import wyhoare.io.HoareFilePrinter;

public class SubstitutionTests {

	@Test
	public void testSimple() {
		assertEquals("x + 1 = 1", substitute("x = 1", "x", "x + 1"));
		assertEquals("(y + 1) * z > 0", substitute("x * z > 0", "x", "y + 1"));
		assertEquals("y = 0", substitute("y = 0", "x", "1"));
	}

	@Test
	public void testBooleanVariable() {
		assertEquals("!b ==> c", substitute("a ==> c", "a", "!b"));
	}

	@Test
	public void testBoundVariableShadows() {
		assertEquals("(forall x:int. x >= 0) && 5 = 5", substitute("(forall x:int. x >= 0) && x = 5", "x", "5"));
	}

	@Test
	public void testCaptureAvoided() {
		assertEquals("forall y_1:int. y + 1 < y_1", substitute("forall y:int. x < y", "x", "y + 1"));
		assertEquals("exists y_1:int. y_1 = y * 2", substitute("exists y:int. y = x", "x", "y * 2"));
	}

	@Test
	public void testRenamingAvoidsExistingNames() {
		// y_1 already occurs, so must not be chosen
		assertEquals("forall y_2:int. y + y_1 < y_2", substitute("forall y:int. x + y_1 < y", "x", "y"));
	}

	@Test
	public void testFreshNamesAreShared() {
		FreshNames names = new FreshNames();
		Expr.Logical f = HoareFileParser.parseFormula("forall y:int. x < y");
		Expr.Logical g = Substitution.substitute(f, "x", HoareFileParser.parseExpression("y"), names);
		Expr.Logical h = Substitution.substitute(f, "x", HoareFileParser.parseExpression("y"), names);
		assertEquals("forall y_1:int. y < y_1", HoareFilePrinter.toString(g));
		assertEquals("forall y_2:int. y < y_2", HoareFilePrinter.toString(h));
		assertEquals(2, names.size());
	}

	@Test
	public void testFreeVariables() {
		Expr e = HoareFileParser.parseFormula("(forall i:int. i < n) && x = y");
		assertEquals(new TreeSet<>(Arrays.asList("n", "x", "y")), FreeVariables.of(e));
		assertEquals(new TreeSet<>(Arrays.asList("i", "n", "x", "y")), FreeVariables.allNames(e));
		assertFalse(FreeVariables.isFree("i", e));
	}

	private static String substitute(String formula, String variable, String term) {
		Expr.Logical f = HoareFileParser.parseFormula(formula);
		Expr t = HoareFileParser.parseExpression(term);
		return HoareFilePrinter.toString(Substitution.substitute(f, variable, t, new FreshNames()));
	}
}
