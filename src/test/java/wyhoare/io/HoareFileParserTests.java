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

import java.util.List;

import org.junit.jupiter.api.Test;

import wyhoare.core.HoareFile;
import wyhoare.core.HoareFile.Decl;
import wyhoare.core.HoareFile.Expr;
import wyhoare.core.HoareFile.Stmt;
import wyhoare.core.HoareFile.Type;
import wyhoare.core.MissingInvariantError;
import wyhoare.core.SourcePosition;
import wyhoare.core.SyntacticException;
import wyhoare.core.SyntaxError;
import wyhoare.util.MailBox;

public class HoareFileParserTests {

	@Test
	public void testDeclarations() {
		HoareFile unit = parse("var x, y : int;\nvar b : bool;\ntriple t: { x = 0 } skip { x = 0 }");
		List<Decl.Variable> vars = unit.getVariables();
		assertEquals(3, vars.size());
		assertEquals("x", vars.get(0).getName());
		assertEquals(Type.Int, vars.get(1).getType());
		assertEquals(Type.Bool, vars.get(2).getType());
		assertEquals(1, unit.getTriples().size());
		assertEquals("t", unit.getTriples().get(0).getName());
	}

	@Test
	public void testTriplePosition() {
		HoareFile unit = parse("var x : int;\n\n  triple t: { true } skip { true }");
		Decl.Triple t = unit.getTriples().get(0);
		assertEquals(new SourcePosition(3, 3), t.getAttribute(SourcePosition.class));
	}

	@Test
	public void testTripleEquality() {
		Decl.Triple t1 = parse("var x : int; triple t: { x > 0 } skip { x > 0 }").getTriples().get(0);
		Decl.Triple t2 = parse("var x : int;\n\ntriple t:\n  {x>0}\n  skip\n  {x>0}").getTriples().get(0);
		Decl.Triple t3 = parse("var x : int; triple u: { x > 0 } skip { x > 0 }").getTriples().get(0);
		assertNotEquals(t1.getAttribute(SourcePosition.class), t2.getAttribute(SourcePosition.class));
		assertEquals(t1, t2);
		assertEquals(t1.hashCode(), t2.hashCode());
		assertNotEquals(t1, t3);
	}

	@Test
	public void testPrecedence() {
		assertEquals("x + y * z = 1", print("x + y * z = 1"));
		assertEquals("(x + y) * z = 1", print("(x + y) * z = 1"));
		assertEquals("a && b || c", print("a && b || c"));
		assertEquals("a && (b || c)", print("a && (b || c)"));
		assertEquals("a ==> b ==> c", print("a ==> b ==> c"));
		assertEquals("(a ==> b) ==> c", print("(a ==> b) ==> c"));
		assertEquals("x - (y - z) = 0", print("x - (y - z) = 0"));
		assertEquals("x - y - z = 0", print("x - y - z = 0"));
	}

	@Test
	public void testImpliesIsRightAssociative() {
		Expr e = HoareFileParser.parseExpression("a ==> b ==> c");
		assertTrue(e instanceof Expr.Implies);
		assertTrue(((Expr.Implies) e).getRightHandSide() instanceof Expr.Implies);
	}

	@Test
	public void testUnicodeOperators() {
		assertEquals(HoareFileParser.parseFormula("x >= 0 && !(y != 1) ==> b"),
				HoareFileParser.parseFormula("x ≥ 0 ∧ ¬(y ≠ 1) ⇒ b"));
		assertEquals(HoareFileParser.parseFormula("forall z:int. z <= z"),
				HoareFileParser.parseFormula("∀z:int. z ≤ z"));
	}

	@Test
	public void testQuantifierBindsTighterThanConnectives() {
		Expr e = HoareFileParser.parseExpression("forall i:int. i >= 0 ==> b");
		assertTrue(e instanceof Expr.Implies);
		assertTrue(((Expr.Implies) e).getLeftHandSide() instanceof Expr.UniversalQuantifier);
	}

	@Test
	public void testStatements() {
		Stmt s = HoareFileParser.parseStatements("x := 1; if x > 0 then y := x else skip fi; while x < 10 invariant x <= 10 do x := x + 1 od");
		assertTrue(s instanceof Stmt.Sequence);
		Stmt.Sequence seq = (Stmt.Sequence) s;
		assertEquals(3, seq.size());
		assertTrue(seq.get(0) instanceof Stmt.Assignment);
		assertTrue(seq.get(1) instanceof Stmt.IfElse);
		Stmt.While w = (Stmt.While) seq.get(2);
		assertEquals("x <= 10", HoareFilePrinter.toString(w.getInvariant()));
	}

	@Test
	public void testIfWithoutElse() {
		Stmt.IfElse s = (Stmt.IfElse) HoareFileParser.parseStatements("if x > 0 then x := 0 fi");
		assertTrue(s.getFalseBranch() instanceof Stmt.Skip);
	}

	@Test
	public void testComments() {
		HoareFile unit = parse("// leading\nvar x : int; // trailing\ntriple t: { x = 0 } skip { x = 0 }\n// done");
		assertEquals(1, unit.getTriples().size());
	}

	@Test
	public void testSyntaxErrorPosition() {
		try {
			parse("var x : int;\ntriple t: { x = 0 }\n  x := := 1 { x = 1 }");
			fail("expected syntax error");
		} catch (SyntaxError e) {
			assertEquals(new SourcePosition(3, 8), e.getPosition());
			assertEquals("an expression", e.getExpected());
			assertEquals("t", e.getTriple());
		}
	}

	@Test
	public void testUnknownCharacter() {
		try {
			parse("var x : int;\ntriple t: { x = 0 } x := x # 1 { x = 1 }");
			fail("expected syntax error");
		} catch (SyntaxError e) {
			assertEquals(new SourcePosition(2, 28), e.getPosition());
			assertEquals("'#'", e.getFound());
		}
	}

	@Test
	public void testTermWhereFormulaExpected() {
		assertThrows(SyntaxError.class, () -> HoareFileParser.parseFormula("x + 1"));
	}

	@Test
	public void testTrailingInput() {
		assertThrows(SyntaxError.class, () -> HoareFileParser.parseFormula("x = 1 )"));
	}

	@Test
	public void testMissingInvariant() {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		HoareFile unit = new HoareFileParser("var x : int;\n" + "triple bad: { x >= 0 } while x > 0 do x := x - 1 od { x = 0 }\n"
				+ "triple good: { x = 0 } skip { x = 0 }", errors).read();
		// The bad triple is dropped, but parsing continues
		assertEquals(1, unit.getTriples().size());
		assertEquals("good", unit.getTriples().get(0).getName());
		assertEquals(1, errors.getAll().size());
		SyntacticException e = errors.getAll().get(0);
		assertTrue(e instanceof MissingInvariantError);
		assertEquals("bad", e.getTriple());
		assertEquals(new SourcePosition(2, 24), e.getPosition());
	}

	private static HoareFile parse(String text) {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		HoareFile unit = new HoareFileParser(text, errors).read();
		assertTrue(errors.isEmpty(), "unexpected errors " + errors.getAll());
		return unit;
	}

	private static String print(String text) {
		return HoareFilePrinter.toString(HoareFileParser.parseExpression(text));
	}
}
