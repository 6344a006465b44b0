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
package wyhoare.tasks;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import wyhoare.core.HoareTriple;
import wyhoare.core.SourcePosition;
import wyhoare.io.HoareFileParser;
import wyhoare.io.HoareFilePrinter;

public class VerificationConditionGeneratorTests {

	@Test
	public void testAssignment() {
		List<VerificationCondition> vcs = generate("x = 0", "x := x + 1", "x = 1");
		assertEquals(Arrays.asList("x = 0 ==> x + 1 = 1"), obligations(vcs));
		assertEquals(Origin.Kind.PRECONDITION, vcs.get(0).getOrigin().getKind());
		assertEquals(VerificationCondition.Status.OPEN, vcs.get(0).getStatus());
	}

	@Test
	public void testSequence() {
		List<VerificationCondition> vcs = generate("x = 0", "x := x + 1; y := x", "y = 1");
		assertEquals(Arrays.asList("x = 0 ==> x + 1 = 1"), obligations(vcs));
	}

	@Test
	public void testSkipWithIdenticalSidesIsOmitted() {
		assertTrue(generate("x >= 0", "skip", "x >= 0").isEmpty());
		assertEquals(Arrays.asList("x >= 1 ==> x >= 0"), obligations(generate("x >= 1", "skip", "x >= 0")));
	}

	@Test
	public void testConditional() {
		List<VerificationCondition> vcs = generate("true", "if x > 0 then y := x else y := 0 - x fi", "y >= 0");
		assertEquals(Arrays.asList("x > 0 ==> x >= 0", "!(x > 0) ==> 0 - x >= 0"), obligations(vcs));
		assertEquals(Arrays.asList("then"), vcs.get(0).getOrigin().getPath());
		assertEquals(Arrays.asList("else"), vcs.get(1).getOrigin().getPath());
	}

	@Test
	public void testNestedConditionalPaths() {
		List<VerificationCondition> vcs = generate("true",
				"if x > 0 then if y > 0 then z := 1 else z := 2 fi else z := 3 fi", "z > 0");
		assertEquals(3, vcs.size());
		assertEquals(Arrays.asList("then", "then"), vcs.get(0).getOrigin().getPath());
		assertEquals(Arrays.asList("then", "else"), vcs.get(1).getOrigin().getPath());
		assertEquals(Arrays.asList("else"), vcs.get(2).getOrigin().getPath());
	}

	@Test
	public void testConditionalFollowedByAssignment() {
		List<VerificationCondition> vcs = generate("x = 0", "if b then x := 1 else x := 2 fi; y := x", "y > 0");
		assertEquals(Arrays.asList("x = 0 && b ==> 1 > 0", "x = 0 && !b ==> 2 > 0"), obligations(vcs));
	}

	@Test
	public void testLoop() {
		List<VerificationCondition> vcs = generate("x >= 1", "while x > 0 invariant x >= 0 do x := x - 1 od",
				"x = 0");
		assertEquals(Arrays.asList("x >= 1 ==> x >= 0", "x >= 0 && x > 0 ==> x - 1 >= 0",
				"x >= 0 && !(x > 0) ==> x = 0"), obligations(vcs));
		assertEquals(Arrays.asList(Origin.Kind.LOOP_INITIATION, Origin.Kind.LOOP_PRESERVATION, Origin.Kind.LOOP_EXIT),
				kinds(vcs));
	}

	@Test
	public void testLoopInitiationOmittedWhenPreconditionIsInvariant() {
		List<VerificationCondition> vcs = generate("x >= 0", "while x > 0 invariant x >= 0 do x := x - 1 od",
				"x = 0");
		assertEquals(Arrays.asList(Origin.Kind.LOOP_PRESERVATION, Origin.Kind.LOOP_EXIT), kinds(vcs));
	}

	@Test
	public void testLoopWithinSequence() {
		List<VerificationCondition> vcs = generate("n >= 0", "i := 0; while i < n invariant i <= n do i := i + 1 od; r := i",
				"r = n");
		assertEquals(Arrays.asList("n >= 0 ==> 0 <= n", "i <= n && i < n ==> i + 1 <= n",
				"i <= n && !(i < n) ==> i = n"), obligations(vcs));
		assertEquals(Arrays.asList(Origin.Kind.PRECONDITION, Origin.Kind.LOOP_PRESERVATION, Origin.Kind.LOOP_EXIT),
				kinds(vcs));
	}

	@Test
	public void testOriginPosition() {
		HoareTriple t = new HoareTriple(HoareFileParser.parseFormula("x = 0"),
				HoareFileParser.parseStatements("skip;\n  x := 1"), HoareFileParser.parseFormula("x = 1"));
		List<VerificationCondition> vcs = VerificationConditionGenerator.generate(t);
		// Attributed to the first statement of the sequence
		assertEquals(new SourcePosition(1, 1), vcs.get(0).getOrigin().getPosition());
		assertEquals(Collections.emptyList(), vcs.get(0).getOrigin().getPath());
	}

	@Test
	public void testDeterministic() {
		HoareTriple t = triple("true", "x := y; while x > 0 invariant forall y:int. (y < x ==> y < x + 1) do x := x - 1 od",
				"x <= 0");
		assertEquals(obligations(VerificationConditionGenerator.generate(t)),
				obligations(VerificationConditionGenerator.generate(t)));
	}

	private static List<VerificationCondition> generate(String pre, String stmts, String post) {
		return VerificationConditionGenerator.generate(triple(pre, stmts, post));
	}

	private static HoareTriple triple(String pre, String stmts, String post) {
		return new HoareTriple(HoareFileParser.parseFormula(pre), HoareFileParser.parseStatements(stmts),
				HoareFileParser.parseFormula(post));
	}

	private static List<String> obligations(List<VerificationCondition> vcs) {
		ArrayList<String> r = new ArrayList<>();
		for (VerificationCondition vc : vcs) {
			r.add(HoareFilePrinter.toString(vc.getObligation()));
		}
		return r;
	}

	private static List<Origin.Kind> kinds(List<VerificationCondition> vcs) {
		ArrayList<Origin.Kind> r = new ArrayList<>();
		for (VerificationCondition vc : vcs) {
			r.add(vc.getOrigin().getKind());
		}
		return r;
	}
}
