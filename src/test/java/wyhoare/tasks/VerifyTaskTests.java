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
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;

import wyhoare.core.HoareFile;
import wyhoare.core.SyntacticException;
import wyhoare.io.HoareFileParser;
import wyhoare.tasks.VerificationCondition.Status;
import wyhoare.util.MailBox;

public class VerifyTaskTests {
	private static final String SUM = "var i, n, sum : int;\n"
			+ "triple sum: { n >= 1 }\n"
			+ "  i := 1; sum := 0;\n"
			+ "  while i < n invariant sum = (i * (i - 1)) / 2 && i <= n do\n"
			+ "    sum := sum + i; i := i + 1\n"
			+ "  od;\n"
			+ "  sum := sum + n\n"
			+ "{ sum = (n * (n + 1)) / 2 }";

	private static final String WEAK_SUM = SUM.replace(" && i <= n do", " do");

	@Test
	public void testAssignment() {
		TripleResult r = verify("var x : int; triple inc: { x = 0 } x := x + 1 { x = 1 }").getResult("inc");
		assertEquals(Verdict.VALID, r.getVerdict());
		assertEquals(1, r.getVerificationConditions().size());
		VerificationCondition vc = r.getVerificationConditions().get(0);
		assertEquals("x = 0 ==> x + 1 = 1", vc.getObligation().toString());
		assertEquals(Status.DISCHARGED, vc.getStatus());
		assertTrue(vc.getNormalisedObligation().isTrue());
	}

	@Test
	public void testConditional() {
		TripleResult r = verify("var x, y : int;\n"
				+ "triple abs: { true } if x > 0 then y := x else y := 0 - x fi { y >= 0 }").getResult("abs");
		assertEquals(Verdict.VALID, r.getVerdict());
		assertEquals(2, r.getVerificationConditions().size());
	}

	@Test
	public void testSumLoop() {
		TripleResult r = verify(SUM).getResult("sum");
		assertEquals(Verdict.VALID, r.getVerdict());
		assertEquals(3, r.getVerificationConditions().size());
		for (VerificationCondition vc : r.getVerificationConditions()) {
			assertEquals(Status.DISCHARGED, vc.getStatus(), vc.toString());
		}
	}

	@Test
	public void testWeakInvariantRefutedOnExit() {
		TripleResult r = verify(WEAK_SUM).getResult("sum");
		assertEquals(Verdict.INVALID, r.getVerdict());
		List<VerificationCondition> vcs = r.getVerificationConditions();
		assertEquals(Status.DISCHARGED, vcs.get(0).getStatus());
		assertEquals(Origin.Kind.LOOP_PRESERVATION, vcs.get(1).getOrigin().getKind());
		assertEquals(Status.DISCHARGED, vcs.get(1).getStatus());
		VerificationCondition exit = vcs.get(2);
		assertEquals(Origin.Kind.LOOP_EXIT, exit.getOrigin().getKind());
		assertEquals(Status.REFUTED, exit.getStatus());
		assertEquals("{i = 0, n = -1, sum = 0}", exit.getCounterexample().toString());
	}

	@Test
	public void testNonlinearIsIndeterminate() {
		TripleResult r = verify("var x, y : int; triple square: { true } y := x * x { y >= 0 }").getResult("square");
		assertEquals(Verdict.INDETERMINATE, r.getVerdict());
		assertEquals(Status.OPEN, r.getVerificationConditions().get(0).getStatus());
	}

	@Test
	public void testTriplesAreIndependent() {
		VerificationReport report = verify("var x : int;\n"
				+ "triple good: { x = 0 } x := x + 1 { x = 1 }\n"
				+ "triple bad: { x = 0 } y := x { y = 0 }\n"
				+ "triple wrong: { x = 0 } x := x + 1 { x = 2 }");
		assertEquals(3, report.getResults().size());
		assertEquals(Verdict.VALID, report.getResult("good").getVerdict());
		TripleResult bad = report.getResult("bad");
		assertTrue(bad.isFailed());
		assertNull(bad.getVerdict());
		assertEquals(SyntacticException.Kind.SCOPE, bad.getError().getKind());
		assertEquals("bad", bad.getError().getTriple());
		assertEquals(Verdict.INVALID, report.getResult("wrong").getVerdict());
		assertEquals(1, report.getDiagnostics().size());
		assertFalse(report.isValid());
	}

	@Test
	public void testDuplicateDeclaration() {
		VerificationReport report = verify("var x : int; var x : bool;\n"
				+ "triple a: { true } skip { true }\n"
				+ "triple b: { true } skip { true }");
		assertEquals(2, report.getResults().size());
		for (TripleResult r : report.getResults()) {
			assertTrue(r.isFailed());
			assertEquals(SyntacticException.Kind.SCOPE, r.getError().getKind());
		}
	}

	@Test
	public void testParallel() {
		StringBuilder sb = new StringBuilder(SUM);
		for (int i = 0; i != 8; ++i) {
			sb.append("\ntriple inc" + i + ": { i = " + i + " } i := i + 1 { i = " + (i + 1) + " }");
			sb.append("\ntriple dec" + i + ": { i = " + i + " } i := i - 1 { i = " + i + " }");
		}
		HoareFile unit = parse(sb.toString());
		VerificationReport sequential = new VerifyTask().verify(unit);
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			VerificationReport parallel = new VerifyTask().verify(unit, pool);
			assertEquals(names(sequential), names(parallel));
			for (int i = 0; i != sequential.getResults().size(); ++i) {
				assertEquals(sequential.getResults().get(i).getVerdict(), parallel.getResults().get(i).getVerdict());
			}
			assertEquals(Verdict.VALID, parallel.getResult("inc3").getVerdict());
			assertEquals(Verdict.INVALID, parallel.getResult("dec3").getVerdict());
		} finally {
			pool.shutdown();
		}
	}

	@Test
	public void testVacuousQuantifier() {
		VerificationReport report = verify("var x : int;\n"
				+ "triple good: { x = 0 } x := x + 1 { x = 1 }\n"
				+ "triple q: { forall k : int. x > 0 } skip { x > 1 }");
		assertEquals(List.of("good", "q"), names(report));
		assertEquals(Verdict.VALID, report.getResult("good").getVerdict());
		TripleResult q = report.getResult("q");
		assertEquals(Verdict.INVALID, q.getVerdict());
		VerificationCondition vc = q.getVerificationConditions().get(0);
		assertEquals(Status.REFUTED, vc.getStatus());
		assertEquals("{x = 1}", vc.getCounterexample().toString());
	}

	@Test
	public void testOptions() {
		VerificationOptions options = new VerificationOptions(5, 0);
		assertEquals(options, new VerifyTask(options).getOptions());
		// Too few steps to refute anything
		TripleResult r = new VerifyTask(options).verify(parse(WEAK_SUM)).getResult("sum");
		assertNotEquals(Verdict.INVALID, r.getVerdict());
	}

	private static VerificationReport verify(String text) {
		return new VerifyTask().verify(parse(text));
	}

	private static HoareFile parse(String text) {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		HoareFile unit = new HoareFileParser(text, errors).read();
		assertTrue(errors.isEmpty());
		return unit;
	}

	private static List<String> names(VerificationReport report) {
		ArrayList<String> names = new ArrayList<>();
		for (TripleResult r : report.getResults()) {
			names.add(r.getName());
		}
		return names;
	}
}
