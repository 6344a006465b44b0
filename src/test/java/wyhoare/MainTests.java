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
package wyhoare;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;

import wyhoare.core.SyntacticException;
import wyhoare.io.HoareFilePrinter.Notation;
import wyhoare.tasks.TripleResult;
import wyhoare.tasks.Verdict;
import wyhoare.tasks.VerificationOptions;
import wyhoare.tasks.VerificationReport;
import wyhoare.util.MailBox;

public class MainTests {

	@Test
	public void testValid() {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		VerificationReport report = new Main().setErrorHandler(errors)
				.verify("var x : int;\ntriple t: { x = 0 } x := x + 1 { x > 0 }");
		assertTrue(report.isValid());
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testMissingInvariant() {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		VerificationReport report = new Main().setErrorHandler(errors)
				.verify("var x : int;\n"
						+ "triple t: { x >= 0 } while x > 0 do x := x - 1 od { x = 0 }\n"
						+ "triple u: { x = 0 } skip { x = 0 }");
		assertEquals(2, report.getResults().size());
		TripleResult t = report.getResults().get(0);
		assertEquals("t", t.getName());
		assertTrue(t.isFailed());
		assertEquals(SyntacticException.Kind.MISSING_INVARIANT, t.getError().getKind());
		assertEquals(Verdict.VALID, report.getResults().get(1).getVerdict());
		assertFalse(report.isValid());
		assertEquals(1, errors.getAll().size());
		assertEquals("t", errors.getAll().get(0).getTriple());
	}

	@Test
	public void testMalformedDeclaration() {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		VerificationReport report = new Main().setErrorHandler(errors)
				.verify("var x int;\ntriple t: { true } skip { true }");
		assertTrue(report.getResults().isEmpty());
		assertEquals(1, report.getDiagnostics().size());
		assertEquals(1, errors.getAll().size());
		assertEquals(SyntacticException.Kind.SYNTAX, errors.getAll().get(0).getKind());
		assertNull(errors.getAll().get(0).getTriple());
	}

	@Test
	public void testUnknownCharacter() {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		VerificationReport report = new Main().setErrorHandler(errors).verify("var x : int; #");
		assertTrue(report.getResults().isEmpty());
		assertEquals(SyntacticException.Kind.SYNTAX, errors.getAll().get(0).getKind());
	}

	@Test
	public void testFile() throws IOException {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		VerificationReport report = new Main().setErrorHandler(errors)
				.verify(Paths.get("tests/valid/assignment.hoare"));
		assertEquals(4, report.getResults().size());
		assertTrue(report.isValid());
		assertEquals(0, report.getResult("nothing").getVerificationConditions().size());
	}

	@Test
	public void testExecutor() throws IOException {
		ExecutorService pool = Executors.newFixedThreadPool(2);
		try {
			MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
			VerificationReport report = new Main().setErrorHandler(errors).setExecutor(pool)
					.verify(Paths.get("tests/valid/loops.hoare"));
			assertTrue(report.isValid());
			assertTrue(errors.isEmpty());
		} finally {
			pool.shutdown();
		}
	}

	@Test
	public void testOptions() throws IOException {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		VerificationReport report = new Main().setErrorHandler(errors)
				.verify(Paths.get("tests/invalid/sum_weak_invariant.hoare"));
		assertEquals(Verdict.INVALID, report.getResults().get(0).getVerdict());
		// Without a search, the exit condition can no longer be refuted
		report = new Main().setErrorHandler(errors).setOptions(new VerificationOptions(5, 0))
				.verify(Paths.get("tests/invalid/sum_weak_invariant.hoare"));
		assertEquals(Verdict.INDETERMINATE, report.getResults().get(0).getVerdict());
	}

	@Test
	public void testArguments() {
		Main.Arguments args = Main.Arguments.parse(
				new String[] { "--maxSteps=50", "--bound=2", "--jobs=3", "--unicode", "a.hoare", "b.hoare" },
				VerificationOptions.DEFAULT);
		assertEquals(new VerificationOptions(50, 2), args.getOptions());
		assertEquals(Notation.UNICODE, args.getNotation());
		assertEquals(3, args.getJobs());
		assertEquals(Arrays.asList(Paths.get("a.hoare"), Paths.get("b.hoare")), args.getFiles());
		args = Main.Arguments.parse(new String[] { "a.hoare" }, VerificationOptions.DEFAULT);
		assertEquals(VerificationOptions.DEFAULT, args.getOptions());
		assertEquals(Notation.ASCII, args.getNotation());
		assertEquals(1, args.getJobs());
	}

	@Test
	public void testInvalidArguments() {
		String[][] invalid = { { "--maxSteps=0", "a.hoare" }, { "--jobs=x", "a.hoare" }, { "--jobs=0", "a.hoare" },
				{ "--bound=-1", "a.hoare" }, { "--verbose", "a.hoare" }, { "--unicode" }, {} };
		for (String[] args : invalid) {
			assertThrows(IllegalArgumentException.class,
					() -> Main.Arguments.parse(args, VerificationOptions.DEFAULT), Arrays.toString(args));
		}
	}
}
