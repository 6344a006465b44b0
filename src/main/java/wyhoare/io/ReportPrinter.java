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

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import wyhoare.core.SyntacticException;
import wyhoare.io.HoareFilePrinter.Notation;
import wyhoare.tasks.TripleResult;
import wyhoare.tasks.VerificationCondition;
import wyhoare.tasks.VerificationReport;

/**
 * Writes a verification report as plain text. Each triple is summarised on
 * one line, followed by one line for each of its verification conditions.
 * For example:
 *
 * <pre>
 * triple inc: VALID
 *   [0] precondition at 3:3: DISCHARGED true
 * triple sum: INVALID
 *   [2] loop exit at 5:3: REFUTED sum = ... counterexample {i = 0, n = -1, sum = 0}
 * </pre>
 */
public class ReportPrinter {
	private final PrintWriter out;
	private final Notation notation;

	public ReportPrinter(OutputStream output) {
		this(output, Notation.ASCII);
	}

	public ReportPrinter(OutputStream output, Notation notation) {
		this.out = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
		this.notation = notation;
	}

	public void write(VerificationReport report) {
		for (TripleResult r : report.getResults()) {
			write(r);
		}
		for (SyntacticException e : report.getDiagnostics()) {
			// Errors outside of any triple are not shown above
			if (e.getTriple() == null) {
				out.println(e);
			}
		}
		out.flush();
	}

	public void write(TripleResult result) {
		out.print("triple " + result.getName() + ": ");
		if (result.isFailed()) {
			SyntacticException e = result.getError();
			out.println(e.getKind() + " error at " + e.getPosition() + ": " + e.getMessage());
		} else {
			out.println(result.getVerdict());
			List<VerificationCondition> vcs = result.getVerificationConditions();
			for (int i = 0; i != vcs.size(); ++i) {
				write(i, vcs.get(i));
			}
		}
		out.flush();
	}

	private void write(int index, VerificationCondition vc) {
		out.print("  [" + index + "] " + vc.getOrigin() + ": " + vc.getStatus());
		if (vc.isReviewed()) {
			out.print(" (reviewed)");
		}
		out.print(" ");
		out.print(HoareFilePrinter.toString(vc.getNormalisedObligation(), notation));
		if (vc.getCounterexample() != null) {
			out.print(" counterexample " + vc.getCounterexample());
		}
		if (vc.getNote() != null) {
			out.print(" note: " + vc.getNote());
		}
		out.println();
	}

	public static String toString(VerificationReport report) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		new ReportPrinter(bout).write(report);
		return new String(bout.toByteArray(), StandardCharsets.UTF_8);
	}
}
