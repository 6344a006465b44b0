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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import wyhoare.core.SourcePosition;
import wyhoare.core.SyntacticException;

/**
 * The results of verifying every triple in a source unit, along with all
 * diagnostics reported along the way.
 */
public final class VerificationReport {
	private static final Comparator<TripleResult> SOURCE_ORDER = Comparator
			.comparingInt((TripleResult r) -> r.getPosition().getLine())
			.thenComparingInt(r -> r.getPosition().getColumn());

	private final List<TripleResult> results;
	private final List<SyntacticException> diagnostics;

	public VerificationReport(List<TripleResult> results, List<SyntacticException> diagnostics) {
		this.results = Collections.unmodifiableList(new ArrayList<>(results));
		this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
	}

	public List<TripleResult> getResults() {
		return results;
	}

	/**
	 * Get the result for a given triple, or <code>null</code> if there is no
	 * such triple.
	 */
	public TripleResult getResult(String name) {
		for (TripleResult r : results) {
			if (r.getName().equals(name)) {
				return r;
			}
		}
		return null;
	}

	public List<SyntacticException> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * Check whether every triple was verified and found valid.
	 */
	public boolean isValid() {
		for (TripleResult r : results) {
			if (r.getVerdict() != Verdict.VALID) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Include triples which were dropped before verification (e.g. while
	 * parsing), each reported as failed with the given error. Results are
	 * kept in source order.
	 *
	 * @param errors Errors naming the triple they occurred in.
	 * @return
	 */
	public VerificationReport include(List<SyntacticException> errors) {
		ArrayList<TripleResult> rs = new ArrayList<>(results);
		ArrayList<SyntacticException> ds = new ArrayList<>(errors);
		for (SyntacticException e : errors) {
			if (e.getTriple() != null) {
				SourcePosition position = e.getPosition();
				rs.add(TripleResult.failed(e.getTriple(), position, e));
			}
		}
		rs.sort(SOURCE_ORDER);
		ds.addAll(diagnostics);
		return new VerificationReport(rs, ds);
	}
}
