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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wyhoare.core.Environment;
import wyhoare.core.HoareFile;
import wyhoare.core.HoareFile.Decl;
import wyhoare.core.HoareTriple;
import wyhoare.core.SourcePosition;
import wyhoare.core.SyntacticException;
import wyhoare.core.TypeChecker;
import wyhoare.tasks.VerificationCondition.Status;

/**
 * Verifies every triple in a source unit. Triples are independent of each
 * other: each is type checked, reduced to verification conditions and
 * discharged in isolation, so that a structural error in one triple does not
 * affect the others. The only state they share is the environment of the
 * unit, which is never modified.
 */
public class VerifyTask {
	private static final Logger logger = LoggerFactory.getLogger(VerifyTask.class);

	private final VerificationOptions options;

	public VerifyTask() {
		this(VerificationOptions.DEFAULT);
	}

	public VerifyTask(VerificationOptions options) {
		if (options == null) {
			throw new IllegalArgumentException("options required");
		}
		this.options = options;
	}

	public VerificationOptions getOptions() {
		return options;
	}

	/**
	 * Verify every triple in a unit, in declaration order.
	 *
	 * @param unit
	 * @return
	 */
	public VerificationReport verify(HoareFile unit) {
		return verify(unit, Runnable::run);
	}

	/**
	 * Verify every triple in a unit, using a given executor to verify triples
	 * in parallel. Results are returned in declaration order regardless.
	 *
	 * @param unit
	 * @param executor
	 * @return
	 */
	public VerificationReport verify(HoareFile unit, Executor executor) {
		List<Decl.Triple> triples = unit.getTriples();
		ArrayList<TripleResult> results = new ArrayList<>();
		ArrayList<SyntacticException> diagnostics = new ArrayList<>();
		Environment environment;
		try {
			environment = Environment.of(unit);
		} catch (SyntacticException e) {
			// Every triple depends on the declarations
			logger.warn("invalid declarations: {}", e.getMessage());
			diagnostics.add(e);
			for (Decl.Triple t : triples) {
				results.add(TripleResult.failed(t.getName(), position(t), e));
			}
			return new VerificationReport(results, diagnostics);
		}
		for (TripleResult r : verifyAll(triples, environment, executor)) {
			results.add(r);
			if (r.isFailed()) {
				diagnostics.add(r.getError());
			}
		}
		return new VerificationReport(results, diagnostics);
	}

	private List<TripleResult> verifyAll(List<Decl.Triple> triples, Environment environment, Executor executor) {
		ArrayList<CompletableFuture<TripleResult>> futures = new ArrayList<>();
		for (Decl.Triple t : triples) {
			futures.add(CompletableFuture.supplyAsync(() -> verify(t, environment), executor));
		}
		ArrayList<TripleResult> results = new ArrayList<>();
		for (CompletableFuture<TripleResult> f : futures) {
			results.add(join(f));
		}
		return results;
	}

	/**
	 * Verify a single named triple against a given environment.
	 *
	 * @param triple
	 * @param environment
	 * @return
	 */
	public TripleResult verify(Decl.Triple triple, Environment environment) {
		String name = triple.getName();
		try {
			HoareTriple checked = new TypeChecker(environment).check(triple.getTriple());
			List<VerificationCondition> vcs = VerificationConditionGenerator.generate(checked);
			DischargeTask discharger = new DischargeTask(environment, options);
			for (VerificationCondition vc : vcs) {
				discharger.discharge(vc);
			}
			TripleResult result = TripleResult.verified(name, position(triple), vcs);
			logger.info("{}: {} ({} conditions)", name, result.getVerdict(), vcs.size());
			return result;
		} catch (SyntacticException e) {
			e.setTriple(name);
			logger.warn("{}", e.toString());
			return TripleResult.failed(name, position(triple), e);
		}
	}

	/**
	 * Refer every open verification condition of a triple for review. The
	 * triple's verdict reflects each decision as it arrives.
	 *
	 * @param result
	 * @param boundary
	 * @return One pending review for each open condition, in order.
	 */
	public List<PendingReview> requestReviews(TripleResult result, ReviewBoundary boundary) {
		if (boundary == null) {
			throw new IllegalArgumentException("review boundary required");
		}
		ArrayList<PendingReview> reviews = new ArrayList<>();
		List<VerificationCondition> vcs = result.getVerificationConditions();
		for (int i = 0; i != vcs.size(); ++i) {
			VerificationCondition vc = vcs.get(i);
			if (vc.getStatus() == Status.OPEN) {
				reviews.add(new PendingReview(new ReviewRequest(result.getName(), i, vc), vc, boundary));
			}
		}
		return reviews;
	}

	/**
	 * Refer every open verification condition in a report for review.
	 */
	public List<PendingReview> requestReviews(VerificationReport report, ReviewBoundary boundary) {
		ArrayList<PendingReview> reviews = new ArrayList<>();
		for (TripleResult r : report.getResults()) {
			reviews.addAll(requestReviews(r, boundary));
		}
		return reviews;
	}

	private static TripleResult join(CompletableFuture<TripleResult> f) {
		try {
			return f.join();
		} catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw e;
		}
	}

	private static SourcePosition position(Decl.Triple t) {
		return t.getAttribute(SourcePosition.class);
	}
}
