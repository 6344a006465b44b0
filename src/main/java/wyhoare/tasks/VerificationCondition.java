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

import wyhoare.core.HoareFile.Expr;
import wyhoare.io.HoareFilePrinter;
import wyhoare.solver.Counterexample;

/**
 * A proof obligation produced for a triple, together with its current
 * status. The obligation itself never changes; the status is written only by
 * the discharge engine and, afterwards, by any reviewer decision.
 */
public final class VerificationCondition {
	public enum Status {
		DISCHARGED, OPEN, REFUTED
	}

	private final Expr.Logical obligation;
	private final Origin origin;

	private Expr.Logical normalised;
	private Status status = Status.OPEN;
	private Counterexample counterexample;
	private boolean reviewed;
	private String note;
	/**
	 * Identifies the most recent review request which has not been withdrawn.
	 */
	private Object pendingReview;

	public VerificationCondition(Expr.Logical obligation, Origin origin) {
		if (obligation == null) {
			throw new IllegalArgumentException("obligation required");
		} else if (origin == null) {
			throw new IllegalArgumentException("origin required");
		}
		this.obligation = obligation;
		this.origin = origin;
		this.normalised = obligation;
	}

	public Expr.Logical getObligation() {
		return obligation;
	}

	public Origin getOrigin() {
		return origin;
	}

	public synchronized Expr.Logical getNormalisedObligation() {
		return normalised;
	}

	public synchronized Status getStatus() {
		return status;
	}

	/**
	 * Get the assignment which falsifies this condition, or <code>null</code>
	 * if it was not refuted automatically.
	 */
	public synchronized Counterexample getCounterexample() {
		return counterexample;
	}

	/**
	 * Check whether the current status was decided by a reviewer.
	 */
	public synchronized boolean isReviewed() {
		return reviewed;
	}

	/**
	 * Get the reviewer's note, such as a suggested invariant, or
	 * <code>null</code>.
	 */
	public synchronized String getNote() {
		return note;
	}

	synchronized void discharged(Expr.Logical normalised, Status status, Counterexample counterexample) {
		this.normalised = normalised;
		this.status = status;
		this.counterexample = counterexample;
	}

	synchronized void beginReview(Object token) {
		this.pendingReview = token;
	}

	/**
	 * Apply a reviewer's decision, provided the request it answers has not
	 * been withdrawn or superseded.
	 *
	 * @return <code>true</code> if the decision was applied.
	 */
	synchronized boolean applyReview(Object token, ReviewDecision decision) {
		if (pendingReview != token) {
			return false;
		}
		reviewed = true;
		note = decision.getNote();
		switch (decision.getKind()) {
		case ACCEPT:
			status = Status.DISCHARGED;
			break;
		case REJECT:
			status = Status.REFUTED;
			break;
		default:
			status = Status.OPEN;
		}
		return true;
	}

	/**
	 * Withdraw a review, returning this condition to the open state whether or
	 * not a decision has already been applied.
	 *
	 * @return <code>true</code> if the request had not already been withdrawn
	 *         or superseded.
	 */
	synchronized boolean withdrawReview(Object token) {
		if (pendingReview != token) {
			return false;
		}
		pendingReview = null;
		reviewed = false;
		note = null;
		status = Status.OPEN;
		return true;
	}

	@Override
	public String toString() {
		return origin + ": " + HoareFilePrinter.toString(obligation) + " (" + getStatus() + ")";
	}
}
