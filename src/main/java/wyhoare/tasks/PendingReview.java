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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An outstanding review of one open verification condition. The decision is
 * applied to the condition when it arrives, unless the review has been
 * withdrawn in the meantime.
 */
public final class PendingReview {
	private static final Logger logger = LoggerFactory.getLogger(PendingReview.class);

	private final ReviewRequest request;
	private final VerificationCondition vc;
	private final CompletableFuture<ReviewDecision> decision;
	private final CompletableFuture<Boolean> applied;

	PendingReview(ReviewRequest request, VerificationCondition vc, ReviewBoundary boundary) {
		this.request = request;
		this.vc = vc;
		vc.beginReview(this);
		this.decision = boundary.review(request);
		this.applied = decision.handle((d, e) -> {
			if (e instanceof CancellationException) {
				return false;
			} else if (e != null) {
				logger.warn("review of {} failed: {}", request, e.getMessage());
				return false;
			} else if (vc.applyReview(this, d)) {
				logger.info("review of {}: {}", request, d);
				return true;
			} else {
				logger.debug("ignoring decision {} for withdrawn review of {}", d, request);
				return false;
			}
		});
	}

	public ReviewRequest getRequest() {
		return request;
	}

	public VerificationCondition getVerificationCondition() {
		return vc;
	}

	/**
	 * A future which completes once the reviewer's decision has been handled,
	 * yielding <code>true</code> if it was applied to the condition.
	 *
	 * @return
	 */
	public CompletableFuture<Boolean> whenApplied() {
		return applied;
	}

	/**
	 * Withdraw this review. The condition returns to the open state, and any
	 * decision arriving afterwards is ignored.
	 */
	public void withdraw() {
		if (vc.withdrawReview(this)) {
			logger.debug("withdrew review of {}", request);
		}
		decision.cancel(false);
	}
}
