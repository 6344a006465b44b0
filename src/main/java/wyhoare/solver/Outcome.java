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
package wyhoare.solver;

/**
 * The result of attempting to decide a single formula.
 */
public final class Outcome {
	public enum Kind {
		/**
		 * The formula holds for every assignment.
		 */
		VALID,
		/**
		 * The formula is falsified by a concrete assignment.
		 */
		INVALID,
		/**
		 * Neither could be established within the configured bounds.
		 */
		UNKNOWN
	}

	private static final Outcome VALID = new Outcome(Kind.VALID, null, null);

	private final Kind kind;
	private final Counterexample counterexample;
	private final String reason;

	private Outcome(Kind kind, Counterexample counterexample, String reason) {
		this.kind = kind;
		this.counterexample = counterexample;
		this.reason = reason;
	}

	public static Outcome valid() {
		return VALID;
	}

	public static Outcome invalid(Counterexample counterexample) {
		return new Outcome(Kind.INVALID, counterexample, null);
	}

	public static Outcome unknown(String reason) {
		return new Outcome(Kind.UNKNOWN, null, reason);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Get the falsifying assignment, or <code>null</code> unless the outcome is
	 * {@link Kind#INVALID}.
	 */
	public Counterexample getCounterexample() {
		return counterexample;
	}

	/**
	 * Get a short explanation of why the outcome is {@link Kind#UNKNOWN}.
	 */
	public String getReason() {
		return reason;
	}

	@Override
	public String toString() {
		switch (kind) {
		case INVALID:
			return "invalid " + counterexample;
		case UNKNOWN:
			return "unknown (" + reason + ")";
		default:
			return "valid";
		}
	}
}
