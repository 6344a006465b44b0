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

/**
 * A reviewer's response to a {@link ReviewRequest}.
 */
public final class ReviewDecision {
	public enum Kind {
		/**
		 * The condition holds.
		 */
		ACCEPT,
		/**
		 * The condition does not hold.
		 */
		REJECT,
		/**
		 * The annotations should be strengthened (e.g. a loop invariant), after
		 * which verification is re-run.
		 */
		STRENGTHEN
	}

	private final Kind kind;
	private final String note;

	private ReviewDecision(Kind kind, String note) {
		this.kind = kind;
		this.note = note;
	}

	public static ReviewDecision accept() {
		return new ReviewDecision(Kind.ACCEPT, null);
	}

	public static ReviewDecision reject(String note) {
		if (note == null) {
			throw new IllegalArgumentException("rejection requires a note");
		}
		return new ReviewDecision(Kind.REJECT, note);
	}

	public static ReviewDecision strengthen(String note) {
		if (note == null) {
			throw new IllegalArgumentException("strengthening requires a note");
		}
		return new ReviewDecision(Kind.STRENGTHEN, note);
	}

	public Kind getKind() {
		return kind;
	}

	public String getNote() {
		return note;
	}

	@Override
	public String toString() {
		return note == null ? kind.toString() : kind + " (" + note + ")";
	}
}
