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

import java.util.Collections;
import java.util.List;

import wyhoare.core.SourcePosition;

/**
 * Identifies the rule application which produced a verification condition,
 * so that failures can be reported against the program.
 */
public final class Origin {
	public enum Kind {
		/**
		 * The declared (or branch) precondition must establish what the
		 * following statements require.
		 */
		PRECONDITION("precondition"),
		/**
		 * The loop invariant must hold on entry.
		 */
		LOOP_INITIATION("loop initiation"),
		/**
		 * The loop body must preserve the invariant.
		 */
		LOOP_PRESERVATION("loop preservation"),
		/**
		 * The invariant and negated guard must establish the postcondition.
		 */
		LOOP_EXIT("loop exit");

		private final String description;

		private Kind(String description) {
			this.description = description;
		}

		@Override
		public String toString() {
			return description;
		}
	}

	private final Kind kind;
	private final SourcePosition position;
	private final List<String> path;

	public Origin(Kind kind, SourcePosition position, List<String> path) {
		this.kind = kind;
		this.position = position == null ? SourcePosition.UNKNOWN : position;
		this.path = Collections.unmodifiableList(path);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Position of the statement at which the condition arose.
	 */
	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * Branches taken to reach the statement, each of which is either
	 * <code>then</code> or <code>else</code>.
	 */
	public List<String> getPath() {
		return path;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Origin) {
			Origin r = (Origin) o;
			return kind == r.kind && position.equals(r.position) && path.equals(r.path);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return kind.hashCode() ^ position.hashCode() ^ path.hashCode();
	}

	@Override
	public String toString() {
		String r = kind + " at " + position;
		if (!path.isEmpty()) {
			r += " " + path;
		}
		return r;
	}
}
