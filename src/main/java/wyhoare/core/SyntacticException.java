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
package wyhoare.core;

/**
 * Signals a structural problem with a source unit (i.e. one which prevents
 * verification from being attempted). Each exception carries a
 * machine-distinguishable {@link Kind} and the position in the source unit
 * where the problem was detected.
 */
public class SyntacticException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		SYNTAX, SCOPE, TYPE, MISSING_INVARIANT
	}

	private final Kind kind;
	private final SourcePosition position;
	/**
	 * Name of the triple being processed, or <code>null</code> if the problem
	 * is not attributable to a single triple.
	 */
	private String triple;

	public SyntacticException(Kind kind, String message, SourcePosition position) {
		super(message);
		this.kind = kind;
		this.position = position == null ? SourcePosition.UNKNOWN : position;
	}

	public Kind getKind() {
		return kind;
	}

	public SourcePosition getPosition() {
		return position;
	}

	public String getTriple() {
		return triple;
	}

	/**
	 * Associate this error with the triple in which it arose.
	 *
	 * @param name
	 * @return
	 */
	public SyntacticException setTriple(String name) {
		this.triple = name;
		return this;
	}

	@Override
	public String toString() {
		String prefix = triple == null ? "" : triple + ": ";
		return prefix + position + ": " + kind.name().toLowerCase().replace('_', ' ') + " error: " + getMessage();
	}
}
