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
import wyhoare.core.SyntacticException;

/**
 * The result of verifying a single named triple. This is either a sequence
 * of verification conditions, from which the verdict is determined, or the
 * structural error which prevented verification.
 */
public final class TripleResult {
	private final String name;
	private final SourcePosition position;
	private final List<VerificationCondition> vcs;
	private final SyntacticException error;

	private TripleResult(String name, SourcePosition position, List<VerificationCondition> vcs,
			SyntacticException error) {
		this.name = name;
		this.position = position == null ? SourcePosition.UNKNOWN : position;
		this.vcs = Collections.unmodifiableList(vcs);
		this.error = error;
	}

	public static TripleResult verified(String name, SourcePosition position, List<VerificationCondition> vcs) {
		return new TripleResult(name, position, vcs, null);
	}

	public static TripleResult failed(String name, SourcePosition position, SyntacticException error) {
		return new TripleResult(name, position, Collections.emptyList(), error);
	}

	public String getName() {
		return name;
	}

	public SourcePosition getPosition() {
		return position;
	}

	public List<VerificationCondition> getVerificationConditions() {
		return vcs;
	}

	/**
	 * Get the structural error which prevented verification, or
	 * <code>null</code> if the triple was verified.
	 */
	public SyntacticException getError() {
		return error;
	}

	public boolean isFailed() {
		return error != null;
	}

	/**
	 * Get the current verdict for this triple, which reflects any review
	 * decisions applied since verification. A triple which failed has no
	 * verdict.
	 *
	 * @return
	 */
	public Verdict getVerdict() {
		return error != null ? null : Verdict.of(vcs);
	}

	@Override
	public String toString() {
		return name + ": " + (error != null ? error.getKind() + " error" : getVerdict());
	}
}
