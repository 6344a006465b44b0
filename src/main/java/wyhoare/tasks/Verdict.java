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

import java.util.List;

/**
 * The overall outcome of verifying a triple.
 */
public enum Verdict {
	VALID, INVALID, INDETERMINATE;

	/**
	 * Determine the verdict for a set of verification conditions. A triple is
	 * valid only when every condition is discharged, and invalid as soon as
	 * any is refuted.
	 *
	 * @param vcs
	 * @return
	 */
	public static Verdict of(List<VerificationCondition> vcs) {
		Verdict verdict = VALID;
		for (VerificationCondition vc : vcs) {
			switch (vc.getStatus()) {
			case REFUTED:
				return INVALID;
			case OPEN:
				verdict = INDETERMINATE;
				break;
			default:
			}
		}
		return verdict;
	}
}
