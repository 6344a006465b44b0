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
 * Counts the steps taken by the decision procedure. Once the configured limit
 * is reached, any further step raises {@link Exhausted}, which the procedure
 * reports as an unknown outcome.
 */
public final class StepBudget {
	private final int limit;
	private int used;

	public StepBudget(int limit) {
		if (limit <= 0) {
			throw new IllegalArgumentException("step bound must be positive");
		}
		this.limit = limit;
	}

	public void step() {
		if (++used > limit) {
			throw new Exhausted(limit);
		}
	}

	public int getUsed() {
		return used;
	}

	public int getLimit() {
		return limit;
	}

	public static final class Exhausted extends RuntimeException {
		private static final long serialVersionUID = 1L;

		public Exhausted(int limit) {
			super("step bound of " + limit + " exhausted");
		}
	}
}
