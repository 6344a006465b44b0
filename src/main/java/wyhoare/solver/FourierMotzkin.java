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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Decides whether a set of linear constraints is infeasible by Fourier-Motzkin
 * elimination. Every derived constraint is tightened over the integers, which
 * keeps the procedure sound for integer unknowns: if the constraints are
 * reported infeasible, they have no integer solution. The converse does not
 * hold, since a rational solution need not be integral.
 */
public class FourierMotzkin {
	private final StepBudget budget;

	public FourierMotzkin(StepBudget budget) {
		this.budget = budget;
	}

	/**
	 * Check whether a given set of constraints has no solution.
	 *
	 * @param constraints
	 * @return
	 * @throws StepBudget.Exhausted if the step bound is reached.
	 */
	public boolean isInfeasible(Collection<LinearConstraint> constraints) {
		List<LinearConstraint> current = simplify(constraints);
		while (current != null) {
			TreeSet<String> unknowns = new TreeSet<>();
			for (LinearConstraint c : current) {
				unknowns.addAll(c.getUnknowns());
			}
			if (unknowns.isEmpty()) {
				return false;
			}
			current = simplify(eliminate(select(unknowns, current), current));
		}
		return true;
	}

	/**
	 * Select the unknown whose elimination produces the fewest constraints.
	 */
	private static String select(TreeSet<String> unknowns, List<LinearConstraint> constraints) {
		String best = null;
		long cost = Long.MAX_VALUE;
		for (String u : unknowns) {
			long pos = 0, neg = 0;
			for (LinearConstraint c : constraints) {
				int s = c.getCoefficient(u).signum();
				if (s > 0) {
					pos++;
				} else if (s < 0) {
					neg++;
				}
			}
			if (pos * neg < cost) {
				best = u;
				cost = pos * neg;
			}
		}
		return best;
	}

	private List<LinearConstraint> eliminate(String unknown, List<LinearConstraint> constraints) {
		ArrayList<LinearConstraint> upper = new ArrayList<>();
		ArrayList<LinearConstraint> lower = new ArrayList<>();
		ArrayList<LinearConstraint> result = new ArrayList<>();
		for (LinearConstraint c : constraints) {
			int s = c.getCoefficient(unknown).signum();
			if (s > 0) {
				upper.add(c);
			} else if (s < 0) {
				lower.add(c);
			} else {
				result.add(c);
			}
		}
		for (LinearConstraint u : upper) {
			for (LinearConstraint l : lower) {
				budget.step();
				result.add(u.eliminate(unknown, l));
			}
		}
		return result;
	}

	/**
	 * Drop trivial and redundant constraints, keeping only the tightest bound
	 * for each left-hand side. Returns <code>null</code> if a contradiction is
	 * found, including a pair <code>L &lt;= a</code> and <code>-L &lt;= b</code>
	 * where <code>a + b &lt; 0</code>.
	 */
	private List<LinearConstraint> simplify(Collection<LinearConstraint> constraints) {
		LinkedHashMap<Map<String, BigInteger>, LinearConstraint> tightest = new LinkedHashMap<>();
		for (LinearConstraint c : constraints) {
			budget.step();
			if (c.isContradiction()) {
				return null;
			} else if (!c.isTrivial()) {
				LinearConstraint o = tightest.get(c.getCoefficients());
				if (o == null || c.getBound().compareTo(o.getBound()) < 0) {
					tightest.put(c.getCoefficients(), c);
				}
			}
		}
		for (LinearConstraint c : tightest.values()) {
			HashMap<String, BigInteger> negated = new HashMap<>();
			for (Map.Entry<String, BigInteger> e : c.getCoefficients().entrySet()) {
				negated.put(e.getKey(), e.getValue().negate());
			}
			LinearConstraint o = tightest.get(negated);
			if (o != null && c.getBound().add(o.getBound()).signum() < 0) {
				return null;
			}
		}
		return new ArrayList<>(tightest.values());
	}
}
