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
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import wyhoare.util.Util;

/**
 * A linear constraint of the form <code>c1*u1 + ... + cn*un &lt;= k</code>
 * over integer unknowns. Constraints are kept tightened: the coefficients have
 * no common divisor greater than one, and the bound is rounded down
 * accordingly.
 */
public final class LinearConstraint {
	private final TreeMap<String, BigInteger> coefficients;
	private final BigInteger bound;

	private LinearConstraint(TreeMap<String, BigInteger> coefficients, BigInteger bound) {
		this.coefficients = coefficients;
		this.bound = bound;
	}

	/**
	 * Construct the tightened constraint <code>sum(coefficients) &lt;= bound</code>.
	 *
	 * @param coefficients
	 * @param bound
	 * @return
	 */
	public static LinearConstraint of(Map<String, BigInteger> coefficients, BigInteger bound) {
		TreeMap<String, BigInteger> cs = new TreeMap<>();
		BigInteger g = BigInteger.ZERO;
		for (Map.Entry<String, BigInteger> e : coefficients.entrySet()) {
			if (e.getValue().signum() != 0) {
				cs.put(e.getKey(), e.getValue());
				g = g.gcd(e.getValue());
			}
		}
		if (g.compareTo(BigInteger.ONE) > 0) {
			for (Map.Entry<String, BigInteger> e : cs.entrySet()) {
				e.setValue(e.getValue().divide(g));
			}
			bound = Util.floorDiv(bound, g);
		}
		return new LinearConstraint(cs, bound);
	}

	public Set<String> getUnknowns() {
		return Collections.unmodifiableSet(coefficients.keySet());
	}

	public Map<String, BigInteger> getCoefficients() {
		return Collections.unmodifiableMap(coefficients);
	}

	public BigInteger getCoefficient(String unknown) {
		return coefficients.getOrDefault(unknown, BigInteger.ZERO);
	}

	public BigInteger getBound() {
		return bound;
	}

	/**
	 * A constraint without unknowns which cannot hold, i.e. <code>0 &lt;= k</code>
	 * with <code>k</code> negative.
	 */
	public boolean isContradiction() {
		return coefficients.isEmpty() && bound.signum() < 0;
	}

	public boolean isTrivial() {
		return coefficients.isEmpty() && bound.signum() >= 0;
	}

	/**
	 * Eliminate an unknown between this constraint, in which it has a positive
	 * coefficient, and another in which it has a negative coefficient.
	 *
	 * @param unknown
	 * @param lower
	 * @return
	 */
	public LinearConstraint eliminate(String unknown, LinearConstraint lower) {
		BigInteger a = getCoefficient(unknown);
		BigInteger b = lower.getCoefficient(unknown).negate();
		if (a.signum() <= 0 || b.signum() <= 0) {
			throw new IllegalArgumentException("unknown " + unknown + " not bounded from both sides");
		}
		TreeMap<String, BigInteger> r = new TreeMap<>();
		for (Map.Entry<String, BigInteger> e : coefficients.entrySet()) {
			r.merge(e.getKey(), e.getValue().multiply(b), BigInteger::add);
		}
		for (Map.Entry<String, BigInteger> e : lower.coefficients.entrySet()) {
			r.merge(e.getKey(), e.getValue().multiply(a), BigInteger::add);
		}
		r.remove(unknown);
		return of(r, bound.multiply(b).add(lower.bound.multiply(a)));
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof LinearConstraint) {
			LinearConstraint c = (LinearConstraint) o;
			return bound.equals(c.bound) && coefficients.equals(c.coefficients);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return coefficients.hashCode() ^ bound.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, BigInteger> e : coefficients.entrySet()) {
			BigInteger c = e.getValue();
			if (sb.length() > 0) {
				sb.append(c.signum() < 0 ? " - " : " + ");
			} else if (c.signum() < 0) {
				sb.append("-");
			}
			if (!c.abs().equals(BigInteger.ONE)) {
				sb.append(c.abs()).append("*");
			}
			sb.append(e.getKey());
		}
		if (sb.length() == 0) {
			sb.append("0");
		}
		return sb.append(" <= ").append(bound).toString();
	}
}
