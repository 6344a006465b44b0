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
package wyhoare.logic;

import static wyhoare.core.HoareFile.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import wyhoare.io.HoareFilePrinter;
import wyhoare.util.Util;

/**
 * An integer polynomial in canonical form: a sum of monomials with non-zero
 * coefficients, kept in a fixed order, plus a constant. The "atoms" from
 * which monomials are built are variables and those divisions or remainders
 * which cannot be simplified away (e.g. <code>(i*i + i) / 2</code>).
 */
public final class Polynomial {
	public static final Polynomial ZERO = new Polynomial(new TreeMap<>(), BigInteger.ZERO);

	/**
	 * Orders atoms with variables first and everything else afterwards, each
	 * group ordered by its printed form.
	 */
	private static final Comparator<Expr> ATOM_ORDER = (lhs, rhs) -> {
		int lr = (lhs instanceof Expr.VariableAccess) ? 0 : 1;
		int rr = (rhs instanceof Expr.VariableAccess) ? 0 : 1;
		if (lr != rr) {
			return lr - rr;
		}
		return key(lhs).compareTo(key(rhs));
	};

	/**
	 * A product of one or more atoms.
	 */
	public static final class Monomial implements Comparable<Monomial> {
		private final List<Expr> atoms;

		private Monomial(List<Expr> atoms) {
			ArrayList<Expr> sorted = new ArrayList<>(atoms);
			sorted.sort(ATOM_ORDER);
			this.atoms = Collections.unmodifiableList(sorted);
		}

		public List<Expr> getAtoms() {
			return atoms;
		}

		public int degree() {
			return atoms.size();
		}

		/**
		 * Check whether this monomial is a single variable.
		 */
		public boolean isVariable() {
			return atoms.size() == 1 && atoms.get(0) instanceof Expr.VariableAccess;
		}

		public Monomial multiply(Monomial m) {
			ArrayList<Expr> r = new ArrayList<>(atoms);
			r.addAll(m.atoms);
			return new Monomial(r);
		}

		public Expr toExpr() {
			Expr r = atoms.get(0);
			for (int i = 1; i < atoms.size(); ++i) {
				r = MUL(r, atoms.get(i));
			}
			return r;
		}

		/**
		 * Higher degree first, then atom by atom.
		 */
		@Override
		public int compareTo(Monomial o) {
			if (atoms.size() != o.atoms.size()) {
				return o.atoms.size() - atoms.size();
			}
			for (int i = 0; i != atoms.size(); ++i) {
				int c = ATOM_ORDER.compare(atoms.get(i), o.atoms.get(i));
				if (c != 0) {
					return c;
				}
			}
			return 0;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Monomial && compareTo((Monomial) o) == 0;
		}

		@Override
		public int hashCode() {
			return atoms.hashCode();
		}

		@Override
		public String toString() {
			return HoareFilePrinter.toString(toExpr());
		}
	}

	private final TreeMap<Monomial, BigInteger> terms;
	private final BigInteger constant;

	private Polynomial(TreeMap<Monomial, BigInteger> terms, BigInteger constant) {
		this.terms = terms;
		this.constant = constant;
	}

	public static Polynomial constant(BigInteger c) {
		return new Polynomial(new TreeMap<>(), c);
	}

	public static Polynomial atom(Expr atom) {
		TreeMap<Monomial, BigInteger> terms = new TreeMap<>();
		terms.put(new Monomial(Collections.singletonList(atom)), BigInteger.ONE);
		return new Polynomial(terms, BigInteger.ZERO);
	}

	/**
	 * Convert an integer term into canonical form. Division and remainder by
	 * a non-zero constant <code>d</code> are simplified by extracting the
	 * multiple of <code>d</code> from every coefficient, and ground terms are
	 * evaluated. Any other division or remainder becomes an atom.
	 *
	 * @param e
	 * @return
	 */
	public static Polynomial of(Expr e) {
		if (e instanceof Expr.Integer) {
			return constant(((Expr.Integer) e).getValue());
		} else if (e instanceof Expr.VariableAccess) {
			return atom(VAR(((Expr.VariableAccess) e).getVariable()));
		} else if (e instanceof Expr.Negation) {
			return of(((Expr.Negation) e).getOperand()).negate();
		} else if (e instanceof Expr.Addition) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			return of(b.getLeftHandSide()).add(of(b.getRightHandSide()));
		} else if (e instanceof Expr.Subtraction) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			return of(b.getLeftHandSide()).subtract(of(b.getRightHandSide()));
		} else if (e instanceof Expr.Multiplication) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			return of(b.getLeftHandSide()).multiply(of(b.getRightHandSide()));
		} else if (e instanceof Expr.IntegerDivision) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			return divide(of(b.getLeftHandSide()), of(b.getRightHandSide()));
		} else if (e instanceof Expr.Remainder) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			return remainder(of(b.getLeftHandSide()), of(b.getRightHandSide()));
		} else {
			throw new IllegalArgumentException("not an integer term: " + HoareFilePrinter.toString(e));
		}
	}

	private static Polynomial divide(Polynomial lhs, Polynomial rhs) {
		if (!rhs.isConstant() || rhs.constant.signum() == 0) {
			return atom(IDIV(lhs.toExpr(), rhs.toExpr()));
		} else if (lhs.isConstant()) {
			return constant(Util.div(lhs.constant, rhs.constant));
		}
		BigInteger d = rhs.constant.abs();
		Polynomial[] qr = lhs.split(d);
		Polynomial result = qr[0];
		if (!qr[1].isConstant()) {
			result = result.add(atom(IDIV(qr[1].toExpr(), CONST(d))));
		}
		// The residual constant lies in [0,d), so contributes nothing when it
		// stands alone.
		return rhs.constant.signum() < 0 ? result.negate() : result;
	}

	private static Polynomial remainder(Polynomial lhs, Polynomial rhs) {
		if (!rhs.isConstant() || rhs.constant.signum() == 0) {
			return atom(REM(lhs.toExpr(), rhs.toExpr()));
		} else if (lhs.isConstant()) {
			return constant(Util.rem(lhs.constant, rhs.constant));
		}
		BigInteger d = rhs.constant.abs();
		Polynomial residual = lhs.split(d)[1];
		if (residual.isConstant()) {
			return residual;
		}
		return atom(REM(residual.toExpr(), CONST(d)));
	}

	/**
	 * Split this polynomial into <code>q</code> and <code>r</code> such that
	 * <code>this = d*q + r</code>, where every coefficient of <code>r</code>
	 * (and its constant) lies in <code>[0,d)</code>.
	 */
	private Polynomial[] split(BigInteger d) {
		TreeMap<Monomial, BigInteger> q = new TreeMap<>();
		TreeMap<Monomial, BigInteger> r = new TreeMap<>();
		for (Map.Entry<Monomial, BigInteger> t : terms.entrySet()) {
			put(q, t.getKey(), Util.floorDiv(t.getValue(), d));
			put(r, t.getKey(), t.getValue().mod(d));
		}
		return new Polynomial[] { new Polynomial(q, Util.floorDiv(constant, d)),
				new Polynomial(r, constant.mod(d)) };
	}

	private static void put(TreeMap<Monomial, BigInteger> terms, Monomial m, BigInteger c) {
		if (c.signum() != 0) {
			terms.put(m, c);
		}
	}

	// =========================================================================
	// Arithmetic
	// =========================================================================

	public Polynomial add(Polynomial p) {
		TreeMap<Monomial, BigInteger> r = new TreeMap<>(terms);
		for (Map.Entry<Monomial, BigInteger> t : p.terms.entrySet()) {
			BigInteger c = r.getOrDefault(t.getKey(), BigInteger.ZERO).add(t.getValue());
			if (c.signum() == 0) {
				r.remove(t.getKey());
			} else {
				r.put(t.getKey(), c);
			}
		}
		return new Polynomial(r, constant.add(p.constant));
	}

	public Polynomial negate() {
		return multiply(BigInteger.ONE.negate());
	}

	public Polynomial subtract(Polynomial p) {
		return add(p.negate());
	}

	public Polynomial multiply(BigInteger k) {
		if (k.signum() == 0) {
			return ZERO;
		}
		TreeMap<Monomial, BigInteger> r = new TreeMap<>();
		for (Map.Entry<Monomial, BigInteger> t : terms.entrySet()) {
			r.put(t.getKey(), t.getValue().multiply(k));
		}
		return new Polynomial(r, constant.multiply(k));
	}

	public Polynomial multiply(Polynomial p) {
		Polynomial r = p.multiply(constant);
		for (Map.Entry<Monomial, BigInteger> t : terms.entrySet()) {
			TreeMap<Monomial, BigInteger> product = new TreeMap<>();
			for (Map.Entry<Monomial, BigInteger> s : p.terms.entrySet()) {
				product.put(t.getKey().multiply(s.getKey()), t.getValue().multiply(s.getValue()));
			}
			r = r.add(new Polynomial(product, BigInteger.ZERO))
					.add(new Polynomial(single(t.getKey(), t.getValue().multiply(p.constant)), BigInteger.ZERO));
		}
		return r;
	}

	/**
	 * Divide every coefficient and the constant exactly by a given divisor.
	 */
	public Polynomial divideExactly(BigInteger k) {
		TreeMap<Monomial, BigInteger> r = new TreeMap<>();
		for (Map.Entry<Monomial, BigInteger> t : terms.entrySet()) {
			r.put(t.getKey(), t.getValue().divide(k));
		}
		return new Polynomial(r, constant.divide(k));
	}

	private static TreeMap<Monomial, BigInteger> single(Monomial m, BigInteger c) {
		TreeMap<Monomial, BigInteger> r = new TreeMap<>();
		put(r, m, c);
		return r;
	}

	// =========================================================================
	// Accessors
	// =========================================================================

	public boolean isConstant() {
		return terms.isEmpty();
	}

	public BigInteger getConstant() {
		return constant;
	}

	/**
	 * Get the non-constant part of this polynomial.
	 */
	public Polynomial getVariablePart() {
		return new Polynomial(terms, BigInteger.ZERO);
	}

	public Map<Monomial, BigInteger> getTerms() {
		return Collections.unmodifiableMap(terms);
	}

	public BigInteger getCoefficient(Monomial m) {
		return terms.getOrDefault(m, BigInteger.ZERO);
	}

	/**
	 * Coefficient of the first monomial, or zero for a constant.
	 */
	public BigInteger getLeadingCoefficient() {
		return terms.isEmpty() ? BigInteger.ZERO : terms.firstEntry().getValue();
	}

	/**
	 * Greatest common divisor of the non-constant coefficients, which is zero
	 * for a constant polynomial.
	 */
	public BigInteger gcd() {
		BigInteger g = BigInteger.ZERO;
		for (BigInteger c : terms.values()) {
			g = g.gcd(c);
		}
		return g;
	}

	/**
	 * Convert into an expression, with terms in canonical order followed by
	 * the constant.
	 */
	public Expr toExpr() {
		Expr r = null;
		for (Map.Entry<Monomial, BigInteger> t : terms.entrySet()) {
			Expr m = t.getKey().toExpr();
			BigInteger c = t.getValue();
			if (r == null) {
				if (c.equals(BigInteger.ONE)) {
					r = m;
				} else if (c.equals(BigInteger.ONE.negate())) {
					r = NEG(m);
				} else {
					r = MUL(CONST(c), m);
				}
			} else {
				BigInteger a = c.abs();
				Expr term = a.equals(BigInteger.ONE) ? m : MUL(CONST(a), m);
				r = c.signum() > 0 ? ADD(r, term) : SUB(r, term);
			}
		}
		if (r == null) {
			return CONST(constant);
		} else if (constant.signum() > 0) {
			return ADD(r, CONST(constant));
		} else if (constant.signum() < 0) {
			return SUB(r, CONST(constant.negate()));
		} else {
			return r;
		}
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Polynomial) {
			Polynomial p = (Polynomial) o;
			return constant.equals(p.constant) && terms.equals(p.terms);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return terms.hashCode() * 31 + constant.hashCode();
	}

	@Override
	public String toString() {
		return HoareFilePrinter.toString(toExpr());
	}

	private static String key(Expr e) {
		return HoareFilePrinter.toString(e);
	}
}
