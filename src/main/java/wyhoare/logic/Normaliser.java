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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

import wyhoare.io.HoareFilePrinter;
import wyhoare.util.Util;

/**
 * Puts formulas into a canonical form. The normaliser folds constants,
 * collects arithmetic into canonical polynomials and reduces every relation
 * to one of <code>L = k</code>, <code>L != k</code>, <code>L &lt;= k</code> or
 * <code>L &gt;= k</code>. Negations are pushed down to atoms, while
 * conjunctions and disjunctions are flattened, sorted and deduplicated.
 * Trivial tautologies and contradictions collapse to <code>true</code> and
 * <code>false</code>.
 * <p>
 * Every rewrite strictly reduces the formula or puts it in a fixed order, so
 * repeated application reaches a fixed point. The number of passes is
 * nevertheless bounded.
 */
public class Normaliser {
	private final int maxPasses;

	public Normaliser(int maxPasses) {
		if (maxPasses <= 0) {
			throw new IllegalArgumentException("step bound must be positive");
		}
		this.maxPasses = maxPasses;
	}

	/**
	 * Normalise a formula.
	 *
	 * @param formula
	 * @return
	 */
	public Expr.Logical normalise(Expr.Logical formula) {
		Expr.Logical current = formula;
		for (int i = 0; i != maxPasses; ++i) {
			Expr.Logical next = normaliseOnce(current);
			if (next.equals(current)) {
				return next;
			}
			current = next;
		}
		return current;
	}

	/**
	 * Normalise an integer term.
	 */
	public Expr normalise(Expr term) {
		if (term instanceof Expr.Logical && !(term instanceof Expr.VariableAccess)) {
			return normalise((Expr.Logical) term);
		}
		return Polynomial.of(term).toExpr();
	}

	private Expr.Logical normaliseOnce(Expr.Logical e) {
		if (e instanceof Expr.Boolean) {
			return e;
		} else if (e instanceof Expr.VariableAccess) {
			return VAR(((Expr.VariableAccess) e).getVariable());
		} else if (e instanceof Expr.Equals || e instanceof Expr.NotEquals || e instanceof Expr.LessThan
				|| e instanceof Expr.LessThanOrEqual || e instanceof Expr.GreaterThan
				|| e instanceof Expr.GreaterThanOrEqual) {
			return relation((Expr.BinaryOperator) e);
		} else if (e instanceof Expr.LogicalNot) {
			return negate(normaliseOnce(((Expr.LogicalNot) e).getOperand()));
		} else if (e instanceof Expr.LogicalAnd) {
			return and(normaliseAll(((Expr.LogicalAnd) e).getOperands()));
		} else if (e instanceof Expr.LogicalOr) {
			return or(normaliseAll(((Expr.LogicalOr) e).getOperands()));
		} else if (e instanceof Expr.Implies) {
			Expr.Implies i = (Expr.Implies) e;
			return implies(normaliseOnce(i.getLeftHandSide()), normaliseOnce(i.getRightHandSide()));
		} else if (e instanceof Expr.Iff) {
			Expr.Iff i = (Expr.Iff) e;
			return iff(normaliseOnce(i.getLeftHandSide()), normaliseOnce(i.getRightHandSide()));
		} else if (e instanceof Expr.UniversalQuantifier) {
			Expr.Quantifier q = (Expr.Quantifier) e;
			return quantifier(true, q.getVariable(), normaliseOnce(q.getBody()));
		} else if (e instanceof Expr.ExistentialQuantifier) {
			Expr.Quantifier q = (Expr.Quantifier) e;
			return quantifier(false, q.getVariable(), normaliseOnce(q.getBody()));
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private List<Expr.Logical> normaliseAll(List<Expr.Logical> operands) {
		ArrayList<Expr.Logical> r = new ArrayList<>();
		for (Expr.Logical o : operands) {
			r.add(normaliseOnce(o));
		}
		return r;
	}

	// =========================================================================
	// Relations
	// =========================================================================

	private enum Relation {
		EQ, NEQ, LEQ
	}

	private Expr.Logical relation(Expr.BinaryOperator e) {
		Expr lhs = e.getLeftHandSide();
		Expr rhs = e.getRightHandSide();
		if (isFormula(lhs) || isFormula(rhs)) {
			// Equality between formulas which was not elaborated by the type
			// checker.
			Expr.Logical iff = iff(normaliseOnce((Expr.Logical) lhs), normaliseOnce((Expr.Logical) rhs));
			return e instanceof Expr.Equals ? iff : negate(iff);
		}
		Polynomial p = Polynomial.of(lhs).subtract(Polynomial.of(rhs));
		if (e instanceof Expr.Equals) {
			return relation(Relation.EQ, p);
		} else if (e instanceof Expr.NotEquals) {
			return relation(Relation.NEQ, p);
		} else if (e instanceof Expr.LessThan) {
			// lhs < rhs ==> lhs - rhs + 1 <= 0
			return relation(Relation.LEQ, p.add(Polynomial.constant(BigInteger.ONE)));
		} else if (e instanceof Expr.LessThanOrEqual) {
			return relation(Relation.LEQ, p);
		} else if (e instanceof Expr.GreaterThan) {
			// lhs > rhs ==> rhs - lhs + 1 <= 0
			return relation(Relation.LEQ, p.negate().add(Polynomial.constant(BigInteger.ONE)));
		} else {
			return relation(Relation.LEQ, p.negate());
		}
	}

	private static boolean isFormula(Expr e) {
		return e instanceof Expr.Logical && !(e instanceof Expr.VariableAccess);
	}

	/**
	 * Construct the canonical form of <code>p = 0</code>, <code>p != 0</code>
	 * or <code>p &lt;= 0</code>.
	 */
	private static Expr.Logical relation(Relation kind, Polynomial p) {
		BigInteger c = p.getConstant();
		if (p.isConstant()) {
			switch (kind) {
			case EQ:
				return CONST(c.signum() == 0);
			case NEQ:
				return CONST(c.signum() != 0);
			default:
				return CONST(c.signum() <= 0);
			}
		}
		BigInteger g = p.gcd();
		Polynomial lhs = p.getVariablePart();
		if (kind == Relation.LEQ) {
			// L + c <= 0 ==> L/g <= floor(-c/g)
			BigInteger k = Util.floorDiv(c.negate(), g);
			lhs = lhs.divideExactly(g);
			if (lhs.getLeadingCoefficient().signum() > 0) {
				return LTEQ(lhs.toExpr(), CONST(k));
			} else {
				return GTEQ(lhs.negate().toExpr(), CONST(k.negate()));
			}
		} else if (c.mod(g).signum() != 0) {
			// No integer solutions
			return CONST(kind == Relation.NEQ);
		} else {
			lhs = lhs.divideExactly(g);
			BigInteger k = c.negate().divide(g);
			if (lhs.getLeadingCoefficient().signum() < 0) {
				lhs = lhs.negate();
				k = k.negate();
			}
			return kind == Relation.EQ ? EQ(lhs.toExpr(), CONST(k)) : NEQ(lhs.toExpr(), CONST(k));
		}
	}

	// =========================================================================
	// Connectives
	// =========================================================================

	/**
	 * Negate a normalised formula, producing a normalised formula.
	 *
	 * @param e
	 * @return
	 */
	public Expr.Logical negate(Expr.Logical e) {
		if (e instanceof Expr.Boolean) {
			return CONST(!((Expr.Boolean) e).getValue());
		} else if (e instanceof Expr.VariableAccess) {
			return NOT(e);
		} else if (e instanceof Expr.LogicalNot) {
			return ((Expr.LogicalNot) e).getOperand();
		} else if (e instanceof Expr.Equals) {
			Expr.Equals r = (Expr.Equals) e;
			return NEQ(r.getLeftHandSide(), r.getRightHandSide());
		} else if (e instanceof Expr.NotEquals) {
			Expr.NotEquals r = (Expr.NotEquals) e;
			return EQ(r.getLeftHandSide(), r.getRightHandSide());
		} else if (e instanceof Expr.LessThanOrEqual) {
			// L <= k ==> L >= k + 1
			Expr.LessThanOrEqual r = (Expr.LessThanOrEqual) e;
			return GTEQ(r.getLeftHandSide(), CONST(constant(r.getRightHandSide()).add(BigInteger.ONE)));
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			Expr.GreaterThanOrEqual r = (Expr.GreaterThanOrEqual) e;
			return LTEQ(r.getLeftHandSide(), CONST(constant(r.getRightHandSide()).subtract(BigInteger.ONE)));
		} else if (e instanceof Expr.LessThan || e instanceof Expr.GreaterThan) {
			// Not produced by normalisation, but handled for completeness
			return normaliseOnce(NOT(e));
		} else if (e instanceof Expr.LogicalAnd) {
			return or(negateAll(((Expr.LogicalAnd) e).getOperands()));
		} else if (e instanceof Expr.LogicalOr) {
			return and(negateAll(((Expr.LogicalOr) e).getOperands()));
		} else if (e instanceof Expr.Implies) {
			Expr.Implies i = (Expr.Implies) e;
			return and(Arrays.asList(i.getLeftHandSide(), negate(i.getRightHandSide())));
		} else if (e instanceof Expr.Iff) {
			Expr.Iff i = (Expr.Iff) e;
			return iff(i.getLeftHandSide(), negate(i.getRightHandSide()));
		} else if (e instanceof Expr.UniversalQuantifier) {
			Expr.Quantifier q = (Expr.Quantifier) e;
			return quantifier(false, q.getVariable(), negate(q.getBody()));
		} else if (e instanceof Expr.ExistentialQuantifier) {
			Expr.Quantifier q = (Expr.Quantifier) e;
			return quantifier(true, q.getVariable(), negate(q.getBody()));
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private List<Expr.Logical> negateAll(List<Expr.Logical> operands) {
		ArrayList<Expr.Logical> r = new ArrayList<>();
		for (Expr.Logical o : operands) {
			r.add(negate(o));
		}
		return r;
	}

	private static BigInteger constant(Expr e) {
		if (e instanceof Expr.Integer) {
			return ((Expr.Integer) e).getValue();
		}
		return Polynomial.of(e).getConstant();
	}

	/**
	 * Construct a normalised conjunction from normalised operands.
	 */
	public Expr.Logical and(List<Expr.Logical> operands) {
		TreeMap<String, Expr.Logical> items = new TreeMap<>();
		for (Expr.Logical o : flatten(operands, true)) {
			if (o.isFalse()) {
				return CONST(false);
			} else if (!o.isTrue()) {
				items.put(key(o), o);
			}
		}
		for (Expr.Logical o : items.values()) {
			if (items.containsKey(key(negate(o)))) {
				return CONST(false);
			}
		}
		return AND(new ArrayList<>(items.values()));
	}

	/**
	 * Construct a normalised disjunction from normalised operands.
	 */
	public Expr.Logical or(List<Expr.Logical> operands) {
		TreeMap<String, Expr.Logical> items = new TreeMap<>();
		for (Expr.Logical o : flatten(operands, false)) {
			if (o.isTrue()) {
				return CONST(true);
			} else if (!o.isFalse()) {
				items.put(key(o), o);
			}
		}
		for (Expr.Logical o : items.values()) {
			if (items.containsKey(key(negate(o)))) {
				return CONST(true);
			}
		}
		return OR(new ArrayList<>(items.values()));
	}

	private static List<Expr.Logical> flatten(List<Expr.Logical> operands, boolean conjunction) {
		ArrayList<Expr.Logical> r = new ArrayList<>();
		for (Expr.Logical o : operands) {
			if (conjunction && o instanceof Expr.LogicalAnd) {
				r.addAll(((Expr.LogicalAnd) o).getOperands());
			} else if (!conjunction && o instanceof Expr.LogicalOr) {
				r.addAll(((Expr.LogicalOr) o).getOperands());
			} else {
				r.add(o);
			}
		}
		return r;
	}

	/**
	 * Construct a normalised implication from normalised operands. Nested
	 * implications on the right are curried into the antecedent, and any
	 * consequent which already appears as an antecedent conjunct is removed.
	 */
	public Expr.Logical implies(Expr.Logical lhs, Expr.Logical rhs) {
		if (lhs.isFalse() || rhs.isTrue()) {
			return CONST(true);
		} else if (lhs.isTrue()) {
			return rhs;
		} else if (rhs.isFalse()) {
			return negate(lhs);
		} else if (rhs instanceof Expr.Implies) {
			Expr.Implies r = (Expr.Implies) rhs;
			return implies(and(Arrays.asList(lhs, r.getLeftHandSide())), r.getRightHandSide());
		}
		List<Expr.Logical> antecedents = conjuncts(lhs);
		ArrayList<Expr.Logical> consequents = new ArrayList<>();
		for (Expr.Logical c : conjuncts(rhs)) {
			if (!antecedents.contains(c)) {
				consequents.add(c);
			}
		}
		if (consequents.isEmpty()) {
			return CONST(true);
		}
		Expr.Logical consequent = and(consequents);
		if (consequent instanceof Expr.LogicalOr) {
			for (Expr.Logical d : ((Expr.LogicalOr) consequent).getOperands()) {
				if (antecedents.contains(d)) {
					return CONST(true);
				}
			}
		}
		return IMPLIES(lhs, consequent);
	}

	private static List<Expr.Logical> conjuncts(Expr.Logical e) {
		if (e instanceof Expr.LogicalAnd) {
			return ((Expr.LogicalAnd) e).getOperands();
		}
		return Collections.singletonList(e);
	}

	/**
	 * Construct a normalised equivalence from normalised operands.
	 */
	public Expr.Logical iff(Expr.Logical lhs, Expr.Logical rhs) {
		if (lhs.isTrue()) {
			return rhs;
		} else if (rhs.isTrue()) {
			return lhs;
		} else if (lhs.isFalse()) {
			return negate(rhs);
		} else if (rhs.isFalse()) {
			return negate(lhs);
		} else if (lhs.equals(rhs)) {
			return CONST(true);
		} else if (lhs.equals(negate(rhs))) {
			return CONST(false);
		} else if (key(lhs).compareTo(key(rhs)) > 0) {
			return IFF(rhs, lhs);
		} else {
			return IFF(lhs, rhs);
		}
	}

	private static Expr.Logical quantifier(boolean universal, Decl.Variable var, Expr.Logical body) {
		if (!FreeVariables.isFree(var.getName(), body)) {
			return body;
		}
		Decl.Variable v = new Decl.Variable(var.getName(), var.getType());
		return universal ? FORALL(v, body) : EXISTS(v, body);
	}

	private static String key(Expr e) {
		return HoareFilePrinter.toString(e);
	}
}
