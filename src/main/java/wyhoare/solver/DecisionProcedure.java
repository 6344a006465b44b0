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

import static wyhoare.core.HoareFile.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wyhoare.core.Environment;
import wyhoare.io.HoareFilePrinter;
import wyhoare.logic.Evaluator;
import wyhoare.logic.FreeVariables;
import wyhoare.logic.FreshNames;
import wyhoare.logic.Normaliser;
import wyhoare.logic.Polynomial;
import wyhoare.logic.Substitution;
import wyhoare.util.AbstractExpressionFold;
import wyhoare.util.Pair;

/**
 * A bounded decision procedure for quantifier-free formulas over integers and
 * booleans. A formula is shown valid by refuting its negation: the negation
 * is split into disjunctive normal form, and each disjunct is refuted by
 * complementary boolean literals, by eliminating equalities, or by
 * Fourier-Motzkin elimination over its linear constraints. Nonlinear
 * monomials and divisions are treated as opaque unknowns, so facts about them
 * are not known.
 * <p>
 * If the formula cannot be shown valid, a counterexample is searched for by
 * enumerating small values for its variables. Every phase draws from the same
 * step budget; once this is exhausted the outcome is unknown.
 */
public class DecisionProcedure {
	private static final Logger logger = LoggerFactory.getLogger(DecisionProcedure.class);

	private final int maxSteps;
	private final int counterexampleBound;

	public DecisionProcedure(int maxSteps, int counterexampleBound) {
		if (maxSteps <= 0) {
			throw new IllegalArgumentException("step bound must be positive");
		} else if (counterexampleBound < 0) {
			throw new IllegalArgumentException("counterexample bound cannot be negative");
		}
		this.maxSteps = maxSteps;
		this.counterexampleBound = counterexampleBound;
	}

	/**
	 * Attempt to decide whether a formula holds for every assignment to its
	 * free variables.
	 *
	 * @param formula     Formula to decide.
	 * @param environment Declared types of the formula's free variables.
	 * @return
	 */
	public Outcome decide(Expr.Logical formula, Environment environment) {
		return decide(formula, new Normaliser(maxSteps).normalise(formula), environment);
	}

	/**
	 * Attempt to decide a formula whose normal form has already been
	 * computed. The normal form is used as given.
	 *
	 * @param formula     Formula to decide.
	 * @param normalised  Normal form of the formula.
	 * @param environment Declared types of the formula's free variables.
	 * @return
	 */
	public Outcome decide(Expr.Logical formula, Expr.Logical normalised, Environment environment) {
		Normaliser normaliser = new Normaliser(maxSteps);
		if (normalised.isTrue()) {
			return Outcome.valid();
		} else if (QUANTIFIED.visitLogical(normalised)) {
			return Outcome.unknown("quantified formula");
		}
		StepBudget budget = new StepBudget(maxSteps);
		try {
			Refutation refutation = new Refutation(normaliser, budget);
			if (refutation.isUnsatisfiable(normaliser.negate(normalised))) {
				return Outcome.valid();
			}
			// Any quantifier left in the original is vacuous, as the normal form has none
			Expr.Logical target = QUANTIFIED.visitLogical(formula) ? normalised : formula;
			Counterexample counterexample = search(FreeVariables.of(formula), target, environment, budget);
			if (counterexample != null) {
				return Outcome.invalid(counterexample);
			}
			return Outcome.unknown("no counterexample with values in [-" + counterexampleBound + ","
					+ counterexampleBound + "]");
		} catch (StepBudget.Exhausted e) {
			logger.debug("gave up on {}: {}", HoareFilePrinter.toString(normalised), e.getMessage());
			return Outcome.unknown(e.getMessage());
		}
	}

	// =========================================================================
	// Refutation
	// =========================================================================

	private static class Refutation {
		private final Normaliser normaliser;
		private final StepBudget budget;
		private final FourierMotzkin fm;
		private final FreshNames names = new FreshNames();

		public Refutation(Normaliser normaliser, StepBudget budget) {
			this.normaliser = normaliser;
			this.budget = budget;
			this.fm = new FourierMotzkin(budget);
		}

		/**
		 * Check that a normalised, quantifier-free formula has no solution.
		 */
		public boolean isUnsatisfiable(Expr.Logical formula) {
			for (List<Expr.Logical> cube : dnf(formula)) {
				if (!isUnsatisfiable(cube)) {
					return false;
				}
			}
			return true;
		}

		private boolean isUnsatisfiable(List<Expr.Logical> cube) {
			budget.step();
			HashSet<Expr.Logical> literals = new HashSet<>(cube);
			for (Expr.Logical l : cube) {
				if (l.isFalse() || literals.contains(normaliser.negate(l))) {
					return true;
				}
			}
			Pair<String, Expr> solution = solveEquality(cube);
			if (solution != null) {
				ArrayList<Expr.Logical> rest = new ArrayList<>();
				for (Expr.Logical l : cube) {
					Expr.Logical s = Substitution.substitute(l, solution.first(), solution.second(), names);
					rest.add(normaliser.normalise(s));
				}
				return isUnsatisfiable(normaliser.and(rest));
			}
			return fm.isInfeasible(linearise(cube));
		}

		/**
		 * Put a normalised formula into disjunctive normal form, returned as a
		 * list of conjunctions of literals. Disequalities are split into a pair
		 * of strict inequalities.
		 */
		private List<List<Expr.Logical>> dnf(Expr.Logical e) {
			if (e.isTrue()) {
				return Collections.singletonList(Collections.emptyList());
			} else if (e.isFalse()) {
				return Collections.emptyList();
			} else if (e instanceof Expr.LogicalAnd) {
				List<List<Expr.Logical>> result = dnf(CONST(true));
				for (Expr.Logical o : ((Expr.LogicalAnd) e).getOperands()) {
					result = product(result, dnf(o));
				}
				return result;
			} else if (e instanceof Expr.LogicalOr) {
				ArrayList<List<Expr.Logical>> result = new ArrayList<>();
				for (Expr.Logical o : ((Expr.LogicalOr) e).getOperands()) {
					result.addAll(dnf(o));
				}
				return result;
			} else if (e instanceof Expr.Implies) {
				Expr.Implies i = (Expr.Implies) e;
				ArrayList<List<Expr.Logical>> result = new ArrayList<>(dnf(normaliser.negate(i.getLeftHandSide())));
				result.addAll(dnf(i.getRightHandSide()));
				return result;
			} else if (e instanceof Expr.Iff) {
				Expr.Logical lhs = ((Expr.Iff) e).getLeftHandSide();
				Expr.Logical rhs = ((Expr.Iff) e).getRightHandSide();
				ArrayList<List<Expr.Logical>> result = new ArrayList<>(product(dnf(lhs), dnf(rhs)));
				result.addAll(product(dnf(normaliser.negate(lhs)), dnf(normaliser.negate(rhs))));
				return result;
			} else if (e instanceof Expr.NotEquals) {
				Expr.NotEquals r = (Expr.NotEquals) e;
				BigInteger k = Polynomial.of(r.getRightHandSide()).getConstant();
				ArrayList<List<Expr.Logical>> result = new ArrayList<>();
				result.add(Collections.singletonList(LTEQ(r.getLeftHandSide(), CONST(k.subtract(BigInteger.ONE)))));
				result.add(Collections.singletonList(GTEQ(r.getLeftHandSide(), CONST(k.add(BigInteger.ONE)))));
				return result;
			} else {
				return Collections.singletonList(Collections.singletonList(e));
			}
		}

		private List<List<Expr.Logical>> product(List<List<Expr.Logical>> lhs, List<List<Expr.Logical>> rhs) {
			ArrayList<List<Expr.Logical>> result = new ArrayList<>();
			for (List<Expr.Logical> l : lhs) {
				for (List<Expr.Logical> r : rhs) {
					budget.step();
					ArrayList<Expr.Logical> cube = new ArrayList<>(l);
					cube.addAll(r);
					result.add(cube);
				}
			}
			return result;
		}

		/**
		 * Find an equality in a conjunction, either explicit or implied by a
		 * pair of opposing bounds, which can be solved for a variable with a
		 * unit coefficient. The variable must not also occur within another
		 * monomial of the same equality.
		 *
		 * @return The variable and the term it equals, or <code>null</code>.
		 */
		private Pair<String, Expr> solveEquality(List<Expr.Logical> cube) {
			HashSet<Expr.Logical> literals = new HashSet<>(cube);
			for (Expr.Logical l : cube) {
				Expr.BinaryOperator r = null;
				if (l instanceof Expr.Equals) {
					r = (Expr.BinaryOperator) l;
				} else if (l instanceof Expr.LessThanOrEqual) {
					Expr.LessThanOrEqual le = (Expr.LessThanOrEqual) l;
					if (literals.contains(GTEQ(le.getLeftHandSide(), le.getRightHandSide()))) {
						r = le;
					}
				}
				if (r != null && !isFormula(r.getLeftHandSide())) {
					Pair<String, Expr> s = solve(Polynomial.of(r.getLeftHandSide())
							.subtract(Polynomial.of(r.getRightHandSide())));
					if (s != null) {
						return s;
					}
				}
			}
			return null;
		}

		/**
		 * Solve <code>p = 0</code> for some variable.
		 */
		private static Pair<String, Expr> solve(Polynomial p) {
			for (Map.Entry<Polynomial.Monomial, BigInteger> t : p.getTerms().entrySet()) {
				Polynomial.Monomial m = t.getKey();
				BigInteger c = t.getValue();
				if (!m.isVariable() || !c.abs().equals(BigInteger.ONE)) {
					continue;
				}
				String var = ((Expr.VariableAccess) m.toExpr()).getVariable();
				Polynomial rest = p.subtract(Polynomial.atom(m.toExpr()).multiply(c));
				if (!occurs(var, rest)) {
					// c*x + rest = 0 ==> x = -rest / c
					Polynomial value = c.signum() > 0 ? rest.negate() : rest;
					return new Pair<>(var, value.toExpr());
				}
			}
			return null;
		}

		private static boolean occurs(String var, Polynomial p) {
			for (Polynomial.Monomial m : p.getTerms().keySet()) {
				if (FreeVariables.isFree(var, m.toExpr())) {
					return true;
				}
			}
			return false;
		}

		/**
		 * Translate the arithmetic literals of a conjunction into linear
		 * constraints, where each distinct monomial is an unknown. Literals
		 * with no arithmetic content are ignored, which can only make the
		 * constraints easier to satisfy.
		 */
		private List<LinearConstraint> linearise(List<Expr.Logical> cube) {
			ArrayList<LinearConstraint> constraints = new ArrayList<>();
			for (Expr.Logical l : cube) {
				if (l instanceof Expr.LessThanOrEqual) {
					constraints.add(lessThanOrEqual((Expr.BinaryOperator) l, false));
				} else if (l instanceof Expr.GreaterThanOrEqual) {
					constraints.add(lessThanOrEqual((Expr.BinaryOperator) l, true));
				} else if (l instanceof Expr.Equals && !isFormula(((Expr.Equals) l).getLeftHandSide())) {
					constraints.add(lessThanOrEqual((Expr.BinaryOperator) l, false));
					constraints.add(lessThanOrEqual((Expr.BinaryOperator) l, true));
				}
			}
			return constraints;
		}

		/**
		 * Construct <code>lhs - rhs &lt;= 0</code>, or <code>rhs - lhs &lt;= 0</code>
		 * when flipped.
		 */
		private static LinearConstraint lessThanOrEqual(Expr.BinaryOperator r, boolean flip) {
			Polynomial p = Polynomial.of(r.getLeftHandSide()).subtract(Polynomial.of(r.getRightHandSide()));
			if (flip) {
				p = p.negate();
			}
			TreeMap<String, BigInteger> coefficients = new TreeMap<>();
			for (Map.Entry<Polynomial.Monomial, BigInteger> t : p.getTerms().entrySet()) {
				coefficients.put(t.getKey().toString(), t.getValue());
			}
			return LinearConstraint.of(coefficients, p.getConstant().negate());
		}

		private static boolean isFormula(Expr e) {
			return e instanceof Expr.Logical && !(e instanceof Expr.VariableAccess);
		}
	}

	// =========================================================================
	// Counterexample search
	// =========================================================================

	/**
	 * Enumerate assignments to the free variables of a formula, looking for
	 * one under which it is false. Integers are drawn from
	 * <code>0, 1, -1, 2, -2, ...</code> up to the configured bound, booleans
	 * from <code>false, true</code>.
	 *
	 * @return A falsifying assignment, or <code>null</code> if none exists
	 *         within the bound.
	 */
	private Counterexample search(Set<String> variables, Expr.Logical formula, Environment environment,
			StepBudget budget) {
		ArrayList<String> names = new ArrayList<>(variables);
		ArrayList<List<Object>> domains = new ArrayList<>();
		for (String name : names) {
			domains.add(domain(environment.getType(name)));
		}
		int[] index = new int[names.size()];
		TreeMap<String, Object> binding = new TreeMap<>();
		while (true) {
			budget.step();
			for (int i = 0; i != names.size(); ++i) {
				binding.put(names.get(i), domains.get(i).get(index[i]));
			}
			if (falsifies(formula, binding)) {
				return new Counterexample(binding);
			}
			int i = names.size() - 1;
			while (i >= 0 && ++index[i] == domains.get(i).size()) {
				index[i] = 0;
				i = i - 1;
			}
			if (i < 0) {
				return null;
			}
		}
	}

	private List<Object> domain(Type type) {
		ArrayList<Object> values = new ArrayList<>();
		if (type instanceof Type.Bool) {
			values.add(Boolean.FALSE);
			values.add(Boolean.TRUE);
		} else {
			values.add(BigInteger.ZERO);
			for (int i = 1; i <= counterexampleBound; ++i) {
				values.add(BigInteger.valueOf(i));
				values.add(BigInteger.valueOf(-i));
			}
		}
		return values;
	}

	private static boolean falsifies(Expr.Logical formula, Map<String, Object> binding) {
		try {
			return !new Evaluator(binding).holds(formula);
		} catch (ArithmeticException e) {
			// Division by zero has no value, so this assignment proves nothing
			return false;
		}
	}

	private static final AbstractExpressionFold<Boolean> QUANTIFIED = new AbstractExpressionFold<Boolean>() {
		@Override
		protected Boolean constructExistentialQuantifier(Expr.ExistentialQuantifier expr, Boolean body) {
			return true;
		}

		@Override
		protected Boolean constructUniversalQuantifier(Expr.UniversalQuantifier expr, Boolean body) {
			return true;
		}

		@Override
		public Boolean BOTTOM() {
			return false;
		}

		@Override
		public Boolean join(Boolean lhs, Boolean rhs) {
			return lhs || rhs;
		}
	};
}
