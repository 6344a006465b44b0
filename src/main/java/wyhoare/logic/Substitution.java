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

import java.util.HashSet;
import java.util.Set;

import wyhoare.util.AbstractExpressionTransform;

/**
 * Capture-avoiding substitution of a term for every free occurrence of a
 * variable. When the substitution passes under a quantifier binding a
 * variable which occurs free in the replacement term, the bound variable is
 * first renamed to a fresh name occurring neither in the quantified formula
 * nor in the term.
 */
public class Substitution extends AbstractExpressionTransform {
	private final String variable;
	private final Expr term;
	private final Set<String> termVariables;
	private final FreshNames names;
	/**
	 * Every name occurring in the expression being substituted into, none of
	 * which may be chosen when renaming.
	 */
	private final Set<String> context;

	private Substitution(String variable, Expr term, FreshNames names, Expr target) {
		this.variable = variable;
		this.term = term;
		this.termVariables = FreeVariables.of(term);
		this.names = names;
		this.context = FreeVariables.allNames(target);
	}

	/**
	 * Replace every free occurrence of <code>variable</code> in
	 * <code>formula</code> with <code>term</code>.
	 *
	 * @param formula
	 * @param variable
	 * @param term
	 * @param names    Source of fresh names for any bound variable which must
	 *                 be renamed.
	 * @return
	 */
	public static Expr.Logical substitute(Expr.Logical formula, String variable, Expr term, FreshNames names) {
		return new Substitution(variable, term, names, formula).visitLogical(formula);
	}

	/**
	 * Replace every free occurrence of <code>variable</code> in a term.
	 */
	public static Expr substitute(Expr e, String variable, Expr term, FreshNames names) {
		return new Substitution(variable, term, names, e).visitExpression(e);
	}

	@Override
	protected Expr.Logical constructVariableAccess(Expr.VariableAccess expr) {
		if (expr.getVariable().equals(variable)) {
			if (term instanceof Expr.Logical) {
				return (Expr.Logical) term;
			}
			// An integer term can only replace an integer variable, which
			// never occupies a formula position.
			throw new IllegalArgumentException("cannot substitute " + term + " for formula variable " + variable);
		}
		return expr;
	}

	@Override
	public Expr visitExpression(Expr expr) {
		// Integer variables are substituted here, since constructVariableAccess
		// can only return formulas.
		if (expr instanceof Expr.VariableAccess && ((Expr.VariableAccess) expr).getVariable().equals(variable)) {
			return term;
		}
		return super.visitExpression(expr);
	}

	@Override
	protected Expr.Logical visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
		Decl.Variable bound = expr.getVariable();
		if (!needsSubstitution(expr)) {
			return expr;
		} else if (termVariables.contains(bound.getName())) {
			Decl.Variable renamed = rename(expr);
			Expr.Logical body = substitute(expr.getBody(), bound.getName(), VAR(renamed.getName()), names);
			return FORALL(renamed, visitLogical(body), expr.getAttributes());
		} else {
			return constructUniversalQuantifier(expr, visitLogical(expr.getBody()));
		}
	}

	@Override
	protected Expr.Logical visitExistentialQuantifier(Expr.ExistentialQuantifier expr) {
		Decl.Variable bound = expr.getVariable();
		if (!needsSubstitution(expr)) {
			return expr;
		} else if (termVariables.contains(bound.getName())) {
			Decl.Variable renamed = rename(expr);
			Expr.Logical body = substitute(expr.getBody(), bound.getName(), VAR(renamed.getName()), names);
			return EXISTS(renamed, visitLogical(body), expr.getAttributes());
		} else {
			return constructExistentialQuantifier(expr, visitLogical(expr.getBody()));
		}
	}

	private boolean needsSubstitution(Expr.Quantifier q) {
		return !q.getVariable().getName().equals(variable) && FreeVariables.isFree(variable, q.getBody());
	}

	private Decl.Variable rename(Expr.Quantifier q) {
		HashSet<String> avoid = new HashSet<>(context);
		avoid.addAll(FreeVariables.allNames(q));
		avoid.addAll(FreeVariables.allNames(term));
		avoid.add(variable);
		String name = names.fresh(q.getVariable().getName(), avoid);
		return new Decl.Variable(name, q.getVariable().getType(), q.getVariable().getAttributes());
	}
}
