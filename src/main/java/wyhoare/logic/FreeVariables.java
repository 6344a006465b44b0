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

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

import wyhoare.core.HoareFile.Expr;
import wyhoare.util.AbstractExpressionFold;

/**
 * Computes the set of variables occurring in an expression.
 */
public class FreeVariables extends AbstractExpressionFold<Set<String>> {
	private static final FreeVariables FREE = new FreeVariables(false);
	private static final FreeVariables ALL = new FreeVariables(true);

	private final boolean includeBound;

	private FreeVariables(boolean includeBound) {
		this.includeBound = includeBound;
	}

	/**
	 * Get the variables occurring free in an expression, in sorted order.
	 *
	 * @param e
	 * @return
	 */
	public static Set<String> of(Expr e) {
		return new TreeSet<>(FREE.visitExpression(e));
	}

	/**
	 * Get every variable name occurring in an expression, whether free or
	 * bound.
	 *
	 * @param e
	 * @return
	 */
	public static Set<String> allNames(Expr e) {
		return new TreeSet<>(ALL.visitExpression(e));
	}

	public static boolean isFree(String var, Expr e) {
		return FREE.visitExpression(e).contains(var);
	}

	@Override
	protected Set<String> constructVariableAccess(Expr.VariableAccess expr) {
		return Collections.singleton(expr.getVariable());
	}

	@Override
	protected Set<String> constructExistentialQuantifier(Expr.ExistentialQuantifier expr, Set<String> body) {
		return bind(expr, body);
	}

	@Override
	protected Set<String> constructUniversalQuantifier(Expr.UniversalQuantifier expr, Set<String> body) {
		return bind(expr, body);
	}

	private Set<String> bind(Expr.Quantifier q, Set<String> body) {
		HashSet<String> r = new HashSet<>(body);
		if (includeBound) {
			r.add(q.getVariable().getName());
		} else {
			r.remove(q.getVariable().getName());
		}
		return r;
	}

	@Override
	public Set<String> BOTTOM() {
		return Collections.emptySet();
	}

	@Override
	public Set<String> join(Set<String> lhs, Set<String> rhs) {
		if (lhs.isEmpty()) {
			return rhs;
		} else if (rhs.isEmpty()) {
			return lhs;
		}
		HashSet<String> r = new HashSet<>(lhs);
		r.addAll(rhs);
		return r;
	}
}
