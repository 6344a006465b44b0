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

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import wyhoare.core.HoareFile.Expr;
import wyhoare.util.AbstractExpressionVisitor;
import wyhoare.util.Util;

/**
 * Evaluates a quantifier-free expression under a concrete assignment of
 * values to its variables. Integers are represented as {@link BigInteger}
 * and booleans as {@link Boolean}. Division or remainder by zero has no
 * value and raises an {@link ArithmeticException}.
 */
public class Evaluator extends AbstractExpressionVisitor<Object, Boolean> {
	private final Map<String, Object> binding;

	public Evaluator(Map<String, Object> binding) {
		this.binding = binding;
	}

	public boolean holds(Expr.Logical formula) {
		return visitLogical(formula);
	}

	public BigInteger evaluate(Expr term) {
		return (BigInteger) visitExpression(term);
	}

	@Override
	protected Object constructInteger(Expr.Integer expr) {
		return expr.getValue();
	}

	@Override
	protected Object constructNegation(Expr.Negation expr, Object operand) {
		return ((BigInteger) operand).negate();
	}

	@Override
	protected Object constructAddition(Expr.Addition expr, Object lhs, Object rhs) {
		return ((BigInteger) lhs).add((BigInteger) rhs);
	}

	@Override
	protected Object constructSubtraction(Expr.Subtraction expr, Object lhs, Object rhs) {
		return ((BigInteger) lhs).subtract((BigInteger) rhs);
	}

	@Override
	protected Object constructMultiplication(Expr.Multiplication expr, Object lhs, Object rhs) {
		return ((BigInteger) lhs).multiply((BigInteger) rhs);
	}

	@Override
	protected Object constructIntegerDivision(Expr.IntegerDivision expr, Object lhs, Object rhs) {
		return Util.div((BigInteger) lhs, nonZero(rhs));
	}

	@Override
	protected Object constructRemainder(Expr.Remainder expr, Object lhs, Object rhs) {
		return Util.rem((BigInteger) lhs, nonZero(rhs));
	}

	private static BigInteger nonZero(Object o) {
		BigInteger d = (BigInteger) o;
		if (d.signum() == 0) {
			throw new ArithmeticException("division by zero");
		}
		return d;
	}

	@Override
	public Object visitExpression(Expr expr) {
		if (expr instanceof Expr.VariableAccess) {
			return lookup((Expr.VariableAccess) expr);
		}
		return super.visitExpression(expr);
	}

	private Object lookup(Expr.VariableAccess expr) {
		Object value = binding.get(expr.getVariable());
		if (value == null) {
			throw new IllegalArgumentException("no value for variable " + expr.getVariable());
		}
		return value;
	}

	@Override
	protected Boolean constructBoolean(Expr.Boolean expr) {
		return expr.getValue();
	}

	@Override
	protected Boolean constructVariableAccess(Expr.VariableAccess expr) {
		return (Boolean) lookup(expr);
	}

	@Override
	protected Boolean constructEquals(Expr.Equals expr, Object lhs, Object rhs) {
		return lhs.equals(rhs);
	}

	@Override
	protected Boolean constructNotEquals(Expr.NotEquals expr, Object lhs, Object rhs) {
		return !lhs.equals(rhs);
	}

	@Override
	protected Boolean constructLessThan(Expr.LessThan expr, Object lhs, Object rhs) {
		return ((BigInteger) lhs).compareTo((BigInteger) rhs) < 0;
	}

	@Override
	protected Boolean constructLessThanOrEqual(Expr.LessThanOrEqual expr, Object lhs, Object rhs) {
		return ((BigInteger) lhs).compareTo((BigInteger) rhs) <= 0;
	}

	@Override
	protected Boolean constructGreaterThan(Expr.GreaterThan expr, Object lhs, Object rhs) {
		return ((BigInteger) lhs).compareTo((BigInteger) rhs) > 0;
	}

	@Override
	protected Boolean constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, Object lhs, Object rhs) {
		return ((BigInteger) lhs).compareTo((BigInteger) rhs) >= 0;
	}

	@Override
	protected Boolean constructLogicalAnd(Expr.LogicalAnd expr, List<Boolean> operands) {
		return !operands.contains(Boolean.FALSE);
	}

	@Override
	protected Boolean constructLogicalOr(Expr.LogicalOr expr, List<Boolean> operands) {
		return operands.contains(Boolean.TRUE);
	}

	@Override
	protected Boolean constructLogicalImplication(Expr.Implies expr, Boolean lhs, Boolean rhs) {
		return !lhs || rhs;
	}

	@Override
	protected Boolean constructLogicalIff(Expr.Iff expr, Boolean lhs, Boolean rhs) {
		return lhs.booleanValue() == rhs.booleanValue();
	}

	@Override
	protected Boolean constructLogicalNot(Expr.LogicalNot expr, Boolean operand) {
		return !operand;
	}

	@Override
	protected Boolean visitExistentialQuantifier(Expr.ExistentialQuantifier expr) {
		throw new IllegalArgumentException("cannot evaluate quantified formula");
	}

	@Override
	protected Boolean visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
		throw new IllegalArgumentException("cannot evaluate quantified formula");
	}

	@Override
	protected Boolean constructExistentialQuantifier(Expr.ExistentialQuantifier expr, Boolean body) {
		throw new IllegalArgumentException("cannot evaluate quantified formula");
	}

	@Override
	protected Boolean constructUniversalQuantifier(Expr.UniversalQuantifier expr, Boolean body) {
		throw new IllegalArgumentException("cannot evaluate quantified formula");
	}
}
