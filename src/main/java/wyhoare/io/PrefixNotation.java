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
package wyhoare.io;

import java.util.List;

import wyhoare.core.HoareFile.Decl;
import wyhoare.core.HoareFile.Expr;
import wyhoare.core.HoareFile.Type;
import wyhoare.util.AbstractExpressionVisitor;

/**
 * Renders formulas in prefix (Polish) notation, for example
 * <code>→ = x 0 = + x 1 1</code>. Conjunctions and disjunctions with more
 * than two operands are written as right-nested binary operators. Arithmetic
 * negation is written <code>~</code> to keep it apart from subtraction, and a
 * boolean quantified variable carries a <code>:bool</code> suffix. The
 * output can be read back with {@link PrefixNotationParser}.
 */
public class PrefixNotation extends AbstractExpressionVisitor<String, String> {
	private static final PrefixNotation INSTANCE = new PrefixNotation();

	public static String toString(Expr e) {
		return INSTANCE.visitExpression(e);
	}

	private static String op(String operator, String lhs, String rhs) {
		return operator + " " + lhs + " " + rhs;
	}

	private static String nary(String operator, List<String> operands) {
		String r = operands.get(operands.size() - 1);
		for (int i = operands.size() - 2; i >= 0; --i) {
			r = op(operator, operands.get(i), r);
		}
		return r;
	}

	@Override
	protected String constructInteger(Expr.Integer expr) {
		return expr.getValue().toString();
	}

	@Override
	protected String constructNegation(Expr.Negation expr, String operand) {
		return "~ " + operand;
	}

	@Override
	protected String constructAddition(Expr.Addition expr, String lhs, String rhs) {
		return op("+", lhs, rhs);
	}

	@Override
	protected String constructSubtraction(Expr.Subtraction expr, String lhs, String rhs) {
		return op("-", lhs, rhs);
	}

	@Override
	protected String constructMultiplication(Expr.Multiplication expr, String lhs, String rhs) {
		return op("*", lhs, rhs);
	}

	@Override
	protected String constructIntegerDivision(Expr.IntegerDivision expr, String lhs, String rhs) {
		return op("/", lhs, rhs);
	}

	@Override
	protected String constructRemainder(Expr.Remainder expr, String lhs, String rhs) {
		return op("%", lhs, rhs);
	}

	@Override
	protected String constructBoolean(Expr.Boolean expr) {
		return expr.getValue() ? "⊤" : "⊥";
	}

	@Override
	protected String constructVariableAccess(Expr.VariableAccess expr) {
		return expr.getVariable();
	}

	@Override
	protected String constructEquals(Expr.Equals expr, String lhs, String rhs) {
		return op("=", lhs, rhs);
	}

	@Override
	protected String constructNotEquals(Expr.NotEquals expr, String lhs, String rhs) {
		return op("≠", lhs, rhs);
	}

	@Override
	protected String constructLessThan(Expr.LessThan expr, String lhs, String rhs) {
		return op("<", lhs, rhs);
	}

	@Override
	protected String constructLessThanOrEqual(Expr.LessThanOrEqual expr, String lhs, String rhs) {
		return op("≤", lhs, rhs);
	}

	@Override
	protected String constructGreaterThan(Expr.GreaterThan expr, String lhs, String rhs) {
		return op(">", lhs, rhs);
	}

	@Override
	protected String constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, String lhs, String rhs) {
		return op("≥", lhs, rhs);
	}

	@Override
	protected String constructLogicalAnd(Expr.LogicalAnd expr, List<String> operands) {
		return nary("∧", operands);
	}

	@Override
	protected String constructLogicalOr(Expr.LogicalOr expr, List<String> operands) {
		return nary("∨", operands);
	}

	@Override
	protected String constructLogicalImplication(Expr.Implies expr, String lhs, String rhs) {
		return op("→", lhs, rhs);
	}

	@Override
	protected String constructLogicalIff(Expr.Iff expr, String lhs, String rhs) {
		return op("↔", lhs, rhs);
	}

	@Override
	protected String constructLogicalNot(Expr.LogicalNot expr, String operand) {
		return "¬ " + operand;
	}

	@Override
	protected String constructExistentialQuantifier(Expr.ExistentialQuantifier expr, String body) {
		return "∃ " + name(expr.getVariable()) + " " + body;
	}

	@Override
	protected String constructUniversalQuantifier(Expr.UniversalQuantifier expr, String body) {
		return "∀ " + name(expr.getVariable()) + " " + body;
	}

	private static String name(Decl.Variable var) {
		return var.getType() instanceof Type.Bool ? var.getName() + ":bool" : var.getName();
	}
}
