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
package wyhoare.core;

import static wyhoare.core.HoareFile.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import wyhoare.io.HoareFilePrinter;
import wyhoare.util.AbstractStatementVisitor;
import wyhoare.util.Pair;

/**
 * Checks that a triple only refers to declared variables and is well-typed
 * with respect to a given environment. At the same time, equalities between
 * booleans are rewritten as equivalences (i.e. <code>b = c</code> becomes
 * <code>b &lt;==&gt; c</code>), so that every equality produced by the
 * checker is over integers.
 */
public class TypeChecker extends AbstractStatementVisitor {
	private final Environment environment;

	public TypeChecker(Environment environment) {
		if (environment == null) {
			throw new IllegalArgumentException("environment required");
		}
		this.environment = environment;
	}

	/**
	 * Check a triple, returning its elaborated form.
	 *
	 * @param triple
	 * @return
	 * @throws ScopeError if an undeclared variable is used.
	 * @throws TypeError  if an expression is not well-typed.
	 */
	public HoareTriple check(HoareTriple triple) {
		Expr.Logical pre = checkFormula(triple.getPrecondition());
		Stmt program = visitStatement(triple.getProgram());
		Expr.Logical post = checkFormula(triple.getPostcondition());
		return new HoareTriple(pre, program, post);
	}

	/**
	 * Check a formula in which every free variable must be declared.
	 *
	 * @param formula
	 * @return
	 */
	public Expr.Logical checkFormula(Expr.Logical formula) {
		return (Expr.Logical) expect(Type.Bool, formula, new HashMap<>());
	}

	// =========================================================================
	// Statements
	// =========================================================================

	@Override
	protected Stmt constructAssignment(Stmt.Assignment s) {
		String name = s.getLeftHandSide().getVariable();
		Type declared = environment.getType(name);
		if (declared == null) {
			throw new ScopeError("variable " + name + " not declared", position(s));
		}
		Expr rhs = expect(declared, s.getRightHandSide(), new HashMap<>());
		if (rhs == s.getRightHandSide()) {
			return s;
		}
		return ASSIGN(s.getLeftHandSide(), rhs, s.getAttributes());
	}

	@Override
	protected Expr.Logical visitCondition(Expr.Logical condition) {
		if (condition instanceof Expr.Quantifier) {
			throw new TypeError("loop and branch conditions cannot be quantified", position(condition));
		}
		return checkFormula(condition);
	}

	@Override
	protected Expr.Logical visitInvariant(Expr.Logical invariant) {
		return checkFormula(invariant);
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	private Expr expect(Type expected, Expr e, Map<String, Type> scope) {
		Pair<Type, Expr> r = check(e, scope);
		if (!r.first().equals(expected)) {
			throw new TypeError("expected " + HoareFilePrinter.toString(expected) + ", found "
					+ HoareFilePrinter.toString(r.first()) + " (" + HoareFilePrinter.toString(e) + ")", position(e));
		}
		return r.second();
	}

	private Pair<Type, Expr> check(Expr e, Map<String, Type> scope) {
		if (e instanceof Expr.Integer) {
			return new Pair<>(Type.Int, e);
		} else if (e instanceof Expr.Boolean) {
			return new Pair<>(Type.Bool, e);
		} else if (e instanceof Expr.VariableAccess) {
			return new Pair<>(lookup((Expr.VariableAccess) e, scope), e);
		} else if (e instanceof Expr.Negation) {
			Expr operand = expect(Type.Int, ((Expr.Negation) e).getOperand(), scope);
			return new Pair<>(Type.Int, operand == ((Expr.Negation) e).getOperand() ? e : NEG(operand, e.getAttributes()));
		} else if (e instanceof Expr.Addition || e instanceof Expr.Subtraction || e instanceof Expr.Multiplication
				|| e instanceof Expr.IntegerDivision || e instanceof Expr.Remainder) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			Expr lhs = expect(Type.Int, b.getLeftHandSide(), scope);
			Expr rhs = expect(Type.Int, b.getRightHandSide(), scope);
			return new Pair<>(Type.Int, rebuildArithmetic(b, lhs, rhs));
		} else if (e instanceof Expr.Equals || e instanceof Expr.NotEquals) {
			return new Pair<>(Type.Bool, checkEquality((Expr.BinaryOperator) e, scope));
		} else if (e instanceof Expr.LessThan || e instanceof Expr.LessThanOrEqual || e instanceof Expr.GreaterThan
				|| e instanceof Expr.GreaterThanOrEqual) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			Expr lhs = expect(Type.Int, b.getLeftHandSide(), scope);
			Expr rhs = expect(Type.Int, b.getRightHandSide(), scope);
			return new Pair<>(Type.Bool, rebuildRelation(b, lhs, rhs));
		} else if (e instanceof Expr.LogicalNot) {
			Expr.LogicalNot n = (Expr.LogicalNot) e;
			Expr.Logical operand = (Expr.Logical) expect(Type.Bool, n.getOperand(), scope);
			return new Pair<>(Type.Bool, operand == n.getOperand() ? e : NOT(operand, e.getAttributes()));
		} else if (e instanceof Expr.LogicalAnd || e instanceof Expr.LogicalOr) {
			List<Expr.Logical> operands = ((Expr.AbstractNary) e).getOperands();
			ArrayList<Expr.Logical> noperands = new ArrayList<>();
			boolean changed = false;
			for (Expr.Logical o : operands) {
				Expr.Logical n = (Expr.Logical) expect(Type.Bool, o, scope);
				changed |= (n != o);
				noperands.add(n);
			}
			if (!changed) {
				return new Pair<>(Type.Bool, e);
			} else if (e instanceof Expr.LogicalAnd) {
				return new Pair<>(Type.Bool, AND(noperands, e.getAttributes()));
			} else {
				return new Pair<>(Type.Bool, OR(noperands, e.getAttributes()));
			}
		} else if (e instanceof Expr.Implies || e instanceof Expr.Iff) {
			Expr.BinaryOperator b = (Expr.BinaryOperator) e;
			Expr.Logical lhs = (Expr.Logical) expect(Type.Bool, b.getLeftHandSide(), scope);
			Expr.Logical rhs = (Expr.Logical) expect(Type.Bool, b.getRightHandSide(), scope);
			if (lhs == b.getLeftHandSide() && rhs == b.getRightHandSide()) {
				return new Pair<>(Type.Bool, e);
			} else if (e instanceof Expr.Implies) {
				return new Pair<>(Type.Bool, IMPLIES(lhs, rhs, e.getAttributes()));
			} else {
				return new Pair<>(Type.Bool, IFF(lhs, rhs, e.getAttributes()));
			}
		} else if (e instanceof Expr.Quantifier) {
			Expr.Quantifier q = (Expr.Quantifier) e;
			HashMap<String, Type> inner = new HashMap<>(scope);
			inner.put(q.getVariable().getName(), q.getVariable().getType());
			Expr.Logical body = (Expr.Logical) expect(Type.Bool, q.getBody(), inner);
			if (body == q.getBody()) {
				return new Pair<>(Type.Bool, e);
			} else if (e instanceof Expr.UniversalQuantifier) {
				return new Pair<>(Type.Bool, FORALL(q.getVariable(), body, e.getAttributes()));
			} else {
				return new Pair<>(Type.Bool, EXISTS(q.getVariable(), body, e.getAttributes()));
			}
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private Expr checkEquality(Expr.BinaryOperator e, Map<String, Type> scope) {
		Pair<Type, Expr> lhs = check(e.getLeftHandSide(), scope);
		Pair<Type, Expr> rhs = check(e.getRightHandSide(), scope);
		if (!lhs.first().equals(rhs.first())) {
			throw new TypeError("cannot compare " + HoareFilePrinter.toString(lhs.first()) + " with "
					+ HoareFilePrinter.toString(rhs.first()), position(e));
		} else if (lhs.first().equals(Type.Bool)) {
			Expr.Logical iff = IFF((Expr.Logical) lhs.second(), (Expr.Logical) rhs.second(), e.getAttributes());
			return e instanceof Expr.Equals ? iff : NOT(iff, e.getAttributes());
		} else if (lhs.second() == e.getLeftHandSide() && rhs.second() == e.getRightHandSide()) {
			return e;
		} else {
			return rebuildRelation(e, lhs.second(), rhs.second());
		}
	}

	private Type lookup(Expr.VariableAccess v, Map<String, Type> scope) {
		Type t = scope.get(v.getVariable());
		if (t == null) {
			t = environment.getType(v.getVariable());
		}
		if (t == null) {
			throw new ScopeError("variable " + v.getVariable() + " not declared", position(v));
		}
		return t;
	}

	private static Expr rebuildArithmetic(Expr.BinaryOperator e, Expr lhs, Expr rhs) {
		if (lhs == e.getLeftHandSide() && rhs == e.getRightHandSide()) {
			return e;
		} else if (e instanceof Expr.Addition) {
			return ADD(lhs, rhs, e.getAttributes());
		} else if (e instanceof Expr.Subtraction) {
			return SUB(lhs, rhs, e.getAttributes());
		} else if (e instanceof Expr.Multiplication) {
			return MUL(lhs, rhs, e.getAttributes());
		} else if (e instanceof Expr.IntegerDivision) {
			return IDIV(lhs, rhs, e.getAttributes());
		} else {
			return REM(lhs, rhs, e.getAttributes());
		}
	}

	private static Expr rebuildRelation(Expr.BinaryOperator e, Expr lhs, Expr rhs) {
		if (lhs == e.getLeftHandSide() && rhs == e.getRightHandSide()) {
			return e;
		} else if (e instanceof Expr.Equals) {
			return EQ(lhs, rhs, e.getAttributes());
		} else if (e instanceof Expr.NotEquals) {
			return NEQ(lhs, rhs, e.getAttributes());
		} else if (e instanceof Expr.LessThan) {
			return LT(lhs, rhs, e.getAttributes());
		} else if (e instanceof Expr.LessThanOrEqual) {
			return LTEQ(lhs, rhs, e.getAttributes());
		} else if (e instanceof Expr.GreaterThan) {
			return GT(lhs, rhs, e.getAttributes());
		} else {
			return GTEQ(lhs, rhs, e.getAttributes());
		}
	}

	private static SourcePosition position(Item item) {
		return item.getAttribute(SourcePosition.class);
	}
}
