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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import wyhoare.io.HoareFilePrinter;

/**
 * A parsed source unit. This holds the variable declarations and the named
 * Hoare triples of the unit, along with the complete set of formula, term and
 * statement nodes used to describe them. All nodes are immutable once
 * constructed and are compared structurally (i.e. ignoring attributes).
 */
public class HoareFile {
	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public HoareFile() {
		this.declarations = new ArrayList<>();
	}

	public HoareFile(List<? extends Decl> declarations) {
		this.declarations = new ArrayList<>(declarations);
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	/**
	 * Get all variable declarations in this unit, in order of appearance.
	 *
	 * @return
	 */
	public List<Decl.Variable> getVariables() {
		ArrayList<Decl.Variable> vars = new ArrayList<>();
		for (Decl d : declarations) {
			if (d instanceof Decl.Variable) {
				vars.add((Decl.Variable) d);
			}
		}
		return vars;
	}

	/**
	 * Get all triple declarations in this unit, in order of appearance.
	 *
	 * @return
	 */
	public List<Decl.Triple> getTriples() {
		ArrayList<Decl.Triple> triples = new ArrayList<>();
		for (Decl d : declarations) {
			if (d instanceof Decl.Triple) {
				triples.add((Decl.Triple) d);
			}
		}
		return triples;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}

		@Override
		public String toString() {
			return HoareFilePrinter.toString(this);
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * A named variable of a given type. These are used both for program
		 * variables declared in a unit, and for the variables bound by
		 * quantifiers.
		 */
		public static class Variable extends AbstractItem implements Decl {
			private final String name;
			private final Type type;

			public Variable(String name, Type type, Attribute... attributes) {
				super(attributes);
				if (name == null || type == null) {
					throw new IllegalArgumentException("invalid variable declaration");
				}
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Variable) {
					Variable v = (Variable) o;
					return name.equals(v.name) && type.equals(v.type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ type.hashCode();
			}
		}

		/**
		 * A named Hoare triple, which is the unit of verification.
		 */
		public static class Triple extends AbstractItem implements Decl {
			private final String name;
			private final HoareTriple triple;

			public Triple(String name, HoareTriple triple, Attribute... attributes) {
				super(attributes);
				if (name == null || triple == null) {
					throw new IllegalArgumentException("invalid triple declaration");
				}
				this.name = name;
				this.triple = triple;
			}

			public String getName() {
				return name;
			}

			public HoareTriple getTriple() {
				return triple;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Triple) {
					Triple t = (Triple) o;
					return name.equals(t.name) && triple.equals(t.triple);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ triple.hashCode();
			}
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		public static class Skip extends AbstractItem implements Stmt {
			private Skip(Attribute[] attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Skip;
			}

			@Override
			public int hashCode() {
				return 0;
			}
		}

		public static class Assignment extends AbstractItem implements Stmt {
			private final Expr.VariableAccess lhs;
			private final Expr rhs;

			private Assignment(Expr.VariableAccess lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr.VariableAccess getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Assignment) {
					Assignment a = (Assignment) o;
					return lhs.equals(a.lhs) && rhs.equals(a.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return lhs.hashCode() ^ rhs.hashCode();
			}
		}

		/**
		 * A sequence <code>S1; S2; ...; Sn</code> of two or more statements.
		 * This is equivalent to the right-nested sequence
		 * <code>S1; (S2; ...; Sn)</code>.
		 */
		public static class Sequence extends AbstractItem implements Stmt {
			private final List<Stmt> stmts;

			private Sequence(List<Stmt> stmts, Attribute[] attributes) {
				super(attributes);
				this.stmts = Collections.unmodifiableList(new ArrayList<>(stmts));
			}

			public List<Stmt> getAll() {
				return stmts;
			}

			public int size() {
				return stmts.size();
			}

			public Stmt get(int i) {
				return stmts.get(i);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Sequence && stmts.equals(((Sequence) o).stmts);
			}

			@Override
			public int hashCode() {
				return stmts.hashCode();
			}
		}

		public static class IfElse extends AbstractItem implements Stmt {
			private final Expr.Logical condition;
			private final Stmt trueBranch;
			private final Stmt falseBranch;

			private IfElse(Expr.Logical condition, Stmt trueBranch, Stmt falseBranch, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr.Logical getCondition() {
				return condition;
			}

			public Stmt getTrueBranch() {
				return trueBranch;
			}

			public Stmt getFalseBranch() {
				return falseBranch;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof IfElse) {
					IfElse s = (IfElse) o;
					return condition.equals(s.condition) && trueBranch.equals(s.trueBranch)
							&& falseBranch.equals(s.falseBranch);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(condition, trueBranch, falseBranch);
			}
		}

		public static class While extends AbstractItem implements Stmt {
			private final Expr.Logical condition;
			private final Expr.Logical invariant;
			private final Stmt body;

			private While(Expr.Logical condition, Expr.Logical invariant, Stmt body, Attribute[] attributes) {
				super(attributes);
				if (invariant == null) {
					throw new IllegalArgumentException("loop requires an invariant");
				}
				this.condition = condition;
				this.invariant = invariant;
				this.body = body;
			}

			public Expr.Logical getCondition() {
				return condition;
			}

			public Expr.Logical getInvariant() {
				return invariant;
			}

			public Stmt getBody() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof While) {
					While s = (While) o;
					return condition.equals(s.condition) && invariant.equals(s.invariant) && body.equals(s.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(condition, invariant, body);
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	/**
	 * A term over the basic types. Terms of boolean type are
	 * {@link Expr.Logical}, which are also the formulas of the logic.
	 */
	public interface Expr extends Item {

		/**
		 * A boolean-valued expression (i.e. a formula).
		 */
		public interface Logical extends Expr {
			public boolean isTrue();

			public boolean isFalse();
		}

		public interface UnaryOperator extends Expr {
			public Expr getOperand();
		}

		public interface BinaryOperator extends Expr {
			public Expr getLeftHandSide();

			public Expr getRightHandSide();
		}

		public interface NaryOperator extends Expr {
			public List<? extends Expr> getOperands();
		}

		public interface Quantifier extends Logical {
			public Decl.Variable getVariable();

			public Logical getBody();
		}

		public static abstract class AbstractUnary extends AbstractItem implements UnaryOperator {
			protected final Expr operand;

			private AbstractUnary(Expr operand, Attribute[] attributes) {
				super(attributes);
				if (operand == null) {
					throw new IllegalArgumentException("null operand");
				}
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass() && operand.equals(((AbstractUnary) o).operand);
			}

			@Override
			public int hashCode() {
				return getClass().getSimpleName().hashCode() * 31 + operand.hashCode();
			}
		}

		public static abstract class AbstractBinary extends AbstractItem implements BinaryOperator {
			protected final Expr lhs;
			protected final Expr rhs;

			private AbstractBinary(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				if (lhs == null || rhs == null) {
					throw new IllegalArgumentException("null operand");
				}
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public boolean equals(Object o) {
				if (o != null && o.getClass() == getClass()) {
					AbstractBinary b = (AbstractBinary) o;
					return lhs.equals(b.lhs) && rhs.equals(b.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return getClass().getSimpleName().hashCode() * 31 + lhs.hashCode() * 7 + rhs.hashCode();
			}
		}

		public static abstract class AbstractNary extends AbstractItem implements Logical, NaryOperator {
			private final List<Logical> operands;

			private AbstractNary(List<Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
			}

			@Override
			public List<Logical> getOperands() {
				return operands;
			}

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass() && operands.equals(((AbstractNary) o).operands);
			}

			@Override
			public int hashCode() {
				return getClass().getSimpleName().hashCode() * 31 + operands.hashCode();
			}
		}

		public static abstract class AbstractQuantifier extends AbstractItem implements Quantifier {
			private final Decl.Variable variable;
			private final Logical body;

			private AbstractQuantifier(Decl.Variable variable, Logical body, Attribute[] attributes) {
				super(attributes);
				this.variable = variable;
				this.body = body;
			}

			@Override
			public Decl.Variable getVariable() {
				return variable;
			}

			@Override
			public Logical getBody() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o != null && o.getClass() == getClass()) {
					AbstractQuantifier q = (AbstractQuantifier) o;
					return variable.equals(q.variable) && body.equals(q.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return getClass().getSimpleName().hashCode() * 31 + variable.hashCode() * 7 + body.hashCode();
			}
		}

		// Constants

		public static class Boolean extends AbstractItem implements Logical {
			private final boolean value;

			private Boolean(boolean value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Boolean && ((Boolean) o).value == value;
			}

			@Override
			public int hashCode() {
				return value ? 1 : 2;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Integer && ((Integer) o).value.equals(value);
			}

			@Override
			public int hashCode() {
				return value.hashCode();
			}
		}

		public static class VariableAccess extends AbstractItem implements Logical {
			private final String variable;

			private VariableAccess(String var, Attribute[] attributes) {
				super(attributes);
				if(var == null) {
					throw new IllegalArgumentException();
				}
				this.variable = var;
			}

			public String getVariable() {
				return variable;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof VariableAccess && ((VariableAccess) o).variable.equals(variable);
			}

			@Override
			public int hashCode() {
				return variable.hashCode();
			}
		}

		// Arithmetic

		public static class Negation extends AbstractUnary {
			private Negation(Expr operand, Attribute[] attributes) {
				super(operand, attributes);
			}
		}

		public static class Addition extends AbstractBinary {
			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Subtraction extends AbstractBinary {
			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Multiplication extends AbstractBinary {
			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		/**
		 * Euclidean integer division, where the remainder is always
		 * non-negative.
		 */
		public static class IntegerDivision extends AbstractBinary {
			private IntegerDivision(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		/**
		 * Euclidean remainder, which is always within <code>[0,|d|)</code>.
		 */
		public static class Remainder extends AbstractBinary {
			private Remainder(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		// Relations

		public static class Equals extends AbstractBinary implements Logical {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class NotEquals extends AbstractBinary implements Logical {
			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThan extends AbstractBinary implements Logical {
			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThanOrEqual extends AbstractBinary implements Logical {
			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThan extends AbstractBinary implements Logical {
			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThanOrEqual extends AbstractBinary implements Logical {
			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		// Connectives

		public static class LogicalNot extends AbstractUnary implements Logical {
			private LogicalNot(Logical operand, Attribute[] attributes) {
				super(operand, attributes);
			}

			@Override
			public Logical getOperand() {
				return (Logical) operand;
			}
		}

		public static class LogicalAnd extends AbstractNary {
			private LogicalAnd(List<Logical> operands, Attribute[] attributes) {
				super(operands, attributes);
			}
		}

		public static class LogicalOr extends AbstractNary {
			private LogicalOr(List<Logical> operands, Attribute[] attributes) {
				super(operands, attributes);
			}
		}

		public static class Implies extends AbstractBinary implements Logical {
			private Implies(Logical lhs, Logical rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}

			@Override
			public Logical getLeftHandSide() {
				return (Logical) lhs;
			}

			@Override
			public Logical getRightHandSide() {
				return (Logical) rhs;
			}
		}

		public static class Iff extends AbstractBinary implements Logical {
			private Iff(Logical lhs, Logical rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}

			@Override
			public Logical getLeftHandSide() {
				return (Logical) lhs;
			}

			@Override
			public Logical getRightHandSide() {
				return (Logical) rhs;
			}
		}

		// Quantifiers

		public static class UniversalQuantifier extends AbstractQuantifier {
			private UniversalQuantifier(Decl.Variable variable, Logical body, Attribute[] attributes) {
				super(variable, body, attributes);
			}
		}

		public static class ExistentialQuantifier extends AbstractQuantifier {
			private ExistentialQuantifier(Decl.Variable variable, Logical body, Attribute[] attributes) {
				super(variable, body, attributes);
			}
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();

		public static class Bool extends AbstractItem implements Type {
			private Bool(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bool;
			}

			@Override
			public int hashCode() {
				return 1;
			}
		}

		public static class Int extends AbstractItem implements Type {
			private Int(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int;
			}

			@Override
			public int hashCode() {
				return 2;
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			@SuppressWarnings("unchecked")
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return (T) o;
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	// Statements

	public static Stmt.Skip SKIP(Attribute... attributes) {
		return new Stmt.Skip(attributes);
	}

	public static Stmt.Assignment ASSIGN(Expr.VariableAccess lhs, Expr rhs, Attribute... attributes) {
		return new Stmt.Assignment(lhs, rhs, attributes);
	}

	public static Stmt.Assignment ASSIGN(String lhs, Expr rhs, Attribute... attributes) {
		return new Stmt.Assignment(VAR(lhs), rhs, attributes);
	}

	/**
	 * Construct a sequence of statements. Nested sequences are flattened and a
	 * single statement is returned as is.
	 *
	 * @param stmts
	 * @param attributes
	 * @return
	 */
	public static Stmt SEQUENCE(List<Stmt> stmts, Attribute... attributes) {
		ArrayList<Stmt> nstmts = new ArrayList<>();
		for (Stmt s : stmts) {
			if (s instanceof Stmt.Sequence) {
				nstmts.addAll(((Stmt.Sequence) s).getAll());
			} else {
				nstmts.add(s);
			}
		}
		switch (nstmts.size()) {
		case 0:
			return new Stmt.Skip(attributes);
		case 1:
			return nstmts.get(0);
		default:
			return new Stmt.Sequence(nstmts, attributes);
		}
	}

	public static Stmt SEQUENCE(Stmt... stmts) {
		return SEQUENCE(Arrays.asList(stmts));
	}

	public static Stmt.IfElse IFELSE(Expr.Logical condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
		return new Stmt.IfElse(condition, trueBranch, falseBranch, attributes);
	}

	public static Stmt.While WHILE(Expr.Logical condition, Expr.Logical invariant, Stmt body, Attribute... attributes) {
		return new Stmt.While(condition, invariant, body, attributes);
	}

	// Constants

	public static Expr.Boolean CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.Integer CONST(long i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.VariableAccess VAR(String name, Attribute... attributes) {
		return new Expr.VariableAccess(name, attributes);
	}

	// Arithmetic

	public static Expr.Negation NEG(Expr operand, Attribute... attributes) {
		return new Expr.Negation(operand, attributes);
	}

	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}

	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}

	public static Expr.IntegerDivision IDIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.IntegerDivision(lhs, rhs, attributes);
	}

	public static Expr.Remainder REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Remainder(lhs, rhs, attributes);
	}

	// Relations

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs, attributes);
	}

	public static Expr.NotEquals NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs, attributes);
	}

	public static Expr.LessThan LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	public static Expr.LessThanOrEqual LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs, attributes);
	}

	public static Expr.GreaterThan GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs, attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs, attributes);
	}

	// Connectives. Note these collapse constant operands, but otherwise build
	// exactly what is asked for.

	public static Expr.Logical NOT(Expr.Logical operand, Attribute... attributes) {
		if(operand.isFalse()) {
			return new Expr.Boolean(true,attributes);
		} else if(operand.isTrue()) {
			return new Expr.Boolean(false,attributes);
		} else {
			return new Expr.LogicalNot(operand, attributes);
		}
	}

	public static Expr.Logical AND(List<Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr.Logical ith = operands.get(i);
			if (ith.isFalse()) {
				return new Expr.Boolean(false, attributes);
			} else if (!ith.isTrue()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(true,attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalAnd(noperands, attributes);
		}
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2),attributes);
	}

	public static Expr.Logical OR(List<Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr.Logical ith = operands.get(i);
			if(ith.isTrue()) {
				return new Expr.Boolean(true,attributes);
			} else if(!ith.isFalse()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(false,attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalOr(noperands, attributes);
		}
	}

	public static Expr.Logical OR(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return OR(Arrays.asList(operand1, operand2),attributes);
	}

	public static Expr.Logical IMPLIES(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		if(lhs.isFalse() || rhs.isTrue()) {
			return new Expr.Boolean(true,attributes);
		} else if(lhs.isTrue()) {
			return rhs;
		} else if(rhs.isFalse()) {
			return NOT(lhs, attributes);
		} else {
			return new Expr.Implies(lhs, rhs, attributes);
		}
	}

	public static Expr.Logical IFF(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		if (lhs.isTrue()) {
			return rhs;
		} else if (rhs.isTrue()) {
			return lhs;
		} else if (lhs.isFalse()) {
			return NOT(rhs, attributes);
		} else if (rhs.isFalse()) {
			return NOT(lhs, attributes);
		} else {
			return new Expr.Iff(lhs, rhs, attributes);
		}
	}

	// Quantifiers

	public static Expr.UniversalQuantifier FORALL(String name, Type type, Expr.Logical body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(new Decl.Variable(name, type), body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(Decl.Variable variable, Expr.Logical body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(variable, body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(String name, Type type, Expr.Logical body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(new Decl.Variable(name, type), body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(Decl.Variable variable, Expr.Logical body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(variable, body, attributes);
	}
}
