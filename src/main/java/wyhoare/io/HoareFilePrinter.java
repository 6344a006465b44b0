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

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import wyhoare.core.HoareFile;
import wyhoare.core.HoareFile.Decl;
import wyhoare.core.HoareFile.Expr;
import wyhoare.core.HoareFile.Stmt;
import wyhoare.core.HoareFile.Type;

/**
 * Writes source units, statements and formulas in the concrete syntax
 * accepted by {@link HoareFileParser}. Brackets are only emitted where the
 * precedence of operators requires them.
 */
public class HoareFilePrinter {
	/**
	 * Operator symbols used when printing.
	 */
	public enum Notation {
		ASCII(" <==> ", " ==> ", " || ", " && ", "!", " != ", " <= ", " >= ", "forall ", "exists "),
		UNICODE(" ⇔ ", " ⇒ ", " ∨ ", " ∧ ", "¬", " ≠ ", " ≤ ", " ≥ ", "∀", "∃");

		private final String iff, implies, or, and, not, neq, lteq, gteq, forall, exists;

		private Notation(String iff, String implies, String or, String and, String not, String neq, String lteq,
				String gteq, String forall, String exists) {
			this.iff = iff;
			this.implies = implies;
			this.or = or;
			this.and = and;
			this.not = not;
			this.neq = neq;
			this.lteq = lteq;
			this.gteq = gteq;
			this.forall = forall;
			this.exists = exists;
		}
	}

	// Precedence levels, where higher binds tighter.
	private static final int IFF = 1;
	private static final int IMPLIES = 2;
	private static final int OR = 3;
	private static final int AND = 4;
	private static final int UNARY = 5;
	private static final int RELATION = 6;
	private static final int ADDITIVE = 7;
	private static final int MULTIPLICATIVE = 8;
	private static final int NEGATION = 9;
	private static final int ATOM = 10;

	private final PrintWriter out;
	private final Notation notation;

	public HoareFilePrinter(OutputStream output) {
		this(output, Notation.ASCII);
	}

	public HoareFilePrinter(OutputStream output, Notation notation) {
		this.out = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
		this.notation = notation;
	}

	public void flush() {
		out.flush();
	}

	public void write(HoareFile file) {
		for(Decl d : file.getDeclarations()) {
			writeDecl(d);
		}
		out.flush();
	}

	public void writeDecl(Decl d) {
		if(d instanceof Decl.Variable) {
			Decl.Variable v = (Decl.Variable) d;
			out.print("var " + v.getName() + " : ");
			writeType(v.getType());
			out.println(";");
		} else if(d instanceof Decl.Triple) {
			writeTriple((Decl.Triple) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writeTriple(Decl.Triple d) {
		out.println("triple " + d.getName() + ":");
		out.print("{ ");
		writeExpression(d.getTriple().getPrecondition());
		out.println(" }");
		writeStmt(1, d.getTriple().getProgram());
		out.println();
		out.print("{ ");
		writeExpression(d.getTriple().getPostcondition());
		out.println(" }");
	}

	// =========================================================================
	// Statements
	// =========================================================================

	/**
	 * Write a statement across multiple lines. The final line is not
	 * terminated.
	 */
	private void writeStmt(int indent, Stmt s) {
		if(s instanceof Stmt.Skip) {
			tab(indent);
			out.print("skip");
		} else if(s instanceof Stmt.Assignment) {
			tab(indent);
			writeAssignment((Stmt.Assignment) s);
		} else if(s instanceof Stmt.Sequence) {
			List<Stmt> stmts = ((Stmt.Sequence) s).getAll();
			for(int i=0;i!=stmts.size();++i) {
				if(i != 0) {
					out.println(";");
				}
				writeStmt(indent, stmts.get(i));
			}
		} else if(s instanceof Stmt.IfElse) {
			Stmt.IfElse i = (Stmt.IfElse) s;
			tab(indent);
			out.print("if ");
			writeExpression(i.getCondition());
			out.println(" then");
			writeStmt(indent + 1, i.getTrueBranch());
			out.println();
			if(!(i.getFalseBranch() instanceof Stmt.Skip)) {
				tab(indent);
				out.println("else");
				writeStmt(indent + 1, i.getFalseBranch());
				out.println();
			}
			tab(indent);
			out.print("fi");
		} else if(s instanceof Stmt.While) {
			Stmt.While w = (Stmt.While) s;
			tab(indent);
			out.print("while ");
			writeExpression(w.getCondition());
			out.print(" invariant ");
			writeExpression(w.getInvariant());
			out.println(" do");
			writeStmt(indent + 1, w.getBody());
			out.println();
			tab(indent);
			out.print("od");
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
	}

	/**
	 * Write a statement on a single line.
	 */
	private void writeInlineStmt(Stmt s) {
		if(s instanceof Stmt.Skip) {
			out.print("skip");
		} else if(s instanceof Stmt.Assignment) {
			writeAssignment((Stmt.Assignment) s);
		} else if(s instanceof Stmt.Sequence) {
			List<Stmt> stmts = ((Stmt.Sequence) s).getAll();
			for(int i=0;i!=stmts.size();++i) {
				if(i != 0) {
					out.print("; ");
				}
				writeInlineStmt(stmts.get(i));
			}
		} else if(s instanceof Stmt.IfElse) {
			Stmt.IfElse i = (Stmt.IfElse) s;
			out.print("if ");
			writeExpression(i.getCondition());
			out.print(" then ");
			writeInlineStmt(i.getTrueBranch());
			if(!(i.getFalseBranch() instanceof Stmt.Skip)) {
				out.print(" else ");
				writeInlineStmt(i.getFalseBranch());
			}
			out.print(" fi");
		} else if(s instanceof Stmt.While) {
			Stmt.While w = (Stmt.While) s;
			out.print("while ");
			writeExpression(w.getCondition());
			out.print(" invariant ");
			writeExpression(w.getInvariant());
			out.print(" do ");
			writeInlineStmt(w.getBody());
			out.print(" od");
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
		}
	}

	private void writeAssignment(Stmt.Assignment s) {
		out.print(s.getLeftHandSide().getVariable());
		out.print(" := ");
		writeExpression(s.getRightHandSide());
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public void writeExpression(Expr e) {
		writeExpression(e, 0);
	}

	/**
	 * Write an expression which appears in a context of a given precedence,
	 * bracketing it if it binds more loosely than that.
	 */
	private void writeExpression(Expr e, int context) {
		boolean braces = precedence(e) < context;
		if(braces) {
			out.print("(");
		}
		if(e instanceof Expr.Boolean) {
			out.print(((Expr.Boolean) e).getValue() ? "true" : "false");
		} else if(e instanceof Expr.Integer) {
			out.print(((Expr.Integer) e).getValue().toString());
		} else if(e instanceof Expr.VariableAccess) {
			out.print(((Expr.VariableAccess) e).getVariable());
		} else if(e instanceof Expr.Negation) {
			out.print("-");
			writeExpression(((Expr.Negation) e).getOperand(), NEGATION);
		} else if(e instanceof Expr.Addition) {
			writeInfix((Expr.BinaryOperator) e, " + ", ADDITIVE, MULTIPLICATIVE);
		} else if(e instanceof Expr.Subtraction) {
			writeInfix((Expr.BinaryOperator) e, " - ", ADDITIVE, MULTIPLICATIVE);
		} else if(e instanceof Expr.Multiplication) {
			writeInfix((Expr.BinaryOperator) e, " * ", MULTIPLICATIVE, NEGATION);
		} else if(e instanceof Expr.IntegerDivision) {
			writeInfix((Expr.BinaryOperator) e, " / ", MULTIPLICATIVE, NEGATION);
		} else if(e instanceof Expr.Remainder) {
			writeInfix((Expr.BinaryOperator) e, " % ", MULTIPLICATIVE, NEGATION);
		} else if(e instanceof Expr.Equals) {
			writeInfix((Expr.BinaryOperator) e, " = ", ADDITIVE, ADDITIVE);
		} else if(e instanceof Expr.NotEquals) {
			writeInfix((Expr.BinaryOperator) e, notation.neq, ADDITIVE, ADDITIVE);
		} else if(e instanceof Expr.LessThan) {
			writeInfix((Expr.BinaryOperator) e, " < ", ADDITIVE, ADDITIVE);
		} else if(e instanceof Expr.LessThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, notation.lteq, ADDITIVE, ADDITIVE);
		} else if(e instanceof Expr.GreaterThan) {
			writeInfix((Expr.BinaryOperator) e, " > ", ADDITIVE, ADDITIVE);
		} else if(e instanceof Expr.GreaterThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, notation.gteq, ADDITIVE, ADDITIVE);
		} else if(e instanceof Expr.LogicalNot) {
			out.print(notation.not);
			writeExpression(((Expr.LogicalNot) e).getOperand(), ADDITIVE);
		} else if(e instanceof Expr.LogicalAnd) {
			writeNary(((Expr.LogicalAnd) e).getOperands(), notation.and, UNARY);
		} else if(e instanceof Expr.LogicalOr) {
			writeNary(((Expr.LogicalOr) e).getOperands(), notation.or, AND);
		} else if(e instanceof Expr.Implies) {
			writeInfix((Expr.BinaryOperator) e, notation.implies, OR, IMPLIES);
		} else if(e instanceof Expr.Iff) {
			writeInfix((Expr.BinaryOperator) e, notation.iff, IFF, IMPLIES);
		} else if(e instanceof Expr.UniversalQuantifier) {
			writeQuantifier(notation.forall, (Expr.Quantifier) e);
		} else if(e instanceof Expr.ExistentialQuantifier) {
			writeQuantifier(notation.exists, (Expr.Quantifier) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
		if(braces) {
			out.print(")");
		}
	}

	private void writeInfix(Expr.BinaryOperator e, String operator, int lhsContext, int rhsContext) {
		writeExpression(e.getLeftHandSide(), lhsContext);
		out.print(operator);
		writeExpression(e.getRightHandSide(), rhsContext);
	}

	private void writeNary(List<Expr.Logical> operands, String operator, int context) {
		for(int i=0;i!=operands.size();++i) {
			if(i != 0) {
				out.print(operator);
			}
			writeExpression(operands.get(i), context);
		}
	}

	private void writeQuantifier(String kind, Expr.Quantifier e) {
		out.print(kind);
		out.print(e.getVariable().getName());
		out.print(":");
		writeType(e.getVariable().getType());
		out.print(". ");
		writeExpression(e.getBody(), UNARY);
	}

	private void writeType(Type t) {
		if(t instanceof Type.Bool) {
			out.print("bool");
		} else if(t instanceof Type.Int) {
			out.print("int");
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private static int precedence(Expr e) {
		if(e instanceof Expr.Iff) {
			return IFF;
		} else if(e instanceof Expr.Implies) {
			return IMPLIES;
		} else if(e instanceof Expr.LogicalOr) {
			return OR;
		} else if(e instanceof Expr.LogicalAnd) {
			return AND;
		} else if(e instanceof Expr.LogicalNot) {
			return UNARY;
		} else if(e instanceof Expr.Quantifier) {
			// Always bracket nested quantifiers, since their scope is otherwise
			// easily misread.
			return 0;
		} else if(e instanceof Expr.Equals || e instanceof Expr.NotEquals || e instanceof Expr.LessThan
				|| e instanceof Expr.LessThanOrEqual || e instanceof Expr.GreaterThan
				|| e instanceof Expr.GreaterThanOrEqual) {
			return RELATION;
		} else if(e instanceof Expr.Addition || e instanceof Expr.Subtraction) {
			return ADDITIVE;
		} else if(e instanceof Expr.Multiplication || e instanceof Expr.IntegerDivision
				|| e instanceof Expr.Remainder) {
			return MULTIPLICATIVE;
		} else if(e instanceof Expr.Negation) {
			return NEGATION;
		} else if(e instanceof Expr.Integer && ((Expr.Integer) e).getValue().signum() < 0) {
			return NEGATION;
		} else {
			return ATOM;
		}
	}

	private void tab(int indent) {
		for(int i=0;i!=indent;++i) {
			out.print("   ");
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	public static String toString(HoareFile.Item item) {
		return toString(item, Notation.ASCII);
	}

	public static String toString(HoareFile.Item item, Notation notation) {
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		HoareFilePrinter printer = new HoareFilePrinter(bout, notation);
		if(item instanceof Expr) {
			printer.writeExpression((Expr) item);
		} else if(item instanceof Stmt) {
			printer.writeInlineStmt((Stmt) item);
		} else if(item instanceof Type) {
			printer.writeType((Type) item);
		} else if(item instanceof Decl) {
			printer.writeDecl((Decl) item);
		} else {
			throw new IllegalArgumentException("unknown item encountered (" + item.getClass().getName() + ")");
		}
		printer.flush();
		return new String(bout.toByteArray(), StandardCharsets.UTF_8);
	}
}
