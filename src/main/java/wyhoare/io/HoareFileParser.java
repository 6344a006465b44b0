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

import static wyhoare.core.HoareFile.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wyhoare.core.HoareFile;
import wyhoare.core.HoareTriple;
import wyhoare.core.MissingInvariantError;
import wyhoare.core.SourcePosition;
import wyhoare.core.SyntacticException;
import wyhoare.core.SyntaxError;
import wyhoare.io.HoareFileLexer.Kind;
import wyhoare.io.HoareFileLexer.Token;
import wyhoare.util.MailBox;

/**
 * A recursive descent parser for source units. Operator precedence for
 * formulas, from loosest to tightest, is <code>&lt;==&gt;</code>,
 * <code>==&gt;</code>, <code>||</code>, <code>&amp;&amp;</code>, then
 * <code>!</code> and the quantifiers, whose bodies extend only over a unary
 * formula. Relations sit below the arithmetic operators and do not associate.
 * <p>
 * Any syntax error is fatal to the whole unit. The exception is a loop
 * without an invariant, which is reported to the given mailbox and causes
 * only the enclosing triple to be dropped.
 */
public class HoareFileParser {
	private static final Logger logger = LoggerFactory.getLogger(HoareFileParser.class);

	private final List<Token> tokens;
	private final MailBox<SyntacticException> errors;
	private int index;

	public HoareFileParser(String input, MailBox<SyntacticException> errors) {
		this.tokens = new HoareFileLexer(input).scan();
		this.errors = errors;
	}

	/**
	 * Parse a complete source unit.
	 *
	 * @return
	 * @throws SyntaxError if the unit is malformed.
	 */
	public HoareFile read() {
		ArrayList<Decl> decls = new ArrayList<>();
		while (lookahead().kind != Kind.EOF) {
			Token t = lookahead();
			if (t.kind == Kind.Var) {
				decls.addAll(parseVariableDeclarations());
			} else if (t.kind == Kind.Triple) {
				Decl.Triple d = parseTripleDeclaration();
				if (d != null) {
					decls.add(d);
				}
			} else {
				throw syntaxError("'var' or 'triple'", t);
			}
		}
		return new HoareFile(decls);
	}

	/**
	 * Parse a single formula (or term), which must occupy the entire input.
	 *
	 * @param text
	 * @return
	 */
	public static Expr parseExpression(String text) {
		HoareFileParser p = new HoareFileParser(text, new MailBox.Buffered<>());
		Expr e = p.parseIff();
		p.match(Kind.EOF);
		return e;
	}

	/**
	 * Parse a single formula, which must occupy the entire input.
	 *
	 * @param text
	 * @return
	 */
	public static Expr.Logical parseFormula(String text) {
		HoareFileParser p = new HoareFileParser(text, new MailBox.Buffered<>());
		Token start = p.lookahead();
		Expr e = p.parseIff();
		p.match(Kind.EOF);
		return p.asLogical(e, start);
	}

	/**
	 * Parse a sequence of statements, which must occupy the entire input.
	 *
	 * @param text
	 * @return
	 */
	public static Stmt parseStatements(String text) {
		HoareFileParser p = new HoareFileParser(text, new MailBox.Buffered<>());
		Stmt s = p.parseStatementBlock();
		p.match(Kind.EOF);
		return s;
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	private List<Decl.Variable> parseVariableDeclarations() {
		match(Kind.Var);
		ArrayList<Token> names = new ArrayList<>();
		names.add(match(Kind.Identifier));
		while (tryAndMatch(Kind.Comma) != null) {
			names.add(match(Kind.Identifier));
		}
		match(Kind.Colon);
		Type type = parseType();
		match(Kind.SemiColon);
		ArrayList<Decl.Variable> vars = new ArrayList<>();
		for (Token n : names) {
			vars.add(new Decl.Variable(n.text, type, ATTRIBUTE(n.position)));
		}
		return vars;
	}

	private Decl.Triple parseTripleDeclaration() {
		Token start = match(Kind.Triple);
		Token name = match(Kind.Identifier);
		try {
			match(Kind.Colon);
			match(Kind.LeftCurly);
			Expr.Logical pre = parseLogical();
			match(Kind.RightCurly);
			Stmt body = parseStatementBlock();
			match(Kind.LeftCurly);
			Expr.Logical post = parseLogical();
			match(Kind.RightCurly);
			return new Decl.Triple(name.text, new HoareTriple(pre, body, post), ATTRIBUTE(start.position));
		} catch (MissingInvariantError e) {
			logger.warn("dropping triple {}: {}", name.text, e.getMessage());
			errors.send(e.setTriple(name.text));
			skipToNextDeclaration();
			return null;
		} catch (SyntaxError e) {
			e.setTriple(name.text);
			throw e;
		}
	}

	private void skipToNextDeclaration() {
		while (true) {
			Kind k = lookahead().kind;
			if (k == Kind.Triple || k == Kind.Var || k == Kind.EOF) {
				return;
			}
			index++;
		}
	}

	private Type parseType() {
		Token t = lookahead();
		if (tryAndMatch(Kind.Int) != null) {
			return Type.Int;
		} else if (tryAndMatch(Kind.Bool) != null) {
			return Type.Bool;
		} else {
			throw syntaxError("a type", t);
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	private Stmt parseStatementBlock() {
		Token start = lookahead();
		ArrayList<Stmt> stmts = new ArrayList<>();
		stmts.add(parseStatement());
		while (tryAndMatch(Kind.SemiColon) != null) {
			stmts.add(parseStatement());
		}
		return SEQUENCE(stmts, ATTRIBUTE(start.position));
	}

	private Stmt parseStatement() {
		Token t = lookahead();
		switch (t.kind) {
		case Skip:
			match(Kind.Skip);
			return SKIP(ATTRIBUTE(t.position));
		case Identifier:
			return parseAssignment();
		case If:
			return parseIfElse();
		case While:
			return parseWhile();
		default:
			throw syntaxError("a statement", t);
		}
	}

	private Stmt parseAssignment() {
		Token lhs = match(Kind.Identifier);
		match(Kind.ColonEquals);
		Expr rhs = parseIff();
		return ASSIGN(VAR(lhs.text, ATTRIBUTE(lhs.position)), rhs, ATTRIBUTE(lhs.position));
	}

	private Stmt parseIfElse() {
		Token start = match(Kind.If);
		Expr.Logical condition = parseLogical();
		match(Kind.Then);
		Stmt trueBranch = parseStatementBlock();
		Stmt falseBranch;
		if (tryAndMatch(Kind.Else) != null) {
			falseBranch = parseStatementBlock();
		} else {
			falseBranch = SKIP(ATTRIBUTE(lookahead().position));
		}
		match(Kind.Fi);
		return IFELSE(condition, trueBranch, falseBranch, ATTRIBUTE(start.position));
	}

	private Stmt parseWhile() {
		Token start = match(Kind.While);
		Expr.Logical condition = parseLogical();
		if (lookahead().kind != Kind.Invariant) {
			throw new MissingInvariantError("loop requires an invariant before " + lookahead(), start.position);
		}
		match(Kind.Invariant);
		Expr.Logical invariant = parseLogical();
		match(Kind.Do);
		Stmt body = parseStatementBlock();
		match(Kind.Od);
		return WHILE(condition, invariant, body, ATTRIBUTE(start.position));
	}

	// =========================================================================
	// Formulas and terms
	// =========================================================================

	private Expr.Logical parseLogical() {
		Token start = lookahead();
		return asLogical(parseIff(), start);
	}

	private Expr parseIff() {
		Token start = lookahead();
		Expr lhs = parseImplies();
		Token op;
		while ((op = tryAndMatch(Kind.Iff)) != null) {
			Token next = lookahead();
			Expr rhs = parseImplies();
			lhs = IFF(asLogical(lhs, start), asLogical(rhs, next), ATTRIBUTE(op.position));
		}
		return lhs;
	}

	private Expr parseImplies() {
		Token start = lookahead();
		Expr lhs = parseOr();
		Token op = tryAndMatch(Kind.Implies);
		if (op != null) {
			Token next = lookahead();
			Expr rhs = parseImplies();
			return IMPLIES(asLogical(lhs, start), asLogical(rhs, next), ATTRIBUTE(op.position));
		}
		return lhs;
	}

	private Expr parseOr() {
		Token start = lookahead();
		Expr lhs = parseAnd();
		if (lookahead().kind != Kind.LogicalOr) {
			return lhs;
		}
		ArrayList<Expr.Logical> operands = new ArrayList<>();
		operands.add(asLogical(lhs, start));
		while (tryAndMatch(Kind.LogicalOr) != null) {
			Token next = lookahead();
			operands.add(asLogical(parseAnd(), next));
		}
		return OR(operands, ATTRIBUTE(start.position));
	}

	private Expr parseAnd() {
		Token start = lookahead();
		Expr lhs = parseUnary();
		if (lookahead().kind != Kind.LogicalAnd) {
			return lhs;
		}
		ArrayList<Expr.Logical> operands = new ArrayList<>();
		operands.add(asLogical(lhs, start));
		while (tryAndMatch(Kind.LogicalAnd) != null) {
			Token next = lookahead();
			operands.add(asLogical(parseUnary(), next));
		}
		return AND(operands, ATTRIBUTE(start.position));
	}

	private Expr parseUnary() {
		Token t = lookahead();
		switch (t.kind) {
		case Shreak: {
			match(Kind.Shreak);
			Token next = lookahead();
			return NOT(asLogical(parseUnary(), next), ATTRIBUTE(t.position));
		}
		case Forall:
		case Exists:
			return parseQuantifier();
		default:
			return parseRelation();
		}
	}

	private Expr parseQuantifier() {
		Token t = lookahead();
		index++;
		Token name = match(Kind.Identifier);
		match(Kind.Colon);
		Type type = parseType();
		match(Kind.Dot);
		Token next = lookahead();
		Expr.Logical body = asLogical(parseUnary(), next);
		Decl.Variable var = new Decl.Variable(name.text, type, ATTRIBUTE(name.position));
		if (t.kind == Kind.Forall) {
			return FORALL(var, body, ATTRIBUTE(t.position));
		} else {
			return EXISTS(var, body, ATTRIBUTE(t.position));
		}
	}

	private Expr parseRelation() {
		Expr lhs = parseAdditive();
		Token op = lookahead();
		Attribute attr = ATTRIBUTE(op.position);
		switch (op.kind) {
		case Equals:
			index++;
			return EQ(lhs, parseAdditive(), attr);
		case NotEquals:
			index++;
			return NEQ(lhs, parseAdditive(), attr);
		case LessThan:
			index++;
			return LT(lhs, parseAdditive(), attr);
		case LessEquals:
			index++;
			return LTEQ(lhs, parseAdditive(), attr);
		case GreaterThan:
			index++;
			return GT(lhs, parseAdditive(), attr);
		case GreaterEquals:
			index++;
			return GTEQ(lhs, parseAdditive(), attr);
		default:
			return lhs;
		}
	}

	private Expr parseAdditive() {
		Expr lhs = parseMultiplicative();
		while (true) {
			Token op = lookahead();
			if (op.kind == Kind.Plus) {
				index++;
				lhs = ADD(lhs, parseMultiplicative(), ATTRIBUTE(op.position));
			} else if (op.kind == Kind.Minus) {
				index++;
				lhs = SUB(lhs, parseMultiplicative(), ATTRIBUTE(op.position));
			} else {
				return lhs;
			}
		}
	}

	private Expr parseMultiplicative() {
		Expr lhs = parseNegation();
		while (true) {
			Token op = lookahead();
			if (op.kind == Kind.Star) {
				index++;
				lhs = MUL(lhs, parseNegation(), ATTRIBUTE(op.position));
			} else if (op.kind == Kind.RightSlash) {
				index++;
				lhs = IDIV(lhs, parseNegation(), ATTRIBUTE(op.position));
			} else if (op.kind == Kind.Percent) {
				index++;
				lhs = REM(lhs, parseNegation(), ATTRIBUTE(op.position));
			} else {
				return lhs;
			}
		}
	}

	private Expr parseNegation() {
		Token t = tryAndMatch(Kind.Minus);
		if (t != null) {
			return NEG(parseNegation(), ATTRIBUTE(t.position));
		}
		return parsePrimary();
	}

	private Expr parsePrimary() {
		Token t = lookahead();
		Attribute attr = ATTRIBUTE(t.position);
		switch (t.kind) {
		case IntValue:
			index++;
			return CONST(new BigInteger(t.text), attr);
		case True:
			index++;
			return CONST(true, attr);
		case False:
			index++;
			return CONST(false, attr);
		case Identifier:
			index++;
			return VAR(t.text, attr);
		case LeftBrace: {
			index++;
			Expr e = parseIff();
			match(Kind.RightBrace);
			return e;
		}
		default:
			throw syntaxError("an expression", t);
		}
	}

	/**
	 * Check that an expression is a formula, rather than an arithmetic term.
	 * Whether a variable is boolean or not is left to the type checker.
	 */
	private Expr.Logical asLogical(Expr e, Token start) {
		if (e instanceof Expr.Logical) {
			return (Expr.Logical) e;
		}
		throw new SyntaxError("a formula", "arithmetic term " + HoareFilePrinter.toString(e), start.position);
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private Token lookahead() {
		return tokens.get(index);
	}

	private Token match(Kind kind) {
		Token t = lookahead();
		if (t.kind != kind) {
			throw syntaxError(kind.getDescription(), t);
		}
		index++;
		return t;
	}

	private Token tryAndMatch(Kind kind) {
		Token t = lookahead();
		if (t.kind == kind) {
			index++;
			return t;
		}
		return null;
	}

	private static SyntaxError syntaxError(String expected, Token found) {
		return new SyntaxError(expected, found.toString(), found.position);
	}
}
