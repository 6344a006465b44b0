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
import java.util.regex.Pattern;

import wyhoare.core.SourcePosition;
import wyhoare.core.SyntaxError;

/**
 * Reads formulas written in the prefix notation produced by
 * {@link PrefixNotation}, for example <code>→ ∧ = x 0 ≥ n 0 = + x 1 1</code>.
 * Tokens are separated by whitespace. Each operator is followed by its
 * operands: <code>¬</code> and <code>~</code> (arithmetic negation) take one,
 * the quantifiers take a variable and then a body, and every other operator
 * takes two. A quantified variable is an integer unless written as
 * <code>b:bool</code>.
 * <p>
 * Right-nested conjunctions and disjunctions are read back as a single
 * operator over all of their operands.
 */
public class PrefixNotationParser {
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
	private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

	private final List<Token> tokens;
	private int index;

	public PrefixNotationParser(String input) {
		this.tokens = scan(input);
	}

	/**
	 * Read a single formula, which must occupy the entire input.
	 *
	 * @param text
	 * @return
	 * @throws SyntaxError if the text is not a well-formed formula.
	 */
	public static Expr.Logical parseFormula(String text) {
		PrefixNotationParser p = new PrefixNotationParser(text);
		Expr.Logical e = p.parseLogical();
		p.end();
		return e;
	}

	/**
	 * Read a single formula or term, which must occupy the entire input.
	 *
	 * @param text
	 * @return
	 */
	public static Expr parseExpression(String text) {
		PrefixNotationParser p = new PrefixNotationParser(text);
		Expr e = p.parse();
		p.end();
		return e;
	}

	private Expr parse() {
		Token t = next();
		Attribute attr = ATTRIBUTE(t.position);
		switch (t.text) {
		case "¬":
			return NOT(parseLogical(), attr);
		case "∧": {
			Expr.Logical lhs = parseLogical();
			Expr.Logical rhs = parseLogical();
			return AND(flatten(lhs, rhs, Expr.LogicalAnd.class), attr);
		}
		case "∨": {
			Expr.Logical lhs = parseLogical();
			Expr.Logical rhs = parseLogical();
			return OR(flatten(lhs, rhs, Expr.LogicalOr.class), attr);
		}
		case "→": {
			Expr.Logical lhs = parseLogical();
			return IMPLIES(lhs, parseLogical(), attr);
		}
		case "↔": {
			Expr.Logical lhs = parseLogical();
			return IFF(lhs, parseLogical(), attr);
		}
		case "∀":
		case "∃":
			return parseQuantifier(t);
		case "=": {
			Expr lhs = parse();
			return EQ(lhs, parse(), attr);
		}
		case "≠": {
			Expr lhs = parse();
			return NEQ(lhs, parse(), attr);
		}
		case "<": {
			Expr lhs = parse();
			return LT(lhs, parse(), attr);
		}
		case "≤": {
			Expr lhs = parse();
			return LTEQ(lhs, parse(), attr);
		}
		case ">": {
			Expr lhs = parse();
			return GT(lhs, parse(), attr);
		}
		case "≥": {
			Expr lhs = parse();
			return GTEQ(lhs, parse(), attr);
		}
		case "~":
			return NEG(parse(), attr);
		case "+": {
			Expr lhs = parse();
			return ADD(lhs, parse(), attr);
		}
		case "-": {
			Expr lhs = parse();
			return SUB(lhs, parse(), attr);
		}
		case "*": {
			Expr lhs = parse();
			return MUL(lhs, parse(), attr);
		}
		case "/": {
			Expr lhs = parse();
			return IDIV(lhs, parse(), attr);
		}
		case "%": {
			Expr lhs = parse();
			return REM(lhs, parse(), attr);
		}
		case "⊤":
			return CONST(true, attr);
		case "⊥":
			return CONST(false, attr);
		default:
			if (INTEGER.matcher(t.text).matches()) {
				return CONST(new BigInteger(t.text), attr);
			} else if (isName(t.text)) {
				return VAR(t.text, attr);
			}
			throw syntaxError("an operator, variable or integer", t);
		}
	}

	private Expr parseQuantifier(Token q) {
		Token t = next();
		String name = t.text;
		Type type = Type.Int;
		int colon = name.indexOf(':');
		if (colon >= 0) {
			String suffix = name.substring(colon + 1);
			name = name.substring(0, colon);
			if (suffix.equals("bool")) {
				type = Type.Bool;
			} else if (!suffix.equals("int")) {
				throw syntaxError("'int' or 'bool'", t);
			}
		}
		if (!isName(name)) {
			throw syntaxError("a variable name", t);
		}
		Decl.Variable var = new Decl.Variable(name, type, ATTRIBUTE(t.position));
		Expr.Logical body = parseLogical();
		if (q.text.equals("∀")) {
			return FORALL(var, body, ATTRIBUTE(q.position));
		} else {
			return EXISTS(var, body, ATTRIBUTE(q.position));
		}
	}

	private Expr.Logical parseLogical() {
		Token start = index < tokens.size() ? tokens.get(index) : null;
		Expr e = parse();
		if (e instanceof Expr.Logical) {
			return (Expr.Logical) e;
		}
		throw new SyntaxError("a formula", "arithmetic term " + PrefixNotation.toString(e), start.position);
	}

	private static List<Expr.Logical> flatten(Expr.Logical lhs, Expr.Logical rhs,
			Class<? extends Expr.AbstractNary> kind) {
		ArrayList<Expr.Logical> operands = new ArrayList<>();
		operands.add(lhs);
		if (kind.isInstance(rhs)) {
			operands.addAll(kind.cast(rhs).getOperands());
		} else {
			operands.add(rhs);
		}
		return operands;
	}

	private static boolean isName(String text) {
		return IDENTIFIER.matcher(text).matches() && !HoareFileLexer.isKeyword(text);
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private Token next() {
		if (index == tokens.size()) {
			throw new SyntaxError("an operator, variable or integer", "end of input", endPosition());
		}
		return tokens.get(index++);
	}

	private void end() {
		if (index != tokens.size()) {
			throw syntaxError("end of input", tokens.get(index));
		}
	}

	private SourcePosition endPosition() {
		if (tokens.isEmpty()) {
			return new SourcePosition(1, 1);
		}
		Token last = tokens.get(tokens.size() - 1);
		return new SourcePosition(last.position.getLine(), last.position.getColumn() + last.text.length());
	}

	private static SyntaxError syntaxError(String expected, Token found) {
		return new SyntaxError(expected, "'" + found.text + "'", found.position);
	}

	private static List<Token> scan(String input) {
		ArrayList<Token> tokens = new ArrayList<>();
		int line = 1;
		int column = 1;
		int pos = 0;
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (c == '\n') {
				line++;
				column = 1;
				pos++;
			} else if (Character.isWhitespace(c)) {
				column++;
				pos++;
			} else {
				int begin = pos;
				while (pos < input.length() && !Character.isWhitespace(input.charAt(pos))) {
					pos++;
				}
				tokens.add(new Token(input.substring(begin, pos), new SourcePosition(line, column)));
				column += pos - begin;
			}
		}
		return tokens;
	}

	private static class Token {
		private final String text;
		private final SourcePosition position;

		private Token(String text, SourcePosition position) {
			this.text = text;
			this.position = position;
		}
	}
}
