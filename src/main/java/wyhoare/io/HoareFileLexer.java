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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import wyhoare.core.SourcePosition;
import wyhoare.core.SyntaxError;

/**
 * Splits the text of a source unit into tokens. Most operators have both an
 * ASCII and a Unicode spelling (e.g. <code>&amp;&amp;</code> and
 * <code>∧</code>), which lex to the same token kind.
 */
public class HoareFileLexer {

	public enum Kind {
		Identifier("an identifier"),
		IntValue("an integer"),
		// Keywords
		Var("'var'"), Triple("'triple'"), Int("'int'"), Bool("'bool'"), True("'true'"), False("'false'"),
		Forall("'forall'"), Exists("'exists'"), Skip("'skip'"), If("'if'"), Then("'then'"), Else("'else'"),
		Fi("'fi'"), While("'while'"), Invariant("'invariant'"), Do("'do'"), Od("'od'"),
		// Punctuation
		LeftCurly("'{'"), RightCurly("'}'"), LeftBrace("'('"), RightBrace("')'"), Comma("','"), Colon("':'"),
		SemiColon("';'"), Dot("'.'"), ColonEquals("':='"),
		// Operators
		Equals("'='"), NotEquals("'!='"), LessThan("'<'"), LessEquals("'<='"), GreaterThan("'>'"),
		GreaterEquals("'>='"), Plus("'+'"), Minus("'-'"), Star("'*'"), RightSlash("'/'"), Percent("'%'"),
		LogicalAnd("'&&'"), LogicalOr("'||'"), Shreak("'!'"), Implies("'==>'"), Iff("'<==>'"),
		EOF("end of file");

		private final String description;

		private Kind(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	public static class Token {
		public final Kind kind;
		public final String text;
		public final SourcePosition position;

		public Token(Kind kind, String text, SourcePosition position) {
			this.kind = kind;
			this.text = text;
			this.position = position;
		}

		@Override
		public String toString() {
			return kind == Kind.EOF ? kind.getDescription() : "'" + text + "'";
		}
	}

	private static final Map<String, Kind> KEYWORDS = new HashMap<>();

	static {
		KEYWORDS.put("var", Kind.Var);
		KEYWORDS.put("triple", Kind.Triple);
		KEYWORDS.put("int", Kind.Int);
		KEYWORDS.put("bool", Kind.Bool);
		KEYWORDS.put("true", Kind.True);
		KEYWORDS.put("false", Kind.False);
		KEYWORDS.put("forall", Kind.Forall);
		KEYWORDS.put("exists", Kind.Exists);
		KEYWORDS.put("skip", Kind.Skip);
		KEYWORDS.put("if", Kind.If);
		KEYWORDS.put("then", Kind.Then);
		KEYWORDS.put("else", Kind.Else);
		KEYWORDS.put("fi", Kind.Fi);
		KEYWORDS.put("while", Kind.While);
		KEYWORDS.put("invariant", Kind.Invariant);
		KEYWORDS.put("do", Kind.Do);
		KEYWORDS.put("od", Kind.Od);
	}

	/**
	 * Operator spellings, where longer spellings must precede any spelling
	 * which is a prefix of them.
	 */
	private static final String[][] OPERATORS = {
			{ "<==>", "Iff" }, { "==>", "Implies" }, { ":=", "ColonEquals" }, { "!=", "NotEquals" },
			{ "<=", "LessEquals" }, { ">=", "GreaterEquals" }, { "&&", "LogicalAnd" }, { "||", "LogicalOr" },
			{ "{", "LeftCurly" }, { "}", "RightCurly" }, { "(", "LeftBrace" }, { ")", "RightBrace" },
			{ ",", "Comma" }, { ":", "Colon" }, { ";", "SemiColon" }, { ".", "Dot" }, { "=", "Equals" },
			{ "<", "LessThan" }, { ">", "GreaterThan" }, { "+", "Plus" }, { "-", "Minus" }, { "*", "Star" },
			{ "/", "RightSlash" }, { "%", "Percent" }, { "!", "Shreak" },
			// Unicode alternatives
			{ "⇔", "Iff" }, { "↔", "Iff" }, { "⇒", "Implies" }, { "→", "Implies" }, { "≔", "ColonEquals" },
			{ "≠", "NotEquals" }, { "≤", "LessEquals" }, { "≥", "GreaterEquals" }, { "∧", "LogicalAnd" },
			{ "∨", "LogicalOr" }, { "¬", "Shreak" }, { "∀", "Forall" }, { "∃", "Exists" } };

	private final String input;
	private int pos;
	private int line = 1;
	private int lineStart;

	/**
	 * Check whether a word is reserved, and so cannot name a variable.
	 */
	public static boolean isKeyword(String text) {
		return KEYWORDS.containsKey(text);
	}

	public HoareFileLexer(String input) {
		this.input = input;
	}

	/**
	 * Scan the entire input, producing a list of tokens terminated by an
	 * {@link Kind#EOF} token.
	 *
	 * @return
	 * @throws SyntaxError if an unrecognised character is encountered.
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		while (true) {
			skipWhiteSpaceAndComments();
			if (pos >= input.length()) {
				tokens.add(new Token(Kind.EOF, "", position()));
				return tokens;
			}
			char c = input.charAt(pos);
			if (Character.isDigit(c)) {
				tokens.add(scanInteger());
			} else if (Character.isJavaIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else {
				tokens.add(scanOperator());
			}
		}
	}

	private Token scanInteger() {
		SourcePosition start = position();
		int begin = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos++;
		}
		return new Token(Kind.IntValue, input.substring(begin, pos), start);
	}

	private Token scanIdentifier() {
		SourcePosition start = position();
		int begin = pos;
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		String text = input.substring(begin, pos);
		Kind kind = KEYWORDS.getOrDefault(text, Kind.Identifier);
		return new Token(kind, text, start);
	}

	private Token scanOperator() {
		SourcePosition start = position();
		for (String[] op : OPERATORS) {
			if (input.startsWith(op[0], pos)) {
				pos += op[0].length();
				return new Token(Kind.valueOf(op[1]), op[0], start);
			}
		}
		throw new SyntaxError("a token", "'" + input.charAt(pos) + "'", start);
	}

	private void skipWhiteSpaceAndComments() {
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (c == '\n') {
				pos++;
				line++;
				lineStart = pos;
			} else if (Character.isWhitespace(c)) {
				pos++;
			} else if (input.startsWith("//", pos)) {
				while (pos < input.length() && input.charAt(pos) != '\n') {
					pos++;
				}
			} else {
				return;
			}
		}
	}

	private SourcePosition position() {
		return new SourcePosition(line, pos - lineStart + 1);
	}
}
