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

/**
 * Malformed source text. The message describes what was expected and what was
 * actually found at the given position.
 */
public class SyntaxError extends SyntacticException {
	private static final long serialVersionUID = 1L;

	private final String expected;
	private final String found;

	public SyntaxError(String expected, String found, SourcePosition position) {
		super(Kind.SYNTAX, "expected " + expected + ", found " + found, position);
		this.expected = expected;
		this.found = found;
	}

	public String getExpected() {
		return expected;
	}

	public String getFound() {
		return found;
	}
}
