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

import wyhoare.core.HoareFile.Expr;
import wyhoare.core.HoareFile.Stmt;
import wyhoare.io.HoareFilePrinter;

/**
 * A Hoare triple <code>{P} S {Q}</code> asserting that, if <code>P</code>
 * holds before <code>S</code> executes and <code>S</code> terminates, then
 * <code>Q</code> holds afterwards.
 */
public final class HoareTriple {
	private final Expr.Logical precondition;
	private final Stmt program;
	private final Expr.Logical postcondition;

	public HoareTriple(Expr.Logical precondition, Stmt program, Expr.Logical postcondition) {
		if (precondition == null || program == null || postcondition == null) {
			throw new IllegalArgumentException("incomplete triple");
		}
		this.precondition = precondition;
		this.program = program;
		this.postcondition = postcondition;
	}

	public Expr.Logical getPrecondition() {
		return precondition;
	}

	public Stmt getProgram() {
		return program;
	}

	public Expr.Logical getPostcondition() {
		return postcondition;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof HoareTriple) {
			HoareTriple t = (HoareTriple) o;
			return precondition.equals(t.precondition) && program.equals(t.program)
					&& postcondition.equals(t.postcondition);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return precondition.hashCode() ^ program.hashCode() ^ postcondition.hashCode();
	}

	@Override
	public String toString() {
		return "{" + HoareFilePrinter.toString(precondition) + "} " + HoareFilePrinter.toString(program) + " {"
				+ HoareFilePrinter.toString(postcondition) + "}";
	}
}
