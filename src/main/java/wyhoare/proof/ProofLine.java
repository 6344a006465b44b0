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
package wyhoare.proof;

import wyhoare.core.HoareFile.Expr;
import wyhoare.core.HoareTriple;
import wyhoare.io.HoareFilePrinter;
import wyhoare.io.HoareFilePrinter.Notation;

/**
 * A single line of a hand-written proof, which is either a formula (usually
 * a side condition for the rule of consequence) or a triple.
 */
public abstract class ProofLine {

	public Expr.Logical getFormula() {
		throw new IllegalStateException("proof line is not a formula: " + this);
	}

	public HoareTriple getTriple() {
		throw new IllegalStateException("proof line is not a triple: " + this);
	}

	public abstract String toString(Notation notation);

	@Override
	public String toString() {
		return toString(Notation.ASCII);
	}

	public static final class Formula extends ProofLine {
		private final Expr.Logical formula;

		public Formula(Expr.Logical formula) {
			this.formula = formula;
		}

		@Override
		public Expr.Logical getFormula() {
			return formula;
		}

		@Override
		public String toString(Notation notation) {
			return HoareFilePrinter.toString(formula, notation);
		}
	}

	public static final class Triple extends ProofLine {
		private final HoareTriple triple;

		public Triple(HoareTriple triple) {
			this.triple = triple;
		}

		@Override
		public HoareTriple getTriple() {
			return triple;
		}

		@Override
		public String toString(Notation notation) {
			return "{" + HoareFilePrinter.toString(triple.getPrecondition(), notation) + "} "
					+ HoareFilePrinter.toString(triple.getProgram(), notation) + " {"
					+ HoareFilePrinter.toString(triple.getPostcondition(), notation) + "}";
		}
	}
}
