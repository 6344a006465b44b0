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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wyhoare.core.Environment;
import wyhoare.core.HoareFile.Expr;
import wyhoare.core.HoareTriple;
import wyhoare.io.HoareFilePrinter.Notation;
import wyhoare.solver.DecisionProcedure;
import wyhoare.solver.Outcome;

/**
 * A numbered sequence of proof lines. Triples are typically derived from
 * earlier lines using {@link ProofRules}, whilst formulas record the side
 * conditions those derivations rely upon.
 */
public class ProofScript {
	private static final Logger logger = LoggerFactory.getLogger(ProofScript.class);

	private final ArrayList<ProofLine> lines = new ArrayList<>();

	/**
	 * Append a formula, returning its line number.
	 */
	public int add(Expr.Logical formula) {
		lines.add(new ProofLine.Formula(formula));
		return lines.size() - 1;
	}

	/**
	 * Append a triple, returning its line number.
	 */
	public int add(HoareTriple triple) {
		lines.add(new ProofLine.Triple(triple));
		return lines.size() - 1;
	}

	public ProofLine get(int line) {
		return lines.get(line);
	}

	public int size() {
		return lines.size();
	}

	public List<ProofLine> getLines() {
		return Collections.unmodifiableList(lines);
	}

	/**
	 * Attempt to decide every formula in this script.
	 *
	 * @param procedure
	 * @param environment Types of the variables used in this script.
	 * @return The outcome for each formula, keyed by line number.
	 */
	public Map<Integer, Outcome> check(DecisionProcedure procedure, Environment environment) {
		LinkedHashMap<Integer, Outcome> outcomes = new LinkedHashMap<>();
		for (int i = 0; i != lines.size(); ++i) {
			ProofLine line = lines.get(i);
			if (line instanceof ProofLine.Formula) {
				Outcome outcome = procedure.decide(line.getFormula(), environment);
				logger.debug("line {}: {}", i, outcome);
				outcomes.put(i, outcome);
			}
		}
		return outcomes;
	}

	public String toString(Notation notation) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i != lines.size(); ++i) {
			sb.append(i).append(" ").append(lines.get(i).toString(notation)).append("\n\n");
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return toString(Notation.UNICODE);
	}
}
