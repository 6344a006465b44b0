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
package wyhoare.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wyhoare.core.Environment;
import wyhoare.core.HoareFile.Expr;
import wyhoare.io.HoareFilePrinter;
import wyhoare.logic.Normaliser;
import wyhoare.solver.DecisionProcedure;
import wyhoare.solver.Outcome;
import wyhoare.tasks.VerificationCondition.Status;

/**
 * Attempts to settle the status of verification conditions automatically.
 * Each condition is normalised first, which is often enough to show it holds.
 * Otherwise, the decision procedure either proves it, refutes it with a
 * counterexample, or leaves it open for review.
 */
public class DischargeTask {
	private static final Logger logger = LoggerFactory.getLogger(DischargeTask.class);

	private final Environment environment;
	private final Normaliser normaliser;
	private final DecisionProcedure procedure;

	public DischargeTask(Environment environment, VerificationOptions options) {
		if (environment == null) {
			throw new IllegalArgumentException("environment required");
		} else if (options == null) {
			throw new IllegalArgumentException("options required");
		}
		this.environment = environment;
		this.normaliser = new Normaliser(options.getMaxSteps());
		this.procedure = new DecisionProcedure(options.getMaxSteps(), options.getCounterexampleBound());
	}

	/**
	 * Determine the status of a verification condition.
	 *
	 * @param vc
	 * @return The status now recorded for the condition.
	 */
	public Status discharge(VerificationCondition vc) {
		Expr.Logical normalised = normaliser.normalise(vc.getObligation());
		if (normalised.isTrue()) {
			vc.discharged(normalised, Status.DISCHARGED, null);
		} else {
			Outcome outcome = decide(vc.getObligation(), normalised);
			switch (outcome.getKind()) {
			case VALID:
				vc.discharged(normalised, Status.DISCHARGED, null);
				break;
			case INVALID:
				vc.discharged(normalised, Status.REFUTED, outcome.getCounterexample());
				break;
			default:
				vc.discharged(normalised, Status.OPEN, null);
			}
			logger.debug("{}: {} is {}", vc.getOrigin(), HoareFilePrinter.toString(normalised), outcome);
		}
		return vc.getStatus();
	}

	private Outcome decide(Expr.Logical obligation, Expr.Logical normalised) {
		try {
			return procedure.decide(obligation, normalised, environment);
		} catch (RuntimeException e) {
			// Leave this condition open rather than lose the rest of the triple
			logger.warn("cannot decide {}: {}", HoareFilePrinter.toString(normalised), e.toString());
			return Outcome.unknown(e.getMessage());
		}
	}
}
