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

import static wyhoare.core.HoareFile.*;

import java.util.List;

import wyhoare.core.HoareTriple;
import wyhoare.io.HoareFilePrinter;
import wyhoare.logic.FreshNames;
import wyhoare.logic.Normaliser;
import wyhoare.logic.Substitution;

/**
 * The axioms and rules of Hoare logic, for constructing proofs by hand. Each
 * rule checks that its premises have the required form and, if so, returns
 * the triple it concludes. Formulas are compared after normalisation, so that
 * (for example) <code>x &gt; 0</code> matches <code>x &gt;= 1</code>.
 * <p>
 * The rule of consequence accepts its side conditions as given. Their
 * validity must be established separately, for example by
 * {@link ProofScript#check}.
 */
public class ProofRules {
	private final Normaliser normaliser;
	private final FreshNames names = new FreshNames();

	public ProofRules(Normaliser normaliser) {
		this.normaliser = normaliser;
	}

	/**
	 * The empty statement axiom: <code>{P} skip {P}</code>.
	 */
	public HoareTriple skip(Expr.Logical p) {
		return new HoareTriple(p, SKIP(), p);
	}

	/**
	 * The assignment axiom: <code>{Q[x := e]} x := e {Q}</code>.
	 *
	 * @param variable
	 * @param e
	 * @param q
	 * @return
	 */
	public HoareTriple assignment(String variable, Expr e, Expr.Logical q) {
		Expr.Logical pre = Substitution.substitute(q, variable, e, names);
		return new HoareTriple(pre, ASSIGN(variable, e), q);
	}

	/**
	 * The rule of composition: from <code>{P} S1 {R}</code> and
	 * <code>{R} S2 {Q}</code> conclude <code>{P} S1; S2 {Q}</code>.
	 *
	 * @param left
	 * @param right
	 * @return
	 * @throws InvalidProofException if the midconditions do not match.
	 */
	public HoareTriple composition(HoareTriple left, HoareTriple right) {
		if (!matches(left.getPostcondition(), right.getPrecondition())) {
			throw new InvalidProofException("midconditions do not match: left postcondition "
					+ show(left.getPostcondition()) + ", right precondition " + show(right.getPrecondition()));
		}
		return new HoareTriple(left.getPrecondition(), SEQUENCE(left.getProgram(), right.getProgram()),
				right.getPostcondition());
	}

	/**
	 * The conditional rule: from <code>{P &amp;&amp; B} S1 {Q}</code> and
	 * <code>{P &amp;&amp; !B} S2 {Q}</code> conclude
	 * <code>{P} if B then S1 else S2 fi {Q}</code>. The condition is the last
	 * conjunct of each precondition.
	 *
	 * @param left
	 * @param right
	 * @return
	 * @throws InvalidProofException if the premises do not have this form.
	 */
	public HoareTriple condition(HoareTriple left, HoareTriple right) {
		Expr.Logical[] l = split(left.getPrecondition(), "left");
		Expr.Logical[] r = split(right.getPrecondition(), "right");
		if (!matches(l[0], r[0])) {
			throw new InvalidProofException(
					"preconditions do not share a common part: left " + show(l[0]) + ", right " + show(r[0]));
		} else if (!matches(NOT(l[1]), r[1])) {
			throw new InvalidProofException(
					"conditions are not complementary: left " + show(l[1]) + ", right " + show(r[1]));
		} else if (!matches(left.getPostcondition(), right.getPostcondition())) {
			throw new InvalidProofException("postconditions do not match: left " + show(left.getPostcondition())
					+ ", right " + show(right.getPostcondition()));
		}
		return new HoareTriple(l[0], IFELSE(l[1], left.getProgram(), right.getProgram()), left.getPostcondition());
	}

	/**
	 * The rule of consequence: from <code>P' ==&gt; P</code>,
	 * <code>{P} S {Q}</code> and <code>Q ==&gt; Q'</code> conclude
	 * <code>{P'} S {Q'}</code>.
	 *
	 * @param strengthen
	 * @param middle
	 * @param weaken
	 * @return
	 * @throws InvalidProofException if either formula is not an implication, or
	 *                               does not match the triple.
	 */
	public HoareTriple consequence(Expr.Logical strengthen, HoareTriple middle, Expr.Logical weaken) {
		if (!(strengthen instanceof Expr.Implies)) {
			throw new InvalidProofException("left formula " + show(strengthen) + " is not an implication");
		} else if (!(weaken instanceof Expr.Implies)) {
			throw new InvalidProofException("right formula " + show(weaken) + " is not an implication");
		}
		Expr.Implies s = (Expr.Implies) strengthen;
		Expr.Implies w = (Expr.Implies) weaken;
		if (!matches(s.getRightHandSide(), middle.getPrecondition())) {
			throw new InvalidProofException("left formula " + show(strengthen)
					+ " does not match the precondition " + show(middle.getPrecondition()));
		} else if (!matches(w.getLeftHandSide(), middle.getPostcondition())) {
			throw new InvalidProofException("right formula " + show(weaken) + " does not match the postcondition "
					+ show(middle.getPostcondition()));
		}
		return new HoareTriple(s.getLeftHandSide(), middle.getProgram(), w.getRightHandSide());
	}

	/**
	 * The while rule: from <code>{I &amp;&amp; B} S {I}</code> conclude
	 * <code>{I} while B invariant I do S od {I &amp;&amp; !B}</code>. The
	 * condition is the last conjunct of the precondition.
	 *
	 * @param body
	 * @return
	 * @throws InvalidProofException if the invariant is not preserved.
	 */
	public HoareTriple loop(HoareTriple body) {
		Expr.Logical[] p = split(body.getPrecondition(), "loop body");
		if (!matches(p[0], body.getPostcondition())) {
			throw new InvalidProofException("loop invariant is not preserved: precondition " + show(p[0])
					+ ", postcondition " + show(body.getPostcondition()));
		}
		Expr.Logical invariant = body.getPostcondition();
		return new HoareTriple(invariant, WHILE(p[1], invariant, body.getProgram()), AND(invariant, NOT(p[1])));
	}

	/**
	 * Split a conjunction into everything but its last conjunct, and its last
	 * conjunct.
	 */
	private static Expr.Logical[] split(Expr.Logical e, String side) {
		if (!(e instanceof Expr.LogicalAnd)) {
			throw new InvalidProofException(side + " precondition " + show(e) + " is not a conjunction");
		}
		List<Expr.Logical> operands = ((Expr.LogicalAnd) e).getOperands();
		Expr.Logical last = operands.get(operands.size() - 1);
		return new Expr.Logical[] { AND(operands.subList(0, operands.size() - 1)), last };
	}

	private boolean matches(Expr.Logical lhs, Expr.Logical rhs) {
		return lhs.equals(rhs) || normaliser.normalise(lhs).equals(normaliser.normalise(rhs));
	}

	private static String show(Expr e) {
		return HoareFilePrinter.toString(e);
	}
}
