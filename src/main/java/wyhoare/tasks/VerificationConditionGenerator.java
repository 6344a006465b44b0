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

import static wyhoare.core.HoareFile.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import wyhoare.core.HoareTriple;
import wyhoare.core.SourcePosition;
import wyhoare.logic.FreshNames;
import wyhoare.logic.Substitution;
import wyhoare.util.Util;

/**
 * Reduces a Hoare triple to a sequence of verification conditions, whose
 * joint validity implies that of the triple (under partial correctness). The
 * reduction works backwards through each statement using weakest
 * preconditions:
 *
 * <ul>
 * <li><code>{P} x := e {Q}</code> gives <code>P ==&gt; Q[x := e]</code>.</li>
 * <li><code>{P} S1; S2 {Q}</code> reduces <code>{P} S1 {wp(S2,Q)}</code>,
 * followed by any conditions arising within <code>S2</code>.</li>
 * <li><code>{P} if g then S1 else S2 fi {Q}</code> reduces
 * <code>{P &amp;&amp; g} S1 {Q}</code> and
 * <code>{P &amp;&amp; !g} S2 {Q}</code>.</li>
 * <li><code>{P} while g invariant I do S od {Q}</code> gives
 * <code>P ==&gt; I</code>, reduces <code>{I &amp;&amp; g} S {I}</code> and
 * gives <code>I &amp;&amp; !g ==&gt; Q</code>.</li>
 * </ul>
 *
 * Conditions are produced in program order, and an implication whose two
 * sides are identical is omitted. The generator for a triple owns the fresh
 * names used when renaming during substitution, so repeated generation for
 * the same triple always gives the same result.
 */
public class VerificationConditionGenerator {
	private final FreshNames names = new FreshNames();

	private VerificationConditionGenerator() {
	}

	/**
	 * Generate the verification conditions for a (type checked) triple.
	 *
	 * @param triple
	 * @return
	 */
	public static List<VerificationCondition> generate(HoareTriple triple) {
		ArrayList<VerificationCondition> vcs = new ArrayList<>();
		new VerificationConditionGenerator().reduce(triple.getPrecondition(), triple.getProgram(),
				triple.getPostcondition(), Origin.Kind.PRECONDITION, Collections.emptyList(), vcs);
		return vcs;
	}

	// =========================================================================
	// Reduction
	// =========================================================================

	/**
	 * Reduce the triple <code>{pre} stmt {post}</code>, adding its conditions to
	 * the given list.
	 *
	 * @param pre
	 * @param stmt
	 * @param post
	 * @param kind Kind of condition arising from the precondition.
	 * @param path Branches taken to reach this statement.
	 * @param vcs
	 */
	private void reduce(Expr.Logical pre, Stmt stmt, Expr.Logical post, Origin.Kind kind, List<String> path,
			List<VerificationCondition> vcs) {
		if (stmt instanceof Stmt.Sequence) {
			reduceSequence(pre, (Stmt.Sequence) stmt, post, kind, path, vcs);
		} else if (stmt instanceof Stmt.IfElse) {
			Stmt.IfElse s = (Stmt.IfElse) stmt;
			Expr.Logical g = s.getCondition();
			reduce(AND(pre, g), s.getTrueBranch(), post, kind, Util.append(path, "then"), vcs);
			reduce(AND(pre, NOT(g)), s.getFalseBranch(), post, kind, Util.append(path, "else"), vcs);
		} else if (stmt instanceof Stmt.While) {
			Stmt.While s = (Stmt.While) stmt;
			implies(pre, s.getInvariant(), Origin.Kind.LOOP_INITIATION, s, path, vcs);
			reduceLoop(s, post, path, vcs);
		} else {
			implies(pre, weakestPrecondition(stmt, post), kind, stmt, path, vcs);
		}
	}

	private void reduceSequence(Expr.Logical pre, Stmt.Sequence s, Expr.Logical post, Origin.Kind kind,
			List<String> path, List<VerificationCondition> vcs) {
		if (s.size() == 0) {
			implies(pre, post, kind, s, path, vcs);
			return;
		}
		Stmt rest = SEQUENCE(s.getAll().subList(1, s.size()));
		ArrayList<VerificationCondition> side = new ArrayList<>();
		Expr.Logical mid = weakestPrecondition(rest, post, kind, path, side);
		reduce(pre, s.get(0), mid, kind, path, vcs);
		vcs.addAll(side);
	}

	/**
	 * Reduce the preservation and exit obligations of a loop.
	 */
	private void reduceLoop(Stmt.While s, Expr.Logical post, List<String> path, List<VerificationCondition> vcs) {
		Expr.Logical invariant = s.getInvariant();
		Expr.Logical guard = s.getCondition();
		reduce(AND(invariant, guard), s.getBody(), invariant, Origin.Kind.LOOP_PRESERVATION, path, vcs);
		implies(AND(invariant, NOT(guard)), post, Origin.Kind.LOOP_EXIT, s, path, vcs);
	}

	// =========================================================================
	// Weakest Preconditions
	// =========================================================================

	/**
	 * Determine the weakest precondition of a loop-free assignment or skip.
	 */
	private Expr.Logical weakestPrecondition(Stmt stmt, Expr.Logical post) {
		if (stmt instanceof Stmt.Skip) {
			return post;
		} else if (stmt instanceof Stmt.Assignment) {
			Stmt.Assignment s = (Stmt.Assignment) stmt;
			return Substitution.substitute(post, s.getLeftHandSide().getVariable(), s.getRightHandSide(), names);
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + stmt.getClass().getName() + ")");
		}
	}

	/**
	 * Determine the weakest precondition of an arbitrary statement. Loops
	 * within the statement contribute their invariant, and their preservation
	 * and exit obligations are added to <code>side</code> in program order.
	 */
	private Expr.Logical weakestPrecondition(Stmt stmt, Expr.Logical post, Origin.Kind kind, List<String> path,
			List<VerificationCondition> side) {
		if (stmt instanceof Stmt.Sequence) {
			List<Stmt> stmts = ((Stmt.Sequence) stmt).getAll();
			ArrayList<List<VerificationCondition>> sides = new ArrayList<>();
			Expr.Logical wp = post;
			for (int i = stmts.size() - 1; i >= 0; --i) {
				ArrayList<VerificationCondition> ith = new ArrayList<>();
				wp = weakestPrecondition(stmts.get(i), wp, kind, path, ith);
				sides.add(0, ith);
			}
			for (List<VerificationCondition> s : sides) {
				side.addAll(s);
			}
			return wp;
		} else if (stmt instanceof Stmt.IfElse) {
			Stmt.IfElse s = (Stmt.IfElse) stmt;
			Expr.Logical g = s.getCondition();
			Expr.Logical lhs = weakestPrecondition(s.getTrueBranch(), post, kind, Util.append(path, "then"), side);
			Expr.Logical rhs = weakestPrecondition(s.getFalseBranch(), post, kind, Util.append(path, "else"), side);
			return AND(IMPLIES(g, lhs), IMPLIES(NOT(g), rhs));
		} else if (stmt instanceof Stmt.While) {
			Stmt.While s = (Stmt.While) stmt;
			reduceLoop(s, post, path, side);
			return s.getInvariant();
		} else {
			return weakestPrecondition(stmt, post);
		}
	}

	/**
	 * Add the condition <code>lhs ==&gt; rhs</code>, unless both sides are
	 * identical.
	 */
	private static void implies(Expr.Logical lhs, Expr.Logical rhs, Origin.Kind kind, Stmt stmt, List<String> path,
			List<VerificationCondition> vcs) {
		if (!lhs.equals(rhs)) {
			SourcePosition position = stmt.getAttribute(SourcePosition.class);
			vcs.add(new VerificationCondition(IMPLIES(lhs, rhs), new Origin(kind, position, path)));
		}
	}
}
