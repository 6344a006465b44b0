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
package wyhoare.util;

import static wyhoare.core.HoareFile.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A visitor which rebuilds a statement bottom-up, reusing any statement whose
 * components were not changed.
 */
public class AbstractStatementVisitor {

    public Stmt visitStatement(Stmt s) {
        if(s instanceof Stmt.Skip) {
            return constructSkip((Stmt.Skip) s);
        } else if(s instanceof Stmt.Assignment) {
            return constructAssignment((Stmt.Assignment) s);
        } else if(s instanceof Stmt.IfElse) {
            return visitIfElse((Stmt.IfElse)s);
        } else if(s instanceof Stmt.Sequence) {
            return visitSequence((Stmt.Sequence)s);
        } else if(s instanceof Stmt.While) {
            return visitWhile((Stmt.While)s);
        } else {
            throw new IllegalArgumentException("unknown statement encountered (" + s.getClass().getName() + ")");
        }
    }

    protected Stmt visitSequence(Stmt.Sequence s) {
        List<Stmt> oldStmts = s.getAll();
        List<Stmt> newStmts = oldStmts;
        for (int i = 0; i != s.size(); ++i) {
            Stmt o = newStmts.get(i);
            Stmt n = visitStatement(o);
            if (o != n) {
                if (newStmts == oldStmts) {
                    newStmts = new ArrayList<>(oldStmts);
                }
                newStmts.set(i, n);
            }
        }
        return constructSequence(s, newStmts);
    }

    protected Stmt visitIfElse(Stmt.IfElse s) {
        Expr.Logical condition = visitCondition(s.getCondition());
        Stmt trueBranch = visitStatement(s.getTrueBranch());
        Stmt falseBranch = visitStatement(s.getFalseBranch());
        return constructIfElse(s, condition, trueBranch, falseBranch);
    }

    protected Stmt visitWhile(Stmt.While s) {
        Expr.Logical condition = visitCondition(s.getCondition());
        Expr.Logical invariant = visitInvariant(s.getInvariant());
        Stmt body = visitStatement(s.getBody());
        return constructWhile(s, condition, invariant, body);
    }

    protected Expr.Logical visitCondition(Expr.Logical condition) {
        return condition;
    }

    protected Expr.Logical visitInvariant(Expr.Logical invariant) {
        return invariant;
    }

    protected Stmt constructSkip(Stmt.Skip s) {
        return s;
    }

    protected Stmt constructAssignment(Stmt.Assignment s) {
        return s;
    }

    protected Stmt constructIfElse(Stmt.IfElse s, Expr.Logical condition, Stmt trueBranch, Stmt falseBranch) {
        if (s.getCondition() == condition && s.getTrueBranch() == trueBranch && s.getFalseBranch() == falseBranch) {
            return s;
        } else {
            return IFELSE(condition, trueBranch, falseBranch, s.getAttributes());
        }
    }

    protected Stmt constructSequence(Stmt.Sequence s, List<Stmt> stmts) {
        if(s.getAll() == stmts) {
            return s;
        } else {
            return SEQUENCE(stmts, s.getAttributes());
        }
    }

    protected Stmt constructWhile(Stmt.While s, Expr.Logical condition, Expr.Logical invariant, Stmt body) {
        if (s.getCondition() == condition && s.getInvariant() == invariant && s.getBody() == body) {
            return s;
        } else {
            return WHILE(condition, invariant, body, s.getAttributes());
        }
    }
}
