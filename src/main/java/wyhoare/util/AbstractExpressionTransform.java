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

import java.util.List;

import wyhoare.core.HoareFile;
import wyhoare.core.HoareFile.Expr;

/**
 * A visitor which rebuilds an expression bottom-up. A node is reused as is
 * whenever none of its children were changed, so a transform which changes
 * nothing returns the original expression (by reference).
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr, Expr.Logical> {

    @Override
    protected Expr constructInteger(Expr.Integer expr) {
        return expr;
    }

    @Override
    protected Expr constructNegation(Expr.Negation expr, Expr operand) {
        if(expr.getOperand() == operand) {
            return expr;
        } else {
            return HoareFile.NEG(operand, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructAddition(Expr.Addition expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.ADD(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructSubtraction(Expr.Subtraction expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.SUB(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructMultiplication(Expr.Multiplication expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.MUL(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructIntegerDivision(Expr.IntegerDivision expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.IDIV(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructRemainder(Expr.Remainder expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.REM(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructBoolean(Expr.Boolean expr) {
        return expr;
    }

    @Override
    protected Expr.Logical constructVariableAccess(Expr.VariableAccess expr) {
        return expr;
    }

    @Override
    protected Expr.Logical constructEquals(Expr.Equals expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.EQ(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructNotEquals(Expr.NotEquals expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.NEQ(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructLessThan(Expr.LessThan expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.LT(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructLessThanOrEqual(Expr.LessThanOrEqual expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.LTEQ(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructGreaterThan(Expr.GreaterThan expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.GT(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, Expr lhs, Expr rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.GTEQ(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructLogicalAnd(Expr.LogicalAnd expr, List<Expr.Logical> operands) {
        if (unchanged(expr.getOperands(), operands)) {
            return expr;
        } else {
            return HoareFile.AND(operands, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructLogicalOr(Expr.LogicalOr expr, List<Expr.Logical> operands) {
        if (unchanged(expr.getOperands(), operands)) {
            return expr;
        } else {
            return HoareFile.OR(operands, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructLogicalImplication(Expr.Implies expr, Expr.Logical lhs, Expr.Logical rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.IMPLIES(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructLogicalIff(Expr.Iff expr, Expr.Logical lhs, Expr.Logical rhs) {
        if (unchanged(expr, lhs, rhs)) {
            return expr;
        } else {
            return HoareFile.IFF(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructLogicalNot(Expr.LogicalNot expr, Expr.Logical operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return HoareFile.NOT(operand, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructExistentialQuantifier(Expr.ExistentialQuantifier expr, Expr.Logical body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return HoareFile.EXISTS(expr.getVariable(), body, expr.getAttributes());
        }
    }

    @Override
    protected Expr.Logical constructUniversalQuantifier(Expr.UniversalQuantifier expr, Expr.Logical body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return HoareFile.FORALL(expr.getVariable(), body, expr.getAttributes());
        }
    }

    private static boolean unchanged(Expr.BinaryOperator expr, Expr lhs, Expr rhs) {
        return expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs;
    }

    private static boolean unchanged(List<Expr.Logical> before, List<Expr.Logical> after) {
        for (int i = 0; i != before.size(); ++i) {
            if (before.get(i) != after.get(i)) {
                return false;
            }
        }
        return true;
    }
}
