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
package vc2smt.util;

import java.util.ArrayList;
import java.util.List;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;

/**
 * A visitor which rebuilds an expression from its transformed children. Nodes
 * whose children are unchanged are returned as is, so that a transform which
 * changes nothing returns the original expression.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr> {

    @Override
    protected Expr constructBoolean(Expr.Boolean expr) {
        return expr;
    }

    @Override
    protected Expr constructInteger(Expr.Integer expr) {
        return expr;
    }

    @Override
    protected Expr constructDecimal(Expr.Decimal expr) {
        return expr;
    }

    @Override
    protected Expr constructBitVector(Expr.BitVector expr) {
        return expr;
    }

    @Override
    protected Expr constructStringLiteral(Expr.StringLiteral expr) {
        return expr;
    }

    @Override
    protected Expr constructVariableAccess(Expr.VariableAccess expr) {
        return expr;
    }

    @Override
    protected Expr constructOperator(Expr.Operator expr, List<Expr> operands) {
        if (equals(expr.getOperands(), operands)) {
            return expr;
        } else {
            return Logic.OPERATOR(expr.getKind(), operands, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructInvoke(Expr.Invoke expr, List<Expr> arguments) {
        if (equals(expr.getArguments(), arguments)) {
            return expr;
        } else {
            return Logic.INVOKE(expr.getFunction(), expr.getTypeArguments(), arguments, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructQuantifier(Expr.Quantifier expr, List<List<Expr>> triggers, Expr body) {
        boolean unchanged = expr.getBody() == body;
        for (int i = 0; i != triggers.size(); ++i) {
            unchanged &= equals(expr.getTriggers().get(i), triggers.get(i));
        }
        if (unchanged) {
            return expr;
        } else {
            return Logic.QUANTIFIER(expr, expr.getTypeParameters(), expr.getParameters(), triggers, body);
        }
    }

    @Override
    protected Expr constructLet(Expr.Let expr, List<Expr> values, Expr body) {
        List<Expr.Binding> bindings = expr.getBindings();
        boolean unchanged = expr.getBody() == body;
        for (int i = 0; i != bindings.size(); ++i) {
            unchanged &= bindings.get(i).getValue() == values.get(i);
        }
        if (unchanged) {
            return expr;
        }
        List<Expr.Binding> nbindings = new ArrayList<>();
        for (int i = 0; i != bindings.size(); ++i) {
            Expr.Binding ith = bindings.get(i);
            nbindings.add(Logic.BIND(ith.getVariable(), values.get(i), ith.getAttributes()));
        }
        return Logic.LET(nbindings, body, expr.getAttributes());
    }

    @Override
    protected Expr constructLabel(Expr.Label expr, Expr body) {
        if (expr.getBody() == body) {
            return expr;
        } else {
            return Logic.LABEL(expr.getName(), expr.isPositive(), body, expr.getAttributes());
        }
    }

    /**
     * Check whether two lists contain exactly the same (i.e. identical) items.
     *
     * @param before
     * @param after
     * @return
     */
    protected static boolean equals(List<? extends Expr> before, List<? extends Expr> after) {
        if (before.size() != after.size()) {
            return false;
        }
        for (int i = 0; i != before.size(); ++i) {
            if (before.get(i) != after.get(i)) {
                return false;
            }
        }
        return true;
    }
}
