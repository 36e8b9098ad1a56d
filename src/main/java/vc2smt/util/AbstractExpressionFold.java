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

import java.util.List;

import vc2smt.core.Logic.Expr;

/**
 * A visitor which combines the results of all subexpressions using a
 * <code>join</code> operation, with leaves producing <code>BOTTOM</code> unless
 * overridden.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructBoolean(Expr.Boolean expr) {
        return BOTTOM();
    }

    @Override
    protected E constructInteger(Expr.Integer expr) {
        return BOTTOM();
    }

    @Override
    protected E constructDecimal(Expr.Decimal expr) {
        return BOTTOM();
    }

    @Override
    protected E constructBitVector(Expr.BitVector expr) {
        return BOTTOM();
    }

    @Override
    protected E constructStringLiteral(Expr.StringLiteral expr) {
        return BOTTOM();
    }

    @Override
    protected E constructVariableAccess(Expr.VariableAccess expr) {
        return BOTTOM();
    }

    @Override
    protected E constructOperator(Expr.Operator expr, List<E> operands) {
        return join(operands);
    }

    @Override
    protected E constructInvoke(Expr.Invoke expr, List<E> arguments) {
        return join(arguments);
    }

    @Override
    protected E constructQuantifier(Expr.Quantifier expr, List<List<E>> triggers, E body) {
        E r = body;
        for (List<E> trigger : triggers) {
            r = join(r, join(trigger));
        }
        return r;
    }

    @Override
    protected E constructLet(Expr.Let expr, List<E> values, E body) {
        return join(join(values), body);
    }

    @Override
    protected E constructLabel(Expr.Label expr, E body) {
        return body;
    }

    protected E join(List<E> items) {
        E r = BOTTOM();
        for (int i = 0; i != items.size(); ++i) {
            r = join(r, items.get(i));
        }
        return r;
    }

    public abstract E join(E lhs, E rhs);

    public abstract E BOTTOM();
}
