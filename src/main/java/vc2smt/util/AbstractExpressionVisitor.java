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

import vc2smt.core.Logic.Expr;

/**
 * Provides a generic bottom-up traversal of expressions. Each kind of node is
 * first visited, which recursively visits its children, and then constructed
 * from the results of those children.
 *
 * @param <E> The result produced for each expression.
 */
public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if(expr instanceof Expr.Boolean) {
            return constructBoolean((Expr.Boolean) expr);
        } else if(expr instanceof Expr.Integer) {
            return constructInteger((Expr.Integer) expr);
        } else if(expr instanceof Expr.Decimal) {
            return constructDecimal((Expr.Decimal) expr);
        } else if(expr instanceof Expr.BitVector) {
            return constructBitVector((Expr.BitVector) expr);
        } else if(expr instanceof Expr.StringLiteral) {
            return constructStringLiteral((Expr.StringLiteral) expr);
        } else if(expr instanceof Expr.VariableAccess) {
            return constructVariableAccess((Expr.VariableAccess) expr);
        } else if(expr instanceof Expr.Operator) {
            return visitOperator((Expr.Operator) expr);
        } else if(expr instanceof Expr.Invoke) {
            return visitInvoke((Expr.Invoke) expr);
        } else if(expr instanceof Expr.Quantifier) {
            return visitQuantifier((Expr.Quantifier) expr);
        } else if(expr instanceof Expr.Let) {
            return visitLet((Expr.Let) expr);
        } else if(expr instanceof Expr.Label) {
            return visitLabel((Expr.Label) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitOperator(Expr.Operator expr) {
        List<E> operands = visitExpressions(expr.getOperands());
        return constructOperator(expr, operands);
    }

    protected E visitInvoke(Expr.Invoke expr) {
        List<E> arguments = visitExpressions(expr.getArguments());
        return constructInvoke(expr, arguments);
    }

    protected E visitQuantifier(Expr.Quantifier expr) {
        List<List<E>> triggers = new ArrayList<>();
        for (List<Expr> trigger : expr.getTriggers()) {
            triggers.add(visitExpressions(trigger));
        }
        E body = visitExpression(expr.getBody());
        return constructQuantifier(expr, triggers, body);
    }

    protected E visitLet(Expr.Let expr) {
        List<E> values = new ArrayList<>();
        for (Expr.Binding b : expr.getBindings()) {
            values.add(visitExpression(b.getValue()));
        }
        E body = visitExpression(expr.getBody());
        return constructLet(expr, values, body);
    }

    protected E visitLabel(Expr.Label expr) {
        E body = visitExpression(expr.getBody());
        return constructLabel(expr, body);
    }

    protected abstract E constructBoolean(Expr.Boolean expr);

    protected abstract E constructInteger(Expr.Integer expr);

    protected abstract E constructDecimal(Expr.Decimal expr);

    protected abstract E constructBitVector(Expr.BitVector expr);

    protected abstract E constructStringLiteral(Expr.StringLiteral expr);

    protected abstract E constructVariableAccess(Expr.VariableAccess expr);

    protected abstract E constructOperator(Expr.Operator expr, List<E> operands);

    protected abstract E constructInvoke(Expr.Invoke expr, List<E> arguments);

    protected abstract E constructQuantifier(Expr.Quantifier expr, List<List<E>> triggers, E body);

    protected abstract E constructLet(Expr.Let expr, List<E> values, E body);

    protected abstract E constructLabel(Expr.Label expr, E body);
}
