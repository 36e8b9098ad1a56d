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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;

/**
 * Determines the free variables of an expression, in order of first
 * occurrence. A variable bound by a quantifier is not free within it. A
 * variable bound by a <code>let</code> is not free within its body but, since
 * bindings are simultaneous, remains free in the bound values.
 */
public class FreeVariableCollector extends AbstractExpressionFold<Set<Logic.Variable>> {

    public Set<Logic.Variable> collect(Expr expr) {
        return visitExpression(expr);
    }

    @Override
    protected Set<Logic.Variable> constructVariableAccess(Expr.VariableAccess expr) {
        Set<Logic.Variable> vars = new LinkedHashSet<>();
        vars.add(expr.getVariable());
        return vars;
    }

    @Override
    protected Set<Logic.Variable> constructQuantifier(Expr.Quantifier expr, List<List<Set<Logic.Variable>>> triggers,
            Set<Logic.Variable> body) {
        Set<Logic.Variable> vars = super.constructQuantifier(expr, triggers, body);
        vars.removeAll(expr.getParameters());
        return vars;
    }

    @Override
    protected Set<Logic.Variable> constructLet(Expr.Let expr, List<Set<Logic.Variable>> values,
            Set<Logic.Variable> body) {
        for (Expr.Binding b : expr.getBindings()) {
            body.remove(b.getVariable());
        }
        Set<Logic.Variable> vars = join(values);
        vars.addAll(body);
        return vars;
    }

    @Override
    public Set<Logic.Variable> join(Set<Logic.Variable> lhs, Set<Logic.Variable> rhs) {
        Set<Logic.Variable> vars = new LinkedHashSet<>(lhs);
        vars.addAll(rhs);
        return vars;
    }

    @Override
    public Set<Logic.Variable> BOTTOM() {
        return new LinkedHashSet<>();
    }
}
