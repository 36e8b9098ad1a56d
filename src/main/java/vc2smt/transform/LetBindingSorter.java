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
package vc2smt.transform;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.util.AbstractExpressionTransform;
import vc2smt.util.FreeVariableCollector;

/**
 * <p>
 * Sorts the bindings of <code>let</code> expressions so that they can be
 * expressed with the strictly nested scoping of SMT-LIB. The bindings of a
 * single SMT-LIB <code>let</code> are simultaneous, hence a bound value cannot
 * refer to another binding of the same <code>let</code>. Upstream producers of
 * verification conditions, however, bind shared subexpressions in whatever order
 * they were discovered. For example:
 * </p>
 *
 * <pre>
 * (let ((y (+ x 1)) (x (f a))) (g x y))
 * </pre>
 *
 * <p>
 * Here, the value bound to <code>y</code> refers to <code>x</code>, which is
 * bound by the same <code>let</code>. This is rewritten into nested layers,
 * where each layer refers only to bindings of the layers enclosing it:
 * </p>
 *
 * <pre>
 * (let ((x (f a))) (let ((y (+ x 1))) (g x y)))
 * </pre>
 *
 * <p>
 * Within a layer, bindings keep their original relative order. No binding is
 * ever duplicated or dropped. Since the input is produced from an acyclic
 * graph of shared terms, a cycle amongst bindings indicates a bug upstream and
 * is reported as an <code>IllegalStateException</code>.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class LetBindingSorter extends AbstractExpressionTransform {
	private final FreeVariableCollector freeVariables = new FreeVariableCollector();

	public Expr sort(Expr expr) {
		return visitExpression(expr);
	}

	@Override
	protected Expr constructLet(Expr.Let expr, List<Expr> values, Expr body) {
		List<Expr.Binding> bindings = expr.getBindings();
		Set<Logic.Variable> bound = new HashSet<>();
		for (Expr.Binding b : bindings) {
			bound.add(b.getVariable());
		}
		// Determine dependencies amongst bindings of this let
		List<Set<Logic.Variable>> dependencies = new ArrayList<>();
		boolean independent = true;
		for (int i = 0; i != bindings.size(); ++i) {
			Set<Logic.Variable> deps = freeVariables.collect(values.get(i));
			deps.retainAll(bound);
			dependencies.add(deps);
			independent &= deps.isEmpty();
		}
		if (independent) {
			return super.constructLet(expr, values, body);
		}
		// Peel off layers whose dependencies are already in scope
		List<List<Expr.Binding>> layers = new ArrayList<>();
		Set<Logic.Variable> inScope = new HashSet<>();
		boolean[] placed = new boolean[bindings.size()];
		int remaining = bindings.size();
		while (remaining > 0) {
			List<Integer> layer = new ArrayList<>();
			for (int i = 0; i != bindings.size(); ++i) {
				if (!placed[i] && inScope.containsAll(dependencies.get(i))) {
					layer.add(i);
				}
			}
			if (layer.isEmpty()) {
				throw new IllegalStateException("cyclic let bindings: " + unplaced(bindings, placed));
			}
			List<Expr.Binding> nbindings = new ArrayList<>();
			for (int i : layer) {
				Expr.Binding ith = bindings.get(i);
				nbindings.add(Logic.BIND(ith.getVariable(), values.get(i), ith.getAttributes()));
				inScope.add(ith.getVariable());
				placed[i] = true;
			}
			remaining -= layer.size();
			layers.add(nbindings);
		}
		// Rebuild from innermost layer outwards
		Expr result = body;
		for (int i = layers.size() - 1; i >= 0; --i) {
			if (i == 0) {
				result = Logic.LET(layers.get(i), result, expr.getAttributes());
			} else {
				result = Logic.LET(layers.get(i), result);
			}
		}
		return result;
	}

	private static List<String> unplaced(List<Expr.Binding> bindings, boolean[] placed) {
		ArrayList<String> names = new ArrayList<>();
		for (int i = 0; i != bindings.size(); ++i) {
			if (!placed[i]) {
				names.add(bindings.get(i).getVariable().getName());
			}
		}
		return names;
	}
}
