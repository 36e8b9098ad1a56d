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
package vc2smt.erasure;

import static vc2smt.core.Logic.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.core.Logic.Type;
import vc2smt.core.Polarity;
import vc2smt.util.AbstractExpressionTransform;

/**
 * <p>
 * Rewrites a polymorphic verification condition into an equivalent one over
 * the sorts understood by the prover. Values of non-native types are moved into
 * the universal sort <code>U</code>, polymorphic functions are replaced by their
 * erased counterparts, and the type parameters of quantifiers are bound as
 * variables of sort <code>T</code>. Consider:
 * </p>
 *
 * <pre>
 * forall&lt;α&gt; x : α, s : Set&lt;α&gt; :: contains(add(s, x), x)
 * </pre>
 *
 * <p>
 * Under the premises encoding, this becomes:
 * </p>
 *
 * <pre>
 * (forall ((x U) (s U))
 *    (=> (= (type s) (Set (type x))) (contains (add s x) x)))
 * </pre>
 *
 * <p>
 * The polarity of every subexpression is tracked during the traversal. It is
 * flipped under negation and implication antecedents, and becomes neutral
 * beneath operators whose operands are used in both directions (e.g.
 * equivalence). The polarity does not influence how guards are attached to a
 * quantifier: a universal quantifier always receives its guards as antecedent
 * and an existential one as conjunct, since both remain sound whichever way the
 * quantifier is used.
 * </p>
 *
 * <p>
 * An eraser is used for a single expression. All persistent state lives in the
 * axiom builder it is bound to.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public abstract class TypeEraser extends AbstractExpressionTransform {
	protected final TypeAxiomBuilder builder;
	/**
	 * Variables bound by enclosing quantifiers and lets, mapped to their erased
	 * counterparts.
	 */
	private final Map<Logic.Variable, Logic.Variable> boundVariables = new HashMap<>();
	/**
	 * Type parameters of enclosing quantifiers, mapped to the terms representing
	 * them.
	 */
	private final Map<Type.Variable, Expr> typeBindings = new HashMap<>();
	private Polarity polarity = Polarity.POSITIVE;

	public TypeEraser(TypeAxiomBuilder builder) {
		this.builder = builder;
	}

	/**
	 * Erase the types of a given expression, which occurs with a given polarity.
	 *
	 * @param expr
	 * @param polarity
	 * @return
	 */
	public Expr erase(Expr expr, Polarity polarity) {
		this.polarity = polarity;
		return visitExpression(expr);
	}

	/**
	 * Get the polarity of the subexpression currently being erased.
	 *
	 * @return
	 */
	protected Polarity getPolarity() {
		return polarity;
	}

	/**
	 * Determine whether quantifier type parameters should be recovered from the
	 * types of bound variables, rather than being quantified themselves.
	 *
	 * @return
	 */
	protected abstract boolean inferTypeParameters();

	/**
	 * Determine whether bound variables of erased sort are guarded by premises
	 * stating their types.
	 *
	 * @return
	 */
	protected abstract boolean guardBoundVariables();

	@Override
	protected Expr constructVariableAccess(Expr.VariableAccess expr) {
		Logic.Variable v = expr.getVariable();
		Logic.Variable r = boundVariables.get(v);
		if (r == null) {
			r = builder.untypedVariable(v);
		}
		return r == v ? expr : VAR(r, expr.getAttributes());
	}

	@Override
	protected Expr visitOperator(Expr.Operator expr) {
		Polarity saved = polarity;
		List<Expr> operands = expr.getOperands();
		List<Expr> noperands = new ArrayList<>();
		for (int i = 0; i != operands.size(); ++i) {
			polarity = polarityOf(expr.getKind(), i, saved);
			noperands.add(visitExpression(operands.get(i)));
		}
		polarity = saved;
		Expr.Operator.Kind kind = expr.getKind();
		if (kind == Expr.Operator.Kind.SELECT || kind == Expr.Operator.Kind.STORE) {
			Type.Map type = (Type.Map) typeOf(operands.get(0));
			if (builder.erasedSort(type) == TypeAxiomBuilder.U) {
				return eraseMapOperator(kind, type, noperands);
			}
		}
		return constructOperator(expr, noperands);
	}

	/**
	 * Translate a select or store on a map whose sort was erased. Keys and values
	 * are boxed into <code>U</code> and a selected value is unboxed again.
	 *
	 * @param kind
	 * @param type
	 * @param operands
	 * @return
	 */
	private Expr eraseMapOperator(Expr.Operator.Kind kind, Type.Map type, List<Expr> operands) {
		Type key = builder.erasedSort(type.getKey());
		Type value = builder.erasedSort(type.getValue());
		Expr map = operands.get(0);
		Expr index = builder.cast(operands.get(1), key, TypeAxiomBuilder.U);
		if (kind == Expr.Operator.Kind.SELECT) {
			return builder.cast(builder.mapSelect(map, index), TypeAxiomBuilder.U, value);
		} else {
			return builder.mapStore(map, index, builder.cast(operands.get(2), value, TypeAxiomBuilder.U));
		}
	}

	@Override
	protected Expr visitInvoke(Expr.Invoke expr) {
		Logic.Function f = expr.getFunction();
		Logic.Function uf = builder.untypedFunction(f);
		Map<Type.Variable, Type> instantiation = Logic.bind(f.getTypeParameters(), expr.getTypeArguments());
		Polarity saved = polarity;
		polarity = Polarity.NEUTRAL;
		List<Expr> arguments = new ArrayList<>();
		for (Type.Variable tv : builder.explicitTypeParameters(f)) {
			arguments.add(builder.typeTerm(instantiation.get(tv), typeBindings));
		}
		List<Type> parameters = f.getParameterTypes();
		for (int i = 0; i != parameters.size(); ++i) {
			Expr arg = visitExpression(expr.getArguments().get(i));
			Type actual = builder.erasedSort(substitute(parameters.get(i), instantiation));
			Type declared = builder.erasedSort(parameters.get(i));
			arguments.add(builder.cast(arg, actual, declared));
		}
		polarity = saved;
		if (uf == f && equals(expr.getArguments(), arguments)) {
			return expr;
		}
		Expr r = INVOKE(uf, Collections.emptyList(), arguments, expr.getAttributes());
		Type declared = builder.erasedSort(f.getReturnType());
		Type actual = builder.erasedSort(substitute(f.getReturnType(), instantiation));
		return builder.cast(r, declared, actual);
	}

	@Override
	protected Expr visitQuantifier(Expr.Quantifier expr) {
		Polarity saved = polarity;
		List<Logic.Variable> parameters = expr.getParameters();
		List<Type.Variable> typeParameters = expr.getTypeParameters();
		Map<Logic.Variable, Logic.Variable> outerVariables = new HashMap<>(boundVariables);
		Map<Type.Variable, Expr> outerTypes = new HashMap<>(typeBindings);
		// Erase bound variables
		List<Logic.Variable> nparameters = new ArrayList<>();
		for (Logic.Variable v : parameters) {
			Logic.Variable nv = eraseVariable(v);
			boundVariables.put(v, nv);
			nparameters.add(nv);
		}
		// Bind type parameters
		Map<Type.Variable, Logic.Variable> inferredFrom = new HashMap<>();
		List<Logic.Variable> typeVariables = new ArrayList<>();
		for (Type.Variable tv : typeParameters) {
			Expr term = null;
			if (inferTypeParameters()) {
				for (Logic.Variable v : parameters) {
					Logic.Variable nv = boundVariables.get(v);
					if (nv.getType() == TypeAxiomBuilder.U) {
						term = builder.extract(tv, v.getType(), builder.typeApp(VAR(nv)));
						if (term != null) {
							inferredFrom.put(tv, v);
							break;
						}
					}
				}
			}
			if (term == null) {
				Logic.Variable t = new Logic.Variable(tv.getName(), TypeAxiomBuilder.T);
				typeVariables.add(t);
				term = VAR(t);
			}
			typeBindings.put(tv, term);
		}
		// Construct guards
		List<Expr> guards = new ArrayList<>();
		if (guardBoundVariables()) {
			for (Logic.Variable v : parameters) {
				Logic.Variable nv = boundVariables.get(v);
				if (nv.getType() != TypeAxiomBuilder.U || inferredFrom.get(v.getType()) == v) {
					// Not erased, or its guard would be trivially true
					continue;
				}
				guards.add(EQ(builder.typeApp(VAR(nv)), builder.typeTerm(v.getType(), typeBindings)));
			}
		}
		// Erase triggers and body
		polarity = Polarity.NEUTRAL;
		List<List<Expr>> triggers = new ArrayList<>();
		boolean changed = false;
		for (List<Expr> trigger : expr.getTriggers()) {
			List<Expr> ntrigger = visitExpressions(trigger);
			changed |= !equals(trigger, ntrigger);
			triggers.add(ntrigger);
		}
		polarity = saved;
		Expr body = visitExpression(expr.getBody());
		restore(boundVariables, outerVariables);
		restore(typeBindings, outerTypes);
		//
		if (!guards.isEmpty()) {
			if (expr.isUniversal()) {
				body = IMPLIES(AND(guards), body);
			} else {
				guards.add(body);
				body = AND(guards);
			}
		}
		changed |= body != expr.getBody() || !typeParameters.isEmpty() || !nparameters.equals(parameters);
		if (!changed) {
			return expr;
		}
		typeVariables.addAll(nparameters);
		return QUANTIFIER(expr, Collections.emptyList(), typeVariables, triggers, body);
	}

	@Override
	protected Expr visitLet(Expr.Let expr) {
		Polarity saved = polarity;
		Map<Logic.Variable, Logic.Variable> outerVariables = new HashMap<>(boundVariables);
		List<Expr.Binding> bindings = expr.getBindings();
		// Bindings of the same let may refer to each other until they are sorted.
		for (Expr.Binding b : bindings) {
			boundVariables.put(b.getVariable(), eraseVariable(b.getVariable()));
		}
		polarity = Polarity.NEUTRAL;
		boolean changed = false;
		List<Expr.Binding> nbindings = new ArrayList<>();
		for (Expr.Binding b : bindings) {
			Logic.Variable nv = boundVariables.get(b.getVariable());
			Expr value = visitExpression(b.getValue());
			if (nv == b.getVariable() && value == b.getValue()) {
				nbindings.add(b);
			} else {
				nbindings.add(BIND(nv, value, b.getAttributes()));
				changed = true;
			}
		}
		polarity = saved;
		Expr body = visitExpression(expr.getBody());
		restore(boundVariables, outerVariables);
		if (!changed && body == expr.getBody()) {
			return expr;
		}
		return LET(nbindings, body, expr.getAttributes());
	}

	/**
	 * Determine the polarity of an operand, given the polarity of its enclosing
	 * operator.
	 *
	 * @param kind
	 * @param operand
	 * @param polarity
	 * @return
	 */
	private static Polarity polarityOf(Expr.Operator.Kind kind, int operand, Polarity polarity) {
		switch (kind) {
		case NOT:
			return polarity.negate();
		case IMPLIES:
			return operand == 0 ? polarity.negate() : polarity;
		case AND:
		case OR:
			return polarity;
		case ITE:
			return operand == 0 ? Polarity.NEUTRAL : polarity;
		default:
			return Polarity.NEUTRAL;
		}
	}

	private Logic.Variable eraseVariable(Logic.Variable v) {
		Type sort = builder.erasedSort(v.getType());
		return sort.equals(v.getType()) ? v : new Logic.Variable(v.getName(), sort, v.getAttributes());
	}

	private static <K, V> void restore(Map<K, V> map, Map<K, V> saved) {
		map.clear();
		map.putAll(saved);
	}
}
