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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.core.Logic.Type;

/**
 * <p>
 * Maintains the symbols and axioms which give meaning to erased types. Values
 * whose types are not natively supported by the prover live in the universal
 * sort <code>U</code>, whilst types themselves are represented as terms of sort
 * <code>T</code>. The function <code>type : U -> T</code> relates every value
 * with its type. For example, after erasure a constant <code>h</code> of type
 * <code>Heap</code> becomes a constant of sort <code>U</code> constrained as
 * follows:
 * </p>
 *
 * <pre>
 * (assert (= (type h) Heap))
 * </pre>
 *
 * <p>
 * Every symbol created here is memoised for the lifetime of the builder, which
 * matches the lifetime of a prover session. This ensures that the same source
 * symbol is always translated into the same erased symbol, and therefore
 * receives the same identifier from the namer across checks. Axioms are
 * accumulated as they are required, and handed out once through
 * {@link #getNewAxioms()}.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public abstract class TypeAxiomBuilder {
	/**
	 * The universal sort of erased values. This is never equal to a user sort,
	 * even one called <code>U</code>.
	 */
	public static final Type.Constructor U = new Sort("U");
	/**
	 * The sort of type terms.
	 */
	public static final Type.Constructor T = new Sort("T");

	private final Logic.Function typeFunction = new Logic.Function("type", Collections.emptyList(),
			List.of(U), T);
	private final Logic.Function ctorFunction = new Logic.Function("Ctor", Collections.emptyList(),
			List.of(T), Type.Int);
	private final Map<Type, Logic.Function> builtinTypes = new HashMap<>();
	private final Map<String, TypeConstructor> typeConstructors = new HashMap<>();
	private final Map<Type.Variable, Logic.Function> freeTypeVariables = new HashMap<>();
	private final Map<Type, Cast> casts = new HashMap<>();
	private final Map<Logic.Variable, Logic.Variable> untypedVariables = new HashMap<>();
	private final Map<Logic.Function, Logic.Function> untypedFunctions = new HashMap<>();
	private TypeConstructor mapType;
	private Logic.Function mapSelect;
	private Logic.Function mapStore;
	private final List<Expr> newAxioms = new ArrayList<>();
	private int ctorCount = 0;
	private boolean setup;

	/**
	 * Register the casts which are needed by almost every verification
	 * condition, so that their axioms are emitted together with the first check.
	 * This has no effect when called more than once.
	 */
	public void setup() {
		if (!setup) {
			setup = true;
			cast(Type.Int);
			cast(Type.Bool);
		}
	}

	/**
	 * Return the conjunction of all axioms registered since the last call, and
	 * forget them. If nothing was registered, then this is <code>true</code>.
	 *
	 * @return
	 */
	public Expr getNewAxioms() {
		Expr r = AND(new ArrayList<>(newAxioms));
		newAxioms.clear();
		return r;
	}

	/**
	 * Determine the type parameters of a polymorphic function which must be
	 * passed as explicit arguments of sort <code>T</code>, in declaration order.
	 *
	 * @param f
	 * @return
	 */
	public abstract List<Type.Variable> explicitTypeParameters(Logic.Function f);

	// =======================================================
	// Sorts
	// =======================================================

	/**
	 * Determine the sort used to represent values of a given type after erasure.
	 * Primitives, bit-vectors and maps built only from them are represented
	 * natively. Everything else lives in <code>U</code>, including maps whose key
	 * or value is not native. Hence, the erased sort of a type is either the type
	 * itself or <code>U</code>.
	 *
	 * @param type
	 * @return
	 */
	public Type erasedSort(Type type) {
		if (type == T || isNative(type)) {
			return type;
		} else {
			return U;
		}
	}

	private static boolean isNative(Type type) {
		if (type instanceof Type.Primitive || type instanceof Type.BitVector) {
			return true;
		} else if (type instanceof Type.Map) {
			Type.Map m = (Type.Map) type;
			return isNative(m.getKey()) && isNative(m.getValue());
		} else {
			return false;
		}
	}

	// =======================================================
	// Type terms
	// =======================================================

	/**
	 * Construct the term of sort <code>T</code> which represents a given type.
	 * Type variables are looked up in the given bindings first, and otherwise
	 * treated as free type constants.
	 *
	 * @param type
	 * @param bindings
	 * @return
	 */
	public Expr typeTerm(Type type, Map<Type.Variable, Expr> bindings) {
		if (type instanceof Type.Primitive || type instanceof Type.BitVector) {
			return INVOKE(builtinType(type));
		} else if (type instanceof Type.Variable) {
			Expr e = bindings.get(type);
			return e != null ? e : INVOKE(freeTypeVariable((Type.Variable) type));
		} else if (type instanceof Type.Constructor) {
			Type.Constructor c = (Type.Constructor) type;
			List<Expr> args = new ArrayList<>();
			for (Type arg : c.getArguments()) {
				args.add(typeTerm(arg, bindings));
			}
			return INVOKE(typeConstructor(c.getName(), args.size()).function, Collections.emptyList(), args);
		} else if (type instanceof Type.Map) {
			Type.Map m = (Type.Map) type;
			Expr k = typeTerm(m.getKey(), bindings);
			Expr v = typeTerm(m.getValue(), bindings);
			return INVOKE(mapTypeConstructor().function, Collections.emptyList(), List.of(k, v));
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + type + ")");
		}
	}

	/**
	 * Construct the term <code>(type e)</code> for an expression of sort
	 * <code>U</code>.
	 *
	 * @param e
	 * @return
	 */
	public Expr typeApp(Expr e) {
		return INVOKE(typeFunction, e);
	}

	/**
	 * Attempt to recover a type variable from the type term of a value whose
	 * (unerased) type is given. This uses the inverse functions of type
	 * constructors. For example, given <code>x : Set&lt;α&gt;</code>, the type
	 * variable <code>α</code> is recovered as <code>(Set_inv0 (type x))</code>.
	 * Maps are treated as applications of the constructor <code>MapType</code>.
	 *
	 * @param variable The type variable to recover.
	 * @param type     The type of the value.
	 * @param term     The type term of the value.
	 * @return The term for the type variable, or <code>null</code> if it cannot be
	 *         recovered.
	 */
	public Expr extract(Type.Variable variable, Type type, Expr term) {
		if (type == variable) {
			return term;
		} else if (type instanceof Type.Constructor) {
			Type.Constructor c = (Type.Constructor) type;
			List<Type> args = c.getArguments();
			for (int i = 0; i != args.size(); ++i) {
				if (typeVariablesOf(args.get(i)).contains(variable)) {
					TypeConstructor tc = typeConstructor(c.getName(), args.size());
					Expr r = extract(variable, args.get(i), INVOKE(tc.inverses.get(i), term));
					if (r != null) {
						return r;
					}
				}
			}
		} else if (type instanceof Type.Map) {
			Type.Map m = (Type.Map) type;
			List<Logic.Function> inverses = mapTypeConstructor().inverses;
			Expr r = null;
			if (typeVariablesOf(m.getKey()).contains(variable)) {
				r = extract(variable, m.getKey(), INVOKE(inverses.get(0), term));
			}
			if (r == null && typeVariablesOf(m.getValue()).contains(variable)) {
				r = extract(variable, m.getValue(), INVOKE(inverses.get(1), term));
			}
			return r;
		}
		return null;
	}

	private Logic.Function builtinType(Type type) {
		Logic.Function f = builtinTypes.get(type);
		if (f == null) {
			String name = mangle(type) + "Type";
			f = new Logic.Function(name, Collections.emptyList(), Collections.emptyList(), T);
			builtinTypes.put(type, f);
			addAxiom(EQ(INVOKE(ctorFunction, INVOKE(f)), CONST(ctorCount++)));
		}
		return f;
	}

	private Logic.Function freeTypeVariable(Type.Variable v) {
		Logic.Function f = freeTypeVariables.get(v);
		if (f == null) {
			f = new Logic.Function(v.getName(), Collections.emptyList(), Collections.emptyList(), T);
			freeTypeVariables.put(v, f);
		}
		return f;
	}

	private TypeConstructor mapTypeConstructor() {
		if (mapType == null) {
			mapType = createTypeConstructor("MapType", 2);
		}
		return mapType;
	}

	private TypeConstructor typeConstructor(String name, int arity) {
		TypeConstructor tc = typeConstructors.get(name);
		if (tc == null) {
			tc = createTypeConstructor(name, arity);
			typeConstructors.put(name, tc);
		} else if (tc.inverses.size() != arity) {
			throw new IllegalArgumentException("type constructor " + name + " used with different arities");
		}
		return tc;
	}

	/**
	 * Create a type constructor along with its axioms. Each constructor gets a
	 * distinct code via <code>Ctor</code>, which makes the constructors pairwise
	 * distinct, and each argument position gets an inverse function.
	 *
	 * @param name
	 * @param arity
	 * @return
	 */
	private TypeConstructor createTypeConstructor(String name, int arity) {
		List<Type> params = new ArrayList<>();
		List<Logic.Variable> vars = new ArrayList<>();
		List<Expr> args = new ArrayList<>();
		for (int i = 0; i != arity; ++i) {
			Logic.Variable v = new Logic.Variable("t" + i, T);
			params.add(T);
			vars.add(v);
			args.add(VAR(v));
		}
		Logic.Function f = new Logic.Function(name, Collections.emptyList(), params, T);
		Expr app = INVOKE(f, Collections.emptyList(), args);
		Expr code = EQ(INVOKE(ctorFunction, app), CONST(ctorCount++));
		List<Logic.Function> inverses = new ArrayList<>();
		if (arity == 0) {
			addAxiom(code);
		} else {
			List<List<Expr>> triggers = List.of(List.of(app));
			addAxiom(FORALL(Collections.emptyList(), vars, triggers, code));
			for (int i = 0; i != arity; ++i) {
				Logic.Function inv = new Logic.Function(name + "_inv" + i, Collections.emptyList(), List.of(T), T);
				inverses.add(inv);
				addAxiom(FORALL(Collections.emptyList(), vars, triggers, EQ(INVOKE(inv, app), args.get(i))));
			}
		}
		return new TypeConstructor(f, inverses);
	}

	// =======================================================
	// Casts
	// =======================================================

	/**
	 * Coerce an expression of one sort into another. Only coercions between a
	 * native sort and <code>U</code> are possible.
	 *
	 * @param e
	 * @param from
	 * @param to
	 * @return
	 */
	public Expr cast(Expr e, Type from, Type to) {
		if (from.equals(to)) {
			return e;
		} else if (to == U && from != T) {
			Cast c = cast(from);
			// Undo an immediately preceding unboxing
			if (e instanceof Expr.Invoke && ((Expr.Invoke) e).getFunction() == c.fromU) {
				return ((Expr.Invoke) e).getArguments().get(0);
			}
			return INVOKE(c.toU, e);
		} else if (from == U && to != T) {
			Cast c = cast(to);
			if (e instanceof Expr.Invoke && ((Expr.Invoke) e).getFunction() == c.toU) {
				return ((Expr.Invoke) e).getArguments().get(0);
			}
			return INVOKE(c.fromU, e);
		} else {
			throw new IllegalStateException("cannot coerce " + from + " into " + to);
		}
	}

	private Cast cast(Type sort) {
		Cast c = casts.get(sort);
		if (c == null) {
			String m = mangle(sort);
			Logic.Function toU = new Logic.Function(m + "_2_U", Collections.emptyList(), List.of(sort), U);
			Logic.Function fromU = new Logic.Function("U_2_" + m, Collections.emptyList(), List.of(U), sort);
			c = new Cast(toU, fromU);
			casts.put(sort, c);
			//
			Logic.Variable x = new Logic.Variable("x", sort);
			Expr boxed = INVOKE(toU, VAR(x));
			List<List<Expr>> triggers = List.of(List.of(boxed));
			addAxiom(FORALL(Collections.emptyList(), List.of(x), triggers, EQ(INVOKE(fromU, boxed), VAR(x))));
			Expr term = typeTerm(sort, Collections.emptyMap());
			addAxiom(FORALL(Collections.emptyList(), List.of(x), triggers, EQ(typeApp(boxed), term)));
			Logic.Variable u = new Logic.Variable("u", U);
			Expr unboxed = INVOKE(fromU, VAR(u));
			addAxiom(FORALL(Collections.emptyList(), List.of(u), List.of(List.of(unboxed)),
					IMPLIES(EQ(typeApp(VAR(u)), term), EQ(INVOKE(toU, unboxed), VAR(u)))));
			if (sort instanceof Type.Map) {
				bridgeMap((Type.Map) sort, c);
			}
		}
		return c;
	}

	/**
	 * Relate the native operations on a map sort with their counterparts on boxed
	 * maps, so that a native map passed where an erased map is expected keeps its
	 * contents.
	 *
	 * @param sort
	 * @param c
	 */
	private void bridgeMap(Type.Map sort, Cast c) {
		Logic.Variable m = new Logic.Variable("m", sort);
		Logic.Variable k = new Logic.Variable("k", sort.getKey());
		Logic.Variable v = new Logic.Variable("v", sort.getValue());
		Expr key = cast(VAR(k), sort.getKey(), U);
		Expr boxedMap = INVOKE(c.toU, VAR(m));
		Expr select = mapSelect(boxedMap, key);
		addAxiom(FORALL(Collections.emptyList(), List.of(m, k), List.of(List.of(select)),
				EQ(select, cast(SELECT(VAR(m), VAR(k)), sort.getValue(), U))));
		Expr boxedStore = INVOKE(c.toU, STORE(VAR(m), VAR(k), VAR(v)));
		addAxiom(FORALL(Collections.emptyList(), List.of(m, k, v), List.of(List.of(boxedStore)),
				EQ(boxedStore, mapStore(boxedMap, key, cast(VAR(v), sort.getValue(), U)))));
	}

	// =======================================================
	// Erased maps
	// =======================================================

	/**
	 * Read from a map of sort <code>U</code> at a key of sort <code>U</code>,
	 * giving a value of sort <code>U</code>.
	 *
	 * @param map
	 * @param key
	 * @return
	 */
	public Expr mapSelect(Expr map, Expr key) {
		createMapFunctions();
		return INVOKE(mapSelect, map, key);
	}

	/**
	 * Update a map of sort <code>U</code>, where both key and value have sort
	 * <code>U</code>.
	 *
	 * @param map
	 * @param key
	 * @param value
	 * @return
	 */
	public Expr mapStore(Expr map, Expr key, Expr value) {
		createMapFunctions();
		return INVOKE(mapStore, map, key, value);
	}

	private void createMapFunctions() {
		if (mapSelect == null) {
			mapSelect = new Logic.Function("MapSelect", Collections.emptyList(), List.of(U, U), U);
			mapStore = new Logic.Function("MapStore", Collections.emptyList(), List.of(U, U, U), U);
			Logic.Variable m = new Logic.Variable("m", U);
			Logic.Variable i = new Logic.Variable("i", U);
			Logic.Variable j = new Logic.Variable("j", U);
			Logic.Variable v = new Logic.Variable("v", U);
			Expr store = INVOKE(mapStore, VAR(m), VAR(i), VAR(v));
			// read over write, same key
			addAxiom(FORALL(Collections.emptyList(), List.of(m, i, v), List.of(List.of(store)),
					EQ(INVOKE(mapSelect, store, VAR(i)), VAR(v))));
			// read over write, different keys
			Expr select = INVOKE(mapSelect, store, VAR(j));
			addAxiom(FORALL(Collections.emptyList(), List.of(m, i, j, v), List.of(List.of(select)),
					OR(EQ(VAR(i), VAR(j)), EQ(select, INVOKE(mapSelect, VAR(m), VAR(j))))));
		}
	}

	// =======================================================
	// Symbols
	// =======================================================

	/**
	 * Get the erased counterpart of a free variable. A variable whose sort is
	 * unaffected by erasure is its own counterpart. A variable erased to
	 * <code>U</code> is constrained by an axiom stating its type.
	 *
	 * @param v
	 * @return
	 */
	public Logic.Variable untypedVariable(Logic.Variable v) {
		Logic.Variable r = untypedVariables.get(v);
		if (r == null) {
			Type sort = erasedSort(v.getType());
			r = sort.equals(v.getType()) ? v : new Logic.Variable(v.getName(), sort, v.getAttributes());
			untypedVariables.put(v, r);
			if (sort == U) {
				addAxiom(EQ(typeApp(VAR(r)), typeTerm(v.getType(), Collections.emptyMap())));
			}
		}
		return r;
	}

	/**
	 * Get the erased counterpart of a function. Explicit type parameters become
	 * leading parameters of sort <code>T</code>, and all other parameters and the
	 * return get their erased sorts. A function returning <code>U</code> is
	 * accompanied by an axiom stating the type of its result.
	 *
	 * @param f
	 * @return
	 */
	public Logic.Function untypedFunction(Logic.Function f) {
		Logic.Function r = untypedFunctions.get(f);
		if (r == null) {
			List<Type.Variable> explicit = explicitTypeParameters(f);
			List<Type> params = new ArrayList<>();
			for (int i = 0; i != explicit.size(); ++i) {
				params.add(T);
			}
			for (Type p : f.getParameterTypes()) {
				params.add(erasedSort(p));
			}
			Type ret = erasedSort(f.getReturnType());
			if (!f.isPolymorphic() && params.equals(f.getParameterTypes()) && ret.equals(f.getReturnType())) {
				r = f;
			} else {
				r = new Logic.Function(f.getName(), Collections.emptyList(), params, ret, f.getAttributes());
			}
			untypedFunctions.put(f, r);
			if (ret == U) {
				addAxiom(typingAxiom(f, r, explicit));
			}
		}
		return r;
	}

	/**
	 * Construct the axiom stating the type of a function's result in terms of its
	 * arguments. Explicit type parameters are quantified as variables of sort
	 * <code>T</code>. Implicit ones are recovered from the types of arguments.
	 *
	 * @param f
	 * @param uf
	 * @param explicit
	 * @return
	 */
	private Expr typingAxiom(Logic.Function f, Logic.Function uf, List<Type.Variable> explicit) {
		Map<Type.Variable, Expr> bindings = new LinkedHashMap<>();
		List<Logic.Variable> bound = new ArrayList<>();
		List<Expr> args = new ArrayList<>();
		for (Type.Variable tv : explicit) {
			Logic.Variable t = new Logic.Variable(tv.getName(), T);
			bound.add(t);
			args.add(VAR(t));
			bindings.put(tv, VAR(t));
		}
		List<Type> params = f.getParameterTypes();
		for (int i = 0; i != params.size(); ++i) {
			Logic.Variable x = new Logic.Variable("x" + i, erasedSort(params.get(i)));
			bound.add(x);
			args.add(VAR(x));
		}
		for (Type.Variable tv : f.getTypeParameters()) {
			if (!bindings.containsKey(tv)) {
				bindings.put(tv, inferTypeParameter(tv, params, args.subList(explicit.size(), args.size())));
			}
		}
		Expr app = INVOKE(uf, Collections.emptyList(), args);
		Expr body = EQ(typeApp(app), typeTerm(f.getReturnType(), bindings));
		if (bound.isEmpty()) {
			return body;
		}
		return FORALL(Collections.emptyList(), bound, List.of(List.of(app)), body);
	}

	/**
	 * Recover the term for a type parameter from the first argument whose type
	 * determines it.
	 *
	 * @param tv
	 * @param types
	 * @param args
	 * @return
	 */
	protected Expr inferTypeParameter(Type.Variable tv, List<Type> types, List<Expr> args) {
		for (int i = 0; i != types.size(); ++i) {
			if (erasedSort(types.get(i)) == U) {
				Expr r = extract(tv, types.get(i), typeApp(args.get(i)));
				if (r != null) {
					return r;
				}
			}
		}
		throw new IllegalStateException("type parameter " + tv + " cannot be inferred");
	}

	/**
	 * Check whether a type parameter of a function can be recovered from the
	 * types of its arguments.
	 *
	 * @param tv
	 * @param f
	 * @return
	 */
	protected boolean isInferable(Type.Variable tv, Logic.Function f) {
		for (Type p : f.getParameterTypes()) {
			if (erasedSort(p) == U && isExtractable(tv, p)) {
				return true;
			}
		}
		return false;
	}

	private static boolean isExtractable(Type.Variable tv, Type type) {
		if (type == tv) {
			return true;
		} else if (type instanceof Type.Constructor) {
			for (Type arg : ((Type.Constructor) type).getArguments()) {
				if (isExtractable(tv, arg)) {
					return true;
				}
			}
		} else if (type instanceof Type.Map) {
			Type.Map m = (Type.Map) type;
			return isExtractable(tv, m.getKey()) || isExtractable(tv, m.getValue());
		}
		return false;
	}

	protected void addAxiom(Expr axiom) {
		newAxioms.add(axiom);
	}

	// =======================================================
	// Helpers
	// =======================================================

	/**
	 * Generate a symbol-safe name fragment for a native sort.
	 *
	 * @param sort
	 * @return
	 */
	static String mangle(Type sort) {
		if (sort instanceof Type.Primitive) {
			return ((Type.Primitive) sort).getName().toLowerCase(Locale.ROOT);
		} else if (sort instanceof Type.BitVector) {
			return "bv" + ((Type.BitVector) sort).getWidth();
		} else if (sort instanceof Type.Map) {
			Type.Map m = (Type.Map) sort;
			return "Map_" + mangle(m.getKey()) + "_" + mangle(m.getValue());
		} else if (sort instanceof Type.Constructor) {
			return ((Type.Constructor) sort).getName();
		} else {
			throw new IllegalArgumentException("cannot mangle sort " + sort);
		}
	}

	/**
	 * A sort introduced by erasure. It is only ever equal to itself.
	 */
	private static final class Sort extends Type.Constructor {
		private Sort(String name) {
			super(name);
		}
	}

	private static class TypeConstructor {
		private final Logic.Function function;
		private final List<Logic.Function> inverses;

		public TypeConstructor(Logic.Function function, List<Logic.Function> inverses) {
			this.function = function;
			this.inverses = inverses;
		}
	}

	private static class Cast {
		private final Logic.Function toU;
		private final Logic.Function fromU;

		public Cast(Logic.Function toU, Logic.Function fromU) {
			this.toU = toU;
			this.fromU = fromU;
		}
	}
}
