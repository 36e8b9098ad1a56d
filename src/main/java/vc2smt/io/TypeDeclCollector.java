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
package vc2smt.io;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.core.Logic.Type;
import vc2smt.util.AbstractExpressionVisitor;
import vc2smt.util.FreeVariableCollector;

/**
 * <p>
 * Collects the declarations needed by the expressions of a prover session. For
 * each expression given to {@link #collect(Expr)}, every uninterpreted sort,
 * function and free variable which has not been seen before in this session
 * gets a declaration, such as:
 * </p>
 *
 * <pre>
 * (declare-sort Heap 0)
 * (declare-fun read (Heap Int) Int)
 * (declare-fun h () Heap)
 * </pre>
 *
 * <p>
 * A sort is always declared before the first symbol whose signature uses it.
 * Expressions must be monomorphic by the time they get here, hence a type
 * variable or polymorphic function is rejected.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class TypeDeclCollector {
	private final SMTLibNamer namer;
	private final Set<String> knownSorts = new HashSet<>();
	private final Set<Logic.Function> knownFunctions = new HashSet<>();
	private final Set<Logic.Variable> knownVariables = new HashSet<>();
	private final List<String> newDeclarations = new ArrayList<>();

	public TypeDeclCollector(SMTLibNamer namer) {
		this.namer = namer;
	}

	/**
	 * Record declarations for all symbols of the given expression which have not
	 * been seen before.
	 *
	 * @param expr
	 */
	public void collect(Expr expr) {
		for (Logic.Variable v : new FreeVariableCollector().collect(expr)) {
			declareVariable(v);
		}
		new Declarer().visitExpression(expr);
	}

	/**
	 * Return the declarations recorded since the last call, in the order they
	 * must be emitted, and forget them.
	 *
	 * @return
	 */
	public List<String> getNewDeclarations() {
		List<String> r = new ArrayList<>(newDeclarations);
		newDeclarations.clear();
		return r;
	}

	private void declareVariable(Logic.Variable v) {
		if (knownVariables.add(v)) {
			declareSort(v.getType());
			newDeclarations.add("(declare-fun " + namer.getName(v) + " () "
					+ SMTLibExprLinearizer.toString(v.getType(), namer) + ")");
		}
	}

	private void declareFunction(Logic.Function f) {
		if (f.isPolymorphic()) {
			throw new IllegalArgumentException("polymorphic function " + f.getName() + " cannot be declared");
		} else if (knownFunctions.add(f)) {
			StringBuilder sb = new StringBuilder();
			sb.append("(declare-fun ").append(namer.getName(f)).append(" (");
			List<Type> params = f.getParameterTypes();
			for (int i = 0; i != params.size(); ++i) {
				declareSort(params.get(i));
				if (i != 0) {
					sb.append(" ");
				}
				sb.append(SMTLibExprLinearizer.toString(params.get(i), namer));
			}
			declareSort(f.getReturnType());
			sb.append(") ").append(SMTLibExprLinearizer.toString(f.getReturnType(), namer)).append(")");
			newDeclarations.add(sb.toString());
		}
	}

	private void declareSort(Type type) {
		if (type instanceof Type.Primitive || type instanceof Type.BitVector) {
			// built in
		} else if (type instanceof Type.Map) {
			Type.Map m = (Type.Map) type;
			declareSort(m.getKey());
			declareSort(m.getValue());
		} else if (type instanceof Type.Constructor) {
			Type.Constructor c = (Type.Constructor) type;
			for (Type arg : c.getArguments()) {
				declareSort(arg);
			}
			String name = namer.getName(c);
			if (knownSorts.add(name)) {
				newDeclarations.add("(declare-sort " + name + " " + c.getArguments().size() + ")");
			}
		} else if (type instanceof Type.Variable) {
			throw new IllegalArgumentException("type variable " + type + " cannot be declared");
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + type + ")");
		}
	}

	/**
	 * Walks an expression declaring the functions it invokes, along with the
	 * sorts of every variable it binds.
	 */
	private class Declarer extends AbstractExpressionVisitor<Void> {

		@Override
		protected Void constructBoolean(Expr.Boolean expr) {
			return null;
		}

		@Override
		protected Void constructInteger(Expr.Integer expr) {
			return null;
		}

		@Override
		protected Void constructDecimal(Expr.Decimal expr) {
			return null;
		}

		@Override
		protected Void constructBitVector(Expr.BitVector expr) {
			return null;
		}

		@Override
		protected Void constructStringLiteral(Expr.StringLiteral expr) {
			return null;
		}

		@Override
		protected Void constructVariableAccess(Expr.VariableAccess expr) {
			declareSort(expr.getVariable().getType());
			return null;
		}

		@Override
		protected Void constructOperator(Expr.Operator expr, List<Void> operands) {
			return null;
		}

		@Override
		protected Void constructInvoke(Expr.Invoke expr, List<Void> arguments) {
			declareFunction(expr.getFunction());
			return null;
		}

		@Override
		protected Void constructQuantifier(Expr.Quantifier expr, List<List<Void>> triggers, Void body) {
			if (!expr.getTypeParameters().isEmpty()) {
				throw new IllegalArgumentException("polymorphic quantifier cannot be declared");
			}
			for (Logic.Variable v : expr.getParameters()) {
				declareSort(v.getType());
			}
			return null;
		}

		@Override
		protected Void constructLet(Expr.Let expr, List<Void> values, Void body) {
			for (Expr.Binding b : expr.getBindings()) {
				declareSort(b.getVariable().getType());
			}
			return null;
		}

		@Override
		protected Void constructLabel(Expr.Label expr, Void body) {
			return null;
		}
	}
}
