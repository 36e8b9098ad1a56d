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
package vc2smt.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * The typed logical language in which verification conditions arrive from the
 * verification-condition generator. Expressions form an immutable tree. Shared
 * subexpressions are represented explicitly through <code>let</code> bindings,
 * rather than through aliasing of subtrees, so that they survive the lowering
 * into SMT-LIB text.
 *
 * @author David J. Pearce
 *
 */
public class Logic {

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}
	}

	// =========================================================================
	// Symbols
	// =========================================================================

	/**
	 * A term variable. This is used for free constants of a verification
	 * condition, for variables bound by quantifiers and for variables bound by
	 * <code>let</code> expressions. Variables are compared by identity: two
	 * distinct variables may share the same name, in which case the namer is
	 * responsible for telling them apart.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Variable extends AbstractItem {
		private final String name;
		private final Type type;

		public Variable(String name, Type type, Attribute... attributes) {
			super(attributes);
			this.name = Objects.requireNonNull(name);
			this.type = Objects.requireNonNull(type);
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		@Override
		public String toString() {
			return name + ":" + type;
		}
	}

	/**
	 * An uninterpreted function symbol, which may be polymorphic in a number of
	 * type parameters. Functions are compared by identity.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Function extends AbstractItem {
		private final String name;
		private final List<Type.Variable> typeParameters;
		private final List<Type> parameterTypes;
		private final Type returnType;

		public Function(String name, List<Type.Variable> typeParameters, List<Type> parameterTypes, Type returnType,
				Attribute... attributes) {
			super(attributes);
			this.name = Objects.requireNonNull(name);
			this.typeParameters = ImmutableList.copyOf(typeParameters);
			this.parameterTypes = ImmutableList.copyOf(parameterTypes);
			this.returnType = Objects.requireNonNull(returnType);
		}

		public String getName() {
			return name;
		}

		public List<Type.Variable> getTypeParameters() {
			return typeParameters;
		}

		public List<Type> getParameterTypes() {
			return parameterTypes;
		}

		public Type getReturnType() {
			return returnType;
		}

		public boolean isPolymorphic() {
			return !typeParameters.isEmpty();
		}

		@Override
		public String toString() {
			return name + (typeParameters.isEmpty() ? "" : typeParameters.toString()) + parameterTypes + ":" + returnType;
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type {
		public static final Primitive Bool = new Primitive("Bool");
		public static final Primitive Int = new Primitive("Int");
		public static final Primitive Real = new Primitive("Real");
		public static final Primitive String = new Primitive("String");

		/**
		 * One of the built-in sorts of SMT-LIB. There is exactly one instance of
		 * each, hence primitives are compared by identity.
		 */
		public static class Primitive implements Type {
			private final java.lang.String name;

			private Primitive(java.lang.String name) {
				this.name = name;
			}

			public java.lang.String getName() {
				return name;
			}

			@Override
			public java.lang.String toString() {
				return name;
			}
		}

		public static class BitVector implements Type {
			private final int width;

			public BitVector(int width) {
				if (width <= 0) {
					throw new IllegalArgumentException("invalid bitvector width: " + width);
				}
				this.width = width;
			}

			public int getWidth() {
				return width;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof BitVector && ((BitVector) o).width == width;
			}

			@Override
			public int hashCode() {
				return width;
			}

			@Override
			public java.lang.String toString() {
				return "bv" + width;
			}
		}

		/**
		 * A type variable, as found in the type parameters of polymorphic functions
		 * and quantifiers. Type variables are compared by identity.
		 */
		public static class Variable implements Type {
			private final java.lang.String name;

			public Variable(java.lang.String name) {
				this.name = Objects.requireNonNull(name);
			}

			public java.lang.String getName() {
				return name;
			}

			@Override
			public java.lang.String toString() {
				return name;
			}
		}

		/**
		 * An uninterpreted type constructor applied to zero or more arguments, such
		 * as <code>Heap</code> or <code>Set int</code>.
		 */
		public static class Constructor implements Type {
			private final java.lang.String name;
			private final List<Type> arguments;

			public Constructor(java.lang.String name, Type... arguments) {
				this(name, Arrays.asList(arguments));
			}

			public Constructor(java.lang.String name, List<Type> arguments) {
				this.name = Objects.requireNonNull(name);
				this.arguments = ImmutableList.copyOf(arguments);
			}

			public java.lang.String getName() {
				return name;
			}

			public List<Type> getArguments() {
				return arguments;
			}

			@Override
			public boolean equals(Object o) {
				// Subclasses denote sorts of their own, distinct from any user sort
				if (o != null && o.getClass() == getClass()) {
					Constructor c = (Constructor) o;
					return name.equals(c.name) && arguments.equals(c.arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ arguments.hashCode();
			}

			@Override
			public java.lang.String toString() {
				return arguments.isEmpty() ? name : name + arguments;
			}
		}

		public static class Map implements Type {
			private final Type key;
			private final Type value;

			public Map(Type key, Type value) {
				this.key = Objects.requireNonNull(key);
				this.value = Objects.requireNonNull(value);
			}

			public Type getKey() {
				return key;
			}

			public Type getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Map) {
					Map m = (Map) o;
					return key.equals(m.key) && value.equals(m.value);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return key.hashCode() * 31 + value.hashCode();
			}

			@Override
			public java.lang.String toString() {
				return "[" + key + "]" + value;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public static class Boolean extends AbstractItem implements Expr {
			private final boolean value;

			private Boolean(boolean value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public boolean getValue() {
				return value;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger value, Attribute[] attributes) {
				super(attributes);
				this.value = Objects.requireNonNull(value);
			}

			public BigInteger getValue() {
				return value;
			}
		}

		public static class Decimal extends AbstractItem implements Expr {
			private final BigDecimal value;

			private Decimal(BigDecimal value, Attribute[] attributes) {
				super(attributes);
				this.value = Objects.requireNonNull(value);
			}

			public BigDecimal getValue() {
				return value;
			}
		}

		public static class BitVector extends AbstractItem implements Expr {
			private final BigInteger value;
			private final int width;

			private BitVector(BigInteger value, int width, Attribute[] attributes) {
				super(attributes);
				if (value.signum() < 0 || value.bitLength() > width) {
					throw new IllegalArgumentException("bitvector value " + value + " does not fit in " + width + " bits");
				}
				this.value = value;
				this.width = width;
			}

			public BigInteger getValue() {
				return value;
			}

			public int getWidth() {
				return width;
			}
		}

		public static class StringLiteral extends AbstractItem implements Expr {
			private final String value;

			private StringLiteral(String value, Attribute[] attributes) {
				super(attributes);
				this.value = Objects.requireNonNull(value);
			}

			public String getValue() {
				return value;
			}
		}

		public static class VariableAccess extends AbstractItem implements Expr {
			private final Logic.Variable variable;

			private VariableAccess(Logic.Variable variable, Attribute[] attributes) {
				super(attributes);
				this.variable = Objects.requireNonNull(variable);
			}

			public Logic.Variable getVariable() {
				return variable;
			}
		}

		/**
		 * An application of one of the interpreted operators of SMT-LIB's core,
		 * arithmetic and array theories.
		 */
		public static class Operator extends AbstractItem implements Expr {
			public enum Kind {
				NOT(1, 1, true), AND(0, -1, true), OR(0, -1, true), IMPLIES(2, 2, true), IFF(2, 2, true),
				ITE(3, 3, false), EQ(2, 2, true), DISTINCT(2, -1, true), LT(2, 2, true), LTEQ(2, 2, true),
				GT(2, 2, true), GTEQ(2, 2, true), ADD(2, -1, false), SUB(2, -1, false), MUL(2, -1, false),
				DIV(2, 2, false), MOD(2, 2, false), RDIV(2, 2, false), NEG(1, 1, false), SELECT(2, 2, false),
				STORE(3, 3, false);

				private final int minArity;
				private final int maxArity;
				private final boolean logical;

				private Kind(int minArity, int maxArity, boolean logical) {
					this.minArity = minArity;
					this.maxArity = maxArity;
					this.logical = logical;
				}

				/**
				 * Check whether this operator always produces a boolean.
				 *
				 * @return
				 */
				public boolean isLogical() {
					return logical;
				}

				public boolean accepts(int arity) {
					return arity >= minArity && (maxArity < 0 || arity <= maxArity);
				}
			}

			private final Kind kind;
			private final List<Expr> operands;

			private Operator(Kind kind, List<Expr> operands, Attribute[] attributes) {
				super(attributes);
				if (!kind.accepts(operands.size())) {
					throw new IllegalArgumentException("invalid number of operands for " + kind + ": " + operands.size());
				}
				this.kind = kind;
				this.operands = ImmutableList.copyOf(operands);
			}

			public Kind getKind() {
				return kind;
			}

			public List<Expr> getOperands() {
				return operands;
			}

			public Expr getOperand(int i) {
				return operands.get(i);
			}
		}

		/**
		 * Application of an uninterpreted function. For a polymorphic function, the
		 * type arguments give the instantiation of its type parameters.
		 */
		public static class Invoke extends AbstractItem implements Expr {
			private final Logic.Function function;
			private final List<Type> typeArguments;
			private final List<Expr> arguments;

			private Invoke(Logic.Function function, List<Type> typeArguments, List<Expr> arguments,
					Attribute[] attributes) {
				super(attributes);
				if (function.getTypeParameters().size() != typeArguments.size()) {
					throw new IllegalArgumentException("invalid number of type arguments for " + function.getName());
				} else if (function.getParameterTypes().size() != arguments.size()) {
					throw new IllegalArgumentException("invalid number of arguments for " + function.getName());
				}
				this.function = function;
				this.typeArguments = ImmutableList.copyOf(typeArguments);
				this.arguments = ImmutableList.copyOf(arguments);
			}

			public Logic.Function getFunction() {
				return function;
			}

			public List<Type> getTypeArguments() {
				return typeArguments;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		public abstract static class Quantifier extends AbstractItem implements Expr {
			private final List<Type.Variable> typeParameters;
			private final List<Logic.Variable> parameters;
			private final List<List<Expr>> triggers;
			private final int weight;
			private final String qid;
			private final int skolemId;
			private final Expr body;

			private Quantifier(List<Type.Variable> typeParameters, List<Logic.Variable> parameters,
					List<List<Expr>> triggers, int weight, String qid, int skolemId, Expr body, Attribute[] attributes) {
				super(attributes);
				if (parameters.isEmpty() && typeParameters.isEmpty()) {
					throw new IllegalArgumentException("quantifier binds nothing");
				}
				this.typeParameters = ImmutableList.copyOf(typeParameters);
				this.parameters = ImmutableList.copyOf(parameters);
				ImmutableList.Builder<List<Expr>> ts = ImmutableList.builder();
				for (List<Expr> t : triggers) {
					ts.add(ImmutableList.copyOf(t));
				}
				this.triggers = ts.build();
				this.weight = weight;
				this.qid = qid;
				this.skolemId = skolemId;
				this.body = Objects.requireNonNull(body);
			}

			public List<Type.Variable> getTypeParameters() {
				return typeParameters;
			}

			public List<Logic.Variable> getParameters() {
				return parameters;
			}

			/**
			 * Get the instantiation patterns of this quantifier. Each pattern is a
			 * non-empty list of terms which together must mention every bound
			 * variable.
			 *
			 * @return
			 */
			public List<List<Expr>> getTriggers() {
				return triggers;
			}

			public int getWeight() {
				return weight;
			}

			/**
			 * Get the quantifier identifier used by the prover when reporting
			 * instantiations, or <code>null</code> if there is none.
			 *
			 * @return
			 */
			public String getQid() {
				return qid;
			}

			/**
			 * Get the skolem identifier for this quantifier, or <code>-1</code> if none.
			 *
			 * @return
			 */
			public int getSkolemId() {
				return skolemId;
			}

			public Expr getBody() {
				return body;
			}

			public abstract boolean isUniversal();
		}

		public static class UniversalQuantifier extends Quantifier {
			private UniversalQuantifier(List<Type.Variable> typeParameters, List<Logic.Variable> parameters,
					List<List<Expr>> triggers, int weight, String qid, int skolemId, Expr body, Attribute[] attributes) {
				super(typeParameters, parameters, triggers, weight, qid, skolemId, body, attributes);
			}

			@Override
			public boolean isUniversal() {
				return true;
			}
		}

		public static class ExistentialQuantifier extends Quantifier {
			private ExistentialQuantifier(List<Type.Variable> typeParameters, List<Logic.Variable> parameters,
					List<List<Expr>> triggers, int weight, String qid, int skolemId, Expr body, Attribute[] attributes) {
				super(typeParameters, parameters, triggers, weight, qid, skolemId, body, attributes);
			}

			@Override
			public boolean isUniversal() {
				return false;
			}
		}

		/**
		 * A scoped binding of one or more shared subexpressions. The bindings of a
		 * single <code>let</code> are simultaneous: the value of one binding cannot
		 * see another binding of the same <code>let</code>. Upstream producers may
		 * nevertheless create such references, which are then resolved by
		 * <code>LetBindingSorter</code>.
		 */
		public static class Let extends AbstractItem implements Expr {
			private final List<Binding> bindings;
			private final Expr body;

			private Let(List<Binding> bindings, Expr body, Attribute[] attributes) {
				super(attributes);
				if (bindings.isEmpty()) {
					throw new IllegalArgumentException("let requires at least one binding");
				}
				this.bindings = ImmutableList.copyOf(bindings);
				this.body = Objects.requireNonNull(body);
			}

			public List<Binding> getBindings() {
				return bindings;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class Binding extends AbstractItem implements Item {
			private final Logic.Variable variable;
			private final Expr value;

			private Binding(Logic.Variable variable, Expr value, Attribute[] attributes) {
				super(attributes);
				this.variable = Objects.requireNonNull(variable);
				this.value = Objects.requireNonNull(value);
			}

			public Logic.Variable getVariable() {
				return variable;
			}

			public Expr getValue() {
				return value;
			}
		}

		/**
		 * A labelled formula. Labels are reported back by the prover when the
		 * enclosing formula is responsible for a counterexample. A positive label is
		 * reported when its body is true in the model, a negative label when it is
		 * false.
		 */
		public static class Label extends AbstractItem implements Expr {
			private final String name;
			private final boolean positive;
			private final Expr body;

			private Label(String name, boolean positive, Expr body, Attribute[] attributes) {
				super(attributes);
				this.name = Objects.requireNonNull(name);
				this.positive = positive;
				this.body = Objects.requireNonNull(body);
			}

			public String getName() {
				return name;
			}

			public boolean isPositive() {
				return positive;
			}

			public Expr getBody() {
				return body;
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static final Expr.Boolean TRUE = new Expr.Boolean(true, new Attribute[0]);
	public static final Expr.Boolean FALSE = new Expr.Boolean(false, new Attribute[0]);

	// Constants
	public static Expr.Boolean CONST(boolean b, Attribute... attributes) {
		if(attributes.length == 0) {
			return b ? TRUE : FALSE;
		}
		return new Expr.Boolean(b, attributes);
	}

	public static Expr.Integer CONST(long i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.Decimal CONST(BigDecimal d, Attribute... attributes) {
		return new Expr.Decimal(d, attributes);
	}

	public static Expr.BitVector BV(long value, int width, Attribute... attributes) {
		return new Expr.BitVector(BigInteger.valueOf(value), width, attributes);
	}

	public static Expr.BitVector BV(BigInteger value, int width, Attribute... attributes) {
		return new Expr.BitVector(value, width, attributes);
	}

	public static Expr.StringLiteral STRING(String value, Attribute... attributes) {
		return new Expr.StringLiteral(value, attributes);
	}

	public static Expr.VariableAccess VAR(Variable v, Attribute... attributes) {
		return new Expr.VariableAccess(v, attributes);
	}

	// Operators

	/**
	 * Construct an operator application as given, without any simplification.
	 *
	 * @param kind
	 * @param operands
	 * @param attributes
	 * @return
	 */
	public static Expr.Operator OPERATOR(Expr.Operator.Kind kind, List<Expr> operands, Attribute... attributes) {
		return new Expr.Operator(kind, operands, attributes);
	}

	public static Expr AND(List<Expr> operands, Attribute... attributes) {
		ArrayList<Expr> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr ith = operands.get(i);
			if (isFalse(ith)) {
				return CONST(false, attributes);
			} else if (!isTrue(ith)) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return CONST(true, attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.Operator(Expr.Operator.Kind.AND, noperands, attributes);
		}
	}

	public static Expr AND(Expr... operands) {
		return AND(Arrays.asList(operands));
	}

	public static Expr OR(List<Expr> operands, Attribute... attributes) {
		ArrayList<Expr> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr ith = operands.get(i);
			if (isTrue(ith)) {
				return CONST(true, attributes);
			} else if (!isFalse(ith)) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return CONST(false, attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.Operator(Expr.Operator.Kind.OR, noperands, attributes);
		}
	}

	public static Expr OR(Expr... operands) {
		return OR(Arrays.asList(operands));
	}

	public static Expr NOT(Expr operand, Attribute... attributes) {
		if (isTrue(operand)) {
			return CONST(false, attributes);
		} else if (isFalse(operand)) {
			return CONST(true, attributes);
		}
		return new Expr.Operator(Expr.Operator.Kind.NOT, Arrays.asList(operand), attributes);
	}

	public static Expr IMPLIES(Expr lhs, Expr rhs, Attribute... attributes) {
		if (isTrue(lhs)) {
			return rhs;
		} else if (isFalse(lhs) || isTrue(rhs)) {
			return CONST(true, attributes);
		}
		return new Expr.Operator(Expr.Operator.Kind.IMPLIES, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator IFF(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.IFF, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator ITE(Expr condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.ITE, Arrays.asList(condition, trueBranch, falseBranch), attributes);
	}

	public static Expr.Operator EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.EQ, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator DISTINCT(List<Expr> operands, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.DISTINCT, operands, attributes);
	}

	public static Expr.Operator LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.LT, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.LTEQ, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.GT, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.GTEQ, Arrays.asList(lhs, rhs), attributes);
	}

	// Arithmetic
	public static Expr.Operator ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.ADD, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.SUB, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.MUL, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator DIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.DIV, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator MOD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.MOD, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator RDIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.RDIV, Arrays.asList(lhs, rhs), attributes);
	}

	public static Expr.Operator NEG(Expr operand, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.NEG, Arrays.asList(operand), attributes);
	}

	// Maps
	public static Expr.Operator SELECT(Expr map, Expr key, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.SELECT, Arrays.asList(map, key), attributes);
	}

	public static Expr.Operator STORE(Expr map, Expr key, Expr value, Attribute... attributes) {
		return new Expr.Operator(Expr.Operator.Kind.STORE, Arrays.asList(map, key, value), attributes);
	}

	// Functions
	public static Expr.Invoke INVOKE(Function f, Expr... arguments) {
		return new Expr.Invoke(f, Collections.emptyList(), Arrays.asList(arguments), new Attribute[0]);
	}

	public static Expr.Invoke INVOKE(Function f, List<Type> typeArguments, List<Expr> arguments, Attribute... attributes) {
		return new Expr.Invoke(f, typeArguments, arguments, attributes);
	}

	// Quantifiers
	public static Expr.UniversalQuantifier FORALL(Variable parameter, Expr body, Attribute... attributes) {
		return FORALL(Collections.emptyList(), Arrays.asList(parameter), Collections.emptyList(), body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Variable> parameters, Expr body, Attribute... attributes) {
		return FORALL(Collections.emptyList(), parameters, Collections.emptyList(), body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Type.Variable> typeParameters, List<Variable> parameters,
			List<List<Expr>> triggers, Expr body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(typeParameters, parameters, triggers, 1, null, -1, body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Type.Variable> typeParameters, List<Variable> parameters,
			List<List<Expr>> triggers, int weight, String qid, int skolemId, Expr body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(typeParameters, parameters, triggers, weight, qid, skolemId, body,
				attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(Variable parameter, Expr body, Attribute... attributes) {
		return EXISTS(Collections.emptyList(), Arrays.asList(parameter), Collections.emptyList(), body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(List<Variable> parameters, Expr body, Attribute... attributes) {
		return EXISTS(Collections.emptyList(), parameters, Collections.emptyList(), body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(List<Type.Variable> typeParameters, List<Variable> parameters,
			List<List<Expr>> triggers, Expr body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(typeParameters, parameters, triggers, 1, null, -1, body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(List<Type.Variable> typeParameters, List<Variable> parameters,
			List<List<Expr>> triggers, int weight, String qid, int skolemId, Expr body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(typeParameters, parameters, triggers, weight, qid, skolemId, body,
				attributes);
	}

	/**
	 * Construct a quantifier of the same kind and annotations as a given one, but
	 * with different contents.
	 *
	 * @param original
	 * @param typeParameters
	 * @param parameters
	 * @param triggers
	 * @param body
	 * @return
	 */
	public static Expr.Quantifier QUANTIFIER(Expr.Quantifier original, List<Type.Variable> typeParameters,
			List<Variable> parameters, List<List<Expr>> triggers, Expr body) {
		if (original.isUniversal()) {
			return FORALL(typeParameters, parameters, triggers, original.getWeight(), original.getQid(),
					original.getSkolemId(), body, original.getAttributes());
		} else {
			return EXISTS(typeParameters, parameters, triggers, original.getWeight(), original.getQid(),
					original.getSkolemId(), body, original.getAttributes());
		}
	}

	// Bindings
	public static Expr.Binding BIND(Variable variable, Expr value, Attribute... attributes) {
		return new Expr.Binding(variable, value, attributes);
	}

	public static Expr.Let LET(List<Expr.Binding> bindings, Expr body, Attribute... attributes) {
		return new Expr.Let(bindings, body, attributes);
	}

	public static Expr.Let LET(Expr.Binding binding, Expr body, Attribute... attributes) {
		return new Expr.Let(Arrays.asList(binding), body, attributes);
	}

	// Labels
	public static Expr.Label LABEL(String name, boolean positive, Expr body, Attribute... attributes) {
		return new Expr.Label(name, positive, body, attributes);
	}

	// =======================================================
	// Queries
	// =======================================================

	public static boolean isTrue(Expr e) {
		return e instanceof Expr.Boolean && ((Expr.Boolean) e).getValue();
	}

	public static boolean isFalse(Expr e) {
		return e instanceof Expr.Boolean && !((Expr.Boolean) e).getValue();
	}

	/**
	 * Determine the static type of a given expression.
	 *
	 * @param e
	 * @return
	 */
	public static Type typeOf(Expr e) {
		if (e instanceof Expr.Boolean) {
			return Type.Bool;
		} else if (e instanceof Expr.Integer) {
			return Type.Int;
		} else if (e instanceof Expr.Decimal) {
			return Type.Real;
		} else if (e instanceof Expr.BitVector) {
			return new Type.BitVector(((Expr.BitVector) e).getWidth());
		} else if (e instanceof Expr.StringLiteral) {
			return Type.String;
		} else if (e instanceof Expr.VariableAccess) {
			return ((Expr.VariableAccess) e).getVariable().getType();
		} else if (e instanceof Expr.Operator) {
			return typeOf((Expr.Operator) e);
		} else if (e instanceof Expr.Invoke) {
			Expr.Invoke i = (Expr.Invoke) e;
			Function f = i.getFunction();
			return substitute(f.getReturnType(), bind(f.getTypeParameters(), i.getTypeArguments()));
		} else if (e instanceof Expr.Quantifier || e instanceof Expr.Label) {
			return Type.Bool;
		} else if (e instanceof Expr.Let) {
			return typeOf(((Expr.Let) e).getBody());
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private static Type typeOf(Expr.Operator e) {
		switch (e.getKind()) {
		case ITE:
			return typeOf(e.getOperand(1));
		case ADD:
		case SUB:
		case MUL:
		case NEG:
			return typeOf(e.getOperand(0));
		case DIV:
		case MOD:
			return Type.Int;
		case RDIV:
			return Type.Real;
		case SELECT: {
			Type t = typeOf(e.getOperand(0));
			if (t instanceof Type.Map) {
				return ((Type.Map) t).getValue();
			}
			throw new IllegalArgumentException("select on non-map type " + t);
		}
		case STORE:
			return typeOf(e.getOperand(0));
		default:
			return Type.Bool;
		}
	}

	/**
	 * Construct a substitution from type parameters to their arguments.
	 *
	 * @param parameters
	 * @param arguments
	 * @return
	 */
	public static Map<Type.Variable, Type> bind(List<Type.Variable> parameters, List<Type> arguments) {
		if (parameters.size() != arguments.size()) {
			throw new IllegalArgumentException("mismatched type arguments");
		}
		HashMap<Type.Variable, Type> binding = new HashMap<>();
		for (int i = 0; i != parameters.size(); ++i) {
			binding.put(parameters.get(i), arguments.get(i));
		}
		return binding;
	}

	/**
	 * Apply a given substitution of type variables to a type. Type variables not
	 * in the substitution are left untouched.
	 *
	 * @param type
	 * @param binding
	 * @return
	 */
	public static Type substitute(Type type, Map<Type.Variable, Type> binding) {
		if (binding.isEmpty()) {
			return type;
		} else if (type instanceof Type.Variable) {
			Type t = binding.get(type);
			return t == null ? type : t;
		} else if (type instanceof Type.Constructor && !((Type.Constructor) type).getArguments().isEmpty()) {
			Type.Constructor c = (Type.Constructor) type;
			List<Type> arguments = new ArrayList<>();
			for (Type arg : c.getArguments()) {
				arguments.add(substitute(arg, binding));
			}
			return new Type.Constructor(c.getName(), arguments);
		} else if (type instanceof Type.Map) {
			Type.Map m = (Type.Map) type;
			return new Type.Map(substitute(m.getKey(), binding), substitute(m.getValue(), binding));
		} else {
			return type;
		}
	}

	/**
	 * Determine the type variables occurring in a given type, in order of first
	 * occurrence.
	 *
	 * @param type
	 * @return
	 */
	public static Set<Type.Variable> typeVariablesOf(Type type) {
		LinkedHashSet<Type.Variable> vars = new LinkedHashSet<>();
		typeVariablesOf(type, vars);
		return vars;
	}

	private static void typeVariablesOf(Type type, Set<Type.Variable> vars) {
		if (type instanceof Type.Variable) {
			vars.add((Type.Variable) type);
		} else if (type instanceof Type.Constructor) {
			for (Type arg : ((Type.Constructor) type).getArguments()) {
				typeVariablesOf(arg, vars);
			}
		} else if (type instanceof Type.Map) {
			typeVariablesOf(((Type.Map) type).getKey(), vars);
			typeVariablesOf(((Type.Map) type).getValue(), vars);
		}
	}
}
