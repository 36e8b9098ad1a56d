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

import static org.junit.Assert.*;
import static vc2smt.core.Logic.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.core.Logic.Type;
import vc2smt.core.Polarity;
import vc2smt.io.SMTLibExprLinearizer;
import vc2smt.io.SMTLibNamer;
import vc2smt.io.TypeDeclCollector;
import vc2smt.tasks.SMTLibProverOptions;

public class TypeEraserTest {
	private static final Type.Constructor Heap = new Type.Constructor("Heap");
	private static final Type.Variable a = new Type.Variable("a");
	private static final Logic.Variable x = new Logic.Variable("x", Type.Int);
	private static final Logic.Variable h = new Logic.Variable("h", Heap);
	private static final Logic.Variable r = new Logic.Variable("r", Heap);
	private static final Logic.Function P = new Logic.Function("P", Collections.emptyList(), Arrays.asList(Heap),
			Type.Bool);
	private static final Logic.Function f = new Logic.Function("f", Collections.emptyList(), Arrays.asList(Type.Int),
			Type.Int);
	// id<a>(a) : a
	private static final Logic.Function id = new Logic.Function("id", Arrays.asList(a), Arrays.asList(a), a);
	// Q<a>(a) : bool
	private static final Logic.Function Q = new Logic.Function("Q", Arrays.asList(a), Arrays.asList(a), Type.Bool);

	private SMTLibNamer namer;

	@Before
	public void setup() {
		namer = new SMTLibNamer();
	}

	private String linearize(Expr e) {
		return SMTLibExprLinearizer.toString(e, namer, new SMTLibProverOptions());
	}

	// ===============================================================
	// Monomorphic
	// ===============================================================

	@Test
	public void test_monomorphic_01() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.MONOMORPHIC);
		Expr e = FORALL(r, INVOKE(P, VAR(r)));
		assertSame(e, enc.erase(e, Polarity.POSITIVE));
		assertSame(e, enc.erase(e, Polarity.NEGATIVE));
		assertSame(e, enc.erase(e, Polarity.NEUTRAL));
		assertTrue(isTrue(enc.getNewAxioms()));
	}

	// ===============================================================
	// Native expressions
	// ===============================================================

	@Test
	public void test_native_01() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = AND(GT(VAR(x), CONST(0)), EQ(INVOKE(f, VAR(x)), CONST(1)));
		assertSame(e, enc.erase(e, Polarity.POSITIVE));
	}

	@Test
	public void test_native_02() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.ARGUMENTS);
		Logic.Variable y = new Logic.Variable("y", Type.Int);
		Expr e = FORALL(x, LET(BIND(y, ADD(VAR(x), CONST(1))), GT(VAR(y), VAR(x))));
		assertSame(e, enc.erase(e, Polarity.POSITIVE));
	}

	// ===============================================================
	// Free variables
	// ===============================================================

	@Test
	public void test_variable_01() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		enc.getNewAxioms();
		Expr e = enc.erase(EQ(VAR(h), VAR(h)), Polarity.POSITIVE);
		Expr.VariableAccess lhs = (Expr.VariableAccess) ((Expr.Operator) e).getOperand(0);
		assertEquals(TypeAxiomBuilder.U, lhs.getVariable().getType());
		assertEquals("(= h h)", linearize(e));
		assertTrue(linearize(enc.getNewAxioms()).contains("(= (type h) Heap)"));
	}

	@Test
	public void test_variable_02() {
		// Free variables are translated once per session
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e1 = enc.erase(EQ(VAR(h), VAR(h)), Polarity.POSITIVE);
		enc.getNewAxioms();
		Expr e2 = enc.erase(INVOKE(P, VAR(h)), Polarity.NEGATIVE);
		Logic.Variable v1 = ((Expr.VariableAccess) ((Expr.Operator) e1).getOperand(0)).getVariable();
		Logic.Variable v2 = ((Expr.VariableAccess) ((Expr.Invoke) e2).getArguments().get(0)).getVariable();
		assertSame(v1, v2);
		enc.getNewAxioms();
		enc.erase(INVOKE(P, VAR(h)), Polarity.POSITIVE);
		assertTrue(isTrue(enc.getNewAxioms()));
	}

	// ===============================================================
	// Quantifiers
	// ===============================================================

	@Test
	public void test_premises_forall() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = enc.erase(FORALL(r, INVOKE(P, VAR(r))), Polarity.POSITIVE);
		assertEquals("(forall ((r U)) (=> (= (type r) Heap) (P r)))", linearize(e));
	}

	@Test
	public void test_premises_exists() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = enc.erase(EXISTS(r, INVOKE(P, VAR(r))), Polarity.POSITIVE);
		assertEquals("(exists ((r U)) (and (= (type r) Heap) (P r)))", linearize(e));
	}

	@Test
	public void test_premises_negative() {
		// A universal hypothesis is still guarded by implication
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = enc.erase(FORALL(r, INVOKE(P, VAR(r))), Polarity.NEGATIVE);
		assertEquals("(forall ((r U)) (=> (= (type r) Heap) (P r)))", linearize(e));
	}

	@Test
	public void test_arguments_forall() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.ARGUMENTS);
		Expr e = enc.erase(FORALL(r, INVOKE(P, VAR(r))), Polarity.POSITIVE);
		assertEquals("(forall ((r U)) (P r))", linearize(e));
	}

	@Test
	public void test_premises_polymorphic_quantifier() {
		Logic.Variable v = new Logic.Variable("v", a);
		Expr q = FORALL(Arrays.asList(a), Arrays.asList(v), Collections.emptyList(),
				INVOKE(Q, Arrays.asList(a), Arrays.asList(VAR(v))));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		assertEquals("(forall ((v U)) (Q v))", linearize(enc.erase(q, Polarity.POSITIVE)));
	}

	@Test
	public void test_arguments_polymorphic_quantifier() {
		Logic.Variable v = new Logic.Variable("v", a);
		Expr q = FORALL(Arrays.asList(a), Arrays.asList(v), Collections.emptyList(),
				INVOKE(Q, Arrays.asList(a), Arrays.asList(VAR(v))));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.ARGUMENTS);
		assertEquals("(forall ((a T) (v U)) (Q a v))", linearize(enc.erase(q, Polarity.POSITIVE)));
	}

	@Test
	public void test_premises_guarded_polymorphic_quantifier() {
		// The type parameter is recovered through the inverse of Set
		Type set = new Type.Constructor("Set", a);
		Logic.Variable s = new Logic.Variable("s", set);
		Logic.Function empty = new Logic.Function("isEmpty", Arrays.asList(a), Arrays.asList(set), Type.Bool);
		Expr q = FORALL(Arrays.asList(a), Arrays.asList(s), Collections.emptyList(),
				INVOKE(empty, Arrays.asList(a), Arrays.asList(VAR(s))));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		assertEquals("(forall ((s U)) (=> (= (type s) (Set (Set_inv0 (type s)))) (isEmpty s)))",
				linearize(enc.erase(q, Polarity.POSITIVE)));
	}

	// ===============================================================
	// Function applications
	// ===============================================================

	@Test
	public void test_premises_casts() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		enc.getNewAxioms();
		Expr e = EQ(INVOKE(id, Arrays.asList(Type.Int), Arrays.asList(CONST(1))), CONST(1));
		assertEquals("(= (U_2_int (id (int_2_U 1))) 1)", linearize(enc.erase(e, Polarity.POSITIVE)));
		String axioms = linearize(enc.getNewAxioms());
		assertTrue(axioms.contains("(forall ((x0 U)) (! (= (type (id x0)) (type x0)) :pattern ((id x0))))"));
	}

	@Test
	public void test_arguments_casts() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.ARGUMENTS);
		Expr e = EQ(INVOKE(id, Arrays.asList(Type.Int), Arrays.asList(CONST(1))), CONST(1));
		assertEquals("(= (U_2_int (id intType (int_2_U 1))) 1)", linearize(enc.erase(e, Polarity.POSITIVE)));
	}

	@Test
	public void test_premises_inverse() {
		Type.Constructor boxInt = new Type.Constructor("Box", Type.Int);
		Logic.Function get = new Logic.Function("get", Arrays.asList(a),
				Arrays.asList(new Type.Constructor("Box", a)), a);
		Logic.Variable b = new Logic.Variable("b", boxInt);
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		enc.getNewAxioms();
		Expr e = EQ(INVOKE(get, Arrays.asList(Type.Int), Arrays.asList(VAR(b))), CONST(3));
		assertEquals("(= (U_2_int (get b)) 3)", linearize(enc.erase(e, Polarity.POSITIVE)));
		String axioms = linearize(enc.getNewAxioms());
		assertTrue(axioms.contains("(= (type b) (Box intType))"));
		assertTrue(axioms.contains(
				"(forall ((x0 U)) (! (= (type (get x0)) (Box_inv0 (type x0))) :pattern ((get x0))))"));
	}

	@Test
	public void test_function_memoised() {
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e1 = enc.erase(INVOKE(P, VAR(h)), Polarity.POSITIVE);
		Expr e2 = enc.erase(INVOKE(P, VAR(h)), Polarity.NEGATIVE);
		assertSame(((Expr.Invoke) e1).getFunction(), ((Expr.Invoke) e2).getFunction());
		assertNotSame(P, ((Expr.Invoke) e1).getFunction());
	}

	// ===============================================================
	// User sorts named like internal ones
	// ===============================================================

	@Test
	public void test_user_sort_T_01() {
		Logic.Variable t = new Logic.Variable("t", new Type.Constructor("T"));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = EQ(INVOKE(id, Arrays.asList(t.getType()), Arrays.asList(VAR(t))), VAR(t));
		assertEquals("(= (id t) t)", linearize(enc.erase(e, Polarity.POSITIVE)));
	}

	@Test
	public void test_user_sort_T_02() {
		// Values of a user sort T are guarded like those of any other sort
		Type.Constructor userT = new Type.Constructor("T");
		Logic.Variable t = new Logic.Variable("t", userT);
		Logic.Variable s = new Logic.Variable("s", userT);
		Expr q = FORALL(Collections.emptyList(), Arrays.asList(t, s), Collections.emptyList(), EQ(VAR(t), VAR(s)));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = enc.erase(q, Polarity.NEGATIVE);
		assertEquals("(forall ((t U) (s U)) (=> (and (= (type t) T) (= (type s) T)) (= t s)))", linearize(e));
		Expr.Quantifier eq = (Expr.Quantifier) e;
		assertSame(TypeAxiomBuilder.U, eq.getParameters().get(0).getType());
	}

	@Test
	public void test_user_sort_U() {
		Logic.Variable u = new Logic.Variable("u", new Type.Constructor("U"));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = enc.erase(FORALL(u, EQ(VAR(u), VAR(u))), Polarity.POSITIVE);
		// The internal sort is named first, hence the user sort gets renamed
		assertEquals("(forall ((u U)) (=> (= (type u) U@1) (= u u)))", linearize(e));
	}

	// ===============================================================
	// Maps
	// ===============================================================

	@Test
	public void test_native_map() {
		Logic.Variable m = new Logic.Variable("m", new Type.Map(Type.Int, Type.Int));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = GTEQ(SELECT(STORE(VAR(m), CONST(1), CONST(2)), CONST(1)), CONST(0));
		assertSame(e, enc.erase(e, Polarity.POSITIVE));
	}

	@Test
	public void test_premises_map_argument() {
		// g<a>([a]int) : bool applied at [int]int
		Logic.Function g = new Logic.Function("g", Arrays.asList(a), Arrays.asList(new Type.Map(a, Type.Int)),
				Type.Bool);
		Logic.Variable m = new Logic.Variable("m", new Type.Map(Type.Int, Type.Int));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		enc.getNewAxioms();
		Expr e = enc.erase(INVOKE(g, Arrays.asList(Type.Int), Arrays.asList(VAR(m))), Polarity.POSITIVE);
		assertEquals("(g (Map_int_int_2_U m))", linearize(e));
		// Boxed maps agree with the native ones on reads and writes
		TypeDeclCollector collector = new TypeDeclCollector(new SMTLibNamer());
		collector.collect(enc.getNewAxioms());
		List<String> decls = collector.getNewDeclarations();
		assertTrue(decls.contains("(declare-fun Map_int_int_2_U ((Array Int Int)) U)"));
		assertTrue(decls.contains("(declare-fun MapSelect (U U) U)"));
		assertTrue(decls.contains("(declare-fun MapStore (U U U) U)"));
		assertTrue(decls.contains("(declare-fun MapType (T T) T)"));
	}

	@Test
	public void test_arguments_map_argument() {
		Logic.Function g = new Logic.Function("g", Arrays.asList(a), Arrays.asList(new Type.Map(a, Type.Int)),
				Type.Bool);
		Logic.Variable m = new Logic.Variable("m", new Type.Map(Type.Int, Type.Int));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.ARGUMENTS);
		Expr e = enc.erase(INVOKE(g, Arrays.asList(Type.Int), Arrays.asList(VAR(m))), Polarity.POSITIVE);
		assertEquals("(g intType (Map_int_int_2_U m))", linearize(e));
	}

	@Test
	public void test_erased_map_select() {
		Logic.Variable m = new Logic.Variable("m", new Type.Map(a, Type.Int));
		Logic.Variable k = new Logic.Variable("k", a);
		Expr q = FORALL(Arrays.asList(a), Arrays.asList(m, k), Collections.emptyList(),
				GTEQ(SELECT(VAR(m), VAR(k)), CONST(0)));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.ARGUMENTS);
		assertEquals("(forall ((a T) (m U) (k U)) (>= (U_2_int (MapSelect m k)) 0))",
				linearize(enc.erase(q, Polarity.POSITIVE)));
	}

	@Test
	public void test_erased_map_store() {
		Logic.Variable m = new Logic.Variable("m", new Type.Map(a, Type.Int));
		Logic.Variable k = new Logic.Variable("k", a);
		Expr q = FORALL(Arrays.asList(a), Arrays.asList(m, k), Collections.emptyList(),
				EQ(STORE(VAR(m), VAR(k), CONST(1)), VAR(m)));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.ARGUMENTS);
		assertEquals("(forall ((a T) (m U) (k U)) (= (MapStore m k (int_2_U 1)) m))",
				linearize(enc.erase(q, Polarity.POSITIVE)));
	}

	@Test
	public void test_premises_map_quantifier() {
		// The type parameter is recovered through the inverse of MapType
		Logic.Variable m = new Logic.Variable("m", new Type.Map(a, Type.Int));
		Logic.Variable k = new Logic.Variable("k", a);
		Expr q = FORALL(Arrays.asList(a), Arrays.asList(m, k), Collections.emptyList(),
				GTEQ(SELECT(VAR(m), VAR(k)), CONST(0)));
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		String text = linearize(enc.erase(q, Polarity.POSITIVE));
		assertTrue(text, text.startsWith("(forall ((m U) (k U)) (=> (and "));
		assertTrue(text, text.contains("(= (type k) (MapType_inv0 (type m)))"));
		assertTrue(text, text.endsWith("(>= (U_2_int (MapSelect m k)) 0)))"));
	}

	// ===============================================================
	// Lets
	// ===============================================================

	@Test
	public void test_let_01() {
		Logic.Variable h2 = new Logic.Variable("h2", Heap);
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		Expr e = enc.erase(LET(BIND(h2, VAR(h)), INVOKE(P, VAR(h2))), Polarity.POSITIVE);
		assertEquals("(let ((h2 h)) (P h2))", linearize(e));
		assertEquals(TypeAxiomBuilder.U, ((Expr.Let) e).getBindings().get(0).getVariable().getType());
	}

	// ===============================================================
	// Polarity
	// ===============================================================

	@Test
	public void test_polarity_01() {
		Logic.Variable p = new Logic.Variable("p", Type.Bool);
		Logic.Variable q = new Logic.Variable("q", Type.Bool);
		Logic.Variable s = new Logic.Variable("s", Type.Bool);
		Logic.Variable t = new Logic.Variable("t", Type.Bool);
		Logic.Variable u = new Logic.Variable("u", Type.Bool);
		Logic.Variable w = new Logic.Variable("w", Type.Bool);
		Expr e = IMPLIES(NOT(VAR(p)), AND(VAR(q), IFF(VAR(s), VAR(t)), ITE(VAR(u), VAR(w), VAR(q))));
		PolarityRecorder recorder = new PolarityRecorder(new TypeAxiomBuilderPremises());
		recorder.erase(e, Polarity.POSITIVE);
		assertEquals(Polarity.POSITIVE, recorder.seen.get(p));
		assertEquals(Polarity.POSITIVE, recorder.seen.get(q));
		assertEquals(Polarity.NEUTRAL, recorder.seen.get(s));
		assertEquals(Polarity.NEUTRAL, recorder.seen.get(t));
		assertEquals(Polarity.NEUTRAL, recorder.seen.get(u));
		assertEquals(Polarity.POSITIVE, recorder.seen.get(w));
		recorder.erase(e, Polarity.NEGATIVE);
		assertEquals(Polarity.NEGATIVE, recorder.seen.get(p));
		assertEquals(Polarity.NEGATIVE, recorder.seen.get(w));
	}

	// ===============================================================
	// Axioms
	// ===============================================================

	@Test
	public void test_axioms_declarable() {
		// Axioms introduced by erasure are monomorphic, hence can be declared
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		enc.erase(EQ(INVOKE(id, Arrays.asList(Heap), Arrays.asList(VAR(h))), VAR(h)), Polarity.POSITIVE);
		TypeDeclCollector collector = new TypeDeclCollector(namer);
		collector.collect(enc.getNewAxioms());
		List<String> decls = collector.getNewDeclarations();
		assertTrue(decls.contains("(declare-sort U 0)"));
		assertTrue(decls.contains("(declare-sort T 0)"));
		assertTrue(decls.contains("(declare-fun type (U) T)"));
		assertTrue(decls.contains("(declare-fun int_2_U (Int) U)"));
		assertTrue(decls.contains("(declare-fun h () U)"));
	}

	private static class PolarityRecorder extends TypeEraserPremises {
		private final Map<Logic.Variable, Polarity> seen = new HashMap<>();

		public PolarityRecorder(TypeAxiomBuilderPremises builder) {
			super(builder);
		}

		@Override
		protected Expr constructVariableAccess(Expr.VariableAccess expr) {
			seen.put(expr.getVariable(), getPolarity());
			return super.constructVariableAccess(expr);
		}
	}
}
