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

import static org.junit.Assert.*;
import static vc2smt.core.Logic.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.Test;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.core.Logic.Type;

public class TypeDeclCollectorTest {
	private static final Type.Constructor Heap = new Type.Constructor("Heap");
	private static final Logic.Variable h = new Logic.Variable("h", Heap);
	private static final Logic.Variable i = new Logic.Variable("i", Type.Int);
	private static final Logic.Function read = new Logic.Function("read", Collections.emptyList(),
			Arrays.asList(Heap, Type.Int), Type.Int);

	@Test
	public void test_collect_01() {
		TypeDeclCollector collector = new TypeDeclCollector(new SMTLibNamer());
		collector.collect(GT(INVOKE(read, VAR(h), VAR(i)), CONST(0)));
		assertEquals(Arrays.asList("(declare-sort Heap 0)", "(declare-fun h () Heap)", "(declare-fun i () Int)",
				"(declare-fun read (Heap Int) Int)"), collector.getNewDeclarations());
		assertTrue(collector.getNewDeclarations().isEmpty());
	}

	@Test
	public void test_dedup_01() {
		TypeDeclCollector collector = new TypeDeclCollector(new SMTLibNamer());
		Logic.Variable j = new Logic.Variable("j", Type.Int);
		collector.collect(GT(INVOKE(read, VAR(h), VAR(i)), CONST(0)));
		List<String> first = collector.getNewDeclarations();
		collector.collect(LT(INVOKE(read, VAR(h), VAR(j)), INVOKE(read, VAR(h), VAR(i))));
		List<String> second = collector.getNewDeclarations();
		assertEquals(Arrays.asList("(declare-fun j () Int)"), second);
		HashSet<String> all = new HashSet<>(first);
		all.addAll(second);
		assertEquals(first.size() + second.size(), all.size());
	}

	@Test
	public void test_bound_01() {
		// Bound variables are not declared, but their sorts are
		Logic.Variable r = new Logic.Variable("r", new Type.Constructor("Ref"));
		TypeDeclCollector collector = new TypeDeclCollector(new SMTLibNamer());
		collector.collect(FORALL(r, EQ(VAR(r), VAR(r))));
		assertEquals(Arrays.asList("(declare-sort Ref 0)"), collector.getNewDeclarations());
	}

	@Test
	public void test_let_01() {
		Logic.Variable y = new Logic.Variable("y", Type.Int);
		TypeDeclCollector collector = new TypeDeclCollector(new SMTLibNamer());
		collector.collect(LET(BIND(y, VAR(i)), GT(VAR(y), CONST(0))));
		assertEquals(Arrays.asList("(declare-fun i () Int)"), collector.getNewDeclarations());
	}

	@Test
	public void test_parametric_sort() {
		Type set = new Type.Constructor("Set", new Type.Constructor("Ref"));
		Logic.Variable s = new Logic.Variable("s", set);
		TypeDeclCollector collector = new TypeDeclCollector(new SMTLibNamer());
		collector.collect(EQ(VAR(s), VAR(s)));
		assertEquals(Arrays.asList("(declare-sort Ref 0)", "(declare-sort Set 1)", "(declare-fun s () (Set Ref))"),
				collector.getNewDeclarations());
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_type_variable() {
		Logic.Variable v = new Logic.Variable("v", new Type.Variable("a"));
		new TypeDeclCollector(new SMTLibNamer()).collect(EQ(VAR(v), VAR(v)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_polymorphic_function() {
		Type.Variable a = new Type.Variable("a");
		Logic.Function id = new Logic.Function("id", Arrays.asList(a), Arrays.asList(a), a);
		Expr e = EQ(INVOKE(id, Arrays.asList(Type.Int), Arrays.asList(CONST(1))), CONST(1));
		new TypeDeclCollector(new SMTLibNamer()).collect(e);
	}
}
