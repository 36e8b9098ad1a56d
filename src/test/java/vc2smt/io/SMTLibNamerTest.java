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

import java.util.Collections;

import org.junit.Test;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Type;
import vc2smt.erasure.TypeAxiomBuilder;

public class SMTLibNamerTest {

	@Test
	public void test_stable_01() {
		SMTLibNamer namer = new SMTLibNamer();
		Logic.Variable x = new Logic.Variable("x", Type.Int);
		assertEquals("x", namer.getName(x));
		assertEquals("x", namer.getName(x));
	}

	@Test
	public void test_injective_01() {
		SMTLibNamer namer = new SMTLibNamer();
		Logic.Variable x1 = new Logic.Variable("x", Type.Int);
		Logic.Variable x2 = new Logic.Variable("x", Type.Bool);
		Logic.Function x3 = new Logic.Function("x", Collections.emptyList(), Collections.emptyList(), Type.Int);
		assertEquals("x", namer.getName(x1));
		assertEquals("x@1", namer.getName(x2));
		assertEquals("x@2", namer.getName(x3));
		assertEquals("x@1", namer.getName(x2));
	}

	@Test
	public void test_injective_02() {
		// A symbol whose name looks like a generated one
		SMTLibNamer namer = new SMTLibNamer();
		Logic.Variable x1 = new Logic.Variable("x@1", Type.Int);
		Logic.Variable x2 = new Logic.Variable("x", Type.Int);
		Logic.Variable x3 = new Logic.Variable("x", Type.Int);
		assertEquals("x@1", namer.getName(x1));
		assertEquals("x", namer.getName(x2));
		assertEquals("x@2", namer.getName(x3));
	}

	@Test
	public void test_reserved_01() {
		SMTLibNamer namer = new SMTLibNamer();
		assertEquals("and@1", namer.getName(new Logic.Variable("and", Type.Bool)));
		assertEquals("Int@1", namer.getName(new Type.Constructor("Int")));
		assertEquals("select@1", namer.getName(
				new Logic.Function("select", Collections.emptyList(), Collections.emptyList(), Type.Int)));
	}

	@Test
	public void test_quoting_01() {
		SMTLibNamer namer = new SMTLibNamer();
		assertEquals("|my var|", namer.getName(new Logic.Variable("my var", Type.Int)));
		assertEquals("|1x|", namer.getName(new Logic.Variable("1x", Type.Int)));
		assertEquals("|a_b c|", namer.getName(new Logic.Variable("a|b c", Type.Int)));
		assertEquals("a_b", namer.getName(new Logic.Variable("a\\b", Type.Int)));
	}

	@Test
	public void test_sorts_01() {
		SMTLibNamer namer = new SMTLibNamer();
		assertEquals("Heap", namer.getName(new Type.Constructor("Heap")));
		assertEquals("Heap", namer.getName(new Type.Constructor("Heap")));
		assertEquals("Set", namer.getName(new Type.Constructor("Set", Type.Int)));
		assertEquals("Set", namer.getName(new Type.Constructor("Set", Type.Bool)));
		// The same name with a different arity is a different sort
		assertEquals("Set@1", namer.getName(new Type.Constructor("Set", Type.Int, Type.Int)));
	}

	@Test
	public void test_quoteId_01() {
		assertEquals("proc1", SMTLibNamer.quoteId("proc1"));
		assertEquals("|Foo.bar baz|", SMTLibNamer.quoteId("Foo.bar baz"));
		assertEquals("a_b", SMTLibNamer.quoteId("a|b"));
		assertEquals("_", SMTLibNamer.quoteId(""));
		assertEquals("_@x", SMTLibNamer.quoteId("@x"));
	}

	@Test
	public void test_reserved_02() {
		// Leading @ and . are reserved for solvers, even within bars
		SMTLibNamer namer = new SMTLibNamer();
		assertEquals("_@x", namer.getName(new Logic.Variable("@x", Type.Int)));
		assertEquals("_.y", namer.getName(new Logic.Variable(".y", Type.Int)));
		assertEquals("|_@a b|", namer.getName(new Logic.Variable("@a b", Type.Int)));
		assertEquals("_@x@1", namer.getName(new Logic.Function("_@x", Collections.emptyList(),
				Collections.emptyList(), Type.Int)));
		assertEquals("_", namer.getName(new Logic.Variable("", Type.Int)));
	}

	@Test
	public void test_sorts_02() {
		// User sorts never share a name with the sorts introduced by erasure
		SMTLibNamer namer = new SMTLibNamer();
		assertEquals("T", namer.getName(TypeAxiomBuilder.T));
		assertEquals("U", namer.getName(TypeAxiomBuilder.U));
		assertEquals("T@1", namer.getName(new Type.Constructor("T")));
		assertEquals("U@1", namer.getName(new Type.Constructor("U")));
		assertEquals("T", namer.getName(TypeAxiomBuilder.T));
	}
}
