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

import org.junit.Test;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Type;
import vc2smt.core.Polarity;

public class TypeEncodingTest {

	@Test
	public void test_modes() {
		for (EncodingMode mode : EncodingMode.values()) {
			assertEquals(mode, TypeEncoding.create(mode).getMode());
		}
	}

	@Test
	public void test_fromString() {
		assertEquals(EncodingMode.PREMISES, EncodingMode.fromString("premises"));
		assertEquals(EncodingMode.ARGUMENTS, EncodingMode.fromString("Arguments"));
		assertEquals(EncodingMode.MONOMORPHIC, EncodingMode.fromString("MONOMORPHIC"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_fromString_invalid() {
		EncodingMode.fromString("erasure");
	}

	@Test
	public void test_setup_axioms() {
		// The common casts are registered when the session begins
		TypeEncoding enc = TypeEncoding.create(EncodingMode.PREMISES);
		assertFalse(isTrue(enc.getNewAxioms()));
		assertTrue(isTrue(enc.getNewAxioms()));
	}

	@Test
	public void test_sessions_independent() {
		Logic.Variable h = new Logic.Variable("h", new Type.Constructor("Heap"));
		TypeEncoding enc1 = TypeEncoding.create(EncodingMode.ARGUMENTS);
		TypeEncoding enc2 = TypeEncoding.create(EncodingMode.ARGUMENTS);
		enc1.getNewAxioms();
		enc2.getNewAxioms();
		enc1.erase(EQ(VAR(h), VAR(h)), Polarity.POSITIVE);
		assertFalse(isTrue(enc1.getNewAxioms()));
		assertTrue(isTrue(enc2.getNewAxioms()));
	}

	@Test
	public void test_builder_bound() {
		TypeEncoding.Premises premises = (TypeEncoding.Premises) TypeEncoding.create(EncodingMode.PREMISES);
		TypeEncoding.Arguments arguments = (TypeEncoding.Arguments) TypeEncoding.create(EncodingMode.ARGUMENTS);
		Type.Variable a = new Type.Variable("a");
		// empty<a>() : Set<a>
		Logic.Function empty = new Logic.Function("empty", Arrays.asList(a), Collections.emptyList(),
				new Type.Constructor("Set", a));
		assertEquals(Arrays.asList(a), premises.getBuilder().explicitTypeParameters(empty));
		assertEquals(Arrays.asList(a), arguments.getBuilder().explicitTypeParameters(empty));
	}
}
