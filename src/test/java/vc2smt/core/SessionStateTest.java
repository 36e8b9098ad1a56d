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

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class SessionStateTest {

	@Test
	public void test_append_01() {
		SessionState s = new SessionState();
		s.addDeclaration("(declare-fun x () Int)");
		s.addAxiom("(> x 0)");
		s.addAxiom("(< x 10)");
		assertEquals(Arrays.asList("(declare-fun x () Int)"), s.getDeclarations());
		assertEquals(Arrays.asList("(> x 0)", "(< x 10)"), s.getAxioms());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void test_readonly_01() {
		SessionState s = new SessionState();
		s.addAxiom("(> x 0)");
		s.getAxioms().clear();
	}

	@Test(expected = UnsupportedOperationException.class)
	public void test_readonly_02() {
		new SessionState().getDeclarations().add("(declare-sort U 0)");
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_null_axiom() {
		new SessionState().addAxiom(null);
	}

	@Test
	public void test_background_setup() {
		SessionState s = new SessionState();
		assertFalse(s.isBackgroundSetupDone());
		s.markBackgroundSetupDone();
		assertTrue(s.isBackgroundSetupDone());
	}

	@Test
	public void test_polarity() {
		assertEquals(Polarity.NEGATIVE, Polarity.POSITIVE.negate());
		assertEquals(Polarity.POSITIVE, Polarity.NEGATIVE.negate());
		assertEquals(Polarity.NEUTRAL, Polarity.NEUTRAL.negate());
	}
}
