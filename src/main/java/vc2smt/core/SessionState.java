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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The state accumulated by a prover over the lifetime of one verifier run. All
 * declarations and axioms ever produced are kept here, since every script
 * written must be self-contained. Both sequences only ever grow. There is no
 * deduplication here: it is the responsibility of the declaration collector and
 * the prover not to insert the same thing twice.
 *
 * @author David J. Pearce
 *
 */
public class SessionState {
	/**
	 * Sort and function declarations, in the order they must be given to the
	 * prover.
	 */
	private final List<String> declarations = new ArrayList<>();
	/**
	 * Linearised axioms, without the enclosing <code>assert</code>.
	 */
	private final List<String> axioms = new ArrayList<>();
	/**
	 * Signals whether the background axioms of the prover context have been
	 * linearised yet.
	 */
	private boolean backgroundSetupDone = false;

	public void addDeclaration(String declaration) {
		if (declaration == null) {
			throw new IllegalArgumentException("invalid declaration");
		}
		declarations.add(declaration);
	}

	public void addAxiom(String axiom) {
		if (axiom == null) {
			throw new IllegalArgumentException("invalid axiom");
		}
		axioms.add(axiom);
	}

	public List<String> getDeclarations() {
		return Collections.unmodifiableList(declarations);
	}

	public List<String> getAxioms() {
		return Collections.unmodifiableList(axioms);
	}

	public boolean isBackgroundSetupDone() {
		return backgroundSetupDone;
	}

	public void markBackgroundSetupDone() {
		this.backgroundSetupDone = true;
	}
}
