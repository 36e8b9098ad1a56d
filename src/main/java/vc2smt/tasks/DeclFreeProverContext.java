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
package vc2smt.tasks;

import java.util.ArrayList;
import java.util.List;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;

/**
 * A prover context which holds only background axioms and prover commands.
 * Declarations are not tracked here, since they are discovered by the prover
 * from the expressions themselves.
 *
 * @author David J. Pearce
 *
 */
public class DeclFreeProverContext implements ProverContext {
	private final List<Expr> axioms = new ArrayList<>();
	private final List<String> commands = new ArrayList<>();

	public DeclFreeProverContext addAxiom(Expr axiom) {
		axioms.add(axiom);
		return this;
	}

	public DeclFreeProverContext addProverCommand(String command) {
		commands.add(command);
		return this;
	}

	@Override
	public Expr getAxioms() {
		return Logic.AND(new ArrayList<>(axioms));
	}

	@Override
	public String getProverCommands() {
		return String.join("\n", commands);
	}
}
