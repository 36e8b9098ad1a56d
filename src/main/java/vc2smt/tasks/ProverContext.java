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

import vc2smt.core.Logic.Expr;

/**
 * The logical context against which verification conditions are checked.
 *
 * @author David J. Pearce
 *
 */
public interface ProverContext {
	/**
	 * Get the background axioms of this context, as a single (typically
	 * conjunctive) expression.
	 *
	 * @return
	 */
	public Expr getAxioms();

	/**
	 * Get the commands which must be sent to the prover before each check. Since
	 * the context may evolve between checks, these are requested afresh every
	 * time.
	 *
	 * @return
	 */
	public String getProverCommands();
}
