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

import java.nio.file.Path;

/**
 * Constructs the options, contexts and provers for SMT-LIB2 based checking.
 *
 * @author David J. Pearce
 *
 */
public class SMTLibProverFactory {

	public SMTLibProverOptions blankProverOptions() {
		return new SMTLibProverOptions();
	}

	public DeclFreeProverContext newProverContext(ProverOptions options) {
		return new DeclFreeProverContext();
	}

	/**
	 * Construct a prover which only emits scripts, leaving every outcome
	 * undetermined.
	 *
	 * @param options
	 * @param context
	 * @return
	 * @throws ProverException if the background predicates cannot be loaded.
	 */
	public SMTLibProcessTheoremProver spawnProver(SMTLibProverOptions options, ProverContext context)
			throws ProverException {
		return new SMTLibProcessTheoremProver(options, context, BackgroundPredicates.global());
	}

	/**
	 * Construct a prover which runs the prover executable on each emitted script
	 * to determine its outcome.
	 *
	 * @param options
	 * @param context
	 * @return
	 * @throws ProverException if the background predicates or the prover
	 *                         executable cannot be found.
	 */
	public SMTLibProcessTheoremProver spawnSolvingProver(SMTLibProverOptions options, ProverContext context)
			throws ProverException {
		Path executable = SolverExecutable.find(options);
		SolverProcess process = new SolverProcess(executable);
		return spawnProver(options, context)
				.setOutcomeReader(new SolverOutcomeReader(process, options.getTimeLimit()));
	}
}
