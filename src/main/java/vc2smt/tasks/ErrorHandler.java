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

/**
 * Receives the diagnostics produced while checking a verification condition.
 * All callbacks do nothing by default.
 *
 * @author David J. Pearce
 *
 */
public abstract class ErrorHandler {

	/**
	 * Called when the prover reports a counterexample.
	 *
	 * @param model The model reported by the prover.
	 */
	public void onCounterexample(String model) {
	}

	/**
	 * Called when a check exceeded its time or memory limit.
	 *
	 * @param outcome
	 */
	public void onResourceExceeded(Outcome outcome) {
	}

	public void onProverWarning(String message) {
	}
}
