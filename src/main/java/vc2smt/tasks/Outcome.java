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
 * The result of checking a verification condition.
 *
 * @author David J. Pearce
 *
 */
public enum Outcome {
	/**
	 * The negated verification condition is unsatisfiable.
	 */
	VALID,
	/**
	 * The negated verification condition is satisfiable.
	 */
	INVALID,
	TIMEOUT,
	OUT_OF_MEMORY,
	/**
	 * No conclusion could be drawn.
	 */
	UNDETERMINED
}
