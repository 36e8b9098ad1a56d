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
 * Determines the outcome of a check whose script has been emitted.
 *
 * @author David J. Pearce
 *
 */
public interface OutcomeReader {
	/**
	 * A reader which never draws a conclusion. This is used when no solver is run.
	 */
	public static final OutcomeReader UNDETERMINED = (name, file, handler) -> Outcome.UNDETERMINED;

	/**
	 * Read the outcome of a given check.
	 *
	 * @param name    Descriptive name of the check.
	 * @param file    Emitted script.
	 * @param handler Receiver for diagnostics.
	 * @return
	 */
	public Outcome read(String name, Path file, ErrorHandler handler);
}
