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
 * Signals that a prover could not be configured or started, for example because
 * of an unknown option or a missing resource.
 *
 * @author David J. Pearce
 *
 */
public class ProverException extends Exception {
	private static final long serialVersionUID = 1L;

	public ProverException(String message) {
		super(message);
	}

	public ProverException(String message, Throwable cause) {
		super(message, cause);
	}
}
