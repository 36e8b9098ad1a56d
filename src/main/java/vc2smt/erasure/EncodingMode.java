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

/**
 * Identifies how the polymorphic types of verification conditions are encoded
 * for a prover which only understands monomorphic, many-sorted logic.
 *
 * @author David J. Pearce
 *
 */
public enum EncodingMode {
	/**
	 * Type parameters of polymorphic functions are passed as explicit arguments.
	 */
	ARGUMENTS,
	/**
	 * No encoding is necessary, as verification conditions are already
	 * monomorphic.
	 */
	MONOMORPHIC,
	/**
	 * Type parameters are inferred from argument types where possible, and
	 * quantified variables are guarded by type premises.
	 */
	PREMISES;

	public static EncodingMode fromString(String s) {
		for (EncodingMode m : values()) {
			if (m.name().equalsIgnoreCase(s)) {
				return m;
			}
		}
		throw new IllegalArgumentException("unknown type encoding: " + s);
	}
}
