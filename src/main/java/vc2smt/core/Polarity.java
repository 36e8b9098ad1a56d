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

/**
 * The sign context of a subformula. A formula occurring as a hypothesis has
 * negative polarity, a formula occurring as a goal has positive polarity, and a
 * formula whose sign cannot be determined (e.g. underneath an equivalence) is
 * neutral.
 *
 * @author David J. Pearce
 *
 */
public enum Polarity {
	NEGATIVE, NEUTRAL, POSITIVE;

	public Polarity negate() {
		switch (this) {
		case NEGATIVE:
			return POSITIVE;
		case POSITIVE:
			return NEGATIVE;
		default:
			return NEUTRAL;
		}
	}
}
