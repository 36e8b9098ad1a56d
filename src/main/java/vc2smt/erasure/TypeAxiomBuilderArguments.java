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

import java.util.List;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Type;

/**
 * Axiom builder for the arguments encoding, where every type parameter of a
 * polymorphic function is passed explicitly.
 *
 * @author David J. Pearce
 *
 */
public class TypeAxiomBuilderArguments extends TypeAxiomBuilder {

	@Override
	public List<Type.Variable> explicitTypeParameters(Logic.Function f) {
		return f.getTypeParameters();
	}
}
