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

import java.util.ArrayList;
import java.util.List;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Type;

/**
 * Axiom builder for the premises encoding. Type parameters of a polymorphic
 * function which can be recovered from the types of its arguments are left
 * implicit. For example, <code>contains&lt;α&gt;(Set&lt;α&gt;, α)</code> takes no type
 * arguments at all, whilst <code>empty&lt;α&gt;() : Set&lt;α&gt;</code> takes one.
 *
 * @author David J. Pearce
 *
 */
public class TypeAxiomBuilderPremises extends TypeAxiomBuilder {

	@Override
	public List<Type.Variable> explicitTypeParameters(Logic.Function f) {
		ArrayList<Type.Variable> explicit = new ArrayList<>();
		for (Type.Variable tv : f.getTypeParameters()) {
			if (!isInferable(tv, f)) {
				explicit.add(tv);
			}
		}
		return explicit;
	}
}
