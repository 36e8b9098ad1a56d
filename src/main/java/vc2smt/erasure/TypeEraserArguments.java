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
 * Type eraser for the arguments encoding. Quantifier type parameters are always
 * quantified as variables of sort <code>T</code> and bound variables are left
 * unguarded.
 *
 * @author David J. Pearce
 *
 */
public class TypeEraserArguments extends TypeEraser {

	public TypeEraserArguments(TypeAxiomBuilderArguments builder) {
		super(builder);
	}

	@Override
	protected boolean inferTypeParameters() {
		return false;
	}

	@Override
	protected boolean guardBoundVariables() {
		return false;
	}
}
