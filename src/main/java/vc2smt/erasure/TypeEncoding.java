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

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.core.Polarity;

/**
 * The type encoding used by a prover session. Each encoding owns the axiom
 * builder for the session, and pairs it with erasers of the matching kind. The
 * set of encodings is closed, hence an eraser can never be used with the axiom
 * builder of another encoding.
 *
 * @author David J. Pearce
 *
 */
public abstract class TypeEncoding {

	private TypeEncoding() {
	}

	/**
	 * Erase the types of a given expression.
	 *
	 * @param expr
	 * @param polarity
	 * @return
	 */
	public abstract Expr erase(Expr expr, Polarity polarity);

	/**
	 * Return (and forget) the axioms registered since the last call.
	 *
	 * @return
	 */
	public abstract Expr getNewAxioms();

	public abstract EncodingMode getMode();

	/**
	 * Create a fresh encoding for a new prover session.
	 *
	 * @param mode
	 * @return
	 */
	public static TypeEncoding create(EncodingMode mode) {
		switch (mode) {
		case MONOMORPHIC:
			return new Monomorphic();
		case ARGUMENTS:
			return new Arguments();
		default:
			return new Premises();
		}
	}

	/**
	 * The identity encoding, used when expressions are already monomorphic.
	 */
	public static final class Monomorphic extends TypeEncoding {
		@Override
		public Expr erase(Expr expr, Polarity polarity) {
			return expr;
		}

		@Override
		public Expr getNewAxioms() {
			return Logic.TRUE;
		}

		@Override
		public EncodingMode getMode() {
			return EncodingMode.MONOMORPHIC;
		}
	}

	public static final class Arguments extends TypeEncoding {
		private final TypeAxiomBuilderArguments builder = new TypeAxiomBuilderArguments();

		private Arguments() {
			builder.setup();
		}

		@Override
		public Expr erase(Expr expr, Polarity polarity) {
			return new TypeEraserArguments(builder).erase(expr, polarity);
		}

		@Override
		public Expr getNewAxioms() {
			return builder.getNewAxioms();
		}

		@Override
		public EncodingMode getMode() {
			return EncodingMode.ARGUMENTS;
		}

		public TypeAxiomBuilderArguments getBuilder() {
			return builder;
		}
	}

	public static final class Premises extends TypeEncoding {
		private final TypeAxiomBuilderPremises builder = new TypeAxiomBuilderPremises();

		private Premises() {
			builder.setup();
		}

		@Override
		public Expr erase(Expr expr, Polarity polarity) {
			return new TypeEraserPremises(builder).erase(expr, polarity);
		}

		@Override
		public Expr getNewAxioms() {
			return builder.getNewAxioms();
		}

		@Override
		public EncodingMode getMode() {
			return EncodingMode.PREMISES;
		}

		public TypeAxiomBuilderPremises getBuilder() {
			return builder;
		}
	}
}
