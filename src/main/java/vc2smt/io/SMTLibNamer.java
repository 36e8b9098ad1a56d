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
package vc2smt.io;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableSet;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Type;

/**
 * <p>
 * Assigns SMT-LIB identifiers to the symbols of a prover session. Once a
 * symbol has been named its identifier never changes, and no two symbols share
 * an identifier. Names are derived from the symbol's own name, avoiding the
 * reserved words and predefined symbols of SMT-LIB. Clashes are resolved by
 * appending <code>@n</code> for the smallest positive <code>n</code> which gives
 * an unused name. For example, two distinct variables both called
 * <code>x</code> are named <code>x</code> and <code>x@1</code>.
 * </p>
 * <p>
 * Identifiers which are not simple symbols are quoted as
 * <code>|...|</code>. Characters which cannot appear within a quoted symbol
 * (namely <code>|</code> and <code>\</code>) are replaced by <code>_</code>.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class SMTLibNamer {
	private static final Pattern SIMPLE_SYMBOL = Pattern
			.compile("[a-zA-Z~!@$%^&*_+=<>.?/\\-][0-9a-zA-Z~!@$%^&*_+=<>.?/\\-]*");

	private static final Set<String> RESERVED = ImmutableSet.of(
			// Reserved words
			"!", "_", "as", "BINARY", "DECIMAL", "exists", "HEXADECIMAL", "forall", "let", "match", "NUMERAL", "par",
			"STRING",
			// Commands
			"assert", "check-sat", "check-sat-assuming", "declare-const", "declare-datatype", "declare-datatypes",
			"declare-fun", "declare-sort", "define-fun", "define-fun-rec", "define-funs-rec", "define-sort", "echo",
			"exit", "get-assertions", "get-assignment", "get-info", "get-model", "get-option", "get-proof",
			"get-unsat-assumptions", "get-unsat-core", "get-value", "pop", "push", "reset", "reset-assertions",
			"set-info", "set-logic", "set-option",
			// Core theory
			"Bool", "true", "false", "not", "=>", "and", "or", "xor", "=", "distinct", "ite",
			// Arithmetic
			"Int", "Real", "-", "+", "*", "/", "div", "mod", "abs", "<=", "<", ">=", ">", "to_real", "to_int", "is_int",
			// Arrays, bit-vectors and strings
			"Array", "select", "store", "BitVec", "concat", "extract", "String",
			// Attributes and solver extensions
			"pattern", "weight", "qid", "skolemid", "lblpos", "lblneg", "named", "lambda");

	private final Map<Object, String> names = new HashMap<>();
	private final Set<String> used = new HashSet<>(RESERVED);

	/**
	 * Get the identifier for a variable.
	 *
	 * @param v
	 * @return
	 */
	public String getName(Logic.Variable v) {
		return getName(v, v.getName());
	}

	/**
	 * Get the identifier for a function.
	 *
	 * @param f
	 * @return
	 */
	public String getName(Logic.Function f) {
		return getName(f, f.getName());
	}

	/**
	 * Get the identifier for an uninterpreted sort, which is determined by its
	 * name and arity.
	 *
	 * @param sort
	 * @return
	 */
	public String getName(Type.Constructor sort) {
		return getName(new SortName(sort.getClass(), sort.getName(), sort.getArguments().size()), sort.getName());
	}

	/**
	 * Look up the identifier assigned to a symbol, or create one if it has none.
	 *
	 * @param key
	 * @param name
	 * @return
	 */
	private String getName(Object key, String name) {
		String r = names.get(key);
		if (r == null) {
			String content = sanitise(name);
			String candidate = content;
			for (int n = 1; used.contains(candidate); ++n) {
				candidate = content + "@" + n;
			}
			used.add(candidate);
			r = quote(candidate);
			names.put(key, r);
		}
		return r;
	}

	/**
	 * Quote an arbitrary string so that it can be used as an SMT-LIB symbol. The
	 * result is unaffected by the names assigned so far.
	 *
	 * @param s
	 * @return
	 */
	public static String quoteId(String s) {
		return quote(sanitise(s));
	}

	/**
	 * Symbols beginning with <code>@</code> or <code>.</code> are reserved for
	 * solvers, even when quoted.
	 */
	private static String sanitise(String name) {
		String content = name.replace('|', '_').replace('\\', '_');
		if (content.isEmpty() || content.startsWith("@") || content.startsWith(".")) {
			content = "_" + content;
		}
		return content;
	}

	private static String quote(String content) {
		if (SIMPLE_SYMBOL.matcher(content).matches()) {
			return content;
		}
		return "|" + content + "|";
	}

	private static final class SortName {
		private final Class<?> kind;
		private final String name;
		private final int arity;

		public SortName(Class<?> kind, String name, int arity) {
			this.kind = kind;
			this.name = name;
			this.arity = arity;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof SortName) {
				SortName s = (SortName) o;
				return kind == s.kind && name.equals(s.name) && arity == s.arity;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, name, arity);
		}
	}
}
