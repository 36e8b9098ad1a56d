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

import java.util.Arrays;
import java.util.Locale;

import vc2smt.erasure.EncodingMode;

/**
 * Options common to all provers. Options are given as <code>KEY=VALUE</code>
 * strings, and subclasses extend the set of recognised keys by overriding
 * {@link #parse(String, String)}.
 *
 * @author David J. Pearce
 *
 */
public class ProverOptions {
	/**
	 * Explicit path of the prover executable, or <code>null</code> if it should be
	 * discovered.
	 */
	private String proverPath;
	private String proverName = "z3";
	/**
	 * Time limit (in seconds) for each check, where zero means no limit.
	 */
	private int timeLimit = 0;
	private EncodingMode typeEncoding = EncodingMode.PREMISES;

	/**
	 * Parse a sequence of options, each of the form <code>KEY=VALUE</code>.
	 *
	 * @param options
	 * @throws ProverException if an option is malformed or not recognised.
	 */
	public void parse(Iterable<String> options) throws ProverException {
		for (String option : options) {
			int eq = option.indexOf('=');
			if (eq <= 0) {
				throw new ProverException("malformed prover option \"" + option + "\", expected KEY=VALUE");
			}
			String key = option.substring(0, eq).trim();
			String value = option.substring(eq + 1).trim();
			if (!parse(key, value)) {
				throw new ProverException("unrecognised prover option \"" + key + "\"\n" + getHelp());
			}
		}
	}

	public void parse(String... options) throws ProverException {
		parse(Arrays.asList(options));
	}

	/**
	 * Parse a single option. Subclasses should try their own options first, and
	 * defer to this method otherwise.
	 *
	 * @param key
	 * @param value
	 * @return <code>true</code> if the key was recognised.
	 * @throws ProverException if the value is malformed.
	 */
	protected boolean parse(String key, String value) throws ProverException {
		switch (key) {
		case "PROVER_PATH":
			proverPath = value;
			return true;
		case "PROVER_NAME":
			proverName = value;
			return true;
		case "TIME_LIMIT":
			timeLimit = parseInt(key, value);
			if (timeLimit < 0) {
				throw new ProverException("invalid value for " + key + ": " + value);
			}
			return true;
		case "TYPE_ENCODING":
			try {
				typeEncoding = EncodingMode.fromString(value);
			} catch (IllegalArgumentException e) {
				throw new ProverException("invalid value for " + key + ": " + value, e);
			}
			return true;
		default:
			return false;
		}
	}

	protected static boolean parseBool(String key, String value) throws ProverException {
		switch (value.toLowerCase(Locale.ROOT)) {
		case "true":
		case "1":
			return true;
		case "false":
		case "0":
			return false;
		default:
			throw new ProverException("invalid value for " + key + ": " + value + " (expected a boolean)");
		}
	}

	protected static int parseInt(String key, String value) throws ProverException {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new ProverException("invalid value for " + key + ": " + value + " (expected an integer)", e);
		}
	}

	/**
	 * Describe the options understood by this prover.
	 *
	 * @return
	 */
	public String getHelp() {
		return "\nGeneric prover options:\n" //
				+ "~~~~~~~~~~~~~~~~~~~~~~~\n" //
				+ "PROVER_PATH=<path>        Path of the prover executable (default: discovered)\n"
				+ "PROVER_NAME=<string>      Name of the prover executable (default: z3)\n"
				+ "TIME_LIMIT=<int>          Time limit per check in seconds, 0 for none (default: 0)\n"
				+ "TYPE_ENCODING=<string>    One of arguments, monomorphic or premises (default: premises)\n";
	}

	public String getProverPath() {
		return proverPath;
	}

	public ProverOptions setProverPath(String path) {
		this.proverPath = path;
		return this;
	}

	public String getProverName() {
		return proverName;
	}

	public ProverOptions setProverName(String name) {
		this.proverName = name;
		return this;
	}

	public int getTimeLimit() {
		return timeLimit;
	}

	public ProverOptions setTimeLimit(int seconds) {
		this.timeLimit = seconds;
		return this;
	}

	public EncodingMode getTypeEncoding() {
		return typeEncoding;
	}

	public ProverOptions setTypeEncoding(EncodingMode mode) {
		this.typeEncoding = mode;
		return this;
	}
}
