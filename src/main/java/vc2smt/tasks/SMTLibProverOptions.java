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
 * Options specific to provers which communicate through SMT-LIB2 scripts.
 *
 * @author David J. Pearce
 *
 */
public class SMTLibProverOptions extends ProverOptions {
	public static final String DEFAULT_OUTPUT = "vc2smt-@PROC@.smt2";

	/**
	 * Filename template for emitted scripts, where <code>@PROC@</code> stands for
	 * the descriptive name of the check.
	 */
	private String output = DEFAULT_OUTPUT;
	private boolean useWeights = true;
	private boolean useZ3 = true;

	@Override
	protected boolean parse(String key, String value) throws ProverException {
		switch (key) {
		case "OUTPUT":
			output = value;
			return true;
		case "USE_WEIGHTS":
			useWeights = parseBool(key, value);
			return true;
		case "USE_Z3":
			useZ3 = parseBool(key, value);
			return true;
		default:
			return super.parse(key, value);
		}
	}

	@Override
	public String getHelp() {
		return "\nSMT-specific options:\n" //
				+ "~~~~~~~~~~~~~~~~~~~~~\n" //
				+ "OUTPUT=<string>           Store VC in named file (default: " + DEFAULT_OUTPUT + ")\n"
				+ "USE_WEIGHTS=<bool>        Pass :weight annotations on quantified formulas (default: true)\n"
				+ "USE_Z3=<bool>             Use Z3 extensions such as :qid and labels (default: true)\n"
				+ super.getHelp();
	}

	public String getOutput() {
		return output;
	}

	public SMTLibProverOptions setOutput(String output) {
		this.output = output;
		return this;
	}

	public boolean getUseWeights() {
		return useWeights;
	}

	public SMTLibProverOptions setUseWeights(boolean flag) {
		this.useWeights = flag;
		return this;
	}

	public boolean getUseZ3() {
		return useZ3;
	}

	/**
	 * Labels are only supported through the Z3 extensions.
	 *
	 * @return
	 */
	public boolean getUseLabels() {
		return useZ3;
	}

	public SMTLibProverOptions setUseZ3(boolean flag) {
		this.useZ3 = flag;
		return this;
	}

	/**
	 * Determine the script filename for a given descriptive name.
	 *
	 * @param name
	 * @return
	 */
	public String getOutputFile(String name) {
		return output.replace("@PROC@", name.replaceAll("[^A-Za-z0-9._-]", "_"));
	}
}
