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

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Determines the outcome of a check by running the prover on the emitted script
 * and classifying its response.
 *
 * @author David J. Pearce
 *
 */
public class SolverOutcomeReader implements OutcomeReader {
	private static final Logger LOGGER = Logger.getLogger(SolverOutcomeReader.class.getName());

	private final SolverProcess process;
	/**
	 * Time limit in seconds, where zero means none.
	 */
	private final int timeLimit;

	public SolverOutcomeReader(SolverProcess process, int timeLimit) {
		this.process = process;
		this.timeLimit = timeLimit;
	}

	@Override
	public Outcome read(String name, Path file, ErrorHandler handler) {
		try {
			SolverProcess.Result result = process.run(file, timeLimit * 1000L);
			if (result.isTimedOut()) {
				LOGGER.log(Level.FINE, "{0} timed out after {1}s", new Object[] { name, timeLimit });
				handler.onResourceExceeded(Outcome.TIMEOUT);
				return Outcome.TIMEOUT;
			}
			Outcome outcome = parseResponse(result.getOutput(), handler);
			if (outcome == Outcome.UNDETERMINED && result.getExitCode() != 0) {
				handler.onProverWarning("prover exited with code " + result.getExitCode());
			}
			return outcome;
		} catch (IOException e) {
			LOGGER.log(Level.WARNING, "failed running prover on " + file, e);
			handler.onProverWarning("failed running prover: " + e.getMessage());
			return Outcome.UNDETERMINED;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			handler.onProverWarning("interrupted whilst waiting for prover");
			return Outcome.UNDETERMINED;
		}
	}

	/**
	 * Classify the response of a prover to a script ending in
	 * <code>(check-sat)</code>. Error responses are reported as warnings, and
	 * anything following a <code>sat</code> response is reported as a
	 * counterexample.
	 *
	 * @param output
	 * @param handler
	 * @return
	 */
	public static Outcome parseResponse(String output, ErrorHandler handler) {
		String[] lines = output.split("\n");
		for (int i = 0; i != lines.length; ++i) {
			String ith = lines[i].trim(); // discards carriage returns
			if (ith.startsWith("(error")) {
				LOGGER.warning(ith);
				handler.onProverWarning(ith);
			} else if (ith.equals("unsat")) {
				return Outcome.VALID;
			} else if (ith.equals("sat")) {
				StringBuilder model = new StringBuilder();
				for (int j = i + 1; j < lines.length; ++j) {
					model.append(lines[j].trim()).append("\n");
				}
				if (model.toString().trim().length() > 0) {
					handler.onCounterexample(model.toString());
				}
				return Outcome.INVALID;
			} else if (ith.equals("unknown")) {
				return Outcome.UNDETERMINED;
			} else if (ith.equals("timeout")) {
				handler.onResourceExceeded(Outcome.TIMEOUT);
				return Outcome.TIMEOUT;
			} else if (ith.equals("memout")) {
				handler.onResourceExceeded(Outcome.OUT_OF_MEMORY);
				return Outcome.OUT_OF_MEMORY;
			}
		}
		return Outcome.UNDETERMINED;
	}
}
