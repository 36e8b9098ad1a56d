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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * A wrapper for running a prover executable on an emitted script.
 *
 * @author David J. Pearce
 */
public class SolverProcess {
	private final Path executable;

	public SolverProcess(Path executable) {
		this.executable = executable;
	}

	/**
	 * Run the prover on a given script.
	 *
	 * @param script
	 * @param timeout Timeout in milliseconds, where zero means none.
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public Result run(Path script, long timeout) throws IOException, InterruptedException {
		// ===================================================
		// Construct command
		// ===================================================
		ArrayList<String> command = new ArrayList<>();
		command.add(executable.toString());
		command.add(script.toString());
		// ===================================================
		// Construct the process
		// ===================================================
		Path output = Files.createTempFile("vc2smt", ".out");
		try {
			ProcessBuilder builder = new ProcessBuilder(command);
			builder.redirectErrorStream(true);
			builder.redirectOutput(output.toFile());
			Process child = builder.start();
			try {
				boolean finished;
				if (timeout > 0) {
					finished = child.waitFor(timeout, TimeUnit.MILLISECONDS);
				} else {
					child.waitFor();
					finished = true;
				}
				String stdout = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
				return new Result(!finished, finished ? child.exitValue() : -1, stdout);
			} finally {
				// make sure child process is destroyed.
				child.destroy();
			}
		} finally {
			Files.deleteIfExists(output);
		}
	}

	public static class Result {
		private final boolean timedOut;
		private final int exitCode;
		private final String output;

		public Result(boolean timedOut, int exitCode, String output) {
			this.timedOut = timedOut;
			this.exitCode = exitCode;
			this.output = output;
		}

		public boolean isTimedOut() {
			return timedOut;
		}

		public int getExitCode() {
			return exitCode;
		}

		/**
		 * Get everything the prover wrote to its standard output and error streams.
		 *
		 * @return
		 */
		public String getOutput() {
			return output;
		}
	}
}
