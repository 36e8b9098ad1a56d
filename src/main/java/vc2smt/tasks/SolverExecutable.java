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

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Locates the prover executable. An explicitly configured path always takes
 * priority, and must exist. Otherwise, the executable is expected next to the
 * installation of this library (i.e. in the directory holding its jar). The
 * resolved path is cached for the lifetime of the process.
 *
 * @author David J. Pearce
 *
 */
public class SolverExecutable {
	private static final Logger LOGGER = Logger.getLogger(SolverExecutable.class.getName());

	private static Path proverPath;

	/**
	 * Determine the prover executable, resolving it on first use.
	 *
	 * @param options
	 * @return
	 * @throws ProverException if the executable cannot be found.
	 */
	public static synchronized Path find(ProverOptions options) throws ProverException {
		if (proverPath == null) {
			proverPath = resolve(options.getProverPath(), options.getProverName(), getInstallationDirectory());
		}
		return proverPath;
	}

	/**
	 * Resolve the prover executable without consulting the cache.
	 *
	 * @param explicitPath Configured path of the executable, or <code>null</code>.
	 * @param name         Conventional name of the executable.
	 * @param directory    Directory in which to look for the conventional name.
	 * @return
	 * @throws ProverException if the executable cannot be found.
	 */
	static Path resolve(String explicitPath, String name, Path directory) throws ProverException {
		if (explicitPath != null) {
			Path p = Paths.get(explicitPath);
			if (!Files.exists(p)) {
				throw new ProverException("Cannot find prover specified with PROVER_PATH: " + p);
			}
			LOGGER.log(Level.FINE, "Using prover: {0}", p);
			return p;
		}
		Path p = directory.resolve(name);
		if (!Files.exists(p)) {
			throw new ProverException("Cannot find executable: " + p);
		}
		LOGGER.log(Level.FINE, "Using prover: {0}", p);
		return p;
	}

	/**
	 * Determine the directory from which this library was loaded.
	 *
	 * @return
	 * @throws ProverException
	 */
	static Path getInstallationDirectory() throws ProverException {
		try {
			Path location = Paths.get(SolverExecutable.class.getProtectionDomain().getCodeSource().getLocation().toURI());
			return Files.isDirectory(location) ? location : location.getParent();
		} catch (URISyntaxException | SecurityException e) {
			throw new ProverException("cannot determine installation directory", e);
		}
	}

	static synchronized void clearCache() {
		proverPath = null;
	}
}
