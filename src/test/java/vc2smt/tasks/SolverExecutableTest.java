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

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SolverExecutableTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Before
	@After
	public void clear() {
		SolverExecutable.clearCache();
	}

	@Test
	public void test_explicit_missing() throws IOException {
		Path dir = folder.getRoot().toPath();
		Path missing = dir.resolve("missing");
		try {
			SolverExecutable.resolve(missing.toString(), "z3", dir);
			fail("expected exception");
		} catch (ProverException e) {
			assertEquals("Cannot find prover specified with PROVER_PATH: " + missing, e.getMessage());
		}
	}

	@Test
	public void test_conventional_missing() {
		Path dir = folder.getRoot().toPath();
		try {
			SolverExecutable.resolve(null, "z3", dir);
			fail("expected exception");
		} catch (ProverException e) {
			assertEquals("Cannot find executable: " + dir.resolve("z3"), e.getMessage());
		}
	}

	@Test
	public void test_conventional_found() throws IOException, ProverException {
		Path dir = folder.getRoot().toPath();
		Path z3 = Files.createFile(dir.resolve("z3"));
		assertEquals(z3, SolverExecutable.resolve(null, "z3", dir));
	}

	@Test
	public void test_explicit_found() throws IOException, ProverException {
		Path dir = folder.getRoot().toPath();
		Path solver = Files.createFile(dir.resolve("solver"));
		// An explicit path takes precedence over the conventional one
		Files.createFile(dir.resolve("z3"));
		assertEquals(solver, SolverExecutable.resolve(solver.toString(), "z3", dir));
	}

	@Test
	public void test_cached() throws IOException, ProverException {
		Path first = folder.newFile("first").toPath();
		Path second = folder.newFile("second").toPath();
		assertEquals(first, SolverExecutable.find(new ProverOptions().setProverPath(first.toString())));
		assertEquals(first, SolverExecutable.find(new ProverOptions().setProverPath(second.toString())));
		SolverExecutable.clearCache();
		assertEquals(second, SolverExecutable.find(new ProverOptions().setProverPath(second.toString())));
	}
}
