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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import vc2smt.core.Logic;
import vc2smt.core.Logic.Expr;
import vc2smt.core.Polarity;
import vc2smt.core.SessionState;
import vc2smt.erasure.TypeEncoding;
import vc2smt.io.SMTLibExprLinearizer;
import vc2smt.io.SMTLibNamer;
import vc2smt.io.TypeDeclCollector;
import vc2smt.transform.LetBindingSorter;

/**
 * <p>
 * A prover which communicates through SMT-LIB2 scripts. Each check produces a
 * complete, self-contained script consisting of:
 * </p>
 * <ol>
 * <li>The background predicates.</li>
 * <li>A <code>set-info</code> command identifying the check.</li>
 * <li>The commands supplied by the prover context.</li>
 * <li>Every declaration produced so far in this session.</li>
 * <li>Every axiom produced so far in this session.</li>
 * <li>The negated verification condition, followed by
 * <code>(check-sat)</code>.</li>
 * </ol>
 * <p>
 * Declarations and axioms accumulate over the session, hence the script for a
 * later check always contains everything emitted for earlier ones. The
 * background axioms of the prover context are translated once only, on the
 * first check. Instances are not thread-safe.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class SMTLibProcessTheoremProver {
	private static final Logger LOGGER = Logger.getLogger(SMTLibProcessTheoremProver.class.getName());
	/**
	 * Linearising taking longer than this (in nanoseconds) is reported.
	 */
	private static final long SLOW_LINEARISATION = 500_000_000L;

	private final SMTLibProverOptions options;
	private final ProverContext context;
	private final BackgroundPredicates backgroundPredicates;
	private final TypeEncoding encoding;
	private final SMTLibNamer namer = new SMTLibNamer();
	private final TypeDeclCollector declCollector = new TypeDeclCollector(namer);
	private final SessionState session = new SessionState();
	private OutcomeReader outcomeReader = OutcomeReader.UNDETERMINED;
	private String currentName;
	private Path currentFile;
	private ErrorHandler currentHandler;

	public SMTLibProcessTheoremProver(SMTLibProverOptions options, ProverContext context,
			BackgroundPredicates backgroundPredicates) {
		this.options = Preconditions.checkNotNull(options, "options");
		this.context = Preconditions.checkNotNull(context, "context");
		this.backgroundPredicates = Preconditions.checkNotNull(backgroundPredicates, "backgroundPredicates");
		this.encoding = TypeEncoding.create(options.getTypeEncoding());
	}

	public SMTLibProcessTheoremProver setOutcomeReader(OutcomeReader reader) {
		this.outcomeReader = Preconditions.checkNotNull(reader);
		return this;
	}

	public SessionState getSession() {
		return session;
	}

	public TypeEncoding getEncoding() {
		return encoding;
	}

	/**
	 * Emit the script for checking a given verification condition. The script is
	 * first written into a temporary file alongside its destination, and only
	 * moved into place once complete. Hence, a failure never leaves a partial
	 * script behind.
	 *
	 * @param name    Descriptive name of the check, used for the filename.
	 * @param vc      The verification condition to be proved.
	 * @param handler Receives the counterexamples, warnings and resource limits
	 *                reported when the outcome is determined.
	 * @return The path of the emitted script.
	 * @throws IOException if the script could not be written.
	 */
	public Path beginCheck(String name, Expr vc, ErrorHandler handler) throws IOException {
		Preconditions.checkNotNull(handler, "handler");
		Path file = Paths.get(options.getOutputFile(name)).toAbsolutePath();
		LOGGER.log(Level.FINE, "Checking {0} into {1}", new Object[] { name, file });
		Path directory = file.getParent();
		if (directory != null) {
			Files.createDirectories(directory);
		}
		Path tmp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
		boolean written = false;
		try {
			try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
				writeLine(out, backgroundPredicates.getText());
				writeLine(out, "(set-info :vc-id " + SMTLibNamer.quoteId(name) + ")");
				setupAxioms();
				String goal = "(assert (not\n" + vcExprToString(vc, Polarity.POSITIVE) + "\n))";
				writeLine(out, context.getProverCommands());
				for (String declaration : session.getDeclarations()) {
					writeLine(out, declaration);
				}
				for (String axiom : session.getAxioms()) {
					if (!axiom.equals("true")) {
						writeLine(out, "(assert " + axiom + ")");
					}
				}
				writeLine(out, goal);
				writeLine(out, "(check-sat)");
			}
			move(tmp, file);
			written = true;
		} finally {
			if (!written) {
				deleteQuietly(tmp);
			}
		}
		currentName = name;
		currentFile = file;
		currentHandler = handler;
		return file;
	}

	/**
	 * Determine the outcome of the most recent check, reporting to the handler it
	 * was begun with.
	 *
	 * @return
	 */
	public Outcome checkOutcome() {
		if (currentFile == null) {
			throw new IllegalStateException("no check has begun");
		}
		return outcomeReader.read(currentName, currentFile, currentHandler);
	}

	/**
	 * Translate the background axioms of the prover context. This happens only
	 * once per session. A top-level conjunction is split into separate axioms,
	 * and trivial ones are dropped.
	 */
	private void setupAxioms() {
		if (!session.isBackgroundSetupDone()) {
			Expr axioms = context.getAxioms();
			List<Expr> conjuncts;
			if (axioms instanceof Expr.Operator && ((Expr.Operator) axioms).getKind() == Expr.Operator.Kind.AND) {
				conjuncts = ((Expr.Operator) axioms).getOperands();
			} else {
				conjuncts = Collections.singletonList(axioms);
			}
			for (Expr axiom : conjuncts) {
				String text = vcExprToString(axiom, Polarity.NEGATIVE);
				if (!text.equals("true")) {
					session.addAxiom(text);
				}
			}
			session.markBackgroundSetupDone();
		}
	}

	/**
	 * Translate an expression into SMT-LIB2 text. Along the way, any axioms
	 * introduced by type erasure and any declarations needed by the expression or
	 * those axioms are added to the session.
	 *
	 * @param expr
	 * @param polarity
	 * @return
	 */
	String vcExprToString(Expr expr, Polarity polarity) {
		long start = System.nanoTime();
		Expr erased = encoding.erase(expr, polarity);
		LetBindingSorter sorter = new LetBindingSorter();
		Expr sorted = sorter.sort(erased);
		Expr axioms = sorter.sort(encoding.getNewAxioms());
		declCollector.collect(axioms);
		declCollector.collect(sorted);
		for (String declaration : declCollector.getNewDeclarations()) {
			session.addDeclaration(declaration);
		}
		if (!Logic.isTrue(axioms)) {
			session.addAxiom(SMTLibExprLinearizer.toString(axioms, namer, options));
		}
		String text = SMTLibExprLinearizer.toString(sorted, namer, options);
		long elapsed = System.nanoTime() - start;
		if (elapsed > SLOW_LINEARISATION) {
			LOGGER.log(Level.FINE, "Linearising took {0}ms", elapsed / 1_000_000);
		}
		return text;
	}

	private static void writeLine(Writer out, String text) throws IOException {
		if (!text.isEmpty()) {
			out.write(text.replace("\r\n", "\n").replace('\r', '\n'));
			out.write('\n');
		}
	}

	private static void move(Path from, Path to) throws IOException {
		try {
			Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static void deleteQuietly(Path file) {
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			LOGGER.log(Level.WARNING, "cannot delete " + file, e);
		}
	}
}
