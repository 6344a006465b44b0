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
package wyhoare;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wyhoare.core.HoareFile;
import wyhoare.core.SyntacticException;
import wyhoare.io.HoareFileParser;
import wyhoare.io.HoareFilePrinter.Notation;
import wyhoare.io.ReportPrinter;
import wyhoare.tasks.VerificationOptions;
import wyhoare.tasks.VerificationReport;
import wyhoare.tasks.VerifyTask;
import wyhoare.util.MailBox;

public class Main {
	private static final Logger logger = LoggerFactory.getLogger(Main.class);
	/**
	 * Bounds for the automatic discharge of verification conditions.
	 */
	private VerificationOptions options = VerificationOptions.DEFAULT;
	/**
	 * Executor on which triples are verified. By default, triples are verified
	 * one after another on the calling thread.
	 */
	private Executor executor = Runnable::run;
	/**
	 * The outgoing mailbox for diagnostics. Essentially, all parse, scope and
	 * type errors are sent here.
	 */
	private MailBox<SyntacticException> mailbox = new MailBox.PrintStreamMailBox<>(System.err);

	public Main setOptions(VerificationOptions options) {
		this.options = options;
		return this;
	}

	public Main setExecutor(Executor executor) {
		this.executor = executor;
		return this;
	}

	public Main setErrorHandler(MailBox<SyntacticException> mailbox) {
		this.mailbox = mailbox;
		return this;
	}

	/**
	 * Parse and verify a source unit. Syntax errors are fatal to the unit,
	 * although any triple they occur in is still reported.
	 *
	 * @param source Text of the unit.
	 * @return
	 */
	public VerificationReport verify(String source) {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		VerificationReport report;
		try {
			HoareFile unit = new HoareFileParser(source, errors).read();
			report = new VerifyTask(options).verify(unit, executor);
		} catch (SyntacticException e) {
			logger.warn("{}", e.toString());
			errors.send(e);
			report = new VerificationReport(Collections.emptyList(), Collections.emptyList());
		}
		report = report.include(errors.getAll());
		for (SyntacticException e : report.getDiagnostics()) {
			mailbox.send(e);
		}
		return report;
	}

	public VerificationReport verify(Path file) throws IOException {
		return verify(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
	}

	/**
	 * Command-line usage
	 */
	private static final String USAGE = "usage: wyhoare [--maxSteps=n] [--bound=n] [--jobs=n] [--unicode] file...";

	public static void main(String[] _args) throws IOException {
		Arguments args;
		try {
			args = Arguments.parse(_args, VerificationOptions.load());
		} catch (IllegalArgumentException e) {
			System.err.println(e.getMessage());
			System.err.println(USAGE);
			System.exit(2);
			return;
		}
		ExecutorService pool = Executors.newFixedThreadPool(args.getJobs());
		boolean valid = true;
		try {
			Main main = new Main().setOptions(args.getOptions()).setExecutor(pool);
			ReportPrinter printer = new ReportPrinter(System.out, args.getNotation());
			for (Path file : args.getFiles()) {
				System.out.println("=== " + file + " ===");
				VerificationReport report = main.verify(file);
				printer.write(report);
				valid &= report.isValid() && report.getDiagnostics().isEmpty();
			}
		} finally {
			pool.shutdown();
		}
		System.exit(valid ? 0 : 1);
	}

	/**
	 * Command-line arguments, after validation.
	 */
	public static class Arguments {
		private final VerificationOptions options;
		private final Notation notation;
		private final int jobs;
		private final List<Path> files;

		private Arguments(VerificationOptions options, Notation notation, int jobs, List<Path> files) {
			this.options = options;
			this.notation = notation;
			this.jobs = jobs;
			this.files = Collections.unmodifiableList(files);
		}

		/**
		 * Parse the command line, starting from a given set of options.
		 *
		 * @param args
		 * @param defaults
		 * @return
		 * @throws IllegalArgumentException if an option is unknown or has an
		 *                                  invalid value, or no file is given.
		 */
		public static Arguments parse(String[] args, VerificationOptions defaults) {
			VerificationOptions options = defaults;
			Notation notation = Notation.ASCII;
			int jobs = 1;
			ArrayList<Path> files = new ArrayList<>();
			for (String arg : args) {
				if (arg.startsWith("--maxSteps=")) {
					options = options.withMaxSteps(integer(arg));
				} else if (arg.startsWith("--bound=")) {
					options = options.withCounterexampleBound(integer(arg));
				} else if (arg.startsWith("--jobs=")) {
					jobs = integer(arg);
					if (jobs <= 0) {
						throw new IllegalArgumentException("job count must be positive");
					}
				} else if (arg.equals("--unicode")) {
					notation = Notation.UNICODE;
				} else if (arg.startsWith("-")) {
					throw new IllegalArgumentException("unknown option " + arg);
				} else {
					files.add(Paths.get(arg));
				}
			}
			if (files.isEmpty()) {
				throw new IllegalArgumentException("no input files");
			}
			return new Arguments(options, notation, jobs, files);
		}

		public VerificationOptions getOptions() {
			return options;
		}

		public Notation getNotation() {
			return notation;
		}

		public int getJobs() {
			return jobs;
		}

		public List<Path> getFiles() {
			return files;
		}

		private static int integer(String arg) {
			String value = arg.substring(arg.indexOf('=') + 1);
			try {
				return Integer.parseInt(value);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("invalid integer in " + arg, e);
			}
		}
	}
}
