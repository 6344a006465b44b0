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

import static org.junit.jupiter.api.Assertions.fail;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import wyhoare.core.SyntacticException;
import wyhoare.tasks.VerificationReport;
import wyhoare.util.MailBox;

/**
 * Run through all test files. Every triple in a valid test file must be
 * verified. An invalid test file must either be rejected by the parser or
 * type checker, or contain a triple which is not verified. Note that an
 * internal failure does not count as either, and indicates the test exposed
 * some kind of bug.
 */
public class HoareFileTests {
	public enum Error {
		OK, // Every triple verified
		FAILED_CHECK, // Test did not parse or type check
		FAILED_VERIFY, // Some triple was not verified
	}

	/**
	 * The directory containing the valid source files for each test case. Every test
	 * corresponds to a file in this directory.
	 */
	public final static Path VALID_SRC_DIR = Paths.get("tests/valid");
	/**
	 * The directory containing the invalid source files for each test case. Every test
	 * corresponds to a file in this directory.
	 */
	public final static Path INVALID_SRC_DIR = Paths.get("tests/invalid");

	// ======================================================================
	// Test Harness
	// ======================================================================

	@ParameterizedTest
	@MethodSource("validSourceFiles")
	public void testValid(String name) throws IOException {
		Error e = verify(VALID_SRC_DIR, name);
		if (e != Error.OK) {
			fail("Test failed to verify (" + e + ")! " + name);
		}
	}

	@ParameterizedTest
	@MethodSource("invalidSourceFiles")
	public void testInvalid(String name) throws IOException {
		Error e = verify(INVALID_SRC_DIR, name);
		if (e == Error.OK) {
			fail("Test should have failed to check / verify! " + name);
		}
	}

	/**
	 * Parse, check and verify a given test file.
	 *
	 * @param dir
	 * @param name
	 * @return
	 * @throws IOException
	 */
	public static Error verify(Path dir, String name) throws IOException {
		MailBox.Buffered<SyntacticException> errors = new MailBox.Buffered<>();
		VerificationReport report = new Main().setErrorHandler(errors).verify(dir.resolve(name + ".hoare"));
		if (!errors.isEmpty()) {
			return Error.FAILED_CHECK;
		} else if (!report.isValid()) {
			return Error.FAILED_VERIFY;
		} else {
			return Error.OK;
		}
	}

	// ======================================================================
	// Data sources
	// ======================================================================

	// Here we enumerate all available test cases.
	private static Stream<String> validSourceFiles() throws IOException {
		return readTestFiles(VALID_SRC_DIR);
	}

	private static Stream<String> invalidSourceFiles() throws IOException {
		return readTestFiles(INVALID_SRC_DIR);
	}

	public static Stream<String> readTestFiles(Path dir) throws IOException {
		ArrayList<String> testcases = new ArrayList<>();
		try (Stream<Path> files = Files.walk(dir, 1)) {
			files.forEach(f -> {
				String name = f.getFileName().toString();
				if (name.endsWith(".hoare")) {
					testcases.add(name.replace(".hoare", ""));
				}
			});
		}
		// Sort the result by filename
		Collections.sort(testcases);
		return testcases.stream();
	}
}
