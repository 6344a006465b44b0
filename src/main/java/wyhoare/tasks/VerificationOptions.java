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
package wyhoare.tasks;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds which govern the automatic discharge of verification conditions.
 * Options are passed explicitly to each task, rather than held globally, so
 * that independent verification runs can proceed in parallel with different
 * settings.
 */
public final class VerificationOptions {
	private static final Logger logger = LoggerFactory.getLogger(VerificationOptions.class);

	public static final String MAX_STEPS = "wyhoare.verify.maxSteps";
	public static final String COUNTEREXAMPLE_BOUND = "wyhoare.verify.counterexampleBound";
	/**
	 * Classpath resource consulted by {@link #load()}.
	 */
	public static final String RESOURCE = "/wyhoare.properties";

	public static final int DEFAULT_MAX_STEPS = 10000;
	public static final int DEFAULT_COUNTEREXAMPLE_BOUND = 8;

	public static final VerificationOptions DEFAULT = new VerificationOptions(DEFAULT_MAX_STEPS,
			DEFAULT_COUNTEREXAMPLE_BOUND);

	/**
	 * Maximum number of steps for normalisation, and for the decision
	 * procedure on each verification condition.
	 */
	private final int maxSteps;
	/**
	 * Largest magnitude of integer tried during counterexample search.
	 */
	private final int counterexampleBound;

	public VerificationOptions(int maxSteps, int counterexampleBound) {
		if (maxSteps <= 0) {
			throw new IllegalArgumentException("maxSteps must be positive (was " + maxSteps + ")");
		} else if (counterexampleBound < 0) {
			throw new IllegalArgumentException(
					"counterexampleBound cannot be negative (was " + counterexampleBound + ")");
		}
		this.maxSteps = maxSteps;
		this.counterexampleBound = counterexampleBound;
	}

	public int getMaxSteps() {
		return maxSteps;
	}

	public int getCounterexampleBound() {
		return counterexampleBound;
	}

	public VerificationOptions withMaxSteps(int maxSteps) {
		return new VerificationOptions(maxSteps, counterexampleBound);
	}

	public VerificationOptions withCounterexampleBound(int bound) {
		return new VerificationOptions(maxSteps, bound);
	}

	/**
	 * Construct options from a set of properties, using the defaults for any
	 * key which is not present.
	 *
	 * @param properties
	 * @return
	 * @throws IllegalArgumentException if a value is not a valid integer, or is
	 *                                  out of range.
	 */
	public static VerificationOptions fromProperties(Properties properties) {
		int maxSteps = integer(properties, MAX_STEPS, DEFAULT_MAX_STEPS);
		int bound = integer(properties, COUNTEREXAMPLE_BOUND, DEFAULT_COUNTEREXAMPLE_BOUND);
		return new VerificationOptions(maxSteps, bound);
	}

	/**
	 * Load options from the classpath resource {@value #RESOURCE}, or return
	 * the defaults if there is no such resource.
	 *
	 * @return
	 */
	public static VerificationOptions load() {
		try (InputStream in = VerificationOptions.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				logger.debug("no {} on classpath, using defaults", RESOURCE);
				return DEFAULT;
			}
			Properties properties = new Properties();
			properties.load(in);
			VerificationOptions options = fromProperties(properties);
			logger.debug("loaded {} from {}", options, RESOURCE);
			return options;
		} catch (IOException e) {
			throw new UncheckedIOException("failed reading " + RESOURCE, e);
		}
	}

	private static int integer(Properties properties, String key, int def) {
		String value = properties.getProperty(key);
		if (value == null) {
			return def;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("invalid value for " + key + ": " + value, e);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof VerificationOptions) {
			VerificationOptions v = (VerificationOptions) o;
			return maxSteps == v.maxSteps && counterexampleBound == v.counterexampleBound;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return maxSteps * 31 + counterexampleBound;
	}

	@Override
	public String toString() {
		return "{maxSteps=" + maxSteps + ", counterexampleBound=" + counterexampleBound + "}";
	}
}
