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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class VerificationOptionsTests {

	@Test
	public void testDefaults() {
		VerificationOptions options = VerificationOptions.DEFAULT;
		assertEquals(10000, options.getMaxSteps());
		assertEquals(8, options.getCounterexampleBound());
		assertEquals("{maxSteps=10000, counterexampleBound=8}", options.toString());
	}

	@Test
	public void testLoad() {
		assertEquals(VerificationOptions.DEFAULT, VerificationOptions.load());
	}

	@Test
	public void testFromProperties() {
		Properties properties = new Properties();
		properties.setProperty(VerificationOptions.MAX_STEPS, " 250 ");
		VerificationOptions options = VerificationOptions.fromProperties(properties);
		assertEquals(250, options.getMaxSteps());
		assertEquals(VerificationOptions.DEFAULT_COUNTEREXAMPLE_BOUND, options.getCounterexampleBound());
		properties.setProperty(VerificationOptions.COUNTEREXAMPLE_BOUND, "0");
		assertEquals(new VerificationOptions(250, 0), VerificationOptions.fromProperties(properties));
		assertEquals(VerificationOptions.DEFAULT, VerificationOptions.fromProperties(new Properties()));
	}

	@Test
	public void testInvalidProperties() {
		Properties properties = new Properties();
		properties.setProperty(VerificationOptions.COUNTEREXAMPLE_BOUND, "lots");
		assertThrows(IllegalArgumentException.class, () -> VerificationOptions.fromProperties(properties));
		properties.setProperty(VerificationOptions.COUNTEREXAMPLE_BOUND, "-1");
		assertThrows(IllegalArgumentException.class, () -> VerificationOptions.fromProperties(properties));
	}

	@Test
	public void testOutOfRange() {
		assertThrows(IllegalArgumentException.class, () -> new VerificationOptions(0, 8));
		assertThrows(IllegalArgumentException.class, () -> new VerificationOptions(10, -1));
		assertThrows(IllegalArgumentException.class, () -> VerificationOptions.DEFAULT.withMaxSteps(-5));
	}

	@Test
	public void testWith() {
		VerificationOptions options = VerificationOptions.DEFAULT.withMaxSteps(7).withCounterexampleBound(3);
		assertEquals(new VerificationOptions(7, 3), options);
		assertEquals(new VerificationOptions(7, 3).hashCode(), options.hashCode());
		assertNotEquals(VerificationOptions.DEFAULT, options);
	}
}
