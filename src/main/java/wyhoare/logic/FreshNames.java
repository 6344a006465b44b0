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
package wyhoare.logic;

import java.util.HashSet;
import java.util.Set;

/**
 * Generates variable names which are guaranteed not to clash with a given
 * set of names. Each verification run owns exactly one generator, so the
 * names produced for a given triple are always the same.
 */
public class FreshNames {
	private final HashSet<String> issued = new HashSet<>();
	private int counter;

	/**
	 * Generate a fresh variable name derived from a given base name.
	 *
	 * @param base  Name being replaced, used as the prefix of the result.
	 * @param avoid Names which the result must not equal.
	 * @return
	 */
	public String fresh(String base, Set<String> avoid) {
		String root = strip(base);
		while (true) {
			String candidate = root + "_" + (++counter);
			if (!avoid.contains(candidate) && issued.add(candidate)) {
				return candidate;
			}
		}
	}

	/**
	 * Number of names issued so far.
	 */
	public int size() {
		return counter;
	}

	/**
	 * Remove any numeric suffix introduced by an earlier renaming, so that
	 * repeated renaming yields <code>y_2</code> rather than <code>y_1_2</code>.
	 */
	private static String strip(String name) {
		int i = name.lastIndexOf('_');
		if (i > 0 && i < name.length() - 1) {
			for (int j = i + 1; j < name.length(); ++j) {
				if (!Character.isDigit(name.charAt(j))) {
					return name;
				}
			}
			return name.substring(0, i);
		}
		return name;
	}
}
