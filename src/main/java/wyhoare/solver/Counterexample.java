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
package wyhoare.solver;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * An assignment of values to variables under which a verification condition
 * does not hold.
 */
public final class Counterexample {
	private final TreeMap<String, Object> binding;

	public Counterexample(Map<String, Object> binding) {
		this.binding = new TreeMap<>(binding);
	}

	public Set<String> getNames() {
		return Collections.unmodifiableSet(binding.keySet());
	}

	public Object get(String name) {
		return binding.get(name);
	}

	public Map<String, Object> getBinding() {
		return Collections.unmodifiableMap(binding);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Counterexample && binding.equals(((Counterexample) o).binding);
	}

	@Override
	public int hashCode() {
		return binding.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<String, Object> e : binding.entrySet()) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			sb.append(e.getKey()).append(" = ").append(e.getValue());
		}
		return "{" + sb + "}";
	}
}
