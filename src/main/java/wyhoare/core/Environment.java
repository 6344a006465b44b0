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
package wyhoare.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import wyhoare.core.HoareFile.Decl;
import wyhoare.core.HoareFile.Type;

/**
 * Maps program variables to their declared types. An environment is built
 * once for a source unit and is shared, read-only, by every triple verified
 * against that unit.
 */
public final class Environment {
	private final Map<String, Type> types;

	private Environment(Map<String, Type> types) {
		this.types = Collections.unmodifiableMap(types);
	}

	/**
	 * Construct an environment from a list of declarations.
	 *
	 * @param declarations
	 * @return
	 * @throws ScopeError if the same variable is declared more than once.
	 */
	public static Environment of(List<Decl.Variable> declarations) {
		LinkedHashMap<String, Type> types = new LinkedHashMap<>();
		for (Decl.Variable v : declarations) {
			if (types.containsKey(v.getName())) {
				throw new ScopeError("variable " + v.getName() + " already declared",
						v.getAttribute(SourcePosition.class));
			}
			types.put(v.getName(), v.getType());
		}
		return new Environment(types);
	}

	public static Environment of(HoareFile unit) {
		return of(unit.getVariables());
	}

	public boolean contains(String name) {
		return types.containsKey(name);
	}

	/**
	 * Get the declared type of a variable, or <code>null</code> if it is not
	 * declared.
	 */
	public Type getType(String name) {
		return types.get(name);
	}

	public Set<String> getNames() {
		return types.keySet();
	}

	@Override
	public String toString() {
		return types.toString();
	}
}
