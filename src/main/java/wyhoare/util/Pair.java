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
package wyhoare.util;

import java.util.Objects;

public class Pair<S, T> {
	private final S first;
	private final T second;

	public Pair(S first, T second) {
		this.first = first;
		this.second = second;
	}

	public S first() {
		return first;
	}

	public T second() {
		return second;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Pair) {
			Pair<?, ?> p = (Pair<?, ?>) o;
			return Objects.equals(first, p.first) && Objects.equals(second, p.second);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(first) * 31 + Objects.hashCode(second);
	}

	@Override
	public String toString() {
		return "(" + first + "," + second + ")";
	}
}
