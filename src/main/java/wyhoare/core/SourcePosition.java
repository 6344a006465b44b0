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

/**
 * A line and column within a source unit. Both are counted from one.
 */
public final class SourcePosition {
	public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

	private final int line;
	private final int column;

	public SourcePosition(int line, int column) {
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof SourcePosition) {
			SourcePosition p = (SourcePosition) o;
			return line == p.line && column == p.column;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return line * 1021 + column;
	}

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
