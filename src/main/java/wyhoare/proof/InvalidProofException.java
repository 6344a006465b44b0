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
package wyhoare.proof;

/**
 * Signals that a proof rule was applied to premises which do not have the
 * form the rule requires.
 */
public class InvalidProofException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public InvalidProofException(String message) {
		super(message);
	}
}
