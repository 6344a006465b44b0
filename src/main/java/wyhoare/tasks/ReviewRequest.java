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

import wyhoare.io.HoareFilePrinter;

/**
 * A verification condition referred for review.
 */
public final class ReviewRequest {
	private final String triple;
	private final int index;
	private final String obligation;
	private final Origin origin;

	public ReviewRequest(String triple, int index, VerificationCondition vc) {
		this.triple = triple;
		this.index = index;
		this.obligation = HoareFilePrinter.toString(vc.getNormalisedObligation());
		this.origin = vc.getOrigin();
	}

	public String getTriple() {
		return triple;
	}

	/**
	 * Position of the condition within its triple's sequence of conditions.
	 */
	public int getIndex() {
		return index;
	}

	public String getObligation() {
		return obligation;
	}

	public Origin getOrigin() {
		return origin;
	}

	@Override
	public String toString() {
		return triple + "#" + index + " (" + origin + "): " + obligation;
	}
}
