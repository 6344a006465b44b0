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

import java.util.concurrent.CompletableFuture;

/**
 * A collaborator which refers open verification conditions to a human
 * reviewer. Since a decision may take arbitrarily long to arrive, a request
 * returns immediately with a future for the decision.
 */
@FunctionalInterface
public interface ReviewBoundary {

	public CompletableFuture<ReviewDecision> review(ReviewRequest request);
}
