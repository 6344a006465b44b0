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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * A destination for messages (typically diagnostics) produced while
 * processing a source unit.
 *
 * @param <T>
 */
public interface MailBox<T> {

	public void send(T message);

	/**
	 * A mailbox which retains every message it receives, in order.
	 */
	public static class Buffered<T> implements MailBox<T> {
		private final ArrayList<T> messages = new ArrayList<>();

		@Override
		public synchronized void send(T message) {
			messages.add(message);
		}

		public synchronized List<T> getAll() {
			return new ArrayList<>(messages);
		}

		public synchronized boolean isEmpty() {
			return messages.isEmpty();
		}
	}

	/**
	 * A mailbox which prints every message it receives.
	 */
	public static class PrintStreamMailBox<T> implements MailBox<T> {
		private final PrintStream out;

		public PrintStreamMailBox(PrintStream out) {
			this.out = out;
		}

		@Override
		public void send(T message) {
			out.println(message);
		}
	}
}
