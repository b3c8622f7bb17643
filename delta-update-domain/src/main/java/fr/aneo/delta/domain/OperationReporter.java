/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.delta.domain;

import java.util.List;

/**
 * Push channel through which a running operation reports its progress to the session it belongs to.
 * <p>
 * A reporter is bound to exactly one session, and the operation is its only writer: calls must
 * therefore be issued in production order, typically from the operation's own thread. Every
 * report is visible to any poll that starts after the call returns.
 *
 * <h2>After Termination</h2>
 * <p>
 * Once {@link #reportOutcome(OperationOutcome)} has been accepted, the session is final and all
 * further reports are ignored.
 *
 * @param <F> the type of result fragments
 * @see OperationFactory
 */
public interface OperationReporter<F> {

  /**
   * Appends one result fragment to the session.
   *
   * @param result the fragment; must not be {@code null}
   * @throws NullPointerException if {@code result} is {@code null}
   */
  void reportResult(F result);

  /**
   * Appends several result fragments to the session, atomically with respect to pollers.
   *
   * @param results the fragments in production order; must not be {@code null}
   * @throws NullPointerException if {@code results} or any element is {@code null}
   */
  void reportResults(List<F> results);

  /**
   * Appends text to the session log. Blank and empty strings are accepted and kept as-is.
   *
   * @param text the log text; must not be {@code null}
   */
  void reportLog(String text);

  /**
   * Records where the operation stores its artifacts, for instance an XCTest result bundle path.
   *
   * @param location the location; must not be {@code null}
   */
  void reportOutputLocation(String location);

  /**
   * Reports the final outcome of the operation and moves the session to a terminal state.
   *
   * @param outcome the outcome; must not be {@code null}
   */
  void reportOutcome(OperationOutcome outcome);
}
