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

/**
 * Capability the {@link DeltaUpdateManager} uses to start operations.
 * <p>
 * The manager knows nothing of an operation's internals: it hands the request through unchanged,
 * gives the operation a reporter bound to its session, and keeps the returned handle to signal
 * cancellation.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #start} must return promptly; the work itself runs on the operation's own execution context.</li>
 *   <li>The operation must eventually call {@link OperationReporter#reportOutcome(OperationOutcome)} exactly once.</li>
 *   <li>Exceptions thrown by {@link #start} abort the session creation and are rethrown to the caller
 *       of {@link DeltaUpdateManager#startSession(SessionId, Object)}.</li>
 * </ul>
 *
 * @param <R> the request type
 * @param <F> the result fragment type
 */
@FunctionalInterface
public interface OperationFactory<R, F> {

  /**
   * Starts an operation for the given session.
   *
   * @param sessionId the session the operation belongs to
   * @param request   the caller's request, already validated
   * @param reporter  the channel to report results, logs and the final outcome
   * @return a handle used to signal cancellation; never {@code null}
   */
  OperationHandle start(SessionId sessionId, R request, OperationReporter<F> reporter);
}
