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

import static java.util.Objects.requireNonNull;

/**
 * Immutable incremental view of a session, as returned by {@link DeltaUpdateManager#poll(SessionId, Cursor)}.
 * <p>
 * A snapshot is taken atomically: when {@link #state()} is terminal, every result and log line the
 * operation produced before terminating is included (after the cursor that was supplied).
 * An empty {@link #results()} does not mean the session is over; callers must check {@link #state()}.
 *
 * @param sessionId      the session this snapshot describes
 * @param results        results produced after the supplied cursor, in production order
 * @param logOutput      log text produced after the supplied cursor; empty when nothing new
 * @param outputLocation location of the operation's artifacts, or {@code null} if none was reported
 * @param state          the session state at the time of the snapshot
 * @param error          the failure cause when {@code state} is {@link SessionState#FAILED}, {@code null} otherwise
 * @param nextCursor     the cursor to supply on the next poll
 * @param <F>            the result fragment type
 */
public record DeltaSnapshot<F>(
  SessionId sessionId,
  List<F> results,
  String logOutput,
  String outputLocation,
  SessionState state,
  Throwable error,
  Cursor nextCursor
) {

  public DeltaSnapshot {
    requireNonNull(sessionId, "sessionId must not be null");
    requireNonNull(state, "state must not be null");
    requireNonNull(nextCursor, "nextCursor must not be null");
    results = results == null ? List.of() : List.copyOf(results);
    logOutput = logOutput == null ? "" : logOutput;
  }

  /**
   * @return {@code true} if the session will not change anymore
   */
  public boolean isTerminal() {
    return state.isTerminal();
  }

  /**
   * @return {@code true} if this snapshot carries an error
   */
  public boolean hasError() {
    return error != null;
  }

  /**
   * @return the error message, {@code error.toString()} when the error has no message, or {@code null} without error
   */
  public String errorMessage() {
    if (error == null) return null;
    return error.getMessage() != null ? error.getMessage() : error.toString();
  }

  @Override
  public String toString() {
    return "DeltaSnapshot{" +
      "sessionId=" + sessionId +
      ", results=" + results.size() +
      ", logOutput=" + logOutput.length() + " chars" +
      ", outputLocation='" + outputLocation + '\'' +
      ", state=" + state +
      ", error=" + errorMessage() +
      ", nextCursor=" + nextCursor +
      '}';
  }
}
