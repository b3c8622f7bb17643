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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledFuture;

import static fr.aneo.delta.domain.SessionState.PENDING;
import static fr.aneo.delta.domain.SessionState.RUNNING;
import static java.lang.Math.max;
import static java.lang.Math.min;
import static java.util.Objects.requireNonNull;

/**
 * One tracked run of an operation, owned by a {@link SessionRegistry}.
 * <p>
 * A session accumulates the results and log output reported by its operation and serves
 * incremental snapshots of them to pollers. Results and log are append-only: once added, an element
 * keeps its position forever.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The operation (single producer) and any number of pollers access a session concurrently. Every
 * mutation and every snapshot runs under the session's own monitor, so a snapshot never mixes a
 * state with a partial set of results: if it reports a terminal state, it includes everything the
 * operation reported before terminating. Critical sections only copy the requested slice, never
 * wait for the operation.
 * <p>
 * Once terminal, a session never changes again and releases its {@link OperationHandle}.
 *
 * @param <F> the result fragment type
 * @see SessionRegistry
 * @see DeltaSnapshot
 */
public final class Session<F> {

  private final SessionId id;
  private final Clock clock;
  private final Instant createdAt;
  private final Object lock = new Object();
  private final List<F> results = new ArrayList<>();
  private final StringBuilder log = new StringBuilder();
  private final CompletableFuture<SessionState> termination = new CompletableFuture<>();

  private SessionState state = PENDING;
  private Throwable error;
  private String outputLocation;
  private Instant terminatedAt;
  private OperationHandle operation;
  private boolean cancellationRequested;
  private ScheduledFuture<?> expiryTimer;

  Session(SessionId id, Clock clock) {
    this.id = requireNonNull(id, "id must not be null");
    this.clock = requireNonNull(clock, "clock must not be null");
    this.createdAt = clock.instant();
  }

  public SessionId id() {
    return id;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public SessionState state() {
    synchronized (lock) {
      return state;
    }
  }

  public boolean isTerminal() {
    return state().isTerminal();
  }

  /**
   * @return the instant the session reached a terminal state, or {@code null} while it is live
   */
  public Instant terminatedAt() {
    synchronized (lock) {
      return terminatedAt;
    }
  }

  /**
   * @return {@code true} once {@link DeltaUpdateManager#terminate(SessionId)} has been requested
   */
  public boolean isCancellationRequested() {
    synchronized (lock) {
      return cancellationRequested;
    }
  }

  /**
   * Returns a stage completed with the terminal state once the session terminates.
   *
   * @return the termination stage; already completed for terminal sessions
   */
  public CompletionStage<SessionState> termination() {
    return termination.minimalCompletionStage();
  }

  /**
   * Takes an atomic snapshot of everything produced after {@code cursor}.
   * <p>
   * Positions beyond what the session holds are clamped: the delta is empty and the returned
   * {@link DeltaSnapshot#nextCursor()} never moves backwards from the supplied cursor.
   * The cost is proportional to the size of the delta, not to the session history.
   *
   * @param cursor the poller's cursor; must not be {@code null}
   * @return the snapshot
   */
  public DeltaSnapshot<F> snapshot(Cursor cursor) {
    requireNonNull(cursor, "cursor must not be null");

    synchronized (lock) {
      int resultCount = results.size();
      int logLength = log.length();
      var newResults = results.subList(min(cursor.resultPosition(), resultCount), resultCount);
      var newLog = log.substring(min(cursor.logPosition(), logLength));
      var nextCursor = new Cursor(max(cursor.resultPosition(), resultCount), max(cursor.logPosition(), logLength));

      return new DeltaSnapshot<>(id, newResults, newLog, outputLocation, state, error, nextCursor);
    }
  }

  boolean appendResults(List<F> fragments) {
    synchronized (lock) {
      if (state.isTerminal()) return false;
      results.addAll(fragments);
      markRunningLocked();
      return true;
    }
  }

  boolean appendLog(String text) {
    synchronized (lock) {
      if (state.isTerminal()) return false;
      log.append(text);
      markRunningLocked();
      return true;
    }
  }

  boolean updateOutputLocation(String location) {
    synchronized (lock) {
      if (state.isTerminal()) return false;
      outputLocation = location;
      return true;
    }
  }

  /**
   * Binds the started operation to this session and moves it to {@link SessionState#RUNNING}.
   *
   * @return {@code true} if a cancellation was requested before the handle existed and must now be
   * forwarded to it
   */
  boolean attach(OperationHandle handle) {
    synchronized (lock) {
      if (state.isTerminal()) return false;
      operation = handle;
      markRunningLocked();
      return cancellationRequested;
    }
  }

  /**
   * Records a cancellation request.
   *
   * @return the handle to signal, or {@code null} when the session is terminal, was already asked
   * to stop, or has no handle yet (the request is then forwarded by {@link #attach})
   */
  OperationHandle requestCancellation() {
    synchronized (lock) {
      if (state.isTerminal() || cancellationRequested) return null;
      cancellationRequested = true;
      return operation;
    }
  }

  /**
   * Moves the session to the terminal state matching {@code outcome}.
   *
   * @return {@code false} if the session was already terminal, in which case nothing changes
   */
  boolean complete(OperationOutcome outcome) {
    SessionState terminalState;
    ScheduledFuture<?> timer;
    synchronized (lock) {
      if (state.isTerminal()) return false;
      state = outcome.terminalState();
      error = outcome instanceof OperationOutcome.Failure failure ? failure.cause() : null;
      terminatedAt = clock.instant();
      operation = null;
      timer = expiryTimer;
      expiryTimer = null;
      terminalState = state;
    }
    if (timer != null) timer.cancel(false);
    termination.complete(terminalState);
    return true;
  }

  void expireWith(ScheduledFuture<?> timer) {
    synchronized (lock) {
      if (!state.isTerminal()) {
        expiryTimer = timer;
        return;
      }
    }
    timer.cancel(false);
  }

  private void markRunningLocked() {
    if (state == PENDING) state = RUNNING;
  }

  @Override
  public String toString() {
    return "Session{" +
      "id=" + id +
      ", state=" + state() +
      '}';
  }
}
