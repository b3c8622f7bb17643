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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Concurrency-safe mapping from {@link SessionId} to {@link Session}.
 * <p>
 * The registry is the single point of mutual exclusion for the identifier namespace: every
 * operation is started through {@link #create(SessionId, Function)}, which guarantees that at most
 * one operation is ever started per identifier, however many callers race on it.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>{@link #create} holds a creation lock only for the check-and-insert step; the operation is
 *       started outside of it.</li>
 *   <li>{@link #get} is a lock-free lookup and never waits on an operation appending results.</li>
 *   <li>{@link #remove} only drops terminal sessions. A poller already holding a removed session
 *       keeps reading it safely, since terminal sessions never change.</li>
 * </ul>
 *
 * @param <F> the result fragment type
 * @see DeltaUpdateManager
 * @see SessionReaper
 */
public final class SessionRegistry<F> {
  private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

  private final ConcurrentMap<SessionId, Session<F>> sessions = new ConcurrentHashMap<>();
  private final Object creationLock = new Object();
  private final int capacity;
  private final Clock clock;

  /**
   * Creates a registry.
   *
   * @param capacity maximum number of live sessions, {@code 0} for no limit
   * @param clock    the clock used to timestamp sessions
   * @throws IllegalArgumentException if {@code capacity} is negative
   */
  public SessionRegistry(int capacity, Clock clock) {
    if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0");
    this.capacity = capacity;
    this.clock = requireNonNull(clock, "clock must not be null");
  }

  public SessionRegistry() {
    this(0, Clock.systemUTC());
  }

  /**
   * Creates a session and starts its operation.
   * <p>
   * The session is inserted in {@link SessionState#PENDING} state, then {@code operationStarter} is
   * invoked with it and the returned handle is attached, moving the session to
   * {@link SessionState#RUNNING}. If {@code operationStarter} throws, the session is marked
   * {@link SessionState#FAILED} and removed, leaving the identifier free.
   *
   * @param sessionId        the identifier of the new session
   * @param operationStarter starts the operation for the given session and returns its handle
   * @return the created session
   * @throws SessionAlreadyExistsException     if a session, live or not yet reaped, already uses {@code sessionId}
   * @throws SessionCapacityExceededException  if the registry already holds {@code capacity} live sessions
   * @throws DeltaUpdateException              if the operation could not be started
   */
  public Session<F> create(SessionId sessionId, Function<Session<F>, OperationHandle> operationStarter) {
    requireNonNull(sessionId, "sessionId must not be null");
    requireNonNull(operationStarter, "operationStarter must not be null");

    var session = new Session<F>(sessionId, clock);
    synchronized (creationLock) {
      if (sessions.containsKey(sessionId)) {
        throw new SessionAlreadyExistsException(sessionId);
      }
      if (capacity > 0 && liveSessionCount() >= capacity) {
        logger.warn("Rejecting session {}: capacity of {} live sessions reached", sessionId.asString(), capacity);
        throw new SessionCapacityExceededException(capacity);
      }
      sessions.put(sessionId, session);
    }

    OperationHandle handle;
    try {
      handle = requireNonNull(operationStarter.apply(session), "operation handle must not be null");
    } catch (RuntimeException e) {
      session.complete(OperationOutcome.failure(e));
      sessions.remove(sessionId, session);
      logger.warn("Failed to start operation for session {}: {}", sessionId.asString(), e.getMessage());
      if (e instanceof DeltaUpdateException) throw e;
      throw new DeltaUpdateException("Failed to start operation for session " + sessionId.asString(), e);
    }

    if (session.attach(handle)) {
      logger.info("Forwarding cancellation requested while session {} was starting", sessionId.asString());
      handle.cancel();
    }
    return session;
  }

  /**
   * Looks up a session.
   *
   * @param sessionId the identifier
   * @return the session
   * @throws SessionNotFoundException if no session exists under {@code sessionId}
   */
  public Session<F> get(SessionId sessionId) {
    requireNonNull(sessionId, "sessionId must not be null");

    var session = sessions.get(sessionId);
    if (session == null) throw new SessionNotFoundException(sessionId);
    return session;
  }

  /**
   * Removes a terminal session. Live sessions are left untouched.
   *
   * @param sessionId the identifier
   * @return {@code true} if a session was removed
   */
  public boolean remove(SessionId sessionId) {
    requireNonNull(sessionId, "sessionId must not be null");

    var session = sessions.get(sessionId);
    if (session == null || !session.isTerminal()) return false;
    return sessions.remove(sessionId, session);
  }

  /**
   * Lists the terminal sessions that terminated at least {@code age} ago.
   *
   * @param age the minimum time since termination
   * @return the matching identifiers
   */
  public List<SessionId> listTerminalOlderThan(Duration age) {
    requireNonNull(age, "age must not be null");

    var threshold = clock.instant().minus(age);
    return sessions.values()
                   .stream()
                   .filter(session -> {
                     var terminatedAt = session.terminatedAt();
                     return terminatedAt != null && !terminatedAt.isAfter(threshold);
                   })
                   .map(Session::id)
                   .toList();
  }

  /**
   * @return the number of sessions not yet terminal
   */
  public int liveSessionCount() {
    return (int) sessions.values().stream().filter(session -> !session.isTerminal()).count();
  }

  /**
   * @return the identifiers of every registered session, live or terminal
   */
  public Set<SessionId> sessionIds() {
    return Set.copyOf(sessions.keySet());
  }

  List<Session<F>> liveSessions() {
    return sessions.values().stream().filter(session -> !session.isTerminal()).toList();
  }
}
