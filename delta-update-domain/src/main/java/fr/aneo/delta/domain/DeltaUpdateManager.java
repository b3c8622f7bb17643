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

import fr.aneo.delta.domain.internal.concurrent.Schedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Starts long-running operations in sessions and serves their results incrementally.
 * <p>
 * The manager is generic over the request type {@code R} handed opaquely to the
 * {@link OperationFactory}, and over the result fragment type {@code F} the operations report.
 *
 * <h2>Lifecycle of a Session</h2>
 * <ol>
 *   <li>{@link #startSession(SessionId, Object)} validates the request, registers the session and
 *       starts its operation, then returns without waiting for it.</li>
 *   <li>The operation reports results, log output and finally its outcome through an
 *       {@link OperationReporter} bound to its session.</li>
 *   <li>Pollers call {@link #poll(SessionId, Cursor)} with the cursor they got from their previous
 *       poll and receive only what is new.</li>
 *   <li>{@link #terminate(SessionId)} asks the operation to stop; the session becomes
 *       {@link SessionState#CANCELLED} once the operation acknowledges.</li>
 *   <li>Terminal sessions stay pollable for {@link DeltaUpdateConfig#sessionRetention()}, then the
 *       {@link SessionReaper} removes them.</li>
 * </ol>
 *
 * <h2>Error Handling</h2>
 * <ul>
 *   <li>{@link InvalidRequestException}, {@link SessionAlreadyExistsException} and
 *       {@link SessionCapacityExceededException} are thrown synchronously by {@code startSession},
 *       with no session created.</li>
 *   <li>{@link SessionNotFoundException} is thrown by {@code poll} and {@code terminate} for unknown or
 *       reaped identifiers.</li>
 *   <li>Failures of the operation itself are never thrown: they surface as a {@link SessionState#FAILED}
 *       snapshot carrying the error.</li>
 * </ul>
 * <p>
 * This class is thread-safe. {@code poll} and {@code terminate} never wait on an operation.
 *
 * @param <R> the request type
 * @param <F> the result fragment type
 * @see SessionRegistry
 * @see SessionReaper
 * @see DeltaSnapshot
 */
public final class DeltaUpdateManager<R, F> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(DeltaUpdateManager.class);

  private final String name;
  private final OperationFactory<R, F> operationFactory;
  private final RequestValidator<R> requestValidator;
  private final SessionRegistry<F> registry;
  private final SessionReaper reaper;
  private final ScheduledExecutorService scheduler;
  private final Duration maxSessionLifetime;

  private DeltaUpdateManager(Builder<R, F> builder) {
    this.name = builder.name;
    this.operationFactory = builder.operationFactory;
    this.requestValidator = builder.requestValidator;
    this.scheduler = builder.scheduler;
    this.maxSessionLifetime = builder.config.maxSessionLifetime();
    this.registry = new SessionRegistry<>(builder.config.capacity(), builder.clock);
    this.reaper = new SessionReaper(registry, builder.config.sessionRetention(), builder.config.reapInterval(), scheduler);
    this.reaper.start();
    logger.info("[{}] Delta update manager started with {}", name, builder.config);
  }

  /**
   * Creates a builder for a manager starting operations with {@code operationFactory}.
   *
   * @param operationFactory the factory starting operations
   * @param <R>              the request type
   * @param <F>              the result fragment type
   * @return a new builder
   */
  public static <R, F> Builder<R, F> builder(OperationFactory<R, F> operationFactory) {
    return new Builder<>(operationFactory);
  }

  /**
   * Starts a session under a generated identifier.
   *
   * @param request the request handed to the operation
   * @return the generated session identifier
   * @see #startSession(SessionId, Object)
   */
  public SessionId startSession(R request) {
    return startSession(SessionId.random(), request);
  }

  /**
   * Starts a session under the given identifier.
   * <p>
   * The operation runs asynchronously: this method returns as soon as it is started.
   *
   * @param sessionId the identifier of the session to create
   * @param request   the request handed to the operation
   * @return {@code sessionId}
   * @throws InvalidRequestException           if the request is {@code null} or fails validation
   * @throws SessionAlreadyExistsException     if a session already uses {@code sessionId}
   * @throws SessionCapacityExceededException  if the configured capacity is reached
   * @throws DeltaUpdateException              if the operation could not be started
   */
  public SessionId startSession(SessionId sessionId, R request) {
    requireNonNull(sessionId, "sessionId must not be null");
    validate(request);

    var session = registry.create(sessionId, s -> operationFactory.start(sessionId, request, new SessionReporter(s)));
    scheduleExpiry(session);

    logger.info("[{}] Session {} started", name, sessionId.asString());
    return sessionId;
  }

  /**
   * Returns everything the session produced since the beginning.
   *
   * @param sessionId the session identifier
   * @return the snapshot
   * @throws SessionNotFoundException if the session does not exist
   * @see #poll(SessionId, Cursor)
   */
  public DeltaSnapshot<F> poll(SessionId sessionId) {
    return poll(sessionId, Cursor.START);
  }

  /**
   * Returns what the session produced after {@code cursor}, along with its current state.
   * <p>
   * Polling with successive cursors taken from {@link DeltaSnapshot#nextCursor()} delivers every
   * result exactly once. This method never fails because of the operation: a failed operation is
   * reported as a {@link SessionState#FAILED} snapshot.
   *
   * @param sessionId the session identifier
   * @param cursor    the cursor returned by the previous poll, or {@link Cursor#START}
   * @return the snapshot
   * @throws SessionNotFoundException if the session never existed or has been reaped
   */
  public DeltaSnapshot<F> poll(SessionId sessionId, Cursor cursor) {
    requireNonNull(cursor, "cursor must not be null");
    return registry.get(sessionId).snapshot(cursor);
  }

  /**
   * Asks the operation of a session to stop.
   * <p>
   * Cancellation is cooperative: the operation is signalled and the session becomes
   * {@link SessionState#CANCELLED} once the operation acknowledges, unless it was already finishing
   * and reports its natural outcome first. Terminating a terminal session is a no-op.
   *
   * @param sessionId the session identifier
   * @return a stage completed with the terminal state of the session
   * @throws SessionNotFoundException if the session does not exist
   */
  public CompletionStage<SessionState> terminate(SessionId sessionId) {
    var session = registry.get(sessionId);
    if (session.isTerminal()) {
      return completedFuture(session.state());
    }
    logger.info("[{}] Termination requested for session {}", name, sessionId.asString());
    cancel(session);
    return session.termination();
  }

  /**
   * @param sessionId the session identifier
   * @return a stage completed with the terminal state of the session, whatever ends it
   * @throws SessionNotFoundException if the session does not exist
   */
  public CompletionStage<SessionState> awaitTermination(SessionId sessionId) {
    return registry.get(sessionId).termination();
  }

  /**
   * @param sessionId the session identifier
   * @return the current state of the session, without copying any result
   * @throws SessionNotFoundException if the session does not exist
   */
  public SessionState state(SessionId sessionId) {
    return registry.get(sessionId).state();
  }

  /**
   * @return the identifiers of every session currently registered, live or terminal
   */
  public Set<SessionId> sessionIds() {
    return registry.sessionIds();
  }

  /**
   * Stops the reaper and asks every live session to stop. Does not wait for the operations.
   */
  @Override
  public void close() {
    reaper.close();
    List<Session<F>> live = registry.liveSessions();
    if (!live.isEmpty()) {
      logger.info("[{}] Closing manager, cancelling {} live session(s)", name, live.size());
    }
    live.forEach(this::cancel);
  }

  private void validate(R request) {
    if (request == null) throw new InvalidRequestException("request must not be null");
    try {
      requestValidator.validate(request);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException(e.getMessage(), e);
    }
  }

  private void scheduleExpiry(Session<F> session) {
    if (maxSessionLifetime == null) return;

    var timer = scheduler.schedule(() -> expire(session), maxSessionLifetime.toNanos(), NANOSECONDS);
    session.expireWith(timer);
  }

  private void expire(Session<F> session) {
    if (session.isTerminal()) return;

    logger.warn("[{}] Session {} exceeded its maximum lifetime of {}, terminating it",
      name, session.id().asString(), maxSessionLifetime);
    cancel(session);
  }

  private void cancel(Session<F> session) {
    var handle = session.requestCancellation();
    if (handle == null) return;

    try {
      handle.cancel();
    } catch (RuntimeException e) {
      logger.error("[{}] Failed to signal cancellation to session {}", name, session.id().asString(), e);
      if (session.complete(OperationOutcome.failure(new DeltaUpdateException("Cancellation failed", e)))) {
        logger.warn("[{}] Session {} marked as failed", name, session.id().asString());
      }
    }
  }

  /**
   * Reporter bound to one session, handed to the operation at start.
   */
  private final class SessionReporter implements OperationReporter<F> {
    private final Session<F> session;

    private SessionReporter(Session<F> session) {
      this.session = session;
    }

    @Override
    public void reportResult(F result) {
      requireNonNull(result, "result must not be null");
      append(List.of(result));
    }

    @Override
    public void reportResults(List<F> results) {
      requireNonNull(results, "results must not be null");
      append(List.copyOf(results));
    }

    @Override
    public void reportLog(String text) {
      requireNonNull(text, "text must not be null");
      if (!session.appendLog(text)) ignored("log output");
    }

    @Override
    public void reportOutputLocation(String location) {
      requireNonNull(location, "location must not be null");
      if (!session.updateOutputLocation(location)) ignored("output location");
    }

    @Override
    public void reportOutcome(OperationOutcome outcome) {
      requireNonNull(outcome, "outcome must not be null");
      if (!session.complete(outcome)) {
        ignored("outcome " + outcome);
        return;
      }

      var sessionId = session.id().asString();
      if (outcome instanceof OperationOutcome.Failure failure) {
        logger.warn("[{}] Session {} failed: {}", name, sessionId, failure.message());
      } else {
        logger.info("[{}] Session {} terminated with state {}", name, sessionId, outcome.terminalState());
      }
    }

    private void append(List<F> results) {
      if (results.isEmpty()) return;
      if (!session.appendResults(results)) ignored(results.size() + " result(s)");
    }

    private void ignored(String what) {
      logger.debug("[{}] Ignoring {} reported after session {} terminated", name, what, session.id().asString());
    }
  }

  /**
   * Builder for {@link DeltaUpdateManager}.
   *
   * @param <R> the request type
   * @param <F> the result fragment type
   */
  public static final class Builder<R, F> {
    private final OperationFactory<R, F> operationFactory;
    private String name = "delta-update";
    private RequestValidator<R> requestValidator = RequestValidator.acceptAll();
    private DeltaUpdateConfig config = DeltaUpdateConfig.defaultConfig();
    private ScheduledExecutorService scheduler = Schedulers.shared();
    private Clock clock = Clock.systemUTC();

    private Builder(OperationFactory<R, F> operationFactory) {
      this.operationFactory = requireNonNull(operationFactory, "operationFactory must not be null");
    }

    /**
     * Sets the name identifying the manager in log messages.
     *
     * @param name the name
     * @return this builder
     */
    public Builder<R, F> withName(String name) {
      this.name = requireNonNull(name, "name must not be null");
      return this;
    }

    public Builder<R, F> withRequestValidator(RequestValidator<R> requestValidator) {
      this.requestValidator = requireNonNull(requestValidator, "requestValidator must not be null");
      return this;
    }

    public Builder<R, F> withConfig(DeltaUpdateConfig config) {
      this.config = requireNonNull(config, "config must not be null");
      return this;
    }

    /**
     * Sets the scheduler running the reaper and the session expiry timers.
     * Defaults to {@link Schedulers#shared()}.
     *
     * @param scheduler the scheduler
     * @return this builder
     */
    public Builder<R, F> withScheduler(ScheduledExecutorService scheduler) {
      this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
      return this;
    }

    public Builder<R, F> withClock(Clock clock) {
      this.clock = requireNonNull(clock, "clock must not be null");
      return this;
    }

    /**
     * Builds the manager and starts its reaper.
     *
     * @return the manager
     */
    public DeltaUpdateManager<R, F> build() {
      return new DeltaUpdateManager<>(this);
    }
  }
}
