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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Periodic sweep removing terminal sessions once their retention period has elapsed.
 * <p>
 * The reaper is decoupled from polling: it only removes registry entries, so a poller that already
 * fetched a session keeps reading it; only new lookups of the identifier fail with
 * {@link SessionNotFoundException}. Live sessions are never removed.
 *
 * @see SessionRegistry#listTerminalOlderThan(Duration)
 * @see DeltaUpdateConfig#sessionRetention()
 */
public final class SessionReaper implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(SessionReaper.class);

  private final SessionRegistry<?> registry;
  private final Duration retention;
  private final Duration interval;
  private final ScheduledExecutorService scheduler;
  private final Object lock = new Object();
  private ScheduledFuture<?> sweepTask;

  /**
   * @param registry  the registry to sweep
   * @param retention how long terminal sessions are kept
   * @param interval  delay between two sweeps
   * @param scheduler the scheduler running the sweeps
   */
  public SessionReaper(SessionRegistry<?> registry, Duration retention, Duration interval, ScheduledExecutorService scheduler) {
    this.registry = requireNonNull(registry, "registry must not be null");
    this.retention = requireNonNull(retention, "retention must not be null");
    this.interval = requireNonNull(interval, "interval must not be null");
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
  }

  /**
   * Schedules the periodic sweep. Calling it on a started reaper has no effect.
   */
  public void start() {
    synchronized (lock) {
      if (sweepTask != null) return;
      sweepTask = scheduler.scheduleWithFixedDelay(this::sweepSafely, interval.toNanos(), interval.toNanos(), NANOSECONDS);
    }
    logger.debug("Session reaper started: retention={}, interval={}", retention, interval);
  }

  /**
   * Removes every terminal session whose retention period has elapsed.
   *
   * @return the identifiers of the removed sessions
   */
  public List<SessionId> sweep() {
    var reaped = new ArrayList<SessionId>();
    for (var sessionId : registry.listTerminalOlderThan(retention)) {
      if (registry.remove(sessionId)) {
        reaped.add(sessionId);
      }
    }
    if (!reaped.isEmpty()) {
      logger.info("Reaped {} terminated session(s): {}",
        reaped.size(),
        reaped.stream().map(SessionId::asString).toList());
    }
    return reaped;
  }

  /**
   * Cancels the periodic sweep. Sessions already registered are left as they are.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (sweepTask != null) {
        sweepTask.cancel(false);
        sweepTask = null;
        logger.debug("Session reaper stopped");
      }
    }
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (RuntimeException e) {
      // an exception would cancel the periodic task
      logger.error("Session sweep failed, will retry in {}", interval, e);
    }
  }
}
