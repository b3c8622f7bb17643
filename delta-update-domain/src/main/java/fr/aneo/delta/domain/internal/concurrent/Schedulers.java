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
package fr.aneo.delta.domain.internal.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared executors of the delta update manager.
 * <p>
 * Two pools are exposed:
 * <ul>
 *   <li>{@link #shared()}: a single daemon thread scheduling session expiry timers and reaper sweeps.
 *       Work submitted there must be short.</li>
 *   <li>{@link #operations()}: a cached pool of daemon threads running operation bodies, one thread per
 *       running operation, so that an operation never delays another one or a poller.</li>
 * </ul>
 * <p>
 * A JVM shutdown hook shuts both pools down when the application terminates. Do not call
 * {@code shutdown()} on the returned executors.
 */
public final class Schedulers {

  private static final ScheduledThreadPoolExecutor SHARED;
  private static final ExecutorService OPERATIONS;

  private Schedulers() {}

  static {
    SHARED = new ScheduledThreadPoolExecutor(1, daemonThreadFactory("delta-update-scheduler"));
    SHARED.setRemoveOnCancelPolicy(true);
    SHARED.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

    OPERATIONS = Executors.newCachedThreadPool(daemonThreadFactory("delta-update-operation"));

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      SHARED.shutdown();
      OPERATIONS.shutdown();
    }, "delta-update-scheduler-shutdown"));
  }

  /**
   * @return the shared scheduled executor
   */
  public static ScheduledExecutorService shared() {
    return SHARED;
  }

  /**
   * @return the executor running operation bodies
   */
  public static ExecutorService operations() {
    return OPERATIONS;
  }

  private static ThreadFactory daemonThreadFactory(String prefix) {
    var counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
