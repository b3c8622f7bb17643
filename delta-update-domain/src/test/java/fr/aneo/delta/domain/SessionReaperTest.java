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

import fr.aneo.delta.domain.testutils.MutableClock;
import org.jmock.lib.concurrent.DeterministicScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static java.time.Duration.ofSeconds;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionReaperTest {

  private MutableClock clock;
  private DeterministicScheduler scheduler;
  private SessionRegistry<String> registry;
  private SessionReaper reaper;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    scheduler = new DeterministicScheduler();
    registry = new SessionRegistry<>(0, clock);
    reaper = new SessionReaper(registry, ofSeconds(60), ofSeconds(10), scheduler);
  }

  @Test
  void should_reap_terminal_sessions_once_retention_elapsed() {
    // Given
    var done = registry.create(SessionId.from("done"), s -> () -> {});
    done.complete(OperationOutcome.SUCCESS);
    clock.advance(ofSeconds(60));

    // When
    var reaped = reaper.sweep();

    // Then
    assertThat(reaped).containsExactly(SessionId.from("done"));
    assertThat(registry.sessionIds()).isEmpty();
  }

  @Test
  void should_never_reap_live_sessions() {
    // Given
    registry.create(SessionId.from("live"), s -> () -> {});
    clock.advance(ofSeconds(3600));

    // When
    var reaped = reaper.sweep();

    // Then
    assertThat(reaped).isEmpty();
    assertThat(registry.sessionIds()).containsExactly(SessionId.from("live"));
  }

  @Test
  void should_keep_terminal_sessions_within_retention() {
    // Given
    var done = registry.create(SessionId.from("done"), s -> () -> {});
    done.complete(OperationOutcome.failure("boom"));
    clock.advance(ofSeconds(59));

    // When / Then
    assertThat(reaper.sweep()).isEmpty();
  }

  @Test
  void should_keep_serving_a_session_already_fetched_when_it_is_reaped() {
    // Given
    var done = registry.create(SessionId.from("done"), s -> () -> {});
    done.appendResults(List.of("a"));
    done.complete(OperationOutcome.SUCCESS);
    clock.advance(ofSeconds(60));

    // When
    reaper.sweep();

    // Then
    assertThat(done.snapshot(Cursor.START).results()).containsExactly("a");
  }

  @Test
  void should_sweep_periodically_once_started() {
    // Given
    var done = registry.create(SessionId.from("done"), s -> () -> {});
    done.complete(OperationOutcome.SUCCESS);
    clock.advance(ofSeconds(60));
    reaper.start();
    reaper.start();

    // When
    scheduler.tick(9, SECONDS);
    var beforeInterval = registry.sessionIds().size();
    scheduler.tick(1, SECONDS);

    // Then
    assertThat(beforeInterval).isEqualTo(1);
    assertThat(registry.sessionIds()).isEmpty();
  }

  @Test
  void should_stop_sweeping_once_closed() {
    // Given
    reaper.start();
    var done = registry.create(SessionId.from("done"), s -> () -> {});
    done.complete(OperationOutcome.SUCCESS);
    clock.advance(ofSeconds(60));

    // When
    reaper.close();
    scheduler.tick(10, SECONDS);

    // Then
    assertThat(registry.sessionIds()).containsExactly(SessionId.from("done"));
  }

  @SuppressWarnings("unchecked")
  @Test
  void should_keep_sweeping_after_a_failed_sweep() {
    // Given
    var failingRegistry = (SessionRegistry<String>) mock(SessionRegistry.class);
    when(failingRegistry.listTerminalOlderThan(ofSeconds(60)))
      .thenThrow(new IllegalStateException("boom"))
      .thenReturn(List.of());
    reaper = new SessionReaper(failingRegistry, ofSeconds(60), ofSeconds(10), scheduler);
    reaper.start();

    // When
    scheduler.tick(10, SECONDS);
    scheduler.tick(10, SECONDS);

    // Then
    verify(failingRegistry, times(2)).listTerminalOlderThan(ofSeconds(60));
  }
}
