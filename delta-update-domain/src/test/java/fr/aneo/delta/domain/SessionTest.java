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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static fr.aneo.delta.domain.SessionState.COMPLETED;
import static fr.aneo.delta.domain.SessionState.FAILED;
import static fr.aneo.delta.domain.SessionState.PENDING;
import static fr.aneo.delta.domain.SessionState.RUNNING;
import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThat;

class SessionTest {

  private MutableClock clock;
  private Session<String> session;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    session = new Session<>(SessionId.from("session-1"), clock);
  }

  @Test
  void should_start_pending_and_run_on_first_report() {
    assertThat(session.state()).isEqualTo(PENDING);

    session.appendLog("booting\n");

    assertThat(session.state()).isEqualTo(RUNNING);
  }

  @Test
  void should_return_the_set_difference_between_two_cursors() {
    // Given
    session.appendResults(List.of("a", "b"));
    var first = session.snapshot(Cursor.START);

    // When
    session.appendResults(List.of("c", "d"));
    var second = session.snapshot(first.nextCursor());

    // Then
    assertThat(first.results()).containsExactly("a", "b");
    assertThat(second.results()).containsExactly("c", "d");
    assertThat(second.nextCursor()).isEqualTo(new Cursor(4, 0));
  }

  @Test
  void should_return_an_immutable_copy_of_the_results() {
    // Given
    session.appendResults(List.of("a"));
    var snapshot = session.snapshot(Cursor.START);

    // When
    session.appendResults(List.of("b"));

    // Then
    assertThat(snapshot.results()).containsExactly("a");
  }

  @Test
  void should_never_move_the_cursor_backwards() {
    session.appendResults(List.of("a", "b"));

    var snapshot = session.snapshot(new Cursor(5, 0));

    assertThat(snapshot.results()).isEmpty();
    assertThat(snapshot.nextCursor().resultPosition()).isEqualTo(5);
  }

  @Test
  void should_freeze_once_terminal() {
    // Given
    session.appendResults(List.of("a"));
    clock.advance(ofSeconds(5));

    // When
    var completed = session.complete(OperationOutcome.SUCCESS);
    var completedAgain = session.complete(OperationOutcome.failure("late"));
    var appended = session.appendResults(List.of("b"));

    // Then
    assertThat(completed).isTrue();
    assertThat(completedAgain).isFalse();
    assertThat(appended).isFalse();
    assertThat(session.state()).isEqualTo(COMPLETED);
    assertThat(session.terminatedAt()).isEqualTo(clock.instant());
    assertThat(session.snapshot(Cursor.START).results()).containsExactly("a");
    assertThat(session.termination().toCompletableFuture()).isCompletedWithValue(COMPLETED);
  }

  @Test
  void should_carry_the_failure_cause() {
    var cause = new IllegalStateException("simulator crashed");

    session.complete(OperationOutcome.failure(cause));

    var snapshot = session.snapshot(Cursor.START);
    assertThat(snapshot.state()).isEqualTo(FAILED);
    assertThat(snapshot.error()).isSameAs(cause);
    assertThat(snapshot.errorMessage()).isEqualTo("simulator crashed");
  }

  @Test
  void should_return_the_handle_only_on_the_first_cancellation_request() {
    // Given
    OperationHandle handle = () -> {};
    session.attach(handle);

    // When
    var first = session.requestCancellation();
    var second = session.requestCancellation();

    // Then
    assertThat(first).isSameAs(handle);
    assertThat(second).isNull();
    assertThat(session.isCancellationRequested()).isTrue();
  }

  @Test
  void should_release_the_handle_once_terminal() {
    session.attach(() -> {});
    session.complete(OperationOutcome.SUCCESS);

    assertThat(session.requestCancellation()).isNull();
  }
}
