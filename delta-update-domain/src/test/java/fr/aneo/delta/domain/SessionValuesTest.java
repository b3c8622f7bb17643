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

import org.junit.jupiter.api.Test;

import static fr.aneo.delta.domain.SessionState.CANCELLED;
import static fr.aneo.delta.domain.SessionState.COMPLETED;
import static fr.aneo.delta.domain.SessionState.FAILED;
import static fr.aneo.delta.domain.SessionState.PENDING;
import static fr.aneo.delta.domain.SessionState.RUNNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionValuesTest {

  @Test
  void should_only_move_forward_in_the_lifecycle() {
    assertThat(PENDING.canTransitionTo(RUNNING)).isTrue();
    assertThat(PENDING.canTransitionTo(FAILED)).isTrue();
    assertThat(RUNNING.canTransitionTo(COMPLETED)).isTrue();
    assertThat(RUNNING.canTransitionTo(PENDING)).isFalse();
    assertThat(COMPLETED.canTransitionTo(CANCELLED)).isFalse();
    assertThat(CANCELLED.canTransitionTo(RUNNING)).isFalse();
  }

  @Test
  void should_flag_terminal_states() {
    assertThat(PENDING.isTerminal()).isFalse();
    assertThat(RUNNING.isTerminal()).isFalse();
    assertThat(COMPLETED.isTerminal()).isTrue();
    assertThat(FAILED.isTerminal()).isTrue();
    assertThat(CANCELLED.isTerminal()).isTrue();
  }

  @Test
  void should_reject_negative_cursor_positions() {
    assertThatThrownBy(() -> new Cursor(-1, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Cursor(0, -1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void should_position_a_result_cursor_at_the_start_of_the_log() {
    assertThat(Cursor.ofResults(3)).isEqualTo(new Cursor(3, 0));
  }

  @Test
  void should_reject_blank_session_identifiers() {
    assertThatThrownBy(() -> SessionId.from(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SessionId.from(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void should_compare_session_identifiers_by_value() {
    assertThat(SessionId.from("abc")).isEqualTo(SessionId.from("abc"));
    assertThat(SessionId.from("abc").asString()).isEqualTo("abc");
  }

  @Test
  void should_map_outcomes_to_terminal_states() {
    assertThat(OperationOutcome.SUCCESS.terminalState()).isEqualTo(COMPLETED);
    assertThat(OperationOutcome.CANCELLED.terminalState()).isEqualTo(CANCELLED);
    assertThat(OperationOutcome.failure((Throwable) null).message()).isEqualTo("Unknown error");
  }
}
