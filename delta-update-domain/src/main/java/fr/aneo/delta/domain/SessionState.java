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
 * Lifecycle state of a session.
 * <p>
 * States only move forward: {@code PENDING -> RUNNING -> {COMPLETED, FAILED, CANCELLED}}.
 * {@code PENDING} may also jump directly to a terminal state when the operation finishes, fails
 * to start, or is cancelled before it reports anything. Terminal states are final.
 */
public enum SessionState {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  /**
   * @return {@code true} for {@link #COMPLETED}, {@link #FAILED} and {@link #CANCELLED}
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  /**
   * Tells whether moving from this state to {@code next} goes forward in the lifecycle.
   *
   * @param next the candidate state
   * @return {@code true} if the transition is allowed
   */
  public boolean canTransitionTo(SessionState next) {
    return switch (this) {
      case PENDING -> next != PENDING;
      case RUNNING -> next.isTerminal();
      case COMPLETED, FAILED, CANCELLED -> false;
    };
  }
}
