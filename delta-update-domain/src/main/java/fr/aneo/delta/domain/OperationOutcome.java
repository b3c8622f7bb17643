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
 * Final event reported by an operation through {@link OperationReporter#reportOutcome(OperationOutcome)}.
 *
 * <h2>State Mapping</h2>
 * <ul>
 *   <li>{@link Success} &rarr; {@link SessionState#COMPLETED}</li>
 *   <li>{@link Failure} &rarr; {@link SessionState#FAILED}, the cause becoming the snapshot error</li>
 *   <li>{@link Cancelled} &rarr; {@link SessionState#CANCELLED}</li>
 * </ul>
 *
 * @see OperationReporter
 * @see DeltaSnapshot#error()
 */
public sealed interface OperationOutcome {

  /**
   * Singleton instance representing a successful run.
   */
  Success SUCCESS = new Success();

  /**
   * Singleton instance representing a run stopped after a cancellation request.
   */
  Cancelled CANCELLED = new Cancelled();

  /**
   * Creates a {@link Failure} from a {@link Throwable}. If {@code cause} is {@code null}, a generic
   * {@link DeltaUpdateException} is used instead so that failed sessions always carry an error.
   *
   * @param cause the cause of the failure; may be {@code null}
   * @return a failure outcome
   */
  static Failure failure(Throwable cause) {
    return new Failure(cause == null ? new DeltaUpdateException("Unknown error") : cause);
  }

  /**
   * Creates a {@link Failure} from a message.
   *
   * @param message human-readable error description; may be {@code null}
   * @return a failure outcome
   */
  static Failure failure(String message) {
    return new Failure(new DeltaUpdateException(message == null ? "Unknown error" : message));
  }

  /**
   * @return the session state this outcome leads to
   */
  SessionState terminalState();

  record Success() implements OperationOutcome {
    @Override
    public SessionState terminalState() {
      return SessionState.COMPLETED;
    }
  }

  /**
   * Failed run.
   *
   * @param cause the error exposed to pollers; never {@code null}
   */
  record Failure(Throwable cause) implements OperationOutcome {
    public Failure {
      if (cause == null) {
        cause = new DeltaUpdateException("Unknown error");
      }
    }

    /**
     * @return the cause message, or {@code cause.toString()} when the cause has no message
     */
    public String message() {
      return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }

    @Override
    public SessionState terminalState() {
      return SessionState.FAILED;
    }
  }

  record Cancelled() implements OperationOutcome {
    @Override
    public SessionState terminalState() {
      return SessionState.CANCELLED;
    }
  }
}
