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
 * Base exception for all delta update operations.
 * <p>
 * This unchecked exception is thrown synchronously by {@link DeltaUpdateManager} when a request
 * cannot be honoured: invalid request, identifier collision, unknown session or capacity reached.
 * Failures of a running operation are never thrown; they are reported through
 * {@link DeltaSnapshot#error()} on the next poll.
 * </p>
 */
public class DeltaUpdateException extends RuntimeException {

  /**
   * Creates a new exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public DeltaUpdateException(String message) {
    super(message);
  }

  /**
   * Creates a new exception with the specified error message and cause.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public DeltaUpdateException(String message, Throwable cause) {
    super(message, cause);
  }
}
