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
 * Handle on a started operation, owned by its session while the operation runs.
 * <p>
 * Cancellation is cooperative: {@link #cancel()} only signals the operation, which is expected to
 * observe the signal at its next checkpoint, stop, and report {@link OperationOutcome#CANCELLED}
 * (or its natural outcome if it was already finishing). Implementations must return promptly and
 * tolerate repeated calls.
 */
@FunctionalInterface
public interface OperationHandle {

  /**
   * Signals the operation to stop.
   */
  void cancel();
}
