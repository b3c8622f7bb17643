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
 * Thrown when starting a session while the registry already holds as many live sessions as its
 * configured capacity allows.
 *
 * @see DeltaUpdateConfig#capacity()
 */
public class SessionCapacityExceededException extends DeltaUpdateException {
  private final int capacity;

  public SessionCapacityExceededException(int capacity) {
    super("Cannot start a new session: " + capacity + " sessions are already running");
    this.capacity = capacity;
  }

  public int capacity() {
    return capacity;
  }
}
