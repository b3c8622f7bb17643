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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a session is started with an identifier already present in the registry,
 * whether that session is still running or terminated but not yet reaped.
 */
public class SessionAlreadyExistsException extends DeltaUpdateException {
  private final SessionId sessionId;

  public SessionAlreadyExistsException(SessionId sessionId) {
    super("Session " + requireNonNull(sessionId, "sessionId must not be null").asString() + " already exists");
    this.sessionId = sessionId;
  }

  public SessionId sessionId() {
    return sessionId;
  }
}
