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
 * Thrown when polling or terminating a session that never existed or has already been reaped.
 * Both cases are reported identically.
 */
public class SessionNotFoundException extends DeltaUpdateException {
  private final SessionId sessionId;

  public SessionNotFoundException(SessionId sessionId) {
    super("Session " + requireNonNull(sessionId, "sessionId must not be null").asString() + " not found");
    this.sessionId = sessionId;
  }

  public SessionId sessionId() {
    return sessionId;
  }
}
