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

import java.util.Objects;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Immutable identifier of a session tracked by a {@link DeltaUpdateManager}.
 * <p>
 * Identifiers are either supplied by the caller when starting a session or generated by the manager.
 * They are opaque to the manager and unique within the lifetime of the {@link SessionRegistry} entry
 * they name.
 */
public final class SessionId {
  private final String id;

  private SessionId(String id) {
    this.id = id;
  }

  /**
   * Returns the string representation of this session identifier, as exchanged with remote callers.
   *
   * @return the session identifier as a string
   */
  public String asString() {
    return id;
  }

  /**
   * Creates a session identifier from its string form.
   *
   * @param sessionId the identifier; must not be {@code null} or blank
   * @return the session identifier
   * @throws NullPointerException     if {@code sessionId} is {@code null}
   * @throws IllegalArgumentException if {@code sessionId} is blank
   */
  public static SessionId from(String sessionId) {
    requireNonNull(sessionId, "sessionId must not be null");
    if (sessionId.isBlank()) throw new IllegalArgumentException("sessionId must not be blank");

    return new SessionId(sessionId);
  }

  /**
   * Generates a new random session identifier.
   *
   * @return a session identifier backed by a random UUID
   */
  public static SessionId random() {
    return new SessionId(UUID.randomUUID().toString());
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (SessionId) obj;
    return Objects.equals(this.id, that.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public String toString() {
    return "SessionId{" +
      "id='" + id + '\'' +
      '}';
  }
}
