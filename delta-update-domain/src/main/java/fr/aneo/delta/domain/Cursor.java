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
 * Position in a session's output already consumed by a poller.
 * <p>
 * Cursors are held by pollers, never by the manager. A poller passes the cursor it received in
 * {@link DeltaSnapshot#nextCursor()} to its next {@link DeltaUpdateManager#poll(SessionId, Cursor)}
 * call and receives only what was produced after it. Two independent positions are tracked: the
 * number of results already delivered and the number of log characters already delivered.
 *
 * @param resultPosition number of results already consumed
 * @param logPosition    number of log characters already consumed
 */
public record Cursor(int resultPosition, int logPosition) {

  /**
   * Cursor of a poller that has consumed nothing yet.
   */
  public static final Cursor START = new Cursor(0, 0);

  /**
   * @throws IllegalArgumentException if any position is negative
   */
  public Cursor {
    if (resultPosition < 0) throw new IllegalArgumentException("resultPosition must be >= 0, got " + resultPosition);
    if (logPosition < 0) throw new IllegalArgumentException("logPosition must be >= 0, got " + logPosition);
  }

  /**
   * Creates a cursor positioned after {@code resultPosition} results, with the whole log still unread.
   *
   * @param resultPosition number of results already consumed
   * @return the cursor
   */
  public static Cursor ofResults(int resultPosition) {
    return new Cursor(resultPosition, 0);
  }
}
