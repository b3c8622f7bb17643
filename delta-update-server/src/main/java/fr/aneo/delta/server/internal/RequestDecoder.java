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
package fr.aneo.delta.server.internal;

/**
 * Turns the JSON request of a {@code StartSession} call into the operation request.
 *
 * @param <R> the request type
 */
@FunctionalInterface
public interface RequestDecoder<R> {

  /**
   * @param json the JSON request
   * @return the decoded request, or {@code null} when {@code json} is empty
   * @throws IllegalArgumentException if {@code json} is not a valid request
   */
  R decode(String json);
}
