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
 * Validates requests before any session is created.
 *
 * @param <R> the request type
 */
@FunctionalInterface
public interface RequestValidator<R> {

  /**
   * @param request the request to validate; never {@code null}
   * @throws InvalidRequestException if the request is malformed or unsupported
   */
  void validate(R request);

  /**
   * @param <R> the request type
   * @return a validator accepting every request
   */
  static <R> RequestValidator<R> acceptAll() {
    return request -> {};
  }
}
