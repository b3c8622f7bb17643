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
package fr.aneo.delta.domain.xctest;

import fr.aneo.delta.domain.SessionId;

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Everything a {@link TestTarget} needs to run one test bundle.
 *
 * @param sessionId        the session running the tests
 * @param request          the validated request
 * @param testBundlePath   location of the installed test bundle
 * @param workingDirectory scratch directory dedicated to this run
 * @param resultBundlePath where to write the {@code .xcresult} bundle, or {@code null} when not requested
 */
public record TestLaunch(
  SessionId sessionId,
  XCTestRunRequest request,
  Path testBundlePath,
  Path workingDirectory,
  Path resultBundlePath
) {

  public TestLaunch {
    requireNonNull(sessionId, "sessionId must not be null");
    requireNonNull(request, "request must not be null");
    requireNonNull(testBundlePath, "testBundlePath must not be null");
    requireNonNull(workingDirectory, "workingDirectory must not be null");
  }
}
