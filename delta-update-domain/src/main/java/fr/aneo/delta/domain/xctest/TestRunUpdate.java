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

import java.time.Duration;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Result of a single test method, the result fragment of XCTest sessions.
 *
 * @param className      the test class
 * @param methodName     the test method
 * @param status         the test status
 * @param duration       how long the test ran
 * @param failureMessage the assertion or crash message, {@code null} for passed and skipped tests
 * @param logs           output captured while the test ran
 */
public record TestRunUpdate(
  String className,
  String methodName,
  Status status,
  Duration duration,
  String failureMessage,
  List<String> logs
) {

  public enum Status {
    PASSED,
    FAILED,
    SKIPPED,
    CRASHED
  }

  public TestRunUpdate {
    requireNonNull(className, "className must not be null");
    requireNonNull(methodName, "methodName must not be null");
    requireNonNull(status, "status must not be null");
    duration = duration == null ? Duration.ZERO : duration;
    logs = logs == null ? List.of() : List.copyOf(logs);
  }

  public static TestRunUpdate passed(String className, String methodName, Duration duration) {
    return new TestRunUpdate(className, methodName, Status.PASSED, duration, null, List.of());
  }

  public static TestRunUpdate failed(String className, String methodName, Duration duration, String failureMessage) {
    return new TestRunUpdate(className, methodName, Status.FAILED, duration, failureMessage, List.of());
  }

  /**
   * @return the test name in {@code Class/method} form, as accepted by {@link XCTestRunRequest#testsToRun()}
   */
  public String testName() {
    return className + "/" + methodName;
  }
}
