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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request to run an XCTest bundle on a {@link TestTarget}.
 *
 * <h2>Modes</h2>
 * <dl>
 *   <dt>{@link Mode#LOGIC}</dt>
 *   <dd>The bundle runs in a bare test process; no application is involved.</dd>
 *   <dt>{@link Mode#APPLICATION}</dt>
 *   <dd>The bundle is injected in {@code testHostAppBundleId}.</dd>
 *   <dt>{@link Mode#UI}</dt>
 *   <dd>The bundle runs in {@code testHostAppBundleId} and drives {@code testTargetAppBundleId}.</dd>
 * </dl>
 * Validation rules are enforced by {@link XCTestRequestValidator} before any session is created.
 *
 * @param mode                  how the bundle is run
 * @param testBundleId          identifier of the installed test bundle
 * @param testHostAppBundleId   host application, for application and UI tests
 * @param testTargetAppBundleId application under test, for UI tests
 * @param testsToRun            tests to run ({@code Class} or {@code Class/method}); empty runs them all
 * @param testsToSkip           tests to skip
 * @param environment           environment variables of the test process
 * @param arguments             launch arguments of the test process
 * @param timeout               maximum duration of the run, or {@code null} for none
 * @param collectResultBundle   whether an {@code .xcresult} bundle is produced
 */
public record XCTestRunRequest(
  Mode mode,
  String testBundleId,
  String testHostAppBundleId,
  String testTargetAppBundleId,
  Set<String> testsToRun,
  Set<String> testsToSkip,
  Map<String, String> environment,
  List<String> arguments,
  Duration timeout,
  boolean collectResultBundle
) {

  public enum Mode {
    LOGIC,
    APPLICATION,
    UI
  }

  public XCTestRunRequest {
    testsToRun = testsToRun == null ? Set.of() : Set.copyOf(testsToRun);
    testsToSkip = testsToSkip == null ? Set.of() : Set.copyOf(testsToSkip);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
  }

  public static XCTestRunRequest logicTest(String testBundleId) {
    return new XCTestRunRequest(Mode.LOGIC, testBundleId, null, null, null, null, null, null, null, false);
  }

  public static XCTestRunRequest applicationTest(String testBundleId, String testHostAppBundleId) {
    return new XCTestRunRequest(Mode.APPLICATION, testBundleId, testHostAppBundleId, null, null, null, null, null, null, false);
  }

  public static XCTestRunRequest uiTest(String testBundleId, String testHostAppBundleId, String testTargetAppBundleId) {
    return new XCTestRunRequest(Mode.UI, testBundleId, testHostAppBundleId, testTargetAppBundleId, null, null, null, null, null, false);
  }

  public XCTestRunRequest withTestsToRun(Set<String> testsToRun) {
    return new XCTestRunRequest(mode, testBundleId, testHostAppBundleId, testTargetAppBundleId, testsToRun, testsToSkip, environment, arguments, timeout, collectResultBundle);
  }

  public XCTestRunRequest withTestsToSkip(Set<String> testsToSkip) {
    return new XCTestRunRequest(mode, testBundleId, testHostAppBundleId, testTargetAppBundleId, testsToRun, testsToSkip, environment, arguments, timeout, collectResultBundle);
  }

  /**
   * Returns a copy of this request with an additional environment variable.
   *
   * @param name  the variable name
   * @param value the variable value
   * @return the new request
   */
  public XCTestRunRequest withEnvironment(String name, String value) {
    var merged = new HashMap<>(environment);
    merged.put(name, value);
    return new XCTestRunRequest(mode, testBundleId, testHostAppBundleId, testTargetAppBundleId, testsToRun, testsToSkip, merged, arguments, timeout, collectResultBundle);
  }

  public XCTestRunRequest withArguments(List<String> arguments) {
    return new XCTestRunRequest(mode, testBundleId, testHostAppBundleId, testTargetAppBundleId, testsToRun, testsToSkip, environment, arguments, timeout, collectResultBundle);
  }

  public XCTestRunRequest withTimeout(Duration timeout) {
    return new XCTestRunRequest(mode, testBundleId, testHostAppBundleId, testTargetAppBundleId, testsToRun, testsToSkip, environment, arguments, timeout, collectResultBundle);
  }

  public XCTestRunRequest withResultBundle() {
    return new XCTestRunRequest(mode, testBundleId, testHostAppBundleId, testTargetAppBundleId, testsToRun, testsToSkip, environment, arguments, timeout, true);
  }

  /**
   * @return the tests present in both {@link #testsToRun()} and {@link #testsToSkip()}
   */
  Set<String> conflictingTests() {
    var conflicts = new HashSet<>(testsToRun);
    conflicts.retainAll(testsToSkip);
    return conflicts;
  }
}
