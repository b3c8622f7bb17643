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

/**
 * Execution environment running XCTest bundles, such as a simulator or a device.
 * <p>
 * Implementations wrap the platform tooling; the delta update manager only relies on this
 * contract.
 */
public interface TestTarget {

  /**
   * How a test run ended without error.
   */
  enum Completion {
    /**
     * Every selected test ran.
     */
    FINISHED,
    /**
     * The run stopped early after observing the cancellation signal.
     */
    STOPPED
  }

  /**
   * @return the unique identifier of the target
   */
  String udid();

  /**
   * Runs a test bundle and blocks until the run ends.
   * <p>
   * Implementations report each test result to {@code listener} as soon as it is known, and check
   * {@code cancellation} between tests, returning {@link Completion#STOPPED} once it is set.
   *
   * @param launch       what to run and where
   * @param listener     receives test results and log output
   * @param cancellation set when the run must stop
   * @return how the run ended
   * @throws Exception if the run could not complete
   */
  Completion runTests(TestLaunch launch, TestRunListener listener, CancellationSignal cancellation) throws Exception;
}
