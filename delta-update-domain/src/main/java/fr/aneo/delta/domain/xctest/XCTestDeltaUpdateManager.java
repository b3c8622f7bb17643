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

import fr.aneo.delta.domain.DeltaUpdateConfig;
import fr.aneo.delta.domain.DeltaUpdateManager;
import fr.aneo.delta.domain.internal.concurrent.Schedulers;

/**
 * Entry point wiring a {@link DeltaUpdateManager} for XCTest runs.
 */
public final class XCTestDeltaUpdateManager {

  private XCTestDeltaUpdateManager() {}

  public static DeltaUpdateManager<XCTestRunRequest, TestRunUpdate> create(TestTarget target,
                                                                           XCTestBundleStorage bundleStorage,
                                                                           TemporaryDirectory temporaryDirectory) {
    return create(target, bundleStorage, temporaryDirectory, DeltaUpdateConfig.defaultConfig());
  }

  /**
   * Creates a manager running XCTest bundles on {@code target}.
   * <p>
   * Runs execute on {@link Schedulers#operations()}; timeouts, session expiry and reaping run on
   * {@link Schedulers#shared()}.
   *
   * @param target             the target running the tests
   * @param bundleStorage      resolves installed test bundles
   * @param temporaryDirectory provides per-run working directories
   * @param config             the manager configuration
   * @return a started manager
   */
  public static DeltaUpdateManager<XCTestRunRequest, TestRunUpdate> create(TestTarget target,
                                                                           XCTestBundleStorage bundleStorage,
                                                                           TemporaryDirectory temporaryDirectory,
                                                                           DeltaUpdateConfig config) {
    var operationFactory = new XCTestOperationFactory(target, bundleStorage, temporaryDirectory,
      Schedulers.operations(), Schedulers.shared());

    return DeltaUpdateManager.builder(operationFactory)
                             .withName("xctest-" + target.udid())
                             .withRequestValidator(new XCTestRequestValidator(bundleStorage, target.udid()))
                             .withConfig(config)
                             .build();
  }
}
