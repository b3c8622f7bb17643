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

import com.google.common.base.Joiner;
import fr.aneo.delta.domain.InvalidRequestException;
import fr.aneo.delta.domain.RequestValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.Objects.requireNonNull;

/**
 * Checks that an {@link XCTestRunRequest} is consistent with its {@link XCTestRunRequest.Mode}.
 * <p>
 * All violations are collected and reported together in a single {@link InvalidRequestException}.
 * When built with an {@link XCTestBundleStorage}, the test bundle must also be installed on the target.
 */
public final class XCTestRequestValidator implements RequestValidator<XCTestRunRequest> {
  private final XCTestBundleStorage bundleStorage;
  private final String targetUdid;

  /**
   * Creates a validator checking the request alone, without looking up installed bundles.
   */
  public XCTestRequestValidator() {
    this.bundleStorage = null;
    this.targetUdid = null;
  }

  /**
   * @param bundleStorage resolves the bundles installed on the target
   * @param targetUdid    the target identifier, used in error messages
   */
  public XCTestRequestValidator(XCTestBundleStorage bundleStorage, String targetUdid) {
    this.bundleStorage = requireNonNull(bundleStorage, "bundleStorage must not be null");
    this.targetUdid = requireNonNull(targetUdid, "targetUdid must not be null");
  }

  @Override
  public void validate(XCTestRunRequest request) {
    var violations = new ArrayList<String>();

    if (isNullOrEmpty(request.testBundleId())) {
      violations.add("testBundleId is required");
    } else if (bundleStorage != null && bundleStorage.bundlePath(request.testBundleId()).isEmpty()) {
      violations.add("test bundle " + request.testBundleId() + " is not installed on target " + targetUdid);
    }
    if (request.mode() == null) {
      violations.add("mode is required");
    } else {
      checkMode(request, violations);
    }

    var conflicts = request.conflictingTests();
    if (!conflicts.isEmpty()) {
      violations.add("tests both run and skipped: " + Joiner.on(", ").join(new TreeSet<>(conflicts)));
    }
    if (request.timeout() != null && (request.timeout().isZero() || request.timeout().isNegative())) {
      violations.add("timeout must be positive");
    }

    if (!violations.isEmpty()) {
      throw new InvalidRequestException("Invalid XCTest request: " + Joiner.on("; ").join(violations));
    }
  }

  private static void checkMode(XCTestRunRequest request, List<String> violations) {
    switch (request.mode()) {
      case LOGIC -> {
        if (!isNullOrEmpty(request.testHostAppBundleId())) {
          violations.add("logic tests do not accept testHostAppBundleId");
        }
        if (!isNullOrEmpty(request.testTargetAppBundleId())) {
          violations.add("logic tests do not accept testTargetAppBundleId");
        }
      }
      case APPLICATION -> {
        if (isNullOrEmpty(request.testHostAppBundleId())) {
          violations.add("application tests require testHostAppBundleId");
        }
        if (!isNullOrEmpty(request.testTargetAppBundleId())) {
          violations.add("application tests do not accept testTargetAppBundleId");
        }
      }
      case UI -> {
        if (isNullOrEmpty(request.testHostAppBundleId())) {
          violations.add("UI tests require testHostAppBundleId");
        }
        if (isNullOrEmpty(request.testTargetAppBundleId())) {
          violations.add("UI tests require testTargetAppBundleId");
        }
      }
    }
  }
}
