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

import fr.aneo.delta.domain.InvalidRequestException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import static java.time.Duration.ZERO;
import static java.time.Duration.ofMinutes;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XCTestRequestValidatorTest {

  private final XCTestRequestValidator validator = new XCTestRequestValidator();

  @Test
  void should_accept_well_formed_requests_of_every_mode() {
    assertThatCode(() -> validator.validate(XCTestRunRequest.logicTest("com.acme.LogicTests"))).doesNotThrowAnyException();
    assertThatCode(() -> validator.validate(XCTestRunRequest.applicationTest("com.acme.AppTests", "com.acme.App")
                                                            .withTimeout(ofMinutes(5))))
      .doesNotThrowAnyException();
    assertThatCode(() -> validator.validate(XCTestRunRequest.uiTest("com.acme.UITests", "com.acme.Runner", "com.acme.App")))
      .doesNotThrowAnyException();
  }

  @Test
  void should_require_a_test_bundle() {
    assertThatThrownBy(() -> validator.validate(XCTestRunRequest.logicTest("")))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("testBundleId is required");
  }

  @Test
  void should_require_a_mode() {
    var request = new XCTestRunRequest(null, "com.acme.Tests", null, null, null, null, null, null, null, false);

    assertThatThrownBy(() -> validator.validate(request))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("mode is required");
  }

  @Test
  void should_require_a_host_application_for_application_tests() {
    assertThatThrownBy(() -> validator.validate(XCTestRunRequest.applicationTest("com.acme.AppTests", null)))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("application tests require testHostAppBundleId");
  }

  @Test
  void should_require_a_target_application_for_ui_tests() {
    assertThatThrownBy(() -> validator.validate(XCTestRunRequest.uiTest("com.acme.UITests", "com.acme.Runner", null)))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("UI tests require testTargetAppBundleId");
  }

  @Test
  void should_reject_applications_for_logic_tests() {
    var request = new XCTestRunRequest(XCTestRunRequest.Mode.LOGIC, "com.acme.LogicTests", "com.acme.App", null,
      null, null, null, null, null, false);

    assertThatThrownBy(() -> validator.validate(request))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("logic tests do not accept testHostAppBundleId");
  }

  @Test
  void should_reject_tests_both_run_and_skipped() {
    var request = XCTestRunRequest.logicTest("com.acme.LogicTests")
                                  .withTestsToRun(Set.of("FooTests/testB", "FooTests/testA", "BarTests"))
                                  .withTestsToSkip(Set.of("FooTests/testA", "FooTests/testB"));

    assertThatThrownBy(() -> validator.validate(request))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("tests both run and skipped: FooTests/testA, FooTests/testB");
  }

  @Test
  void should_reject_a_non_positive_timeout() {
    assertThatThrownBy(() -> validator.validate(XCTestRunRequest.logicTest("com.acme.LogicTests").withTimeout(ZERO)))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("timeout must be positive");
  }

  @Test
  void should_report_every_violation_at_once() {
    var request = XCTestRunRequest.uiTest(null, null, null);

    assertThatThrownBy(() -> validator.validate(request))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("testBundleId is required")
      .hasMessageContaining("UI tests require testHostAppBundleId")
      .hasMessageContaining("UI tests require testTargetAppBundleId");
  }

  @Test
  void should_reject_a_test_bundle_that_is_not_installed_on_the_target() {
    // Given
    XCTestBundleStorage storage = bundleId -> "com.acme.LogicTests".equals(bundleId)
      ? Optional.of(Path.of("LogicTests.xctest"))
      : Optional.empty();
    var installedOnly = new XCTestRequestValidator(storage, "SIM-1");

    // When / Then
    assertThatCode(() -> installedOnly.validate(XCTestRunRequest.logicTest("com.acme.LogicTests"))).doesNotThrowAnyException();
    assertThatThrownBy(() -> installedOnly.validate(XCTestRunRequest.logicTest("com.acme.Missing")))
      .isInstanceOf(InvalidRequestException.class)
      .hasMessageContaining("test bundle com.acme.Missing is not installed on target SIM-1");
  }
}
