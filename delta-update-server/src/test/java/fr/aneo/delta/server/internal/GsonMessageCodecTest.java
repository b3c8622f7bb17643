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

import fr.aneo.delta.domain.xctest.TestRunUpdate;
import fr.aneo.delta.domain.xctest.XCTestRunRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static java.time.Duration.ofMillis;
import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GsonMessageCodecTest {

  private final GsonMessageCodec<XCTestRunRequest, TestRunUpdate> codec = GsonMessageCodec.forXCTest();

  @Test
  void should_decode_a_complete_request() {
    // Given
    var json = """
      {
        "mode": "UI",
        "testBundleId": "com.acme.UITests",
        "testHostAppBundleId": "com.acme.Runner",
        "testTargetAppBundleId": "com.acme.App",
        "testsToRun": ["LoginTests/testLogin"],
        "testsToSkip": ["LoginTests/testLogout"],
        "environment": {"LOCALE": "fr_FR"},
        "arguments": ["-AppleLanguages", "(fr)"],
        "timeout": "PT10M",
        "collectResultBundle": true
      }
      """;

    // When
    var request = codec.decode(json);

    // Then
    assertThat(request.mode()).isEqualTo(XCTestRunRequest.Mode.UI);
    assertThat(request.testHostAppBundleId()).isEqualTo("com.acme.Runner");
    assertThat(request.testTargetAppBundleId()).isEqualTo("com.acme.App");
    assertThat(request.testsToRun()).containsExactly("LoginTests/testLogin");
    assertThat(request.testsToSkip()).containsExactly("LoginTests/testLogout");
    assertThat(request.environment()).containsEntry("LOCALE", "fr_FR");
    assertThat(request.arguments()).containsExactly("-AppleLanguages", "(fr)");
    assertThat(request.timeout()).hasMinutes(10);
    assertThat(request.collectResultBundle()).isTrue();
  }

  @Test
  void should_default_missing_collections_to_empty() {
    var request = codec.decode("{\"mode\":\"LOGIC\",\"testBundleId\":\"com.acme.LogicTests\"}");

    assertThat(request.testsToRun()).isEmpty();
    assertThat(request.environment()).isEmpty();
    assertThat(request.arguments()).isEmpty();
    assertThat(request.timeout()).isNull();
    assertThat(request.collectResultBundle()).isFalse();
  }

  @Test
  void should_read_numeric_timeouts_as_seconds() {
    var request = codec.decode("{\"mode\":\"LOGIC\",\"testBundleId\":\"b\",\"timeout\":90}");

    assertThat(request.timeout()).isEqualTo(ofSeconds(90));
  }

  @Test
  void should_decode_blank_input_as_no_request() {
    assertThat(codec.decode("  ")).isNull();
  }

  @Test
  void should_reject_malformed_json() {
    assertThatThrownBy(() -> codec.decode("{\"mode\":"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("XCTestRunRequest");
  }

  @Test
  void should_reject_null_elements_in_collections() {
    assertThatThrownBy(() -> codec.decode("{\"mode\":\"LOGIC\",\"testBundleId\":\"b\",\"testsToRun\":[null]}"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("XCTestRunRequest");
    assertThatThrownBy(() -> codec.decode("{\"mode\":\"LOGIC\",\"testBundleId\":\"b\",\"environment\":{\"A\":null}}"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("XCTestRunRequest");
  }

  @Test
  void should_reject_invalid_durations() {
    assertThatThrownBy(() -> codec.decode("{\"mode\":\"LOGIC\",\"testBundleId\":\"b\",\"timeout\":\"ten minutes\"}"))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void should_encode_results_with_iso_durations() {
    // Given
    var update = new TestRunUpdate("FooTests", "testA", TestRunUpdate.Status.CRASHED, ofMillis(250),
      "EXC_BAD_ACCESS", List.of("<unknown>:0: crashed"));

    // When
    var json = codec.encode(update);

    // Then
    assertThat(json).isEqualTo("{\"className\":\"FooTests\",\"methodName\":\"testA\",\"status\":\"CRASHED\","
      + "\"duration\":\"PT0.25S\",\"failureMessage\":\"EXC_BAD_ACCESS\",\"logs\":[\"<unknown>:0: crashed\"]}");
  }
}
