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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static fr.aneo.delta.domain.DeltaUpdateConfig.CAPACITY_ENV;
import static fr.aneo.delta.domain.DeltaUpdateConfig.MAX_SESSION_LIFETIME_ENV;
import static fr.aneo.delta.domain.DeltaUpdateConfig.REAP_INTERVAL_ENV;
import static fr.aneo.delta.domain.DeltaUpdateConfig.SESSION_RETENTION_ENV;
import static java.time.Duration.ofMinutes;
import static java.time.Duration.ofSeconds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeltaUpdateConfigTest {

  @Test
  void should_use_defaults() {
    var config = DeltaUpdateConfig.defaultConfig();

    assertThat(config.sessionRetention()).isEqualTo(ofSeconds(60));
    assertThat(config.reapInterval()).isEqualTo(ofSeconds(10));
    assertThat(config.maxSessionLifetime()).isNull();
    assertThat(config.capacity()).isZero();
  }

  @Test
  void should_read_seconds_and_iso_durations_from_environment() {
    // Given
    var environment = Map.of(
      SESSION_RETENTION_ENV, "120",
      REAP_INTERVAL_ENV, "PT5S",
      MAX_SESSION_LIFETIME_ENV, "PT30M",
      CAPACITY_ENV, " 4 ");

    // When
    var config = DeltaUpdateConfig.fromEnvironment(environment);

    // Then
    assertThat(config.sessionRetention()).isEqualTo(ofSeconds(120));
    assertThat(config.reapInterval()).isEqualTo(ofSeconds(5));
    assertThat(config.maxSessionLifetime()).isEqualTo(ofMinutes(30));
    assertThat(config.capacity()).isEqualTo(4);
  }

  @Test
  void should_fall_back_to_defaults_for_blank_variables() {
    var config = DeltaUpdateConfig.fromEnvironment(Map.of(SESSION_RETENTION_ENV, " "));

    assertThat(config.sessionRetention()).isEqualTo(ofSeconds(60));
  }

  @ParameterizedTest
  @CsvSource({
    "DeltaUpdate__SessionRetention, soon",
    "DeltaUpdate__ReapInterval, 0",
    "DeltaUpdate__MaxSessionLifetime, -5",
    "DeltaUpdate__Capacity, many",
    "DeltaUpdate__Capacity, -1"
  })
  void should_reject_invalid_environment_values(String name, String value) {
    assertThatThrownBy(() -> DeltaUpdateConfig.fromEnvironment(Map.of(name, value)))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void should_reject_a_negative_retention() {
    assertThatThrownBy(() -> DeltaUpdateConfig.builder().sessionRetention(ofSeconds(-1)).build())
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("sessionRetention");
  }

  @Test
  void should_accept_a_zero_retention() {
    var config = DeltaUpdateConfig.builder().sessionRetention(ofSeconds(0)).build();

    assertThat(config.sessionRetention()).isZero();
  }
}
