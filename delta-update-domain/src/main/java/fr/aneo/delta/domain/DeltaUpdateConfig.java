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

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration of a {@link DeltaUpdateManager}.
 * <p>
 * Create instances using {@link #builder()}, or from environment variables with
 * {@link #fromEnvironment(Map)}.
 *
 * <h2>Environment Variables</h2>
 * <dl>
 *   <dt><code>DeltaUpdate__SessionRetention</code></dt>
 *   <dd>How long terminated sessions stay pollable before being reaped.</dd>
 *   <dt><code>DeltaUpdate__ReapInterval</code></dt>
 *   <dd>Delay between two sweeps of the session reaper.</dd>
 *   <dt><code>DeltaUpdate__MaxSessionLifetime</code></dt>
 *   <dd>Running sessions older than this are terminated automatically. Unset means no limit.</dd>
 *   <dt><code>DeltaUpdate__Capacity</code></dt>
 *   <dd>Maximum number of sessions running at the same time. {@code 0} means unbounded.</dd>
 * </dl>
 * Durations are given either in seconds ({@code "90"}) or in ISO-8601 ({@code "PT1M30S"}).
 *
 * @see DeltaUpdateManager
 * @see SessionReaper
 */
public final class DeltaUpdateConfig {

  static final String SESSION_RETENTION_ENV = "DeltaUpdate__SessionRetention";
  static final String REAP_INTERVAL_ENV = "DeltaUpdate__ReapInterval";
  static final String MAX_SESSION_LIFETIME_ENV = "DeltaUpdate__MaxSessionLifetime";
  static final String CAPACITY_ENV = "DeltaUpdate__Capacity";

  private final Duration sessionRetention;
  private final Duration reapInterval;
  private final Duration maxSessionLifetime;
  private final int capacity;

  private DeltaUpdateConfig(Builder builder) {
    this.sessionRetention = builder.sessionRetention;
    this.reapInterval = builder.reapInterval;
    this.maxSessionLifetime = builder.maxSessionLifetime;
    this.capacity = builder.capacity;
  }

  /**
   * Returns how long a terminated session remains available to pollers before it is reaped.
   *
   * @return the retention period; defaults to 60 seconds
   */
  public Duration sessionRetention() {
    return sessionRetention;
  }

  /**
   * @return the delay between two reaper sweeps; defaults to 10 seconds
   */
  public Duration reapInterval() {
    return reapInterval;
  }

  /**
   * Returns the maximum time a session may run before it is terminated as if
   * {@link DeltaUpdateManager#terminate(SessionId)} had been called.
   *
   * @return the lifetime limit, or {@code null} when sessions may run indefinitely
   */
  public Duration maxSessionLifetime() {
    return maxSessionLifetime;
  }

  /**
   * @return the maximum number of live sessions, {@code 0} for no limit
   */
  public int capacity() {
    return capacity;
  }

  /**
   * @return a configuration with every default value
   */
  public static DeltaUpdateConfig defaultConfig() {
    return builder().build();
  }

  /**
   * Creates a new builder for constructing a {@link DeltaUpdateConfig}.
   *
   * @return a new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a configuration from environment variables, falling back to defaults for unset ones.
   *
   * @param environment the environment, typically {@code System.getenv()}
   * @return the configuration
   * @throws IllegalArgumentException if a variable cannot be parsed or the result is invalid
   */
  public static DeltaUpdateConfig fromEnvironment(Map<String, String> environment) {
    requireNonNull(environment, "environment must not be null");

    var builder = builder();
    var retention = environment.get(SESSION_RETENTION_ENV);
    if (isSet(retention)) builder.sessionRetention(parseDuration(SESSION_RETENTION_ENV, retention));

    var reapInterval = environment.get(REAP_INTERVAL_ENV);
    if (isSet(reapInterval)) builder.reapInterval(parseDuration(REAP_INTERVAL_ENV, reapInterval));

    var lifetime = environment.get(MAX_SESSION_LIFETIME_ENV);
    if (isSet(lifetime)) builder.maxSessionLifetime(parseDuration(MAX_SESSION_LIFETIME_ENV, lifetime));

    var capacity = environment.get(CAPACITY_ENV);
    if (isSet(capacity)) {
      try {
        builder.capacity(Integer.parseInt(capacity.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(CAPACITY_ENV + " must be an integer, got: " + capacity, e);
      }
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return "DeltaUpdateConfig{" +
      "sessionRetention=" + sessionRetention +
      ", reapInterval=" + reapInterval +
      ", maxSessionLifetime=" + maxSessionLifetime +
      ", capacity=" + capacity +
      '}';
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }

  private static Duration parseDuration(String name, String value) {
    var trimmed = value.trim();
    try {
      if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
        return Duration.parse(trimmed);
      }
      return Duration.ofSeconds(Long.parseLong(trimmed));
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new IllegalArgumentException(name + " must be a number of seconds or an ISO-8601 duration, got: " + value, e);
    }
  }

  /**
   * Builder for {@link DeltaUpdateConfig}.
   */
  public static final class Builder {
    private Duration sessionRetention = Duration.ofSeconds(60);
    private Duration reapInterval = Duration.ofSeconds(10);
    private Duration maxSessionLifetime;
    private int capacity;

    private Builder() {
    }

    /**
     * Sets how long terminated sessions remain pollable.
     *
     * @param sessionRetention the retention period; must be zero or positive
     * @return this builder
     */
    public Builder sessionRetention(Duration sessionRetention) {
      this.sessionRetention = sessionRetention;
      return this;
    }

    /**
     * Sets the delay between two reaper sweeps.
     *
     * @param reapInterval the interval; must be positive
     * @return this builder
     */
    public Builder reapInterval(Duration reapInterval) {
      this.reapInterval = reapInterval;
      return this;
    }

    /**
     * Sets the maximum lifetime of a running session.
     *
     * @param maxSessionLifetime the lifetime; {@code null} for no limit
     * @return this builder
     */
    public Builder maxSessionLifetime(Duration maxSessionLifetime) {
      this.maxSessionLifetime = maxSessionLifetime;
      return this;
    }

    /**
     * Sets the maximum number of live sessions.
     *
     * @param capacity the capacity; {@code 0} for no limit
     * @return this builder
     */
    public Builder capacity(int capacity) {
      this.capacity = capacity;
      return this;
    }

    /**
     * Builds the immutable {@link DeltaUpdateConfig} instance.
     *
     * @return a new {@link DeltaUpdateConfig} instance
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public DeltaUpdateConfig build() {
      validate();
      return new DeltaUpdateConfig(this);
    }

    private void validate() {
      if (sessionRetention == null || sessionRetention.isNegative())
        throw new IllegalArgumentException("sessionRetention must be zero or positive");

      if (reapInterval == null || reapInterval.isNegative() || reapInterval.isZero())
        throw new IllegalArgumentException("reapInterval must be positive");

      if (maxSessionLifetime != null && (maxSessionLifetime.isNegative() || maxSessionLifetime.isZero()))
        throw new IllegalArgumentException("maxSessionLifetime must be positive when set");

      if (capacity < 0)
        throw new IllegalArgumentException("capacity must be >= 0");
    }
  }
}
