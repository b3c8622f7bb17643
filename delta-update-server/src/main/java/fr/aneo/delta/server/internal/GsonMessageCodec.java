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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.JsonSyntaxException;
import fr.aneo.delta.domain.xctest.TestRunUpdate;
import fr.aneo.delta.domain.xctest.XCTestRunRequest;

import java.lang.reflect.Type;
import java.time.Duration;
import java.time.format.DateTimeParseException;

import static java.util.Objects.requireNonNull;

/**
 * JSON codec of requests and result fragments, based on Gson.
 * <p>
 * {@link Duration} values are written as ISO-8601 strings ({@code "PT1.5S"}); numbers are also
 * accepted on input and read as seconds. Any input the request type cannot be built from is reported
 * as an {@link IllegalArgumentException}.
 *
 * @param <R> the request type
 * @param <F> the result fragment type
 */
public final class GsonMessageCodec<R, F> implements RequestDecoder<R>, ResultEncoder<F> {

  private final Class<R> requestType;
  private final Gson gson;

  public GsonMessageCodec(Class<R> requestType) {
    this.requestType = requireNonNull(requestType, "requestType cannot be null");
    this.gson = new GsonBuilder()
      .registerTypeAdapter(Duration.class, new DurationAdapter())
      .disableHtmlEscaping()
      .create();
  }

  /**
   * @return the codec of XCTest requests and results
   */
  public static GsonMessageCodec<XCTestRunRequest, TestRunUpdate> forXCTest() {
    return new GsonMessageCodec<>(XCTestRunRequest.class);
  }

  @Override
  public R decode(String json) {
    if (json == null || json.isBlank()) return null;

    try {
      return gson.fromJson(json, requestType);
    } catch (JsonSyntaxException e) {
      throw new IllegalArgumentException("Invalid JSON for " + requestType.getSimpleName() + ": " + e.getMessage(), e);
    } catch (JsonParseException | IllegalStateException e) {
      throw new IllegalArgumentException("Malformed " + requestType.getSimpleName() + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      // Gson wraps failures of the request's own constructor, such as null collection elements
      var cause = e.getCause() != null ? e.getCause() : e;
      throw new IllegalArgumentException("Malformed " + requestType.getSimpleName() + ": " + cause, e);
    }
  }

  @Override
  public String encode(F result) {
    requireNonNull(result, "result cannot be null");
    return gson.toJson(result);
  }

  private static final class DurationAdapter implements JsonSerializer<Duration>, JsonDeserializer<Duration> {

    @Override
    public JsonElement serialize(Duration src, Type typeOfSrc, JsonSerializationContext context) {
      return new JsonPrimitive(src.toString());
    }

    @Override
    public Duration deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) {
      if (!json.isJsonPrimitive()) {
        throw new JsonParseException("Duration must be an ISO-8601 string or a number of seconds, got: " + json);
      }
      var primitive = json.getAsJsonPrimitive();
      if (primitive.isNumber()) {
        return Duration.ofMillis(Math.round(primitive.getAsDouble() * 1000));
      }
      try {
        return Duration.parse(primitive.getAsString());
      } catch (DateTimeParseException e) {
        throw new JsonParseException("Invalid duration: " + primitive.getAsString(), e);
      }
    }
  }
}
