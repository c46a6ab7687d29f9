/*-
 * -\-\-
 * gateway-monitor
 * --
 * Copyright (C) 2024 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.gatewaymonitor.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spotify.gatewaymonitor.util.MonitoringException;
import java.util.Map;
import java.util.function.Function;

/** Request parsing shared by the resources; bad input becomes an invalid field error. */
final class Params {

  private static final TypeReference<Map<String, Object>> JSON_OBJECT =
      new TypeReference<Map<String, Object>>() {};

  private Params() {}

  /** @return the parsed value, or null when the parameter was not given */
  static <T> T optional(
      final String field, final String raw, final Function<String, T> parser) {
    if (raw == null || raw.isEmpty()) {
      return null;
    }
    try {
      return parser.apply(raw);
    } catch (final IllegalArgumentException e) {
      throw MonitoringException.invalidField(field, "unrecognized value " + raw);
    }
  }

  static Map<String, Object> jsonObject(final ObjectMapper mapper, final String body) {
    if (body == null || body.trim().isEmpty()) {
      throw MonitoringException.invalidField("body", "a JSON object is required");
    }
    try {
      final Map<String, Object> parsed = mapper.readValue(body, JSON_OBJECT);
      if (parsed == null) {
        throw MonitoringException.invalidField("body", "a JSON object is required");
      }
      return parsed;
    } catch (final JsonProcessingException e) {
      throw MonitoringException.invalidField("body", "malformed JSON: " + e.getOriginalMessage());
    }
  }
}
