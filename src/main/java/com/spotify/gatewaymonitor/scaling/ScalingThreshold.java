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

package com.spotify.gatewaymonitor.scaling;

import java.util.Optional;

public enum ScalingThreshold {
  CPU_HIGH("cpu_high", 80.0),
  CPU_CRITICAL("cpu_critical", 95.0),
  MEMORY_HIGH("memory_high", 80.0),
  MEMORY_CRITICAL("memory_critical", 95.0),
  RESPONSE_TIME_HIGH("response_time_high", 1000.0),
  RESPONSE_TIME_CRITICAL("response_time_critical", 5000.0),
  CONCURRENT_USERS_HIGH("concurrent_users_high", 1000.0),
  CONCURRENT_USERS_CRITICAL("concurrent_users_critical", 5000.0);

  private final String key;
  private final double defaultValue;

  ScalingThreshold(final String key, final double defaultValue) {
    this.key = key;
    this.defaultValue = defaultValue;
  }

  public String key() {
    return key;
  }

  public double defaultValue() {
    return defaultValue;
  }

  public static Optional<ScalingThreshold> fromKey(final String key) {
    for (final ScalingThreshold threshold : values()) {
      if (threshold.key.equals(key)) {
        return Optional.of(threshold);
      }
    }
    return Optional.empty();
  }
}
