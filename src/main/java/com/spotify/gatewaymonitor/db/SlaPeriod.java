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

package com.spotify.gatewaymonitor.db;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Duration;

public enum SlaPeriod {
  DAILY("daily", Duration.ofDays(1)),
  WEEKLY("weekly", Duration.ofDays(7)),
  MONTHLY("monthly", Duration.ofDays(30));

  private final String value;
  private final Duration length;

  SlaPeriod(final String value, final Duration length) {
    this.value = value;
    this.length = length;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public Duration length() {
    return length;
  }

  @JsonCreator
  public static SlaPeriod fromValue(final String value) {
    for (final SlaPeriod period : values()) {
      if (period.value.equalsIgnoreCase(value)) {
        return period;
      }
    }
    throw new IllegalArgumentException("Unknown SlaPeriod " + value);
  }
}
