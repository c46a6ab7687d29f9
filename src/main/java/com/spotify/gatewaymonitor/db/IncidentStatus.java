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

/** Incident lifecycle. Declaration order is the only direction an incident may move in. */
public enum IncidentStatus {
  OPEN("open"),
  INVESTIGATING("investigating"),
  RESOLVED("resolved"),
  CLOSED("closed");

  private final String value;

  IncidentStatus(final String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isBefore(final IncidentStatus other) {
    return ordinal() < other.ordinal();
  }

  public boolean isActive() {
    return this == OPEN || this == INVESTIGATING;
  }

  @JsonCreator
  public static IncidentStatus fromValue(final String value) {
    for (final IncidentStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown IncidentStatus " + value);
  }
}
