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

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/** Rows shared by the store tests. Timestamps are truncated to what PostgreSQL keeps. */
final class Fixtures {

  static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private Fixtures() {}

  static HealthSnapshot snapshot(final String organizationId, final Instant recordedAt) {
    return new HealthSnapshotBuilder()
        .cpuUsage(42.5)
        .memoryUsage(61.0)
        .diskUsage(70.25)
        .networkLatency(50.0)
        .responseTime(180.0)
        .status(HealthStatus.HEALTHY)
        .uptimeSeconds(3600)
        .activeConnections(4)
        .errorRate(1.5)
        .throughput(12.0)
        .recordedAt(recordedAt)
        .organizationId(Optional.ofNullable(organizationId))
        .build();
  }

  static MetricPoint metric(
      final String name, final double value, final String organizationId, final Instant at) {
    return new MetricPointBuilder()
        .id(UUID.randomUUID().toString())
        .metricName(name)
        .metricType(MetricType.GAUGE)
        .value(value)
        .unit("ms")
        .endpoint("/v1/chat/completions")
        .method("POST")
        .organizationId(Optional.ofNullable(organizationId))
        .recordedAt(at)
        .build();
  }

  static Alert alert(
      final AlertSeverity severity, final String organizationId, final Instant createdAt) {
    return new AlertBuilder()
        .id(UUID.randomUUID().toString())
        .alertType("system")
        .severity(severity)
        .title("High CPU Usage")
        .message("CPU usage is 97.0%")
        .status(AlertStatus.ACTIVE)
        .source("cpu_monitoring")
        .metricName("cpu_usage")
        .thresholdValue(95.0)
        .currentValue(97.0)
        .notificationSent(false)
        .notificationChannels(ImmutableList.of("email", "slack"))
        .organizationId(Optional.ofNullable(organizationId))
        .createdAt(createdAt)
        .build();
  }

  static Incident incident(final String organizationId, final Instant detectedAt) {
    return new IncidentBuilder()
        .id(UUID.randomUUID().toString())
        .incidentType("outage")
        .severity(IncidentSeverity.HIGH)
        .title("Provider unreachable")
        .description("Every completion fails")
        .status(IncidentStatus.OPEN)
        .priority(IncidentPriority.URGENT)
        .affectedServices(ImmutableList.of("chat"))
        .impactLevel(ImpactLevel.SEVERE)
        .detectedAt(detectedAt)
        .updatedAt(detectedAt)
        .organizationId(Optional.ofNullable(organizationId))
        .build();
  }
}
