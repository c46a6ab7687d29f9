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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for health snapshots, metric points and the alert, threshold, SLA and incident
 * rows derived from them.
 *
 * <p>A {@code null} organization id in a query means "any organization". Implementations report
 * backend failures as {@link com.spotify.gatewaymonitor.util.MonitoringException} with {@link
 * com.spotify.gatewaymonitor.util.ErrorCode#STORE_UNAVAILABLE}.
 */
public interface MetricStore extends AutoCloseable {

  void insertSnapshot(HealthSnapshot snapshot);

  Optional<HealthSnapshot> getLatestSnapshot(String organizationId);

  /** Snapshots recorded at or after {@code since}, oldest first. */
  List<HealthSnapshot> getSnapshots(String organizationId, Instant since);

  void insertMetric(MetricPoint point);

  /** Points recorded at or after {@code since}, newest first. A null name matches every metric. */
  List<MetricPoint> getMetrics(String metricName, String organizationId, Instant since);

  Optional<Alert> findActiveAlert(
      String alertType, AlertSeverity severity, String source, String organizationId);

  /** Every active alert of a family, regardless of severity. */
  List<Alert> getActiveAlerts(String alertType, String source, String organizationId);

  /** @throws IllegalStateException when an active alert with the same key already exists */
  void insertAlert(Alert alert);

  boolean updateAlert(Alert alert);

  Optional<Alert> getAlert(String alertId, String organizationId);

  /** Newest first. Null filters match everything. */
  List<Alert> getAlerts(
      String organizationId,
      AlertStatus status,
      AlertSeverity severity,
      String alertType,
      Instant since,
      int limit,
      int offset);

  Optional<ThresholdConfig> getThresholdConfig(String configKey);

  void saveThresholdConfig(ThresholdConfig config);

  void insertSlaMetric(SlaMetric metric);

  List<SlaMetric> getSlaMetrics(String organizationId, int limit);

  void insertIncident(Incident incident);

  boolean updateIncident(Incident incident);

  Optional<Incident> getIncident(String incidentId, String organizationId);

  /** Newest first. Null filters match everything. */
  List<Incident> getIncidents(
      String organizationId,
      List<IncidentStatus> statuses,
      IncidentSeverity severity,
      int limit,
      int offset);

  void healthCheck();

  int getTotalConnections();

  void migrate();

  @Override
  void close();
}
