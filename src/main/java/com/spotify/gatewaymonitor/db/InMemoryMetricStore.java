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

import com.google.common.collect.Lists;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/** Store kept on the heap, used for local runs and tests. Every method is synchronized. */
public class InMemoryMetricStore implements MetricStore {

  private final List<HealthSnapshot> snapshots = new ArrayList<>();
  private final List<MetricPoint> metrics = new ArrayList<>();
  private final Map<String, Alert> alerts = new LinkedHashMap<>();
  private final Map<String, ThresholdConfig> thresholdConfigs = new HashMap<>();
  private final List<SlaMetric> slaMetrics = new ArrayList<>();
  private final Map<String, Incident> incidents = new LinkedHashMap<>();

  @Override
  public synchronized void insertSnapshot(final HealthSnapshot snapshot) {
    snapshots.add(snapshot);
  }

  @Override
  public synchronized Optional<HealthSnapshot> getLatestSnapshot(final String organizationId) {
    return newestFirst(snapshots, HealthSnapshot::recordedAt)
        .stream()
        .filter(s -> matches(organizationId, s.organizationId()))
        .findFirst();
  }

  @Override
  public synchronized List<HealthSnapshot> getSnapshots(
      final String organizationId, final Instant since) {
    return snapshots
        .stream()
        .filter(s -> matches(organizationId, s.organizationId()))
        .filter(s -> !s.recordedAt().isBefore(since))
        .sorted(Comparator.comparing(HealthSnapshot::recordedAt))
        .collect(Collectors.toList());
  }

  @Override
  public synchronized void insertMetric(final MetricPoint point) {
    metrics.add(point);
  }

  @Override
  public synchronized List<MetricPoint> getMetrics(
      final String metricName, final String organizationId, final Instant since) {
    return newestFirst(metrics, MetricPoint::recordedAt)
        .stream()
        .filter(p -> metricName == null || metricName.equals(p.metricName()))
        .filter(p -> matches(organizationId, p.organizationId()))
        .filter(p -> !p.recordedAt().isBefore(since))
        .collect(Collectors.toList());
  }

  @Override
  public synchronized Optional<Alert> findActiveAlert(
      final String alertType,
      final AlertSeverity severity,
      final String source,
      final String organizationId) {
    return alerts
        .values()
        .stream()
        .filter(a -> a.status() == AlertStatus.ACTIVE)
        .filter(a -> a.alertType().equals(alertType))
        .filter(a -> a.severity() == severity)
        .filter(a -> a.source().equals(source))
        .filter(a -> a.organizationId().equals(Optional.ofNullable(organizationId)))
        .findFirst();
  }

  @Override
  public synchronized List<Alert> getActiveAlerts(
      final String alertType, final String source, final String organizationId) {
    return alerts
        .values()
        .stream()
        .filter(a -> a.status() == AlertStatus.ACTIVE)
        .filter(a -> a.alertType().equals(alertType))
        .filter(a -> a.source().equals(source))
        .filter(a -> a.organizationId().equals(Optional.ofNullable(organizationId)))
        .collect(Collectors.toList());
  }

  @Override
  public synchronized void insertAlert(final Alert alert) {
    if (alert.status() == AlertStatus.ACTIVE
        && findActiveAlert(
                alert.alertType(),
                alert.severity(),
                alert.source(),
                alert.organizationId().orElse(null))
            .isPresent()) {
      throw new IllegalStateException("Duplicate active alert " + alert.title());
    }
    alerts.put(alert.id(), alert);
  }

  @Override
  public synchronized boolean updateAlert(final Alert alert) {
    return alerts.replace(alert.id(), alert) != null;
  }

  @Override
  public synchronized Optional<Alert> getAlert(final String alertId, final String organizationId) {
    return Optional.ofNullable(alerts.get(alertId))
        .filter(a -> a.organizationId().equals(Optional.ofNullable(organizationId)));
  }

  @Override
  public synchronized List<Alert> getAlerts(
      final String organizationId,
      final AlertStatus status,
      final AlertSeverity severity,
      final String alertType,
      final Instant since,
      final int limit,
      final int offset) {
    final Predicate<Alert> filter =
        a ->
            matches(organizationId, a.organizationId())
                && (status == null || a.status() == status)
                && (severity == null || a.severity() == severity)
                && (alertType == null || alertType.equals(a.alertType()))
                && (since == null || !a.createdAt().isBefore(since));
    return newestFirst(alerts.values(), Alert::createdAt)
        .stream()
        .filter(filter)
        .skip(offset)
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized Optional<ThresholdConfig> getThresholdConfig(final String configKey) {
    return Optional.ofNullable(thresholdConfigs.get(configKey));
  }

  @Override
  public synchronized void saveThresholdConfig(final ThresholdConfig config) {
    thresholdConfigs.put(config.configKey(), config);
  }

  @Override
  public synchronized void insertSlaMetric(final SlaMetric metric) {
    slaMetrics.add(metric);
  }

  @Override
  public synchronized List<SlaMetric> getSlaMetrics(final String organizationId, final int limit) {
    return newestFirst(slaMetrics, SlaMetric::recordedAt)
        .stream()
        .filter(m -> matches(organizationId, m.organizationId()))
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized void insertIncident(final Incident incident) {
    incidents.put(incident.id(), incident);
  }

  @Override
  public synchronized boolean updateIncident(final Incident incident) {
    return incidents.replace(incident.id(), incident) != null;
  }

  @Override
  public synchronized Optional<Incident> getIncident(
      final String incidentId, final String organizationId) {
    return Optional.ofNullable(incidents.get(incidentId))
        .filter(i -> i.organizationId().equals(Optional.ofNullable(organizationId)));
  }

  @Override
  public synchronized List<Incident> getIncidents(
      final String organizationId,
      final List<IncidentStatus> statuses,
      final IncidentSeverity severity,
      final int limit,
      final int offset) {
    return newestFirst(incidents.values(), Incident::detectedAt)
        .stream()
        .filter(i -> matches(organizationId, i.organizationId()))
        .filter(i -> statuses == null || statuses.contains(i.status()))
        .filter(i -> severity == null || i.severity() == severity)
        .skip(offset)
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public void healthCheck() {}

  @Override
  public int getTotalConnections() {
    return 0;
  }

  @Override
  public void migrate() {}

  @Override
  public void close() {}

  private static boolean matches(final String organizationId, final Optional<String> actual) {
    return organizationId == null || Objects.equals(organizationId, actual.orElse(null));
  }

  // Later insertions win ties on the timestamp.
  private static <T> List<T> newestFirst(
      final Iterable<T> rows, final Function<T, Instant> timestamp) {
    final List<T> reversed = Lists.reverse(Lists.newArrayList(rows));
    return reversed
        .stream()
        .sorted(Comparator.comparing(timestamp).reversed())
        .collect(Collectors.toList());
  }
}
