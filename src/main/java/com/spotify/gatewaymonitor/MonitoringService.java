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

package com.spotify.gatewaymonitor;

import static com.google.common.base.Preconditions.checkNotNull;

import com.spotify.gatewaymonitor.alert.AlertEngine;
import com.spotify.gatewaymonitor.db.Alert;
import com.spotify.gatewaymonitor.db.AlertSeverity;
import com.spotify.gatewaymonitor.db.AlertStatus;
import com.spotify.gatewaymonitor.db.HealthSnapshot;
import com.spotify.gatewaymonitor.db.MetricPoint;
import com.spotify.gatewaymonitor.db.MetricPointBuilder;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.db.MetricType;
import com.spotify.gatewaymonitor.db.ThresholdConfig;
import com.spotify.gatewaymonitor.health.HealthSampler;
import com.spotify.gatewaymonitor.health.HostProbe;
import com.spotify.gatewaymonitor.incident.IncidentService;
import com.spotify.gatewaymonitor.scaling.ScalabilityAnalysis;
import com.spotify.gatewaymonitor.scaling.ScalabilityAnalysisBuilder;
import com.spotify.gatewaymonitor.scaling.ScalingAdvisor;
import com.spotify.gatewaymonitor.scaling.ScalingConfiguration;
import com.spotify.gatewaymonitor.scaling.ScalingMetrics;
import com.spotify.gatewaymonitor.scaling.ScalingMetricsBuilder;
import com.spotify.gatewaymonitor.threshold.ThresholdConfigService;
import com.spotify.gatewaymonitor.util.MonitoringException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point for the monitoring operations exposed over HTTP and run by the collector. */
public class MonitoringService {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringService.class);

  static final int DEFAULT_METRIC_HOURS = 24;
  static final int MAX_METRIC_HOURS = 168;
  static final Duration DASHBOARD_ALERT_WINDOW = Duration.ofHours(24);
  static final int DASHBOARD_ALERTS = 10;
  static final int DASHBOARD_SLA_ROWS = 5;
  static final int DASHBOARD_INCIDENTS = 5;

  // used for scaling analysis before the first snapshot exists
  static final double FALLBACK_RESPONSE_TIME = 100.0;
  static final int FALLBACK_CONNECTIONS = 10;
  static final double FALLBACK_THROUGHPUT = 10.0;

  private final MetricStore store;
  private final HealthSampler sampler;
  private final HostProbe probe;
  private final AlertEngine alertEngine;
  private final ThresholdConfigService thresholds;
  private final ScalingAdvisor scalingAdvisor;
  private final IncidentService incidents;
  private final Supplier<Instant> timeSupplier;

  public MonitoringService(
      final MetricStore store,
      final HealthSampler sampler,
      final HostProbe probe,
      final AlertEngine alertEngine,
      final ThresholdConfigService thresholds,
      final ScalingAdvisor scalingAdvisor,
      final IncidentService incidents,
      final Supplier<Instant> timeSupplier) {
    this.store = checkNotNull(store);
    this.sampler = checkNotNull(sampler);
    this.probe = checkNotNull(probe);
    this.alertEngine = checkNotNull(alertEngine);
    this.thresholds = checkNotNull(thresholds);
    this.scalingAdvisor = checkNotNull(scalingAdvisor);
    this.incidents = checkNotNull(incidents);
    this.timeSupplier = checkNotNull(timeSupplier);
  }

  public HealthSnapshot collectHealth(final String organizationId) {
    try {
      LoggerContext.pushContext(organizationId);
      return sampler.sample(organizationId);
    } finally {
      LoggerContext.clearContext();
    }
  }

  public MetricPoint recordMetric(
      final String metricName,
      final Double value,
      final String unit,
      final String endpoint,
      final String method,
      final String userId,
      final String organizationId,
      final MetricType metricType) {
    if (metricName == null || metricName.trim().isEmpty()) {
      throw MonitoringException.invalidField("metric_name", "is required");
    }
    if (value == null || !Double.isFinite(value)) {
      throw MonitoringException.invalidField("value", "must be a finite number");
    }
    if (unit == null || unit.trim().isEmpty()) {
      throw MonitoringException.invalidField("unit", "is required");
    }
    final MetricPoint point =
        new MetricPointBuilder()
            .id(UUID.randomUUID().toString())
            .metricName(metricName)
            .metricType(metricType == null ? MetricType.GAUGE : metricType)
            .value(value)
            .unit(unit)
            .endpoint(Optional.ofNullable(endpoint))
            .method(Optional.ofNullable(method))
            .userId(Optional.ofNullable(userId))
            .organizationId(Optional.ofNullable(organizationId))
            .recordedAt(timeSupplier.get())
            .build();
    store.insertMetric(point);
    return point;
  }

  public List<MetricPoint> listMetrics(
      final String organizationId, final String metricName, final int hours) {
    if (hours < 1 || hours > MAX_METRIC_HOURS) {
      throw MonitoringException.invalidField(
          "hours", "must be between 1 and " + MAX_METRIC_HOURS);
    }
    return store.getMetrics(
        metricName, organizationId, timeSupplier.get().minus(Duration.ofHours(hours)));
  }

  public List<Alert> listAlerts(
      final String organizationId,
      final AlertStatus status,
      final AlertSeverity severity,
      final String alertType,
      final int limit,
      final int offset) {
    return alertEngine.listAlerts(organizationId, status, severity, alertType, limit, offset);
  }

  public Alert acknowledgeAlert(
      final String alertId, final String actorId, final String organizationId) {
    return alertEngine.acknowledge(alertId, actorId, organizationId);
  }

  public Alert resolveAlert(final String alertId, final String organizationId) {
    return alertEngine.resolve(alertId, organizationId);
  }

  public ThresholdConfig getThresholdConfig(final String organizationId) {
    return thresholds.get(organizationId);
  }

  public ThresholdConfig updateThresholdConfig(
      final String organizationId, final Map<String, Object> partial) {
    return thresholds.update(organizationId, partial);
  }

  public HealthDashboard dashboard(final String organizationId) {
    final Instant now = timeSupplier.get();
    final Optional<HealthSnapshot> latest = store.getLatestSnapshot(organizationId);
    return new HealthDashboardBuilder()
        .status(latest.map(s -> s.status().value()).orElse("unknown"))
        .currentHealth(latest)
        .recentAlerts(
            alertEngine.recentAlerts(
                organizationId, now.minus(DASHBOARD_ALERT_WINDOW), DASHBOARD_ALERTS))
        .slaMetrics(store.getSlaMetrics(organizationId, DASHBOARD_SLA_ROWS))
        .activeIncidents(incidents.openIncidents(organizationId, DASHBOARD_INCIDENTS))
        .generatedAt(now)
        .build();
  }

  public ScalabilityAnalysis analyzeScalability(final String organizationId) {
    final ScalingMetrics current = currentScalingMetrics(organizationId);
    final ScalingConfiguration configuration = scalingAdvisor.configuration();
    return new ScalabilityAnalysisBuilder()
        .currentMetrics(current)
        .scalingRecommendations(scalingAdvisor.analyze(current))
        .scalingHistory(configuration.scalingHistory())
        .autoScalingEnabled(configuration.autoScalingEnabled())
        .currentInstances(configuration.currentInstances())
        .maxInstances(configuration.maxInstances())
        .build();
  }

  private ScalingMetrics currentScalingMetrics(final String organizationId) {
    final Optional<HealthSnapshot> latest = store.getLatestSnapshot(organizationId);
    if (latest.isPresent()) {
      final HealthSnapshot snapshot = latest.get();
      return new ScalingMetricsBuilder()
          .cpuUsage(snapshot.cpuUsage())
          .memoryUsage(snapshot.memoryUsage())
          .responseTime(snapshot.responseTime())
          .activeConnections(snapshot.activeConnections())
          .throughput(snapshot.throughput())
          .recordedAt(snapshot.recordedAt())
          .build();
    }
    return new ScalingMetricsBuilder()
        .cpuUsage(liveReading("cpu", probe::cpuUsage))
        .memoryUsage(liveReading("memory", probe::memoryUsage))
        .responseTime(FALLBACK_RESPONSE_TIME)
        .activeConnections(FALLBACK_CONNECTIONS)
        .throughput(FALLBACK_THROUGHPUT)
        .recordedAt(timeSupplier.get())
        .build();
  }

  private static double liveReading(final String name, final DoubleSupplier reading) {
    try {
      return reading.getAsDouble();
    } catch (final RuntimeException e) {
      LOGGER.warn("Failed to read {} for scaling analysis", name, e);
      return 0.0;
    }
  }
}
