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

package com.spotify.gatewaymonitor.health;

import static com.google.common.base.Preconditions.checkNotNull;

import com.spotify.gatewaymonitor.alert.AlertEngine;
import com.spotify.gatewaymonitor.db.HealthSnapshot;
import com.spotify.gatewaymonitor.db.HealthSnapshotBuilder;
import com.spotify.gatewaymonitor.db.HealthStatus;
import com.spotify.gatewaymonitor.db.MetricPoint;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.metric.MonitorMetrics;
import com.spotify.gatewaymonitor.threshold.ThresholdConfigService;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects a point-in-time health snapshot, stores it and hands it to the {@link AlertEngine}.
 *
 * <p>Host readings come from a {@link HostProbe}, request figures from recent metric points. Any
 * single reading that fails is replaced by its default. When cpu, memory and disk all fail the
 * collection is treated as failed: an error snapshot is returned and nothing is stored or
 * evaluated.
 */
public class HealthSampler {

  private static final Logger LOGGER = LoggerFactory.getLogger(HealthSampler.class);

  static final double DEFAULT_UTILIZATION = 0.0;
  static final double DEFAULT_LATENCY = 50.0;
  static final double DEFAULT_RESPONSE_TIME = 100.0;
  static final double DEFAULT_ERROR_RATE = 0.0;
  static final double DEFAULT_THROUGHPUT = 10.0;

  static final double WARNING_LEVEL = 80.0;
  static final double CRITICAL_LEVEL = 95.0;

  private static final Duration RESPONSE_TIME_WINDOW = Duration.ofMinutes(5);
  private static final Duration ERROR_WINDOW = Duration.ofMinutes(5);
  private static final Duration THROUGHPUT_WINDOW = Duration.ofMinutes(1);

  private final MetricStore store;
  private final HostProbe probe;
  private final AlertEngine alertEngine;
  private final ThresholdConfigService thresholds;
  private final MonitorMetrics metrics;
  private final Supplier<Instant> timeSupplier;
  private final Instant startedAt;

  public HealthSampler(
      final MetricStore store,
      final HostProbe probe,
      final AlertEngine alertEngine,
      final ThresholdConfigService thresholds,
      final MonitorMetrics metrics,
      final Supplier<Instant> timeSupplier) {
    this.store = checkNotNull(store);
    this.probe = checkNotNull(probe);
    this.alertEngine = checkNotNull(alertEngine);
    this.thresholds = checkNotNull(thresholds);
    this.metrics = checkNotNull(metrics);
    this.timeSupplier = checkNotNull(timeSupplier);
    this.startedAt = timeSupplier.get();
  }

  public HealthSnapshot sample(final String organizationId) {
    final Instant now = timeSupplier.get();
    final List<String> failures = new ArrayList<>();

    final double cpu = hostReading("cpu", probe::cpuUsage, DEFAULT_UTILIZATION, failures);
    final double memory = hostReading("memory", probe::memoryUsage, DEFAULT_UTILIZATION, failures);
    final double disk = hostReading("disk", probe::diskUsage, DEFAULT_UTILIZATION, failures);
    // latency alone is not enough to describe the host
    final boolean utilizationUnavailable = failures.size() == 3;
    final double latency =
        hostReading("network latency", probe::networkLatency, DEFAULT_LATENCY, failures);

    final HealthSnapshotBuilder builder =
        new HealthSnapshotBuilder()
            .cpuUsage(cpu)
            .memoryUsage(memory)
            .diskUsage(disk)
            .networkLatency(latency)
            .uptimeSeconds(Duration.between(startedAt, now).getSeconds())
            .organizationId(Optional.ofNullable(organizationId))
            .recordedAt(now);

    if (utilizationUnavailable) {
      metrics.markCollectionFailure();
      LOGGER.error("Health collection failed, no utilization reading available: {}", failures);
      return builder
          .responseTime(DEFAULT_RESPONSE_TIME)
          .errorRate(DEFAULT_ERROR_RATE)
          .throughput(DEFAULT_THROUGHPUT)
          .activeConnections(0)
          .status(HealthStatus.ERROR)
          .error(String.join("; ", failures))
          .build();
    }

    final HealthSnapshot snapshot =
        builder
            .responseTime(averageResponseTime(now))
            .errorRate(errorRate(now))
            .throughput(throughput(now))
            .activeConnections(activeConnections())
            .status(status(cpu, memory, disk))
            .error(Optional.empty())
            .build();

    store.insertSnapshot(snapshot);
    metrics.markCollection();
    alertEngine.evaluate(snapshot, thresholds.get(organizationId), organizationId);
    return snapshot;
  }

  static HealthStatus status(final double cpu, final double memory, final double disk) {
    if (cpu > CRITICAL_LEVEL || memory > CRITICAL_LEVEL || disk > CRITICAL_LEVEL) {
      return HealthStatus.CRITICAL;
    }
    if (cpu > WARNING_LEVEL || memory > WARNING_LEVEL || disk > WARNING_LEVEL) {
      return HealthStatus.WARNING;
    }
    return HealthStatus.HEALTHY;
  }

  private double hostReading(
      final String name,
      final DoubleSupplier reading,
      final double fallback,
      final List<String> failures) {
    try {
      return reading.getAsDouble();
    } catch (final RuntimeException e) {
      LOGGER.warn("Failed to read {}, using {}", name, fallback, e);
      failures.add(name + ": " + e.getMessage());
      return fallback;
    }
  }

  private double averageResponseTime(final Instant now) {
    try {
      final OptionalDouble average =
          store
              .getMetrics(MetricPoint.API_RESPONSE_TIME, null, now.minus(RESPONSE_TIME_WINDOW))
              .stream()
              .mapToDouble(MetricPoint::value)
              .average();
      return average.orElse(DEFAULT_RESPONSE_TIME);
    } catch (final RuntimeException e) {
      LOGGER.warn("Failed to read response times, using {}", DEFAULT_RESPONSE_TIME, e);
      return DEFAULT_RESPONSE_TIME;
    }
  }

  private double errorRate(final Instant now) {
    try {
      final List<MetricPoint> errors =
          store.getMetrics(MetricPoint.API_ERRORS, null, now.minus(ERROR_WINDOW));
      if (errors.isEmpty()) {
        return DEFAULT_ERROR_RATE;
      }
      return Math.min(100.0, errors.stream().mapToDouble(MetricPoint::value).sum());
    } catch (final RuntimeException e) {
      LOGGER.warn("Failed to read error counts, using {}", DEFAULT_ERROR_RATE, e);
      return DEFAULT_ERROR_RATE;
    }
  }

  private double throughput(final Instant now) {
    try {
      return store
          .getMetrics(MetricPoint.REQUESTS_PER_SECOND, null, now.minus(THROUGHPUT_WINDOW))
          .stream()
          .mapToDouble(MetricPoint::value)
          .average()
          .orElse(DEFAULT_THROUGHPUT);
    } catch (final RuntimeException e) {
      LOGGER.warn("Failed to read throughput, using {}", DEFAULT_THROUGHPUT, e);
      return DEFAULT_THROUGHPUT;
    }
  }

  private int activeConnections() {
    try {
      return store.getTotalConnections();
    } catch (final RuntimeException e) {
      LOGGER.warn("Failed to read open connections", e);
      return 0;
    }
  }
}
