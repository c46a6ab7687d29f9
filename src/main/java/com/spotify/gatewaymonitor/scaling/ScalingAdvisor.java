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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.spotify.gatewaymonitor.metric.MonitorMetrics;
import com.spotify.gatewaymonitor.util.MonitoringException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the advisory instance count and recommends scaling it up or down. Nothing here acts on real
 * infrastructure; scaling events only move the simulated instance count.
 *
 * <p>One advisor exists per deployment. Every method is synchronized on it.
 */
public class ScalingAdvisor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScalingAdvisor.class);

  static final int HISTORY_VIEW = 10;
  static final double LOW_UTILIZATION = 30.0;
  static final double LOW_RESPONSE_TIME = 200.0;
  static final int SHARD_CONNECTIONS = 50;

  private final int maxInstances;
  private final MonitorMetrics metrics;
  private final Supplier<Instant> timeSupplier;
  private final Map<ScalingThreshold, Double> thresholds = new EnumMap<>(ScalingThreshold.class);
  private final List<ScalingEvent> history = new ArrayList<>();
  private int currentInstances = 1;
  private boolean autoScalingEnabled = true;

  public ScalingAdvisor(
      final int maxInstances, final MonitorMetrics metrics, final Supplier<Instant> timeSupplier) {
    checkArgument(maxInstances >= 1, "maxInstances must be at least 1");
    this.maxInstances = maxInstances;
    this.metrics = checkNotNull(metrics);
    this.timeSupplier = checkNotNull(timeSupplier);
    for (final ScalingThreshold threshold : ScalingThreshold.values()) {
      thresholds.put(threshold, threshold.defaultValue());
    }
  }

  public synchronized List<ScalingRecommendation> analyze(final ScalingMetrics current) {
    final List<ScalingRecommendation> recommendations = new ArrayList<>();
    scaleUp(
            "CPU usage",
            current.cpuUsage(),
            ScalingThreshold.CPU_HIGH,
            ScalingThreshold.CPU_CRITICAL)
        .ifPresent(recommendations::add);
    scaleUp(
            "Memory usage",
            current.memoryUsage(),
            ScalingThreshold.MEMORY_HIGH,
            ScalingThreshold.MEMORY_CRITICAL)
        .ifPresent(recommendations::add);
    scaleUp(
            "Response time",
            current.responseTime(),
            ScalingThreshold.RESPONSE_TIME_HIGH,
            ScalingThreshold.RESPONSE_TIME_CRITICAL)
        .ifPresent(recommendations::add);

    if (current.cpuUsage() < LOW_UTILIZATION
        && current.memoryUsage() < LOW_UTILIZATION
        && current.responseTime() < LOW_RESPONSE_TIME
        && currentInstances > 1) {
      recommendations.add(
          new ScalingRecommendationBuilder()
              .type(ScalingRecommendation.SCALE_DOWN)
              .priority("medium")
              .reason(
                  String.format(
                      "Low resource usage (CPU: %s%%, Memory: %s%%)",
                      current.cpuUsage(), current.memoryUsage()))
              .currentValue(Math.max(current.cpuUsage(), current.memoryUsage()))
              .threshold(LOW_UTILIZATION)
              .action("Scale down - remove one instance")
              .estimatedInstances(Math.max(currentInstances - 1, 1))
              .build());
    }
    return recommendations;
  }

  private Optional<ScalingRecommendation> scaleUp(
      final String subject,
      final double value,
      final ScalingThreshold high,
      final ScalingThreshold critical) {
    if (value > thresholds.get(critical)) {
      return Optional.of(
          new ScalingRecommendationBuilder()
              .type(ScalingRecommendation.SCALE_UP)
              .priority("critical")
              .reason(subject + " critical")
              .currentValue(value)
              .threshold(thresholds.get(critical))
              .action("Scale up immediately - add more instances")
              .estimatedInstances(Math.min(currentInstances + 2, maxInstances))
              .build());
    }
    if (value > thresholds.get(high)) {
      return Optional.of(
          new ScalingRecommendationBuilder()
              .type(ScalingRecommendation.SCALE_UP)
              .priority("high")
              .reason(subject + " high")
              .currentValue(value)
              .threshold(thresholds.get(high))
              .action("Scale up - add one more instance")
              .estimatedInstances(Math.min(currentInstances + 1, maxInstances))
              .build());
    }
    return Optional.empty();
  }

  /**
   * Updates the recognized threshold keys and ignores the rest. Nothing is applied unless every
   * recognized key carries a number.
   */
  public synchronized Map<String, Double> setThresholds(final Map<String, ?> updates) {
    final Map<ScalingThreshold, Double> validated = new EnumMap<>(ScalingThreshold.class);
    for (final Map.Entry<String, ?> entry : updates.entrySet()) {
      final Optional<ScalingThreshold> threshold = ScalingThreshold.fromKey(entry.getKey());
      if (!threshold.isPresent()) {
        LOGGER.debug("Ignoring unknown scaling threshold {}", entry.getKey());
        continue;
      }
      if (!(entry.getValue() instanceof Number)) {
        throw MonitoringException.invalidField(entry.getKey(), "expected a number");
      }
      validated.put(threshold.get(), ((Number) entry.getValue()).doubleValue());
    }
    thresholds.putAll(validated);
    return thresholds();
  }

  public synchronized Map<String, Double> thresholds() {
    final Map<String, Double> view = new LinkedHashMap<>();
    thresholds.forEach((threshold, value) -> view.put(threshold.key(), value));
    return view;
  }

  /**
   * Moves the simulated instance count. {@code scale_up} is capped at the maximum, {@code
   * scale_down} floored at one, and any other type is recorded without changing the count.
   */
  public synchronized ScalingEvent simulateScalingEvent(
      final String eventType, final int instances) {
    if (instances < 0) {
      throw MonitoringException.invalidField("instances", "must not be negative");
    }
    if (ScalingRecommendation.SCALE_UP.equals(eventType)) {
      currentInstances = Math.min(currentInstances + instances, maxInstances);
    } else if (ScalingRecommendation.SCALE_DOWN.equals(eventType)) {
      currentInstances = Math.max(currentInstances - instances, 1);
    } else {
      LOGGER.info("Recording scaling event of unknown type {}", eventType);
    }
    final ScalingEvent event =
        new ScalingEventBuilder()
            .eventType(String.valueOf(eventType))
            .instances(instances)
            .newTotal(currentInstances)
            .timestamp(timeSupplier.get())
            .build();
    history.add(event);
    metrics.markScalingEvent(event.eventType());
    LOGGER.info("Scaling event {}: now {} instance(s)", event.eventType(), currentInstances);
    return event;
  }

  public synchronized boolean toggleAutoScaling(final boolean enabled) {
    autoScalingEnabled = enabled;
    LOGGER.info("Auto-scaling {}", enabled ? "enabled" : "disabled");
    return autoScalingEnabled;
  }

  public synchronized ScalingConfiguration configuration() {
    return new ScalingConfigurationBuilder()
        .autoScalingEnabled(autoScalingEnabled)
        .currentInstances(currentInstances)
        .maxInstances(maxInstances)
        .scalingThresholds(thresholds())
        .scalingHistory(recentHistory())
        .build();
  }

  public synchronized List<ScalingEvent> recentHistory() {
    return ImmutableList.copyOf(
        history.subList(Math.max(0, history.size() - HISTORY_VIEW), history.size()));
  }

  public synchronized LoadBalancerStatus loadBalancerStatus() {
    final Map<String, String> healthChecks = new LinkedHashMap<>();
    final Map<String, Double> traffic = new LinkedHashMap<>();
    final double share = 100.0 / currentInstances;
    for (int i = 1; i <= maxInstances; i++) {
      final boolean active = i <= currentInstances;
      healthChecks.put("instance_" + i, active ? "healthy" : "not_active");
      traffic.put("instance_" + i, active ? share : 0.0);
    }
    return new LoadBalancerStatusBuilder()
        .status("healthy")
        .activeInstances(currentInstances)
        .healthChecks(healthChecks)
        .trafficDistribution(traffic)
        .lastUpdated(timeSupplier.get())
        .build();
  }

  /** One shard holding all load; replication stays off in this deployment. */
  public synchronized ShardingStatus shardingStatus() {
    return new ShardingStatusBuilder()
        .shardingEnabled(false)
        .shards(
            ImmutableList.of(
                new DatabaseShardBuilder()
                    .id("shard_1")
                    .status("active")
                    .connections(SHARD_CONNECTIONS)
                    .loadPercentage(100.0)
                    .build()))
        .replicationEnabled(false)
        .replicas(0)
        .backupStatus("healthy")
        .lastBackup(timeSupplier.get())
        .build();
  }

  /** The gateway runs as a monolith; the api gateway entry follows the simulated instances. */
  public synchronized MicroservicesStatus microservicesStatus() {
    return new MicroservicesStatusBuilder()
        .architecture("monolithic")
        .services(
            ImmutableList.of(
                service("api_gateway", currentInstances, 50),
                service("auth_service", 1, 30),
                service("llm_service", 1, 200),
                service("monitoring_service", 1, 20)))
        .serviceMesh("not_implemented")
        .containerOrchestration("not_implemented")
        .build();
  }

  private static GatewayService service(
      final String name, final int instances, final double responseTime) {
    return new GatewayServiceBuilder()
        .name(name)
        .status("healthy")
        .instances(instances)
        .responseTime(responseTime)
        .build();
  }

  public synchronized int currentInstances() {
    return currentInstances;
  }

  public synchronized int maxInstances() {
    return maxInstances;
  }

  public synchronized boolean isAutoScalingEnabled() {
    return autoScalingEnabled;
  }
}
