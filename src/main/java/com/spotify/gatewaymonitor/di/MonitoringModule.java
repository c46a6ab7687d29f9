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

package com.spotify.gatewaymonitor.di;

import com.spotify.gatewaymonitor.HealthCollector;
import com.spotify.gatewaymonitor.MonitoringService;
import com.spotify.gatewaymonitor.alert.AlertEngine;
import com.spotify.gatewaymonitor.alert.Notifier;
import com.spotify.gatewaymonitor.cache.Cache;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.health.HealthSampler;
import com.spotify.gatewaymonitor.health.HostProbe;
import com.spotify.gatewaymonitor.health.JvmHostProbe;
import com.spotify.gatewaymonitor.incident.IncidentService;
import com.spotify.gatewaymonitor.metric.MonitorMetrics;
import com.spotify.gatewaymonitor.scaling.ScalingAdvisor;
import com.spotify.gatewaymonitor.score.ScoreAggregator;
import com.spotify.gatewaymonitor.threshold.ThresholdConfigService;
import com.typesafe.config.Config;
import dagger.Module;
import dagger.Provides;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import javax.inject.Singleton;

@Module
public class MonitoringModule {
  private static final int CONCURRENCY_LIMIT = 5;

  @Provides
  @Singleton
  public static Supplier<Instant> timeSupplier() {
    return Instant::now;
  }

  @Provides
  @Singleton
  public static HostProbe hostProbe() {
    return new JvmHostProbe();
  }

  @Provides
  @Singleton
  public static ThresholdConfigService thresholdConfigService(
      final MetricStore store, final Supplier<Instant> timeSupplier) {
    return new ThresholdConfigService(store, timeSupplier);
  }

  @Provides
  @Singleton
  public static AlertEngine alertEngine(
      final MetricStore store,
      final Notifier notifier,
      final MonitorMetrics metrics,
      final Supplier<Instant> timeSupplier) {
    return new AlertEngine(store, notifier, metrics, timeSupplier);
  }

  @Provides
  @Singleton
  public static HealthSampler healthSampler(
      final MetricStore store,
      final HostProbe probe,
      final AlertEngine alertEngine,
      final ThresholdConfigService thresholds,
      final MonitorMetrics metrics,
      final Supplier<Instant> timeSupplier) {
    return new HealthSampler(store, probe, alertEngine, thresholds, metrics, timeSupplier);
  }

  @Provides
  @Singleton
  public static ScoreAggregator scoreAggregator(
      final Config config,
      final MetricStore store,
      final Cache cache,
      final ThresholdConfigService thresholds,
      final Supplier<Instant> timeSupplier) {
    return new ScoreAggregator(
        store, cache, thresholds, config.getDuration("cache.ttl"), timeSupplier);
  }

  @Provides
  @Singleton
  public static ScalingAdvisor scalingAdvisor(
      final Config config, final MonitorMetrics metrics, final Supplier<Instant> timeSupplier) {
    final ScalingAdvisor advisor =
        new ScalingAdvisor(config.getInt("scaling.maxInstances"), metrics, timeSupplier);
    metrics.registerScalingState(advisor);
    return advisor;
  }

  @Provides
  @Singleton
  public static IncidentService incidentService(
      final MetricStore store, final Supplier<Instant> timeSupplier) {
    return new IncidentService(store, timeSupplier);
  }

  @Provides
  @Singleton
  public static MonitoringService monitoringService(
      final MetricStore store,
      final HealthSampler sampler,
      final HostProbe probe,
      final AlertEngine alertEngine,
      final ThresholdConfigService thresholds,
      final ScalingAdvisor scalingAdvisor,
      final IncidentService incidents,
      final Supplier<Instant> timeSupplier) {
    return new MonitoringService(
        store, sampler, probe, alertEngine, thresholds, scalingAdvisor, incidents, timeSupplier);
  }

  @Provides
  @Singleton
  public static HealthCollector healthCollector(
      final Config config,
      final MonitoringService monitoringService,
      final MonitorMetrics metrics) {
    return new HealthCollector(
        Executors.newFixedThreadPool(CONCURRENCY_LIMIT),
        monitoringService,
        metrics,
        config.getStringList("collection.organizations"),
        config.getDuration("collection.timeout"));
  }
}
