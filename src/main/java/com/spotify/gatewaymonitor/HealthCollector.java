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

import com.google.common.collect.ImmutableList;
import com.spotify.gatewaymonitor.metric.MonitorMetrics;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic health collection. Each configured organization is sampled in parallel on a bounded
 * pool; with no organizations configured a single gateway-wide sample is taken.
 */
public class HealthCollector implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(HealthCollector.class);

  private final ExecutorService executorService;
  private final MonitoringService monitoringService;
  private final MonitorMetrics metrics;
  private final List<String> organizations;
  private final Duration cycleTimeout;

  public HealthCollector(
      final ExecutorService executorService,
      final MonitoringService monitoringService,
      final MonitorMetrics metrics,
      final List<String> organizations,
      final Duration cycleTimeout) {
    this.executorService = checkNotNull(executorService);
    this.monitoringService = checkNotNull(monitoringService);
    this.metrics = checkNotNull(metrics);
    this.organizations =
        organizations.isEmpty()
            ? Collections.<String>singletonList(null)
            : ImmutableList.copyOf(organizations);
    this.cycleTimeout = checkNotNull(cycleTimeout);
  }

  @Override
  public void run() {
    try {
      collect();
    } catch (final Exception e) {
      LOGGER.error("Unexpected Exception.", e);
    }
  }

  void collect() {
    final Instant start = Instant.now();
    LOGGER.info("Starting health collection for {} organization(s).", organizations.size());
    metrics.markCollectionHeartBeat();

    final List<CompletableFuture<Void>> futures = new ArrayList<>();
    for (final String organizationId : organizations) {
      futures.add(
          CompletableFuture.runAsync(() -> collectFor(organizationId), executorService));
    }
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
          .get(cycleTimeout.toMillis(), TimeUnit.MILLISECONDS);
      LOGGER.info("Completed health collection in {} seconds.", getElapsedSeconds(start));
    } catch (final TimeoutException e) {
      LOGGER.error(
          "Health collection timed out after " + getElapsedSeconds(start) + " seconds", e);
    } catch (final ExecutionException e) {
      LOGGER.error("Health collection failed.", e);
    } catch (final InterruptedException e) {
      LOGGER.error("Health collection was interrupted.", e);
      Thread.currentThread().interrupt();
    }
  }

  private float getElapsedSeconds(final Instant start) {
    return Duration.between(start, Instant.now()).toMillis() / 1000.0f;
  }

  private void collectFor(final String organizationId) {
    try {
      monitoringService.collectHealth(organizationId);
    } catch (final Exception e) {
      metrics.markCollectionFailure();
      LOGGER.error("Failed to collect health for organization {}", organizationId, e);
    }
  }

  public void close() {
    executorService.shutdown();
  }
}
