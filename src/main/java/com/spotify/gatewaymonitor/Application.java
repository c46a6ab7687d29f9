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

import com.spotify.gatewaymonitor.cache.Cache;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.metrics.ffwd.FastForwardReporter;
import com.typesafe.config.Config;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import org.glassfish.grizzly.http.server.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Application {
  private static final Logger LOGGER = LoggerFactory.getLogger(Application.class);
  private final ScheduledExecutorService scheduledExecutorService =
      new ScheduledThreadPoolExecutor(1);
  private final HealthCollector collector;
  private final HttpServer server;
  private final MetricStore store;
  private final Cache cache;
  private final Optional<FastForwardReporter> reporter;
  private final Duration collectionInterval;

  @Inject
  public Application(
      final HealthCollector collector,
      final HttpServer server,
      final MetricStore store,
      final Cache cache,
      final Optional<FastForwardReporter> reporter,
      final Config config) {
    this.collector = collector;
    this.server = server;
    this.store = store;
    this.cache = cache;
    this.reporter = reporter;
    this.collectionInterval = config.getDuration("collection.interval");
  }

  public void start() throws IOException {
    store.migrate();
    reporter.ifPresent(FastForwardReporter::start);
    scheduledExecutorService.scheduleWithFixedDelay(
        collector,
        collectionInterval.toMillis(),
        collectionInterval.toMillis(),
        TimeUnit.MILLISECONDS);
    server.start();
    LOGGER.info("{} started", Main.SERVICE_NAME);
    addShutdownHooks();
  }

  private void addShutdownHooks() {
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  try {
                    onShutdown();
                    LOGGER.info("services shutdown");
                  } catch (final Exception e) {
                    LOGGER.error("Exception occurred on shutdown", e);
                    throw new RuntimeException(e);
                  }
                }));
  }

  private void onShutdown() throws Exception {
    server.shutdown(10, TimeUnit.SECONDS).get();
    reporter.ifPresent(FastForwardReporter::stop);
    scheduledExecutorService.shutdown();
    scheduledExecutorService.awaitTermination(5, TimeUnit.SECONDS);
    collector.close();
    cache.close();
    store.close();
  }
}
