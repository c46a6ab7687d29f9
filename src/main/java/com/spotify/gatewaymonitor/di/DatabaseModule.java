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

import com.spotify.gatewaymonitor.db.InMemoryMetricStore;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.db.PostgresMetricStore;
import com.typesafe.config.Config;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Module
public class DatabaseModule {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseModule.class);

  @Provides
  @Singleton
  public static MetricStore metricStore(final Config config) {
    final Config database = config.getConfig("database");
    final String store = database.getString("store");
    switch (store) {
      case "postgres":
        LOGGER.info("Using PostgreSQL metric store at {}", database.getString("jdbcUrl"));
        return new PostgresMetricStore(database);
      case "memory":
        LOGGER.warn("Using in-memory metric store, data is lost on restart");
        return new InMemoryMetricStore();
      default:
        throw new IllegalArgumentException("Unknown database.store " + store);
    }
  }
}
