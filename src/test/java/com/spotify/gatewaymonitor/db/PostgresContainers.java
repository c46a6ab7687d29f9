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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.testcontainers.containers.PostgreSQLContainer;

final class PostgresContainers {

  private PostgresContainers() {}

  /*
  The container stops once its last connection closes, so callers only need to close the store.
  */
  static PostgresMetricStore migratedStore() {
    final PostgreSQLContainer<?> container = new PostgreSQLContainer<>("postgres:14-alpine");
    container.start();
    final Config config =
        ConfigFactory.empty()
            .withValue("jdbcUrl", ConfigValueFactory.fromAnyRef(container.getJdbcUrl()))
            .withValue("username", ConfigValueFactory.fromAnyRef(container.getUsername()))
            .withValue("password", ConfigValueFactory.fromAnyRef(container.getPassword()))
            .withValue("maxConnectionPool", ConfigValueFactory.fromAnyRef(2));

    final PostgresMetricStore store = new PostgresMetricStore(config);
    store.migrate();
    return store;
  }
}
