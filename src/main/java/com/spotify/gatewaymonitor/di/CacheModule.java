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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spotify.gatewaymonitor.cache.Cache;
import com.spotify.gatewaymonitor.cache.InMemoryCache;
import com.spotify.gatewaymonitor.cache.RedisCache;
import com.typesafe.config.Config;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Module
public class CacheModule {
  private static final Logger LOGGER = LoggerFactory.getLogger(CacheModule.class);

  @Provides
  @Singleton
  public static Cache cache(final Config config, final ObjectMapper mapper) {
    final Config cache = config.getConfig("cache");
    final String backend = cache.getString("backend");
    switch (backend) {
      case "redis":
        LOGGER.info(
            "Using redis cache at {}:{}", cache.getString("host"), cache.getInt("port"));
        return new RedisCache(cache.getString("host"), cache.getInt("port"), mapper);
      case "memory":
        return new InMemoryCache(cache.getDuration("sweepInterval"));
      default:
        throw new IllegalArgumentException("Unknown cache.backend " + backend);
    }
  }
}
