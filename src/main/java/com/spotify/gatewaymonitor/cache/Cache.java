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

package com.spotify.gatewaymonitor.cache;

import java.time.Duration;
import java.util.Optional;

/** Key/value store with per-entry expiry. Backends are chosen at construction time. */
public interface Cache extends AutoCloseable {

  <T> Optional<T> get(String key, Class<T> type);

  void set(String key, Object value, Duration ttl);

  boolean delete(String key);

  /** Drops every entry owned by this cache and returns how many were removed. */
  long clear();

  CacheStats stats();

  @Override
  void close();

  static double hitRate(final long hits, final long misses) {
    final long lookups = hits + misses;
    return lookups == 0 ? 0.0 : hits * 100.0 / lookups;
  }
}
