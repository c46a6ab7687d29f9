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

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap cache. Expired entries are dropped when read and by a periodic sweep, so stale values are
 * never returned even between sweeps.
 */
public class InMemoryCache implements Cache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryCache.class);

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final Supplier<Instant> timeSupplier;
  private final ScheduledExecutorService sweeper;

  public InMemoryCache(final Duration sweepInterval) {
    this(Instant::now);
    sweeper.scheduleAtFixedRate(
        () -> {
          try {
            final int removed = sweep();
            if (removed > 0) {
              LOGGER.debug("Swept {} expired cache entries", removed);
            }
          } catch (final Throwable t) {
            LOGGER.error("Cache sweep failed", t);
          }
        },
        sweepInterval.toMillis(),
        sweepInterval.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  @VisibleForTesting
  InMemoryCache(final Supplier<Instant> timeSupplier) {
    this.timeSupplier = timeSupplier;
    this.sweeper = new ScheduledThreadPoolExecutor(1, r -> new Thread(r, "Cache-Sweeper"));
  }

  @Override
  public <T> Optional<T> get(final String key, final Class<T> type) {
    final Entry entry = entries.get(key);
    if (entry == null || entry.isExpired(timeSupplier.get())) {
      if (entry != null) {
        entries.remove(key, entry);
      }
      misses.incrementAndGet();
      return Optional.empty();
    }
    if (!type.isInstance(entry.value)) {
      misses.incrementAndGet();
      return Optional.empty();
    }
    hits.incrementAndGet();
    return Optional.of(type.cast(entry.value));
  }

  @Override
  public void set(final String key, final Object value, final Duration ttl) {
    entries.put(key, new Entry(value, timeSupplier.get().plus(ttl)));
  }

  @Override
  public boolean delete(final String key) {
    return entries.remove(key) != null;
  }

  @Override
  public long clear() {
    final long size = entries.size();
    entries.clear();
    return size;
  }

  @Override
  public CacheStats stats() {
    final long h = hits.get();
    final long m = misses.get();
    return new CacheStatsBuilder()
        .backend("memory")
        .totalKeys(entries.size())
        .hits(h)
        .misses(m)
        .hitRate(Cache.hitRate(h, m))
        .build();
  }

  @VisibleForTesting
  int sweep() {
    final Instant now = timeSupplier.get();
    final int before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(now));
    return before - entries.size();
  }

  @Override
  public void close() {
    sweeper.shutdownNow();
  }

  private static final class Entry {
    private final Object value;
    private final Instant expiresAt;

    private Entry(final Object value, final Instant expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }

    private boolean isExpired(final Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
