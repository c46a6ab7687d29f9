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

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Cache backed by Redis. Values are stored as JSON under a key prefix and expire natively. A Redis
 * failure degrades to a cache miss.
 */
public class RedisCache implements Cache {

  private static final Logger LOGGER = LoggerFactory.getLogger(RedisCache.class);
  static final String KEY_PREFIX = "gateway_monitor:";

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper mapper;
  private final LettuceConnectionFactory connectionFactory;
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  public RedisCache(final String host, final int port, final ObjectMapper mapper) {
    this.connectionFactory = new LettuceConnectionFactory(host, port);
    connectionFactory.afterPropertiesSet();
    this.redisTemplate = new StringRedisTemplate(connectionFactory);
    this.mapper = checkNotNull(mapper);
  }

  RedisCache(final StringRedisTemplate redisTemplate, final ObjectMapper mapper) {
    this.connectionFactory = null;
    this.redisTemplate = checkNotNull(redisTemplate);
    this.mapper = checkNotNull(mapper);
  }

  @Override
  public <T> Optional<T> get(final String key, final Class<T> type) {
    try {
      final String json = redisTemplate.opsForValue().get(KEY_PREFIX + key);
      if (json == null) {
        misses.incrementAndGet();
        return Optional.empty();
      }
      final T value = mapper.readValue(json, type);
      hits.incrementAndGet();
      return Optional.of(value);
    } catch (final DataAccessException | JsonProcessingException e) {
      LOGGER.warn("Cache read failed for {}", key, e);
      misses.incrementAndGet();
      return Optional.empty();
    }
  }

  @Override
  public void set(final String key, final Object value, final Duration ttl) {
    try {
      redisTemplate.opsForValue().set(KEY_PREFIX + key, mapper.writeValueAsString(value), ttl);
    } catch (final DataAccessException | JsonProcessingException e) {
      LOGGER.warn("Cache write failed for {}", key, e);
    }
  }

  @Override
  public boolean delete(final String key) {
    try {
      return Boolean.TRUE.equals(redisTemplate.delete(KEY_PREFIX + key));
    } catch (final DataAccessException e) {
      LOGGER.warn("Cache delete failed for {}", key, e);
      return false;
    }
  }

  @Override
  public long clear() {
    try {
      final Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
      if (keys == null || keys.isEmpty()) {
        return 0;
      }
      final Long removed = redisTemplate.delete(keys);
      return removed == null ? 0 : removed;
    } catch (final DataAccessException e) {
      LOGGER.warn("Cache clear failed", e);
      return 0;
    }
  }

  @Override
  public CacheStats stats() {
    long totalKeys = 0;
    try {
      final Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
      totalKeys = keys == null ? 0 : keys.size();
    } catch (final DataAccessException e) {
      LOGGER.warn("Failed to count cache keys", e);
    }
    final long h = hits.get();
    final long m = misses.get();
    return new CacheStatsBuilder()
        .backend("redis")
        .totalKeys(totalKeys)
        .hits(h)
        .misses(m)
        .hitRate(Cache.hitRate(h, m))
        .build();
  }

  @Override
  public void close() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }
}
