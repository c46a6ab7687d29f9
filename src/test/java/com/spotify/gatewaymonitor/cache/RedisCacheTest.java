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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

public class RedisCacheTest {

  private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);

  @SuppressWarnings("unchecked")
  private final ValueOperations<String, String> values = mock(ValueOperations.class);

  private RedisCache cache;

  @Before
  public void setUp() {
    when(redisTemplate.opsForValue()).thenReturn(values);
    cache = new RedisCache(redisTemplate, new ObjectMapper());
  }

  @Test
  public void setStoresJsonUnderPrefixWithTtl() {
    cache.set("summary", ImmutableMap.of("score", 85), Duration.ofMinutes(5));
    verify(values).set("gateway_monitor:summary", "{\"score\":85}", Duration.ofMinutes(5));
  }

  @Test
  @SuppressWarnings("rawtypes")
  public void getReadsJson() {
    when(values.get("gateway_monitor:summary")).thenReturn("{\"score\":85}");

    final Optional<Map> value = cache.get("summary", Map.class);

    assertThat((Integer) value.get().get("score"), equalTo(85));
    assertThat(cache.stats().hits(), equalTo(1L));
  }

  @Test
  public void connectionFailureIsAMiss() {
    when(values.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

    assertThat(cache.get("summary", String.class), equalTo(Optional.empty()));
    assertThat(cache.stats().misses(), equalTo(1L));
  }

  @Test
  public void clearRemovesPrefixedKeys() {
    when(redisTemplate.keys("gateway_monitor:*"))
        .thenReturn(ImmutableSet.of("gateway_monitor:a", "gateway_monitor:b"));
    when(redisTemplate.delete(ImmutableSet.of("gateway_monitor:a", "gateway_monitor:b")))
        .thenReturn(2L);

    assertThat(cache.clear(), equalTo(2L));
  }
}
