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
import static org.hamcrest.Matchers.is;

import com.spotify.gatewaymonitor.TimeSupplier;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.After;
import org.junit.Test;

public class InMemoryCacheTest {

  private final TimeSupplier timeSupplier =
      new TimeSupplier(Instant.parse("2024-03-01T12:00:00Z"));
  private final InMemoryCache cache = new InMemoryCache(timeSupplier);

  @After
  public void tearDown() {
    cache.close();
  }

  @Test
  public void getReturnsStoredValue() {
    cache.set("k", "v", Duration.ofMinutes(1));
    assertThat(cache.get("k", String.class), equalTo(Optional.of("v")));
  }

  @Test
  public void expiredEntryIsAMiss() {
    cache.set("k", "v", Duration.ofMinutes(1));
    timeSupplier.advance(Duration.ofMinutes(1));

    assertThat(cache.get("k", String.class), equalTo(Optional.empty()));
    assertThat(cache.stats().totalKeys(), equalTo(0L));
  }

  @Test
  public void wrongTypeIsAMiss() {
    cache.set("k", "v", Duration.ofMinutes(1));
    assertThat(cache.get("k", Integer.class), equalTo(Optional.empty()));
    assertThat(cache.stats().misses(), equalTo(1L));
  }

  @Test
  public void sweepDropsOnlyExpiredEntries() {
    cache.set("short", 1, Duration.ofSeconds(10));
    cache.set("long", 2, Duration.ofMinutes(10));
    timeSupplier.advance(Duration.ofMinutes(1));

    assertThat(cache.sweep(), equalTo(1));
    assertThat(cache.get("long", Integer.class), equalTo(Optional.of(2)));
  }

  @Test
  public void statsTrackHitRate() {
    cache.set("k", "v", Duration.ofMinutes(1));
    cache.get("k", String.class);
    cache.get("k", String.class);
    cache.get("k", String.class);
    cache.get("missing", String.class);

    final CacheStats stats = cache.stats();
    assertThat(stats.backend(), equalTo("memory"));
    assertThat(stats.hits(), equalTo(3L));
    assertThat(stats.misses(), equalTo(1L));
    assertThat(stats.hitRate(), equalTo(75.0));
  }

  @Test
  public void emptyStatsHaveZeroHitRate() {
    assertThat(cache.stats().hitRate(), equalTo(0.0));
  }

  @Test
  public void deleteAndClear() {
    cache.set("a", 1, Duration.ofMinutes(1));
    cache.set("b", 2, Duration.ofMinutes(1));
    cache.set("c", 3, Duration.ofMinutes(1));

    assertThat(cache.delete("a"), is(true));
    assertThat(cache.delete("a"), is(false));
    assertThat(cache.clear(), equalTo(2L));
    assertThat(cache.get("b", Integer.class), equalTo(Optional.empty()));
  }
}
