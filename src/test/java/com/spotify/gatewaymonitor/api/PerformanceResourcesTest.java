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

package com.spotify.gatewaymonitor.api;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;
import com.spotify.gatewaymonitor.TimeSupplier;
import com.spotify.gatewaymonitor.cache.InMemoryCache;
import com.spotify.gatewaymonitor.db.InMemoryMetricStore;
import com.spotify.gatewaymonitor.db.MetricPoint;
import com.spotify.gatewaymonitor.db.MetricPointBuilder;
import com.spotify.gatewaymonitor.db.MetricType;
import com.spotify.gatewaymonitor.di.HttpServerModule;
import com.spotify.gatewaymonitor.score.ScoreAggregator;
import com.spotify.gatewaymonitor.threshold.ThresholdConfigService;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import javax.ws.rs.client.Entity;
import javax.ws.rs.core.Application;
import javax.ws.rs.core.Response;
import org.glassfish.jersey.test.JerseyTest;
import org.junit.After;
import org.junit.Test;

public class PerformanceResourcesTest extends JerseyTest implements ApiTestResources {

  // assigned in configure(), which JerseyTest calls from its constructor
  private TimeSupplier timeSupplier;
  private InMemoryMetricStore store;
  private InMemoryCache cache;

  @Override
  protected Application configure() {
    timeSupplier = new TimeSupplier(Instant.parse("2024-03-01T12:00:00Z"));
    store = new InMemoryMetricStore();
    cache = new InMemoryCache(Duration.ofMinutes(1));
    final ScoreAggregator scoreAggregator =
        new ScoreAggregator(
            store,
            cache,
            new ThresholdConfigService(store, timeSupplier),
            Duration.ofMinutes(5),
            timeSupplier);
    return new HttpServerModule()
        .resourceConfig(
            ConfigFactory.load(ApiTestResources.SERVICE_NAME),
            ImmutableSet.of(new PerformanceResources(scoreAggregator, MAPPER)));
  }

  @After
  @Override
  public void tearDown() throws Exception {
    cache.close();
    super.tearDown();
  }

  @Test
  public void summaryIsComputedThenCached() throws IOException {
    responseTime(50);
    responseTime(150);

    final JsonNode summary = json(target(PERFORMANCE + "/summary").request().get());
    assertThat(summary.get("totalRequests").asLong(), equalTo(2L));
    assertThat(summary.get("avgResponseTime").asDouble(), equalTo(100.0));
    assertThat(summary.get("optimizationScore").asDouble(), equalTo(85.0));

    final JsonNode stats = json(target(PERFORMANCE + "/cache/stats").request().get());
    assertThat(stats.get("backend").asText(), equalTo("memory"));
    assertThat(stats.get("totalKeys").asLong(), equalTo(1L));

    final JsonNode cleared =
        json(target(PERFORMANCE + "/cache/clear").request().post(Entity.text("")));
    assertThat(cleared.get("cleared").asLong(), equalTo(1L));
  }

  @Test
  public void summaryWithoutDataScoresNeutral() throws IOException {
    final JsonNode summary = json(target(PERFORMANCE + "/summary").request().get());
    assertThat(summary.get("totalRequests").asLong(), equalTo(0L));
    assertThat(summary.get("avgResponseTime").asDouble(), equalTo(0.0));
  }

  @Test
  public void summaryRejectsEmptyWindow() {
    final Response response =
        target(PERFORMANCE + "/summary").queryParam("hours", "0").request().get();
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void responseTimeReport() throws IOException {
    responseTime(2500);
    final Response response = target(PERFORMANCE + "/response-times").request().get();
    assertThat(response.getStatusInfo(), equalTo(Response.Status.OK));
    final JsonNode report = json(response);
    assertThat(report.get("needsOptimization").asBoolean(), equalTo(true));
    assertThat(report.get("recommendations").size(), equalTo(3));
  }

  private void responseTime(final double value) {
    store.insertMetric(
        new MetricPointBuilder()
            .id(UUID.randomUUID().toString())
            .metricName(MetricPoint.API_RESPONSE_TIME)
            .metricType(MetricType.HISTOGRAM)
            .value(value)
            .unit("ms")
            .recordedAt(timeSupplier.get().minus(Duration.ofMinutes(10)))
            .build());
  }
}
