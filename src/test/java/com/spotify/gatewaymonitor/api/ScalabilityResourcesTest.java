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
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;
import com.spotify.gatewaymonitor.MonitoringService;
import com.spotify.gatewaymonitor.TimeSupplier;
import com.spotify.gatewaymonitor.alert.AlertEngine;
import com.spotify.gatewaymonitor.alert.LoggingNotifier;
import com.spotify.gatewaymonitor.db.InMemoryMetricStore;
import com.spotify.gatewaymonitor.di.HttpServerModule;
import com.spotify.gatewaymonitor.health.HealthSampler;
import com.spotify.gatewaymonitor.health.HostProbe;
import com.spotify.gatewaymonitor.incident.IncidentService;
import com.spotify.gatewaymonitor.metric.MonitorMetrics;
import com.spotify.gatewaymonitor.scaling.ScalingAdvisor;
import com.spotify.gatewaymonitor.threshold.ThresholdConfigService;
import com.spotify.metrics.core.SemanticMetricRegistry;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.time.Instant;
import javax.ws.rs.client.Entity;
import javax.ws.rs.core.Application;
import javax.ws.rs.core.Response;
import org.glassfish.jersey.test.JerseyTest;
import org.junit.Test;

public class ScalabilityResourcesTest extends JerseyTest implements ApiTestResources {

  private static final int MAX_INSTANCES = 4;

  @Override
  protected Application configure() {
    final TimeSupplier timeSupplier = new TimeSupplier(Instant.parse("2024-03-01T12:00:00Z"));
    final InMemoryMetricStore store = new InMemoryMetricStore();
    final HostProbe probe = mock(HostProbe.class);
    final MonitorMetrics metrics = new MonitorMetrics(new SemanticMetricRegistry());
    final ThresholdConfigService thresholds = new ThresholdConfigService(store, timeSupplier);
    final AlertEngine alertEngine =
        new AlertEngine(store, new LoggingNotifier(), metrics, timeSupplier);
    final ScalingAdvisor advisor = new ScalingAdvisor(MAX_INSTANCES, metrics, timeSupplier);
    final MonitoringService monitoringService =
        new MonitoringService(
            store,
            new HealthSampler(store, probe, alertEngine, thresholds, metrics, timeSupplier),
            probe,
            alertEngine,
            thresholds,
            advisor,
            new IncidentService(store, timeSupplier),
            timeSupplier);
    return new HttpServerModule()
        .resourceConfig(
            ConfigFactory.load(ApiTestResources.SERVICE_NAME),
            ImmutableSet.of(new ScalabilityResources(monitoringService, advisor, MAPPER)));
  }

  @Test
  public void analyzeBeforeAnySnapshot() throws IOException {
    final Response response = target(SCALABILITY + "/analyze").request().get();
    assertThat(response.getStatusInfo(), equalTo(Response.Status.OK));
    final JsonNode analysis = json(response);
    assertThat(analysis.get("currentInstances").asInt(), equalTo(1));
    assertThat(analysis.get("maxInstances").asInt(), equalTo(MAX_INSTANCES));
    assertThat(analysis.get("autoScalingEnabled").asBoolean(), equalTo(true));
  }

  @Test
  public void simulateScaleUpIsCappedAtMax() throws IOException {
    final JsonNode result =
        json(
            target(SCALABILITY + "/simulate")
                .queryParam("eventType", "scale_up")
                .queryParam("instances", "10")
                .request()
                .post(Entity.text("")));
    assertThat(result.get("currentInstances").asInt(), equalTo(MAX_INSTANCES));
    assertThat(result.get("event").get("eventType").asText(), equalTo("scale_up"));

    final JsonNode balancer = json(target(SCALABILITY + "/load-balancer").request().get());
    assertThat(balancer.get("activeInstances").asInt(), equalTo(MAX_INSTANCES));
    assertThat(
        balancer.get("trafficDistribution").get("instance_1").asDouble(),
        equalTo(100.0 / MAX_INSTANCES));
  }

  @Test
  public void simulateNegativeInstancesIsBadRequest() {
    final Response response =
        target(SCALABILITY + "/simulate")
            .queryParam("eventType", "scale_up")
            .queryParam("instances", "-1")
            .request()
            .post(Entity.text(""));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void toggleAutoScaling() throws IOException {
    final JsonNode toggled =
        json(
            target(SCALABILITY + "/auto-scaling")
                .queryParam("enabled", "false")
                .request()
                .post(Entity.text("")));
    assertThat(toggled.get("autoScalingEnabled").asBoolean(), equalTo(false));

    final JsonNode config = json(target(SCALABILITY + "/config").request().get());
    assertThat(config.get("autoScalingEnabled").asBoolean(), equalTo(false));
  }

  @Test
  public void setThresholdsKeepsUnknownKeysOut() throws IOException {
    final JsonNode thresholds =
        json(
            target(SCALABILITY + "/thresholds")
                .request()
                .put(Entity.json("{\"cpu_high\": 70, \"gpu_high\": 50}")));
    assertThat(thresholds.get("cpu_high").asDouble(), equalTo(70.0));
    assertThat(thresholds.has("gpu_high"), equalTo(false));
  }

  @Test
  public void setThresholdsWithNonNumberIsBadRequest() {
    final Response response =
        target(SCALABILITY + "/thresholds").request().put(Entity.json("{\"cpu_high\": \"high\"}"));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void simulateNonNumericInstancesIsBadRequest() throws IOException {
    final Response response =
        target(SCALABILITY + "/simulate")
            .queryParam("eventType", "scale_up")
            .queryParam("instances", "many")
            .request()
            .post(Entity.text(""));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
    assertThat(json(response).get("error").asText(), equalTo("invalid_field"));
  }

  @Test
  public void databaseSharding() throws IOException {
    final Response response = target(SCALABILITY + "/database").request().get();
    assertThat(response.getStatusInfo(), equalTo(Response.Status.OK));
    final JsonNode status = json(response);
    assertThat(status.get("shardingEnabled").asBoolean(), equalTo(false));
    assertThat(status.get("shards").get(0).get("id").asText(), equalTo("shard_1"));
  }

  @Test
  public void microservices() throws IOException {
    final Response response = target(SCALABILITY + "/microservices").request().get();
    assertThat(response.getStatusInfo(), equalTo(Response.Status.OK));
    final JsonNode status = json(response);
    assertThat(status.get("architecture").asText(), equalTo("monolithic"));
    assertThat(status.get("services").size(), equalTo(4));
  }
}
