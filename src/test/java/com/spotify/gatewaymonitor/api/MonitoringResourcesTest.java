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
import static org.mockito.Mockito.when;
import static org.mockito.MockitoAnnotations.initMocks;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;
import com.spotify.gatewaymonitor.MonitoringService;
import com.spotify.gatewaymonitor.TimeSupplier;
import com.spotify.gatewaymonitor.alert.AlertEngine;
import com.spotify.gatewaymonitor.alert.LoggingNotifier;
import com.spotify.gatewaymonitor.cache.Cache;
import com.spotify.gatewaymonitor.db.InMemoryMetricStore;
import com.spotify.gatewaymonitor.di.HttpServerModule;
import com.spotify.gatewaymonitor.health.HealthSampler;
import com.spotify.gatewaymonitor.health.HostProbe;
import com.spotify.gatewaymonitor.incident.IncidentService;
import com.spotify.gatewaymonitor.metric.MonitorMetrics;
import com.spotify.gatewaymonitor.scaling.ScalingAdvisor;
import com.spotify.gatewaymonitor.score.ScoreAggregator;
import com.spotify.gatewaymonitor.threshold.ThresholdConfigService;
import com.spotify.metrics.core.SemanticMetricRegistry;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import javax.ws.rs.client.Entity;
import javax.ws.rs.core.Application;
import javax.ws.rs.core.Response;
import org.glassfish.jersey.test.JerseyTest;
import org.junit.Test;
import org.mockito.Mock;

public class MonitoringResourcesTest extends JerseyTest implements ApiTestResources {

  private static final String ORG = "org-1";

  @Mock private HostProbe probe;

  @Override
  protected Application configure() {
    initMocks(this);
    final TimeSupplier timeSupplier = new TimeSupplier(Instant.parse("2024-03-01T12:00:00Z"));
    when(probe.cpuUsage()).thenReturn(20.0);
    when(probe.memoryUsage()).thenReturn(30.0);
    when(probe.diskUsage()).thenReturn(40.0);
    when(probe.networkLatency()).thenReturn(5.0);

    final InMemoryMetricStore store = new InMemoryMetricStore();
    final MonitorMetrics metrics = new MonitorMetrics(new SemanticMetricRegistry());
    final ThresholdConfigService thresholds = new ThresholdConfigService(store, timeSupplier);
    final AlertEngine alertEngine =
        new AlertEngine(store, new LoggingNotifier(), metrics, timeSupplier);
    final HealthSampler sampler =
        new HealthSampler(store, probe, alertEngine, thresholds, metrics, timeSupplier);
    final IncidentService incidents = new IncidentService(store, timeSupplier);
    final ScalingAdvisor advisor = new ScalingAdvisor(10, metrics, timeSupplier);
    final MonitoringService monitoringService =
        new MonitoringService(
            store, sampler, probe, alertEngine, thresholds, advisor, incidents, timeSupplier);
    final ScoreAggregator scoreAggregator =
        new ScoreAggregator(
            store, mock(Cache.class), thresholds, Duration.ofMinutes(5), timeSupplier);

    return new HttpServerModule()
        .resourceConfig(
            ConfigFactory.load(ApiTestResources.SERVICE_NAME),
            ImmutableSet.of(
                new MonitoringResources(monitoringService, scoreAggregator, incidents, MAPPER)));
  }

  @Test
  public void recordMetric() throws IOException {
    final Response response =
        target(MONITORING + "/metrics")
            .queryParam("metricName", "latency")
            .queryParam("value", "12.5")
            .queryParam("unit", "ms")
            .queryParam("organizationId", ORG)
            .queryParam("metricType", "histogram")
            .request()
            .post(Entity.text(""));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.OK));

    final JsonNode point = json(response);
    assertThat(point.get("metricName").asText(), equalTo("latency"));
    assertThat(point.get("value").asDouble(), equalTo(12.5));
    assertThat(point.get("metricType").asText(), equalTo("histogram"));
    assertThat(point.get("organizationId").asText(), equalTo(ORG));

    final JsonNode listed =
        json(
            target(MONITORING + "/metrics")
                .queryParam("organizationId", ORG)
                .queryParam("metricName", "latency")
                .request()
                .get());
    assertThat(listed.size(), equalTo(1));
  }

  @Test
  public void recordMetricWithUnknownTypeIsBadRequest() throws IOException {
    final Response response =
        target(MONITORING + "/metrics")
            .queryParam("metricName", "latency")
            .queryParam("value", "12.5")
            .queryParam("unit", "ms")
            .queryParam("metricType", "summary")
            .request()
            .post(Entity.text(""));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
    assertThat(json(response).get("error").asText(), equalTo("invalid_field"));
  }

  @Test
  public void recordMetricWithNonNumericValueIsBadRequest() {
    final Response response =
        target(MONITORING + "/metrics")
            .queryParam("metricName", "latency")
            .queryParam("value", "fast")
            .queryParam("unit", "ms")
            .request()
            .post(Entity.text(""));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void listMetricsOutsideWindowIsBadRequest() {
    final Response response =
        target(MONITORING + "/metrics").queryParam("hours", "169").request().get();
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void resolveUnknownAlertIsNotFound() throws IOException {
    final Response response =
        target(MONITORING + "/alerts/missing/resolve")
            .queryParam("organizationId", ORG)
            .request()
            .post(Entity.text(""));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.NOT_FOUND));
    assertThat(json(response).get("error").asText(), equalTo("not_found"));
  }

  @Test
  public void listAlertsWithUnknownSeverityIsBadRequest() {
    final Response response =
        target(MONITORING + "/alerts").queryParam("severity", "fatal").request().get();
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void updateThresholdConfig() throws IOException {
    final Response put =
        target(MONITORING + "/config")
            .queryParam("organizationId", ORG)
            .request()
            .put(Entity.json("{\"cpu_warning_threshold\": 65, \"slack_notifications\": true}"));
    assertThat(put.getStatusInfo(), equalTo(Response.Status.OK));

    final JsonNode config =
        json(target(MONITORING + "/config").queryParam("organizationId", ORG).request().get());
    assertThat(config.get("configKey").asText(), equalTo(ORG));
    assertThat(config.get("cpuWarning").asDouble(), equalTo(65.0));
    assertThat(config.get("slackNotifications").asBoolean(), equalTo(true));
  }

  @Test
  public void updateThresholdConfigWithMalformedBodyIsBadRequest() {
    final Response response =
        target(MONITORING + "/config").request().put(Entity.json("{\"cpu_warning_threshold\":"));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void collectHealthFeedsDashboard() throws IOException {
    final Response collected =
        target(MONITORING + "/health/collect")
            .queryParam("organizationId", ORG)
            .request()
            .post(Entity.text(""));
    assertThat(collected.getStatusInfo(), equalTo(Response.Status.OK));
    final String status = json(collected).get("status").asText();

    final JsonNode dashboard =
        json(
            target(MONITORING + "/health/dashboard")
                .queryParam("organizationId", ORG)
                .request()
                .get());
    assertThat(dashboard.get("status").asText(), equalTo(status));
    assertThat(dashboard.get("currentHealth").get("cpuUsage").asDouble(), equalTo(20.0));
  }

  @Test
  public void dashboardBeforeFirstCollectionIsUnknown() throws IOException {
    final JsonNode dashboard = json(target(MONITORING + "/health/dashboard").request().get());
    assertThat(dashboard.get("status").asText(), equalTo("unknown"));
  }

  @Test
  public void incidentLifecycle() throws IOException {
    final Response created =
        target(MONITORING + "/incidents")
            .queryParam("organizationId", ORG)
            .request()
            .post(
                Entity.json(
                    "{\"incident_type\": \"outage\", \"severity\": \"high\","
                        + " \"title\": \"Gateway down\", \"description\": \"503s everywhere\","
                        + " \"priority\": \"urgent\", \"impact_level\": \"severe\","
                        + " \"affected_services\": [\"chat\"]}"));
    assertThat(created.getStatusInfo(), equalTo(Response.Status.OK));
    final JsonNode incident = json(created);
    assertThat(incident.get("status").asText(), equalTo("open"));

    final Response resolved =
        target(MONITORING + "/incidents/" + incident.get("id").asText() + "/status")
            .queryParam("organizationId", ORG)
            .queryParam("status", "resolved")
            .queryParam("actorId", "ops-1")
            .queryParam("resolution", "restarted")
            .request()
            .put(Entity.text(""));
    assertThat(resolved.getStatusInfo(), equalTo(Response.Status.OK));
    final JsonNode updated = json(resolved);
    assertThat(updated.get("status").asText(), equalTo("resolved"));
    assertThat(updated.get("resolvedBy").asText(), equalTo("ops-1"));
    assertThat(updated.get("resolution").asText(), equalTo("restarted"));

    final Response reopened =
        target(MONITORING + "/incidents/" + incident.get("id").asText() + "/status")
            .queryParam("organizationId", ORG)
            .queryParam("status", "open")
            .request()
            .put(Entity.text(""));
    assertThat(reopened.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void createIncidentWithoutTitleIsBadRequest() {
    final Response response =
        target(MONITORING + "/incidents")
            .request()
            .post(
                Entity.json(
                    "{\"incident_type\": \"outage\", \"severity\": \"high\","
                        + " \"description\": \"d\", \"priority\": \"urgent\","
                        + " \"impact_level\": \"severe\"}"));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }

  @Test
  public void evaluateSlaWithUnknownPeriodIsBadRequest() {
    final Response response =
        target(MONITORING + "/sla").queryParam("period", "yearly").request().post(Entity.text(""));
    assertThat(response.getStatusInfo(), equalTo(Response.Status.BAD_REQUEST));
  }
}
