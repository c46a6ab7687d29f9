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

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spotify.gatewaymonitor.LoggerContext;
import com.spotify.gatewaymonitor.MonitoringService;
import com.spotify.gatewaymonitor.db.AlertSeverity;
import com.spotify.gatewaymonitor.db.AlertStatus;
import com.spotify.gatewaymonitor.db.IncidentSeverity;
import com.spotify.gatewaymonitor.db.IncidentStatus;
import com.spotify.gatewaymonitor.db.MetricType;
import com.spotify.gatewaymonitor.db.SlaPeriod;
import com.spotify.gatewaymonitor.incident.IncidentService;
import com.spotify.gatewaymonitor.score.ScoreAggregator;
import com.spotify.gatewaymonitor.util.Paging;
import javax.inject.Inject;
import javax.ws.rs.Consumes;
import javax.ws.rs.DefaultValue;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.PUT;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Path("/monitoring")
@Produces(MediaType.APPLICATION_JSON)
public class MonitoringResources implements Endpoint {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringResources.class);

  private final MonitoringService monitoringService;
  private final ScoreAggregator scoreAggregator;
  private final IncidentService incidentService;
  private final ObjectMapper mapper;

  @Inject
  public MonitoringResources(
      final MonitoringService monitoringService,
      final ScoreAggregator scoreAggregator,
      final IncidentService incidentService,
      final ObjectMapper mapper) {
    this.monitoringService = checkNotNull(monitoringService);
    this.scoreAggregator = checkNotNull(scoreAggregator);
    this.incidentService = checkNotNull(incidentService);
    this.mapper = checkNotNull(mapper);
  }

  @POST
  @Path("health/collect")
  public Response collectHealth(@QueryParam("organizationId") final String organizationId) {
    return json(monitoringService.collectHealth(organizationId));
  }

  @GET
  @Path("health/dashboard")
  public Response dashboard(@QueryParam("organizationId") final String organizationId) {
    return json(monitoringService.dashboard(organizationId));
  }

  @POST
  @Path("metrics")
  public Response recordMetric(
      @QueryParam("metricName") final String metricName,
      @QueryParam("value") final String value,
      @QueryParam("unit") final String unit,
      @QueryParam("endpoint") final String endpoint,
      @QueryParam("method") final String method,
      @QueryParam("userId") final String userId,
      @QueryParam("organizationId") final String organizationId,
      @QueryParam("metricType") final String metricType) {
    return json(
        monitoringService.recordMetric(
            metricName,
            Params.optional("value", value, Double::valueOf),
            unit,
            endpoint,
            method,
            userId,
            organizationId,
            Params.optional("metric_type", metricType, MetricType::fromValue)));
  }

  @GET
  @Path("metrics")
  public Response listMetrics(
      @QueryParam("organizationId") final String organizationId,
      @QueryParam("metricName") final String metricName,
      @QueryParam("hours") @DefaultValue("24") final int hours) {
    return json(monitoringService.listMetrics(organizationId, metricName, hours));
  }

  @GET
  @Path("alerts")
  public Response listAlerts(
      @QueryParam("organizationId") final String organizationId,
      @QueryParam("status") final String status,
      @QueryParam("severity") final String severity,
      @QueryParam("alertType") final String alertType,
      @QueryParam("limit") @DefaultValue("" + Paging.DEFAULT_LIMIT) final int limit,
      @QueryParam("offset") @DefaultValue("0") final int offset) {
    return json(
        monitoringService.listAlerts(
            organizationId,
            Params.optional("status", status, AlertStatus::fromValue),
            Params.optional("severity", severity, AlertSeverity::fromValue),
            alertType,
            limit,
            offset));
  }

  @POST
  @Path("alerts/{id}/acknowledge")
  public Response acknowledgeAlert(
      @PathParam("id") final String alertId,
      @QueryParam("actorId") final String actorId,
      @QueryParam("organizationId") final String organizationId) {
    try {
      LoggerContext.pushContext(organizationId);
      return json(monitoringService.acknowledgeAlert(alertId, actorId, organizationId));
    } finally {
      LoggerContext.clearContext();
    }
  }

  @POST
  @Path("alerts/{id}/resolve")
  public Response resolveAlert(
      @PathParam("id") final String alertId,
      @QueryParam("organizationId") final String organizationId) {
    try {
      LoggerContext.pushContext(organizationId);
      return json(monitoringService.resolveAlert(alertId, organizationId));
    } finally {
      LoggerContext.clearContext();
    }
  }

  @GET
  @Path("config")
  public Response getThresholdConfig(@QueryParam("organizationId") final String organizationId) {
    return json(monitoringService.getThresholdConfig(organizationId));
  }

  @PUT
  @Path("config")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response updateThresholdConfig(
      @QueryParam("organizationId") final String organizationId, final String body) {
    try {
      LoggerContext.pushContext(organizationId);
      LOGGER.info("Updating threshold configuration");
      return json(
          monitoringService.updateThresholdConfig(
              organizationId, Params.jsonObject(mapper, body)));
    } finally {
      LoggerContext.clearContext();
    }
  }

  @GET
  @Path("sla")
  public Response listSlaMetrics(@QueryParam("organizationId") final String organizationId) {
    return json(scoreAggregator.listSlaMetrics(organizationId));
  }

  @POST
  @Path("sla")
  public Response evaluateSla(
      @QueryParam("organizationId") final String organizationId,
      @QueryParam("period") @DefaultValue("daily") final String period) {
    return json(
        scoreAggregator.evaluateSla(
            organizationId, Params.optional("period", period, SlaPeriod::fromValue)));
  }

  @GET
  @Path("incidents")
  public Response listIncidents(
      @QueryParam("organizationId") final String organizationId,
      @QueryParam("status") final String status,
      @QueryParam("severity") final String severity,
      @QueryParam("limit") @DefaultValue("" + Paging.DEFAULT_LIMIT) final int limit,
      @QueryParam("offset") @DefaultValue("0") final int offset) {
    return json(
        incidentService.list(
            organizationId,
            Params.optional("status", status, IncidentStatus::fromValue),
            Params.optional("severity", severity, IncidentSeverity::fromValue),
            limit,
            offset));
  }

  @POST
  @Path("incidents")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response createIncident(
      @QueryParam("organizationId") final String organizationId, final String body) {
    try {
      LoggerContext.pushContext(organizationId);
      return json(incidentService.create(organizationId, Params.jsonObject(mapper, body)));
    } finally {
      LoggerContext.clearContext();
    }
  }

  @PUT
  @Path("incidents/{id}/status")
  public Response transitionIncident(
      @PathParam("id") final String incidentId,
      @QueryParam("organizationId") final String organizationId,
      @QueryParam("status") final String status,
      @QueryParam("actorId") final String actorId,
      @QueryParam("rootCause") final String rootCause,
      @QueryParam("resolution") final String resolution) {
    try {
      LoggerContext.pushContext(organizationId);
      return json(
          incidentService.transition(
              incidentId,
              organizationId,
              Params.optional("status", status, IncidentStatus::fromValue),
              actorId,
              rootCause,
              resolution));
    } finally {
      LoggerContext.clearContext();
    }
  }

  private Response json(final Object entity) {
    try {
      return Response.ok(mapper.writeValueAsString(entity)).build();
    } catch (final JsonProcessingException e) {
      LOGGER.error("Failed to serialize response", e);
      return Response.serverError().build();
    }
  }
}
