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
import com.google.common.collect.ImmutableMap;
import com.spotify.gatewaymonitor.LoggerContext;
import com.spotify.gatewaymonitor.MonitoringService;
import com.spotify.gatewaymonitor.scaling.ScalingAdvisor;
import com.spotify.gatewaymonitor.scaling.ScalingEvent;
import javax.inject.Inject;
import javax.ws.rs.Consumes;
import javax.ws.rs.DefaultValue;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.PUT;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Path("/scalability")
@Produces(MediaType.APPLICATION_JSON)
public class ScalabilityResources implements Endpoint {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScalabilityResources.class);

  private final MonitoringService monitoringService;
  private final ScalingAdvisor scalingAdvisor;
  private final ObjectMapper mapper;

  @Inject
  public ScalabilityResources(
      final MonitoringService monitoringService,
      final ScalingAdvisor scalingAdvisor,
      final ObjectMapper mapper) {
    this.monitoringService = checkNotNull(monitoringService);
    this.scalingAdvisor = checkNotNull(scalingAdvisor);
    this.mapper = checkNotNull(mapper);
  }

  @GET
  @Path("analyze")
  public Response analyze(@QueryParam("organizationId") final String organizationId) {
    try {
      LoggerContext.pushContext(organizationId);
      return json(monitoringService.analyzeScalability(organizationId));
    } finally {
      LoggerContext.clearContext();
    }
  }

  @GET
  @Path("config")
  public Response configuration() {
    return json(scalingAdvisor.configuration());
  }

  @GET
  @Path("load-balancer")
  public Response loadBalancer() {
    return json(scalingAdvisor.loadBalancerStatus());
  }

  @GET
  @Path("database")
  public Response database() {
    return json(scalingAdvisor.shardingStatus());
  }

  @GET
  @Path("microservices")
  public Response microservices() {
    return json(scalingAdvisor.microservicesStatus());
  }

  @POST
  @Path("auto-scaling")
  public Response toggleAutoScaling(
      @QueryParam("enabled") @DefaultValue("true") final boolean enabled) {
    return json(ImmutableMap.of("autoScalingEnabled", scalingAdvisor.toggleAutoScaling(enabled)));
  }

  @POST
  @Path("simulate")
  public Response simulate(
      @QueryParam("eventType") final String eventType,
      @QueryParam("instances") @DefaultValue("1") final String instances) {
    final Integer count = Params.optional("instances", instances, Integer::valueOf);
    final ScalingEvent event =
        scalingAdvisor.simulateScalingEvent(eventType, count == null ? 1 : count);
    return json(ImmutableMap.of("event", event, "currentInstances", event.newTotal()));
  }

  @PUT
  @Path("thresholds")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response setThresholds(final String body) {
    return json(scalingAdvisor.setThresholds(Params.jsonObject(mapper, body)));
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
