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
import com.spotify.gatewaymonitor.score.ScoreAggregator;
import com.spotify.gatewaymonitor.util.MonitoringException;
import java.time.Duration;
import javax.inject.Inject;
import javax.ws.rs.DefaultValue;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Path("/performance")
@Produces(MediaType.APPLICATION_JSON)
public class PerformanceResources implements Endpoint {

  private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceResources.class);

  private final ScoreAggregator scoreAggregator;
  private final ObjectMapper mapper;

  @Inject
  public PerformanceResources(final ScoreAggregator scoreAggregator, final ObjectMapper mapper) {
    this.scoreAggregator = checkNotNull(scoreAggregator);
    this.mapper = checkNotNull(mapper);
  }

  @GET
  @Path("summary")
  public Response summary(@QueryParam("hours") @DefaultValue("24") final int hours) {
    if (hours < 1) {
      throw MonitoringException.invalidField("hours", "must be at least 1");
    }
    return json(scoreAggregator.performanceSummary(Duration.ofHours(hours)));
  }

  @GET
  @Path("optimize")
  public Response optimize() {
    return json(scoreAggregator.queryOptimizationReport());
  }

  @GET
  @Path("response-times")
  public Response responseTimes() {
    return json(scoreAggregator.responseTimeReport());
  }

  @GET
  @Path("cache/stats")
  public Response cacheStats() {
    return json(scoreAggregator.cacheStatistics());
  }

  @POST
  @Path("cache/clear")
  public Response clearCache() {
    return json(ImmutableMap.of("cleared", scoreAggregator.clearCache()));
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
