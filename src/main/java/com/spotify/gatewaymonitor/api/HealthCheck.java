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

import com.spotify.gatewaymonitor.db.MetricStore;
import javax.inject.Inject;
import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.core.Response;

@Path("/health")
public class HealthCheck implements Endpoint {

  private final MetricStore store;

  @Inject
  public HealthCheck(final MetricStore store) {
    this.store = checkNotNull(store);
  }

  @GET
  public Response healthCheck() {
    store.healthCheck();
    return Response.ok().build();
  }
}
