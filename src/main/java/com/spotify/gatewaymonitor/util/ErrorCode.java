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

package com.spotify.gatewaymonitor.util;

import javax.ws.rs.core.Response;

public enum ErrorCode {
  COLLECTION_FAILED(Response.Status.INTERNAL_SERVER_ERROR),
  INVALID_FIELD(Response.Status.BAD_REQUEST),
  NOT_FOUND(Response.Status.NOT_FOUND),
  STORE_UNAVAILABLE(Response.Status.SERVICE_UNAVAILABLE);

  private final Response.Status httpStatus;

  ErrorCode(final Response.Status httpStatus) {
    this.httpStatus = httpStatus;
  }

  public Response.Status httpStatus() {
    return httpStatus;
  }

  /** Name used in error bodies, e.g. {@code invalid_field}. */
  public String kind() {
    return name().toLowerCase();
  }
}
