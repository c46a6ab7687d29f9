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

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Provider
public class MonitoringExceptionMapper implements ExceptionMapper<MonitoringException> {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringExceptionMapper.class);

  @Override
  public Response toResponse(final MonitoringException exception) {
    final ErrorCode code = exception.errorCode();
    if (code == ErrorCode.STORE_UNAVAILABLE || code == ErrorCode.COLLECTION_FAILED) {
      LOGGER.error("Request failed with {}", code, exception);
    } else {
      LOGGER.debug("Request rejected with {}: {}", code, exception.getMessage());
    }
    return Response.status(code.httpStatus())
        .type(MediaType.APPLICATION_JSON)
        .entity(ErrorBody.render(code.kind(), exception.getMessage()))
        .build();
  }
}
