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

import static com.google.common.base.Preconditions.checkNotNull;

public class MonitoringException extends RuntimeException {

  private final ErrorCode errorCode;

  public MonitoringException(final ErrorCode errorCode, final String message) {
    super(message);
    this.errorCode = checkNotNull(errorCode);
  }

  public MonitoringException(
      final ErrorCode errorCode, final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = checkNotNull(errorCode);
  }

  public ErrorCode errorCode() {
    return errorCode;
  }

  public static MonitoringException invalidField(final String field, final String reason) {
    return new MonitoringException(ErrorCode.INVALID_FIELD, field + ": " + reason);
  }

  public static MonitoringException notFound(final String what, final String id) {
    return new MonitoringException(ErrorCode.NOT_FOUND, what + " " + id + " not found");
  }

  public static MonitoringException storeUnavailable(
      final String operation, final Throwable cause) {
    return new MonitoringException(
        ErrorCode.STORE_UNAVAILABLE, "metric store failed during " + operation, cause);
  }

  public static MonitoringException collectionFailed(final String reason, final Throwable cause) {
    return new MonitoringException(ErrorCode.COLLECTION_FAILED, reason, cause);
  }
}
