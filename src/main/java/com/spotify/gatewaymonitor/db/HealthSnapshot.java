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

package com.spotify.gatewaymonitor.db;

import io.norberg.automatter.AutoMatter;
import java.time.Instant;
import java.util.Optional;

/** Point-in-time host and gateway health. Utilization values are on a 0-100 scale. */
@AutoMatter
public interface HealthSnapshot {

  double cpuUsage();

  double memoryUsage();

  double diskUsage();

  // ms
  double networkLatency();

  // ms, mean of recent api_response_time points
  double responseTime();

  HealthStatus status();

  long uptimeSeconds();

  int activeConnections();

  double errorRate();

  // requests per second
  double throughput();

  Instant recordedAt();

  Optional<String> organizationId();

  // Only set on an error snapshot
  Optional<String> error();
}
