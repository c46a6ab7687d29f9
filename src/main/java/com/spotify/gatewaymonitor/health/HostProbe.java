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

package com.spotify.gatewaymonitor.health;

/**
 * Reads host utilization. Each reading may fail on its own with a runtime exception, in which case
 * the sampler falls back to a default for that reading only.
 */
public interface HostProbe {

  /** 0-100 */
  double cpuUsage();

  /** 0-100 */
  double memoryUsage();

  /** 0-100 */
  double diskUsage();

  /** Estimated network latency in ms. */
  double networkLatency();
}
