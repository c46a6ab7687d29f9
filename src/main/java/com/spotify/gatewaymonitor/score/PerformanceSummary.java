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

package com.spotify.gatewaymonitor.score;

import com.spotify.gatewaymonitor.cache.CacheStats;
import io.norberg.automatter.AutoMatter;
import java.time.Instant;

@AutoMatter
public interface PerformanceSummary {

  long windowHours();

  long totalRequests();

  double avgResponseTime();

  double minResponseTime();

  double maxResponseTime();

  double errorRate();

  CacheStats cacheStats();

  double optimizationScore();

  Instant generatedAt();
}
