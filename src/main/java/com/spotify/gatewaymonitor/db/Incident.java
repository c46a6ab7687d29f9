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
import java.util.List;
import java.util.Optional;

@AutoMatter
public interface Incident {

  String id();

  // outage, performance, security
  String incidentType();

  IncidentSeverity severity();

  String title();

  String description();

  IncidentStatus status();

  IncidentPriority priority();

  List<String> affectedServices();

  ImpactLevel impactLevel();

  Optional<String> rootCause();

  Optional<String> resolution();

  Optional<String> resolvedBy();

  Optional<Instant> resolvedAt();

  Instant detectedAt();

  Instant updatedAt();

  Optional<String> organizationId();
}
