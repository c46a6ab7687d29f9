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
public interface Alert {

  String id();

  // system, performance, security
  String alertType();

  AlertSeverity severity();

  String title();

  String message();

  AlertStatus status();

  // component that raised the alert
  String source();

  String metricName();

  double thresholdValue();

  double currentValue();

  Optional<String> acknowledgedBy();

  Optional<Instant> acknowledgedAt();

  Optional<Instant> resolvedAt();

  boolean notificationSent();

  List<String> notificationChannels();

  Optional<String> organizationId();

  Instant createdAt();
}
