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

package com.spotify.gatewaymonitor;

import com.spotify.gatewaymonitor.db.Alert;
import com.spotify.gatewaymonitor.db.HealthSnapshot;
import com.spotify.gatewaymonitor.db.Incident;
import com.spotify.gatewaymonitor.db.SlaMetric;
import io.norberg.automatter.AutoMatter;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@AutoMatter
public interface HealthDashboard {

  /** Status of the latest snapshot, or {@code unknown} before the first collection. */
  String status();

  Optional<HealthSnapshot> currentHealth();

  List<Alert> recentAlerts();

  List<SlaMetric> slaMetrics();

  List<Incident> activeIncidents();

  Instant generatedAt();
}
