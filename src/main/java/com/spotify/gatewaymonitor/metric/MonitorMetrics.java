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

package com.spotify.gatewaymonitor.metric;

import com.codahale.metrics.Gauge;
import com.spotify.gatewaymonitor.Main;
import com.spotify.gatewaymonitor.db.AlertSeverity;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.scaling.ScalingAdvisor;
import com.spotify.metrics.core.MetricId;
import com.spotify.metrics.core.SemanticMetricRegistry;

/*Helper class containing methods to register and measure monitoring metrics.*/
public class MonitorMetrics {

  public static final MetricId APP_PREFIX = MetricId.build("key", Main.SERVICE_NAME);

  private final SemanticMetricRegistry registry;

  public MonitorMetrics(final SemanticMetricRegistry registry) {
    this.registry = registry;
  }

  public void markCollection() {
    registry.meter(APP_PREFIX.tagged("what", "health-collections")).mark();
  }

  public void markCollectionFailure() {
    registry.meter(APP_PREFIX.tagged("what", "health-collection-failures")).mark();
  }

  public void markCollectionHeartBeat() {
    registry.meter(APP_PREFIX.tagged("what", "collection-heartbeat")).mark();
  }

  public void markAlertCreated(final String alertType, final AlertSeverity severity) {
    registry.meter(alertMetric("alerts-created", alertType, severity)).mark();
  }

  public void markAlertUpdated(final String alertType, final AlertSeverity severity) {
    registry.meter(alertMetric("alerts-updated", alertType, severity)).mark();
  }

  public void markAlertResolved(final String alertType, final AlertSeverity severity) {
    registry.meter(alertMetric("alerts-resolved", alertType, severity)).mark();
  }

  public void markNotificationFailure() {
    registry.meter(APP_PREFIX.tagged("what", "notification-failures")).mark();
  }

  public void markScalingEvent(final String eventType) {
    registry.meter(APP_PREFIX.tagged("what", "scaling-events").tagged("event-type", eventType))
        .mark();
  }

  private MetricId alertMetric(
      final String what, final String alertType, final AlertSeverity severity) {
    return APP_PREFIX
        .tagged("what", what)
        .tagged("alert-type", alertType)
        .tagged("severity", severity.value());
  }

  public void registerOpenDatabaseConnections(final MetricStore store) {
    final MetricId metricId = APP_PREFIX.tagged("what", "open-db-connections");
    if (!registry.getGauges().containsKey(metricId)) {
      registry.register(metricId, (Gauge<Integer>) store::getTotalConnections);
    }
  }

  public void registerScalingState(final ScalingAdvisor advisor) {
    final MetricId instances = APP_PREFIX.tagged("what", "current-instances");
    if (!registry.getGauges().containsKey(instances)) {
      registry.register(instances, (Gauge<Integer>) advisor::currentInstances);
    }
    final MetricId enabled = APP_PREFIX.tagged("what", "auto-scaling-enabled");
    if (!registry.getGauges().containsKey(enabled)) {
      registry.register(
          enabled, (Gauge<Integer>) () -> advisor.isAutoScalingEnabled() ? 1 : 0);
    }
  }
}
