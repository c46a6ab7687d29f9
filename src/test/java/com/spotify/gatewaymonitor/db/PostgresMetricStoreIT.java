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

import static com.spotify.gatewaymonitor.db.Fixtures.NOW;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

public class PostgresMetricStoreIT {

  private static PostgresMetricStore db;

  @BeforeClass
  public static void setup() {
    db = PostgresContainers.migratedStore();
  }

  @After
  public void truncate() {
    db.truncateAll();
  }

  @AfterClass
  public static void tearDown() {
    db.close();
  }

  @Test
  public void testSetupAndConnection() {
    db.healthCheck();
    assertEquals(Optional.empty(), db.getLatestSnapshot(null));
    assertTrue(db.getTotalConnections() > 0);
  }

  @Test
  public void snapshotsRoundTrip() {
    final HealthSnapshot older = Fixtures.snapshot("org-1", NOW.minusSeconds(60));
    final HealthSnapshot newer = Fixtures.snapshot("org-1", NOW);
    db.insertSnapshot(older);
    db.insertSnapshot(newer);
    db.insertSnapshot(Fixtures.snapshot(null, NOW.plusSeconds(60)));

    assertEquals(Optional.of(newer), db.getLatestSnapshot("org-1"));
    assertEquals(ImmutableList.of(older, newer), db.getSnapshots("org-1", NOW.minusSeconds(300)));
    assertEquals(3, db.getSnapshots(null, NOW.minusSeconds(300)).size());
  }

  @Test
  public void metricsFilteredByNameAndTime() {
    final MetricPoint recent = Fixtures.metric("api_response_time", 120.5, "org-1", NOW);
    db.insertMetric(recent);
    db.insertMetric(
        Fixtures.metric("api_response_time", 80, "org-1", NOW.minus(Duration.ofHours(2))));
    db.insertMetric(Fixtures.metric("api_errors", 2, "org-1", NOW));

    assertEquals(
        ImmutableList.of(recent),
        db.getMetrics("api_response_time", "org-1", NOW.minus(Duration.ofHours(1))));
    assertEquals(3, db.getMetrics(null, null, NOW.minus(Duration.ofDays(1))).size());
  }

  @Test
  public void alertLifecycle() {
    final Alert alert = Fixtures.alert(AlertSeverity.CRITICAL, "org-1", NOW);
    db.insertAlert(alert);

    assertEquals(
        Optional.of(alert),
        db.findActiveAlert("system", AlertSeverity.CRITICAL, "cpu_monitoring", "org-1"));
    assertEquals(Optional.empty(), db.getAlert(alert.id(), "org-2"));

    final Alert acknowledged =
        AlertBuilder.from(alert)
            .status(AlertStatus.ACKNOWLEDGED)
            .acknowledgedBy("user-1")
            .acknowledgedAt(NOW.plusSeconds(5))
            .notificationSent(true)
            .build();
    assertTrue(db.updateAlert(acknowledged));
    assertEquals(Optional.of(acknowledged), db.getAlert(alert.id(), "org-1"));
    assertEquals(
        Optional.empty(),
        db.findActiveAlert("system", AlertSeverity.CRITICAL, "cpu_monitoring", "org-1"));
    assertFalse(db.updateAlert(Fixtures.alert(AlertSeverity.INFO, "org-1", NOW)));
  }

  @Test(expected = IllegalStateException.class)
  public void partialIndexRejectsSecondActiveAlert() {
    db.insertAlert(Fixtures.alert(AlertSeverity.CRITICAL, null, NOW));
    db.insertAlert(Fixtures.alert(AlertSeverity.CRITICAL, null, NOW));
  }

  @Test
  public void alertListing() {
    db.insertAlert(Fixtures.alert(AlertSeverity.CRITICAL, "org-1", NOW));
    db.insertAlert(Fixtures.alert(AlertSeverity.WARNING, "org-1", NOW.plusSeconds(1)));
    db.insertAlert(Fixtures.alert(AlertSeverity.WARNING, "org-2", NOW.plusSeconds(2)));

    final List<Alert> org1 = db.getAlerts("org-1", null, null, null, null, 10, 0);
    assertEquals(2, org1.size());
    assertEquals(AlertSeverity.WARNING, org1.get(0).severity());
    assertEquals(3, db.getAlerts(null, null, null, null, null, 10, 0).size());
    assertEquals(
        1,
        db.getAlerts(null, AlertStatus.ACTIVE, AlertSeverity.CRITICAL, null, null, 10, 0).size());
    assertEquals(1, db.getAlerts(null, null, null, null, null, 1, 2).size());
  }

  @Test
  public void thresholdConfigUpsert() {
    final ThresholdConfig config =
        new ThresholdConfigBuilder()
            .configKey(ThresholdConfig.DEFAULT_KEY)
            .cpuWarning(70)
            .cpuCritical(90)
            .memoryWarning(70)
            .memoryCritical(90)
            .responseTimeWarning(500)
            .responseTimeCritical(2000)
            .uptimeTarget(99.9)
            .responseTimeTarget(150)
            .emailNotifications(true)
            .slackNotifications(true)
            .webhookNotifications(false)
            .notificationRecipients(ImmutableList.of("ops@example.com", "sre@example.com"))
            .updatedAt(NOW)
            .build();
    db.saveThresholdConfig(config);
    assertEquals(Optional.of(config), db.getThresholdConfig(ThresholdConfig.DEFAULT_KEY));

    final ThresholdConfig updated = ThresholdConfigBuilder.from(config).cpuWarning(60).build();
    db.saveThresholdConfig(updated);
    assertEquals(Optional.of(updated), db.getThresholdConfig(ThresholdConfig.DEFAULT_KEY));
  }

  @Test
  public void slaMetricsNewestFirst() {
    for (int i = 0; i < 3; i++) {
      db.insertSlaMetric(
          new SlaMetricBuilder()
              .id("sla-" + i)
              .slaName("api_uptime")
              .slaTarget(99.99)
              .slaPeriod(SlaPeriod.DAILY)
              .currentValue(100.0)
              .compliancePercentage(100.0)
              .status(SlaStatus.COMPLIANT)
              .periodStart(NOW.minus(Duration.ofDays(1)))
              .periodEnd(NOW.plusSeconds(i))
              .recordedAt(NOW.plusSeconds(i))
              .organizationId("org-1")
              .build());
    }
    final List<SlaMetric> rows = db.getSlaMetrics("org-1", 2);
    assertEquals(2, rows.size());
    assertEquals("sla-2", rows.get(0).id());
  }

  @Test
  public void incidentLifecycle() {
    final Incident incident = Fixtures.incident("org-1", NOW);
    db.insertIncident(incident);
    assertEquals(Optional.of(incident), db.getIncident(incident.id(), "org-1"));

    final Incident resolved =
        IncidentBuilder.from(incident)
            .status(IncidentStatus.RESOLVED)
            .rootCause("bad deploy")
            .resolvedBy("user-1")
            .resolvedAt(NOW.plusSeconds(60))
            .updatedAt(NOW.plusSeconds(60))
            .build();
    assertTrue(db.updateIncident(resolved));
    assertEquals(Optional.of(resolved), db.getIncident(incident.id(), "org-1"));
    assertEquals(
        0,
        db.getIncidents(
                "org-1",
                ImmutableList.of(IncidentStatus.OPEN, IncidentStatus.INVESTIGATING),
                null,
                10,
                0)
            .size());
    assertEquals(1, db.getIncidents("org-1", null, IncidentSeverity.HIGH, 10, 0).size());
  }
}
