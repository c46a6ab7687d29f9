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

package com.spotify.gatewaymonitor.alert;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.gatewaymonitor.db.Alert;
import com.spotify.gatewaymonitor.db.AlertBuilder;
import com.spotify.gatewaymonitor.db.AlertSeverity;
import com.spotify.gatewaymonitor.db.AlertStatus;
import com.spotify.gatewaymonitor.db.HealthSnapshot;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.db.ThresholdConfig;
import com.spotify.gatewaymonitor.metric.MonitorMetrics;
import com.spotify.gatewaymonitor.util.MonitoringException;
import com.spotify.gatewaymonitor.util.Paging;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns health snapshots into alerts.
 *
 * <p>For every {@link AlertFamily} a reading above the critical threshold raises a critical alert,
 * a reading above the warning threshold raises a warning, and anything else resolves whatever is
 * still active for that family. Raising is deduplicated: while an alert for the same type,
 * severity, source and organization is active, later readings only refresh its value.
 *
 * <p>The lookup and the write happen under a lock owned by the organization. Notifications go out
 * after the lock is released.
 */
public class AlertEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEngine.class);
  private static final String NO_ORGANIZATION = "";
  // used when every notification flag is off
  static final String DEFAULT_CHANNEL = "email";

  private final MetricStore store;
  private final Notifier notifier;
  private final MonitorMetrics metrics;
  private final Supplier<Instant> timeSupplier;
  private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  public AlertEngine(
      final MetricStore store,
      final Notifier notifier,
      final MonitorMetrics metrics,
      final Supplier<Instant> timeSupplier) {
    this.store = checkNotNull(store);
    this.notifier = checkNotNull(notifier);
    this.metrics = checkNotNull(metrics);
    this.timeSupplier = checkNotNull(timeSupplier);
  }

  /** @return the alerts raised or refreshed by this snapshot */
  public List<Alert> evaluate(
      final HealthSnapshot snapshot, final ThresholdConfig config, final String organizationId) {
    final List<Alert> raised = new ArrayList<>();
    for (final AlertFamily family : AlertFamily.values()) {
      final double value = family.reading(snapshot);
      if (value > family.criticalThreshold(config)) {
        raised.add(
            raise(
                family,
                AlertSeverity.CRITICAL,
                family.criticalThreshold(config),
                value,
                config,
                organizationId));
      } else if (value > family.warningThreshold(config)) {
        raised.add(
            raise(
                family,
                AlertSeverity.WARNING,
                family.warningThreshold(config),
                value,
                config,
                organizationId));
      } else {
        clear(family, organizationId);
      }
    }
    return raised;
  }

  private Alert raise(
      final AlertFamily family,
      final AlertSeverity severity,
      final double threshold,
      final double value,
      final ThresholdConfig config,
      final String organizationId) {
    final Alert created;
    final ReentrantLock lock = lockFor(organizationId);
    lock.lock();
    try {
      final Optional<Alert> active =
          store.findActiveAlert(family.alertType(), severity, family.source(), organizationId);
      if (active.isPresent()) {
        final Alert refreshed =
            AlertBuilder.from(active.get())
                .currentValue(value)
                .message(family.message(value))
                .build();
        store.updateAlert(refreshed);
        metrics.markAlertUpdated(family.alertType(), severity);
        return refreshed;
      }
      created =
          new AlertBuilder()
              .id(UUID.randomUUID().toString())
              .alertType(family.alertType())
              .severity(severity)
              .title(family.title())
              .message(family.message(value))
              .status(AlertStatus.ACTIVE)
              .source(family.source())
              .metricName(family.metricName())
              .thresholdValue(threshold)
              .currentValue(value)
              .acknowledgedBy(Optional.empty())
              .acknowledgedAt(Optional.empty())
              .resolvedAt(Optional.empty())
              .notificationSent(false)
              .notificationChannels(channels(config))
              .organizationId(Optional.ofNullable(organizationId))
              .createdAt(timeSupplier.get())
              .build();
      store.insertAlert(created);
    } finally {
      lock.unlock();
    }
    LOGGER.info("{} alert raised: {}", severity.value(), created.message());
    metrics.markAlertCreated(family.alertType(), severity);
    return deliver(created, config);
  }

  private Alert deliver(final Alert alert, final ThresholdConfig config) {
    try {
      notifier.send(alert, config);
    } catch (final RuntimeException e) {
      LOGGER.warn("Failed to send notification for alert {}", alert.id(), e);
      metrics.markNotificationFailure();
      return alert;
    }
    // Re-read under the lock so a concurrent acknowledge or resolve is not overwritten.
    final String organizationId = alert.organizationId().orElse(null);
    final ReentrantLock lock = lockFor(organizationId);
    lock.lock();
    try {
      final Alert current = store.getAlert(alert.id(), organizationId).orElse(alert);
      final Alert notified = AlertBuilder.from(current).notificationSent(true).build();
      store.updateAlert(notified);
      return notified;
    } finally {
      lock.unlock();
    }
  }

  private void clear(final AlertFamily family, final String organizationId) {
    final ReentrantLock lock = lockFor(organizationId);
    lock.lock();
    try {
      for (final Alert active :
          store.getActiveAlerts(family.alertType(), family.source(), organizationId)) {
        store.updateAlert(
            AlertBuilder.from(active)
                .status(AlertStatus.RESOLVED)
                .resolvedAt(timeSupplier.get())
                .build());
        metrics.markAlertResolved(active.alertType(), active.severity());
        LOGGER.info("Condition cleared, resolved alert {}", active.id());
      }
    } finally {
      lock.unlock();
    }
  }

  public Alert acknowledge(
      final String alertId, final String actorId, final String organizationId) {
    if (actorId == null || actorId.trim().isEmpty()) {
      throw MonitoringException.invalidField("actorId", "is required");
    }
    final ReentrantLock lock = lockFor(organizationId);
    lock.lock();
    try {
      final Alert alert =
          store
              .getAlert(alertId, organizationId)
              .filter(a -> a.status() == AlertStatus.ACTIVE)
              .orElseThrow(() -> MonitoringException.notFound("Active alert", alertId));
      final Alert acknowledged =
          AlertBuilder.from(alert)
              .status(AlertStatus.ACKNOWLEDGED)
              .acknowledgedBy(actorId)
              .acknowledgedAt(timeSupplier.get())
              .build();
      store.updateAlert(acknowledged);
      return acknowledged;
    } finally {
      lock.unlock();
    }
  }

  public Alert resolve(final String alertId, final String organizationId) {
    final ReentrantLock lock = lockFor(organizationId);
    lock.lock();
    try {
      final Alert alert =
          store
              .getAlert(alertId, organizationId)
              .filter(a -> a.status() != AlertStatus.RESOLVED)
              .orElseThrow(() -> MonitoringException.notFound("Alert", alertId));
      final Alert resolved =
          AlertBuilder.from(alert)
              .status(AlertStatus.RESOLVED)
              .resolvedAt(timeSupplier.get())
              .build();
      store.updateAlert(resolved);
      metrics.markAlertResolved(resolved.alertType(), resolved.severity());
      return resolved;
    } finally {
      lock.unlock();
    }
  }

  public List<Alert> listAlerts(
      final String organizationId,
      final AlertStatus status,
      final AlertSeverity severity,
      final String alertType,
      final int limit,
      final int offset) {
    Paging.check(limit, offset);
    return store.getAlerts(organizationId, status, severity, alertType, null, limit, offset);
  }

  public List<Alert> recentAlerts(
      final String organizationId, final Instant since, final int limit) {
    return store.getAlerts(organizationId, null, null, null, since, limit, 0);
  }

  private static List<String> channels(final ThresholdConfig config) {
    final List<String> channels = new ArrayList<>();
    if (config.emailNotifications()) {
      channels.add("email");
    }
    if (config.slackNotifications()) {
      channels.add("slack");
    }
    if (config.webhookNotifications()) {
      channels.add("webhook");
    }
    if (channels.isEmpty()) {
      channels.add(DEFAULT_CHANNEL);
    }
    return channels;
  }

  @VisibleForTesting
  ReentrantLock lockFor(final String organizationId) {
    return locks.computeIfAbsent(
        organizationId == null ? NO_ORGANIZATION : organizationId, k -> new ReentrantLock());
  }
}
