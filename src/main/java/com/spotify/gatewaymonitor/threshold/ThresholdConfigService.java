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

package com.spotify.gatewaymonitor.threshold;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.db.ThresholdConfig;
import com.spotify.gatewaymonitor.db.ThresholdConfigBuilder;
import com.spotify.gatewaymonitor.util.MonitoringException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the thresholds alerts are evaluated against. An organization without its own config
 * falls back to the stored {@code default} config, and then to built-in values.
 */
public class ThresholdConfigService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ThresholdConfigService.class);

  public static final ThresholdConfig BUILT_IN_DEFAULT =
      new ThresholdConfigBuilder()
          .configKey(ThresholdConfig.DEFAULT_KEY)
          .cpuWarning(80.0)
          .cpuCritical(95.0)
          .memoryWarning(80.0)
          .memoryCritical(95.0)
          .responseTimeWarning(1000.0)
          .responseTimeCritical(5000.0)
          .uptimeTarget(99.99)
          .responseTimeTarget(100.0)
          .emailNotifications(true)
          .slackNotifications(false)
          .webhookNotifications(false)
          .notificationRecipients(ImmutableList.of())
          .updatedAt(Optional.empty())
          .build();

  private final MetricStore store;
  private final Supplier<Instant> timeSupplier;

  public ThresholdConfigService(final MetricStore store, final Supplier<Instant> timeSupplier) {
    this.store = checkNotNull(store);
    this.timeSupplier = checkNotNull(timeSupplier);
  }

  public ThresholdConfig get(final String organizationId) {
    if (organizationId != null) {
      final Optional<ThresholdConfig> own = store.getThresholdConfig(organizationId);
      if (own.isPresent()) {
        return own.get();
      }
    }
    return store.getThresholdConfig(ThresholdConfig.DEFAULT_KEY).orElse(BUILT_IN_DEFAULT);
  }

  /**
   * Merges the recognized snake_case keys of {@code partial} into the effective config and stores
   * the result under the organization's key. Unrecognized keys are ignored.
   */
  public ThresholdConfig update(final String organizationId, final Map<String, Object> partial) {
    final ThresholdConfigBuilder builder = ThresholdConfigBuilder.from(get(organizationId));
    for (final Map.Entry<String, Object> entry : partial.entrySet()) {
      final String key = entry.getKey();
      final Object value = entry.getValue();
      switch (key) {
        case "cpu_warning_threshold":
          builder.cpuWarning(number(key, value));
          break;
        case "cpu_critical_threshold":
          builder.cpuCritical(number(key, value));
          break;
        case "memory_warning_threshold":
          builder.memoryWarning(number(key, value));
          break;
        case "memory_critical_threshold":
          builder.memoryCritical(number(key, value));
          break;
        case "response_time_warning_threshold":
          builder.responseTimeWarning(number(key, value));
          break;
        case "response_time_critical_threshold":
          builder.responseTimeCritical(number(key, value));
          break;
        case "uptime_target":
          builder.uptimeTarget(number(key, value));
          break;
        case "response_time_target":
          builder.responseTimeTarget(number(key, value));
          break;
        case "email_notifications":
          builder.emailNotifications(bool(key, value));
          break;
        case "slack_notifications":
          builder.slackNotifications(bool(key, value));
          break;
        case "webhook_notifications":
          builder.webhookNotifications(bool(key, value));
          break;
        case "notification_recipients":
          builder.notificationRecipients(strings(key, value));
          break;
        default:
          LOGGER.debug("Ignoring unknown threshold key {}", key);
      }
    }
    final ThresholdConfig updated =
        builder
            .configKey(organizationId != null ? organizationId : ThresholdConfig.DEFAULT_KEY)
            .updatedAt(timeSupplier.get())
            .build();
    store.saveThresholdConfig(updated);
    LOGGER.info("Threshold config {} updated", updated.configKey());
    return updated;
  }

  private static double number(final String key, final Object value) {
    if (!(value instanceof Number)) {
      throw MonitoringException.invalidField(key, "expected a number but got " + value);
    }
    final double number = ((Number) value).doubleValue();
    if (!Double.isFinite(number)) {
      throw MonitoringException.invalidField(key, "must be finite");
    }
    return number;
  }

  private static boolean bool(final String key, final Object value) {
    if (!(value instanceof Boolean)) {
      throw MonitoringException.invalidField(key, "expected a boolean but got " + value);
    }
    return (Boolean) value;
  }

  private static List<String> strings(final String key, final Object value) {
    if (!(value instanceof List)) {
      throw MonitoringException.invalidField(key, "expected a list of strings");
    }
    final List<String> result = new ArrayList<>();
    for (final Object item : (List<?>) value) {
      if (!(item instanceof String)) {
        throw MonitoringException.invalidField(key, "expected a list of strings");
      }
      result.add((String) item);
    }
    return result;
  }
}
