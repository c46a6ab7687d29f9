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

import com.spotify.gatewaymonitor.db.HealthSnapshot;
import com.spotify.gatewaymonitor.db.ThresholdConfig;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/** The conditions a snapshot is checked for. Each family is evaluated on its own. */
public enum AlertFamily {
  CPU(
      "system",
      "cpu_monitoring",
      "cpu_usage",
      "High CPU Usage",
      "CPU usage is %.1f%%",
      HealthSnapshot::cpuUsage,
      ThresholdConfig::cpuWarning,
      ThresholdConfig::cpuCritical),
  MEMORY(
      "system",
      "memory_monitoring",
      "memory_usage",
      "High Memory Usage",
      "Memory usage is %.1f%%",
      HealthSnapshot::memoryUsage,
      ThresholdConfig::memoryWarning,
      ThresholdConfig::memoryCritical),
  RESPONSE_TIME(
      "performance",
      "performance_monitoring",
      "response_time",
      "High Response Time",
      "Average response time is %.1fms",
      HealthSnapshot::responseTime,
      ThresholdConfig::responseTimeWarning,
      ThresholdConfig::responseTimeCritical);

  private final String alertType;
  private final String source;
  private final String metricName;
  private final String title;
  private final String messageFormat;
  private final ToDoubleFunction<HealthSnapshot> reading;
  private final ToDoubleFunction<ThresholdConfig> warning;
  private final ToDoubleFunction<ThresholdConfig> critical;

  AlertFamily(
      final String alertType,
      final String source,
      final String metricName,
      final String title,
      final String messageFormat,
      final ToDoubleFunction<HealthSnapshot> reading,
      final ToDoubleFunction<ThresholdConfig> warning,
      final ToDoubleFunction<ThresholdConfig> critical) {
    this.alertType = alertType;
    this.source = source;
    this.metricName = metricName;
    this.title = title;
    this.messageFormat = messageFormat;
    this.reading = reading;
    this.warning = warning;
    this.critical = critical;
  }

  public String alertType() {
    return alertType;
  }

  public String source() {
    return source;
  }

  public String metricName() {
    return metricName;
  }

  public String title() {
    return title;
  }

  public String message(final double value) {
    return String.format(Locale.ROOT, messageFormat, value);
  }

  public double reading(final HealthSnapshot snapshot) {
    return reading.applyAsDouble(snapshot);
  }

  public double warningThreshold(final ThresholdConfig config) {
    return warning.applyAsDouble(config);
  }

  public double criticalThreshold(final ThresholdConfig config) {
    return critical.applyAsDouble(config);
  }
}
