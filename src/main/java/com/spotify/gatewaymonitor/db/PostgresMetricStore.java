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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.gatewaymonitor.util.MonitoringException;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.flywaydb.core.Flyway;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class PostgresMetricStore implements MetricStore {

  private static final String SNAPSHOT_COLUMNS =
      "cpu_usage, memory_usage, disk_usage, network_latency, response_time, status, "
          + "uptime_seconds, active_connections, error_rate, throughput, organization_id, "
          + "recorded_at";

  private static final String METRIC_COLUMNS =
      "id, metric_name, metric_type, value, unit, endpoint, method, user_id, organization_id, "
          + "recorded_at";

  private static final String ALERT_COLUMNS =
      "id, alert_type, severity, title, message, status, source, metric_name, threshold_value, "
          + "current_value, acknowledged_by, acknowledged_at, resolved_at, notification_sent, "
          + "notification_channels, organization_id, created_at";

  private static final String THRESHOLD_COLUMNS =
      "config_key, cpu_warning_threshold, cpu_critical_threshold, memory_warning_threshold, "
          + "memory_critical_threshold, response_time_warning_threshold, "
          + "response_time_critical_threshold, uptime_target, response_time_target, "
          + "email_notifications, slack_notifications, webhook_notifications, "
          + "notification_recipients, updated_at";

  private static final String SLA_COLUMNS =
      "id, sla_name, sla_target, sla_period, current_value, compliance_percentage, status, "
          + "period_start, period_end, organization_id, recorded_at";

  private static final String INCIDENT_COLUMNS =
      "id, incident_type, severity, title, description, status, priority, affected_services, "
          + "impact_level, root_cause, resolution, resolved_by, resolved_at, detected_at, "
          + "updated_at, organization_id";

  private static final Joiner LIST_JOINER = Joiner.on(',');
  private static final Splitter LIST_SPLITTER = Splitter.on(',').omitEmptyStrings().trimResults();

  private final HikariDataSource dataSource;
  private final NamedParameterJdbcTemplate jdbc;

  public PostgresMetricStore(final Config config) {
    this.dataSource = dataSource(config);
    this.jdbc = new NamedParameterJdbcTemplate(dataSource);
  }

  private HikariDataSource dataSource(final Config config) {
    final HikariDataSource ds = new HikariDataSource();
    ds.setJdbcUrl(config.getString("jdbcUrl"));
    ds.setUsername(config.getString("username"));
    ds.setPassword(config.getString("password"));
    ds.setMaximumPoolSize(config.getInt("maxConnectionPool"));
    ds.setInitializationFailTimeout(-1);
    return ds;
  }

  @Override
  public void close() {
    this.dataSource.close();
  }

  @Override
  public void insertSnapshot(final HealthSnapshot snapshot) {
    final String sql =
        "INSERT INTO health_snapshot("
            + SNAPSHOT_COLUMNS
            + ") VALUES (:cpu_usage, :memory_usage, :disk_usage, :network_latency, "
            + ":response_time, :status, :uptime_seconds, :active_connections, :error_rate, "
            + ":throughput, :organization_id, :recorded_at)";
    final Map<String, Object> params = new HashMap<>();
    params.put("cpu_usage", snapshot.cpuUsage());
    params.put("memory_usage", snapshot.memoryUsage());
    params.put("disk_usage", snapshot.diskUsage());
    params.put("network_latency", snapshot.networkLatency());
    params.put("response_time", snapshot.responseTime());
    params.put("status", snapshot.status().value());
    params.put("uptime_seconds", snapshot.uptimeSeconds());
    params.put("active_connections", snapshot.activeConnections());
    params.put("error_rate", snapshot.errorRate());
    params.put("throughput", snapshot.throughput());
    params.put("organization_id", snapshot.organizationId().orElse(null));
    params.put("recorded_at", Timestamp.from(snapshot.recordedAt()));
    guarded("insertSnapshot", () -> jdbc.update(sql, params));
  }

  @Override
  public Optional<HealthSnapshot> getLatestSnapshot(final String organizationId) {
    final Map<String, Object> params = new HashMap<>();
    final String sql =
        "SELECT "
            + SNAPSHOT_COLUMNS
            + " FROM health_snapshot"
            + where(orgCondition(organizationId, params))
            + " ORDER BY recorded_at DESC, id DESC LIMIT 1";
    return guarded(
        "getLatestSnapshot",
        () ->
            jdbc.query(sql, params, (rs, rowNum) -> buildSnapshotFromResultSet(rs))
                .stream()
                .findFirst());
  }

  @Override
  public List<HealthSnapshot> getSnapshots(final String organizationId, final Instant since) {
    final Map<String, Object> params = new HashMap<>();
    params.put("since", Timestamp.from(since));
    final String sql =
        "SELECT "
            + SNAPSHOT_COLUMNS
            + " FROM health_snapshot"
            + where(orgCondition(organizationId, params), "recorded_at >= :since")
            + " ORDER BY recorded_at ASC, id ASC";
    return guarded(
        "getSnapshots",
        () -> jdbc.query(sql, params, (rs, rowNum) -> buildSnapshotFromResultSet(rs)));
  }

  private HealthSnapshot buildSnapshotFromResultSet(final ResultSet rs) throws SQLException {
    return new HealthSnapshotBuilder()
        .cpuUsage(rs.getDouble("cpu_usage"))
        .memoryUsage(rs.getDouble("memory_usage"))
        .diskUsage(rs.getDouble("disk_usage"))
        .networkLatency(rs.getDouble("network_latency"))
        .responseTime(rs.getDouble("response_time"))
        .status(HealthStatus.fromValue(rs.getString("status")))
        .uptimeSeconds(rs.getLong("uptime_seconds"))
        .activeConnections(rs.getInt("active_connections"))
        .errorRate(rs.getDouble("error_rate"))
        .throughput(rs.getDouble("throughput"))
        .organizationId(Optional.ofNullable(rs.getString("organization_id")))
        .error(Optional.empty())
        .recordedAt(rs.getTimestamp("recorded_at").toInstant())
        .build();
  }

  @Override
  public void insertMetric(final MetricPoint point) {
    final String sql =
        "INSERT INTO metric_point("
            + METRIC_COLUMNS
            + ") VALUES (:id, :metric_name, :metric_type, :value, :unit, :endpoint, :method, "
            + ":user_id, :organization_id, :recorded_at)";
    final Map<String, Object> params = new HashMap<>();
    params.put("id", point.id());
    params.put("metric_name", point.metricName());
    params.put("metric_type", point.metricType().value());
    params.put("value", point.value());
    params.put("unit", point.unit());
    params.put("endpoint", point.endpoint().orElse(null));
    params.put("method", point.method().orElse(null));
    params.put("user_id", point.userId().orElse(null));
    params.put("organization_id", point.organizationId().orElse(null));
    params.put("recorded_at", Timestamp.from(point.recordedAt()));
    guarded("insertMetric", () -> jdbc.update(sql, params));
  }

  @Override
  public List<MetricPoint> getMetrics(
      final String metricName, final String organizationId, final Instant since) {
    final Map<String, Object> params = new HashMap<>();
    final List<String> conditions = new ArrayList<>();
    if (metricName != null) {
      conditions.add("metric_name = :metric_name");
      params.put("metric_name", metricName);
    }
    conditions.add(orgCondition(organizationId, params));
    conditions.add("recorded_at >= :since");
    params.put("since", Timestamp.from(since));
    final String sql =
        "SELECT "
            + METRIC_COLUMNS
            + " FROM metric_point"
            + where(conditions.toArray(new String[0]))
            + " ORDER BY recorded_at DESC";
    return guarded(
        "getMetrics", () -> jdbc.query(sql, params, (rs, rowNum) -> buildMetricFromResultSet(rs)));
  }

  private MetricPoint buildMetricFromResultSet(final ResultSet rs) throws SQLException {
    return new MetricPointBuilder()
        .id(rs.getString("id"))
        .metricName(rs.getString("metric_name"))
        .metricType(MetricType.fromValue(rs.getString("metric_type")))
        .value(rs.getDouble("value"))
        .unit(rs.getString("unit"))
        .endpoint(Optional.ofNullable(rs.getString("endpoint")))
        .method(Optional.ofNullable(rs.getString("method")))
        .userId(Optional.ofNullable(rs.getString("user_id")))
        .organizationId(Optional.ofNullable(rs.getString("organization_id")))
        .recordedAt(rs.getTimestamp("recorded_at").toInstant())
        .build();
  }

  @Override
  public Optional<Alert> findActiveAlert(
      final String alertType,
      final AlertSeverity severity,
      final String source,
      final String organizationId) {
    final Map<String, Object> params = new HashMap<>();
    params.put("alert_type", alertType);
    params.put("severity", severity.value());
    params.put("source", source);
    params.put("status", AlertStatus.ACTIVE.value());
    final String sql =
        "SELECT "
            + ALERT_COLUMNS
            + " FROM alert"
            + where(
                "alert_type = :alert_type",
                "severity = :severity",
                "source = :source",
                "status = :status",
                exactOrgCondition(organizationId, params))
            + " LIMIT 1";
    return guarded(
        "findActiveAlert",
        () ->
            jdbc.query(sql, params, (rs, rowNum) -> buildAlertFromResultSet(rs))
                .stream()
                .findFirst());
  }

  @Override
  public List<Alert> getActiveAlerts(
      final String alertType, final String source, final String organizationId) {
    final Map<String, Object> params = new HashMap<>();
    params.put("alert_type", alertType);
    params.put("source", source);
    params.put("status", AlertStatus.ACTIVE.value());
    final String sql =
        "SELECT "
            + ALERT_COLUMNS
            + " FROM alert"
            + where(
                "alert_type = :alert_type",
                "source = :source",
                "status = :status",
                exactOrgCondition(organizationId, params));
    return guarded(
        "getActiveAlerts",
        () -> jdbc.query(sql, params, (rs, rowNum) -> buildAlertFromResultSet(rs)));
  }

  @Override
  public void insertAlert(final Alert alert) {
    final String sql =
        "INSERT INTO alert("
            + ALERT_COLUMNS
            + ") VALUES (:id, :alert_type, :severity, :title, :message, :status, :source, "
            + ":metric_name, :threshold_value, :current_value, :acknowledged_by, "
            + ":acknowledged_at, :resolved_at, :notification_sent, :notification_channels, "
            + ":organization_id, :created_at)";
    try {
      guarded("insertAlert", () -> jdbc.update(sql, alertParams(alert)));
    } catch (final MonitoringException e) {
      // the partial unique index allows one active alert per key
      if (e.getCause() instanceof DuplicateKeyException) {
        throw new IllegalStateException("Duplicate active alert " + alert.title(), e.getCause());
      }
      throw e;
    }
  }

  @Override
  public boolean updateAlert(final Alert alert) {
    final String sql =
        "UPDATE alert SET "
            + "message = :message, status = :status, current_value = :current_value, "
            + "threshold_value = :threshold_value, acknowledged_by = :acknowledged_by, "
            + "acknowledged_at = :acknowledged_at, resolved_at = :resolved_at, "
            + "notification_sent = :notification_sent, "
            + "notification_channels = :notification_channels "
            + "WHERE id = :id";
    return guarded("updateAlert", () -> jdbc.update(sql, alertParams(alert))) == 1;
  }

  private Map<String, Object> alertParams(final Alert alert) {
    final Map<String, Object> params = new HashMap<>();
    params.put("id", alert.id());
    params.put("alert_type", alert.alertType());
    params.put("severity", alert.severity().value());
    params.put("title", alert.title());
    params.put("message", alert.message());
    params.put("status", alert.status().value());
    params.put("source", alert.source());
    params.put("metric_name", alert.metricName());
    params.put("threshold_value", alert.thresholdValue());
    params.put("current_value", alert.currentValue());
    params.put("acknowledged_by", alert.acknowledgedBy().orElse(null));
    params.put("acknowledged_at", timestamp(alert.acknowledgedAt()));
    params.put("resolved_at", timestamp(alert.resolvedAt()));
    params.put("notification_sent", alert.notificationSent());
    params.put("notification_channels", LIST_JOINER.join(alert.notificationChannels()));
    params.put("organization_id", alert.organizationId().orElse(null));
    params.put("created_at", Timestamp.from(alert.createdAt()));
    return params;
  }

  @Override
  public Optional<Alert> getAlert(final String alertId, final String organizationId) {
    final Map<String, Object> params = new HashMap<>();
    params.put("id", alertId);
    final String sql =
        "SELECT "
            + ALERT_COLUMNS
            + " FROM alert"
            + where("id = :id", exactOrgCondition(organizationId, params));
    return guarded(
        "getAlert",
        () ->
            jdbc.query(sql, params, (rs, rowNum) -> buildAlertFromResultSet(rs))
                .stream()
                .findFirst());
  }

  @Override
  public List<Alert> getAlerts(
      final String organizationId,
      final AlertStatus status,
      final AlertSeverity severity,
      final String alertType,
      final Instant since,
      final int limit,
      final int offset) {
    final Map<String, Object> params = new HashMap<>();
    final List<String> conditions = new ArrayList<>();
    conditions.add(orgCondition(organizationId, params));
    if (status != null) {
      conditions.add("status = :status");
      params.put("status", status.value());
    }
    if (severity != null) {
      conditions.add("severity = :severity");
      params.put("severity", severity.value());
    }
    if (alertType != null) {
      conditions.add("alert_type = :alert_type");
      params.put("alert_type", alertType);
    }
    if (since != null) {
      conditions.add("created_at >= :since");
      params.put("since", Timestamp.from(since));
    }
    params.put("limit", limit);
    params.put("offset", offset);
    final String sql =
        "SELECT "
            + ALERT_COLUMNS
            + " FROM alert"
            + where(conditions.toArray(new String[0]))
            + " ORDER BY created_at DESC LIMIT :limit OFFSET :offset";
    return guarded(
        "getAlerts", () -> jdbc.query(sql, params, (rs, rowNum) -> buildAlertFromResultSet(rs)));
  }

  private Alert buildAlertFromResultSet(final ResultSet rs) throws SQLException {
    return new AlertBuilder()
        .id(rs.getString("id"))
        .alertType(rs.getString("alert_type"))
        .severity(AlertSeverity.fromValue(rs.getString("severity")))
        .title(rs.getString("title"))
        .message(rs.getString("message"))
        .status(AlertStatus.fromValue(rs.getString("status")))
        .source(rs.getString("source"))
        .metricName(rs.getString("metric_name"))
        .thresholdValue(rs.getDouble("threshold_value"))
        .currentValue(rs.getDouble("current_value"))
        .acknowledgedBy(Optional.ofNullable(rs.getString("acknowledged_by")))
        .acknowledgedAt(instant(rs.getTimestamp("acknowledged_at")))
        .resolvedAt(instant(rs.getTimestamp("resolved_at")))
        .notificationSent(rs.getBoolean("notification_sent"))
        .notificationChannels(LIST_SPLITTER.splitToList(rs.getString("notification_channels")))
        .organizationId(Optional.ofNullable(rs.getString("organization_id")))
        .createdAt(rs.getTimestamp("created_at").toInstant())
        .build();
  }

  @Override
  public Optional<ThresholdConfig> getThresholdConfig(final String configKey) {
    final String sql =
        "SELECT " + THRESHOLD_COLUMNS + " FROM threshold_config WHERE config_key = :config_key";
    return guarded(
        "getThresholdConfig",
        () ->
            jdbc.query(
                    sql,
                    ImmutableMap.of("config_key", configKey),
                    (rs, rowNum) -> buildThresholdConfigFromResultSet(rs))
                .stream()
                .findFirst());
  }

  @Override
  public void saveThresholdConfig(final ThresholdConfig config) {
    final String sql =
        "INSERT INTO threshold_config("
            + THRESHOLD_COLUMNS
            + ") VALUES (:config_key, :cpu_warning_threshold, :cpu_critical_threshold, "
            + ":memory_warning_threshold, :memory_critical_threshold, "
            + ":response_time_warning_threshold, :response_time_critical_threshold, "
            + ":uptime_target, :response_time_target, :email_notifications, "
            + ":slack_notifications, :webhook_notifications, :notification_recipients, "
            + ":updated_at) "
            + "ON CONFLICT(config_key) DO UPDATE SET "
            + "cpu_warning_threshold = :cpu_warning_threshold, "
            + "cpu_critical_threshold = :cpu_critical_threshold, "
            + "memory_warning_threshold = :memory_warning_threshold, "
            + "memory_critical_threshold = :memory_critical_threshold, "
            + "response_time_warning_threshold = :response_time_warning_threshold, "
            + "response_time_critical_threshold = :response_time_critical_threshold, "
            + "uptime_target = :uptime_target, response_time_target = :response_time_target, "
            + "email_notifications = :email_notifications, "
            + "slack_notifications = :slack_notifications, "
            + "webhook_notifications = :webhook_notifications, "
            + "notification_recipients = :notification_recipients, updated_at = :updated_at";
    final Map<String, Object> params = new HashMap<>();
    params.put("config_key", config.configKey());
    params.put("cpu_warning_threshold", config.cpuWarning());
    params.put("cpu_critical_threshold", config.cpuCritical());
    params.put("memory_warning_threshold", config.memoryWarning());
    params.put("memory_critical_threshold", config.memoryCritical());
    params.put("response_time_warning_threshold", config.responseTimeWarning());
    params.put("response_time_critical_threshold", config.responseTimeCritical());
    params.put("uptime_target", config.uptimeTarget());
    params.put("response_time_target", config.responseTimeTarget());
    params.put("email_notifications", config.emailNotifications());
    params.put("slack_notifications", config.slackNotifications());
    params.put("webhook_notifications", config.webhookNotifications());
    params.put("notification_recipients", LIST_JOINER.join(config.notificationRecipients()));
    params.put("updated_at", timestamp(config.updatedAt()));
    guarded("saveThresholdConfig", () -> jdbc.update(sql, params));
  }

  private ThresholdConfig buildThresholdConfigFromResultSet(final ResultSet rs)
      throws SQLException {
    return new ThresholdConfigBuilder()
        .configKey(rs.getString("config_key"))
        .cpuWarning(rs.getDouble("cpu_warning_threshold"))
        .cpuCritical(rs.getDouble("cpu_critical_threshold"))
        .memoryWarning(rs.getDouble("memory_warning_threshold"))
        .memoryCritical(rs.getDouble("memory_critical_threshold"))
        .responseTimeWarning(rs.getDouble("response_time_warning_threshold"))
        .responseTimeCritical(rs.getDouble("response_time_critical_threshold"))
        .uptimeTarget(rs.getDouble("uptime_target"))
        .responseTimeTarget(rs.getDouble("response_time_target"))
        .emailNotifications(rs.getBoolean("email_notifications"))
        .slackNotifications(rs.getBoolean("slack_notifications"))
        .webhookNotifications(rs.getBoolean("webhook_notifications"))
        .notificationRecipients(LIST_SPLITTER.splitToList(rs.getString("notification_recipients")))
        .updatedAt(instant(rs.getTimestamp("updated_at")))
        .build();
  }

  @Override
  public void insertSlaMetric(final SlaMetric metric) {
    final String sql =
        "INSERT INTO sla_metric("
            + SLA_COLUMNS
            + ") VALUES (:id, :sla_name, :sla_target, :sla_period, :current_value, "
            + ":compliance_percentage, :status, :period_start, :period_end, :organization_id, "
            + ":recorded_at)";
    final Map<String, Object> params = new HashMap<>();
    params.put("id", metric.id());
    params.put("sla_name", metric.slaName());
    params.put("sla_target", metric.slaTarget());
    params.put("sla_period", metric.slaPeriod().value());
    params.put("current_value", metric.currentValue());
    params.put("compliance_percentage", metric.compliancePercentage());
    params.put("status", metric.status().value());
    params.put("period_start", Timestamp.from(metric.periodStart()));
    params.put("period_end", Timestamp.from(metric.periodEnd()));
    params.put("organization_id", metric.organizationId().orElse(null));
    params.put("recorded_at", Timestamp.from(metric.recordedAt()));
    guarded("insertSlaMetric", () -> jdbc.update(sql, params));
  }

  @Override
  public List<SlaMetric> getSlaMetrics(final String organizationId, final int limit) {
    final Map<String, Object> params = new HashMap<>();
    params.put("limit", limit);
    final String sql =
        "SELECT "
            + SLA_COLUMNS
            + " FROM sla_metric"
            + where(orgCondition(organizationId, params))
            + " ORDER BY recorded_at DESC LIMIT :limit";
    return guarded(
        "getSlaMetrics",
        () ->
            jdbc.query(
                sql,
                params,
                (rs, rowNum) ->
                    new SlaMetricBuilder()
                        .id(rs.getString("id"))
                        .slaName(rs.getString("sla_name"))
                        .slaTarget(rs.getDouble("sla_target"))
                        .slaPeriod(SlaPeriod.fromValue(rs.getString("sla_period")))
                        .currentValue(rs.getDouble("current_value"))
                        .compliancePercentage(rs.getDouble("compliance_percentage"))
                        .status(SlaStatus.fromValue(rs.getString("status")))
                        .periodStart(rs.getTimestamp("period_start").toInstant())
                        .periodEnd(rs.getTimestamp("period_end").toInstant())
                        .organizationId(Optional.ofNullable(rs.getString("organization_id")))
                        .recordedAt(rs.getTimestamp("recorded_at").toInstant())
                        .build()));
  }

  @Override
  public void insertIncident(final Incident incident) {
    final String sql =
        "INSERT INTO incident("
            + INCIDENT_COLUMNS
            + ") VALUES (:id, :incident_type, :severity, :title, :description, :status, "
            + ":priority, :affected_services, :impact_level, :root_cause, :resolution, "
            + ":resolved_by, :resolved_at, :detected_at, :updated_at, :organization_id)";
    guarded("insertIncident", () -> jdbc.update(sql, incidentParams(incident)));
  }

  @Override
  public boolean updateIncident(final Incident incident) {
    final String sql =
        "UPDATE incident SET status = :status, root_cause = :root_cause, "
            + "resolution = :resolution, resolved_by = :resolved_by, "
            + "resolved_at = :resolved_at, updated_at = :updated_at "
            + "WHERE id = :id";
    return guarded("updateIncident", () -> jdbc.update(sql, incidentParams(incident))) == 1;
  }

  private Map<String, Object> incidentParams(final Incident incident) {
    final Map<String, Object> params = new HashMap<>();
    params.put("id", incident.id());
    params.put("incident_type", incident.incidentType());
    params.put("severity", incident.severity().value());
    params.put("title", incident.title());
    params.put("description", incident.description());
    params.put("status", incident.status().value());
    params.put("priority", incident.priority().value());
    params.put("affected_services", LIST_JOINER.join(incident.affectedServices()));
    params.put("impact_level", incident.impactLevel().value());
    params.put("root_cause", incident.rootCause().orElse(null));
    params.put("resolution", incident.resolution().orElse(null));
    params.put("resolved_by", incident.resolvedBy().orElse(null));
    params.put("resolved_at", timestamp(incident.resolvedAt()));
    params.put("detected_at", Timestamp.from(incident.detectedAt()));
    params.put("updated_at", Timestamp.from(incident.updatedAt()));
    params.put("organization_id", incident.organizationId().orElse(null));
    return params;
  }

  @Override
  public Optional<Incident> getIncident(final String incidentId, final String organizationId) {
    final Map<String, Object> params = new HashMap<>();
    params.put("id", incidentId);
    final String sql =
        "SELECT "
            + INCIDENT_COLUMNS
            + " FROM incident"
            + where("id = :id", exactOrgCondition(organizationId, params));
    return guarded(
        "getIncident",
        () ->
            jdbc.query(sql, params, (rs, rowNum) -> buildIncidentFromResultSet(rs))
                .stream()
                .findFirst());
  }

  @Override
  public List<Incident> getIncidents(
      final String organizationId,
      final List<IncidentStatus> statuses,
      final IncidentSeverity severity,
      final int limit,
      final int offset) {
    final Map<String, Object> params = new HashMap<>();
    final List<String> conditions = new ArrayList<>();
    conditions.add(orgCondition(organizationId, params));
    if (statuses != null && !statuses.isEmpty()) {
      conditions.add("status IN (:statuses)");
      params.put(
          "statuses", statuses.stream().map(IncidentStatus::value).collect(Collectors.toList()));
    }
    if (severity != null) {
      conditions.add("severity = :severity");
      params.put("severity", severity.value());
    }
    params.put("limit", limit);
    params.put("offset", offset);
    final String sql =
        "SELECT "
            + INCIDENT_COLUMNS
            + " FROM incident"
            + where(conditions.toArray(new String[0]))
            + " ORDER BY detected_at DESC LIMIT :limit OFFSET :offset";
    return guarded(
        "getIncidents",
        () -> jdbc.query(sql, params, (rs, rowNum) -> buildIncidentFromResultSet(rs)));
  }

  private Incident buildIncidentFromResultSet(final ResultSet rs) throws SQLException {
    return new IncidentBuilder()
        .id(rs.getString("id"))
        .incidentType(rs.getString("incident_type"))
        .severity(IncidentSeverity.fromValue(rs.getString("severity")))
        .title(rs.getString("title"))
        .description(rs.getString("description"))
        .status(IncidentStatus.fromValue(rs.getString("status")))
        .priority(IncidentPriority.fromValue(rs.getString("priority")))
        .affectedServices(LIST_SPLITTER.splitToList(rs.getString("affected_services")))
        .impactLevel(ImpactLevel.fromValue(rs.getString("impact_level")))
        .rootCause(Optional.ofNullable(rs.getString("root_cause")))
        .resolution(Optional.ofNullable(rs.getString("resolution")))
        .resolvedBy(Optional.ofNullable(rs.getString("resolved_by")))
        .resolvedAt(instant(rs.getTimestamp("resolved_at")))
        .detectedAt(rs.getTimestamp("detected_at").toInstant())
        .updatedAt(rs.getTimestamp("updated_at").toInstant())
        .organizationId(Optional.ofNullable(rs.getString("organization_id")))
        .build();
  }

  @Override
  public void healthCheck() {
    jdbc.getJdbcOperations().execute("SELECT 1");
  }

  @Override
  public int getTotalConnections() {
    return dataSource.getHikariPoolMXBean().getTotalConnections();
  }

  @Override
  public void migrate() {
    Flyway.configure().dataSource(dataSource).load().migrate();
  }

  @VisibleForTesting
  void truncateAll() {
    for (final String table :
        ImmutableList.of(
            "health_snapshot", "metric_point", "alert", "threshold_config", "sla_metric",
            "incident")) {
      jdbc.getJdbcOperations().execute("TRUNCATE " + table);
    }
  }

  private static <T> T guarded(final String operation, final Supplier<T> query) {
    try {
      return query.get();
    } catch (final DataAccessException e) {
      throw MonitoringException.storeUnavailable(operation, e);
    }
  }

  // A null organization id matches every organization.
  private static String orgCondition(
      final String organizationId, final Map<String, Object> params) {
    if (organizationId == null) {
      return null;
    }
    params.put("organization_id", organizationId);
    return "organization_id = :organization_id";
  }

  // Rows created without an organization are only visible to callers without one.
  private static String exactOrgCondition(
      final String organizationId, final Map<String, Object> params) {
    if (organizationId == null) {
      return "organization_id IS NULL";
    }
    params.put("organization_id", organizationId);
    return "organization_id = :organization_id";
  }

  private static String where(final String... conditions) {
    final List<String> present = new ArrayList<>();
    for (final String condition : conditions) {
      if (condition != null) {
        present.add(condition);
      }
    }
    return present.isEmpty() ? "" : " WHERE " + String.join(" AND ", present);
  }

  private static Timestamp timestamp(final Optional<Instant> instant) {
    return instant.map(Timestamp::from).orElse(null);
  }

  private static Optional<Instant> instant(final Timestamp timestamp) {
    return Optional.ofNullable(timestamp).map(Timestamp::toInstant);
  }
}
