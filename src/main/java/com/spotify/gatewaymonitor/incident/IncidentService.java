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

package com.spotify.gatewaymonitor.incident;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.spotify.gatewaymonitor.db.ImpactLevel;
import com.spotify.gatewaymonitor.db.Incident;
import com.spotify.gatewaymonitor.db.IncidentBuilder;
import com.spotify.gatewaymonitor.db.IncidentPriority;
import com.spotify.gatewaymonitor.db.IncidentSeverity;
import com.spotify.gatewaymonitor.db.IncidentStatus;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.util.MonitoringException;
import com.spotify.gatewaymonitor.util.Paging;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class IncidentService {

  private static final Logger LOGGER = LoggerFactory.getLogger(IncidentService.class);

  private static final List<IncidentStatus> OPEN_STATUSES =
      ImmutableList.of(IncidentStatus.OPEN, IncidentStatus.INVESTIGATING);

  private final MetricStore store;
  private final Supplier<Instant> timeSupplier;

  public IncidentService(final MetricStore store, final Supplier<Instant> timeSupplier) {
    this.store = checkNotNull(store);
    this.timeSupplier = checkNotNull(timeSupplier);
  }

  /**
   * Opens an incident from snake_case fields. All of incident_type, severity, title, description,
   * priority and impact_level are required; affected_services is optional.
   */
  public Incident create(final String organizationId, final Map<String, Object> fields) {
    final String incidentType = requiredString(fields, "incident_type");
    final IncidentSeverity severity =
        requiredEnum(fields, "severity", IncidentSeverity::fromValue);
    final String title = requiredString(fields, "title");
    final String description = requiredString(fields, "description");
    final IncidentPriority priority =
        requiredEnum(fields, "priority", IncidentPriority::fromValue);
    final ImpactLevel impactLevel = requiredEnum(fields, "impact_level", ImpactLevel::fromValue);
    final Instant now = timeSupplier.get();

    final Incident incident =
        new IncidentBuilder()
            .id(UUID.randomUUID().toString())
            .incidentType(incidentType)
            .severity(severity)
            .title(title)
            .description(description)
            .status(IncidentStatus.OPEN)
            .priority(priority)
            .affectedServices(affectedServices(fields.get("affected_services")))
            .impactLevel(impactLevel)
            .rootCause(Optional.empty())
            .resolution(Optional.empty())
            .resolvedBy(Optional.empty())
            .resolvedAt(Optional.empty())
            .detectedAt(now)
            .updatedAt(now)
            .organizationId(Optional.ofNullable(organizationId))
            .build();
    store.insertIncident(incident);
    LOGGER.info("Incident {} opened: {}", incident.id(), title);
    return incident;
  }

  public List<Incident> list(
      final String organizationId,
      final IncidentStatus status,
      final IncidentSeverity severity,
      final int limit,
      final int offset) {
    Paging.check(limit, offset);
    return store.getIncidents(
        organizationId, status == null ? null : ImmutableList.of(status), severity, limit, offset);
  }

  public List<Incident> openIncidents(final String organizationId, final int limit) {
    return store.getIncidents(organizationId, OPEN_STATUSES, null, limit, 0);
  }

  /**
   * Moves an incident forward through open, investigating, resolved and closed. Steps may be
   * skipped but never reversed. Reaching resolved records who resolved it and when.
   */
  public Incident transition(
      final String incidentId,
      final String organizationId,
      final IncidentStatus status,
      final String actorId,
      final String rootCause,
      final String resolution) {
    if (status == null) {
      throw MonitoringException.invalidField("status", "is required");
    }
    final Incident incident =
        store
            .getIncident(incidentId, organizationId)
            .orElseThrow(() -> MonitoringException.notFound("Incident", incidentId));
    if (status.isBefore(incident.status())) {
      throw MonitoringException.invalidField(
          "status",
          String.format(
              "cannot move from %s back to %s", incident.status().value(), status.value()));
    }
    final Instant now = timeSupplier.get();
    final IncidentBuilder builder = IncidentBuilder.from(incident).status(status).updatedAt(now);
    if (rootCause != null) {
      builder.rootCause(rootCause);
    }
    if (resolution != null) {
      builder.resolution(resolution);
    }
    if (incident.status().isBefore(IncidentStatus.RESOLVED)
        && !status.isBefore(IncidentStatus.RESOLVED)) {
      builder.resolvedBy(Optional.ofNullable(actorId)).resolvedAt(now);
    }
    final Incident updated = builder.build();
    store.updateIncident(updated);
    LOGGER.info(
        "Incident {} moved from {} to {}",
        incidentId,
        incident.status().value(),
        status.value());
    return updated;
  }

  private static String requiredString(final Map<String, Object> fields, final String name) {
    final Object value = fields.get(name);
    if (!(value instanceof String) || ((String) value).trim().isEmpty()) {
      throw MonitoringException.invalidField(name, "is required");
    }
    return (String) value;
  }

  private static <E extends Enum<E>> E requiredEnum(
      final Map<String, Object> fields, final String name, final Function<String, E> parser) {
    final String value = requiredString(fields, name);
    try {
      return parser.apply(value);
    } catch (final IllegalArgumentException e) {
      throw MonitoringException.invalidField(name, "unknown value " + value);
    }
  }

  private static List<String> affectedServices(final Object value) {
    if (value == null) {
      return ImmutableList.of();
    }
    if (!(value instanceof List)) {
      throw MonitoringException.invalidField("affected_services", "expected a list of strings");
    }
    final List<String> services = new ArrayList<>();
    for (final Object service : (List<?>) value) {
      if (!(service instanceof String)) {
        throw MonitoringException.invalidField("affected_services", "expected a list of strings");
      }
      services.add((String) service);
    }
    return services;
  }
}
