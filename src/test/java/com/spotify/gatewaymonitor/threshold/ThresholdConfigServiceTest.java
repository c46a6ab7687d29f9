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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.gatewaymonitor.TimeSupplier;
import com.spotify.gatewaymonitor.db.InMemoryMetricStore;
import com.spotify.gatewaymonitor.db.ThresholdConfig;
import com.spotify.gatewaymonitor.util.ErrorCode;
import com.spotify.gatewaymonitor.util.MonitoringException;
import java.time.Instant;
import java.util.Optional;
import org.junit.Test;

public class ThresholdConfigServiceTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private final InMemoryMetricStore store = new InMemoryMetricStore();
  private final ThresholdConfigService service =
      new ThresholdConfigService(store, new TimeSupplier(NOW));

  @Test
  public void builtInDefaultWhenNothingStored() {
    assertEquals(ThresholdConfigService.BUILT_IN_DEFAULT, service.get("org-1"));
    assertEquals(ThresholdConfigService.BUILT_IN_DEFAULT, service.get(null));
  }

  @Test
  public void storedDefaultAppliesToOrganizationsWithoutTheirOwn() {
    service.update(null, ImmutableMap.of("cpu_warning_threshold", 70));

    final ThresholdConfig config = service.get("org-1");
    assertThat(config.configKey(), equalTo(ThresholdConfig.DEFAULT_KEY));
    assertThat(config.cpuWarning(), equalTo(70.0));
  }

  @Test
  public void updateMergesOntoEffectiveConfig() {
    service.update(null, ImmutableMap.of("cpu_warning_threshold", 70));
    final ThresholdConfig updated =
        service.update(
            "org-1",
            ImmutableMap.of(
                "memory_critical_threshold", 90.5,
                "slack_notifications", true,
                "notification_recipients", ImmutableList.of("ops@example.com")));

    assertThat(updated.configKey(), equalTo("org-1"));
    assertThat(updated.cpuWarning(), equalTo(70.0));
    assertThat(updated.memoryCritical(), equalTo(90.5));
    assertThat(updated.slackNotifications(), is(true));
    assertThat(updated.notificationRecipients(), contains("ops@example.com"));
    assertThat(updated.updatedAt(), equalTo(Optional.of(NOW)));
    assertEquals(updated, service.get("org-1"));
    // the shared default is untouched
    assertThat(service.get("org-2").memoryCritical(), equalTo(95.0));
  }

  @Test
  public void unknownKeysAreIgnored() {
    final ThresholdConfig updated =
        service.update("org-1", ImmutableMap.of("disk_warning_threshold", 50));
    assertThat(updated.cpuWarning(), equalTo(80.0));
  }

  @Test
  public void nonNumericThresholdIsInvalid() {
    try {
      service.update("org-1", ImmutableMap.of("cpu_critical_threshold", "high"));
      fail("expected an invalid field error");
    } catch (final MonitoringException e) {
      assertThat(e.errorCode(), equalTo(ErrorCode.INVALID_FIELD));
      assertThat(e.getMessage().startsWith("cpu_critical_threshold"), is(true));
    }
    assertEquals(ThresholdConfigService.BUILT_IN_DEFAULT, service.get("org-1"));
  }

  @Test
  public void nonBooleanFlagIsInvalid() {
    try {
      service.update("org-1", ImmutableMap.of("email_notifications", "yes"));
      fail("expected an invalid field error");
    } catch (final MonitoringException e) {
      assertThat(e.errorCode(), equalTo(ErrorCode.INVALID_FIELD));
    }
  }
}
