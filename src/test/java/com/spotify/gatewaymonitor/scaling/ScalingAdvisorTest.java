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

package com.spotify.gatewaymonitor.scaling;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableMap;
import com.spotify.gatewaymonitor.TimeSupplier;
import com.spotify.gatewaymonitor.metric.MonitorMetrics;
import com.spotify.gatewaymonitor.util.ErrorCode;
import com.spotify.gatewaymonitor.util.MonitoringException;
import com.spotify.metrics.core.SemanticMetricRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.Test;

public class ScalingAdvisorTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private final ScalingAdvisor advisor =
      new ScalingAdvisor(
          5, new MonitorMetrics(new SemanticMetricRegistry()), new TimeSupplier(NOW));

  private static ScalingMetrics metrics(
      final double cpu, final double memory, final double responseTime) {
    return new ScalingMetricsBuilder()
        .cpuUsage(cpu)
        .memoryUsage(memory)
        .responseTime(responseTime)
        .activeConnections(10)
        .throughput(10)
        .recordedAt(NOW)
        .build();
  }

  @Test
  public void nothingToRecommendAtModerateLoad() {
    assertThat(advisor.analyze(metrics(50, 50, 300)), is(empty()));
  }

  @Test
  public void criticalAndHighRecommendations() {
    final List<ScalingRecommendation> recommendations =
        advisor.analyze(metrics(97, 85, 1200));

    assertThat(
        recommendations.stream()
            .map(ScalingRecommendation::reason)
            .collect(Collectors.toList()),
        contains("CPU usage critical", "Memory usage high", "Response time high"));
    final ScalingRecommendation cpu = recommendations.get(0);
    assertThat(cpu.type(), equalTo(ScalingRecommendation.SCALE_UP));
    assertThat(cpu.priority(), equalTo("critical"));
    assertThat(cpu.threshold(), equalTo(95.0));
    assertThat(cpu.estimatedInstances(), equalTo(3));
    assertThat(recommendations.get(1).estimatedInstances(), equalTo(2));
    assertThat(recommendations.get(1).action(), equalTo("Scale up - add one more instance"));
  }

  @Test
  public void estimatedInstancesNeverExceedMaximum() {
    advisor.simulateScalingEvent(ScalingRecommendation.SCALE_UP, 4);
    final ScalingRecommendation recommendation = advisor.analyze(metrics(99, 10, 100)).get(0);
    assertThat(recommendation.estimatedInstances(), equalTo(5));
  }

  @Test
  public void scaleDownOnlyWithSpareInstances() {
    assertThat(advisor.analyze(metrics(20, 25, 100)), is(empty()));

    advisor.simulateScalingEvent(ScalingRecommendation.SCALE_UP, 2);
    final List<ScalingRecommendation> recommendations = advisor.analyze(metrics(20, 25, 100));

    assertThat(recommendations, hasSize(1));
    final ScalingRecommendation down = recommendations.get(0);
    assertThat(down.type(), equalTo(ScalingRecommendation.SCALE_DOWN));
    assertThat(down.reason(), equalTo("Low resource usage (CPU: 20.0%, Memory: 25.0%)"));
    assertThat(down.currentValue(), equalTo(25.0));
    assertThat(down.threshold(), equalTo(30.0));
    assertThat(down.estimatedInstances(), equalTo(2));
  }

  @Test
  public void updatedThresholdsApplyToAnalysis() {
    final Map<String, Double> thresholds =
        advisor.setThresholds(ImmutableMap.of("cpu_high", 40, "unknown_key", 1));

    assertThat(thresholds.get("cpu_high"), equalTo(40.0));
    assertThat(thresholds.containsKey("unknown_key"), is(false));
    assertThat(advisor.analyze(metrics(50, 50, 300)), hasSize(1));
  }

  @Test
  public void nonNumericThresholdIsInvalid() {
    try {
      advisor.setThresholds(ImmutableMap.of("cpu_high", "lots"));
      fail("expected an invalid field error");
    } catch (final MonitoringException e) {
      assertThat(e.errorCode(), equalTo(ErrorCode.INVALID_FIELD));
    }
    assertThat(advisor.thresholds().get("cpu_high"), equalTo(80.0));
  }

  @Test
  public void invalidThresholdLeavesEarlierKeysUntouched() {
    try {
      advisor.setThresholds(ImmutableMap.of("cpu_high", 70, "memory_high", "lots"));
      fail("expected an invalid field error");
    } catch (final MonitoringException e) {
      assertThat(e.errorCode(), equalTo(ErrorCode.INVALID_FIELD));
    }
    assertThat(advisor.thresholds().get("cpu_high"), equalTo(80.0));
    assertThat(advisor.thresholds().get("memory_high"), equalTo(80.0));
  }

  @Test
  public void simulatedEventsAreClamped() {
    assertThat(
        advisor.simulateScalingEvent(ScalingRecommendation.SCALE_UP, 10).newTotal(),
        equalTo(5));
    assertThat(
        advisor.simulateScalingEvent(ScalingRecommendation.SCALE_DOWN, 10).newTotal(),
        equalTo(1));

    final ScalingEvent unknown = advisor.simulateScalingEvent("rebalance", 3);
    assertThat(unknown.eventType(), equalTo("rebalance"));
    assertThat(unknown.newTotal(), equalTo(1));
    assertThat(advisor.recentHistory(), hasSize(3));
  }

  @Test
  public void negativeInstancesAreInvalid() {
    try {
      advisor.simulateScalingEvent(ScalingRecommendation.SCALE_UP, -1);
      fail("expected an invalid field error");
    } catch (final MonitoringException e) {
      assertThat(e.errorCode(), equalTo(ErrorCode.INVALID_FIELD));
    }
    assertThat(advisor.recentHistory(), is(empty()));
  }

  @Test
  public void historyKeepsLastTenEvents() {
    for (int i = 0; i < 12; i++) {
      advisor.simulateScalingEvent("noop-" + i, 0);
    }
    final List<ScalingEvent> history = advisor.configuration().scalingHistory();
    assertThat(history, hasSize(10));
    assertThat(history.get(0).eventType(), equalTo("noop-2"));
  }

  @Test
  public void toggleAutoScaling() {
    assertThat(advisor.isAutoScalingEnabled(), is(true));
    assertThat(advisor.toggleAutoScaling(false), is(false));
    assertThat(advisor.configuration().autoScalingEnabled(), is(false));
  }

  @Test
  public void loadBalancerSplitsTrafficOverActiveInstances() {
    advisor.simulateScalingEvent(ScalingRecommendation.SCALE_UP, 1);

    final LoadBalancerStatus status = advisor.loadBalancerStatus();

    assertThat(status.activeInstances(), equalTo(2));
    assertThat(status.healthChecks().size(), equalTo(5));
    assertThat(status.healthChecks().get("instance_2"), equalTo("healthy"));
    assertThat(status.healthChecks().get("instance_3"), equalTo("not_active"));
    assertThat(status.trafficDistribution().get("instance_1"), equalTo(50.0));
    assertThat(status.trafficDistribution().get("instance_5"), equalTo(0.0));
  }

  @Test
  public void shardingStatusIsSingleShard() {
    final ShardingStatus status = advisor.shardingStatus();

    assertThat(status.shardingEnabled(), is(false));
    assertThat(status.shards(), hasSize(1));
    assertThat(status.shards().get(0).id(), equalTo("shard_1"));
    assertThat(status.shards().get(0).loadPercentage(), equalTo(100.0));
    assertThat(status.replicas(), equalTo(0));
    assertThat(status.lastBackup(), equalTo(NOW));
  }

  @Test
  public void microservicesFollowSimulatedInstances() {
    advisor.simulateScalingEvent(ScalingRecommendation.SCALE_UP, 2);

    final MicroservicesStatus status = advisor.microservicesStatus();

    assertThat(status.architecture(), equalTo("monolithic"));
    assertThat(
        status.services().stream().map(GatewayService::name).collect(Collectors.toList()),
        contains("api_gateway", "auth_service", "llm_service", "monitoring_service"));
    assertThat(status.services().get(0).instances(), equalTo(3));
    assertThat(status.services().get(1).instances(), equalTo(1));
  }
}
