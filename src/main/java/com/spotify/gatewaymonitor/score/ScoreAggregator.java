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

package com.spotify.gatewaymonitor.score;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.spotify.gatewaymonitor.cache.Cache;
import com.spotify.gatewaymonitor.cache.CacheStats;
import com.spotify.gatewaymonitor.db.HealthSnapshot;
import com.spotify.gatewaymonitor.db.HealthStatus;
import com.spotify.gatewaymonitor.db.MetricPoint;
import com.spotify.gatewaymonitor.db.MetricStore;
import com.spotify.gatewaymonitor.db.SlaMetric;
import com.spotify.gatewaymonitor.db.SlaMetricBuilder;
import com.spotify.gatewaymonitor.db.SlaPeriod;
import com.spotify.gatewaymonitor.db.SlaStatus;
import com.spotify.gatewaymonitor.db.ThresholdConfig;
import com.spotify.gatewaymonitor.threshold.ThresholdConfigService;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Derives scores, reports and SLA compliance from stored metric history. */
public class ScoreAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScoreAggregator.class);

  static final Duration SCORE_WINDOW = Duration.ofHours(1);
  static final Duration SUMMARY_WINDOW = Duration.ofHours(24);
  static final Duration QUERY_WINDOW = Duration.ofHours(24);
  static final Duration RESPONSE_TIME_WINDOW = Duration.ofMinutes(30);

  static final double NO_DATA_SCORE = 75.0;
  static final double SLOW_QUERY_MS = 1000.0;
  static final int MAX_SLOW_QUERIES = 10;
  static final long FREQUENT_ENDPOINT_COUNT = 1000;
  static final double SLOW_AVERAGE_MS = 500.0;
  static final int SLA_LIST_LIMIT = 10;

  public static final String UPTIME_SLA = "api_uptime";
  public static final String RESPONSE_TIME_SLA = "api_response_time";

  private final MetricStore store;
  private final Cache cache;
  private final ThresholdConfigService thresholds;
  private final Duration cacheTtl;
  private final Supplier<Instant> timeSupplier;

  public ScoreAggregator(
      final MetricStore store,
      final Cache cache,
      final ThresholdConfigService thresholds,
      final Duration cacheTtl,
      final Supplier<Instant> timeSupplier) {
    this.store = checkNotNull(store);
    this.cache = checkNotNull(cache);
    this.thresholds = checkNotNull(thresholds);
    this.cacheTtl = checkNotNull(cacheTtl);
    this.timeSupplier = checkNotNull(timeSupplier);
  }

  /** Scores the mean API response time of the last hour on a 25-95 scale. */
  public double optimizationScore() {
    final List<MetricPoint> points =
        store.getMetrics(
            MetricPoint.API_RESPONSE_TIME, null, timeSupplier.get().minus(SCORE_WINDOW));
    if (points.isEmpty()) {
      return NO_DATA_SCORE;
    }
    final double average = points.stream().mapToDouble(MetricPoint::value).average().orElse(0);
    if (average < 100) {
      return 95.0;
    } else if (average < 200) {
      return 85.0;
    } else if (average < 500) {
      return 70.0;
    } else if (average < 1000) {
      return 50.0;
    }
    return 25.0;
  }

  public PerformanceSummary performanceSummary(final Duration window) {
    final String cacheKey = "performance_summary:" + window.toHours() + "h";
    final Optional<PerformanceSummary> cached = cache.get(cacheKey, PerformanceSummary.class);
    if (cached.isPresent()) {
      return cached.get();
    }

    final Instant now = timeSupplier.get();
    final DoubleSummaryStatistics responseTimes =
        store
            .getMetrics(MetricPoint.API_RESPONSE_TIME, null, now.minus(window))
            .stream()
            .mapToDouble(MetricPoint::value)
            .summaryStatistics();
    final double errorRate =
        store
            .getMetrics(MetricPoint.API_ERRORS, null, now.minus(window))
            .stream()
            .mapToDouble(MetricPoint::value)
            .average()
            .orElse(0.0);
    final boolean empty = responseTimes.getCount() == 0;

    final PerformanceSummary summary =
        new PerformanceSummaryBuilder()
            .windowHours(window.toHours())
            .totalRequests(responseTimes.getCount())
            .avgResponseTime(empty ? 0.0 : responseTimes.getAverage())
            .minResponseTime(empty ? 0.0 : responseTimes.getMin())
            .maxResponseTime(empty ? 0.0 : responseTimes.getMax())
            .errorRate(errorRate)
            .cacheStats(cache.stats())
            .optimizationScore(optimizationScore())
            .generatedAt(now)
            .build();
    cache.set(cacheKey, summary, cacheTtl);
    return summary;
  }

  public PerformanceSummary performanceSummary() {
    return performanceSummary(SUMMARY_WINDOW);
  }

  public QueryOptimizationReport queryOptimizationReport() {
    final List<MetricPoint> queries =
        store.getMetrics(
            MetricPoint.QUERY_DURATION, null, timeSupplier.get().minus(QUERY_WINDOW));

    final List<SlowQuery> slowQueries =
        queries
            .stream()
            .filter(p -> p.value() > SLOW_QUERY_MS)
            .sorted(Comparator.comparingDouble(MetricPoint::value).reversed())
            .limit(MAX_SLOW_QUERIES)
            .map(
                p ->
                    new SlowQueryBuilder()
                        .endpoint(p.endpoint())
                        .duration(p.value())
                        .recordedAt(p.recordedAt())
                        .organizationId(p.organizationId())
                        .build())
            .collect(Collectors.toList());

    final List<QueryPattern> patterns = queryPatterns(queries);
    final double average =
        queries.stream().mapToDouble(MetricPoint::value).average().orElse(0.0);

    final List<OptimizationRecommendation> recommendations = new ArrayList<>();
    if (!slowQueries.isEmpty()) {
      recommendations.add(
          new OptimizationRecommendationBuilder()
              .type("slow_queries")
              .priority("high")
              .title("Optimize Slow Queries")
              .description(
                  String.format("Found %d queries taking more than 1 second", slowQueries.size()))
              .action("Add database indexes and optimize query patterns")
              .impact("High - Will improve response times significantly")
              .build());
    }
    if (!patterns.isEmpty() && patterns.get(0).count() > FREQUENT_ENDPOINT_COUNT) {
      final QueryPattern mostFrequent = patterns.get(0);
      recommendations.add(
          new OptimizationRecommendationBuilder()
              .type("caching")
              .priority("medium")
              .title("Implement Caching")
              .description(
                  String.format(
                      "Endpoint %s has %d requests",
                      mostFrequent.endpoint().orElse("unknown"), mostFrequent.count()))
              .action("Add Redis caching for frequently accessed data")
              .impact("Medium - Will reduce database load")
              .build());
    }
    if (average > SLOW_AVERAGE_MS) {
      recommendations.add(
          new OptimizationRecommendationBuilder()
              .type("general_optimization")
              .priority("medium")
              .title("General Performance Optimization")
              .description(String.format(Locale.ROOT, "Average response time is %.0fms", average))
              .action("Review and optimize database queries and indexes")
              .impact("Medium - Will improve overall performance")
              .build());
    }

    return new QueryOptimizationReportBuilder()
        .slowQueries(slowQueries)
        .queryPatterns(patterns)
        .totalQueries(queries.size())
        .avgQueryTime(average)
        .recommendations(recommendations)
        .optimizationScore(optimizationScore())
        .build();
  }

  private static List<QueryPattern> queryPatterns(final List<MetricPoint> queries) {
    // Optional keys, HashMap-based groupingBy rejects null endpoints
    final Map<Optional<String>, DoubleSummaryStatistics> byEndpoint = new LinkedHashMap<>();
    for (final MetricPoint query : queries) {
      byEndpoint
          .computeIfAbsent(query.endpoint(), k -> new DoubleSummaryStatistics())
          .accept(query.value());
    }
    return byEndpoint
        .entrySet()
        .stream()
        .map(
            e ->
                new QueryPatternBuilder()
                    .endpoint(e.getKey())
                    .count(e.getValue().getCount())
                    .avgDuration(e.getValue().getAverage())
                    .maxDuration(e.getValue().getMax())
                    .build())
        .sorted(Comparator.comparingLong(QueryPattern::count).reversed())
        .collect(Collectors.toList());
  }

  public ResponseTimeReport responseTimeReport() {
    final List<MetricPoint> points =
        store.getMetrics(
            MetricPoint.API_RESPONSE_TIME, null, timeSupplier.get().minus(RESPONSE_TIME_WINDOW));
    if (points.isEmpty()) {
      return new ResponseTimeReportBuilder()
          .currentAvg(0.0)
          .metricsCount(0)
          .needsOptimization(false)
          .recommendations(ImmutableList.of("No recent metrics available"))
          .build();
    }
    final double average = points.stream().mapToDouble(MetricPoint::value).average().orElse(0.0);
    final List<String> advice = new ArrayList<>();
    if (average > 500) {
      advice.add("Enable query result caching");
    }
    if (average > 1000) {
      advice.add("Add database indexes");
    }
    if (average > 2000) {
      advice.add("Implement connection pooling");
    }
    return new ResponseTimeReportBuilder()
        .currentAvg(average)
        .metricsCount(points.size())
        .needsOptimization(!advice.isEmpty())
        .recommendations(advice)
        .build();
  }

  /**
   * Computes uptime and response-time compliance over the organization's snapshots in the period
   * and stores one row per SLA. Returns nothing and stores nothing when there are no snapshots.
   */
  public List<SlaMetric> evaluateSla(final String organizationId, final SlaPeriod period) {
    final Instant now = timeSupplier.get();
    final Instant periodStart = now.minus(period.length());
    final List<HealthSnapshot> snapshots = store.getSnapshots(organizationId, periodStart);
    if (snapshots.isEmpty()) {
      LOGGER.info("No snapshots for {} SLA evaluation", period.value());
      return ImmutableList.of();
    }
    final ThresholdConfig config = thresholds.get(organizationId);

    final long up =
        snapshots
            .stream()
            .filter(s -> s.status() != HealthStatus.CRITICAL && s.status() != HealthStatus.ERROR)
            .count();
    final double uptime = up * 100.0 / snapshots.size();
    final double uptimeCompliance = Math.min(100.0, uptime / config.uptimeTarget() * 100.0);

    final double responseTime =
        snapshots.stream().mapToDouble(HealthSnapshot::responseTime).average().orElse(0.0);
    final double responseCompliance =
        responseTime <= 0
            ? 100.0
            : Math.min(100.0, config.responseTimeTarget() / responseTime * 100.0);

    final List<SlaMetric> rows =
        ImmutableList.of(
            slaRow(
                UPTIME_SLA,
                config.uptimeTarget(),
                uptime,
                uptimeCompliance,
                period,
                periodStart,
                now,
                organizationId),
            slaRow(
                RESPONSE_TIME_SLA,
                config.responseTimeTarget(),
                responseTime,
                responseCompliance,
                period,
                periodStart,
                now,
                organizationId));
    rows.forEach(store::insertSlaMetric);
    return rows;
  }

  private static SlaMetric slaRow(
      final String name,
      final double target,
      final double current,
      final double compliance,
      final SlaPeriod period,
      final Instant periodStart,
      final Instant periodEnd,
      final String organizationId) {
    return new SlaMetricBuilder()
        .id(UUID.randomUUID().toString())
        .slaName(name)
        .slaTarget(target)
        .slaPeriod(period)
        .currentValue(current)
        .compliancePercentage(compliance)
        .status(slaStatus(compliance))
        .periodStart(periodStart)
        .periodEnd(periodEnd)
        .recordedAt(periodEnd)
        .organizationId(Optional.ofNullable(organizationId))
        .build();
  }

  static SlaStatus slaStatus(final double compliance) {
    if (compliance >= 100.0) {
      return SlaStatus.COMPLIANT;
    } else if (compliance >= 95.0) {
      return SlaStatus.AT_RISK;
    }
    return SlaStatus.NON_COMPLIANT;
  }

  public List<SlaMetric> listSlaMetrics(final String organizationId) {
    return store.getSlaMetrics(organizationId, SLA_LIST_LIMIT);
  }

  public CacheStats cacheStatistics() {
    return cache.stats();
  }

  public long clearCache() {
    final long removed = cache.clear();
    LOGGER.info("Cleared {} cache entries", removed);
    return removed;
  }
}
