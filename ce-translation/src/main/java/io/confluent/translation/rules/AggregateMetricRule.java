package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSet;
import io.confluent.translation.DimensionSignature;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.Datum;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rolls the points of one metric up across dimensions.
 *
 * <p>The dimensions to remove are given either as {@code without_dimensions}, or as the complement
 * of {@code dimensions}. Points that become identical after the reduction are combined into one
 * point, carrying the reduced dimensions, timestamp and type of the first point of its group.
 * Aggregated points are appended after the non-matching points, in the order their groups were
 * first seen.
 *
 * <p>A sum of int values is an int, any double input makes the sum a double. An int sum that
 * would overflow a long is computed as a double instead.
 */
public class AggregateMetricRule extends TranslationRule {

  private static final Logger log = LoggerFactory.getLogger(AggregateMetricRule.class);

  private final String metricName;
  private final AggregationMethod aggregationMethod;
  private final ImmutableSet<String> withoutDimensions;
  private final ImmutableSet<String> dimensions;

  @JsonCreator
  public AggregateMetricRule(@JsonProperty("metric_name") String metricName,
                             @JsonProperty("aggregation_method") AggregationMethod aggregationMethod,
                             @JsonProperty("without_dimensions") Set<String> withoutDimensions,
                             @JsonProperty("dimensions") Set<String> dimensions) {
    this.metricName = requiredString(action(), "metric_name", metricName);
    if (aggregationMethod == null) {
      throw invalid(action(), "\"aggregation_method\" must be provided");
    }
    this.aggregationMethod = aggregationMethod;
    this.withoutDimensions = optionalSet(action(), "without_dimensions", withoutDimensions);
    this.dimensions = optionalSet(action(), "dimensions", dimensions);
    if (this.withoutDimensions.isEmpty() == this.dimensions.isEmpty()) {
      throw invalid(action(), "exactly one of \"without_dimensions\" or \"dimensions\" must be provided");
    }
  }

  public static AggregateMetricRule without(String metricName, AggregationMethod method, Set<String> withoutDimensions) {
    return new AggregateMetricRule(metricName, method, withoutDimensions, null);
  }

  @Override
  public RuleAction action() {
    return RuleAction.AGGREGATE_METRIC;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    Map<DimensionSignature, List<DataPoint>> groups = new LinkedHashMap<>();
    for (DataPoint dp : dataPoints) {
      if (!dp.getMetric().equals(metricName)) {
        processed.add(dp);
        continue;
      }
      DataPoint reduced = reduce(dp);
      if (reduced == null) {
        log.debug("Dropping {} from aggregation, it lacks one of the dimensions {}", dp, dimensions);
        continue;
      }
      groups.computeIfAbsent(DimensionSignature.dimensionsOnly(reduced), k -> new ArrayList<>()).add(reduced);
    }

    for (List<DataPoint> group : groups.values()) {
      processed.add(group.get(0).withValue(aggregate(group)));
    }
    return processed;
  }

  private DataPoint reduce(DataPoint dp) {
    if (!withoutDimensions.isEmpty()) {
      return dp.withoutDimensions(withoutDimensions);
    }
    for (String key : dimensions) {
      if (!dp.dimensionValue(key).isPresent()) {
        return null;
      }
    }
    return dp.toBuilder().retainDimensions(dimensions).build();
  }

  private Datum aggregate(List<DataPoint> group) {
    switch (aggregationMethod) {
      case COUNT:
        return Datum.ofInt(group.size());
      case AVG:
        return Datum.ofDouble(sum(group).doubleValue() / group.size());
      case SUM:
      default:
        return sum(group);
    }
  }

  private Datum sum(List<DataPoint> group) {
    boolean allInts = true;
    for (DataPoint dp : group) {
      allInts &= dp.getValue().isInt();
    }
    if (allInts) {
      try {
        long total = 0;
        for (DataPoint dp : group) {
          total = Math.addExact(total, dp.getValue().intValue());
        }
        return Datum.ofInt(total);
      } catch (ArithmeticException e) {
        log.warn("Sum of {} int points of \"{}\" overflows a long, summing as doubles", group.size(), metricName);
      }
    }
    double total = 0;
    for (DataPoint dp : group) {
      total += dp.getValue().doubleValue();
    }
    return Datum.ofDouble(total);
  }
}
