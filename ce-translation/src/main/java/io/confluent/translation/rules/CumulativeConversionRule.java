package io.confluent.translation.rules;

import com.google.common.collect.ImmutableMap;
import io.confluent.translation.DimensionSignature;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.MetricType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base class of the rules that turn cumulative counters into values derived from the previous
 * observation of the same series.
 *
 * <p>The derived points are appended under the mapped name. When a metric is mapped to itself the
 * cumulative points are replaced by the derived ones. Points that are not cumulative counters are
 * left alone.
 */
abstract class CumulativeConversionRule extends TranslationRule {

  private final ImmutableMap<String, String> mapping;

  CumulativeConversionRule(Map<String, String> mapping) {
    this.mapping = requiredMap(action(), "mapping", mapping);
  }

  /**
   * Record {@code source} in the cache and derive the new value, if there is one yet.
   */
  abstract Optional<DataPoint> convert(DataPoint source, DimensionSignature signature, DeltaStateCache deltaCache);

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    List<DataPoint> derived = new ArrayList<>();
    for (DataPoint dp : dataPoints) {
      String newName = mapping.get(dp.getMetric());
      if (newName == null || dp.getMetricType() != MetricType.CUMULATIVE_COUNTER) {
        processed.add(dp);
        continue;
      }
      if (!newName.equals(dp.getMetric())) {
        processed.add(dp);
      }
      convert(dp, DimensionSignature.of(dp), deltaCache)
          .ifPresent(point -> derived.add(point.withMetric(newName)));
    }
    processed.addAll(derived);
    return processed;
  }
}
