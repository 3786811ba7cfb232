package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.confluent.translation.DimensionSignature;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.MetricType;
import java.util.Map;
import java.util.Optional;

/**
 * Converts cumulative counters to delta counters, {@code current - previous}. The first observation
 * of a series only seeds the cache.
 */
public class DeltaMetricRule extends CumulativeConversionRule {

  @JsonCreator
  public DeltaMetricRule(@JsonProperty("mapping") Map<String, String> mapping) {
    super(mapping);
  }

  @Override
  public RuleAction action() {
    return RuleAction.DELTA_METRIC;
  }

  @Override
  Optional<DataPoint> convert(DataPoint source, DimensionSignature signature, DeltaStateCache deltaCache) {
    return deltaCache.delta(signature, source.getValue(), source.getTimestamp())
        .map(delta -> source.toBuilder()
            .setValue(delta)
            .setMetricType(MetricType.COUNTER)
            .build());
  }
}
