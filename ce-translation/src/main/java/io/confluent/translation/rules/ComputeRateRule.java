package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.confluent.translation.DimensionSignature;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.Datum;
import io.confluent.translation.model.MetricType;
import java.util.Map;
import java.util.Optional;

/**
 * Converts cumulative counters to per-second rate gauges,
 * {@code (current - previous) / elapsed_seconds}.
 *
 * <p>Nothing is emitted for the first observation of a series, or when its timestamp is not after
 * the previous one. The cache is updated in both cases.
 */
public class ComputeRateRule extends CumulativeConversionRule {

  @JsonCreator
  public ComputeRateRule(@JsonProperty("mapping") Map<String, String> mapping) {
    super(mapping);
  }

  @Override
  public RuleAction action() {
    return RuleAction.COMPUTE_RATE;
  }

  @Override
  Optional<DataPoint> convert(DataPoint source, DimensionSignature signature, DeltaStateCache deltaCache) {
    return deltaCache.lookupAndUpdate(signature, source.getValue().doubleValue(), source.getTimestamp())
        .map(rate -> source.toBuilder()
            .setValue(Datum.ofDouble(rate))
            .setMetricType(MetricType.GAUGE)
            .build());
  }
}
