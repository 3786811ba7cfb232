package io.confluent.translation.rules;

import com.google.common.collect.ImmutableMap;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.Datum;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the rules that scale int values by a per-metric integer factor.
 *
 * <p>Double points of a configured metric are a configuration error: they are reported and passed
 * through unchanged rather than coerced.
 */
abstract class IntScalingRule extends TranslationRule {

  private static final Logger log = LoggerFactory.getLogger(IntScalingRule.class);

  private final ImmutableMap<String, Long> scaleFactors;

  IntScalingRule(Map<String, Long> scaleFactors) {
    this.scaleFactors = requiredMap(action(), "scale_factors_int", scaleFactors);
  }

  ImmutableMap<String, Long> scaleFactors() {
    return scaleFactors;
  }

  abstract long scale(long value, long factor);

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    for (DataPoint dp : dataPoints) {
      Long factor = scaleFactors.get(dp.getMetric());
      if (factor == null) {
        processed.add(dp);
      } else if (!dp.getValue().isInt()) {
        log.warn("\"{}\" rule only applies to int values, leaving {} unchanged", action(), dp);
        processed.add(dp);
      } else {
        processed.add(dp.withValue(Datum.ofInt(scale(dp.getValue().intValue(), factor))));
      }
    }
    return processed;
  }
}
