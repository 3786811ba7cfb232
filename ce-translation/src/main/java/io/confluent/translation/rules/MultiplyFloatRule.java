package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.Datum;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Multiplies values by a per-metric floating point factor. Int values are promoted to double.
 */
public class MultiplyFloatRule extends TranslationRule {

  private final ImmutableMap<String, Double> scaleFactors;

  @JsonCreator
  public MultiplyFloatRule(@JsonProperty("scale_factors_float") Map<String, Double> scaleFactors) {
    this.scaleFactors = requiredMap(action(), "scale_factors_float", scaleFactors);
  }

  @Override
  public RuleAction action() {
    return RuleAction.MULTIPLY_FLOAT;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    for (DataPoint dp : dataPoints) {
      Double factor = scaleFactors.get(dp.getMetric());
      processed.add(factor == null ? dp : dp.withValue(Datum.ofDouble(dp.getValue().doubleValue() * factor)));
    }
    return processed;
  }
}
