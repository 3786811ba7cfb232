package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts the numeric kind of values. Converting a double to an int truncates.
 */
public class ConvertValuesRule extends TranslationRule {

  private final ImmutableMap<String, MetricValueType> typesMapping;

  @JsonCreator
  public ConvertValuesRule(@JsonProperty("types_mapping") Map<String, MetricValueType> typesMapping) {
    this.typesMapping = requiredMap(action(), "types_mapping", typesMapping);
  }

  @Override
  public RuleAction action() {
    return RuleAction.CONVERT_VALUES;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    for (DataPoint dp : dataPoints) {
      MetricValueType type = typesMapping.get(dp.getMetric());
      if (type == null) {
        processed.add(dp);
      } else if (type == MetricValueType.INT) {
        processed.add(dp.withValue(dp.getValue().toInt()));
      } else {
        processed.add(dp.withValue(dp.getValue().toDouble()));
      }
    }
    return processed;
  }
}
