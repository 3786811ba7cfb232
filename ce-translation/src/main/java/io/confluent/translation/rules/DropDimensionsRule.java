package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Removes dimensions without aggregating, optionally only from some metrics.
 */
public class DropDimensionsRule extends TranslationRule {

  private final ImmutableList<String> dimensionKeys;
  private final ImmutableSet<String> metricNames;

  @JsonCreator
  public DropDimensionsRule(@JsonProperty("dimension_keys") List<String> dimensionKeys,
                            @JsonProperty("metric_names") Set<String> metricNames) {
    this.dimensionKeys = requiredList(action(), "dimension_keys", dimensionKeys);
    this.metricNames = optionalSet(action(), "metric_names", metricNames);
  }

  @Override
  public RuleAction action() {
    return RuleAction.DROP_DIMENSIONS;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    for (DataPoint dp : dataPoints) {
      if (metricNames.isEmpty() || metricNames.contains(dp.getMetric())) {
        processed.add(dp.withoutDimensions(dimensionKeys));
      } else {
        processed.add(dp);
      }
    }
    return processed;
  }
}
