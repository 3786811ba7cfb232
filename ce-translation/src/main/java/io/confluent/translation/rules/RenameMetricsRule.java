package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class RenameMetricsRule extends TranslationRule {

  private final ImmutableMap<String, String> mapping;

  @JsonCreator
  public RenameMetricsRule(@JsonProperty("mapping") Map<String, String> mapping) {
    this.mapping = requiredMap(action(), "mapping", mapping);
  }

  @Override
  public RuleAction action() {
    return RuleAction.RENAME_METRICS;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    for (DataPoint dp : dataPoints) {
      String newName = mapping.get(dp.getMetric());
      processed.add(newName == null ? dp : dp.withMetric(newName));
    }
    return processed;
  }
}
