package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSet;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import java.util.ArrayList;
import java.util.List;

public class DropMetricsRule extends TranslationRule {

  private final ImmutableSet<String> metricNames;

  @JsonCreator
  public DropMetricsRule(@JsonProperty("metric_names") List<String> metricNames) {
    this.metricNames = ImmutableSet.copyOf(requiredList(action(), "metric_names", metricNames));
  }

  @Override
  public RuleAction action() {
    return RuleAction.DROP_METRICS;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    for (DataPoint dp : dataPoints) {
      if (!metricNames.contains(dp.getMetric())) {
        processed.add(dp);
      }
    }
    return processed;
  }
}
