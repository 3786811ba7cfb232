package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives one metric per value of a dimension, e.g. {@code system.memory.usage{state=used}}
 * becomes {@code memory.used}. The derived points drop the split dimension; the source points are
 * kept.
 */
public class SplitMetricRule extends TranslationRule {

  private final String metricName;
  private final String dimensionKey;
  private final ImmutableMap<String, String> mapping;

  @JsonCreator
  public SplitMetricRule(@JsonProperty("metric_name") String metricName,
                         @JsonProperty("dimension_key") String dimensionKey,
                         @JsonProperty("mapping") Map<String, String> mapping) {
    this.metricName = requiredString(action(), "metric_name", metricName);
    this.dimensionKey = requiredString(action(), "dimension_key", dimensionKey);
    this.mapping = requiredMap(action(), "mapping", mapping);
  }

  @Override
  public RuleAction action() {
    return RuleAction.SPLIT_METRIC;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints);
    for (DataPoint dp : dataPoints) {
      if (!dp.getMetric().equals(metricName)) {
        continue;
      }
      Optional<String> value = dp.dimensionValue(dimensionKey);
      if (!value.isPresent() || !mapping.containsKey(value.get())) {
        continue;
      }
      processed.add(dp.toBuilder()
          .setMetric(mapping.get(value.get()))
          .removeDimensionsIf(d -> d.getKey().equals(dimensionKey))
          .build());
    }
    return processed;
  }
}
