package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.Dimension;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renames dimension keys using an old to new mapping, optionally restricted to some metrics.
 *
 * <p>When two keys of one point end up with the same name, the value of the later dimension wins
 * and the renamed dimension keeps the position of the first one.
 */
public class RenameDimensionKeysRule extends TranslationRule {

  private final ImmutableMap<String, String> mapping;
  private final ImmutableSet<String> metricNames;

  @JsonCreator
  public RenameDimensionKeysRule(@JsonProperty("mapping") Map<String, String> mapping,
                                 @JsonProperty("metric_names") Set<String> metricNames) {
    this.mapping = requiredMap(action(), "mapping", mapping);
    this.metricNames = optionalSet(action(), "metric_names", metricNames);
  }

  public RenameDimensionKeysRule(Map<String, String> mapping) {
    this(mapping, null);
  }

  @Override
  public RuleAction action() {
    return RuleAction.RENAME_DIMENSION_KEYS;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints.size());
    for (DataPoint dp : dataPoints) {
      if (!metricNames.isEmpty() && !metricNames.contains(dp.getMetric())) {
        processed.add(dp);
        continue;
      }
      DataPoint.Builder builder = dp.toBuilder().clearDimensions();
      for (Dimension dimension : dp.getDimensions()) {
        builder.addDimension(mapping.getOrDefault(dimension.getKey(), dimension.getKey()), dimension.getValue());
      }
      processed.add(builder.build());
    }
    return processed;
  }
}
