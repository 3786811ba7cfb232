package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Appends a copy of every matching point under a new metric name, keeping the originals.
 *
 * <p>With {@code dimension_key} and {@code dimension_values} only points whose value for that
 * dimension is one of the listed values are copied.
 */
public class CopyMetricsRule extends TranslationRule {

  private final ImmutableMap<String, String> mapping;
  private final String dimensionKey;
  private final ImmutableSet<String> dimensionValues;

  @JsonCreator
  public CopyMetricsRule(@JsonProperty("mapping") Map<String, String> mapping,
                         @JsonProperty("dimension_key") String dimensionKey,
                         @JsonProperty("dimension_values") Set<String> dimensionValues) {
    this.mapping = requiredMap(action(), "mapping", mapping);
    this.dimensionKey = dimensionKey;
    this.dimensionValues = optionalSet(action(), "dimension_values", dimensionValues);
    if ((dimensionKey == null) != this.dimensionValues.isEmpty()) {
      throw invalid(action(), "\"dimension_key\" and \"dimension_values\" must be provided together");
    }
  }

  public CopyMetricsRule(Map<String, String> mapping) {
    this(mapping, null, null);
  }

  @Override
  public RuleAction action() {
    return RuleAction.COPY_METRICS;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    List<DataPoint> processed = new ArrayList<>(dataPoints);
    for (DataPoint dp : dataPoints) {
      String newName = mapping.get(dp.getMetric());
      if (newName != null && matchesDimensionFilter(dp)) {
        processed.add(dp.withMetric(newName));
      }
    }
    return processed;
  }

  private boolean matchesDimensionFilter(DataPoint dp) {
    if (dimensionKey == null) {
      return true;
    }
    Optional<String> value = dp.dimensionValue(dimensionKey);
    return value.isPresent() && dimensionValues.contains(value.get());
  }
}
