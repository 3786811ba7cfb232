package io.confluent.translation.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.kafka.common.config.ConfigException;

/**
 * The resolved form of one exclude or include entry: metric name patterns plus dimension
 * constraints, see {@link StringFilter} for the pattern syntax.
 *
 * <p>A data point matches when its metric name matches one of the name patterns (any name, if none
 * are given) and, for every constrained dimension, the point has the dimension and its value
 * matches one of the value patterns.
 */
public class MetricFilter {

  private final List<String> metricNames;
  private final Map<String, List<String>> dimensions;

  @JsonCreator
  public MetricFilter(@JsonProperty("metric_name") String metricName,
                      @JsonProperty("metric_names") List<String> metricNames,
                      @JsonProperty("dimensions") Map<String, Object> dimensions) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    if (metricName != null) {
      names.add(metricName);
    }
    if (metricNames != null) {
      names.addAll(metricNames);
    }
    this.metricNames = names.build();
    this.dimensions = toDimensionPatterns(dimensions);

    if (this.metricNames.isEmpty() && this.dimensions.isEmpty()) {
      throw new ConfigException("A metric filter needs at least one metric name or dimension");
    }
  }

  public static MetricFilter forMetricNames(String... metricNames) {
    return new MetricFilter(null, ImmutableList.copyOf(metricNames), null);
  }

  public static MetricFilter forDimensions(List<String> metricNames, Map<String, ?> dimensions) {
    return new MetricFilter(null, metricNames, new LinkedHashMap<String, Object>(dimensions));
  }

  public List<String> getMetricNames() {
    return metricNames;
  }

  public Map<String, List<String>> getDimensions() {
    return dimensions;
  }

  private static Map<String, List<String>> toDimensionPatterns(Map<String, Object> dimensions) {
    if (dimensions == null) {
      return Collections.emptyMap();
    }
    ImmutableMap.Builder<String, List<String>> builder = ImmutableMap.builder();
    for (Map.Entry<String, Object> entry : dimensions.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof String) {
        builder.put(entry.getKey(), ImmutableList.of((String) value));
      } else if (value instanceof Collection && !((Collection<?>) value).isEmpty()) {
        ImmutableList.Builder<String> values = ImmutableList.builder();
        for (Object item : (Collection<?>) value) {
          if (!(item instanceof String)) {
            throw new ConfigException("dimensions." + entry.getKey(), item, "dimension patterns must be strings");
          }
          values.add((String) item);
        }
        builder.put(entry.getKey(), values.build());
      } else {
        throw new ConfigException("dimensions." + entry.getKey(), value,
            "dimension patterns must be a string or a non-empty list of strings");
      }
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricFilter that = (MetricFilter) o;
    return metricNames.equals(that.metricNames) &&
        dimensions.equals(that.dimensions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(metricNames, dimensions);
  }

  @Override
  public String toString() {
    return "MetricFilter{" +
        "metricNames=" + metricNames +
        ", dimensions=" + dimensions +
        '}';
  }
}
