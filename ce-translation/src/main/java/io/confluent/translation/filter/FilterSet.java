package io.confluent.translation.filter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.utils.JsonMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclude and include filters applied to translated data points.
 *
 * <p>A point is dropped when it matches at least one exclude filter and no include filter.
 * Include filters only rescue points that would otherwise be excluded.
 */
public class FilterSet {

  private static final Logger log = LoggerFactory.getLogger(FilterSet.class);

  private static final String DEFAULT_EXCLUDES_FILE = "default_metrics_exclude.json";

  public static final FilterSet EMPTY = new FilterSet(ImmutableList.of(), ImmutableList.of());

  private final List<DataPointFilter> excludes;
  private final List<DataPointFilter> includes;

  public FilterSet(List<MetricFilter> excludes, List<MetricFilter> includes) {
    this.excludes = compile(excludes);
    this.includes = compile(includes);
  }

  private static List<DataPointFilter> compile(List<MetricFilter> filters) {
    ImmutableList.Builder<DataPointFilter> compiled = ImmutableList.builder();
    for (MetricFilter filter : filters) {
      compiled.add(new DataPointFilter(filter));
    }
    return compiled.build();
  }

  public boolean shouldExclude(DataPoint dataPoint) {
    return anyMatch(excludes, dataPoint) && !anyMatch(includes, dataPoint);
  }

  /**
   * The points that are not excluded, in their original order.
   */
  public List<DataPoint> filter(List<DataPoint> dataPoints) {
    if (excludes.isEmpty()) {
      return dataPoints;
    }
    List<DataPoint> kept = new ArrayList<>(dataPoints.size());
    for (DataPoint dataPoint : dataPoints) {
      if (shouldExclude(dataPoint)) {
        log.trace("Excluding data point {}", dataPoint);
      } else {
        kept.add(dataPoint);
      }
    }
    return kept;
  }

  private static boolean anyMatch(List<DataPointFilter> filters, DataPoint dataPoint) {
    for (DataPointFilter filter : filters) {
      if (filter.matches(dataPoint)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Combine the default excludes with the user's.
   *
   * @param userExcludes {@code null} keeps the defaults, an empty list disables every exclude and
   *     a non-empty list is appended to the defaults.
   */
  public static List<MetricFilter> resolveExcludes(List<MetricFilter> defaults, List<MetricFilter> userExcludes) {
    if (userExcludes == null) {
      return defaults;
    }
    if (userExcludes.isEmpty()) {
      log.info("Default metric excludes disabled by an empty exclude list");
      return ImmutableList.of();
    }
    return ImmutableList.<MetricFilter>builder()
        .addAll(defaults)
        .addAll(userExcludes)
        .build();
  }

  public static List<MetricFilter> loadDefaultExcludes() {
    return load(FilterSet.class.getClassLoader(), DEFAULT_EXCLUDES_FILE);
  }

  public static List<MetricFilter> load(ClassLoader classLoader, String resourceName) {
    InputStream stream = classLoader.getResourceAsStream(resourceName);
    if (stream == null) {
      throw new KafkaException("Metric filter resource " + resourceName + " not found");
    }
    try {
      try (BufferedReader reader =
          new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
        List<MetricFilter> filters = JsonMapper.objectMapper()
            .readValue(reader, new TypeReference<List<MetricFilter>>() { });
        return ImmutableList.copyOf(filters);
      }
    } catch (IOException e) {
      throw new KafkaException("Metric filters could not be loaded from " + resourceName, e);
    }
  }
}
