package io.confluent.translation.filter;

import io.confluent.translation.model.DataPoint;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled form of a {@link MetricFilter}.
 */
class DataPointFilter {

  private final StringFilter metricNameFilter;
  private final Map<String, StringFilter> dimensionFilters = new LinkedHashMap<>();

  DataPointFilter(MetricFilter metricFilter) {
    List<String> metricNames = metricFilter.getMetricNames();
    this.metricNameFilter = metricNames.isEmpty() ? null : new StringFilter(metricNames);
    for (Map.Entry<String, List<String>> entry : metricFilter.getDimensions().entrySet()) {
      dimensionFilters.put(entry.getKey(), new StringFilter(entry.getValue()));
    }
  }

  boolean matches(DataPoint dataPoint) {
    if (metricNameFilter != null && !metricNameFilter.matches(dataPoint.getMetric())) {
      return false;
    }
    for (Map.Entry<String, StringFilter> entry : dimensionFilters.entrySet()) {
      Optional<String> value = dataPoint.dimensionValue(entry.getKey());
      if (!value.isPresent() || !entry.getValue().matches(value.get())) {
        return false;
      }
    }
    return true;
  }
}
