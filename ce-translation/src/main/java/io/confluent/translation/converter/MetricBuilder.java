package io.confluent.translation.converter;

import com.google.common.base.Preconditions;
import io.confluent.translation.model.Dimension;
import io.opencensus.proto.metrics.v1.LabelKey;
import io.opencensus.proto.metrics.v1.LabelValue;
import io.opencensus.proto.metrics.v1.Metric;
import io.opencensus.proto.metrics.v1.MetricDescriptor;
import io.opencensus.proto.metrics.v1.Point;
import io.opencensus.proto.metrics.v1.TimeSeries;
import io.opencensus.proto.resource.v1.Resource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link Metric} from single point timeseries whose label sets may differ.
 *
 * <p>The descriptor's label keys are the union of the timeseries labels, in the order they are
 * first seen. Every timeseries carries a value for each key, without a value where the timeseries
 * did not have the label.
 */
class MetricBuilder {

  private Resource resource;
  private final MetricDescriptor.Builder descriptorBuilder = MetricDescriptor.newBuilder();
  private final Set<String> labelKeys = new LinkedHashSet<>();
  private final List<Map<String, String>> timeseriesLabels = new ArrayList<>();
  private final List<Point> points = new ArrayList<>();

  MetricBuilder withResource(Resource resource) {
    this.resource = resource;
    return this;
  }

  MetricBuilder withName(String name) {
    descriptorBuilder.setName(name);
    return this;
  }

  MetricBuilder withType(MetricDescriptor.Type type) {
    descriptorBuilder.setType(type);
    return this;
  }

  MetricBuilder addTimeseries(List<Dimension> dimensions, Point point) {
    Map<String, String> labels = new HashMap<>();
    for (Dimension dimension : dimensions) {
      labelKeys.add(dimension.getKey());
      labels.put(dimension.getKey(), dimension.getValue());
    }
    timeseriesLabels.add(labels);
    points.add(point);
    return this;
  }

  Metric build() {
    Preconditions.checkState(resource != null, "Metric Resource must be set");
    for (String key : labelKeys) {
      descriptorBuilder.addLabelKeys(LabelKey.newBuilder().setKey(key).build());
    }

    Metric.Builder metric = Metric.newBuilder()
        .setMetricDescriptor(descriptorBuilder.build())
        .setResource(resource);
    for (int i = 0; i < points.size(); i++) {
      Map<String, String> labels = timeseriesLabels.get(i);
      TimeSeries.Builder timeSeries = TimeSeries.newBuilder();
      for (String key : labelKeys) {
        String value = labels.get(key);
        timeSeries.addLabelValues(value == null
            ? LabelValue.newBuilder().setHasValue(false).build()
            : LabelValue.newBuilder().setValue(value).setHasValue(true).build());
      }
      metric.addTimeseries(timeSeries.addPoints(points.get(i)).build());
    }
    return metric.build();
  }
}
