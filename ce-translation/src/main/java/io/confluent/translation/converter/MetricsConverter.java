package io.confluent.translation.converter;

import com.google.common.collect.ImmutableMap;
import io.confluent.translation.MetricsUtils;
import io.confluent.translation.filter.FilterSet;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.Datum;
import io.confluent.translation.model.MetricType;
import io.confluent.translation.rules.MetricTranslator;
import io.opencensus.proto.metrics.v1.DistributionValue;
import io.opencensus.proto.metrics.v1.LabelKey;
import io.opencensus.proto.metrics.v1.LabelValue;
import io.opencensus.proto.metrics.v1.Metric;
import io.opencensus.proto.metrics.v1.MetricDescriptor;
import io.opencensus.proto.metrics.v1.Point;
import io.opencensus.proto.metrics.v1.SummaryValue;
import io.opencensus.proto.metrics.v1.TimeSeries;
import io.opencensus.proto.resource.v1.Resource;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts OpenCensus {@link Metric}s into translated and filtered {@link DataPoint}s.
 *
 * <p>Each metric is flattened into one data point per timeseries point. The dimensions of a point
 * are, in this order, the timeseries labels (labels without a value are skipped), the resource
 * labels sorted by key, and the configured extra dimensions. When a key occurs more than once the
 * first value wins.
 *
 * <p>The points of every metric are translated separately, so a rule only ever sees the points of
 * a single metric at a time, and then filtered.
 */
public class MetricsConverter {

  private static final Logger log = LoggerFactory.getLogger(MetricsConverter.class);

  static final String COUNT_SUFFIX = "_count";
  static final String BUCKET_SUFFIX = "_bucket";
  static final String QUANTILE_SUFFIX = "_quantile";
  static final String UPPER_BOUND_DIMENSION = "upper_bound";
  static final String QUANTILE_DIMENSION = "quantile";

  private final MetricTranslator translator;
  private final FilterSet filterSet;
  private final Map<String, String> extraDimensions;

  private MetricsConverter(Builder builder) {
    this.translator = builder.translator;
    this.filterSet = builder.filterSet;
    this.extraDimensions = ImmutableMap.copyOf(builder.extraDimensions);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public List<DataPoint> metricsToDataPoints(Collection<Metric> metrics) {
    List<DataPoint> result = new ArrayList<>();
    for (Metric metric : metrics) {
      List<DataPoint> dataPoints = flatten(metric);
      if (translator != null) {
        dataPoints = translator.translateDataPoints(dataPoints);
      }
      result.addAll(filterSet.filter(dataPoints));
    }
    return result;
  }

  List<DataPoint> flatten(Metric metric) {
    MetricDescriptor descriptor = metric.getMetricDescriptor();
    String name = descriptor.getName();
    MetricType metricType = toMetricType(descriptor.getType());
    List<DataPoint> dataPoints = new ArrayList<>();

    for (TimeSeries timeSeries : metric.getTimeseriesList()) {
      Map<String, String> dimensions = dimensions(descriptor.getLabelKeysList(),
          timeSeries.getLabelValuesList(), metric.getResource());

      for (Point point : timeSeries.getPointsList()) {
        DataPoint.Builder base = DataPoint.newBuilder()
            .setMetric(name)
            .addDimensions(dimensions)
            .setTimestamp(MetricsUtils.toInstant(point.getTimestamp()))
            .setMetricType(metricType);

        switch (point.getValueCase()) {
          case INT64_VALUE:
            dataPoints.add(base.setIntValue(point.getInt64Value()).build());
            break;
          case DOUBLE_VALUE:
            dataPoints.add(base.setDoubleValue(point.getDoubleValue()).build());
            break;
          case DISTRIBUTION_VALUE:
            addDistribution(name, base, point.getDistributionValue(), dataPoints);
            break;
          case SUMMARY_VALUE:
            addSummary(name, base, point.getSummaryValue(), dataPoints);
            break;
          default:
            log.debug("Skipping point without a value for metric {}", name);
        }
      }
    }
    return dataPoints;
  }

  private Map<String, String> dimensions(List<LabelKey> labelKeys, List<LabelValue> labelValues,
                                         Resource resource) {
    Map<String, String> dimensions = new LinkedHashMap<>();
    for (int i = 0; i < labelKeys.size() && i < labelValues.size(); i++) {
      LabelValue labelValue = labelValues.get(i);
      if (labelValue.getHasValue()) {
        dimensions.putIfAbsent(labelKeys.get(i).getKey(), labelValue.getValue());
      }
    }
    new TreeMap<>(resource.getLabelsMap()).forEach(dimensions::putIfAbsent);
    extraDimensions.forEach(dimensions::putIfAbsent);
    return dimensions;
  }

  private static void addDistribution(String name, DataPoint.Builder base, DistributionValue distribution,
                                      List<DataPoint> out) {
    DataPoint template = base.setIntValue(distribution.getCount()).build();
    out.add(template.withMetric(name + COUNT_SUFFIX));
    out.add(template.withValue(Datum.ofDouble(distribution.getSum())));

    List<Double> bounds = distribution.getBucketOptions().getExplicit().getBoundsList();
    long cumulativeCount = 0;
    for (int i = 0; i < distribution.getBucketsCount(); i++) {
      cumulativeCount += distribution.getBuckets(i).getCount();
      double upperBound = i < bounds.size() ? bounds.get(i) : Double.POSITIVE_INFINITY;
      out.add(template.toBuilder()
          .setMetric(name + BUCKET_SUFFIX)
          .setIntValue(cumulativeCount)
          .addDimension(UPPER_BOUND_DIMENSION, MetricsUtils.formatDimensionValue(upperBound))
          .build());
    }
  }

  private static void addSummary(String name, DataPoint.Builder base, SummaryValue summary,
                                 List<DataPoint> out) {
    DataPoint template = base.setIntValue(summary.getCount().getValue()).build();
    if (summary.hasCount()) {
      out.add(template.withMetric(name + COUNT_SUFFIX));
    }
    if (summary.hasSum()) {
      out.add(template.withValue(Datum.ofDouble(summary.getSum().getValue())));
    }
    for (SummaryValue.Snapshot.ValueAtPercentile percentile : summary.getSnapshot().getPercentileValuesList()) {
      out.add(template.toBuilder()
          .setMetric(name + QUANTILE_SUFFIX)
          .setDoubleValue(percentile.getValue())
          .setMetricType(MetricType.GAUGE)
          .addDimension(QUANTILE_DIMENSION, MetricsUtils.formatDimensionValue(percentile.getPercentile() / 100))
          .build());
    }
  }

  static MetricType toMetricType(MetricDescriptor.Type type) {
    switch (type) {
      case CUMULATIVE_INT64:
      case CUMULATIVE_DOUBLE:
      case CUMULATIVE_DISTRIBUTION:
      case SUMMARY:
        return MetricType.CUMULATIVE_COUNTER;
      default:
        return MetricType.GAUGE;
    }
  }

  /**
   * Converts data points back into OpenCensus metrics, one metric per metric name in the order the
   * names are first seen, and one single point timeseries per data point.
   *
   * <p>The label keys of a metric are the union of the dimension keys of its points. A point
   * without one of the keys gets a label value without a value. Gauges become {@code GAUGE_*}
   * metrics, counters {@code CUMULATIVE_*} ones; the value kind follows the first point of the
   * metric and int values of a double metric are promoted.
   */
  public static List<Metric> dataPointsToMetrics(List<DataPoint> dataPoints, Resource resource) {
    Objects.requireNonNull(resource, "resource");
    Map<String, List<DataPoint>> byMetric = new LinkedHashMap<>();
    for (DataPoint dp : dataPoints) {
      byMetric.computeIfAbsent(dp.getMetric(), k -> new ArrayList<>()).add(dp);
    }

    List<Metric> metrics = new ArrayList<>(byMetric.size());
    for (Map.Entry<String, List<DataPoint>> entry : byMetric.entrySet()) {
      metrics.add(toMetric(entry.getKey(), entry.getValue(), resource));
    }
    return metrics;
  }

  private static Metric toMetric(String name, List<DataPoint> dataPoints, Resource resource) {
    DataPoint first = dataPoints.get(0);
    boolean isInt = first.getValue().isInt();
    MetricDescriptor.Type type = toDescriptorType(first.getMetricType(), isInt);

    MetricBuilder builder = new MetricBuilder()
        .withResource(resource)
        .withName(name)
        .withType(type);
    for (DataPoint dp : dataPoints) {
      Point.Builder point = Point.newBuilder()
          .setTimestamp(MetricsUtils.toTimestamp(dp.getTimestamp()));
      if (isInt && dp.getValue().isInt()) {
        point.setInt64Value(dp.getValue().intValue());
      } else if (isInt) {
        point.setInt64Value(dp.getValue().toInt().intValue());
      } else {
        point.setDoubleValue(dp.getValue().doubleValue());
      }
      builder.addTimeseries(dp.getDimensions(), point.build());
    }
    return builder.build();
  }

  private static MetricDescriptor.Type toDescriptorType(MetricType metricType, boolean isInt) {
    if (metricType == MetricType.GAUGE) {
      return isInt ? MetricDescriptor.Type.GAUGE_INT64 : MetricDescriptor.Type.GAUGE_DOUBLE;
    }
    return isInt ? MetricDescriptor.Type.CUMULATIVE_INT64 : MetricDescriptor.Type.CUMULATIVE_DOUBLE;
  }

  public static class Builder {
    private MetricTranslator translator;
    private FilterSet filterSet = FilterSet.EMPTY;
    private Map<String, String> extraDimensions = ImmutableMap.of();

    private Builder() {
    }

    /**
     * Translator applied to the points of every metric. Without one the points are not translated.
     */
    public Builder setTranslator(MetricTranslator translator) {
      this.translator = translator;
      return this;
    }

    public Builder setFilterSet(FilterSet filterSet) {
      this.filterSet = Objects.requireNonNull(filterSet, "filterSet");
      return this;
    }

    public Builder setExtraDimensions(Map<String, String> extraDimensions) {
      this.extraDimensions = Objects.requireNonNull(extraDimensions, "extraDimensions");
      return this;
    }

    public MetricsConverter build() {
      return new MetricsConverter(this);
    }
  }
}
