package io.confluent.translation.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * One measurement in the vendor data point schema.
 *
 * <p>Data points are immutable. Dimension keys are unique within a point and the dimension order is
 * the order in which the dimensions were added.
 */
public final class DataPoint {

  private final String metric;
  private final Datum value;
  private final List<Dimension> dimensions;
  private final Instant timestamp;
  private final MetricType metricType;

  private DataPoint(String metric, Datum value, List<Dimension> dimensions, Instant timestamp,
                    MetricType metricType) {
    this.metric = metric;
    this.value = value;
    this.dimensions = dimensions;
    this.timestamp = timestamp;
    this.metricType = metricType;
  }

  public String getMetric() {
    return metric;
  }

  public Datum getValue() {
    return value;
  }

  public List<Dimension> getDimensions() {
    return dimensions;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public MetricType getMetricType() {
    return metricType;
  }

  public Optional<String> dimensionValue(String key) {
    for (Dimension dimension : dimensions) {
      if (dimension.getKey().equals(key)) {
        return Optional.of(dimension.getValue());
      }
    }
    return Optional.empty();
  }

  public DataPoint withMetric(String metric) {
    return toBuilder().setMetric(metric).build();
  }

  public DataPoint withValue(Datum value) {
    return toBuilder().setValue(value).build();
  }

  /**
   * Returns a copy of this point without the dimensions whose key is in {@code keys}.
   */
  public DataPoint withoutDimensions(Collection<String> keys) {
    return toBuilder().removeDimensionsIf(d -> keys.contains(d.getKey())).build();
  }

  public Builder toBuilder() {
    return new Builder()
        .setMetric(metric)
        .setValue(value)
        .addDimensions(dimensions)
        .setTimestamp(timestamp)
        .setMetricType(metricType);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DataPoint that = (DataPoint) o;
    return metric.equals(that.metric) &&
        value.equals(that.value) &&
        dimensions.equals(that.dimensions) &&
        timestamp.equals(that.timestamp) &&
        metricType == that.metricType;
  }

  @Override
  public int hashCode() {
    return Objects.hash(metric, value, dimensions, timestamp, metricType);
  }

  @Override
  public String toString() {
    return "DataPoint{" +
        "metric='" + metric + '\'' +
        ", value=" + value +
        ", dimensions=" + dimensions +
        ", timestamp=" + timestamp +
        ", metricType=" + metricType +
        '}';
  }

  public static class Builder {
    private String metric;
    private Datum value;
    private final List<Dimension> dimensions = new ArrayList<>();
    private Instant timestamp = Instant.EPOCH;
    private MetricType metricType = MetricType.GAUGE;

    private Builder() {
    }

    public Builder setMetric(String metric) {
      this.metric = Objects.requireNonNull(metric, "metric");
      return this;
    }

    public Builder setValue(Datum value) {
      this.value = Objects.requireNonNull(value, "value");
      return this;
    }

    public Builder setIntValue(long value) {
      return setValue(Datum.ofInt(value));
    }

    public Builder setDoubleValue(double value) {
      return setValue(Datum.ofDouble(value));
    }

    /**
     * Add a dimension. If the key is already present its value is replaced in place.
     */
    public Builder addDimension(String key, String value) {
      Dimension dimension = new Dimension(key, value);
      for (int i = 0; i < dimensions.size(); i++) {
        if (dimensions.get(i).getKey().equals(key)) {
          dimensions.set(i, dimension);
          return this;
        }
      }
      dimensions.add(dimension);
      return this;
    }

    public Builder addDimensions(Iterable<Dimension> dimensions) {
      for (Dimension dimension : dimensions) {
        addDimension(dimension.getKey(), dimension.getValue());
      }
      return this;
    }

    public Builder addDimensions(Map<String, String> dimensions) {
      dimensions.forEach(this::addDimension);
      return this;
    }

    public Builder removeDimensionsIf(Predicate<Dimension> predicate) {
      dimensions.removeIf(predicate);
      return this;
    }

    public Builder retainDimensions(Set<String> keys) {
      dimensions.removeIf(d -> !keys.contains(d.getKey()));
      return this;
    }

    public Builder clearDimensions() {
      dimensions.clear();
      return this;
    }

    public Builder setTimestamp(Instant timestamp) {
      this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
      return this;
    }

    public Builder setMetricType(MetricType metricType) {
      this.metricType = Objects.requireNonNull(metricType, "metricType");
      return this;
    }

    public DataPoint build() {
      Preconditions.checkState(metric != null, "metric name must be set");
      Preconditions.checkState(value != null, "value must be set");
      return new DataPoint(metric, value, ImmutableList.copyOf(dimensions), timestamp, metricType);
    }
  }
}
