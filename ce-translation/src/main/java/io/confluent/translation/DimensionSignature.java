package io.confluent.translation;

import com.google.common.collect.ImmutableSortedMap;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.Dimension;
import java.util.Map;
import java.util.Objects;

/**
 * Value object that identifies one logical time series: a metric name plus its dimensions.
 *
 * <p>
 * The dimensions are held sorted by key, so two data points with the same metric name and the
 * same dimension set compare equal regardless of the order their dimensions were added in. Objects
 * of this class are the keys of the {@link io.confluent.translation.delta.DeltaStateCache} and,
 * via {@link #dimensionsOnly(DataPoint)}, the join key used when combining several metrics.
 * </p>
 */
public class DimensionSignature {

  private static final String NO_METRIC = "";

  private final String name;
  private final Map<String, String> dimensions;

  /**
   * @param name metric name of the series.
   * @param dimensions mapping of dimension keys to values.
   */
  public DimensionSignature(String name, Map<String, String> dimensions) {
    this.name = Objects.requireNonNull(name, "name");
    this.dimensions = ImmutableSortedMap.copyOf(dimensions);
  }

  public static DimensionSignature of(DataPoint dataPoint) {
    return new DimensionSignature(dataPoint.getMetric(), toMap(dataPoint));
  }

  /**
   * Signature of the dimension set of a point, ignoring its metric name.
   */
  public static DimensionSignature dimensionsOnly(DataPoint dataPoint) {
    return new DimensionSignature(NO_METRIC, toMap(dataPoint));
  }

  private static Map<String, String> toMap(DataPoint dataPoint) {
    ImmutableSortedMap.Builder<String, String> builder = ImmutableSortedMap.naturalOrder();
    for (Dimension dimension : dataPoint.getDimensions()) {
      builder.put(dimension.getKey(), dimension.getValue());
    }
    return builder.build();
  }

  public String getName() {
    return name;
  }

  public Map<String, String> getDimensions() {
    return dimensions;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DimensionSignature that = (DimensionSignature) o;
    return name.equals(that.name) &&
        dimensions.equals(that.dimensions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, dimensions);
  }

  @Override
  public String toString() {
    return "DimensionSignature{" +
        "name='" + name + '\'' +
        ", dimensions=" + dimensions +
        '}';
  }
}
