package io.confluent.translation.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import org.junit.Test;

public class DataPointTest {

  @Test
  public void defaults() {
    DataPoint dp = DataPoint.newBuilder().setMetric("m").setIntValue(1).build();

    assertThat(dp.getTimestamp()).isEqualTo(Instant.EPOCH);
    assertThat(dp.getMetricType()).isEqualTo(MetricType.GAUGE);
    assertThat(dp.getDimensions()).isEmpty();
  }

  @Test
  public void dimensionsKeepInsertionOrder() {
    DataPoint dp = DataPoint.newBuilder()
        .setMetric("m")
        .setIntValue(1)
        .addDimension("z", "1")
        .addDimension("a", "2")
        .addDimension("m", "3")
        .build();

    assertThat(dp.getDimensions()).containsExactly(
        Dimension.of("z", "1"), Dimension.of("a", "2"), Dimension.of("m", "3"));
  }

  @Test
  public void addingAnExistingKeyReplacesTheValueInPlace() {
    DataPoint dp = DataPoint.newBuilder()
        .setMetric("m")
        .setIntValue(1)
        .addDimension("a", "1")
        .addDimension("b", "2")
        .addDimension("a", "3")
        .build();

    assertThat(dp.getDimensions()).containsExactly(Dimension.of("a", "3"), Dimension.of("b", "2"));
    assertThat(dp.dimensionValue("a")).hasValue("3");
    assertThat(dp.dimensionValue("c")).isEmpty();
  }

  @Test
  public void withoutDimensions() {
    DataPoint dp = DataPoint.newBuilder()
        .setMetric("m")
        .setDoubleValue(1.5)
        .addDimension("a", "1")
        .addDimension("b", "2")
        .addDimension("c", "3")
        .build();

    DataPoint reduced = dp.withoutDimensions(ImmutableList.of("b", "missing"));

    assertThat(reduced.getDimensions()).containsExactly(Dimension.of("a", "1"), Dimension.of("c", "3"));
    assertThat(reduced.getValue()).isEqualTo(Datum.ofDouble(1.5));
    assertThat(dp.getDimensions()).hasSize(3);
  }

  @Test
  public void toBuilderCopiesEverything() {
    DataPoint dp = DataPoint.newBuilder()
        .setMetric("m")
        .setIntValue(5)
        .addDimension("a", "1")
        .setTimestamp(Instant.ofEpochSecond(100))
        .setMetricType(MetricType.CUMULATIVE_COUNTER)
        .build();

    assertThat(dp.toBuilder().build()).isEqualTo(dp);
    assertThat(dp.withMetric("n").getMetricType()).isEqualTo(MetricType.CUMULATIVE_COUNTER);
  }

  @Test
  public void metricAndValueAreRequired() {
    assertThatThrownBy(() -> DataPoint.newBuilder().setIntValue(1).build())
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> DataPoint.newBuilder().setMetric("m").build())
        .isInstanceOf(IllegalStateException.class);
  }
}
