package io.confluent.translation.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.utils.JsonMapper;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Test;

public class FilterSetTest {

  private static DataPoint dp(String metric, String... dimensions) {
    DataPoint.Builder builder = DataPoint.newBuilder().setMetric(metric).setIntValue(1);
    for (int i = 0; i < dimensions.length; i += 2) {
      builder.addDimension(dimensions[i], dimensions[i + 1]);
    }
    return builder.build();
  }

  @Test
  public void emptyFilterSetExcludesNothing() {
    assertThat(FilterSet.EMPTY.shouldExclude(dp("anything"))).isFalse();
  }

  @Test
  public void excludeByMetricName() {
    FilterSet filterSet = new FilterSet(
        Collections.singletonList(MetricFilter.forMetricNames("cpu.idle", "/^memory\\..*/")),
        Collections.emptyList());

    assertThat(filterSet.shouldExclude(dp("cpu.idle"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("memory.used"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("cpu.utilization"))).isFalse();
  }

  @Test
  public void includeRescuesExcludedPoints() {
    FilterSet filterSet = new FilterSet(
        Collections.singletonList(MetricFilter.forMetricNames("/^memory\\..*/")),
        Collections.singletonList(MetricFilter.forMetricNames("memory.used")));

    assertThat(filterSet.shouldExclude(dp("memory.free"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("memory.used"))).isFalse();
    // includes only rescue, they do not restrict
    assertThat(filterSet.shouldExclude(dp("cpu.utilization"))).isFalse();
  }

  @Test
  public void excludeByDimension() {
    FilterSet filterSet = new FilterSet(
        Collections.singletonList(MetricFilter.forDimensions(
            ImmutableList.of("/^if_.*/"),
            ImmutableMap.of("interface", ImmutableList.of("lo", "/^veth.*/")))),
        Collections.emptyList());

    assertThat(filterSet.shouldExclude(dp("if_octets", "interface", "lo"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("if_octets", "interface", "veth1234"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("if_octets", "interface", "eth0"))).isFalse();
    assertThat(filterSet.shouldExclude(dp("if_octets"))).isFalse();
    assertThat(filterSet.shouldExclude(dp("cpu.idle", "interface", "lo"))).isFalse();
  }

  @Test
  public void overlappingDimensionQualifiedFilters() {
    List<MetricFilter> excludes = Collections.singletonList(MetricFilter.forDimensions(
        ImmutableList.of("/^if_.*/"), ImmutableMap.of("interface", "lo")));

    FilterSet byName = new FilterSet(excludes,
        Collections.singletonList(MetricFilter.forMetricNames("if_octets")));
    assertThat(byName.shouldExclude(dp("if_octets", "interface", "lo"))).isFalse();
    assertThat(byName.shouldExclude(dp("if_packets", "interface", "lo"))).isTrue();

    FilterSet otherValue = new FilterSet(excludes,
        Collections.singletonList(MetricFilter.forDimensions(
            ImmutableList.of("if_octets"), ImmutableMap.of("interface", "eth0"))));
    assertThat(otherValue.shouldExclude(dp("if_octets", "interface", "lo"))).isTrue();
    assertThat(otherValue.shouldExclude(dp("if_octets", "interface", "eth0"))).isFalse();

    FilterSet sameValue = new FilterSet(excludes,
        Collections.singletonList(MetricFilter.forDimensions(
            ImmutableList.of("if_octets"), ImmutableMap.of("interface", "lo"))));
    assertThat(sameValue.shouldExclude(dp("if_octets", "interface", "lo"))).isFalse();
    assertThat(sameValue.shouldExclude(dp("if_errors", "interface", "lo"))).isTrue();

    FilterSet missingDimension = new FilterSet(excludes,
        Collections.singletonList(MetricFilter.forDimensions(
            ImmutableList.of("if_octets"), ImmutableMap.of("host", "host0"))));
    assertThat(missingDimension.shouldExclude(dp("if_octets", "interface", "lo"))).isTrue();
    assertThat(missingDimension.shouldExclude(dp("if_octets", "interface", "lo", "host", "host0"))).isFalse();
  }

  @Test
  public void dimensionOnlyFilter() {
    FilterSet filterSet = new FilterSet(
        Collections.singletonList(MetricFilter.forDimensions(null, ImmutableMap.of("env", "test"))),
        Collections.emptyList());

    assertThat(filterSet.shouldExclude(dp("any.metric", "env", "test"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("any.metric", "env", "prod"))).isFalse();
  }

  @Test
  public void filterKeepsOrder() {
    FilterSet filterSet = new FilterSet(
        Collections.singletonList(MetricFilter.forMetricNames("b")),
        Collections.emptyList());

    List<DataPoint> kept = filterSet.filter(Arrays.asList(dp("a"), dp("b"), dp("c"), dp("b")));

    assertThat(kept).extracting(DataPoint::getMetric).containsExactly("a", "c");
  }

  @Test
  public void metricFilterNeedsNamesOrDimensions() {
    assertThatThrownBy(() -> new MetricFilter(null, null, null))
        .isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> new MetricFilter(null, Collections.emptyList(), Collections.emptyMap()))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  public void invalidPatternFailsAtConstruction() {
    assertThatThrownBy(() -> new FilterSet(
        Collections.singletonList(MetricFilter.forMetricNames("/(/")), Collections.emptyList()))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  public void metricFilterFromJson() throws Exception {
    MetricFilter filter = JsonMapper.objectMapper().readValue(
        "{\"metric_name\": \"m1\", \"metric_names\": [\"m2\"], \"dimensions\": {\"a\": \"x\", \"b\": [\"y\", \"z\"]}}",
        MetricFilter.class);

    assertThat(filter.getMetricNames()).containsExactly("m1", "m2");
    assertThat(filter.getDimensions()).containsEntry("a", ImmutableList.of("x"));
    assertThat(filter.getDimensions()).containsEntry("b", ImmutableList.of("y", "z"));
  }

  @Test
  public void resolveExcludes() {
    List<MetricFilter> defaults = FilterSet.loadDefaultExcludes();
    assertThat(defaults).hasSize(11);

    assertThat(FilterSet.resolveExcludes(defaults, null)).hasSize(11);
    assertThat(FilterSet.resolveExcludes(defaults,
        Collections.singletonList(MetricFilter.forMetricNames("metric1")))).hasSize(12);
    assertThat(FilterSet.resolveExcludes(defaults, Collections.emptyList())).isEmpty();
  }

  @Test
  public void defaultExcludesKeepDerivedMetrics() {
    FilterSet filterSet = new FilterSet(FilterSet.loadDefaultExcludes(), Collections.emptyList());

    assertThat(filterSet.shouldExclude(dp("cpu.utilization"))).isFalse();
    assertThat(filterSet.shouldExclude(dp("memory.utilization"))).isFalse();
    assertThat(filterSet.shouldExclude(dp("system.disk.io.total"))).isFalse();
    assertThat(filterSet.shouldExclude(dp("system.network.packets.total"))).isFalse();
    assertThat(filterSet.shouldExclude(dp("disk_ops.total"))).isFalse();

    assertThat(filterSet.shouldExclude(dp("system.cpu.time"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("cpu.idle"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("system.disk.io"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("system.network.io"))).isTrue();
    assertThat(filterSet.shouldExclude(dp("if_octets", "interface", "lo"))).isTrue();
  }
}
