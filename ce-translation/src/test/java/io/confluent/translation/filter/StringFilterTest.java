package io.confluent.translation.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Test;

public class StringFilterTest {

  private static StringFilter filter(String... items) {
    return new StringFilter(Arrays.asList(items));
  }

  @Test
  public void exact() {
    StringFilter filter = filter("cpu.idle", "cpu.user");

    assertThat(filter.matches("cpu.idle")).isTrue();
    assertThat(filter.matches("cpu.user")).isTrue();
    assertThat(filter.matches("cpu.idle2")).isFalse();
  }

  @Test
  public void glob() {
    StringFilter filter = filter("cpu.*", "disk_?ps", "if_{octets,errors}.rx", "df_[ab]");

    assertThat(filter.matches("cpu.idle")).isTrue();
    assertThat(filter.matches("system.cpu.idle")).isFalse();
    assertThat(filter.matches("disk_ops")).isTrue();
    assertThat(filter.matches("disk_oops")).isFalse();
    assertThat(filter.matches("if_octets.rx")).isTrue();
    assertThat(filter.matches("if_errors.rx")).isTrue();
    assertThat(filter.matches("if_dropped.rx")).isFalse();
    assertThat(filter.matches("df_b")).isTrue();
    assertThat(filter.matches("df_c")).isFalse();
  }

  @Test
  public void regex() {
    StringFilter filter = filter("/^system\\.cpu\\..*/", "/load/");

    assertThat(filter.matches("system.cpu.time")).isTrue();
    assertThat(filter.matches("system.cpu")).isFalse();
    assertThat(filter.matches("system.cpu.load_average.1m")).isTrue();
    assertThat(filter.matches("load")).isTrue();
  }

  @Test
  public void negationOnly() {
    StringFilter filter = filter("!cpu.idle");

    assertThat(filter.matches("cpu.idle")).isFalse();
    assertThat(filter.matches("memory.used")).isTrue();
  }

  @Test
  public void negationOverridesPositiveMatch() {
    StringFilter filter = filter("/^system\\.disk\\..*/", "!/\\.total$/");

    assertThat(filter.matches("system.disk.io")).isTrue();
    assertThat(filter.matches("system.disk.io.total")).isFalse();
    assertThat(filter.matches("memory.used")).isFalse();
  }

  @Test
  public void emptyFilterMatchesNothing() {
    assertThat(new StringFilter(Collections.emptyList()).matches("anything")).isFalse();
  }

  @Test
  public void invalidRegexFails() {
    assertThatThrownBy(() -> filter("/[/"))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("/[/");
  }

  @Test
  public void emptyPatternFails() {
    assertThatThrownBy(() -> filter(""))
        .isInstanceOf(ConfigException.class);
  }
}
