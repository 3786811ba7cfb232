package io.confluent.translation;

import com.google.common.collect.ImmutableList;
import io.confluent.translation.converter.MetricsConverter;
import io.confluent.translation.filter.FilterSet;
import io.confluent.translation.filter.MetricFilter;
import io.confluent.translation.rules.MetricTranslator;
import io.confluent.translation.rules.TranslationRule;
import io.confluent.translation.rules.TranslationRules;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TranslationConfig extends AbstractConfig {

  private static final Logger log = LoggerFactory.getLogger(TranslationConfig.class);

  public static final String PREFIX = "confluent.translation.";
  public static final String PREFIX_LABELS = PREFIX + "labels.";

  public static final String DELTA_TTL_SECONDS_CONFIG = PREFIX + "delta.ttl.seconds";
  public static final Long DEFAULT_DELTA_TTL_SECONDS = TimeUnit.HOURS.toSeconds(1);
  public static final String DELTA_TTL_SECONDS_DOC = "How long the previous value of a cumulative "
      + "series is kept for the delta and rate rules. A series that is not reported for longer "
      + "than this starts over, emitting nothing on its next observation.";

  public static final String DEFAULT_RULES_ENABLE_CONFIG = PREFIX + "rules.defaults.enable";
  public static final boolean DEFAULT_RULES_ENABLE_DEFAULT = true;
  public static final String DEFAULT_RULES_ENABLE_DOC = "Apply the built-in translation rules, "
      + "which derive CPU, memory, disk and network utilization and rollup metrics.";

  public static final String RULES_CONFIG = PREFIX + "rules";
  public static final String RULES_DOC = "Additional translation rules, as a JSON document of the "
      + "form {\"translation_rules\": [...]}. They are applied after the built-in rules.";

  public static final String METRICS_EXCLUDE_CONFIG = PREFIX + "metrics.exclude";
  public static final String METRICS_EXCLUDE_DOC = "Metric names, globs or /regular expressions/ "
      + "of translated metrics to drop, in addition to the built-in excludes. Setting this to an "
      + "empty list disables the built-in excludes.";

  public static final String METRICS_INCLUDE_CONFIG = PREFIX + "metrics.include";
  public static final String METRICS_INCLUDE_DOC = "Metric names, globs or /regular expressions/ "
      + "of translated metrics to keep even when an exclude matches them.";

  private static final ConfigDef CONFIG = new ConfigDef()
      .define(
          DELTA_TTL_SECONDS_CONFIG,
          ConfigDef.Type.LONG,
          DEFAULT_DELTA_TTL_SECONDS,
          ConfigDef.Range.atLeast(1),
          ConfigDef.Importance.LOW,
          DELTA_TTL_SECONDS_DOC
      ).define(
          DEFAULT_RULES_ENABLE_CONFIG,
          ConfigDef.Type.BOOLEAN,
          DEFAULT_RULES_ENABLE_DEFAULT,
          ConfigDef.Importance.LOW,
          DEFAULT_RULES_ENABLE_DOC
      ).define(
          RULES_CONFIG,
          ConfigDef.Type.STRING,
          null,
          ConfigDef.Importance.LOW,
          RULES_DOC
      ).define(
          METRICS_EXCLUDE_CONFIG,
          ConfigDef.Type.LIST,
          null,
          new PatternListValidator(),
          ConfigDef.Importance.MEDIUM,
          METRICS_EXCLUDE_DOC
      ).define(
          METRICS_INCLUDE_CONFIG,
          ConfigDef.Type.LIST,
          Collections.emptyList(),
          new PatternListValidator(),
          ConfigDef.Importance.MEDIUM,
          METRICS_INCLUDE_DOC
      );

  public TranslationConfig(Map<String, ?> originals) {
    this(originals, true);
  }

  public TranslationConfig(Map<String, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
  }

  public static void main(String[] args) {
    System.out.println(CONFIG.toRst());
  }

  /**
   * The extra dimensions added to every data point, from the {@code confluent.translation.labels.}
   * prefixed configs.
   */
  public Map<String, String> getLabels() {
    Map<String, String> labels = new HashMap<>();
    for (Map.Entry<String, ?> entry : super.originals().entrySet()) {
      if (entry.getKey().startsWith(PREFIX_LABELS)) {
        labels.put(entry.getKey().substring(PREFIX_LABELS.length()), String.valueOf(entry.getValue()));
      }
    }
    return labels;
  }

  public List<TranslationRule> translationRules() {
    ImmutableList.Builder<TranslationRule> rules = ImmutableList.builder();
    if (getBoolean(DEFAULT_RULES_ENABLE_CONFIG)) {
      rules.addAll(TranslationRules.loadDefaultRules().rules());
    } else {
      log.info("Built-in translation rules are disabled");
    }
    String custom = getString(RULES_CONFIG);
    if (custom != null && !custom.trim().isEmpty()) {
      rules.addAll(TranslationRules.parse(custom).rules());
    }
    return rules.build();
  }

  public MetricTranslator buildMetricTranslator() {
    return new MetricTranslator(translationRules(), getLong(DELTA_TTL_SECONDS_CONFIG));
  }

  /**
   * The exclude filters: the built-in ones followed by the configured patterns, or none at all when
   * the configured list is empty.
   */
  public List<MetricFilter> excludeMetrics(List<MetricFilter> defaults) {
    List<String> patterns = getList(METRICS_EXCLUDE_CONFIG);
    List<MetricFilter> userExcludes = null;
    if (patterns != null) {
      userExcludes = patterns.isEmpty()
          ? Collections.emptyList()
          : Collections.singletonList(new MetricFilter(null, patterns, null));
    }
    return FilterSet.resolveExcludes(defaults, userExcludes);
  }

  public List<MetricFilter> includeMetrics() {
    List<String> patterns = getList(METRICS_INCLUDE_CONFIG);
    return patterns.isEmpty()
        ? Collections.emptyList()
        : Collections.singletonList(new MetricFilter(null, patterns, null));
  }

  public FilterSet buildFilterSet() {
    return new FilterSet(excludeMetrics(FilterSet.loadDefaultExcludes()), includeMetrics());
  }

  public MetricsConverter buildMetricsConverter() {
    return MetricsConverter.newBuilder()
        .setTranslator(buildMetricTranslator())
        .setFilterSet(buildFilterSet())
        .setExtraDimensions(getLabels())
        .build();
  }
}
