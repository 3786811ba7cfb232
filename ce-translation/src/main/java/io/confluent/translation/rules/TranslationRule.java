package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A single, immutable translation rule.
 *
 * <p>Each subclass is one {@link RuleAction} and carries only the arguments that action needs.
 * Arguments are validated when the rule is constructed; a rule that was constructed successfully
 * never fails at translation time. Rules are stateless, the only state they touch is the
 * {@link DeltaStateCache} handed to {@link #apply(List, DeltaStateCache)}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RenameDimensionKeysRule.class, name = "rename_dimension_keys"),
    @JsonSubTypes.Type(value = RenameMetricsRule.class, name = "rename_metrics"),
    @JsonSubTypes.Type(value = MultiplyIntRule.class, name = "multiply_int"),
    @JsonSubTypes.Type(value = DivideIntRule.class, name = "divide_int"),
    @JsonSubTypes.Type(value = MultiplyFloatRule.class, name = "multiply_float"),
    @JsonSubTypes.Type(value = ConvertValuesRule.class, name = "convert_values"),
    @JsonSubTypes.Type(value = CopyMetricsRule.class, name = "copy_metrics"),
    @JsonSubTypes.Type(value = SplitMetricRule.class, name = "split_metric"),
    @JsonSubTypes.Type(value = AggregateMetricRule.class, name = "aggregate_metric"),
    @JsonSubTypes.Type(value = CalculateNewMetricRule.class, name = "calculate_new_metric"),
    @JsonSubTypes.Type(value = ComputeUtilizationRule.class, name = "compute_utilization"),
    @JsonSubTypes.Type(value = DeltaMetricRule.class, name = "delta_metric"),
    @JsonSubTypes.Type(value = ComputeRateRule.class, name = "compute_rate"),
    @JsonSubTypes.Type(value = DropDimensionsRule.class, name = "drop_dimensions"),
    @JsonSubTypes.Type(value = DropMetricsRule.class, name = "drop_metrics")
})
public abstract class TranslationRule {

  public abstract RuleAction action();

  /**
   * Apply this rule to the working set of data points.
   *
   * @param dataPoints the output of the previous rule. Never modified.
   * @param deltaCache previous observations of cumulative series.
   * @return the new working set.
   */
  public abstract List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{action=" + action() + "}";
  }

  static InvalidTranslationRuleException invalid(RuleAction action, String message) {
    return new InvalidTranslationRuleException(message + " for \"" + action + "\" translation rule");
  }

  static <V> ImmutableMap<String, V> requiredMap(RuleAction action, String field, Map<String, V> map) {
    if (map == null || map.isEmpty()) {
      throw invalid(action, "\"" + field + "\" must be provided");
    }
    return optionalMap(action, field, map);
  }

  static <V> ImmutableMap<String, V> optionalMap(RuleAction action, String field, Map<String, V> map) {
    if (map == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, V> builder = ImmutableMap.builder();
    for (Map.Entry<String, V> entry : map.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        throw invalid(action, "\"" + field + "\" must not contain null entries");
      }
      builder.put(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  static ImmutableList<String> requiredList(RuleAction action, String field, Collection<String> values) {
    if (values == null || values.isEmpty()) {
      throw invalid(action, "\"" + field + "\" must be provided");
    }
    if (containsNull(values)) {
      throw invalid(action, "\"" + field + "\" must not contain null entries");
    }
    return ImmutableList.copyOf(values);
  }

  static ImmutableSet<String> optionalSet(RuleAction action, String field, Collection<String> values) {
    if (values == null) {
      return ImmutableSet.of();
    }
    if (containsNull(values)) {
      throw invalid(action, "\"" + field + "\" must not contain null entries");
    }
    return ImmutableSet.copyOf(values);
  }

  private static boolean containsNull(Collection<String> values) {
    for (String value : values) {
      if (value == null) {
        return true;
      }
    }
    return false;
  }

  static String requiredString(RuleAction action, String field, String value) {
    if (value == null || value.isEmpty()) {
      throw invalid(action, "\"" + field + "\" must be provided");
    }
    return value;
  }
}
