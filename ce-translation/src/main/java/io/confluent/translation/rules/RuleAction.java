package io.confluent.translation.rules;

/**
 * The closed set of translation rule kinds. The action name is the value of the {@code action}
 * property in a JSON rule definition.
 */
public enum RuleAction {
  RENAME_DIMENSION_KEYS("rename_dimension_keys"),
  RENAME_METRICS("rename_metrics"),
  MULTIPLY_INT("multiply_int"),
  DIVIDE_INT("divide_int"),
  MULTIPLY_FLOAT("multiply_float"),
  CONVERT_VALUES("convert_values"),
  COPY_METRICS("copy_metrics"),
  SPLIT_METRIC("split_metric"),
  AGGREGATE_METRIC("aggregate_metric"),
  CALCULATE_NEW_METRIC("calculate_new_metric"),
  COMPUTE_UTILIZATION("compute_utilization"),
  DELTA_METRIC("delta_metric"),
  COMPUTE_RATE("compute_rate"),
  DROP_DIMENSIONS("drop_dimensions"),
  DROP_METRICS("drop_metrics");

  private final String actionName;

  RuleAction(String actionName) {
    this.actionName = actionName;
  }

  public String actionName() {
    return actionName;
  }

  @Override
  public String toString() {
    return actionName;
  }
}
