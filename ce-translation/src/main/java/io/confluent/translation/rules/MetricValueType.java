package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Target numeric kind of a {@code convert_values} rule.
 */
public enum MetricValueType {
  @JsonProperty("int")
  INT,
  @JsonProperty("double")
  DOUBLE
}
