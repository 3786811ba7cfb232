package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AggregationMethod {
  @JsonProperty("sum")
  SUM,
  @JsonProperty("count")
  COUNT,
  @JsonProperty("avg")
  AVG
}
