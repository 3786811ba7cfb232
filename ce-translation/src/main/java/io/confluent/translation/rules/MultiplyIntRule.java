package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public class MultiplyIntRule extends IntScalingRule {

  @JsonCreator
  public MultiplyIntRule(@JsonProperty("scale_factors_int") Map<String, Long> scaleFactors) {
    super(scaleFactors);
  }

  @Override
  public RuleAction action() {
    return RuleAction.MULTIPLY_INT;
  }

  @Override
  long scale(long value, long factor) {
    return value * factor;
  }
}
