package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Divides int values, truncating toward zero.
 */
public class DivideIntRule extends IntScalingRule {

  @JsonCreator
  public DivideIntRule(@JsonProperty("scale_factors_int") Map<String, Long> scaleFactors) {
    super(scaleFactors);
    for (Map.Entry<String, Long> entry : scaleFactors().entrySet()) {
      if (entry.getValue() == 0) {
        throw invalid(action(), "scale factor of \"" + entry.getKey() + "\" must not be zero");
      }
    }
  }

  @Override
  public RuleAction action() {
    return RuleAction.DIVIDE_INT;
  }

  @Override
  long scale(long value, long factor) {
    return value / factor;
  }
}
