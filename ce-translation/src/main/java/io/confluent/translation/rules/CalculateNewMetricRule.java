package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.confluent.translation.DimensionSignature;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import io.confluent.translation.model.Datum;
import io.confluent.translation.model.MetricType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a double gauge from two operand metrics: {@code metric_name = operand1 <operator> operand2}.
 *
 * <p>Operands are paired by their dimension set. An operand1 point without a partner, or a division
 * by zero, produces nothing.
 */
public class CalculateNewMetricRule extends TranslationRule {

  private static final Logger log = LoggerFactory.getLogger(CalculateNewMetricRule.class);

  public enum Operator {
    @JsonProperty("+")
    ADD,
    @JsonProperty("-")
    SUBTRACT,
    @JsonProperty("*")
    MULTIPLY,
    @JsonProperty("/")
    DIVIDE
  }

  private final String metricName;
  private final String operand1Metric;
  private final String operand2Metric;
  private final Operator operator;

  @JsonCreator
  public CalculateNewMetricRule(@JsonProperty("metric_name") String metricName,
                                @JsonProperty("operand1_metric") String operand1Metric,
                                @JsonProperty("operand2_metric") String operand2Metric,
                                @JsonProperty("operator") Operator operator) {
    this.metricName = requiredString(action(), "metric_name", metricName);
    this.operand1Metric = requiredString(action(), "operand1_metric", operand1Metric);
    this.operand2Metric = requiredString(action(), "operand2_metric", operand2Metric);
    if (operator == null) {
      throw invalid(action(), "\"operator\" must be provided");
    }
    this.operator = operator;
  }

  @Override
  public RuleAction action() {
    return RuleAction.CALCULATE_NEW_METRIC;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    Map<DimensionSignature, DataPoint> operand2Points = new HashMap<>();
    for (DataPoint dp : dataPoints) {
      if (dp.getMetric().equals(operand2Metric)) {
        operand2Points.putIfAbsent(DimensionSignature.dimensionsOnly(dp), dp);
      }
    }

    List<DataPoint> processed = new ArrayList<>(dataPoints);
    for (DataPoint operand1 : dataPoints) {
      if (!operand1.getMetric().equals(operand1Metric)) {
        continue;
      }
      DataPoint operand2 = operand2Points.get(DimensionSignature.dimensionsOnly(operand1));
      if (operand2 == null) {
        log.debug("No \"{}\" point matching {}, skipping \"{}\"", operand2Metric, operand1, metricName);
        continue;
      }
      double v1 = operand1.getValue().doubleValue();
      double v2 = operand2.getValue().doubleValue();
      if (operator == Operator.DIVIDE && v2 == 0) {
        log.debug("\"{}\" is zero for {}, skipping \"{}\"", operand2Metric, operand1, metricName);
        continue;
      }
      processed.add(operand1.toBuilder()
          .setMetric(metricName)
          .setValue(Datum.ofDouble(calculate(v1, v2)))
          .setMetricType(MetricType.GAUGE)
          .build());
    }
    return processed;
  }

  private double calculate(double v1, double v2) {
    switch (operator) {
      case ADD:
        return v1 + v2;
      case SUBTRACT:
        return v1 - v2;
      case MULTIPLY:
        return v1 * v2;
      case DIVIDE:
      default:
        return v1 / v2;
    }
  }
}
