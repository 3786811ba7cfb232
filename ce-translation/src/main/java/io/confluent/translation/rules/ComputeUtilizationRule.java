package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
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
 * Derives a utilization percentage, {@code used / (used + free...) * 100}, from a "used" metric and
 * one or more "free" metrics that share a dimension set.
 *
 * <p>Nothing is emitted for a dimension set when any of the source metrics is missing for it, or
 * when the denominator is zero.
 */
public class ComputeUtilizationRule extends TranslationRule {

  private static final Logger log = LoggerFactory.getLogger(ComputeUtilizationRule.class);

  private static final double PERCENT = 100;

  private final String metricName;
  private final String usedMetric;
  private final ImmutableList<String> freeMetrics;

  @JsonCreator
  public ComputeUtilizationRule(@JsonProperty("metric_name") String metricName,
                                @JsonProperty("used_metric") String usedMetric,
                                @JsonProperty("free_metrics") List<String> freeMetrics) {
    this.metricName = requiredString(action(), "metric_name", metricName);
    this.usedMetric = requiredString(action(), "used_metric", usedMetric);
    this.freeMetrics = requiredList(action(), "free_metrics", freeMetrics);
  }

  @Override
  public RuleAction action() {
    return RuleAction.COMPUTE_UTILIZATION;
  }

  @Override
  public List<DataPoint> apply(List<DataPoint> dataPoints, DeltaStateCache deltaCache) {
    Map<String, Map<DimensionSignature, DataPoint>> freePoints = new HashMap<>();
    for (String freeMetric : freeMetrics) {
      freePoints.put(freeMetric, new HashMap<>());
    }
    for (DataPoint dp : dataPoints) {
      Map<DimensionSignature, DataPoint> bySignature = freePoints.get(dp.getMetric());
      if (bySignature != null) {
        bySignature.putIfAbsent(DimensionSignature.dimensionsOnly(dp), dp);
      }
    }

    List<DataPoint> processed = new ArrayList<>(dataPoints);
    for (DataPoint used : dataPoints) {
      if (!used.getMetric().equals(usedMetric)) {
        continue;
      }
      DimensionSignature signature = DimensionSignature.dimensionsOnly(used);
      double usedValue = used.getValue().doubleValue();
      double total = usedValue;
      boolean complete = true;
      for (String freeMetric : freeMetrics) {
        DataPoint free = freePoints.get(freeMetric).get(signature);
        if (free == null) {
          log.debug("No \"{}\" point matching {}, skipping \"{}\"", freeMetric, used, metricName);
          complete = false;
          break;
        }
        total += free.getValue().doubleValue();
      }
      if (!complete || total == 0) {
        continue;
      }
      processed.add(used.toBuilder()
          .setMetric(metricName)
          .setValue(Datum.ofDouble(usedValue / total * PERCENT))
          .setMetricType(MetricType.GAUGE)
          .build());
    }
    return processed;
  }
}
