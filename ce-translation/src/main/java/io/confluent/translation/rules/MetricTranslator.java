package io.confluent.translation.rules;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.confluent.translation.delta.DeltaStateCache;
import io.confluent.translation.model.DataPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an ordered list of {@link TranslationRule}s to batches of data points.
 *
 * <p>Rules run in declaration order and each one sees the output of the previous one. The rule
 * list is immutable and may be shared; the translator's {@link DeltaStateCache} is safe for
 * concurrent batches.
 */
public class MetricTranslator {

  private static final Logger log = LoggerFactory.getLogger(MetricTranslator.class);

  private final List<TranslationRule> rules;
  private final DeltaStateCache deltaCache;

  /**
   * @param rules the rules, in the order they are applied.
   * @param deltaTtlSeconds how long a cumulative series may go unreported before its previous value
   *     is forgotten.
   */
  public MetricTranslator(List<TranslationRule> rules, long deltaTtlSeconds) {
    Preconditions.checkNotNull(rules, "rules cannot be null");
    Preconditions.checkArgument(deltaTtlSeconds > 0, "invalid delta ttl: %s", deltaTtlSeconds);
    this.rules = ImmutableList.copyOf(rules);
    this.deltaCache = new DeltaStateCache(Duration.ofSeconds(deltaTtlSeconds));
  }

  public List<DataPoint> translateDataPoints(List<DataPoint> dataPoints) {
    List<DataPoint> processed = new ArrayList<>(dataPoints);
    for (TranslationRule rule : rules) {
      processed = rule.apply(processed, deltaCache);
    }

    Instant newest = null;
    for (DataPoint dp : dataPoints) {
      if (newest == null || dp.getTimestamp().isAfter(newest)) {
        newest = dp.getTimestamp();
      }
    }
    if (newest != null) {
      deltaCache.maybeEvictExpired(newest);
    }

    log.trace("Translated {} data points into {}", dataPoints.size(), processed.size());
    return processed;
  }

  public List<TranslationRule> rules() {
    return rules;
  }

  // Visible for testing
  DeltaStateCache deltaCache() {
    return deltaCache;
  }
}
