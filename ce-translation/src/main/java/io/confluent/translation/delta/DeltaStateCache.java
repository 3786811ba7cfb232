package io.confluent.translation.delta;

import io.confluent.translation.DimensionSignature;
import io.confluent.translation.delta.LastValueTracker.InstantAndValue;
import io.confluent.translation.model.Datum;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Previous observations of cumulative series, used by the delta and rate translation rules.
 *
 * <p>One cache belongs to one translator instance and is shared by every batch that translator
 * handles. Entries that have not been updated for longer than the configured maximum age are
 * treated as absent, and are dropped by {@link #evictExpired(Instant)}.
 */
public class DeltaStateCache {

  private static final Logger log = LoggerFactory.getLogger(DeltaStateCache.class);

  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  private final Duration maxAge;
  private final LastValueTracker<Double> rates;
  private final LastValueTracker<Datum> deltas;
  private volatile Instant lastEviction;

  public DeltaStateCache(Duration maxAge) {
    this.maxAge = maxAge;
    this.rates = new LastValueTracker<>(maxAge);
    this.deltas = new LastValueTracker<>(maxAge);
  }

  /**
   * Record {@code value} for the series and return its rate of change per second since the
   * previous observation.
   *
   * <p>Returns empty on the first observation of a series, after the previous observation expired,
   * and when the elapsed time is not strictly positive. The new observation is stored in every case.
   */
  public Optional<Double> lookupAndUpdate(DimensionSignature signature, double value, Instant timestamp) {
    Optional<InstantAndValue<Double>> previous = rates.getAndSet(signature, timestamp, value);
    if (!previous.isPresent()) {
      return Optional.empty();
    }

    double elapsedSeconds = elapsedSeconds(previous.get().getIntervalStart(), timestamp);
    if (elapsedSeconds <= 0) {
      log.debug("Skipping rate for {}, timestamp {} is not after {}",
          signature, timestamp, previous.get().getIntervalStart());
      return Optional.empty();
    }
    return Optional.of((value - previous.get().getValue()) / elapsedSeconds);
  }

  /**
   * Record {@code value} for the series and return the difference to the previous observation.
   *
   * <p>The delta is an int when both observations are ints, a double otherwise. Returns empty
   * under the same conditions as {@link #lookupAndUpdate(DimensionSignature, double, Instant)}.
   */
  public Optional<Datum> delta(DimensionSignature signature, Datum value, Instant timestamp) {
    Optional<InstantAndValue<Datum>> previous = deltas.getAndSet(signature, timestamp, value);
    if (!previous.isPresent()) {
      return Optional.empty();
    }

    if (!timestamp.isAfter(previous.get().getIntervalStart())) {
      log.debug("Skipping delta for {}, timestamp {} is not after {}",
          signature, timestamp, previous.get().getIntervalStart());
      return Optional.empty();
    }

    Datum last = previous.get().getValue();
    if (value.isInt() && last.isInt()) {
      return Optional.of(Datum.ofInt(value.intValue() - last.intValue()));
    }
    return Optional.of(Datum.ofDouble(value.doubleValue() - last.doubleValue()));
  }

  /**
   * Drop every entry that has expired relative to {@code now}.
   */
  public void evictExpired(Instant now) {
    int removed = rates.removeExpired(now) + deltas.removeExpired(now);
    if (removed > 0) {
      log.debug("Evicted {} expired series from the delta cache", removed);
    }
  }

  /**
   * Like {@link #evictExpired(Instant)}, but at most once per maximum age.
   */
  public void maybeEvictExpired(Instant now) {
    Instant last = lastEviction;
    if (last == null || Duration.between(last, now).compareTo(maxAge) >= 0) {
      lastEviction = now;
      evictExpired(now);
    }
  }

  public Duration maxAge() {
    return maxAge;
  }

  public int size() {
    return rates.size() + deltas.size();
  }

  private static double elapsedSeconds(Instant from, Instant to) {
    Duration elapsed = Duration.between(from, to);
    return elapsed.getSeconds() + elapsed.getNano() / NANOS_PER_SECOND;
  }
}
