package io.confluent.translation.delta;

import com.google.common.base.Preconditions;
import io.confluent.translation.DimensionSignature;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A LastValueTracker uses a ConcurrentMap to maintain historic values for a given key, and return
 * a previous value and an Instant for that value.
 *
 * <p>Updates for the same key are linearized through {@link ConcurrentMap#compute}, updates for
 * different keys proceed independently. An entry older than the maximum age, measured against the
 * instant of the incoming value, is treated as absent.
 *
 * @param <T> The type of the value.
 */
public class LastValueTracker<T> {
  private final ConcurrentMap<DimensionSignature, InstantAndValue<T>> counters = new ConcurrentHashMap<>();
  private final Duration maxAge;

  public LastValueTracker(Duration maxAge) {
    Preconditions.checkArgument(!maxAge.isNegative() && !maxAge.isZero(), "maxAge must be positive");
    this.maxAge = maxAge;
  }

  /**
   * Store the new instant/value for the given key and return the previous one, or Optional.empty
   * if there isn't one that is still fresh.
   *
   * @param key the key for which to calculate a getAndSet.
   * @param now the timestamp for the new value.
   * @param value the current value.
   * @return the timestamp of the previous entry and its value. If there
   *     isn't a previous entry, or it has expired, then this method returns {@link Optional#empty()}
   */
  public Optional<InstantAndValue<T>> getAndSet(DimensionSignature key, Instant now, T value) {
    InstantAndValue<T> instantAndValue = new InstantAndValue<>(now, value);
    AtomicReference<InstantAndValue<T>> previous = new AtomicReference<>();
    counters.compute(key, (k, last) -> {
      previous.set(last);
      return instantAndValue;
    });

    InstantAndValue<T> last = previous.get();
    if (last == null || isExpired(last, now)) {
      return Optional.empty();
    }
    return Optional.of(last);
  }

  /**
   * Remove every entry that has expired relative to {@code now}.
   *
   * @return the number of entries removed.
   */
  public int removeExpired(Instant now) {
    int removed = 0;
    for (Map.Entry<DimensionSignature, InstantAndValue<T>> entry : counters.entrySet()) {
      // conditional remove, a concurrent update of the same key keeps its fresh value
      if (isExpired(entry.getValue(), now) && counters.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    return removed;
  }

  public InstantAndValue<T> remove(DimensionSignature key) {
    return counters.remove(key);
  }

  public int size() {
    return counters.size();
  }

  private boolean isExpired(InstantAndValue<T> entry, Instant now) {
    return Duration.between(entry.getIntervalStart(), now).compareTo(maxAge) > 0;
  }

  public static class InstantAndValue<T> {

    private final Instant intervalStart;
    private final T value;

    public InstantAndValue(Instant intervalStart, T value) {
      Preconditions.checkNotNull(intervalStart, "intervalStart cannot be null");
      Preconditions.checkNotNull(value,  "value cannot be null");
      this.intervalStart = intervalStart;
      this.value = value;
    }

    public Instant getIntervalStart() {
      return intervalStart;
    }

    public T getValue() {
      return value;
    }
  }

}
