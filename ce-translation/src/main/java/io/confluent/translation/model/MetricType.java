package io.confluent.translation.model;

/**
 * Semantics of a {@link DataPoint} value.
 *
 * <p>Only {@link #CUMULATIVE_COUNTER} points are eligible for delta and rate rules.
 */
public enum MetricType {
  /** Instantaneous measurement. */
  GAUGE,
  /** Change since the previous report. */
  COUNTER,
  /** Monotonically increasing total since process start. */
  CUMULATIVE_COUNTER
}
