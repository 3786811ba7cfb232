package io.confluent.translation.model;

import java.util.Objects;

/**
 * The numeric value of a {@link DataPoint}: exactly one of an int64 or a double.
 *
 * <p>Equality is kind sensitive, {@code Datum.ofInt(1)} is not equal to {@code Datum.ofDouble(1.0)}.
 */
public final class Datum {

  private final Long intValue;
  private final Double doubleValue;

  private Datum(Long intValue, Double doubleValue) {
    this.intValue = intValue;
    this.doubleValue = doubleValue;
  }

  public static Datum ofInt(long value) {
    return new Datum(value, null);
  }

  public static Datum ofDouble(double value) {
    return new Datum(null, value);
  }

  public boolean isInt() {
    return intValue != null;
  }

  public boolean isDouble() {
    return doubleValue != null;
  }

  /**
   * @throws IllegalStateException if this is a double datum
   */
  public long intValue() {
    if (intValue == null) {
      throw new IllegalStateException("datum holds a double value: " + doubleValue);
    }
    return intValue;
  }

  /**
   * The value as a double, promoting int values.
   */
  public double doubleValue() {
    return doubleValue != null ? doubleValue : intValue.doubleValue();
  }

  public Datum toDouble() {
    return isDouble() ? this : ofDouble(intValue.doubleValue());
  }

  public Datum toInt() {
    return isInt() ? this : ofInt(doubleValue.longValue());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Datum datum = (Datum) o;
    return Objects.equals(intValue, datum.intValue) &&
        Objects.equals(doubleValue, datum.doubleValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(intValue, doubleValue);
  }

  @Override
  public String toString() {
    return isInt() ? intValue + "i" : String.valueOf(doubleValue);
  }
}
