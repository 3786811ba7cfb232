package io.confluent.translation.model;

import java.util.Objects;

/**
 * A single key/value dimension attached to a {@link DataPoint}, e.g. {@code host=host0}.
 */
public final class Dimension {

  private final String key;
  private final String value;

  public Dimension(String key, String value) {
    this.key = Objects.requireNonNull(key, "key");
    this.value = Objects.requireNonNull(value, "value");
  }

  public static Dimension of(String key, String value) {
    return new Dimension(key, value);
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Dimension that = (Dimension) o;
    return key.equals(that.key) && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}
