package io.confluent.translation;

import com.google.protobuf.Timestamp;
import java.math.BigDecimal;
import java.time.Instant;

public class MetricsUtils {

  public static Timestamp toTimestamp(Instant instant) {
    return Timestamp.newBuilder()
        .setSeconds(instant.getEpochSecond())
        .setNanos(instant.getNano())
        .build();
  }

  public static Instant toInstant(Timestamp timestamp) {
    return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
  }

  /**
   * Shortest plain decimal form of {@code value}, e.g. {@code 10} for 10.0 and {@code 0.25} for
   * 0.25. Infinite values are rendered as {@code +Inf} and {@code -Inf}.
   */
  public static String formatDimensionValue(double value) {
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    if (Double.isNaN(value)) {
      return "NaN";
    }
    BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
    return decimal.signum() == 0 ? "0" : decimal.toPlainString();
  }
}
