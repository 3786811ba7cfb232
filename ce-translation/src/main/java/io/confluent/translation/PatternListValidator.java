package io.confluent.translation;

import io.confluent.translation.filter.StringFilter;
import java.util.Collections;
import java.util.List;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;

/**
 * Validates a list of metric name patterns, see {@link StringFilter} for the syntax. An unset
 * ({@code null}) list is valid.
 */
public class PatternListValidator implements ConfigDef.Validator {

  @Override
  public void ensureValid(String name, Object value) {
    if (value == null) {
      return;
    }
    for (Object item : (List<?>) value) {
      try {
        new StringFilter(Collections.singletonList(String.valueOf(item)));
      } catch (ConfigException e) {
        throw new ConfigException(name, item, e.getMessage());
      }
    }
  }

  @Override
  public String toString() {
    return "List of metric names, globs or /regular expressions/, optionally prefixed with !";
  }
}
