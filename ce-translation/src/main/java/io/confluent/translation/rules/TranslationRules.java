package io.confluent.translation.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import io.confluent.translation.utils.JsonMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * An ordered list of translation rules, as read from a JSON document of the form
 * {@code {"translation_rules": [{"action": "...", ...}, ...]}}.
 *
 * <p>The built-in rules are defined in the JSON file `default_translation_rules.json`.
 */
public class TranslationRules {

  private static final String DEFAULT_RULES_FILE = "default_translation_rules.json";

  private final List<TranslationRule> rules;

  @JsonCreator
  public TranslationRules(@JsonProperty("translation_rules") List<TranslationRule> rules) {
    if (rules == null) {
      throw new InvalidTranslationRuleException("\"translation_rules\" must be provided");
    }
    for (TranslationRule rule : rules) {
      if (rule == null) {
        throw new InvalidTranslationRuleException("\"translation_rules\" must not contain null entries");
      }
    }
    this.rules = ImmutableList.copyOf(rules);
  }

  public List<TranslationRule> rules() {
    return rules;
  }

  /**
   * Concatenation of these rules followed by {@code other}.
   */
  public TranslationRules concat(TranslationRules other) {
    return new TranslationRules(ImmutableList.<TranslationRule>builder()
        .addAll(rules)
        .addAll(other.rules)
        .build());
  }

  public static TranslationRules loadDefaultRules() throws InvalidTranslationRuleException {
    return load(TranslationRules.class.getClassLoader(), DEFAULT_RULES_FILE);
  }

  public static TranslationRules load(ClassLoader classLoader, String rulesResourceName)
      throws InvalidTranslationRuleException {
    InputStream stream = classLoader.getResourceAsStream(rulesResourceName);
    if (stream == null) {
      throw new InvalidTranslationRuleException("Translation rules resource " + rulesResourceName + " not found");
    }
    try {
      try (BufferedReader reader =
          new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
        return JsonMapper.objectMapper().readValue(reader, TranslationRules.class);
      }
    } catch (IOException e) {
      throw new InvalidTranslationRuleException("Translation rules could not be loaded from " + rulesResourceName, e);
    }
  }

  public static TranslationRules parse(String json) throws InvalidTranslationRuleException {
    try {
      return JsonMapper.objectMapper().readValue(json, TranslationRules.class);
    } catch (IOException e) {
      throw new InvalidTranslationRuleException("Translation rules could not be parsed: " + e.getMessage(), e);
    }
  }
}
