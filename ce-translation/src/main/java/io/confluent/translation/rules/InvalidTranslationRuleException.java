package io.confluent.translation.rules;

/**
 * Thrown when a translation rule, or a list of rules, cannot be constructed.
 */
public class InvalidTranslationRuleException extends RuntimeException {

  public InvalidTranslationRuleException(String message) {
    super(message);
  }

  public InvalidTranslationRuleException(String message, Throwable cause) {
    super(message, cause);
  }
}
