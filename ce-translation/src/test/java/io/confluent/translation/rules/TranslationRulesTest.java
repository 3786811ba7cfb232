package io.confluent.translation.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.Test;

public class TranslationRulesTest {

  private static final String ALL_ACTIONS = "{\"translation_rules\": ["
      + "{\"action\": \"rename_dimension_keys\", \"mapping\": {\"a\": \"b\"}, \"metric_names\": [\"m\"]},"
      + "{\"action\": \"rename_metrics\", \"mapping\": {\"a\": \"b\"}},"
      + "{\"action\": \"multiply_int\", \"scale_factors_int\": {\"m\": 1000}},"
      + "{\"action\": \"divide_int\", \"scale_factors_int\": {\"m\": 1024}},"
      + "{\"action\": \"multiply_float\", \"scale_factors_float\": {\"m\": 0.001}},"
      + "{\"action\": \"convert_values\", \"types_mapping\": {\"m\": \"int\", \"n\": \"double\"}},"
      + "{\"action\": \"copy_metrics\", \"mapping\": {\"a\": \"b\"}, \"dimension_key\": \"k\", \"dimension_values\": [\"v\"]},"
      + "{\"action\": \"split_metric\", \"metric_name\": \"m\", \"dimension_key\": \"k\", \"mapping\": {\"v\": \"m.v\"}},"
      + "{\"action\": \"aggregate_metric\", \"metric_name\": \"m\", \"aggregation_method\": \"avg\", \"without_dimensions\": [\"k\"]},"
      + "{\"action\": \"calculate_new_metric\", \"metric_name\": \"r\", \"operand1_metric\": \"a\", \"operand2_metric\": \"b\", \"operator\": \"-\"},"
      + "{\"action\": \"compute_utilization\", \"metric_name\": \"u\", \"used_metric\": \"used\", \"free_metrics\": [\"free\"]},"
      + "{\"action\": \"delta_metric\", \"mapping\": {\"a\": \"a.delta\"}},"
      + "{\"action\": \"compute_rate\", \"mapping\": {\"a\": \"a.rate\"}},"
      + "{\"action\": \"drop_dimensions\", \"dimension_keys\": [\"k\"]},"
      + "{\"action\": \"drop_metrics\", \"metric_names\": [\"m\"]}"
      + "]}";

  @Test
  public void parseEveryAction() {
    TranslationRules rules = TranslationRules.parse(ALL_ACTIONS);

    List<RuleAction> actions = rules.rules().stream()
        .map(TranslationRule::action)
        .collect(Collectors.toList());
    assertThat(actions).containsExactly(RuleAction.values());
  }

  @Test
  public void loadDefaultRules() {
    TranslationRules rules = TranslationRules.loadDefaultRules();

    assertThat(rules.rules()).isNotEmpty();
    assertThat(rules.rules().get(0)).isInstanceOf(DeltaMetricRule.class);
  }

  @Test
  public void concat() {
    TranslationRules first = TranslationRules.parse(
        "{\"translation_rules\": [{\"action\": \"rename_metrics\", \"mapping\": {\"a\": \"b\"}}]}");
    TranslationRules second = TranslationRules.parse(
        "{\"translation_rules\": [{\"action\": \"drop_metrics\", \"metric_names\": [\"b\"]}]}");

    assertThat(first.concat(second).rules())
        .extracting(TranslationRule::action)
        .containsExactly(RuleAction.RENAME_METRICS, RuleAction.DROP_METRICS);
  }

  @Test
  public void unknownActionFails() {
    assertThatThrownBy(() -> TranslationRules.parse(
        "{\"translation_rules\": [{\"action\": \"explode\", \"mapping\": {\"a\": \"b\"}}]}"))
        .isInstanceOf(InvalidTranslationRuleException.class);
  }

  @Test
  public void unknownPropertyFails() {
    assertThatThrownBy(() -> TranslationRules.parse(
        "{\"translation_rules\": [{\"action\": \"rename_metrics\", \"mapping\": {\"a\": \"b\"}, \"bogus\": 1}]}"))
        .isInstanceOf(InvalidTranslationRuleException.class);
  }

  @Test
  public void missingArgumentFails() {
    assertThatThrownBy(() -> TranslationRules.parse(
        "{\"translation_rules\": [{\"action\": \"rename_metrics\"}]}"))
        .isInstanceOf(InvalidTranslationRuleException.class)
        .hasStackTraceContaining("\"mapping\" must be provided for \"rename_metrics\" translation rule");
  }

  @Test
  public void unknownAggregationMethodFails() {
    assertThatThrownBy(() -> TranslationRules.parse(
        "{\"translation_rules\": [{\"action\": \"aggregate_metric\", \"metric_name\": \"m\", "
            + "\"aggregation_method\": \"median\", \"without_dimensions\": [\"k\"]}]}"))
        .isInstanceOf(InvalidTranslationRuleException.class);
  }

  @Test
  public void unknownOperatorFails() {
    assertThatThrownBy(() -> TranslationRules.parse(
        "{\"translation_rules\": [{\"action\": \"calculate_new_metric\", \"metric_name\": \"r\", "
            + "\"operand1_metric\": \"a\", \"operand2_metric\": \"b\", \"operator\": \"%\"}]}"))
        .isInstanceOf(InvalidTranslationRuleException.class);
  }

  @Test
  public void zeroDivisorFails() {
    assertThatThrownBy(() -> TranslationRules.parse(
        "{\"translation_rules\": [{\"action\": \"divide_int\", \"scale_factors_int\": {\"m\": 0}}]}"))
        .isInstanceOf(InvalidTranslationRuleException.class)
        .hasStackTraceContaining("must not be zero");
  }

  @Test
  public void missingRuleListFails() {
    assertThatThrownBy(() -> TranslationRules.parse("{}"))
        .isInstanceOf(InvalidTranslationRuleException.class);
  }

  @Test
  public void missingResourceFails() {
    assertThatThrownBy(() -> TranslationRules.load(getClass().getClassLoader(), "no_such_rules.json"))
        .isInstanceOf(InvalidTranslationRuleException.class)
        .hasMessageContaining("no_such_rules.json");
  }
}
