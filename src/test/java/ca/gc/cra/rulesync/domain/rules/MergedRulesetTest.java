package ca.gc.cra.rulesync.domain.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MergedRulesetTest {

  @Test
  void countsValuesAndLogicalRules() {
    MergedRuleset ruleset = new MergedRuleset(
        2,
        List.of(new RuleGroup("domain", List.of("a.com", "b.com")), new RuleGroup("ip_cidr", List.of("1.1.1.1/32"))),
        List.of(LogicalRule.and(List.of(new RuleCondition("domain", "x.com"), new RuleCondition("port", "443")))));

    assertEquals(4, ruleset.ruleCount());
    assertEquals(Map.of("domain", 2, "ip_cidr", 1, "logical", 1), ruleset.typeBreakdown());
    assertEquals(List.of("domain", "ip_cidr", "logical"), List.copyOf(ruleset.typeBreakdown().keySet()));
    assertEquals(List.of("1.1.1.1/32"), ruleset.group("ip_cidr").orElseThrow().values());
    assertTrue(ruleset.group("port").isEmpty());
    assertEquals(5, ruleset.withVersion(5).version());
  }

  @Test
  void rejectsDuplicateTypes() {
    assertThrows(IllegalArgumentException.class, () -> new MergedRuleset(
        1,
        List.of(new RuleGroup("port", List.of("80")), new RuleGroup("port", List.of("443"))),
        List.of()));
  }

  @Test
  void domainGroupMustLead() {
    assertThrows(IllegalArgumentException.class, () -> new MergedRuleset(
        1,
        List.of(new RuleGroup("ip_cidr", List.of("10.0.0.0/8")), new RuleGroup("domain", List.of("a.com"))),
        List.of()));
  }

  @Test
  void emptyRulesetHasNoRules() {
    MergedRuleset empty = MergedRuleset.empty(1);
    assertTrue(empty.isEmpty());
    assertEquals(0, empty.ruleCount());
  }

  @Test
  void conditionRequiresType() {
    assertThrows(IllegalArgumentException.class, () -> new RuleCondition(" ", "a.com"));
  }
}
