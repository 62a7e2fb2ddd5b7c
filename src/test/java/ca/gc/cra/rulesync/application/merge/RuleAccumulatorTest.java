package ca.gc.cra.rulesync.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rulesync.domain.rules.LogicalRule;
import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import ca.gc.cra.rulesync.domain.rules.RuleCondition;
import ca.gc.cra.rulesync.domain.rules.RuleGroup;
import java.util.List;
import org.junit.jupiter.api.Test;

class RuleAccumulatorTest {

  @Test
  void deduplicatesAndSortsWithinType() {
    RuleAccumulator acc = new RuleAccumulator();
    acc.add("domain_suffix", "b.com");
    acc.add("domain_suffix", " a.com ");
    acc.add("domain_suffix", "b.com");
    acc.add("domain_suffix", "   ");

    MergedRuleset ruleset = acc.finish(1);

    assertEquals(List.of(new RuleGroup("domain_suffix", List.of("a.com", "b.com"))), ruleset.groups());
    assertEquals(3, acc.acceptedValues());
  }

  @Test
  void ordersDomainFirstThenVocabularyThenUnknownAlphabetically() {
    RuleAccumulator acc = new RuleAccumulator();
    acc.add("zeta_custom", "z");
    acc.add("port", "443");
    acc.add("alpha_custom", "a");
    acc.add("ip_cidr", "10.0.0.0/8");
    acc.add("domain", "x.com");
    acc.add("domain_suffix", "y.com");

    List<String> types = acc.finish(1).groups().stream().map(RuleGroup::type).toList();

    assertEquals(List.of("domain", "domain_suffix", "ip_cidr", "port", "alpha_custom", "zeta_custom"), types);
  }

  @Test
  void flushesAcrossBatchBoundary() {
    RuleAccumulator acc = new RuleAccumulator();
    for (int i = 0; i < RuleAccumulator.BATCH_SIZE * 2 + 5; i++) {
      acc.add("domain", "host" + (i % (RuleAccumulator.BATCH_SIZE + 1)) + ".com");
    }

    MergedRuleset ruleset = acc.finish(1);

    assertEquals(RuleAccumulator.BATCH_SIZE + 1, ruleset.group("domain").orElseThrow().size());
  }

  @Test
  void logicalRulesAreKeptAndOrderedByContent() {
    LogicalRule second = LogicalRule.and(List.of(new RuleCondition("port", "443")));
    LogicalRule first = LogicalRule.and(List.of(new RuleCondition("domain", "a.com")));
    RuleAccumulator acc = new RuleAccumulator();
    acc.addLogical(second);
    acc.addLogical(first);
    acc.addLogical(first);

    assertFalse(acc.isEmpty());
    assertEquals(List.of(first, first, second), acc.finish(1).logicalRules());
  }

  @Test
  void addAllUnionsOtherAccumulator() {
    RuleAccumulator left = new RuleAccumulator();
    left.add("domain", "a.com");
    RuleAccumulator right = new RuleAccumulator();
    right.add("domain", "a.com");
    right.add("domain", "b.com");

    left.addAll(right);

    assertEquals(List.of("a.com", "b.com"), left.finish(3).group("domain").orElseThrow().values());
    assertEquals(3, left.acceptedValues());
  }

  @Test
  void freshAccumulatorIsEmpty() {
    RuleAccumulator acc = new RuleAccumulator();
    assertTrue(acc.isEmpty());
    assertTrue(acc.finish(1).isEmpty());
  }
}
