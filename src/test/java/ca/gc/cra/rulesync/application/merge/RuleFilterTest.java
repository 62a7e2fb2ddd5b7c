package ca.gc.cra.rulesync.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rulesync.domain.rules.LogicalRule;
import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import ca.gc.cra.rulesync.domain.rules.RuleCondition;
import ca.gc.cra.rulesync.domain.rules.RuleGroup;
import ca.gc.cra.rulesync.testutil.RecordingMetrics;
import java.util.List;
import org.junit.jupiter.api.Test;

class RuleFilterTest {

  @Test
  void removesDenylistedValuesAcrossGroups() {
    RecordingMetrics metrics = new RecordingMetrics();
    RuleFilter filter = new RuleFilter(List.of("ruleset.skk.moe"), metrics);
    MergedRuleset ruleset = new MergedRuleset(
        1,
        List.of(
            new RuleGroup("domain", List.of("openai.com", "ruleset.skk.moe")),
            new RuleGroup("domain_suffix", List.of("sub.RULESET.skk.moe"))),
        List.of());

    RuleFilter.FilterResult result = filter.filter(ruleset);

    assertEquals(2, result.filteredCount());
    assertEquals(List.of(new RuleGroup("domain", List.of("openai.com"))), result.ruleset().groups());
    assertEquals(List.of(2L), metrics.observed("filter.removed"));
  }

  @Test
  void logicalRulesAreNotInspected() {
    LogicalRule logical = LogicalRule.and(List.of(new RuleCondition("domain", "ruleset.skk.moe")));
    MergedRuleset ruleset = new MergedRuleset(1, List.of(), List.of(logical));

    RuleFilter.FilterResult result = new RuleFilter(List.of("skk"), new RecordingMetrics()).filter(ruleset);

    assertEquals(0, result.filteredCount());
    assertEquals(List.of(logical), result.ruleset().logicalRules());
  }

  @Test
  void emptyDenylistReturnsInput() {
    MergedRuleset ruleset = new MergedRuleset(1, List.of(new RuleGroup("domain", List.of("a.com"))), List.of());
    RecordingMetrics metrics = new RecordingMetrics();

    RuleFilter.FilterResult result = new RuleFilter(List.of(" ", ""), metrics).filter(ruleset);

    assertSame(ruleset, result.ruleset());
    assertTrue(metrics.observed("filter.removed").isEmpty());
  }
}
