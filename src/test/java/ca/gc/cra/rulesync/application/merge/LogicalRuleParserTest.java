package ca.gc.cra.rulesync.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rulesync.domain.rules.LogicalRule;
import ca.gc.cra.rulesync.domain.rules.RuleCondition;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LogicalRuleParserTest {

  @Test
  void parsesAndLineIntoConditions() {
    Optional<LogicalRule> rule = LogicalRuleParser.parse("AND,((DOMAIN,foo.com),(DST-PORT,443)),PROXY");

    assertEquals(
        Optional.of(new LogicalRule("and", List.of(new RuleCondition("domain", "foo.com"),
            new RuleCondition("port", "443")))),
        rule);
  }

  @Test
  void dropsComponentsWithUnknownKeyword() {
    LogicalRule rule = LogicalRuleParser.parse("AND,((PROCESS-NAME,curl),(HOST-SUFFIX,bar.org))").orElseThrow();

    assertEquals(List.of(new RuleCondition("domain_suffix", "bar.org")), rule.conditions());
  }

  @Test
  void noMappableComponentYieldsNothing() {
    assertTrue(LogicalRuleParser.parse("AND,((PROCESS-NAME,curl))").isEmpty());
  }

  @Test
  void detectsAndToken() {
    assertTrue(LogicalRuleParser.isLogicalLine("AND,((DOMAIN,a.com))"));
    assertTrue(LogicalRuleParser.isLogicalLine("and ,((DOMAIN,a.com))"));
    assertFalse(LogicalRuleParser.isLogicalLine("DOMAIN,android.com"));
    assertFalse(LogicalRuleParser.isLogicalLine("ANDROID.COM"));
  }
}
