package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.domain.rules.LogicalRule;
import ca.gc.cra.rulesync.domain.rules.RuleCondition;
import ca.gc.cra.rulesync.domain.rules.RuleType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates proxy-client {@code AND,((KEYWORD,value),(KEYWORD,value)),POLICY} lines into {@link LogicalRule}s.
 *
 * <p>Only the innermost parenthesised components are considered. Each is split at its first comma; the
 * keyword is mapped through {@link RuleType#fromKeyword(String)} and components with an unmapped keyword are
 * dropped.</p>
 */
final class LogicalRuleParser {
  private static final Logger log = LoggerFactory.getLogger(LogicalRuleParser.class);
  private static final Pattern COMPONENT = Pattern.compile("\\(([^()]*)\\)");
  static final String AND_TOKEN = "AND";

  private LogicalRuleParser() {}

  /**
   * Reports whether a proxy line is an {@code AND} compound rule.
   *
   * @param line trimmed, non-comment line
   * @return {@code true} when the first comma-separated field is the {@code AND} token
   */
  static boolean isLogicalLine(String line) {
    int comma = line.indexOf(',');
    String head = comma < 0 ? line : line.substring(0, comma);
    return AND_TOKEN.equals(head.trim().toUpperCase(Locale.ROOT));
  }

  static Optional<LogicalRule> parse(String line) {
    List<RuleCondition> conditions = new ArrayList<>();
    Matcher matcher = COMPONENT.matcher(line);
    while (matcher.find()) {
      String component = matcher.group(1);
      int comma = component.indexOf(',');
      if (comma <= 0) {
        continue;
      }
      String keyword = component.substring(0, comma);
      String value = component.substring(comma + 1).trim();
      Optional<RuleType> type = RuleType.fromKeyword(keyword);
      if (type.isEmpty() || value.isEmpty()) {
        log.debug("Dropping logical component with unmapped keyword {}", keyword.trim());
        continue;
      }
      conditions.add(new RuleCondition(type.get().key(), value));
    }
    if (conditions.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(LogicalRule.and(conditions));
  }
}
