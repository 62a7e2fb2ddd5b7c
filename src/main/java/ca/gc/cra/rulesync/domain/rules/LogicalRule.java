package ca.gc.cra.rulesync.domain.rules;

import java.util.List;
import java.util.Objects;

/**
 * Compound rule whose conditions must all hold.
 *
 * <p>Logical rules are kept structurally. They are never folded into the per-type value sets and are
 * emitted after every {@link RuleGroup} of a merged ruleset.</p>
 *
 * @param mode composition mode; only {@code and} is produced by the parsers
 * @param conditions ordered conditions, copied defensively
 * @since 0.1.0
 */
public record LogicalRule(String mode, List<RuleCondition> conditions) {
  /** Composition mode emitted for {@code AND,((...),(...))} proxy lines. */
  public static final String MODE_AND = "and";

  public LogicalRule {
    Objects.requireNonNull(mode, "mode");
    conditions = List.copyOf(Objects.requireNonNull(conditions, "conditions"));
  }

  /**
   * Creates an {@code and} rule over the supplied conditions.
   *
   * @param conditions ordered conditions
   * @return logical rule in {@code and} mode
   */
  public static LogicalRule and(List<RuleCondition> conditions) {
    return new LogicalRule(MODE_AND, conditions);
  }
}
