package ca.gc.cra.rulesync.domain.rules;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Finalized ruleset document handed to the output writer.
 * <p><strong>Why:</strong> Captures the merge result in a form whose ordering is fully determined by its
 * content, so re-running a sync over the same sources yields byte-identical output.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Each rule type appears in at most one group.</li>
 *   <li>A {@code domain} group, when present, is the first group.</li>
 *   <li>Logical rules follow every group and are never deduplicated.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param version ruleset format version written to the output document
 * @param groups per-type value groups in emission order
 * @param logicalRules compound rules in encounter order
 * @since 0.1.0
 */
public record MergedRuleset(int version, List<RuleGroup> groups, List<LogicalRule> logicalRules) {

  public MergedRuleset {
    groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
    logicalRules = List.copyOf(Objects.requireNonNull(logicalRules, "logicalRules"));
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < groups.size(); i++) {
      String type = groups.get(i).type();
      if (!seen.add(type)) {
        throw new IllegalArgumentException("duplicate rule type: " + type);
      }
      if (i > 0 && RuleType.DOMAIN.key().equals(type)) {
        throw new IllegalArgumentException("domain group must be first");
      }
    }
  }

  /**
   * Returns an empty ruleset for the supplied version.
   *
   * @param version format version
   * @return ruleset with no groups and no logical rules
   */
  public static MergedRuleset empty(int version) {
    return new MergedRuleset(version, List.of(), List.of());
  }

  /**
   * Looks up the group for a rule type key.
   *
   * @param type canonical key
   * @return group when present
   */
  public Optional<RuleGroup> group(String type) {
    for (RuleGroup group : groups) {
      if (group.type().equals(type)) {
        return Optional.of(group);
      }
    }
    return Optional.empty();
  }

  /**
   * Counts scalar values across groups plus one per logical rule.
   *
   * @return total rule count
   */
  public long ruleCount() {
    long count = logicalRules.size();
    for (RuleGroup group : groups) {
      count += group.size();
    }
    return count;
  }

  /**
   * Per-type value counts in emission order; logical rules are reported under {@code logical}.
   *
   * @return ordered breakdown
   */
  public Map<String, Integer> typeBreakdown() {
    Map<String, Integer> breakdown = new LinkedHashMap<>();
    for (RuleGroup group : groups) {
      breakdown.put(group.type(), group.size());
    }
    if (!logicalRules.isEmpty()) {
      breakdown.put("logical", logicalRules.size());
    }
    return breakdown;
  }

  /**
   * Indicates whether the ruleset carries no rules at all.
   *
   * @return {@code true} when there are no groups and no logical rules
   */
  public boolean isEmpty() {
    return groups.isEmpty() && logicalRules.isEmpty();
  }

  /**
   * Returns a copy with a different version.
   *
   * @param newVersion replacement version
   * @return ruleset sharing the same rules
   */
  public MergedRuleset withVersion(int newVersion) {
    return new MergedRuleset(newVersion, groups, logicalRules);
  }
}
