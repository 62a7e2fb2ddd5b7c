package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.application.port.MetricsPort;
import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import ca.gc.cra.rulesync.domain.rules.RuleGroup;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Removes denylisted values from a merged ruleset.
 *
 * <p>A value is removed when it contains any denylist entry, ignoring case. Groups left empty are dropped;
 * logical rules are never inspected.</p>
 *
 * @since 0.1.0
 */
public final class RuleFilter {
  private final List<String> denylist;
  private final MetricsPort metrics;

  /**
   * Creates a filter.
   *
   * @param denylist substrings to reject; blank entries are ignored
   * @param metrics metrics sink for {@code filter.removed}
   */
  public RuleFilter(Collection<String> denylist, MetricsPort metrics) {
    Objects.requireNonNull(denylist, "denylist");
    List<String> needles = new ArrayList<>();
    for (String entry : denylist) {
      if (entry != null && !entry.isBlank()) {
        needles.add(entry.trim().toLowerCase(Locale.ROOT));
      }
    }
    this.denylist = List.copyOf(needles);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Filters {@code ruleset}.
   *
   * @param ruleset merged ruleset
   * @return filtered ruleset and the number of removed values
   */
  public FilterResult filter(MergedRuleset ruleset) {
    Objects.requireNonNull(ruleset, "ruleset");
    if (denylist.isEmpty()) {
      return new FilterResult(ruleset, 0);
    }
    List<RuleGroup> groups = new ArrayList<>(ruleset.groups().size());
    int removed = 0;
    for (RuleGroup group : ruleset.groups()) {
      List<String> kept = new ArrayList<>(group.size());
      for (String value : group.values()) {
        if (denied(value)) {
          removed++;
        } else {
          kept.add(value);
        }
      }
      if (!kept.isEmpty()) {
        groups.add(kept.size() == group.size() ? group : new RuleGroup(group.type(), kept));
      }
    }
    if (removed > 0) {
      metrics.observe("filter.removed", removed);
    }
    return new FilterResult(new MergedRuleset(ruleset.version(), groups, ruleset.logicalRules()), removed);
  }

  private boolean denied(String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    for (String needle : denylist) {
      if (lower.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Filtered ruleset plus the count of removed values.
   *
   * @param ruleset filtered ruleset
   * @param filteredCount values removed across all groups
   */
  public record FilterResult(MergedRuleset ruleset, int filteredCount) {
    public FilterResult {
      Objects.requireNonNull(ruleset, "ruleset");
    }
  }
}
