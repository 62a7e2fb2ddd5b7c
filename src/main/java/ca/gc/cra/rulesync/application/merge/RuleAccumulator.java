package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.domain.rules.LogicalRule;
import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import ca.gc.cra.rulesync.domain.rules.RuleCondition;
import ca.gc.cra.rulesync.domain.rules.RuleGroup;
import ca.gc.cra.rulesync.domain.rules.RuleType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Mutable fold target for one merge invocation.
 * <p><strong>Why:</strong> Every ruleset merge owns its accumulator, so independent rulesets can be merged on
 * separate threads without shared state.</p>
 * <p><strong>Memory:</strong> Values are staged in a buffer of {@link #BATCH_SIZE} entries and flushed into the
 * per-type sets, which caps the transient footprint of a very long value array.</p>
 * <p><strong>Ordering:</strong> {@link #finish(int)} orders groups {@code domain} first, then the remaining
 * canonical types in {@link RuleType} declaration order, then unrecognised types alphabetically. Logical rules
 * are stably ordered by their content. The result therefore does not depend on the order in which payloads
 * were folded.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the merging thread.</p>
 *
 * @since 0.1.0
 */
public final class RuleAccumulator {
  static final int BATCH_SIZE = 1000;

  private final Map<String, Set<String>> valuesByType = new HashMap<>();
  private final List<LogicalRule> logicalRules = new ArrayList<>();
  private final List<String> pending = new ArrayList<>(BATCH_SIZE);
  private String pendingType;
  private long accepted;

  /**
   * Adds one value under {@code type}. Blank values are ignored.
   *
   * @param type rule key
   * @param value rule value; trimmed before insertion
   */
  public void add(String type, String value) {
    Objects.requireNonNull(type, "type");
    if (value == null) {
      return;
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return;
    }
    if (pendingType != null && !pendingType.equals(type)) {
      flush();
    }
    pendingType = type;
    pending.add(trimmed);
    accepted++;
    if (pending.size() >= BATCH_SIZE) {
      flush();
    }
  }

  /**
   * Appends a logical rule; logical rules are never deduplicated.
   *
   * @param rule compound rule
   */
  public void addLogical(LogicalRule rule) {
    logicalRules.add(Objects.requireNonNull(rule, "rule"));
  }

  /**
   * Folds everything collected by {@code other} into this accumulator.
   *
   * @param other accumulator holding one source's rules
   */
  public void addAll(RuleAccumulator other) {
    other.flush();
    flush();
    for (Map.Entry<String, Set<String>> entry : other.valuesByType.entrySet()) {
      valuesByType.computeIfAbsent(entry.getKey(), key -> new HashSet<>()).addAll(entry.getValue());
    }
    logicalRules.addAll(other.logicalRules);
    accepted += other.accepted;
  }

  /**
   * Number of values offered so far, duplicates included.
   *
   * @return accepted value count
   */
  public long acceptedValues() {
    return accepted;
  }

  /**
   * Indicates whether nothing has been collected.
   *
   * @return {@code true} when no value and no logical rule was added
   */
  public boolean isEmpty() {
    return accepted == 0 && logicalRules.isEmpty();
  }

  /**
   * Produces the finalized ruleset.
   *
   * @param version format version to stamp
   * @return merged ruleset with sorted unique values
   */
  public MergedRuleset finish(int version) {
    flush();
    List<String> types = new ArrayList<>(valuesByType.keySet());
    types.sort(Comparator.comparingInt(RuleAccumulator::typeRank).thenComparing(Comparator.naturalOrder()));
    List<RuleGroup> groups = new ArrayList<>(types.size());
    for (String type : types) {
      Set<String> values = valuesByType.get(type);
      if (!values.isEmpty()) {
        groups.add(new RuleGroup(type, SortedValues.sort(values)));
      }
    }
    List<LogicalRule> logical = new ArrayList<>(logicalRules);
    logical.sort(Comparator.comparing(RuleAccumulator::logicalSortKey));
    return new MergedRuleset(version, groups, logical);
  }

  private void flush() {
    if (pending.isEmpty()) {
      return;
    }
    valuesByType.computeIfAbsent(pendingType, key -> new HashSet<>()).addAll(pending);
    pending.clear();
  }

  private static int typeRank(String type) {
    for (RuleType candidate : RuleType.values()) {
      if (candidate.key().equals(type)) {
        return candidate.ordinal();
      }
    }
    return RuleType.values().length;
  }

  private static String logicalSortKey(LogicalRule rule) {
    StringBuilder key = new StringBuilder(rule.mode());
    for (RuleCondition condition : rule.conditions()) {
      key.append('\u0000').append(condition.type()).append('\u0001').append(condition.value());
    }
    return key.toString();
  }
}
