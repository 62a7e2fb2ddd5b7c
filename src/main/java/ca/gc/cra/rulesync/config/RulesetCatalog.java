package ca.gc.cra.rulesync.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named rulesets and their source URLs, in catalog order.
 *
 * @param rulesets ruleset name to source URLs
 * @since 0.1.0
 */
public record RulesetCatalog(Map<String, List<String>> rulesets) {
  public RulesetCatalog {
    Objects.requireNonNull(rulesets, "rulesets");
    Map<String, List<String>> copy = new LinkedHashMap<>();
    rulesets.forEach((name, urls) -> copy.put(name, List.copyOf(urls)));
    rulesets = Collections.unmodifiableMap(copy);
  }

  /**
   * Restricts the catalog to {@code names}, keeping catalog order.
   *
   * @param names ruleset names to keep; empty keeps everything
   * @return filtered catalog
   * @throws IllegalArgumentException when a requested name is not in the catalog
   */
  public RulesetCatalog select(Collection<String> names) {
    Objects.requireNonNull(names, "names");
    if (names.isEmpty()) {
      return this;
    }
    for (String name : names) {
      if (!rulesets.containsKey(name)) {
        throw new IllegalArgumentException("Unknown ruleset in only=: " + name);
      }
    }
    Set<String> wanted = Set.copyOf(names);
    Map<String, List<String>> selected = new LinkedHashMap<>();
    rulesets.forEach((name, urls) -> {
      if (wanted.contains(name)) {
        selected.put(name, urls);
      }
    });
    return new RulesetCatalog(selected);
  }

  /**
   * Number of source URLs across every ruleset.
   *
   * @return total URL count
   */
  public int sourceCount() {
    int count = 0;
    for (List<String> urls : rulesets.values()) {
      count += urls.size();
    }
    return count;
  }
}
