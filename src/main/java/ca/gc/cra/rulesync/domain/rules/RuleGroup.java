package ca.gc.cra.rulesync.domain.rules;

import java.util.List;
import java.util.Objects;

/**
 * Unique values collected for one rule type.
 *
 * @param type canonical rule key, or an unrecognised key carried through from a structured fragment
 * @param values distinct values in lexicographic order
 */
public record RuleGroup(String type, List<String> values) {
  public RuleGroup {
    Objects.requireNonNull(type, "type");
    values = List.copyOf(Objects.requireNonNull(values, "values"));
  }

  /**
   * Returns the number of values held by the group.
   *
   * @return value count
   */
  public int size() {
    return values.size();
  }
}
