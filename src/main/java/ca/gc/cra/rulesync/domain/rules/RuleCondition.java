package ca.gc.cra.rulesync.domain.rules;

import java.util.Objects;

/**
 * Single {@code type: value} condition inside a {@link LogicalRule}.
 *
 * @param type canonical rule key (for example {@code domain} or {@code port})
 * @param value condition value as written in the source
 */
public record RuleCondition(String type, String value) {
  public RuleCondition {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type must not be blank");
    }
  }
}
