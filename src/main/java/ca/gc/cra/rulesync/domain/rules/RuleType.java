package ca.gc.cra.rulesync.domain.rules;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Canonical rule categories emitted in merged rulesets.
 * <p><strong>Why:</strong> Upstream rule lists use several proxy-client vocabularies ({@code DOMAIN-SUFFIX},
 * {@code HOST-SUFFIX}, {@code IP-CIDR6}, ...); merging requires one canonical key per category.</p>
 * <p><strong>Role:</strong> Domain value type shared by the line-list parser, the logical rule parser and the
 * rule filter.</p>
 * <p><strong>Thread-safety:</strong> Enum constants and the alias table are immutable.</p>
 *
 * @since 0.1.0
 */
public enum RuleType {
  DOMAIN("domain", "DOMAIN", "HOST"),
  DOMAIN_SUFFIX("domain_suffix", "DOMAIN-SUFFIX", "HOST-SUFFIX"),
  DOMAIN_KEYWORD("domain_keyword", "DOMAIN-KEYWORD", "HOST-KEYWORD"),
  DOMAIN_REGEX("domain_regex", "DOMAIN-REGEX", "URL-REGEX"),
  IP_CIDR("ip_cidr", "IP-CIDR", "IP-CIDR6", "IP6-CIDR"),
  SOURCE_IP_CIDR("source_ip_cidr", "SRC-IP-CIDR"),
  PORT("port", "DST-PORT"),
  SOURCE_PORT("source_port", "SRC-PORT"),
  GEOIP("geoip", "GEOIP");

  private static final Map<String, RuleType> BY_KEYWORD = buildKeywordIndex();

  private final String key;
  private final List<String> keywords;

  RuleType(String key, String... keywords) {
    this.key = key;
    this.keywords = List.of(keywords);
  }

  /**
   * Returns the canonical key written to merged rulesets (for example {@code domain_suffix}).
   *
   * @return canonical key
   */
  public String key() {
    return key;
  }

  /**
   * Returns the proxy-rule keywords that translate to this type.
   *
   * @return immutable keyword list in upper case
   */
  public List<String> keywords() {
    return keywords;
  }

  /**
   * Translates a raw keyword or canonical key into a rule type.
   *
   * <p>Lookup ignores case and surrounding whitespace, so {@code host-suffix}, {@code HOST-SUFFIX} and
   * {@code domain_suffix} all resolve to {@link #DOMAIN_SUFFIX}.</p>
   *
   * @param raw keyword as it appeared in the source; may be {@code null}
   * @return matching type, or empty when the keyword is not part of the vocabulary
   */
  public static Optional<RuleType> fromKeyword(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_KEYWORD.get(normalized));
  }

  /**
   * Returns whether {@code key} names a canonical rule type.
   *
   * @param key candidate key such as {@code ip_cidr}
   * @return {@code true} when the key is canonical
   */
  public static boolean isCanonicalKey(String key) {
    if (key == null) {
      return false;
    }
    for (RuleType type : values()) {
      if (type.key.equals(key)) {
        return true;
      }
    }
    return false;
  }

  private static Map<String, RuleType> buildKeywordIndex() {
    Map<String, RuleType> index = new HashMap<>();
    for (RuleType type : values()) {
      index.put(type.key.toUpperCase(Locale.ROOT), type);
      for (String keyword : type.keywords) {
        index.put(keyword.toUpperCase(Locale.ROOT), type);
      }
    }
    return Collections.unmodifiableMap(index);
  }
}
