package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.domain.source.Source;
import ca.gc.cra.rulesync.domain.source.SourceKind;
import ca.gc.cra.rulesync.validation.Strings;
import java.util.Locale;

/**
 * Decides the payload family of a source from its URL alone.
 *
 * <p>URLs ending in {@code .json}, {@code .jsonl} or {@code .list}, or mentioning {@code json} anywhere, are
 * {@link SourceKind#STRUCTURED_FRAGMENT}s; everything else is a {@link SourceKind#LINE_LIST}. A fragment that
 * turns out not to be JSON is re-read as a line list by {@link RulesetMerger}.</p>
 *
 * @since 0.1.0
 */
public final class SourceClassifier {
  private SourceClassifier() {}

  /**
   * Classifies {@code url}.
   *
   * @param url source URL; must not be blank
   * @return source tagged with its kind
   * @throws IllegalArgumentException when {@code url} is blank
   */
  public static Source classify(String url) {
    String trimmed = Strings.requireNonBlank("url", url);
    String lower = trimmed.toLowerCase(Locale.ROOT);
    boolean fragment = lower.endsWith(".json")
        || lower.endsWith(".jsonl")
        || lower.endsWith(".list")
        || lower.contains("json");
    return new Source(trimmed, fragment ? SourceKind.STRUCTURED_FRAGMENT : SourceKind.LINE_LIST);
  }
}
