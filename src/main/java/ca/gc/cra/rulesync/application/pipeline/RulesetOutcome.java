package ca.gc.cra.rulesync.application.pipeline;

import ca.gc.cra.rulesync.domain.fetch.BatchStats;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of syncing one ruleset.
 *
 * @param name ruleset name
 * @param success whether a JSON artifact was written
 * @param jsonPath written JSON artifact
 * @param compiledPath compiled artifact, when compilation is enabled and succeeded
 * @param downloads download statistics, absent when the ruleset failed before downloading
 * @param mergedSources payloads folded into the ruleset
 * @param unparsableSources payloads excluded because they could not be parsed
 * @param ruleCount values plus logical rules written
 * @param typeBreakdown per-type counts in output order
 * @param filteredCount values removed by the denylist
 * @param outputBytes size of the JSON artifact
 * @param error reason the ruleset failed
 * @param compileError reason compilation failed; the JSON artifact is still kept
 * @since 0.1.0
 */
public record RulesetOutcome(
    String name,
    boolean success,
    Optional<Path> jsonPath,
    Optional<Path> compiledPath,
    Optional<BatchStats> downloads,
    int mergedSources,
    int unparsableSources,
    long ruleCount,
    Map<String, Integer> typeBreakdown,
    int filteredCount,
    long outputBytes,
    Optional<String> error,
    Optional<String> compileError) {

  public RulesetOutcome {
    Objects.requireNonNull(name, "name");
    jsonPath = Objects.requireNonNullElse(jsonPath, Optional.empty());
    compiledPath = Objects.requireNonNullElse(compiledPath, Optional.empty());
    downloads = Objects.requireNonNullElse(downloads, Optional.empty());
    typeBreakdown = typeBreakdown == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(typeBreakdown));
    error = Objects.requireNonNullElse(error, Optional.empty());
    compileError = Objects.requireNonNullElse(compileError, Optional.empty());
  }

  static RulesetOutcome failure(String name, Optional<BatchStats> downloads, int unparsable, String error) {
    return new RulesetOutcome(name, false, Optional.empty(), Optional.empty(), downloads, 0, unparsable, 0L,
        Map.of(), 0, 0L, Optional.of(error), Optional.empty());
  }

  /**
   * Formats the breakdown as {@code type(count)} pairs, for example {@code domain(12), ip_cidr(40)}.
   *
   * @return human-readable breakdown, empty when nothing was written
   */
  public String breakdownText() {
    StringBuilder text = new StringBuilder();
    typeBreakdown.forEach((type, count) -> {
      if (text.length() > 0) {
        text.append(", ");
      }
      text.append(type).append('(').append(count).append(')');
    });
    return text.toString();
  }
}
