package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of merging one ruleset's payloads.
 *
 * @param ruleset finalized ruleset
 * @param mergedSources number of payloads folded into the ruleset
 * @param failedSources URLs whose payload could not be parsed
 * @param skippedEntries line-list entries dropped for an unknown keyword
 * @param invalidCidrs {@code ip_cidr}/{@code source_ip_cidr} values dropped by CIDR validation
 */
public record MergeReport(
    MergedRuleset ruleset, int mergedSources, List<String> failedSources, long skippedEntries, long invalidCidrs) {
  public MergeReport {
    Objects.requireNonNull(ruleset, "ruleset");
    failedSources = List.copyOf(Objects.requireNonNull(failedSources, "failedSources"));
  }
}
