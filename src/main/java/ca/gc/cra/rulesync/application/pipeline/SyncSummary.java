package ca.gc.cra.rulesync.application.pipeline;

import ca.gc.cra.rulesync.domain.fetch.BatchStats;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Totals of one sync run.
 *
 * @param outcomes per-ruleset outcomes in catalog order
 * @param totalDownloads URLs attempted across every ruleset
 * @param successfulDownloads URLs retrieved successfully
 * @param successfulRulesets rulesets with a written JSON artifact
 * @param compiledRulesets rulesets with a compiled artifact
 * @param totalRules rules written across every ruleset
 * @param totalOutputBytes bytes written across every JSON artifact
 * @param errors one message per failed ruleset or failed compilation
 * @param elapsedSeconds wall time of the run
 * @since 0.1.0
 */
public record SyncSummary(
    List<RulesetOutcome> outcomes,
    int totalDownloads,
    int successfulDownloads,
    int successfulRulesets,
    int compiledRulesets,
    long totalRules,
    long totalOutputBytes,
    List<String> errors,
    double elapsedSeconds) {

  public SyncSummary {
    outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
    errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
  }

  /**
   * Aggregates per-ruleset outcomes.
   *
   * @param outcomes outcomes in catalog order
   * @param elapsedSeconds wall time of the run
   * @return run totals
   */
  public static SyncSummary from(List<RulesetOutcome> outcomes, double elapsedSeconds) {
    int downloads = 0;
    int downloaded = 0;
    int succeeded = 0;
    int compiled = 0;
    long rules = 0;
    long bytes = 0;
    List<String> errors = new ArrayList<>();
    for (RulesetOutcome outcome : outcomes) {
      if (outcome.downloads().isPresent()) {
        BatchStats stats = outcome.downloads().get();
        downloads += stats.totalFiles();
        downloaded += stats.successfulFiles();
      }
      if (outcome.success()) {
        succeeded++;
        rules += outcome.ruleCount();
        bytes += outcome.outputBytes();
      }
      if (outcome.compiledPath().isPresent()) {
        compiled++;
      }
      outcome.error().ifPresent(error -> errors.add(outcome.name() + ": " + error));
      outcome.compileError().ifPresent(error -> errors.add(outcome.name() + " (compile): " + error));
    }
    return new SyncSummary(outcomes, downloads, downloaded, succeeded, compiled, rules, bytes, errors,
        elapsedSeconds);
  }

  /**
   * A run succeeds when at least one ruleset produced an artifact.
   *
   * @return {@code true} when {@link #successfulRulesets()} is positive
   */
  public boolean isSuccess() {
    return successfulRulesets > 0;
  }

  /**
   * Number of rulesets in the run.
   *
   * @return ruleset count
   */
  public int totalRulesets() {
    return outcomes.size();
  }
}
