package ca.gc.cra.rulesync.domain.fetch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Results of a download batch in input order plus aggregate statistics.
 *
 * @param results one result per requested URL, in input order
 * @param stats aggregate statistics
 */
public record BatchReport(List<DownloadResult> results, BatchStats stats) {
  public BatchReport {
    results = List.copyOf(Objects.requireNonNull(results, "results"));
    Objects.requireNonNull(stats, "stats");
  }

  /**
   * Local copies of every successful result, in input order.
   *
   * @return successful local paths
   */
  public List<Path> successfulPaths() {
    List<Path> paths = new ArrayList<>();
    for (DownloadResult result : results) {
      if (result.success()) {
        result.localPath().ifPresent(paths::add);
      }
    }
    return paths;
  }
}
