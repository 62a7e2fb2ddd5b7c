package ca.gc.cra.rulesync.domain.fetch;

/**
 * Throttled progress snapshot published while a batch is running.
 *
 * @param completedFiles URLs finished so far, successful or not
 * @param totalFiles URLs in the batch
 * @param downloadedBytes bytes received across all workers
 * @param speedMbps {@code downloadedBytes} in MB divided by elapsed seconds
 * @param elapsedSeconds seconds since the batch started
 */
public record BatchProgress(
    int completedFiles, int totalFiles, long downloadedBytes, double speedMbps, double elapsedSeconds) {

  /**
   * Completed share of the batch in percent.
   *
   * @return percentage in {@code [0, 100]}
   */
  public double percentComplete() {
    return totalFiles == 0 ? 100d : (completedFiles * 100d) / totalFiles;
  }
}
