/**
 * Source retrieval: single-URL fetch with cache, retry and resume, and the bounded batch coordinator.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.rulesync.application.fetch.Fetcher} is shared by all batch
 * workers; progress is aggregated on one dedicated thread.</p>
 * <p><strong>Errors:</strong> Per-URL failures are reported in the results, never thrown; only caller
 * interruption escapes a batch.</p>
 */
package ca.gc.cra.rulesync.application.fetch;
