package ca.gc.cra.rulesync.domain.fetch;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Tagged result of a single network attempt; the retry loop switches on {@link #status()}.
 *
 * @param status attempt classification
 * @param bytes bytes present in the destination file after the attempt
 * @param httpStatus HTTP status when one was received
 * @param message failure description, empty on success
 * @since 0.1.0
 */
public record FetchOutcome(Status status, long bytes, OptionalInt httpStatus, String message) {

  /** HTTP statuses that will not change on retry. */
  public static final Set<Integer> FATAL_HTTP_STATUSES = Set.of(400, 401, 403, 404, 410);

  /** Attempt classification. */
  public enum Status {
    SUCCESS,
    RETRYABLE,
    FATAL
  }

  public FetchOutcome {
    Objects.requireNonNull(status, "status");
    httpStatus = Objects.requireNonNullElse(httpStatus, OptionalInt.empty());
    message = Objects.requireNonNullElse(message, "");
  }

  public static FetchOutcome success(long bytes) {
    return new FetchOutcome(Status.SUCCESS, bytes, OptionalInt.empty(), "");
  }

  public static FetchOutcome retryable(String message) {
    return new FetchOutcome(Status.RETRYABLE, 0L, OptionalInt.empty(), message);
  }

  /**
   * Classifies a non-success HTTP status.
   *
   * @param status HTTP status code
   * @param reason short description for logs
   * @return fatal outcome for permanent client errors, retryable otherwise
   */
  public static FetchOutcome forHttpStatus(int status, String reason) {
    Status tag = FATAL_HTTP_STATUSES.contains(status) ? Status.FATAL : Status.RETRYABLE;
    return new FetchOutcome(tag, 0L, OptionalInt.of(status), "HTTP " + status + ": " + reason);
  }
}
