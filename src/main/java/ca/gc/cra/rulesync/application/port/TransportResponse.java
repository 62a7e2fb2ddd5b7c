package ca.gc.cra.rulesync.application.port;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Open response returned by {@link SourceTransport#get(String, long)}.
 *
 * @param status HTTP status code
 * @param contentLength body length when advertised
 * @param contentRange raw {@code Content-Range} header when present
 * @param body response body stream; owned by this response
 * @since 0.1.0
 */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the caller owns and closes the body stream")
public record TransportResponse(
    int status, OptionalLong contentLength, Optional<String> contentRange, InputStream body)
    implements AutoCloseable {

  public TransportResponse {
    contentLength = Objects.requireNonNullElse(contentLength, OptionalLong.empty());
    contentRange = Objects.requireNonNullElse(contentRange, Optional.empty());
    body = Objects.requireNonNullElse(body, InputStream.nullInputStream());
  }

  /**
   * Indicates a 2xx status.
   *
   * @return {@code true} for successful statuses
   */
  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }

  /**
   * Extracts the complete resource size from {@code Content-Range: bytes a-b/total}.
   *
   * @return total size when the header carries a numeric total
   */
  public OptionalLong totalFromContentRange() {
    if (contentRange.isEmpty()) {
      return OptionalLong.empty();
    }
    String header = contentRange.get();
    int slash = header.lastIndexOf('/');
    if (slash < 0 || slash == header.length() - 1) {
      return OptionalLong.empty();
    }
    String total = header.substring(slash + 1).trim();
    try {
      return OptionalLong.of(Long.parseLong(total));
    } catch (NumberFormatException ex) {
      return OptionalLong.empty();
    }
  }

  /**
   * Extracts the first byte position from {@code Content-Range: bytes a-b/total}.
   *
   * @return first byte position when the header carries one
   */
  public OptionalLong startFromContentRange() {
    if (contentRange.isEmpty()) {
      return OptionalLong.empty();
    }
    String header = contentRange.get().trim();
    int space = header.indexOf(' ');
    int dash = header.indexOf('-', space + 1);
    if (space < 0 || dash < 0) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(header.substring(space + 1, dash).trim()));
    } catch (NumberFormatException ex) {
      return OptionalLong.empty();
    }
  }

  @Override
  public void close() throws IOException {
    body.close();
  }
}
