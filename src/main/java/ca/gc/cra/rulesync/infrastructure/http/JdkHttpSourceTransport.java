package ca.gc.cra.rulesync.infrastructure.http;

import ca.gc.cra.rulesync.application.port.SourceTransport;
import ca.gc.cra.rulesync.application.port.TransportResponse;
import ca.gc.cra.rulesync.validation.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SourceTransport} backed by {@link HttpClient}.
 * <p><strong>Role:</strong> Network adapter used by every download worker. One client instance is shared; the
 * JDK client multiplexes connections internally.</p>
 * <p><strong>Behaviour:</strong> Redirects are followed, each request carries the configured
 * {@code User-Agent} and a per-request timeout. Timeouts surface as {@link java.net.http.HttpTimeoutException},
 * which callers treat as retryable I/O failures.</p>
 *
 * @since 0.1.0
 */
public final class JdkHttpSourceTransport implements SourceTransport {
  private static final Logger log = LoggerFactory.getLogger(JdkHttpSourceTransport.class);

  /** Browser-like agent; several rule hosts reject unknown agents. */
  public static final String DEFAULT_USER_AGENT =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
          + "(KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

  private final HttpClient client;
  private final Duration requestTimeout;
  private final String userAgent;

  /**
   * Creates a transport with its own {@link HttpClient}.
   *
   * @param requestTimeout per-request timeout
   * @param userAgent {@code User-Agent} header value
   */
  public JdkHttpSourceTransport(Duration requestTimeout, String userAgent) {
    this(
        HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Objects.requireNonNull(requestTimeout, "requestTimeout"))
            .build(),
        requestTimeout,
        userAgent);
  }

  JdkHttpSourceTransport(HttpClient client, Duration requestTimeout, String userAgent) {
    this.client = Objects.requireNonNull(client, "client");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.userAgent = Strings.requireNonBlank("userAgent", userAgent);
  }

  @Override
  public boolean supportsRanges(String url) throws IOException, InterruptedException {
    HttpRequest head = baseRequest(url)
        .method("HEAD", HttpRequest.BodyPublishers.noBody())
        .build();
    HttpResponse<Void> response = client.send(head, BodyHandlers.discarding());
    if (response.statusCode() >= 400) {
      log.debug("HEAD {} returned {}; assuming no range support", url, response.statusCode());
      return false;
    }
    return response.headers()
        .firstValue("Accept-Ranges")
        .map(value -> value.toLowerCase(Locale.ROOT).contains("bytes"))
        .orElse(false);
  }

  @Override
  public TransportResponse get(String url, long rangeStart) throws IOException, InterruptedException {
    if (rangeStart < 0) {
      throw new IllegalArgumentException("rangeStart must be >= 0");
    }
    HttpRequest.Builder builder = baseRequest(url).GET();
    if (rangeStart > 0) {
      builder.header("Range", "bytes=" + rangeStart + "-");
    }
    HttpResponse<InputStream> response = client.send(builder.build(), BodyHandlers.ofInputStream());
    HttpHeaders headers = response.headers();
    OptionalLong length = headers.firstValueAsLong("Content-Length");
    Optional<String> contentRange = headers.firstValue("Content-Range");
    return new TransportResponse(response.statusCode(), length, contentRange, response.body());
  }

  private HttpRequest.Builder baseRequest(String url) {
    URI uri;
    try {
      uri = URI.create(Strings.requireNonBlank("url", url));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("invalid source URL: " + url, ex);
    }
    return HttpRequest.newBuilder(uri)
        .timeout(requestTimeout)
        .header("User-Agent", userAgent);
  }
}
