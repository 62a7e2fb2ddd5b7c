package ca.gc.cra.rulesync.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Port performing the network half of a fetch.
 * <p><strong>Why:</strong> Keeps retry, resume and cache policy in {@code Fetcher} independent of the HTTP
 * client, so the policy can be tested against scripted responses.</p>
 * <p><strong>Thread-safety:</strong> Implementations are shared by every download worker and must be
 * thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.rulesync.infrastructure.http.JdkHttpSourceTransport
 */
public interface SourceTransport {
  /**
   * Asks whether the server advertises byte-range support for {@code url}.
   *
   * @param url remote location
   * @return {@code true} when {@code Accept-Ranges} contains {@code bytes}
   * @throws IOException when the HEAD request cannot be completed
   * @throws InterruptedException when the calling thread is interrupted
   */
  boolean supportsRanges(String url) throws IOException, InterruptedException;

  /**
   * Issues a GET request, optionally starting at {@code rangeStart}.
   *
   * @param url remote location
   * @param rangeStart first byte to request; {@code 0} requests the whole body
   * @return open response; the caller closes it
   * @throws IOException on connection failures and timeouts
   * @throws InterruptedException when the calling thread is interrupted
   */
  TransportResponse get(String url, long rangeStart) throws IOException, InterruptedException;
}
