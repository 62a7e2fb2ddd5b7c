package ca.gc.cra.rulesync.domain.source;

import java.util.Objects;

/**
 * Remote rule source with its payload kind decided once at classification time.
 *
 * @param url remote location
 * @param kind payload family
 */
public record Source(String url, SourceKind kind) {
  public Source {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(kind, "kind");
  }
}
