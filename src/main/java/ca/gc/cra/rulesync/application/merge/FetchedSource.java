package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.domain.source.Source;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Classified source paired with its downloaded local copy.
 *
 * @param source classified remote source
 * @param path local payload
 */
public record FetchedSource(Source source, Path path) {
  public FetchedSource {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(path, "path");
  }
}
