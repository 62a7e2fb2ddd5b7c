package ca.gc.cra.rulesync.application.port;

import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Port persisting a finalized ruleset.
 *
 * @since 0.1.0
 * @see ca.gc.cra.rulesync.infrastructure.output.CanonicalJsonWriter
 */
public interface RulesetWriterPort {
  /**
   * Serializes {@code ruleset} to {@code target}, creating parent directories as needed.
   *
   * @param ruleset finalized ruleset
   * @param target destination file
   * @return number of bytes written
   * @throws IOException when the file cannot be written
   */
  long write(MergedRuleset ruleset, Path target) throws IOException;
}
