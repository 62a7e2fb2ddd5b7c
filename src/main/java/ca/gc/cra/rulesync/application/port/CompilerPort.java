package ca.gc.cra.rulesync.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Port to the external compiler that turns a canonical JSON ruleset into its binary form.
 *
 * @since 0.1.0
 */
public interface CompilerPort {
  /**
   * Compiles {@code input}.
   *
   * @param input canonical JSON ruleset
   * @return compiled artifact, or empty when compilation is disabled
   * @throws IOException when the compiler cannot be started or reports a failure
   * @throws InterruptedException when the caller is interrupted while waiting for the compiler
   */
  Optional<Path> compile(Path input) throws IOException, InterruptedException;

  /** Compiler that skips compilation. */
  CompilerPort NONE = input -> Optional.empty();
}
