package ca.gc.cra.rulesync.infrastructure.compiler;

import ca.gc.cra.rulesync.application.port.CompilerPort;
import ca.gc.cra.rulesync.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CompilerPort} that runs an external rule compiler as a child process.
 * <p><strong>Command:</strong> The template is split on whitespace and the {@code {input}} and {@code {output}}
 * placeholders are replaced per invocation, for example
 * {@code sing-box rule-set compile --output {output} {input}}. The output file is
 * {@code <compiledDir>/<input stem>.srs}.</p>
 * <p><strong>Failure:</strong> A non-zero exit code, a timeout, or a missing output file raise
 * {@link IOException} carrying the truncated compiler output.</p>
 * <p><strong>Thread-safety:</strong> Immutable; concurrent compilations spawn independent processes.</p>
 *
 * @since 0.1.0
 */
public final class ExternalProcessCompilerAdapter implements CompilerPort {
  private static final Logger log = LoggerFactory.getLogger(ExternalProcessCompilerAdapter.class);
  static final String INPUT_PLACEHOLDER = "{input}";
  static final String OUTPUT_PLACEHOLDER = "{output}";
  private static final String OUTPUT_EXTENSION = ".srs";
  private static final int MAX_OUTPUT_LOG_BYTES = 2048;

  private final List<String> template;
  private final Path compiledDir;
  private final Duration timeout;

  /**
   * Creates an adapter.
   *
   * @param commandTemplate whitespace separated command line containing {@code {input}}
   * @param compiledDir directory receiving compiled artifacts
   * @param timeout maximum wall time per compilation
   * @throws IllegalArgumentException when the template is blank or lacks {@code {input}}
   */
  public ExternalProcessCompilerAdapter(String commandTemplate, Path compiledDir, Duration timeout) {
    Objects.requireNonNull(commandTemplate, "commandTemplate");
    if (commandTemplate.isBlank()) {
      throw new IllegalArgumentException("compilerCommand must not be blank");
    }
    List<String> tokens = List.of(commandTemplate.trim().split("\\s+"));
    if (tokens.stream().noneMatch(token -> token.contains(INPUT_PLACEHOLDER))) {
      throw new IllegalArgumentException("compilerCommand must contain " + INPUT_PLACEHOLDER);
    }
    this.template = tokens;
    this.compiledDir = Objects.requireNonNull(compiledDir, "compiledDir");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  @Override
  public Optional<Path> compile(Path input) throws IOException, InterruptedException {
    Objects.requireNonNull(input, "input");
    Files.createDirectories(compiledDir);
    Path output = compiledDir.resolve(stem(input) + OUTPUT_EXTENSION).toAbsolutePath();
    List<String> command = commandFor(input.toAbsolutePath(), output);
    log.debug("Running compiler: {}", command);

    Path transcript = Files.createTempFile("rulesync-compiler", ".log");
    try {
      Process process = new ProcessBuilder(command)
          .redirectErrorStream(true)
          .redirectOutput(transcript.toFile())
          .start();
      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        process.destroyForcibly();
        throw ex;
      }
      if (!finished) {
        process.destroyForcibly();
        throw new IOException("Compiler timed out after " + timeout.toSeconds() + "s for " + input.getFileName());
      }
      int exit = process.exitValue();
      if (exit != 0) {
        throw new IOException("Compiler exited with " + exit + ": " + readTranscript(transcript));
      }
      if (!Files.isRegularFile(output)) {
        throw new IOException("Compiler produced no output at " + output);
      }
      log.info("Compiled {} -> {} ({} bytes)", input.getFileName(), output.getFileName(), Files.size(output));
      return Optional.of(output);
    } finally {
      Files.deleteIfExists(transcript);
    }
  }

  List<String> commandFor(Path input, Path output) {
    List<String> command = new ArrayList<>(template.size());
    for (String token : template) {
      command.add(token.replace(INPUT_PLACEHOLDER, input.toString()).replace(OUTPUT_PLACEHOLDER, output.toString()));
    }
    return command;
  }

  private static String readTranscript(Path transcript) throws IOException {
    try (InputStream in = Files.newInputStream(transcript)) {
      byte[] head = in.readNBytes(MAX_OUTPUT_LOG_BYTES * 2);
      return Logs.truncate(new String(head, StandardCharsets.UTF_8).strip(), MAX_OUTPUT_LOG_BYTES);
    }
  }

  private static String stem(Path input) {
    String name = input.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
