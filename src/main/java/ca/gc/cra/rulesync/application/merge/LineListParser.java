package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.domain.rules.RuleType;
import ca.gc.cra.rulesync.logging.Logs;
import ca.gc.cra.rulesync.validation.Net;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads line-oriented rule sources into a {@link RuleAccumulator}.
 * <p><strong>Formats:</strong>
 * <ul>
 *   <li>YAML documents with a {@code payload:} list (file name ending {@code .yaml}/{@code .yml}, or a first
 *   significant line starting with {@code payload:}).</li>
 *   <li>Proxy rule lists: {@code PATTERN,address[,policy...]} lines and {@code AND,((...),(...))} compound
 *   rules.</li>
 *   <li>Plain lists with one address, CIDR or domain per line.</li>
 * </ul>
 * Blank lines and {@code #} comments are skipped everywhere.</p>
 * <p><strong>Thread-safety:</strong> Stateless; instances may be shared.</p>
 *
 * @since 0.1.0
 */
public final class LineListParser {
  private static final Logger log = LoggerFactory.getLogger(LineListParser.class);
  private static final String PAYLOAD_KEY = "payload";
  private static final int LOG_LINE_BYTES = 200;
  private static final char BOM = '\uFEFF';

  /**
   * Parses {@code file} into {@code target}.
   *
   * @param file downloaded list
   * @param target accumulator receiving values and logical rules
   * @return number of entries skipped because their keyword is not part of the vocabulary
   * @throws IOException when the file cannot be read, is not UTF-8, or is a malformed YAML document
   */
  public int parse(Path file, RuleAccumulator target) throws IOException {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(target, "target");
    if (isYaml(file)) {
      return parseYaml(file, target);
    }
    int skipped = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String raw;
      while ((raw = reader.readLine()) != null) {
        String line = significant(raw);
        if (line.isEmpty()) {
          continue;
        }
        if (!acceptLine(line, target, false)) {
          skipped++;
        }
      }
    }
    return skipped;
  }

  boolean isYaml(Path file) throws IOException {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".yaml") || name.endsWith(".yml")) {
      return true;
    }
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String raw;
      while ((raw = reader.readLine()) != null) {
        String line = significant(raw);
        if (!line.isEmpty()) {
          return line.startsWith(PAYLOAD_KEY + ":");
        }
      }
    }
    return false;
  }

  private int parseYaml(Path file, RuleAccumulator target) throws IOException {
    Object root;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      root = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IOException("Failed to parse YAML payload at " + file, ex);
    }
    if (root == null) {
      return 0;
    }
    Iterable<?> items;
    if (root instanceof Map<?, ?> map) {
      Object payload = map.get(PAYLOAD_KEY);
      if (payload == null) {
        log.debug("YAML document {} has no payload list", file);
        return 0;
      }
      if (!(payload instanceof Iterable<?> iterable)) {
        throw new IOException("payload must be a list in " + file);
      }
      items = iterable;
    } else if (root instanceof Iterable<?> iterable) {
      items = iterable;
    } else if (root instanceof String text) {
      items = text.lines().toList();
    } else {
      throw new IOException("Unsupported YAML root " + root.getClass().getSimpleName() + " in " + file);
    }

    int skipped = 0;
    for (Object item : items) {
      if (item instanceof String text) {
        String line = significant(text);
        if (!line.isEmpty() && !acceptLine(line, target, true)) {
          skipped++;
        }
      } else if (item instanceof Map<?, ?> entry) {
        for (Map.Entry<?, ?> field : entry.entrySet()) {
          skipped += acceptMapping(String.valueOf(field.getKey()), field.getValue(), target);
        }
      } else if (item != null) {
        log.debug("Skipping unsupported payload item of type {}", item.getClass().getSimpleName());
      }
    }
    return skipped;
  }

  private int acceptMapping(String keyword, Object value, RuleAccumulator target) {
    Optional<RuleType> type = RuleType.fromKeyword(keyword);
    if (type.isEmpty()) {
      log.warn("Skipping payload entry with unknown rule type {}", Logs.truncate(keyword, LOG_LINE_BYTES));
      return 1;
    }
    if (value instanceof Iterable<?> values) {
      for (Object single : values) {
        if (single != null) {
          target.add(type.get().key(), String.valueOf(single));
        }
      }
    } else if (value != null) {
      target.add(type.get().key(), String.valueOf(value));
    }
    return 0;
  }

  /**
   * Folds one significant line.
   *
   * @return {@code false} when the line was skipped for an unknown keyword
   */
  private boolean acceptLine(String line, RuleAccumulator target, boolean bareAsDomain) {
    if (LogicalRuleParser.isLogicalLine(line)) {
      LogicalRuleParser.parse(line).ifPresentOrElse(
          target::addLogical,
          () -> log.debug("Logical line without mappable conditions: {}", Logs.truncate(line, LOG_LINE_BYTES)));
      return true;
    }
    int comma = line.indexOf(',');
    if (comma < 0) {
      boolean ip = !bareAsDomain && Net.looksLikeIpOrCidr(line);
      target.add(ip ? RuleType.IP_CIDR.key() : RuleType.DOMAIN.key(), line);
      return true;
    }
    String keyword = line.substring(0, comma);
    Optional<RuleType> type = RuleType.fromKeyword(keyword);
    if (type.isEmpty()) {
      log.warn("Skipping line with unknown rule type: {}", Logs.truncate(line, LOG_LINE_BYTES));
      return false;
    }
    String rest = line.substring(comma + 1);
    int next = rest.indexOf(',');
    String address = next < 0 ? rest : rest.substring(0, next);
    target.add(type.get().key(), address);
    return true;
  }

  private static String significant(String raw) {
    String line = raw.strip();
    if (!line.isEmpty() && line.charAt(0) == BOM) {
      line = line.substring(1).strip();
    }
    if (line.startsWith("#")) {
      return "";
    }
    return line;
  }
}
