package ca.gc.cra.rulesync.config;

import ca.gc.cra.rulesync.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code rulesets} section of the configuration file.
 *
 * <pre>{@code
 * rulesets:
 *   ai:
 *     - https://example.org/ai.json
 *     - https://example.org/ai.list
 * }</pre>
 *
 * <p>Names must be usable as file stems; every ruleset needs at least one URL. Duplicate URLs within a ruleset
 * are collapsed with a warning.</p>
 */
public final class RulesetCatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(RulesetCatalogLoader.class);
  private static final String SECTION = "rulesets";

  private RulesetCatalogLoader() {}

  /**
   * Loads the catalog from {@code path}.
   *
   * @param path YAML configuration file
   * @return catalog in file order
   * @throws IOException when the file is missing or unreadable
   * @throws IllegalArgumentException when the section is absent or malformed
   */
  public static RulesetCatalog load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Configuration file not found: " + path);
    }
    Object section = YamlConfigLoader.findSection(YamlConfigLoader.readRoot(path), SECTION);
    if (section == null) {
      throw new IllegalArgumentException("No rulesets section in " + path);
    }
    Map<String, Object> raw = YamlConfigLoader.asMap(section, SECTION);
    Map<String, List<String>> rulesets = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      String name = Strings.requireRulesetName("ruleset name", entry.getKey());
      rulesets.put(name, parseUrls(name, entry.getValue()));
    }
    if (rulesets.isEmpty()) {
      throw new IllegalArgumentException("rulesets section in " + path + " is empty");
    }
    return new RulesetCatalog(rulesets);
  }

  private static List<String> parseUrls(String name, Object node) {
    if (!(node instanceof Iterable<?> items)) {
      throw new IllegalArgumentException("ruleset " + name + " must be a list of URLs");
    }
    Set<String> urls = new LinkedHashSet<>();
    for (Object item : items) {
      if (!(item instanceof String text) || text.isBlank()) {
        throw new IllegalArgumentException("ruleset " + name + " contains a non-string or blank URL");
      }
      String url = Strings.requireNonBlank(name + " url", text);
      if (!url.startsWith("http://") && !url.startsWith("https://")) {
        throw new IllegalArgumentException("ruleset " + name + " URL must be http(s): " + url);
      }
      if (!urls.add(url)) {
        log.warn("Ruleset {} lists {} more than once; fetching it once", name, url);
      }
    }
    if (urls.isEmpty()) {
      throw new IllegalArgumentException("ruleset " + name + " has no URLs");
    }
    return new ArrayList<>(urls);
  }
}
