package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.application.port.MetricsPort;
import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import ca.gc.cra.rulesync.domain.rules.RuleGroup;
import ca.gc.cra.rulesync.domain.rules.RuleType;
import ca.gc.cra.rulesync.domain.source.SourceKind;
import ca.gc.cra.rulesync.logging.Logs;
import ca.gc.cra.rulesync.validation.Net;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Merges the downloaded payloads of one ruleset into a {@link MergedRuleset}.
 * <p><strong>How:</strong> Each payload is parsed into its own {@link RuleAccumulator} and folded into the
 * ruleset accumulator only when parsing completes, so a payload that fails half way contributes nothing.
 * Structured fragments whose content does not open with a brace or bracket are re-read as line
 * lists.</p>
 * <p><strong>Thread-safety:</strong> Holds no per-merge state; one instance may merge several rulesets
 * concurrently.</p>
 * <p><strong>Observability:</strong> Emits {@code merge.values}, {@code merge.source.failed} and
 * {@code merge.cidr.invalid}.</p>
 *
 * @since 0.1.0
 */
public final class RulesetMerger {
  private static final Logger log = LoggerFactory.getLogger(RulesetMerger.class);
  private static final int SNIFF_LIMIT = 4096;
  private static final Set<String> CIDR_TYPES = Set.of(RuleType.IP_CIDR.key(), RuleType.SOURCE_IP_CIDR.key());

  private final StructuredFragmentParser fragmentParser;
  private final LineListParser lineListParser;
  private final MetricsPort metrics;
  private final boolean validateCidr;

  /**
   * Creates a merger.
   *
   * @param fragmentParser JSON fragment reader
   * @param lineListParser text and YAML list reader
   * @param metrics metrics sink
   * @param validateCidr whether malformed {@code ip_cidr}/{@code source_ip_cidr} values are dropped
   */
  public RulesetMerger(
      StructuredFragmentParser fragmentParser,
      LineListParser lineListParser,
      MetricsPort metrics,
      boolean validateCidr) {
    this.fragmentParser = Objects.requireNonNull(fragmentParser, "fragmentParser");
    this.lineListParser = Objects.requireNonNull(lineListParser, "lineListParser");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.validateCidr = validateCidr;
  }

  /**
   * Merges {@code sources} into one ruleset.
   *
   * @param sources downloaded payloads; order does not affect the result
   * @param version format version stamped on the result
   * @return merged ruleset plus per-source accounting
   */
  public MergeReport merge(List<FetchedSource> sources, int version) {
    Objects.requireNonNull(sources, "sources");
    RuleAccumulator merged = new RuleAccumulator();
    List<String> failed = new ArrayList<>();
    long skipped = 0;
    int mergedSources = 0;
    for (FetchedSource fetched : sources) {
      RuleAccumulator single = new RuleAccumulator();
      try {
        skipped += parseInto(fetched, single);
      } catch (IOException ex) {
        String url = Logs.redactUrl(fetched.source().url());
        log.warn("Excluding source {}: {}", url, Logs.truncate(ex.getMessage(), 300));
        log.debug("Parse failure for {}", url, ex);
        metrics.increment("merge.source.failed");
        failed.add(fetched.source().url());
        continue;
      }
      metrics.observe("merge.values", single.acceptedValues());
      merged.addAll(single);
      mergedSources++;
    }
    if (mergedSources == 1 && sources.size() == 1
        && sources.get(0).source().kind() == SourceKind.STRUCTURED_FRAGMENT) {
      log.debug("Single structured fragment; passing its rules through with version {}", version);
    }

    MergedRuleset ruleset = merged.finish(version);
    long invalid = 0;
    if (validateCidr) {
      CidrCheck check = dropInvalidCidrs(ruleset);
      ruleset = check.ruleset();
      invalid = check.dropped();
      if (invalid > 0) {
        metrics.observe("merge.cidr.invalid", invalid);
        log.warn("Dropped {} malformed CIDR values", invalid);
      }
    }
    return new MergeReport(ruleset, mergedSources, failed, skipped, invalid);
  }

  private int parseInto(FetchedSource fetched, RuleAccumulator target) throws IOException {
    Path path = fetched.path();
    if (fetched.source().kind() == SourceKind.STRUCTURED_FRAGMENT) {
      if (looksLikeJson(path)) {
        fragmentParser.parse(path, target);
        return 0;
      }
      log.info("Source {} is not JSON; reading it as a rule list", Logs.redactUrl(fetched.source().url()));
    }
    return lineListParser.parse(path, target);
  }

  static boolean looksLikeJson(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      for (int i = 0; i < SNIFF_LIMIT; i++) {
        int c = reader.read();
        if (c < 0) {
          return false;
        }
        if (c == '\uFEFF' || Character.isWhitespace(c)) {
          continue;
        }
        return c == '{' || c == '[';
      }
    }
    return false;
  }

  private static CidrCheck dropInvalidCidrs(MergedRuleset ruleset) {
    List<RuleGroup> groups = new ArrayList<>(ruleset.groups().size());
    long dropped = 0;
    for (RuleGroup group : ruleset.groups()) {
      if (!CIDR_TYPES.contains(group.type())) {
        groups.add(group);
        continue;
      }
      List<String> kept = new ArrayList<>(group.size());
      for (String value : group.values()) {
        if (Net.isValidIpOrCidr(value)) {
          kept.add(value);
        } else {
          dropped++;
        }
      }
      if (!kept.isEmpty()) {
        groups.add(new RuleGroup(group.type(), kept));
      }
    }
    return new CidrCheck(new MergedRuleset(ruleset.version(), groups, ruleset.logicalRules()), dropped);
  }

  private record CidrCheck(MergedRuleset ruleset, long dropped) {}
}
