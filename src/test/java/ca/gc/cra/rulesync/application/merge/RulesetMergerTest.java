package ca.gc.cra.rulesync.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rulesync.domain.rules.LogicalRule;
import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import ca.gc.cra.rulesync.domain.rules.RuleCondition;
import ca.gc.cra.rulesync.domain.rules.RuleGroup;
import ca.gc.cra.rulesync.testutil.RecordingMetrics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RulesetMergerTest {
  @TempDir Path tempDir;

  private RecordingMetrics metrics;
  private RulesetMerger merger;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetrics();
    merger = new RulesetMerger(new StructuredFragmentParser(), new LineListParser(), metrics, false);
  }

  @Test
  void unionsFragmentsAndStampsVersion() throws IOException {
    FetchedSource first = source("https://h/one.json", "{\"rules\":[{\"domain_suffix\":[\"a.com\",\"b.com\"]}]}");
    FetchedSource second = source("https://h/two.json", "{\"rules\":[{\"domain_suffix\":[\"b.com\",\"c.com\"]}]}");

    MergeReport report = merger.merge(List.of(first, second), 2);

    assertEquals(
        new MergedRuleset(2, List.of(new RuleGroup("domain_suffix", List.of("a.com", "b.com", "c.com"))), List.of()),
        report.ruleset());
    assertEquals(2, report.mergedSources());
    assertTrue(report.failedSources().isEmpty());
    assertEquals(2, metrics.observed("merge.values").size());
  }

  @Test
  void resultDoesNotDependOnSourceOrder() throws IOException {
    FetchedSource fragment = source("https://h/a.json", "{\"rules\":[{\"ip_cidr\":[\"10.0.0.0/8\"],\"domain\":[\"z.com\"]}]}");
    FetchedSource list = source("https://h/b.txt", "DOMAIN,a.com\nIP-CIDR,1.1.1.1/32\nAND,((DOMAIN,x.com),(DST-PORT,80))\n");

    MergedRuleset forward = merger.merge(List.of(fragment, list), 1).ruleset();
    MergedRuleset reverse = merger.merge(List.of(list, fragment), 1).ruleset();

    assertEquals(forward, reverse);
    assertEquals(List.of("a.com", "z.com"), forward.group("domain").orElseThrow().values());
    assertEquals("domain", forward.groups().get(0).type());
  }

  @Test
  void mergingTheSameSourceTwiceChangesNothing() throws IOException {
    FetchedSource list = source("https://h/b.txt", "DOMAIN-SUFFIX,example.com\nIP-CIDR,10.0.0.0/8\n");

    MergedRuleset once = merger.merge(List.of(list), 1).ruleset();
    MergedRuleset twice = merger.merge(List.of(list, list), 1).ruleset();

    assertEquals(once.groups(), twice.groups());
    assertEquals(
        List.of(new RuleGroup("domain_suffix", List.of("example.com")), new RuleGroup("ip_cidr", List.of("10.0.0.0/8"))),
        once.groups());
  }

  @Test
  void logicalRulesFollowScalarGroupsWithoutDeduplication() throws IOException {
    FetchedSource list = source("https://h/rules.txt", "DOMAIN,foo.com\nAND,((DOMAIN,foo.com),(DST-PORT,443))\n");

    MergedRuleset ruleset = merger.merge(List.of(list), 1).ruleset();

    assertEquals(List.of("foo.com"), ruleset.group("domain").orElseThrow().values());
    assertEquals(
        List.of(LogicalRule.and(List.of(new RuleCondition("domain", "foo.com"), new RuleCondition("port", "443")))),
        ruleset.logicalRules());
  }

  @Test
  void fragmentUrlWithTextBodyIsReadAsList() throws IOException {
    FetchedSource disguised = source("https://h/list.json", "\n  DOMAIN-SUFFIX,a.com\n");

    MergedRuleset ruleset = merger.merge(List.of(disguised), 1).ruleset();

    assertEquals(List.of("a.com"), ruleset.group("domain_suffix").orElseThrow().values());
  }

  @Test
  void unparsableSourceIsExcludedWhole() throws IOException {
    FetchedSource good = source("https://h/good.txt", "DOMAIN,a.com\n");
    FetchedSource broken = source("https://h/broken.json", "{\"rules\":[{\"domain\":[\"leak.com\",");

    MergeReport report = merger.merge(List.of(broken, good), 1);

    assertEquals(List.of("https://h/broken.json"), report.failedSources());
    assertEquals(1, report.mergedSources());
    assertEquals(List.of("a.com"), report.ruleset().group("domain").orElseThrow().values());
    assertEquals(1, metrics.count("merge.source.failed"));
  }

  @Test
  void skippedEntriesAreReported() throws IOException {
    FetchedSource list = source("https://h/rules.txt", "USER-AGENT,x\nDOMAIN,a.com\n");

    assertEquals(1, merger.merge(List.of(list), 1).skippedEntries());
  }

  @Test
  void cidrValidationDropsMalformedValues() throws IOException {
    RulesetMerger validating =
        new RulesetMerger(new StructuredFragmentParser(), new LineListParser(), metrics, true);
    FetchedSource fragment = source("https://h/ip.json",
        "{\"rules\":[{\"ip_cidr\":[\"10.0.0.0/8\",\"999.1.1.1\",\"1.2.3.4/33\",\"2001:db8::/32\"],"
            + "\"source_ip_cidr\":[\"bogus\"],\"domain\":[\"999.1.1.1\"]}]}");

    MergeReport report = validating.merge(List.of(fragment), 1);

    assertEquals(3, report.invalidCidrs());
    assertEquals(List.of("10.0.0.0/8", "2001:db8::/32"), report.ruleset().group("ip_cidr").orElseThrow().values());
    assertFalse(report.ruleset().group("source_ip_cidr").isPresent());
    assertEquals(List.of("999.1.1.1"), report.ruleset().group("domain").orElseThrow().values());
    assertEquals(List.of(3L), metrics.observed("merge.cidr.invalid"));
  }

  @Test
  void sniffsJsonAfterWhitespaceAndBom() throws IOException {
    Path file = tempDir.resolve("sniff.json");
    Files.writeString(file, "\uFEFF  \n[{}]", StandardCharsets.UTF_8);
    Path text = tempDir.resolve("text.json");
    Files.writeString(text, "DOMAIN,a.com", StandardCharsets.UTF_8);

    assertTrue(RulesetMerger.looksLikeJson(file));
    assertFalse(RulesetMerger.looksLikeJson(text));
  }

  private FetchedSource source(String url, String body) throws IOException {
    String name = url.substring(url.lastIndexOf('/') + 1);
    Path file = tempDir.resolve(Integer.toHexString(url.hashCode()) + "_" + name);
    Files.writeString(file, body, StandardCharsets.UTF_8);
    return new FetchedSource(SourceClassifier.classify(url), file);
  }
}
