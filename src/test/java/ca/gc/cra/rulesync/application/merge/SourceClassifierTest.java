package ca.gc.cra.rulesync.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.rulesync.domain.source.SourceKind;
import org.junit.jupiter.api.Test;

class SourceClassifierTest {

  @Test
  void jsonAndListUrlsAreFragments() {
    assertEquals(SourceKind.STRUCTURED_FRAGMENT, SourceClassifier.classify("https://h/rules/ai.json").kind());
    assertEquals(SourceKind.STRUCTURED_FRAGMENT, SourceClassifier.classify("https://h/rules/ai.JSONL").kind());
    assertEquals(SourceKind.STRUCTURED_FRAGMENT, SourceClassifier.classify("https://h/ai.list").kind());
    assertEquals(SourceKind.STRUCTURED_FRAGMENT, SourceClassifier.classify("https://h/json/ai").kind());
  }

  @Test
  void everythingElseIsLineList() {
    assertEquals(SourceKind.LINE_LIST, SourceClassifier.classify("https://h/rules/ai.txt").kind());
    assertEquals(SourceKind.LINE_LIST, SourceClassifier.classify("https://h/rules/ai.yaml").kind());
  }

  @Test
  void trimsUrlAndRejectsBlank() {
    assertEquals("https://h/a.txt", SourceClassifier.classify("  https://h/a.txt ").url());
    assertThrows(IllegalArgumentException.class, () -> SourceClassifier.classify(" "));
  }
}
