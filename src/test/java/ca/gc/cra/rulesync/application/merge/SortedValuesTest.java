package ca.gc.cra.rulesync.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SortedValuesTest {

  @Test
  void chunkedSortMatchesSingleSort() {
    Random random = new Random(42);
    List<String> values = new ArrayList<>();
    for (int i = 0; i < 2_345; i++) {
      values.add(Integer.toHexString(random.nextInt()) + ".example.com");
    }
    List<String> expected = new ArrayList<>(values);
    Collections.sort(expected);

    assertEquals(expected, SortedValues.chunkedSort(values, 100));
    assertEquals(expected, SortedValues.chunkedSort(values, 7));
    assertEquals(expected, SortedValues.sort(values));
  }

  @Test
  void largeSetsTakeChunkedPath() {
    List<String> values = new ArrayList<>();
    for (int i = SortedValues.CHUNKED_THRESHOLD + 10; i > 0; i--) {
      values.add(String.format("%08d", i));
    }

    List<String> sorted = SortedValues.sort(values);

    assertEquals(values.size(), sorted.size());
    assertEquals("00000001", sorted.get(0));
    assertEquals(String.format("%08d", SortedValues.CHUNKED_THRESHOLD + 10), sorted.get(sorted.size() - 1));
  }

  @Test
  void emptyInputYieldsEmptyList() {
    assertEquals(List.of(), SortedValues.chunkedSort(List.of(), 10));
  }

  @Test
  void rejectsNonPositiveChunkSize() {
    assertThrows(IllegalArgumentException.class, () -> SortedValues.chunkedSort(List.of("a"), 0));
  }
}
