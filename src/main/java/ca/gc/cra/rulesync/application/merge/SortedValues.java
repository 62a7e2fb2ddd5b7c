package ca.gc.cra.rulesync.application.merge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Lexicographic sorting of rule values.
 *
 * <p>Sets above {@link #CHUNKED_THRESHOLD} values are sorted in chunks of {@link #CHUNK_SIZE} which are then
 * k-way merged, so the result is globally ordered and identical to a single sort.</p>
 */
final class SortedValues {
  static final int CHUNKED_THRESHOLD = 50_000;
  static final int CHUNK_SIZE = 10_000;

  private SortedValues() {}

  static List<String> sort(Collection<String> values) {
    if (values.size() <= CHUNKED_THRESHOLD) {
      List<String> sorted = new ArrayList<>(values);
      Collections.sort(sorted);
      return sorted;
    }
    return chunkedSort(values, CHUNK_SIZE);
  }

  static List<String> chunkedSort(Collection<String> values, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive");
    }
    List<List<String>> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>(Math.min(chunkSize, values.size()));
    for (String value : values) {
      current.add(value);
      if (current.size() == chunkSize) {
        Collections.sort(current);
        chunks.add(current);
        current = new ArrayList<>(chunkSize);
      }
    }
    if (!current.isEmpty()) {
      Collections.sort(current);
      chunks.add(current);
    }

    PriorityQueue<Cursor> heads = new PriorityQueue<>(Math.max(1, chunks.size()));
    for (List<String> chunk : chunks) {
      Iterator<String> it = chunk.iterator();
      heads.add(new Cursor(it.next(), it));
    }
    List<String> merged = new ArrayList<>(values.size());
    while (!heads.isEmpty()) {
      Cursor head = heads.poll();
      merged.add(head.value);
      if (head.rest.hasNext()) {
        heads.add(new Cursor(head.rest.next(), head.rest));
      }
    }
    return merged;
  }

  private static final class Cursor implements Comparable<Cursor> {
    private final String value;
    private final Iterator<String> rest;

    private Cursor(String value, Iterator<String> rest) {
      this.value = value;
      this.rest = rest;
    }

    @Override
    public int compareTo(Cursor other) {
      return value.compareTo(other.value);
    }
  }
}
