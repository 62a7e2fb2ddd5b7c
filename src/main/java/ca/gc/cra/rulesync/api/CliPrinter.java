package ca.gc.cra.rulesync.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Console output for usage text, dry-run plans, sync summaries and cache reports.
 *
 * <p>Reports are assembled with {@link #report(String)} so that every {@code label : value} row lines up on the
 * same column. Output goes to the stdout file descriptor and stays separate from log output.</p>
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  static final int LABEL_WIDTH = 16;

  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  /**
   * Prints usage text or a one-line result.
   *
   * @param message text to emit; may span several lines
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Starts a report under the given title.
   *
   * @param title first line of the report
   * @return builder that prints once {@link Report#print()} is called
   */
  static Report report(String title) {
    return new Report(Objects.requireNonNull(title, "title"));
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }

  /** Collects report rows and writes them in a single pass. */
  static final class Report {
    private final List<String> lines = new ArrayList<>();

    private Report(String title) {
      lines.add(title);
    }

    /** Adds an aligned {@code label : value} row; labels longer than the column push the value right. */
    Report field(String label, Object value) {
      StringBuilder row = new StringBuilder(" ").append(label);
      for (int pad = label.length(); pad < LABEL_WIDTH; pad++) {
        row.append(' ');
      }
      lines.add(row.append(" : ").append(value).toString());
      return this;
    }

    /** Adds a free-form row, indented by the caller. */
    Report line(String text) {
      lines.add(text);
      return this;
    }

    void print() {
      PrintWriter out = writer();
      for (String line : lines) {
        out.println(line);
      }
    }
  }
}
