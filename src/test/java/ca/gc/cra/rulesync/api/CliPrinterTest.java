package ca.gc.cra.rulesync.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CliPrinterTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void reportAlignsFieldValuesOnOneColumn() {
    CliPrinter.report("Sync summary")
        .field("Rulesets", "2/2 succeeded")
        .field("Output directory", "out/json")
        .line("  + ai: 3 rules")
        .print();

    String[] lines = buffer.toString().split("\\R");
    assertEquals("Sync summary", lines[0]);
    assertEquals(" Rulesets         : 2/2 succeeded", lines[1]);
    assertEquals(" Output directory : out/json", lines[2]);
    assertEquals("  + ai: 3 rules", lines[3]);
    assertEquals(lines[1].indexOf(':'), lines[2].indexOf(':'));
  }

  @Test
  void overlongLabelPushesValueRight() {
    CliPrinter.report("t").field("A label beyond the column", 1).print();

    assertEquals(" A label beyond the column : 1", buffer.toString().split("\\R")[1]);
  }

  @Test
  void printlnWritesMessageVerbatim() {
    CliPrinter.println("usage: cache <info|clear>");

    assertEquals("usage: cache <info|clear>" + System.lineSeparator(), buffer.toString());
  }
}
