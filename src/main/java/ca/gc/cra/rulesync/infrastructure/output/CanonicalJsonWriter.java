package ca.gc.cra.rulesync.infrastructure.output;

import ca.gc.cra.rulesync.application.port.RulesetWriterPort;
import ca.gc.cra.rulesync.domain.rules.LogicalRule;
import ca.gc.cra.rulesync.domain.rules.MergedRuleset;
import ca.gc.cra.rulesync.domain.rules.RuleCondition;
import ca.gc.cra.rulesync.domain.rules.RuleGroup;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RulesetWriterPort} that writes the canonical JSON ruleset document.
 * <p><strong>Layout:</strong> {@code {"rules": [...], "version": N}} with object keys in lexicographic order,
 * scalar lists sorted, and lists of objects kept in ruleset order ({@code domain} group first, logical rules
 * last). Two-space indentation, {@code ": "} separators, UTF-8 without escaping non-ASCII text, and a trailing
 * newline.</p>
 * <p><strong>Atomicity:</strong> The document is written to a temporary sibling and moved over the target, so
 * readers never observe a half-written file.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @since 0.1.0
 */
public final class CanonicalJsonWriter implements RulesetWriterPort {
  private static final Logger log = LoggerFactory.getLogger(CanonicalJsonWriter.class);

  private final JsonFactory jsonFactory = new JsonFactory();

  @Override
  public long write(MergedRuleset ruleset, Path target) throws IOException {
    Objects.requireNonNull(ruleset, "ruleset");
    Objects.requireNonNull(target, "target");
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
          JsonGenerator gen = jsonFactory.createGenerator(out, JsonEncoding.UTF8)) {
        gen.setPrettyPrinter(new TwoSpacePrinter());
        writeDocument(gen, ruleset);
        gen.writeRaw('\n');
      }
      move(temp, absolute);
    } finally {
      Files.deleteIfExists(temp);
    }
    long size = Files.size(absolute);
    log.debug("Wrote {} ({} bytes, {} rules)", absolute, size, ruleset.ruleCount());
    return size;
  }

  private void writeDocument(JsonGenerator gen, MergedRuleset ruleset) throws IOException {
    gen.writeStartObject();
    gen.writeArrayFieldStart("rules");
    for (RuleGroup group : ruleset.groups()) {
      gen.writeStartObject();
      writeSortedStrings(gen, group.type(), group.values());
      gen.writeEndObject();
    }
    for (LogicalRule rule : ruleset.logicalRules()) {
      writeLogical(gen, rule);
    }
    gen.writeEndArray();
    gen.writeNumberField("version", ruleset.version());
    gen.writeEndObject();
  }

  private void writeLogical(JsonGenerator gen, LogicalRule rule) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("mode", rule.mode());
    gen.writeArrayFieldStart("rules");
    for (RuleCondition condition : rule.conditions()) {
      gen.writeStartObject();
      gen.writeStringField(condition.type(), condition.value());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeStringField("type", "logical");
    gen.writeEndObject();
  }

  private static void writeSortedStrings(JsonGenerator gen, String field, List<String> values) throws IOException {
    List<String> sorted = new ArrayList<>(values);
    sorted.sort(null);
    gen.writeArrayFieldStart(field);
    for (String value : sorted) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** Pretty printer producing {@code "key": value} entries, two-space indents and compact empty arrays. */
  static final class TwoSpacePrinter extends DefaultPrettyPrinter {
    private static final long serialVersionUID = 1L;

    TwoSpacePrinter() {
      DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
      indentArraysWith(indenter);
      indentObjectsWith(indenter);
    }

    private TwoSpacePrinter(TwoSpacePrinter base) {
      super(base);
    }

    @Override
    public TwoSpacePrinter createInstance() {
      return new TwoSpacePrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(": ");
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
      if (nrOfValues == 0) {
        _nesting--;
        g.writeRaw(']');
        return;
      }
      super.writeEndArray(g, nrOfValues);
    }
  }
}
