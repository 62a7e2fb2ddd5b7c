package ca.gc.cra.rulesync.application.merge;

import ca.gc.cra.rulesync.domain.rules.LogicalRule;
import ca.gc.cra.rulesync.domain.rules.RuleCondition;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Streams a JSON rule fragment from disk into a {@link RuleAccumulator}.
 * <p><strong>Format:</strong> {@code {"version": N, "rules": [{"type": ["v1", "v2"]}, ...]}}. Every
 * {@code (key, array)} pair of every rule object is folded value by value; non-string elements and non-array
 * fields are skipped. Objects carrying {@code "type": "logical"} are kept as {@link LogicalRule}s. A document
 * without a {@code rules} array is treated as a single rule object.</p>
 * <p><strong>Why streaming:</strong> Some upstream fragments hold hundreds of thousands of CIDRs; the Jackson
 * streaming parser never materialises the document tree.</p>
 * <p><strong>Thread-safety:</strong> {@link JsonFactory} is thread-safe; instances may be shared.</p>
 *
 * @since 0.1.0
 */
public final class StructuredFragmentParser {
  private static final Logger log = LoggerFactory.getLogger(StructuredFragmentParser.class);
  private static final String RULES_FIELD = "rules";
  private static final String LOGICAL_TYPE = "logical";

  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses {@code file} into {@code target}.
   *
   * @param file JSON fragment
   * @param target accumulator receiving values and logical rules
   * @throws IOException when the file cannot be read or is not well-formed JSON
   */
  public void parse(Path file, RuleAccumulator target) throws IOException {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(target, "target");
    try (JsonParser parser = factory.createParser(file.toFile())) {
      JsonToken first = parser.nextToken();
      if (first == null) {
        log.debug("Fragment {} is empty", file);
        return;
      }
      if (first == JsonToken.START_ARRAY) {
        readRuleArray(parser, target);
      } else if (first == JsonToken.START_OBJECT) {
        readDocument(parser, target);
      } else {
        throw new JsonParseException(parser, "fragment must be a JSON object or array, found " + first);
      }
    }
  }

  private void readDocument(JsonParser parser, RuleAccumulator target) throws IOException {
    // Root-level arrays only count when the document turns out to have no rules array.
    RuleAccumulator rootAsRule = new RuleAccumulator();
    RuleObject rootObject = new RuleObject();
    boolean sawRules = false;
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if (RULES_FIELD.equals(field) && value == JsonToken.START_ARRAY && !sawRules) {
        sawRules = true;
        readRuleArray(parser, target);
      } else {
        readField(parser, field, value, rootAsRule, rootObject);
      }
    }
    if (!sawRules) {
      target.addAll(rootAsRule);
      rootObject.logicalRule().ifPresent(target::addLogical);
    }
  }

  private void readRuleArray(JsonParser parser, RuleAccumulator target) throws IOException {
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (token == null) {
        throw new JsonParseException(parser, "unterminated rules array");
      }
      if (token != JsonToken.START_OBJECT) {
        parser.skipChildren();
        continue;
      }
      RuleObject rule = new RuleObject();
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        readField(parser, field, value, target, rule);
      }
      rule.logicalRule().ifPresent(target::addLogical);
    }
  }

  private void readField(
      JsonParser parser, String field, JsonToken value, RuleAccumulator target, RuleObject rule)
      throws IOException {
    switch (value) {
      case START_ARRAY -> readArray(parser, field, target, rule);
      case VALUE_STRING -> {
        if ("type".equals(field)) {
          rule.type = parser.getText();
        } else if ("mode".equals(field)) {
          rule.mode = parser.getText();
        }
      }
      default -> parser.skipChildren();
    }
  }

  private void readArray(JsonParser parser, String field, RuleAccumulator target, RuleObject rule)
      throws IOException {
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (token == null) {
        throw new JsonParseException(parser, "unterminated array for " + field);
      }
      if (RULES_FIELD.equals(field)) {
        // Only condition objects belong under a nested rules key; it never names a rule group.
        if (token == JsonToken.START_OBJECT) {
          readCondition(parser, rule);
        } else {
          parser.skipChildren();
        }
      } else if (token == JsonToken.VALUE_STRING) {
        target.add(field, parser.getText());
      } else {
        parser.skipChildren();
      }
    }
  }

  private void readCondition(JsonParser parser, RuleObject rule) throws IOException {
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String type = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      boolean scalar = value == JsonToken.VALUE_STRING || value == JsonToken.VALUE_NUMBER_INT;
      if (scalar && !type.isBlank()) {
        rule.conditions.add(new RuleCondition(type, parser.getText()));
      } else {
        parser.skipChildren();
      }
    }
  }

  /** Scalar attributes of the rule object being read. */
  private static final class RuleObject {
    private String type;
    private String mode;
    private final List<RuleCondition> conditions = new ArrayList<>();

    Optional<LogicalRule> logicalRule() {
      if (type == null || !LOGICAL_TYPE.equals(type.trim().toLowerCase(Locale.ROOT))) {
        return Optional.empty();
      }
      if (conditions.isEmpty()) {
        log.debug("Ignoring logical rule without conditions");
        return Optional.empty();
      }
      String effectiveMode = (mode == null || mode.isBlank())
          ? LogicalRule.MODE_AND
          : mode.trim().toLowerCase(Locale.ROOT);
      return Optional.of(new LogicalRule(effectiveMode, conditions));
    }
  }
}
