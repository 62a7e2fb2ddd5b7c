package ca.gc.cra.rulesync.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code name=value} configuration overrides that follow a subcommand.
 *
 * <p>Names are configuration keys such as {@code concurrency} or {@code cacheDir}. Values are trimmed and may be
 * empty so that an override can clear a YAML setting ({@code compilerCommand=}). Only the first {@code '='}
 * separates name from value, which keeps compiler command lines intact.</p>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern OVERRIDE = Pattern.compile("([^=]*)=(.*)", Pattern.DOTALL);
  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9._-]+");

  private CliArgsParser() {}

  /**
   * Collects the overrides in command-line order.
   *
   * @param args raw arguments after the subcommand; {@code null} and blank entries are ignored
   * @return mutable map from override name to trimmed value
   * @throws IllegalArgumentException when an argument has no name, names a key twice or carries control
   *     characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> overrides = new LinkedHashMap<>();
    if (args == null) {
      return overrides;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      Matcher matcher = OVERRIDE.matcher(raw.trim());
      if (!matcher.matches() || matcher.group(1).isBlank()) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String name = matcher.group(1).trim();
      if (!NAME.matcher(name).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + name);
      }
      String value = matcher.group(2).trim();
      if (value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("argument " + name + " must not contain control characters");
      }
      if (overrides.putIfAbsent(name, value) != null) {
        throw new IllegalArgumentException("argument " + name + " given more than once");
      }
    }
    return overrides;
  }
}
