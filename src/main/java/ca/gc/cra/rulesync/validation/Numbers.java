package ca.gc.cra.rulesync.validation;

/**
 * Numeric validation helpers used by configuration parsing.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer setting and validates its range.
   *
   * @param name setting name for diagnostics
   * @param raw textual value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or is out of range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label + " must be an integer (was '" + raw.trim() + "')", ex);
    }
    return (int) requireRange(label, parsed, min, max);
  }
}
