package ca.gc.cra.rulesync.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * IP address and CIDR prefix checks used when classifying plain list entries and when
 * {@code validateCidr} is enabled.
 *
 * <p>No method performs name resolution: IPv6 candidates are screened to hex digits, colons and dots
 * before being handed to {@link InetAddress}, which then parses them as literals.</p>
 */
public final class Net {

  // IPv4 dotted-quad shape (fast pre-check); octets are range-checked separately.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern IPV6_CHARS = Pattern.compile("\\A[0-9A-Fa-f:.]+\\z");
  private static final Pattern PREFIX_PATTERN = Pattern.compile("\\A\\d{1,3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Cheap shape test used to route bare list tokens to {@code ip_cidr} rather than {@code domain}.
   *
   * @param token trimmed list entry
   * @return {@code true} when the token is shaped like an IPv4/IPv6 address with an optional prefix
   */
  public static boolean looksLikeIpOrCidr(String token) {
    if (token == null || token.isEmpty()) {
      return false;
    }
    String address = stripPrefix(token);
    if (IPV4_PATTERN.matcher(address).matches()) {
      return true;
    }
    return address.indexOf(':') >= 0 && IPV6_CHARS.matcher(address).matches();
  }

  /**
   * Validates an address or {@code address/prefix} pair.
   *
   * @param value candidate such as {@code 10.0.0.0/8} or {@code 2001:db8::/32}
   * @return {@code true} when the address parses and the prefix fits its family
   */
  public static boolean isValidIpOrCidr(String value) {
    if (value == null) {
      return false;
    }
    String trimmed = value.trim();
    int slash = trimmed.indexOf('/');
    String address = slash < 0 ? trimmed : trimmed.substring(0, slash);
    if (IPV4_PATTERN.matcher(address).matches()) {
      return validIpv4Octets(address) && validPrefix(trimmed, slash, 32);
    }
    if (address.indexOf(':') >= 0 && IPV6_CHARS.matcher(address).matches()) {
      return validIpv6(address) && validPrefix(trimmed, slash, 128);
    }
    return false;
  }

  private static String stripPrefix(String token) {
    int slash = token.indexOf('/');
    if (slash < 0) {
      return token;
    }
    String prefix = token.substring(slash + 1);
    return PREFIX_PATTERN.matcher(prefix).matches() ? token.substring(0, slash) : token;
  }

  private static boolean validPrefix(String value, int slash, int max) {
    if (slash < 0) {
      return true;
    }
    String prefix = value.substring(slash + 1);
    if (!PREFIX_PATTERN.matcher(prefix).matches()) {
      return false;
    }
    int bits = Integer.parseInt(prefix);
    return bits >= 0 && bits <= max;
  }

  /** Parses and range-checks IPv4 octets (0..255). */
  private static boolean validIpv4Octets(String host) {
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      final int octet = Integer.parseInt(host.substring(startIndex, endIndex));
      if (octet > 255) {
        return false;
      }
      startIndex = endIndex + 1;
    }
    return true;
  }

  /** Validates a raw IPv6 literal (without brackets) using JDK literal parsing. */
  private static boolean validIpv6(String host) {
    try {
      return InetAddress.getByName(host) instanceof Inet6Address;
    } catch (UnknownHostException ex) {
      return false;
    }
  }
}
