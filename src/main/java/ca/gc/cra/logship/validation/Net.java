package ca.gc.cra.logship.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation utilities for collector addresses.
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH    = 63;

  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a collector host: a hostname, an IPv4 literal, or an IPv6 literal with or without brackets.
   *
   * @param value candidate host
   * @return trimmed host with IPv6 brackets removed
   * @throws IllegalArgumentException if the host is malformed
   */
  public static String validateHost(String value) {
    String sanitized = Strings.requireNonBlank("host", value);
    if (sanitized.startsWith("[")) {
      if (!sanitized.endsWith("]")) {
        throw new IllegalArgumentException("host must close IPv6 literal with ']'");
      }
      String literal = sanitized.substring(1, sanitized.length() - 1);
      validateIpv6(literal);
      return literal;
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(sanitized);
      return sanitized;
    }
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
      return sanitized;
    }
    validateHostname(sanitized);
    return sanitized;
  }

  /**
   * Validates a TCP port number.
   *
   * @param port candidate port
   * @return the validated port
   * @throws IllegalArgumentException if the port lies outside {@code 1..65535}
   */
  public static int validatePort(int port) {
    return (int) Numbers.requireRange("port", port, 1, 65535);
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static void validateHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  /**
   * Validates a single label [start,end):
   * - length 1..63
   * - first/last are alnum
   * - interior chars are alnum or '-'
   */
  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }

    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }

    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-' || c == '_')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      final int octet = Integer.parseInt(host.substring(startIndex, endIndex));
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      startIndex = endIndex + 1;
    }
  }

  private static void validateIpv6(String host) {
    try {
      final InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
