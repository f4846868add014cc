package com.consullo.orchestrator.exec;

import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validation of user-influenced CLI argument values.
 *
 * @since 1.0
 */
public final class CliArguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(CliArguments.class);

  static final int MAX_OPAQUE_ID_LENGTH = 128;

  private CliArguments() {
  }

  /**
   * True for canonical UUID text (8-4-4-4-12 hex digits, either case).
   */
  public static boolean isUuid(final String value) {
    if (value == null || value.length() != 36) {
      return false;
    }
    for (int i = 0; i < 36; i++) {
      final char c = value.charAt(i);
      if (i == 8 || i == 13 || i == 18 || i == 23) {
        if (c != '-') {
          return false;
        }
      } else if (!isHex(c)) {
        return false;
      }
    }
    return true;
  }

  /**
   * True for 1-128 characters of letters, digits, '.', '_', ':' or '-',
   * starting with a letter or digit.
   */
  public static boolean isOpaqueId(final String value) {
    if (value == null || value.isEmpty() || value.length() > MAX_OPAQUE_ID_LENGTH) {
      return false;
    }
    if (!isAsciiAlphanumeric(value.charAt(0))) {
      return false;
    }
    for (int i = 1; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (!isAsciiAlphanumeric(c) && c != '.' && c != '_' && c != ':' && c != '-') {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns {@code value} when allowed, else {@code fallback} with a warning.
   * A null or blank value yields the fallback silently.
   */
  public static String allowedOrDefault(
          final String kind,
          final String value,
          final List<String> allowed,
          final String fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    final String trimmed = value.trim();
    if (allowed.contains(trimmed)) {
      return trimmed;
    }
    LOGGER.warn("Invalid {} '{}'; using '{}'", kind, value, fallback);
    return fallback;
  }

  /**
   * True when {@code text} contains any of the lower-case {@code markers},
   * ignoring case.
   */
  public static boolean containsAnyIgnoreCase(final String text, final List<String> markers) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    final String lower = text.toLowerCase(Locale.ROOT);
    for (String marker : markers) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isHex(final char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isAsciiAlphanumeric(final char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }
}
