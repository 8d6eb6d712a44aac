package com.smartwealth.sectors.discovery.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TickerSymbols {
  private static final Pattern VALID_SYMBOL = Pattern.compile("^[A-Z0-9]{1,5}(-[A-Z0-9]{1,2})?$");

  private TickerSymbols() {}

  /** Uppercases and maps share-class dots to dashes, so BRK.B becomes BRK-B. */
  public static String normalize(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    return trimmed.toUpperCase(Locale.ROOT).replace('.', '-');
  }

  public static boolean isValid(String symbol) {
    return symbol != null && VALID_SYMBOL.matcher(symbol).matches();
  }

  public static String normalizeValid(String raw) {
    String normalized = normalize(raw);
    return isValid(normalized) ? normalized : null;
  }
}
