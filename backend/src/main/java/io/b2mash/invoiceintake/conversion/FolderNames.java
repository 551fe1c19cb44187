package io.b2mash.invoiceintake.conversion;

/** Storage-safe names derived from invoice identities. */
public final class FolderNames {

  static final String DEFAULT_NAME = "invoice";

  private static final String INVALID_CHARS = "<>:\"/\\|?*";

  private FolderNames() {}

  /**
   * Replaces characters that are not allowed in folder names with {@code _}, then trims whitespace
   * and dots. Returns {@code fallback} (or a fixed default) when nothing usable remains.
   */
  public static String safe(String value, String fallback) {
    String cleaned = clean(value);
    if (!cleaned.isEmpty()) {
      return cleaned;
    }
    String cleanedFallback = clean(fallback);
    return cleanedFallback.isEmpty() ? DEFAULT_NAME : cleanedFallback;
  }

  private static String clean(String value) {
    if (value == null) {
      return "";
    }
    var sb = new StringBuilder(value.length());
    for (char ch : value.toCharArray()) {
      sb.append(ch < 32 || INVALID_CHARS.indexOf(ch) >= 0 ? '_' : ch);
    }
    return stripDots(sb.toString().strip());
  }

  private static String stripDots(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '.') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '.') {
      end--;
    }
    return value.substring(start, end).strip();
  }
}
