package io.b2mash.invoiceintake.mailbox;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Position in a mailbox change log. Gmail history ids are unsigned 64-bit decimals, so the value is
 * kept as a {@link BigInteger} and compared numerically, never lexically.
 */
public final class HistoryMarker implements Comparable<HistoryMarker> {

  private final BigInteger value;

  private HistoryMarker(BigInteger value) {
    this.value = value;
  }

  public static HistoryMarker parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("History marker is blank");
    }
    BigInteger parsed;
    try {
      parsed = new BigInteger(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("History marker is not numeric: " + raw, e);
    }
    if (parsed.signum() < 0) {
      throw new IllegalArgumentException("History marker is negative: " + raw);
    }
    return new HistoryMarker(parsed);
  }

  public static HistoryMarker of(long value) {
    return parse(Long.toString(value));
  }

  /** Returns the larger of the two markers; a {@code null} argument is ignored. */
  public static HistoryMarker max(HistoryMarker a, HistoryMarker b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.compareTo(b) >= 0 ? a : b;
  }

  public boolean isAfter(HistoryMarker other) {
    return other == null || compareTo(other) > 0;
  }

  /** Unsigned value for APIs that take a numeric start id. */
  public BigInteger value() {
    return value;
  }

  @Override
  public int compareTo(HistoryMarker other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HistoryMarker)) {
      return false;
    }
    return value.equals(((HistoryMarker) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
