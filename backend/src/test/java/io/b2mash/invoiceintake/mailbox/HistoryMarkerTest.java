package io.b2mash.invoiceintake.mailbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HistoryMarkerTest {

  @Test
  void compareTo_ordersNumericallyNotLexically() {
    assertThat(HistoryMarker.parse("9").compareTo(HistoryMarker.parse("10"))).isNegative();
    assertThat(HistoryMarker.parse("10").isAfter(HistoryMarker.parse("9"))).isTrue();
  }

  @Test
  void parse_acceptsValuesBeyondSignedLongRange() {
    var marker = HistoryMarker.parse("18446744073709551615");

    assertThat(marker.isAfter(HistoryMarker.of(Long.MAX_VALUE))).isTrue();
    assertThat(marker.toString()).isEqualTo("18446744073709551615");
  }

  @Test
  void parse_rejectsBlankNonNumericAndNegative() {
    assertThatThrownBy(() -> HistoryMarker.parse(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> HistoryMarker.parse("12a"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> HistoryMarker.parse("-1"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void max_ignoresNullAndPicksLarger() {
    var five = HistoryMarker.of(5);
    var seven = HistoryMarker.of(7);

    assertThat(HistoryMarker.max(null, five)).isEqualTo(five);
    assertThat(HistoryMarker.max(seven, null)).isEqualTo(seven);
    assertThat(HistoryMarker.max(five, seven)).isEqualTo(seven);
    assertThat(HistoryMarker.max(seven, five)).isEqualTo(seven);
  }

  @Test
  void isAfter_nullMeansNoCursorYet() {
    assertThat(HistoryMarker.of(1).isAfter(null)).isTrue();
    assertThat(HistoryMarker.of(3).isAfter(HistoryMarker.of(3))).isFalse();
  }
}
