package com.verlumen.tradeindicators.methods;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SmaTest {
  @Test
  public void next_averagesWindowStartingFromSeed() {
    Sma sma = new Sma(3, 10.0);

    assertThat(sma.next(10.0)).isWithin(1e-12).of(10.0);
    assertThat(sma.next(11.0)).isWithin(1e-12).of(31.0 / 3);
    assertThat(sma.next(12.0)).isWithin(1e-12).of(11.0);
    assertThat(sma.next(13.0)).isWithin(1e-12).of(12.0);
  }

  @Test
  public void next_recoversOnceNanLeavesWindow() {
    Sma sma = new Sma(2, 10.0);

    assertThat(sma.next(10.0)).isEqualTo(10.0);
    assertThat(sma.next(Double.NaN)).isNaN();
    assertThat(sma.next(10.0)).isNaN();
    assertThat(sma.next(10.0)).isEqualTo(10.0);
    assertThat(sma.next(12.0)).isEqualTo(11.0);
  }

  @Test
  public void next_recoversOnceInfinityLeavesWindow() {
    Sma sma = new Sma(2, 1.0);

    assertThat(sma.next(Double.POSITIVE_INFINITY)).isPositiveInfinity();
    assertThat(sma.next(3.0)).isPositiveInfinity();
    assertThat(sma.next(5.0)).isEqualTo(4.0);
  }

  @Test
  public void next_periodOne_returnsInput() {
    Sma sma = new Sma(1, 4.0);

    assertThat(sma.next(9.0)).isEqualTo(9.0);
    assertThat(sma.next(-2.0)).isEqualTo(-2.0);
  }
}
