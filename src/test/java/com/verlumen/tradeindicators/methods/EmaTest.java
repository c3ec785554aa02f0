package com.verlumen.tradeindicators.methods;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EmaTest {
  @Test
  public void ofPeriod_usesTwoOverPeriodPlusOne() {
    Ema ema = Ema.ofPeriod(3, 10.0);

    assertThat(ema.next(14.0)).isWithin(1e-12).of(12.0);
    assertThat(ema.next(12.0)).isWithin(1e-12).of(12.0);
    assertThat(ema.value()).isWithin(1e-12).of(12.0);
  }

  @Test
  public void wilder_usesOneOverPeriod() {
    Ema ema = Ema.wilder(4, 0.0);

    assertThat(ema.next(8.0)).isWithin(1e-12).of(2.0);
    assertThat(ema.next(2.0)).isWithin(1e-12).of(2.0);
  }

  @Test
  public void constantInput_staysAtSeed() {
    Ema ema = Ema.ofPeriod(20, 5.0);

    for (int i = 0; i < 100; i++) {
      assertThat(ema.next(5.0)).isEqualTo(5.0);
    }
  }

  @Test
  public void ofPeriod_largestInt_keepsPositiveFactor() {
    Ema ema = Ema.ofPeriod(Integer.MAX_VALUE, 10.0);

    assertThat(ema.next(10.0)).isEqualTo(10.0);
  }

  @Test
  public void ofPeriod_nonPositivePeriod_throws() {
    assertThrows(IllegalArgumentException.class, () -> Ema.ofPeriod(0, 1.0));
    assertThrows(IllegalArgumentException.class, () -> Ema.wilder(-1, 1.0));
  }
}
