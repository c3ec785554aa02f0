package com.verlumen.tradeindicators.core;

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class SourceTest {
  private static final BasicCandle CANDLE = BasicCandle.create(10, 14, 8, 12, 500);

  @Test
  public void parse_roundTripsEveryName(@TestParameter Source source) {
    assertThat(Source.parse(source.name())).hasValue(source);
  }

  @Test
  public void parse_ignoresCaseAndWhitespace() {
    assertThat(Source.parse("  close ")).hasValue(Source.CLOSE);
    assertThat(Source.parse("Hl2")).hasValue(Source.HL2);
  }

  @Test
  public void parse_unknownName_returnsEmpty() {
    assertThat(Source.parse("median")).isEmpty();
  }

  @Test
  public void valueOf_readsMatchingCandleValue() {
    assertThat(Source.OPEN.valueOf(CANDLE)).isEqualTo(10.0);
    assertThat(Source.HIGH.valueOf(CANDLE)).isEqualTo(14.0);
    assertThat(Source.LOW.valueOf(CANDLE)).isEqualTo(8.0);
    assertThat(Source.CLOSE.valueOf(CANDLE)).isEqualTo(12.0);
    assertThat(Source.VOLUME.valueOf(CANDLE)).isEqualTo(500.0);
    assertThat(Source.TP.valueOf(CANDLE)).isEqualTo(CANDLE.hlc3());
  }
}
