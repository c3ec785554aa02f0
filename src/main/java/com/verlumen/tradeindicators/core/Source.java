package com.verlumen.tradeindicators.core;

import com.google.common.base.Ascii;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/** Selects which value of a {@link Candle} an indicator reads. */
public enum Source {
  OPEN(Candle::open),
  HIGH(Candle::high),
  LOW(Candle::low),
  CLOSE(Candle::close),
  VOLUME(Candle::volume),
  HL2(Candle::hl2),
  TP(Candle::hlc3),
  OHLC4(Candle::ohlc4);

  private final ToDoubleFunction<Candle> extractor;

  Source(ToDoubleFunction<Candle> extractor) {
    this.extractor = extractor;
  }

  public double valueOf(Candle candle) {
    return extractor.applyAsDouble(candle);
  }

  /**
   * Parses a source name, ignoring case and surrounding whitespace.
   *
   * @return the matching source, or empty if {@code text} names none
   */
  public static Optional<Source> parse(String text) {
    String normalized = Ascii.toUpperCase(text.trim());
    for (Source source : values()) {
      if (source.name().equals(normalized)) {
        return Optional.of(source);
      }
    }
    return Optional.empty();
  }
}
