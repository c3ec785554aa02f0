package com.verlumen.tradeindicators.indicators;

import com.google.common.collect.Range;

/** Bounds shared by the window lengths of every indicator kind. */
final class Periods {
  /** Longest window any indicator accepts. */
  static final int MAX_PERIOD = 10_000;

  /** Returns the accepted periods starting at {@code min}. */
  static Range<Integer> from(int min) {
    return Range.closed(min, MAX_PERIOD);
  }

  private Periods() {}
}
