package com.verlumen.tradeindicators.methods;

import com.verlumen.tradeindicators.core.Action;

/**
 * Detects when one series crosses another. Comparisons involving {@code NaN} never report a
 * cross.
 */
public final class Cross {
  private double lastA;
  private double lastB;

  public Cross(double seedA, double seedB) {
    this.lastA = seedA;
    this.lastB = seedB;
  }

  /**
   * Returns {@link Action#BUY_ALL} when {@code a} moves above {@code b}, {@link Action#SELL_ALL}
   * when it moves below, {@link Action#NONE} otherwise.
   */
  public Action next(double a, double b) {
    boolean crossedAbove = lastA <= lastB && a > b;
    boolean crossedBelow = lastA >= lastB && a < b;
    lastA = a;
    lastB = b;
    if (crossedAbove) {
      return Action.BUY_ALL;
    }
    return crossedBelow ? Action.SELL_ALL : Action.NONE;
  }
}
