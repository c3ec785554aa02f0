package com.verlumen.tradeindicators.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * A trading signal emitted by an indicator.
 *
 * <p>Positive strength means buy, negative means sell, zero means no signal. The magnitude is at
 * most {@link #MAX_STRENGTH}.
 */
@AutoValue
public abstract class Action {
  public static final int MAX_STRENGTH = 255;

  public static final Action NONE = of(0);
  public static final Action BUY_ALL = of(MAX_STRENGTH);
  public static final Action SELL_ALL = of(-MAX_STRENGTH);

  /** Signed strength in {@code [-MAX_STRENGTH, MAX_STRENGTH]}. */
  public abstract int strength();

  public static Action buy(int strength) {
    checkArgument(strength >= 0, "Buy strength must not be negative: %s", strength);
    return of(strength);
  }

  public static Action sell(int strength) {
    checkArgument(strength >= 0, "Sell strength must not be negative: %s", strength);
    return of(-strength);
  }

  /**
   * Maps an analog signal in {@code [-1, 1]} to an action. Values outside the range are clamped and
   * {@code NaN} maps to {@link #NONE}.
   */
  public static Action fromAnalog(double value) {
    if (Double.isNaN(value)) {
      return NONE;
    }
    double clamped = Math.max(-1.0, Math.min(1.0, value));
    return of((int) Math.round(clamped * MAX_STRENGTH));
  }

  /** Maps the sign of {@code direction} to {@link #BUY_ALL}, {@link #SELL_ALL} or {@link #NONE}. */
  public static Action fromSign(int direction) {
    return direction > 0 ? BUY_ALL : direction < 0 ? SELL_ALL : NONE;
  }

  private static Action of(int strength) {
    checkArgument(
        Math.abs(strength) <= MAX_STRENGTH,
        "Action strength must be within [-%s, %s]: %s",
        MAX_STRENGTH,
        MAX_STRENGTH,
        strength);
    return new AutoValue_Action(strength);
  }

  public int sign() {
    return Integer.signum(strength());
  }

  public boolean isNone() {
    return strength() == 0;
  }

  /** Returns the strength scaled back to {@code [-1, 1]}. */
  public double analog() {
    return strength() / (double) MAX_STRENGTH;
  }
}
