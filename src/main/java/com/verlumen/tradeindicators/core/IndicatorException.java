package com.verlumen.tradeindicators.core;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Failure raised while configuring or initializing an indicator.
 *
 * <p>Once an {@link IndicatorInstance} exists it never raises this exception.
 */
public class IndicatorException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Closed set of failure kinds. */
  public enum Kind {
    /** Rejected parameter name or value, or a configuration that fails validation. */
    INVALID_PARAMETER,
    /** The parameters cannot be seeded from the supplied candle. */
    INCOMPATIBLE_SEED,
    /** A failure specific to one indicator kind. */
    INDICATOR_SPECIFIC
  }

  private final Kind kind;

  public IndicatorException(Kind kind, String message) {
    super(message);
    this.kind = checkNotNull(kind);
  }

  public IndicatorException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = checkNotNull(kind);
  }

  public static IndicatorException invalidParameter(String message) {
    return new IndicatorException(Kind.INVALID_PARAMETER, message);
  }

  public static IndicatorException invalidParameter(String message, Throwable cause) {
    return new IndicatorException(Kind.INVALID_PARAMETER, message, cause);
  }

  public static IndicatorException incompatibleSeed(String message) {
    return new IndicatorException(Kind.INCOMPATIBLE_SEED, message);
  }

  public Kind getKind() {
    return kind;
  }
}
