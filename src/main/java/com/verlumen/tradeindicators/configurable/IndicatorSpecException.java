package com.verlumen.tradeindicators.configurable;

/** Thrown when an indicator group document cannot be read or parsed. */
public class IndicatorSpecException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public IndicatorSpecException(String message) {
    super(message);
  }

  public IndicatorSpecException(String message, Throwable cause) {
    super(message, cause);
  }
}
