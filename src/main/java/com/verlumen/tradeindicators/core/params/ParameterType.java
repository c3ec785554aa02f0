package com.verlumen.tradeindicators.core.params;

/** Value type of an indicator parameter. */
public enum ParameterType {
  INTEGER,
  DOUBLE,
  SOURCE,
  BOOLEAN
}
