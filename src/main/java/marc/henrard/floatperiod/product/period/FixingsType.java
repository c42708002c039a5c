/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.product.period;

/**
 * The shape of the fixings provided to a floating period.
 */
public enum FixingsType {

  /** No fixing provided, all rates are projected. */
  NONE,
  /** A single value. */
  SCALAR,
  /** Values for the first observation dates, oldest first. */
  LIST,
  /** Values indexed by date. */
  SERIES;

}
