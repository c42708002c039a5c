/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

/**
 * The origin of the rate of an observation date.
 */
public enum FixingProvenance {

  /** The rate is provided by the fixings of the period. */
  OVERRIDE,
  /** The rate is projected from a curve. */
  PROJECTED;

}
