/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.market.curve;

import java.time.LocalDate;

import com.opengamma.strata.market.param.CurrencyParameterSensitivities;

/**
 * Curve described by discount factors.
 * 
 * @author Marc Henrard
 */
public interface DiscountCurve extends RateCurve {

  /**
   * Returns the discount factor at a date.
   * 
   * @param date  the date
   * @return the discount factor
   */
  public abstract double discountFactor(LocalDate date);

  /**
   * Returns the sensitivity of the discount factor at a date to the curve parameters.
   * <p>
   * Available only when the derivative order is at least 1. Curve-level utility for callers computing
   * parameter risk; the period pricers only use the discount factors.
   * 
   * @param date  the date
   * @return the parameter sensitivities
   */
  public abstract CurrencyParameterSensitivities discountFactorSensitivity(LocalDate date);

}
