/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.product.period;

import org.joda.convert.FromString;
import org.joda.convert.ToString;

import com.opengamma.strata.collect.named.EnumNames;
import com.opengamma.strata.collect.named.NamedEnum;

/**
 * The method used to fix the rate of a floating period.
 * <p>
 * The method parameter is a number of business days whose meaning depends on the method.
 */
public enum FixingMethod implements NamedEnum {

  /**
   * Overnight rates compounded on the accrual period, payment delayed after the end of the period.
   * The parameter is the payment delay and does not impact the rate.
   */
  RFR_PAYMENT_DELAY,
  /**
   * Overnight rates compounded on the accrual period, the rate of the last parameter days is
   * the rate fixed on the last non-locked date.
   */
  RFR_LOCKOUT,
  /**
   * Overnight rates compounded with the weights of the accrual period, each rate observed the
   * parameter number of business days earlier.
   */
  RFR_LOOKBACK,
  /**
   * Overnight rates compounded on the observation period, shifted the parameter number of business
   * days before the accrual period. Rates and weights are both taken from the shifted period.
   */
  RFR_OBSERVATION_SHIFT,
  /**
   * Term rate fixed the parameter number of business days before the start of the period.
   */
  IBOR;

  // helper for name conversions
  private static final EnumNames<FixingMethod> NAMES = EnumNames.of(FixingMethod.class);

  //-------------------------------------------------------------------------
  /**
   * Obtains an instance from the specified name.
   * <p>
   * Parsing handles the mixed case and lower case forms, e.g. 'rfr_lockout'.
   * 
   * @param name  the name to parse
   * @return the type
   * @throws IllegalArgumentException if the name is not known
   */
  @FromString
  public static FixingMethod of(String name) {
    return NAMES.parse(name);
  }

  /**
   * Checks if the method compounds overnight rates.
   * 
   * @return true for the overnight methods
   */
  public boolean isOvernight() {
    return this != IBOR;
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the formatted name of the type.
   * 
   * @return the formatted string representing the type
   */
  @ToString
  @Override
  public String toString() {
    return NAMES.format(this);
  }

}
