/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.market.curve;

import java.time.LocalDate;
import java.util.OptionalDouble;

import com.opengamma.strata.basics.date.DayCount;
import com.opengamma.strata.market.param.UnitParameterSensitivity;

/**
 * Curve described directly by rate values at each date.
 * <p>
 * The forward rate of a period is the value at its start date and the term rate is the
 * value at the fixing date.
 * 
 * @author Marc Henrard
 */
public interface ValueCurve extends RateCurve {

  /**
   * Returns the value of the curve at a date.
   * 
   * @param date  the date
   * @return the value, in percent, if available
   */
  public abstract OptionalDouble valueAt(LocalDate date);

  /**
   * Returns the sensitivity of the value at a date to the curve parameters.
   * <p>
   * Available only when the derivative order is at least 1 and the value is available. Curve-level
   * utility for callers computing parameter risk; the period pricers only use the values.
   * 
   * @param date  the date
   * @return the parameter sensitivity
   */
  public abstract UnitParameterSensitivity valueSensitivity(LocalDate date);

  @Override
  public default OptionalDouble forwardRate(LocalDate startDate, LocalDate endDate, DayCount dayCount) {
    return valueAt(startDate);
  }

  @Override
  public default OptionalDouble termRate(
      LocalDate fixingDate,
      LocalDate startDate,
      LocalDate endDate,
      DayCount dayCount) {

    return valueAt(fixingDate);
  }

}
