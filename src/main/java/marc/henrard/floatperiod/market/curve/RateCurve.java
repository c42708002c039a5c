/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.market.curve;

import java.time.LocalDate;
import java.util.OptionalDouble;

import com.opengamma.strata.basics.date.DayCount;

/**
 * Curve capability used to project reference rates.
 * <p>
 * Rates are expressed in percent. A curve may be unable to provide a value for some dates,
 * in which case an empty optional is returned.
 * <p>
 * The derivative order is a read-only capability toggle for the pricing engine. Changing it is
 * a mutation of the curve instance and must not be done concurrently with its use.
 * 
 * @author Marc Henrard
 */
public interface RateCurve {

  /**
   * Returns the forward rate between two dates.
   * 
   * @param startDate  the start date of the rate period
   * @param endDate  the end date of the rate period
   * @param dayCount  the day count used to compute the accrual factor of the period
   * @return the rate, in percent, if available
   */
  public abstract OptionalDouble forwardRate(LocalDate startDate, LocalDate endDate, DayCount dayCount);

  /**
   * Returns the term rate for a fixing date and its underlying deposit period.
   * <p>
   * By default, the forward rate over the deposit period.
   * 
   * @param fixingDate  the fixing date
   * @param startDate  the start date of the underlying deposit
   * @param endDate  the end date of the underlying deposit
   * @param dayCount  the day count of the deposit
   * @return the rate, in percent, if available
   */
  public default OptionalDouble termRate(
      LocalDate fixingDate,
      LocalDate startDate,
      LocalDate endDate,
      DayCount dayCount) {

    return forwardRate(startDate, endDate, dayCount);
  }

  /**
   * Returns the derivative order currently computed by the curve.
   * 
   * @return the order
   */
  public abstract int getDerivativeOrder();

  /**
   * Sets the derivative order computed by the curve. 0 for values only, 1 or 2 for sensitivities.
   * 
   * @param order  the order
   */
  public abstract void setDerivativeOrder(int order);

}
