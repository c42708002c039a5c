/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.OptionalDouble;

import com.opengamma.strata.basics.date.BusinessDayConventions;
import com.opengamma.strata.basics.date.HolidayCalendar;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.Messages;
import com.opengamma.strata.data.MarketDataNotFoundException;

import marc.henrard.floatperiod.market.curve.RateCurve;
import marc.henrard.floatperiod.product.period.AccrualPeriod;
import marc.henrard.floatperiod.product.period.FixingMethod;
import marc.henrard.floatperiod.product.period.Fixings;
import marc.henrard.floatperiod.product.period.FixingsType;
import marc.henrard.floatperiod.product.period.FloatingPeriodConfig;

/**
 * Resolves the fixing of a term rate (IBOR-like) period.
 * <p>
 * The fixing date is the start date shifted back by the method parameter number of business days.
 * The rate is, in order of priority, the single value fixing, the value of the fixing series on
 * the fixing date or the term rate of the curve. The underlying deposit of the term rate starts on
 * the period start date and ends one frequency later, adjusted modified following, or on the period
 * end date for a stub.
 * 
 * @author Marc Henrard
 */
public final class TermRateResolver {

  /** Default implementation. */
  public static final TermRateResolver DEFAULT = new TermRateResolver();

  /**
   * Returns the fixing date of the period.
   * 
   * @param period  the accrual period
   * @param config  the floating rate configuration
   * @return the fixing date
   */
  public LocalDate fixingDate(AccrualPeriod period, FloatingPeriodConfig config) {
    return config.getFixingCalendar().shift(period.getStartDate(), -config.getMethodParam());
  }

  /**
   * Returns the end date of the deposit underlying the term rate.
   * 
   * @param period  the accrual period
   * @param config  the floating rate configuration
   * @return the end date
   */
  public LocalDate depositEndDate(AccrualPeriod period, FloatingPeriodConfig config) {
    if (period.isStub()) {
      return period.getEndDate();
    }
    HolidayCalendar calendar = config.getFixingCalendar();
    return BusinessDayConventions.MODIFIED_FOLLOWING.adjust(period.getStartDate().plus(period.getFrequency()), calendar);
  }

  /**
   * Resolves the fixing of the period.
   * 
   * @param period  the accrual period
   * @param config  the floating rate configuration, with the IBOR fixing method
   * @param curve  the curve used to project the rate, may be null if the rate is fixed
   * @return the fixing, without spread
   * @throws MarketDataNotFoundException if the rate can not be projected
   * @throws IllegalArgumentException if the fixings series is not increasing
   */
  public TermFixing resolve(AccrualPeriod period, FloatingPeriodConfig config, RateCurve curve) {
    ArgChecker.notNull(period, "period");
    ArgChecker.notNull(config, "config");
    ArgChecker.isTrue(config.getFixingMethod() == FixingMethod.IBOR,
        "term rate requires the {} fixing method, found {}", FixingMethod.IBOR, config.getFixingMethod());
    LocalDate fixingDate = fixingDate(period, config);
    Fixings fixings = config.getFixings();
    if (fixings.getType() == FixingsType.SCALAR) {
      return new TermFixing(fixingDate, fixings.getScalar(), FixingProvenance.OVERRIDE);
    }
    if (fixings.getType() == FixingsType.SERIES) {
      ArgChecker.isTrue(fixings.isIncreasing(), "fixings as a series must be increasing, found {}",
          fixings.getDates());
      OptionalDouble fixed = fixings.seriesValue(fixingDate);
      if (fixed.isPresent()) {
        return new TermFixing(fixingDate, fixed.getAsDouble(), FixingProvenance.OVERRIDE);
      }
    }
    if (curve == null) {
      throw new MarketDataNotFoundException(Messages.format(
          "term rate could not be calculated: no curve provided and no fixing for {}", fixingDate));
    }
    OptionalDouble projected = curve.termRate(
        fixingDate, period.getStartDate(), depositEndDate(period, config), period.getDayCount());
    if (!projected.isPresent()) {
      throw new MarketDataNotFoundException(Messages.format(
          "term rate could not be calculated: curve {} has no value for {}", curve, fixingDate));
    }
    return new TermFixing(fixingDate, projected.getAsDouble(), FixingProvenance.PROJECTED);
  }

  /**
   * Computes the rate of the period, including the spread.
   * 
   * @param period  the accrual period
   * @param config  the floating rate configuration, with the IBOR fixing method
   * @param curve  the curve used to project the rate, may be null if the rate is fixed
   * @return the rate, in percent
   */
  public double rate(AccrualPeriod period, FloatingPeriodConfig config, RateCurve curve) {
    return resolve(period, config, curve).getRate() + config.getFloatSpread() / 100.0d;
  }

}
