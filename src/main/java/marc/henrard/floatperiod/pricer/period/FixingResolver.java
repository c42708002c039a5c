/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

import com.opengamma.strata.basics.date.HolidayCalendar;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.Messages;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.data.MarketDataNotFoundException;

import marc.henrard.floatperiod.market.curve.RateCurve;
import marc.henrard.floatperiod.product.period.AccrualPeriod;
import marc.henrard.floatperiod.product.period.Fixings;
import marc.henrard.floatperiod.product.period.FloatingPeriodConfig;
import marc.henrard.floatperiod.product.period.SpreadCompoundMethod;

/**
 * Resolves the rate of each observation date of an overnight period.
 * <p>
 * The rate of a date is the fixing provided for it, if any, and otherwise the overnight forward
 * rate projected from the curve between the date and the next business day.
 * <ul>
 * <li>A single value fixing is the rate of the whole period.
 * <li>A list of fixings provides the rates of the first observation dates.
 * <li>A series of fixings provides the rates of the dates it contains. The series must be
 * increasing. A date on or before the last date of the series which is not in the series is
 * reported as a warning and projected.
 * </ul>
 * A fixing provided with a non-zero spread compounded with the rates is also reported as a warning.
 * 
 * @author Marc Henrard
 */
public final class FixingResolver {

  /** Default implementation. */
  public static final FixingResolver DEFAULT = new FixingResolver();

  /**
   * Resolves the fixings of the period.
   * 
   * @param period  the accrual period
   * @param config  the floating rate configuration, with an overnight fixing method
   * @param curve  the curve used to project the rates, may be null if all rates are fixed
   * @return the resolved fixings
   * @throws MarketDataNotFoundException if a rate can not be projected
   * @throws IllegalArgumentException if the fixings are inconsistent with the period
   */
  public ResolvedFixings resolve(AccrualPeriod period, FloatingPeriodConfig config, RateCurve curve) {
    ArgChecker.notNull(period, "period");
    ArgChecker.notNull(config, "config");
    ArgChecker.isTrue(config.getFixingMethod().isOvernight(),
        "fixings can only be resolved for an overnight fixing method, found {}", config.getFixingMethod());
    ObservationSchedule schedule = ObservationSchedule.of(
        period, config.getFixingMethod(), config.getMethodParam(), config.getFixingCalendar());
    Fixings fixings = config.getFixings();
    int nbDates = schedule.size();
    Double[] overrides = new Double[nbDates];
    List<String> warnings = new ArrayList<>();
    switch (fixings.getType()) {
      case NONE:
        break;
      case SCALAR:
        return resolveScalar(schedule, config, warnings);
      case LIST:
        DoubleArray values = fixings.getValues();
        ArgChecker.isTrue(values.size() <= nbDates,
            "too many fixings: {} values for {} observation dates", values.size(), nbDates);
        for (int i = 0; i < values.size(); i++) {
          overrides[i] = values.get(i);
        }
        break;
      case SERIES:
        ArgChecker.isTrue(fixings.isIncreasing(), "fixings as a series must be increasing, found {}",
            fixings.getDates());
        LocalDate lastFixingDate = fixings.getDates().isEmpty() ? null : Collections.max(fixings.getDates());
        boolean missing = false;
        for (int i = 0; i < nbDates; i++) {
          LocalDate date = schedule.getObservationDates().get(i);
          OptionalDouble value = fixings.seriesValue(date);
          if (value.isPresent()) {
            overrides[i] = value.getAsDouble();
          } else if (lastFixingDate != null && !date.isAfter(lastFixingDate)) {
            missing = true;
          }
        }
        if (missing) {
          warnings.add(Messages.format(
              "fixings series ending on {} does not contain all the observation dates of the period, " +
                  "the missing dates are projected from the curve",
              lastFixingDate));
        }
        break;
      default:
        throw new IllegalArgumentException("unknown fixings type " + fixings.getType());
    }
    double[] rates = new double[nbDates];
    List<FixingProvenance> provenances = new ArrayList<>(nbDates);
    HolidayCalendar calendar = config.getFixingCalendar();
    boolean overridden = false;
    for (int i = 0; i < nbDates; i++) {
      if (overrides[i] != null) {
        rates[i] = overrides[i];
        provenances.add(FixingProvenance.OVERRIDE);
        overridden = true;
      } else {
        rates[i] = project(schedule.getObservationDates().get(i), period, calendar, curve);
        provenances.add(FixingProvenance.PROJECTED);
      }
    }
    if (overridden && hasCompoundedSpread(config)) {
      warnings.add(Messages.format(
          "fixings provided with a spread of {} bp under {}: the spread is compounded with the fixed rates",
          config.getFloatSpread(), config.getSpreadCompoundMethod()));
    }
    return new ResolvedFixings(schedule, DoubleArray.ofUnsafe(rates), provenances, OptionalDouble.empty(), warnings);
  }

  // a single value is the rate of the whole period
  private ResolvedFixings resolveScalar(
      ObservationSchedule schedule,
      FloatingPeriodConfig config,
      List<String> warnings) {

    double value = config.getFixings().getScalar();
    if (hasCompoundedSpread(config)) {
      warnings.add(Messages.format(
          "fixing provided as a single value {} with a spread of {} bp: the spread is added to the fixing " +
              "without {}",
          value, config.getFloatSpread(), config.getSpreadCompoundMethod()));
    }
    List<FixingProvenance> provenances = Collections.nCopies(schedule.size(), FixingProvenance.OVERRIDE);
    return new ResolvedFixings(
        schedule, DoubleArray.filled(schedule.size(), value), provenances, OptionalDouble.of(value), warnings);
  }

  private static boolean hasCompoundedSpread(FloatingPeriodConfig config) {
    return config.getFloatSpread() != 0d && config.getSpreadCompoundMethod() != SpreadCompoundMethod.NONE_SIMPLE;
  }

  private static double project(LocalDate date, AccrualPeriod period, HolidayCalendar calendar, RateCurve curve) {
    if (curve == null) {
      throw new MarketDataNotFoundException(Messages.format(
          "RFRs could not be calculated: no curve provided and no fixing for {}", date));
    }
    OptionalDouble rate = curve.forwardRate(date, calendar.next(date), period.getDayCount());
    if (!rate.isPresent()) {
      throw new MarketDataNotFoundException(Messages.format(
          "RFRs could not be calculated: curve {} has no value for {}", curve, date));
    }
    return rate.getAsDouble();
  }

}
