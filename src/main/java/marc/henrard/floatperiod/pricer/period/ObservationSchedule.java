/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.date.DayCount;
import com.opengamma.strata.basics.date.HolidayCalendar;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.floatperiod.product.period.AccrualPeriod;
import marc.henrard.floatperiod.product.period.FixingMethod;

/**
 * The overnight observation dates of a floating period and their compounding weights.
 * <p>
 * Each compounding entry has an accrual factor and uses the fixing of one observation date. The
 * entries and the observation dates are in one-to-one correspondence except for the lockout method,
 * where the last entries reuse the fixing of the last non-locked date.
 * <p>
 * The fixing accrual factor of an observation date is the accrual factor between the date and the
 * next business day, i.e. the tenor of the overnight deposit fixed on that date.
 * 
 * @author Marc Henrard
 */
public final class ObservationSchedule {

  /** The observation dates. */
  private final ImmutableList<LocalDate> observationDates;
  /** The accrual factors of the compounding entries. */
  private final DoubleArray accrualFactors;
  /** The accrual factors of the overnight deposit of each observation date. */
  private final DoubleArray fixingAccrualFactors;
  /** The index of the observation date used by each compounding entry. */
  private final int[] fixingIndices;

  private ObservationSchedule(
      ImmutableList<LocalDate> observationDates,
      DoubleArray accrualFactors,
      DoubleArray fixingAccrualFactors,
      int[] fixingIndices) {

    this.observationDates = observationDates;
    this.accrualFactors = accrualFactors;
    this.fixingAccrualFactors = fixingAccrualFactors;
    this.fixingIndices = fixingIndices;
  }

  /**
   * Creates the schedule of an overnight period.
   * 
   * @param period  the accrual period
   * @param method  the overnight fixing method
   * @param methodParam  the number of business days of the method
   * @param calendar  the calendar of the overnight index
   * @return the schedule
   * @throws IllegalArgumentException if the method is not overnight or the period has too few dates
   */
  public static ObservationSchedule of(
      AccrualPeriod period,
      FixingMethod method,
      int methodParam,
      HolidayCalendar calendar) {

    ArgChecker.notNull(period, "period");
    ArgChecker.notNull(method, "method");
    ArgChecker.notNull(calendar, "calendar");
    LocalDate start = period.getStartDate();
    LocalDate end = period.getEndDate();
    List<LocalDate> boundaries;
    List<LocalDate> observations;
    switch (method) {
      case RFR_PAYMENT_DELAY:
      case RFR_LOCKOUT:
        boundaries = windowBoundaries(start, end, calendar);
        observations = boundaries.subList(0, boundaries.size() - 1);
        break;
      case RFR_OBSERVATION_SHIFT:
        boundaries = windowBoundaries(
            calendar.shift(start, -methodParam), calendar.shift(end, -methodParam), calendar);
        observations = boundaries.subList(0, boundaries.size() - 1);
        break;
      case RFR_LOOKBACK:
        boundaries = windowBoundaries(start, end, calendar);
        observations = new ArrayList<>();
        for (LocalDate accrualDate : boundaries.subList(0, boundaries.size() - 1)) {
          observations.add(calendar.shift(accrualDate, -methodParam));
        }
        break;
      default:
        throw new IllegalArgumentException(
            "observation schedule requires an overnight fixing method, found " + method);
    }
    int nbDates = observations.size();
    ArgChecker.isTrue(nbDates > 0, "period has no business day between {} and {}", start, end);
    DayCount dayCount = period.getDayCount();
    double[] accrualFactors = new double[nbDates];
    double[] fixingAccrualFactors = new double[nbDates];
    int[] fixingIndices = new int[nbDates];
    for (int i = 0; i < nbDates; i++) {
      LocalDate observation = observations.get(i);
      accrualFactors[i] = dayCount.yearFraction(boundaries.get(i), boundaries.get(i + 1));
      fixingAccrualFactors[i] = dayCount.yearFraction(observation, calendar.next(observation));
      fixingIndices[i] = i;
    }
    if (method == FixingMethod.RFR_LOCKOUT) {
      ArgChecker.isTrue(nbDates > methodParam,
          "period has too few dates for {} with {} business days: {} observation dates", method, methodParam, nbDates);
      Arrays.fill(fixingIndices, nbDates - methodParam, nbDates, nbDates - methodParam - 1);
    }
    return new ObservationSchedule(
        ImmutableList.copyOf(observations),
        DoubleArray.ofUnsafe(accrualFactors),
        DoubleArray.ofUnsafe(fixingAccrualFactors),
        fixingIndices);
  }

  // business days in [start, end) followed by end
  private static List<LocalDate> windowBoundaries(LocalDate start, LocalDate end, HolidayCalendar calendar) {
    List<LocalDate> boundaries = new ArrayList<>();
    LocalDate date = calendar.nextOrSame(start);
    while (date.isBefore(end)) {
      boundaries.add(date);
      date = calendar.next(date);
    }
    boundaries.add(end);
    return boundaries;
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the number of observation dates, which is also the number of compounding entries.
   * 
   * @return the size
   */
  public int size() {
    return observationDates.size();
  }

  public ImmutableList<LocalDate> getObservationDates() {
    return observationDates;
  }

  public DoubleArray getAccrualFactors() {
    return accrualFactors;
  }

  public DoubleArray getFixingAccrualFactors() {
    return fixingAccrualFactors;
  }

  /**
   * Returns the index of the observation date whose fixing is used by a compounding entry.
   * 
   * @param entry  the compounding entry index
   * @return the observation index
   */
  public int fixingIndex(int entry) {
    return fixingIndices[entry];
  }

  /**
   * Returns the sum of the accrual factors of the compounding entries.
   * 
   * @return the total accrual factor
   */
  public double totalAccrualFactor() {
    return accrualFactors.sum();
  }

  /**
   * Returns the rates used by each compounding entry from the rates of each observation date.
   * 
   * @param observationRates  the rates by observation date
   * @return the rates by compounding entry
   */
  public DoubleArray compoundedRates(DoubleArray observationRates) {
    ArgChecker.isTrue(observationRates.size() == size(), "expected {} rates, found {}",
        size(), observationRates.size());
    return DoubleArray.of(size(), i -> observationRates.get(fixingIndices[i]));
  }

  @Override
  public String toString() {
    return "ObservationSchedule[" + observationDates + "]";
  }

}
