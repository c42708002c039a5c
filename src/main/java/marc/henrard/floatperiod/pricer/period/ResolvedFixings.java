/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

/**
 * The rates of the observation dates of an overnight period, after merging fixings and projections.
 * <p>
 * When the fixing is a single value, it is the rate of the whole period and is reported as the
 * period rate override; the rates of the individual dates are then that value.
 * 
 * @author Marc Henrard
 */
public final class ResolvedFixings {

  /** The observation schedule. */
  private final ObservationSchedule schedule;
  /** The rate of each observation date, in percent. */
  private final DoubleArray rates;
  /** The origin of each rate. */
  private final ImmutableList<FixingProvenance> provenances;
  /** The rate of the whole period, without spread, when fixed as a single value. */
  private final OptionalDouble periodRateOverride;
  /** The non-fatal issues detected when resolving. */
  private final ImmutableList<String> warnings;

  ResolvedFixings(
      ObservationSchedule schedule,
      DoubleArray rates,
      List<FixingProvenance> provenances,
      OptionalDouble periodRateOverride,
      List<String> warnings) {

    ArgChecker.isTrue(rates.size() == schedule.size(), "expected {} rates, found {}", schedule.size(), rates.size());
    ArgChecker.isTrue(provenances.size() == schedule.size(), "expected {} provenances, found {}",
        schedule.size(), provenances.size());
    this.schedule = schedule;
    this.rates = rates;
    this.provenances = ImmutableList.copyOf(provenances);
    this.periodRateOverride = periodRateOverride;
    this.warnings = ImmutableList.copyOf(warnings);
  }

  //-------------------------------------------------------------------------
  public ObservationSchedule getSchedule() {
    return schedule;
  }

  public ImmutableList<LocalDate> getObservationDates() {
    return schedule.getObservationDates();
  }

  public DoubleArray getRates() {
    return rates;
  }

  public ImmutableList<FixingProvenance> getProvenances() {
    return provenances;
  }

  public OptionalDouble getPeriodRateOverride() {
    return periodRateOverride;
  }

  public ImmutableList<String> getWarnings() {
    return warnings;
  }

  /**
   * Returns the rates used by each compounding entry, taking the lockout into account.
   * 
   * @return the compounded rates
   */
  public DoubleArray compoundedRates() {
    return schedule.compoundedRates(rates);
  }

  @Override
  public String toString() {
    return "ResolvedFixings[" + schedule.getObservationDates() + ", " + rates + "]";
  }

}
