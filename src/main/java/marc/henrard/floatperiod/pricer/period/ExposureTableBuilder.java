/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.floatperiod.market.curve.RateCurve;
import marc.henrard.floatperiod.product.period.AccrualPeriod;
import marc.henrard.floatperiod.product.period.FloatingPeriodConfig;

/**
 * Builds the exposure table of a floating period.
 * <p>
 * For an overnight period, the exposure of an observation date is the notional of the overnight
 * deposit fixed on that date that has the same sensitivity to the overnight rate as the period:
 * {@code -notional * dcf * dR/dr_k / fixingDcf_k}, where {@code R} is the period rate, {@code r_k}
 * the rate of the date and {@code fixingDcf_k} the accrual factor of its deposit. The derivative is
 * closed form for the simple periods and computed by adjoint differentiation otherwise.
 * <p>
 * For a term rate period, the table has one row on the fixing date with the opposite of the notional.
 * <p>
 * The exposures are not discounted.
 * 
 * @author Marc Henrard
 */
public final class ExposureTableBuilder {

  /** Default implementation. */
  public static final ExposureTableBuilder DEFAULT =
      new ExposureTableBuilder(FixingResolver.DEFAULT, RateCompounder.DEFAULT, TermRateResolver.DEFAULT);

  /** Resolver of the overnight fixings. */
  private final FixingResolver fixingResolver;
  /** Compounding of the overnight rates. */
  private final RateCompounder compounder;
  /** Resolver of the term rate fixing. */
  private final TermRateResolver termRateResolver;

  /**
   * Creates an instance.
   * 
   * @param fixingResolver  the overnight fixing resolver
   * @param compounder  the rate compounder
   * @param termRateResolver  the term rate resolver
   */
  public ExposureTableBuilder(
      FixingResolver fixingResolver,
      RateCompounder compounder,
      TermRateResolver termRateResolver) {

    this.fixingResolver = ArgChecker.notNull(fixingResolver, "fixingResolver");
    this.compounder = ArgChecker.notNull(compounder, "compounder");
    this.termRateResolver = ArgChecker.notNull(termRateResolver, "termRateResolver");
  }

  //-------------------------------------------------------------------------
  /**
   * Builds the exposure table.
   * 
   * @param period  the accrual period
   * @param config  the floating rate configuration
   * @param curve  the curve used to project the rates, may be null if all rates are fixed
   * @param fixingExposure  whether the aggregate row is added
   * @return the table
   */
  public ExposureTable table(
      AccrualPeriod period,
      FloatingPeriodConfig config,
      RateCurve curve,
      boolean fixingExposure) {

    ArgChecker.notNull(period, "period");
    ArgChecker.notNull(config, "config");
    if (!config.getFixingMethod().isOvernight()) {
      return termTable(period, config, curve, fixingExposure);
    }
    return overnightTable(period, config, fixingResolver.resolve(period, config, curve), fixingExposure);
  }

  /**
   * Builds the exposure table of an overnight period from its resolved fixings.
   * 
   * @param period  the accrual period
   * @param config  the floating rate configuration, with an overnight fixing method
   * @param fixings  the resolved fixings
   * @param fixingExposure  whether the aggregate row is added
   * @return the table
   */
  public ExposureTable overnightTable(
      AccrualPeriod period,
      FloatingPeriodConfig config,
      ResolvedFixings fixings,
      boolean fixingExposure) {

    ObservationSchedule schedule = fixings.getSchedule();
    ImmutableList<LocalDate> dates = schedule.getObservationDates();
    DoubleArray fixingAccrualFactors = schedule.getFixingAccrualFactors();
    DoubleArray compoundedRates = fixings.compoundedRates();
    int nbDates = schedule.size();
    double periodRate;
    double[] exposures;
    if (fixings.getPeriodRateOverride().isPresent()) {
      periodRate = fixings.getPeriodRateOverride().getAsDouble() + config.getFloatSpread() / 100.0d;
      exposures = new double[nbDates];
    } else {
      periodRate = compounder.compound(
          compoundedRates, schedule.getAccrualFactors(), config.getFloatSpread(), config.getSpreadCompoundMethod());
      exposures = config.isComplex() ?
          complexExposures(period, config, schedule, compoundedRates) :
          simpleExposures(period, schedule, compoundedRates);
    }
    List<ExposureRow> rows = new ArrayList<>(nbDates);
    for (int i = 0; i < nbDates; i++) {
      rows.add(ExposureRow.of(
          dates.get(i), exposures[i], OptionalDouble.of(fixingAccrualFactors.get(i)), compoundedRates.get(i)));
    }
    return ExposureTable.of(rows, aggregate(period, periodRate, fixingExposure));
  }

  // -N * dcf * (d_k / D) * prod / (1 + r_k d_k / 100) / fixingDcf_k
  private static double[] simpleExposures(AccrualPeriod period, ObservationSchedule schedule, DoubleArray rates) {
    DoubleArray accrualFactors = schedule.getAccrualFactors();
    DoubleArray fixingAccrualFactors = schedule.getFixingAccrualFactors();
    double scale = -period.getNotional() * period.yearFraction() / schedule.totalAccrualFactor();
    double product = 1.0d;
    for (int i = 0; i < rates.size(); i++) {
      product *= 1.0d + rates.get(i) * accrualFactors.get(i) / 100.0d;
    }
    double[] exposures = new double[rates.size()];
    for (int i = 0; i < rates.size(); i++) {
      double accrualFactor = accrualFactors.get(i);
      exposures[i] = scale * product / (1.0d + rates.get(i) * accrualFactor / 100.0d) *
          accrualFactor / fixingAccrualFactors.get(i);
    }
    return exposures;
  }

  private double[] complexExposures(
      AccrualPeriod period,
      FloatingPeriodConfig config,
      ObservationSchedule schedule,
      DoubleArray rates) {

    DoubleArray sensitivities = compounder.compoundSensitivity(
        rates, schedule.getAccrualFactors(), config.getFloatSpread(), config.getSpreadCompoundMethod());
    int nbDates = schedule.size();
    double[] byFixing = new double[nbDates];
    for (int i = 0; i < nbDates; i++) {
      byFixing[schedule.fixingIndex(i)] += sensitivities.get(i);
    }
    double scale = -period.getNotional() * period.yearFraction();
    double[] exposures = new double[nbDates];
    for (int i = 0; i < nbDates; i++) {
      exposures[i] = scale * byFixing[i] / schedule.getFixingAccrualFactors().get(i);
    }
    return exposures;
  }

  private ExposureTable termTable(
      AccrualPeriod period,
      FloatingPeriodConfig config,
      RateCurve curve,
      boolean fixingExposure) {

    TermFixing fixing = termRateResolver.resolve(period, config, curve);
    ExposureRow row = ExposureRow.of(
        fixing.getFixingDate(), -period.getNotional(), OptionalDouble.empty(), fixing.getRate());
    double periodRate = fixing.getRate() + config.getFloatSpread() / 100.0d;
    return ExposureTable.of(ImmutableList.of(row), aggregate(period, periodRate, fixingExposure));
  }

  private static Optional<ExposureRow> aggregate(AccrualPeriod period, double periodRate, boolean fixingExposure) {
    if (!fixingExposure) {
      return Optional.empty();
    }
    double cashflow = -period.getNotional() * period.yearFraction() * periodRate / 100.0d;
    return Optional.of(ExposureRow.of(period.getPaymentDate(), cashflow, OptionalDouble.empty(), periodRate));
  }

}
