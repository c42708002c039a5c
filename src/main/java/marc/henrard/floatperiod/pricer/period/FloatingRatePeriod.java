/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.currency.FxRateProvider;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.data.MarketDataNotFoundException;

import marc.henrard.floatperiod.market.curve.DiscountCurve;
import marc.henrard.floatperiod.market.curve.RateCurve;
import marc.henrard.floatperiod.product.period.AccrualPeriod;
import marc.henrard.floatperiod.product.period.Fixings;
import marc.henrard.floatperiod.product.period.FloatingPeriodConfig;
import marc.henrard.floatperiod.product.period.SpreadCompoundMethod;

/**
 * A floating rate accrual period of a swap leg.
 * <p>
 * The rate is either a term rate fixed before the start of the period or a compounded overnight
 * rate, see {@link FloatingPeriodConfig}. Rates are in percent and the spread in basis points.
 * <p>
 * The non-fatal issues detected when resolving the fixings are logged as warnings.
 * 
 * @author Marc Henrard
 */
public final class FloatingRatePeriod implements CashflowPeriod {

  private static final Logger log = LoggerFactory.getLogger(FloatingRatePeriod.class);

  /** The type reported in the cash flows. */
  public static final String TYPE = "FloatingRatePeriod";

  /** The accrual period. */
  private final AccrualPeriod period;
  /** The rate configuration. */
  private final FloatingPeriodConfig config;

  private FloatingRatePeriod(AccrualPeriod period, FloatingPeriodConfig config) {
    this.period = ArgChecker.notNull(period, "period");
    this.config = ArgChecker.notNull(config, "config");
  }

  /**
   * Creates a floating period.
   * 
   * @param period  the accrual period
   * @param config  the rate configuration
   * @return the period
   */
  public static FloatingRatePeriod of(AccrualPeriod period, FloatingPeriodConfig config) {
    return new FloatingRatePeriod(period, config);
  }

  //-------------------------------------------------------------------------
  public AccrualPeriod getPeriod() {
    return period;
  }

  public FloatingPeriodConfig getConfig() {
    return config;
  }

  @Override
  public LocalDate getPaymentDate() {
    return period.getPaymentDate();
  }

  @Override
  public Currency getCurrency() {
    return period.getCurrency();
  }

  @Override
  public double getNotional() {
    return period.getNotional();
  }

  /**
   * Checks if the exposure of the period requires the full compounding chain.
   * 
   * @return true if complex
   */
  public boolean isComplex() {
    return config.isComplex();
  }

  public FloatingRatePeriod withFloatSpread(double floatSpread) {
    return new FloatingRatePeriod(period, config.toBuilder().floatSpread(floatSpread).build());
  }

  public FloatingRatePeriod withSpreadCompoundMethod(SpreadCompoundMethod spreadCompoundMethod) {
    return new FloatingRatePeriod(period, config.toBuilder().spreadCompoundMethod(spreadCompoundMethod).build());
  }

  public FloatingRatePeriod withFixings(Fixings fixings) {
    return new FloatingRatePeriod(period, config.toBuilder().fixings(fixings).build());
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the rate of the period, including the spread.
   * 
   * @param curve  the curve used to project the rates
   * @return the rate, in percent
   * @throws MarketDataNotFoundException if a rate can not be projected
   */
  public double rate(RateCurve curve) {
    ArgChecker.notNull(curve, "curve");
    return computeRate(curve);
  }

  /**
   * Computes the rate of the period from the fixings only.
   * 
   * @return the rate, in percent
   * @throws MarketDataNotFoundException if a rate is not fixed
   */
  public double rate() {
    return computeRate(null);
  }

  private double computeRate(RateCurve curve) {
    if (!config.getFixingMethod().isOvernight()) {
      return TermRateResolver.DEFAULT.rate(period, config, curve);
    }
    ResolvedFixings fixings = resolveFixings(curve);
    if (fixings.getPeriodRateOverride().isPresent()) {
      return fixings.getPeriodRateOverride().getAsDouble() + config.getFloatSpread() / 100.0d;
    }
    return RateCompounder.DEFAULT.compound(
        fixings.compoundedRates(),
        fixings.getSchedule().getAccrualFactors(),
        config.getFloatSpread(),
        config.getSpreadCompoundMethod());
  }

  /**
   * Resolves the rates of the observation dates of an overnight period.
   * <p>
   * The warnings are logged and available in the result.
   * 
   * @param curve  the curve used to project the rates, may be null if all rates are fixed
   * @return the resolved fixings
   */
  public ResolvedFixings resolveFixings(RateCurve curve) {
    ResolvedFixings fixings = FixingResolver.DEFAULT.resolve(period, config, curve);
    fixings.getWarnings().forEach(warning -> log.warn("{}: {}", period, warning));
    return fixings;
  }

  @Override
  public double cashflow(RateCurve curve) {
    return -period.getNotional() * period.yearFraction() * computeRate(curve) / 100.0d;
  }

  /**
   * {@inheritDoc}
   * <p>
   * The analytic delta is {@code notional * dcf * df / 10000}, the sensitivity to a spread added
   * after compounding. It does not depend on the spread compound method; under a compounded spread
   * the compounding effect is not included.
   */
  @Override
  public double analyticDelta(
      RateCurve curve,
      DiscountCurve discountCurve,
      FxRateProvider fxProvider,
      Currency baseCurrency) {

    ArgChecker.notNull(discountCurve, "discountCurve");
    return period.getNotional() * period.yearFraction() * discountCurve.discountFactor(getPaymentDate()) /
        10_000.0d * fxRate(fxProvider, baseCurrency);
  }

  @Override
  public CashflowReport cashflows(
      RateCurve curve,
      DiscountCurve discountCurve,
      FxRateProvider fxProvider,
      Currency baseCurrency) {

    OptionalDouble rate = curve == null ? OptionalDouble.empty() : OptionalDouble.of(rate(curve));
    OptionalDouble cashflow = rate.isPresent() ?
        OptionalDouble.of(-period.getNotional() * period.yearFraction() * rate.getAsDouble() / 100.0d) :
        OptionalDouble.empty();
    CashflowReport.Builder builder = CashflowReports.accrualBuilder(TYPE, period)
        .rate(rate)
        .spread(config.getFloatSpread());
    return CashflowReports.complete(builder, this, cashflow, discountCurve, fxProvider, baseCurrency);
  }

  //-------------------------------------------------------------------------
  /**
   * Builds the table of exposures to each fixing, without the aggregate row.
   * 
   * @param curve  the curve used to project the rates, may be null if all rates are fixed
   * @return the table
   */
  public ExposureTable fixingsTable(RateCurve curve) {
    return fixingsTable(curve, false);
  }

  /**
   * Builds the table of exposures to each fixing.
   * 
   * @param curve  the curve used to project the rates, may be null if all rates are fixed
   * @param fixingExposure  whether the aggregate row with the total cash flow is added
   * @return the table
   */
  public ExposureTable fixingsTable(RateCurve curve, boolean fixingExposure) {
    if (!config.getFixingMethod().isOvernight()) {
      return ExposureTableBuilder.DEFAULT.table(period, config, curve, fixingExposure);
    }
    return ExposureTableBuilder.DEFAULT.overnightTable(period, config, resolveFixings(curve), fixingExposure);
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FloatingRatePeriod)) {
      return false;
    }
    FloatingRatePeriod other = (FloatingRatePeriod) obj;
    return period.equals(other.period) && config.equals(other.config);
  }

  @Override
  public int hashCode() {
    return Objects.hash(period, config);
  }

  @Override
  public String toString() {
    return "FloatingRatePeriod[" + period + ", " + config + "]";
  }

}
