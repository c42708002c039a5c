/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalDouble;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.currency.FxRateProvider;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.floatperiod.market.curve.DiscountCurve;
import marc.henrard.floatperiod.market.curve.RateCurve;
import marc.henrard.floatperiod.product.period.AccrualPeriod;

/**
 * A fixed rate accrual period of a swap leg.
 * <p>
 * The fixed rate, in percent, may be unknown, e.g. before a swap is solved for its par rate. The
 * cash flow and present value then can not be computed, but the analytic delta can.
 * 
 * @author Marc Henrard
 */
public final class FixedRatePeriod implements CashflowPeriod {

  /** The type reported in the cash flows. */
  public static final String TYPE = "FixedRatePeriod";

  /** The accrual period. */
  private final AccrualPeriod period;
  /** The fixed rate, in percent. */
  private final OptionalDouble fixedRate;

  private FixedRatePeriod(AccrualPeriod period, OptionalDouble fixedRate) {
    this.period = ArgChecker.notNull(period, "period");
    this.fixedRate = ArgChecker.notNull(fixedRate, "fixedRate");
  }

  public static FixedRatePeriod of(AccrualPeriod period, double fixedRate) {
    return new FixedRatePeriod(period, OptionalDouble.of(fixedRate));
  }

  /**
   * Creates a period whose fixed rate is not known yet.
   * 
   * @param period  the accrual period
   * @return the period
   */
  public static FixedRatePeriod of(AccrualPeriod period) {
    return new FixedRatePeriod(period, OptionalDouble.empty());
  }

  //-------------------------------------------------------------------------
  public AccrualPeriod getPeriod() {
    return period;
  }

  public OptionalDouble getFixedRate() {
    return fixedRate;
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

  public FixedRatePeriod withFixedRate(double fixedRate) {
    return of(period, fixedRate);
  }

  //-------------------------------------------------------------------------
  /**
   * {@inheritDoc}
   * <p>
   * The curve is not used.
   * 
   * @throws IllegalArgumentException if the fixed rate is not known
   */
  @Override
  public double cashflow(RateCurve curve) {
    ArgChecker.isTrue(fixedRate.isPresent(), "fixed rate must be set to compute the cash flow of {}", period);
    return cashflow(fixedRate.getAsDouble());
  }

  private double cashflow(double rate) {
    return -period.getNotional() * period.yearFraction() * rate / 100.0d;
  }

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

    OptionalDouble cashflow = fixedRate.isPresent() ?
        OptionalDouble.of(cashflow(fixedRate.getAsDouble())) :
        OptionalDouble.empty();
    CashflowReport.Builder builder = CashflowReports.accrualBuilder(TYPE, period).rate(fixedRate);
    return CashflowReports.complete(builder, this, cashflow, discountCurve, fxProvider, baseCurrency);
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FixedRatePeriod)) {
      return false;
    }
    FixedRatePeriod other = (FixedRatePeriod) obj;
    return period.equals(other.period) && fixedRate.equals(other.fixedRate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(period, fixedRate);
  }

  @Override
  public String toString() {
    return "FixedRatePeriod[" + period + ", " + (fixedRate.isPresent() ? fixedRate.getAsDouble() : "no rate") + "]";
  }

}
