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

/**
 * A single cash flow, e.g. a notional exchange.
 * <p>
 * The amount paid is the opposite of the notional. It has no rate and its analytic delta is 0.
 * 
 * @author Marc Henrard
 */
public final class Cashflow implements CashflowPeriod {

  /** The type reported in the cash flows. */
  public static final String TYPE = "Cashflow";

  private final double notional;
  private final LocalDate paymentDate;
  private final Currency currency;

  private Cashflow(double notional, LocalDate paymentDate, Currency currency) {
    this.notional = notional;
    this.paymentDate = ArgChecker.notNull(paymentDate, "paymentDate");
    this.currency = ArgChecker.notNull(currency, "currency");
  }

  public static Cashflow of(double notional, LocalDate paymentDate, Currency currency) {
    return new Cashflow(notional, paymentDate, currency);
  }

  /**
   * Creates a USD cash flow.
   * 
   * @param notional  the notional
   * @param paymentDate  the payment date
   * @return the cash flow
   */
  public static Cashflow of(double notional, LocalDate paymentDate) {
    return new Cashflow(notional, paymentDate, Currency.USD);
  }

  //-------------------------------------------------------------------------
  @Override
  public LocalDate getPaymentDate() {
    return paymentDate;
  }

  @Override
  public Currency getCurrency() {
    return currency;
  }

  @Override
  public double getNotional() {
    return notional;
  }

  @Override
  public double cashflow(RateCurve curve) {
    return -notional;
  }

  @Override
  public double analyticDelta(
      RateCurve curve,
      DiscountCurve discountCurve,
      FxRateProvider fxProvider,
      Currency baseCurrency) {

    return 0.0d;
  }

  @Override
  public CashflowReport cashflows(
      RateCurve curve,
      DiscountCurve discountCurve,
      FxRateProvider fxProvider,
      Currency baseCurrency) {

    CashflowReport.Builder builder = CashflowReport.builder()
        .type(TYPE)
        .paymentDate(paymentDate)
        .notional(notional)
        .currency(currency);
    return CashflowReports.complete(builder, this, OptionalDouble.of(-notional), discountCurve, fxProvider, baseCurrency);
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Cashflow)) {
      return false;
    }
    Cashflow other = (Cashflow) obj;
    return Double.compare(notional, other.notional) == 0 &&
        paymentDate.equals(other.paymentDate) &&
        currency.equals(other.currency);
  }

  @Override
  public int hashCode() {
    return Objects.hash(notional, paymentDate, currency);
  }

  @Override
  public String toString() {
    return "Cashflow[" + paymentDate + ", " + currency + " " + notional + "]";
  }

}
