/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.currency.FxRateProvider;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.floatperiod.market.curve.DiscountCurve;
import marc.henrard.floatperiod.market.curve.RateCurve;

/**
 * A period paying a single cash flow on its payment date.
 * <p>
 * The present value is the cash flow multiplied by the discount factor of the payment date and,
 * when a base currency is provided, by the FX rate from the period currency to the base currency.
 * The cash flow is negative for a positive notional and a positive rate.
 * <p>
 * The discount curve must be a discount factor curve. When only one curve is provided it is used
 * both to project the rates and to discount.
 * 
 * @author Marc Henrard
 */
public interface CashflowPeriod {

  /**
   * Returns the payment date.
   * 
   * @return the payment date
   */
  public abstract LocalDate getPaymentDate();

  /**
   * Returns the currency of the payment.
   * 
   * @return the currency
   */
  public abstract Currency getCurrency();

  /**
   * Returns the notional.
   * 
   * @return the notional
   */
  public abstract double getNotional();

  /**
   * Computes the cash flow paid.
   * 
   * @param curve  the curve used to project the rates, if any
   * @return the cash flow
   */
  public abstract double cashflow(RateCurve curve);

  /**
   * Computes the sensitivity of the present value to a one basis point increase of the rate of
   * the period.
   * 
   * @param curve  the curve used to project the rates, if any
   * @param discountCurve  the discount curve
   * @param fxProvider  the FX rates, may be null
   * @param baseCurrency  the base currency, may be null
   * @return the analytic delta
   */
  public abstract double analyticDelta(
      RateCurve curve,
      DiscountCurve discountCurve,
      FxRateProvider fxProvider,
      Currency baseCurrency);

  /**
   * Describes the cash flow and its present value.
   * 
   * @param curve  the curve used to project the rates, may be null
   * @param discountCurve  the discount curve, may be null
   * @param fxProvider  the FX rates, may be null
   * @param baseCurrency  the base currency, may be null
   * @return the report
   */
  public abstract CashflowReport cashflows(
      RateCurve curve,
      DiscountCurve discountCurve,
      FxRateProvider fxProvider,
      Currency baseCurrency);

  //-------------------------------------------------------------------------
  /**
   * Computes the present value.
   * 
   * @param curve  the curve used to project the rates, if any
   * @param discountCurve  the discount curve
   * @param fxProvider  the FX rates, may be null
   * @param baseCurrency  the base currency, may be null
   * @return the present value, in the base currency if provided
   */
  public default double npv(
      RateCurve curve,
      DiscountCurve discountCurve,
      FxRateProvider fxProvider,
      Currency baseCurrency) {

    ArgChecker.notNull(discountCurve, "discountCurve");
    return cashflow(curve) * discountCurve.discountFactor(getPaymentDate()) * fxRate(fxProvider, baseCurrency);
  }

  public default double npv(RateCurve curve, DiscountCurve discountCurve) {
    return npv(curve, discountCurve, null, null);
  }

  /**
   * Computes the present value with one curve used to project and discount.
   * 
   * @param curve  the discount factor curve
   * @return the present value
   */
  public default double npv(RateCurve curve) {
    return npv(curve, asDiscountCurve(curve), null, null);
  }

  public default double analyticDelta(RateCurve curve, DiscountCurve discountCurve) {
    return analyticDelta(curve, discountCurve, null, null);
  }

  public default double analyticDelta(RateCurve curve) {
    return analyticDelta(curve, asDiscountCurve(curve), null, null);
  }

  /**
   * Describes the cash flow, discounting with the curve if it is a discount factor curve.
   * 
   * @param curve  the curve, may be null
   * @param fxProvider  the FX rates, may be null
   * @param baseCurrency  the base currency, may be null
   * @return the report
   */
  public default CashflowReport cashflows(RateCurve curve, FxRateProvider fxProvider, Currency baseCurrency) {
    DiscountCurve discountCurve = curve instanceof DiscountCurve ? (DiscountCurve) curve : null;
    return cashflows(curve, discountCurve, fxProvider, baseCurrency);
  }

  public default CashflowReport cashflows(RateCurve curve) {
    return cashflows(curve, null, null);
  }

  /**
   * Returns the FX rate from the period currency to the base currency.
   * <p>
   * The rate is 1 when no FX rates or no base currency are provided.
   * 
   * @param fxProvider  the FX rates, may be null
   * @param baseCurrency  the base currency, may be null
   * @return the rate
   */
  public default double fxRate(FxRateProvider fxProvider, Currency baseCurrency) {
    if (fxProvider == null || baseCurrency == null) {
      return 1.0d;
    }
    return fxProvider.fxRate(getCurrency(), baseCurrency);
  }

  /**
   * Checks that a curve can be used for discounting.
   * 
   * @param curve  the curve
   * @return the curve as a discount curve
   * @throws IllegalArgumentException if the curve is null or not a discount factor curve
   */
  public static DiscountCurve asDiscountCurve(RateCurve curve) {
    ArgChecker.notNull(curve, "curve");
    ArgChecker.isTrue(curve instanceof DiscountCurve, "discount curve must be a discount factor curve, found {}", curve);
    return (DiscountCurve) curve;
  }

}
