/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.util.OptionalDouble;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.currency.FxRateProvider;

import marc.henrard.floatperiod.market.curve.DiscountCurve;
import marc.henrard.floatperiod.product.period.AccrualPeriod;

/**
 * Shared construction of the cash flow reports.
 * 
 * @author Marc Henrard
 */
final class CashflowReports {

  // Private constructor
  private CashflowReports() {
  }

  /**
   * Returns a builder with the accrual description of the period.
   * 
   * @param type  the type of period
   * @param period  the accrual period
   * @return the builder
   */
  static CashflowReport.Builder accrualBuilder(String type, AccrualPeriod period) {
    return CashflowReport.builder()
        .type(type)
        .stubType(period.isStub() ? "Stub" : "Regular")
        .accrualStartDate(period.getStartDate())
        .accrualEndDate(period.getEndDate())
        .paymentDate(period.getPaymentDate())
        .notional(period.getNotional())
        .currency(period.getCurrency())
        .dayCount(period.getDayCount())
        .accrualFactor(period.yearFraction());
  }

  /**
   * Completes the builder with the cash flow, discounting and conversion.
   * 
   * @param builder  the builder
   * @param period  the period
   * @param cashflow  the cash flow, empty if unknown
   * @param discountCurve  the discount curve, may be null
   * @param fxProvider  the FX rates, may be null
   * @param baseCurrency  the base currency, may be null
   * @return the report
   */
  static CashflowReport complete(
      CashflowReport.Builder builder,
      CashflowPeriod period,
      OptionalDouble cashflow,
      DiscountCurve discountCurve,
      FxRateProvider fxProvider,
      Currency baseCurrency) {

    double fxRate = period.fxRate(fxProvider, baseCurrency);
    OptionalDouble discountFactor = discountCurve == null ?
        OptionalDouble.empty() :
        OptionalDouble.of(discountCurve.discountFactor(period.getPaymentDate()));
    OptionalDouble npv = OptionalDouble.empty();
    OptionalDouble npvBase = OptionalDouble.empty();
    if (cashflow.isPresent() && discountFactor.isPresent()) {
      double pv = cashflow.getAsDouble() * discountFactor.getAsDouble();
      npv = OptionalDouble.of(pv);
      npvBase = OptionalDouble.of(pv * fxRate);
    }
    return builder
        .cashflow(cashflow)
        .discountFactor(discountFactor)
        .fxRate(fxRate)
        .npv(npv)
        .npvBase(npvBase)
        .build();
  }

}
