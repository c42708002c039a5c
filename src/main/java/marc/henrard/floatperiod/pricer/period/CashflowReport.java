/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.date.DayCount;
import com.opengamma.strata.collect.ArgChecker;

/**
 * Description of the cash flow of a period and of its present value.
 * <p>
 * The values which can not be determined, e.g. the rate of a floating period without curve, are empty.
 * 
 * @author Marc Henrard
 */
public final class CashflowReport {

  private final String type;
  private final Optional<String> stubType;
  private final Optional<LocalDate> accrualStartDate;
  private final Optional<LocalDate> accrualEndDate;
  private final LocalDate paymentDate;
  private final double notional;
  private final Currency currency;
  private final Optional<DayCount> dayCount;
  private final OptionalDouble accrualFactor;
  private final OptionalDouble discountFactor;
  private final OptionalDouble rate;
  private final OptionalDouble spread;
  private final OptionalDouble cashflow;
  private final double fxRate;
  private final OptionalDouble npv;
  private final OptionalDouble npvBase;

  private CashflowReport(Builder builder) {
    this.type = ArgChecker.notNull(builder.type, "type");
    this.stubType = builder.stubType;
    this.accrualStartDate = builder.accrualStartDate;
    this.accrualEndDate = builder.accrualEndDate;
    this.paymentDate = ArgChecker.notNull(builder.paymentDate, "paymentDate");
    this.notional = builder.notional;
    this.currency = ArgChecker.notNull(builder.currency, "currency");
    this.dayCount = builder.dayCount;
    this.accrualFactor = builder.accrualFactor;
    this.discountFactor = builder.discountFactor;
    this.rate = builder.rate;
    this.spread = builder.spread;
    this.cashflow = builder.cashflow;
    this.fxRate = builder.fxRate;
    this.npv = builder.npv;
    this.npvBase = builder.npvBase;
  }

  public static Builder builder() {
    return new Builder();
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the type of the period, e.g. "FloatPeriod".
   * 
   * @return the type
   */
  public String getType() {
    return type;
  }

  /**
   * Returns the stub classification, "Regular" or "Stub", empty for a simple cash flow.
   * 
   * @return the stub type
   */
  public Optional<String> getStubType() {
    return stubType;
  }

  public Optional<LocalDate> getAccrualStartDate() {
    return accrualStartDate;
  }

  public Optional<LocalDate> getAccrualEndDate() {
    return accrualEndDate;
  }

  public LocalDate getPaymentDate() {
    return paymentDate;
  }

  public double getNotional() {
    return notional;
  }

  public Currency getCurrency() {
    return currency;
  }

  public Optional<DayCount> getDayCount() {
    return dayCount;
  }

  public OptionalDouble getAccrualFactor() {
    return accrualFactor;
  }

  public OptionalDouble getDiscountFactor() {
    return discountFactor;
  }

  public OptionalDouble getRate() {
    return rate;
  }

  /**
   * Returns the spread in basis points, empty for periods without spread.
   * 
   * @return the spread
   */
  public OptionalDouble getSpread() {
    return spread;
  }

  public OptionalDouble getCashflow() {
    return cashflow;
  }

  /**
   * Returns the FX rate from the period currency to the base currency, 1 without conversion.
   * 
   * @return the rate
   */
  public double getFxRate() {
    return fxRate;
  }

  public OptionalDouble getNpv() {
    return npv;
  }

  /**
   * Returns the present value converted in the base currency.
   * 
   * @return the present value
   */
  public OptionalDouble getNpvBase() {
    return npvBase;
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CashflowReport)) {
      return false;
    }
    CashflowReport other = (CashflowReport) obj;
    return type.equals(other.type) &&
        stubType.equals(other.stubType) &&
        accrualStartDate.equals(other.accrualStartDate) &&
        accrualEndDate.equals(other.accrualEndDate) &&
        paymentDate.equals(other.paymentDate) &&
        Double.compare(notional, other.notional) == 0 &&
        currency.equals(other.currency) &&
        dayCount.equals(other.dayCount) &&
        accrualFactor.equals(other.accrualFactor) &&
        discountFactor.equals(other.discountFactor) &&
        rate.equals(other.rate) &&
        spread.equals(other.spread) &&
        cashflow.equals(other.cashflow) &&
        Double.compare(fxRate, other.fxRate) == 0 &&
        npv.equals(other.npv) &&
        npvBase.equals(other.npvBase);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, stubType, accrualStartDate, accrualEndDate, paymentDate, notional, currency,
        dayCount, accrualFactor, discountFactor, rate, spread, cashflow, fxRate, npv, npvBase);
  }

  @Override
  public String toString() {
    return "CashflowReport[type=" + type + ", stub=" + stubType.orElse("-") + ", payment=" + paymentDate +
        ", notional=" + notional + ", currency=" + currency + ", rate=" + rate + ", cashflow=" + cashflow +
        ", npv=" + npv + ", fx=" + fxRate + ", npvBase=" + npvBase + "]";
  }

  //-------------------------------------------------------------------------
  /**
   * Builder for {@link CashflowReport}. All optional values default to empty and the FX rate to 1.
   */
  public static final class Builder {

    private String type;
    private Optional<String> stubType = Optional.empty();
    private Optional<LocalDate> accrualStartDate = Optional.empty();
    private Optional<LocalDate> accrualEndDate = Optional.empty();
    private LocalDate paymentDate;
    private double notional;
    private Currency currency;
    private Optional<DayCount> dayCount = Optional.empty();
    private OptionalDouble accrualFactor = OptionalDouble.empty();
    private OptionalDouble discountFactor = OptionalDouble.empty();
    private OptionalDouble rate = OptionalDouble.empty();
    private OptionalDouble spread = OptionalDouble.empty();
    private OptionalDouble cashflow = OptionalDouble.empty();
    private double fxRate = 1.0d;
    private OptionalDouble npv = OptionalDouble.empty();
    private OptionalDouble npvBase = OptionalDouble.empty();

    private Builder() {
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder stubType(String stubType) {
      this.stubType = Optional.of(stubType);
      return this;
    }

    public Builder accrualStartDate(LocalDate accrualStartDate) {
      this.accrualStartDate = Optional.of(accrualStartDate);
      return this;
    }

    public Builder accrualEndDate(LocalDate accrualEndDate) {
      this.accrualEndDate = Optional.of(accrualEndDate);
      return this;
    }

    public Builder paymentDate(LocalDate paymentDate) {
      this.paymentDate = paymentDate;
      return this;
    }

    public Builder notional(double notional) {
      this.notional = notional;
      return this;
    }

    public Builder currency(Currency currency) {
      this.currency = currency;
      return this;
    }

    public Builder dayCount(DayCount dayCount) {
      this.dayCount = Optional.of(dayCount);
      return this;
    }

    public Builder accrualFactor(double accrualFactor) {
      this.accrualFactor = OptionalDouble.of(accrualFactor);
      return this;
    }

    public Builder discountFactor(OptionalDouble discountFactor) {
      this.discountFactor = ArgChecker.notNull(discountFactor, "discountFactor");
      return this;
    }

    public Builder rate(OptionalDouble rate) {
      this.rate = ArgChecker.notNull(rate, "rate");
      return this;
    }

    public Builder spread(double spread) {
      this.spread = OptionalDouble.of(spread);
      return this;
    }

    public Builder cashflow(OptionalDouble cashflow) {
      this.cashflow = ArgChecker.notNull(cashflow, "cashflow");
      return this;
    }

    public Builder fxRate(double fxRate) {
      this.fxRate = fxRate;
      return this;
    }

    public Builder npv(OptionalDouble npv) {
      this.npv = ArgChecker.notNull(npv, "npv");
      return this;
    }

    public Builder npvBase(OptionalDouble npvBase) {
      this.npvBase = ArgChecker.notNull(npvBase, "npvBase");
      return this;
    }

    public CashflowReport build() {
      return new CashflowReport(this);
    }

  }

}
