/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.product.period;

import java.time.LocalDate;
import java.util.Objects;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.date.DayCount;
import com.opengamma.strata.basics.date.DayCounts;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.ArgChecker;

/**
 * The dates and amount description of an accrual period of a swap leg.
 * <p>
 * The payment date may be before, on or after the end date. The notional is signed; a positive
 * notional corresponds to a negative cash flow for a positive rate.
 * 
 * @author Marc Henrard
 */
public final class AccrualPeriod {

  /** The default notional. */
  public static final double DEFAULT_NOTIONAL = 1_000_000.0d;

  /** The start date of the accrual. */
  private final LocalDate startDate;
  /** The end date of the accrual. */
  private final LocalDate endDate;
  /** The payment date. */
  private final LocalDate paymentDate;
  /** The notional. */
  private final double notional;
  /** The currency of the payment. */
  private final Currency currency;
  /** The day count of the accrual. */
  private final DayCount dayCount;
  /** The termination date of the leg the period belongs to. */
  private final LocalDate terminationDate;
  /** The payment frequency of the leg. */
  private final Frequency frequency;
  /** Whether the period is a stub. */
  private final boolean stub;

  private AccrualPeriod(Builder builder) {
    ArgChecker.notNull(builder.startDate, "startDate");
    ArgChecker.notNull(builder.endDate, "endDate");
    ArgChecker.notNull(builder.paymentDate, "paymentDate");
    ArgChecker.notNull(builder.currency, "currency");
    ArgChecker.notNull(builder.dayCount, "dayCount");
    ArgChecker.notNull(builder.frequency, "frequency");
    ArgChecker.inOrderNotEqual(builder.startDate, builder.endDate, "startDate", "endDate");
    this.startDate = builder.startDate;
    this.endDate = builder.endDate;
    this.paymentDate = builder.paymentDate;
    this.notional = builder.notional;
    this.currency = builder.currency;
    this.dayCount = builder.dayCount;
    this.terminationDate = builder.terminationDate != null ? builder.terminationDate : builder.endDate;
    this.frequency = builder.frequency;
    this.stub = builder.stub;
  }

  /**
   * Creates a regular period with the default notional, currency and day count.
   * 
   * @param startDate  the start date
   * @param endDate  the end date
   * @param paymentDate  the payment date
   * @param frequency  the payment frequency
   * @return the period
   */
  public static AccrualPeriod of(LocalDate startDate, LocalDate endDate, LocalDate paymentDate, Frequency frequency) {
    return builder()
        .startDate(startDate)
        .endDate(endDate)
        .paymentDate(paymentDate)
        .frequency(frequency)
        .build();
  }

  /**
   * Returns a builder with the default notional (1,000,000), currency (USD) and day count (ACT/360).
   * 
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  //-------------------------------------------------------------------------
  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
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

  public DayCount getDayCount() {
    return dayCount;
  }

  public LocalDate getTerminationDate() {
    return terminationDate;
  }

  public Frequency getFrequency() {
    return frequency;
  }

  public boolean isStub() {
    return stub;
  }

  /**
   * Returns the accrual factor of the period in its day count.
   * 
   * @return the accrual factor
   */
  public double yearFraction() {
    return dayCount.yearFraction(startDate, endDate);
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    AccrualPeriod other = (AccrualPeriod) obj;
    return startDate.equals(other.startDate) &&
        endDate.equals(other.endDate) &&
        paymentDate.equals(other.paymentDate) &&
        Double.compare(notional, other.notional) == 0 &&
        currency.equals(other.currency) &&
        dayCount.equals(other.dayCount) &&
        terminationDate.equals(other.terminationDate) &&
        frequency.equals(other.frequency) &&
        stub == other.stub;
  }

  @Override
  public int hashCode() {
    return Objects.hash(startDate, endDate, paymentDate, notional, currency, dayCount, terminationDate, frequency, stub);
  }

  @Override
  public String toString() {
    return "AccrualPeriod[" + startDate + " to " + endDate + ", payment " + paymentDate + ", " +
        currency + " " + notional + ", " + dayCount + (stub ? ", stub]" : "]");
  }

  //-------------------------------------------------------------------------
  /**
   * Builder for {@link AccrualPeriod}.
   */
  public static final class Builder {

    private LocalDate startDate;
    private LocalDate endDate;
    private LocalDate paymentDate;
    private double notional = DEFAULT_NOTIONAL;
    private Currency currency = Currency.USD;
    private DayCount dayCount = DayCounts.ACT_360;
    private LocalDate terminationDate;
    private Frequency frequency;
    private boolean stub;

    private Builder() {
    }

    public Builder startDate(LocalDate startDate) {
      this.startDate = startDate;
      return this;
    }

    public Builder endDate(LocalDate endDate) {
      this.endDate = endDate;
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
      this.dayCount = dayCount;
      return this;
    }

    /**
     * Sets the termination date of the leg. Defaults to the end date.
     * 
     * @param terminationDate  the termination date
     * @return this builder
     */
    public Builder terminationDate(LocalDate terminationDate) {
      this.terminationDate = terminationDate;
      return this;
    }

    public Builder frequency(Frequency frequency) {
      this.frequency = frequency;
      return this;
    }

    public Builder stub(boolean stub) {
      this.stub = stub;
      return this;
    }

    public AccrualPeriod build() {
      return new AccrualPeriod(this);
    }

  }

}
