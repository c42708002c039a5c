/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A row of an exposure table.
 * <p>
 * The notional is the notional of a deposit on the fixing, starting on the row date, whose
 * sensitivity to the rate is the same as the sensitivity of the period cash flow.
 * 
 * @author Marc Henrard
 */
public final class ExposureRow {

  private final LocalDate date;
  private final double notional;
  private final OptionalDouble accrualFactor;
  private final double rate;

  /**
   * Creates a row.
   * 
   * @param date  the observation or fixing date
   * @param notional  the notional exposure
   * @param accrualFactor  the accrual factor of the fixing, empty if not relevant
   * @param rate  the rate, in percent
   * @return the row
   */
  public static ExposureRow of(LocalDate date, double notional, OptionalDouble accrualFactor, double rate) {
    return new ExposureRow(date, notional, accrualFactor, rate);
  }

  private ExposureRow(LocalDate date, double notional, OptionalDouble accrualFactor, double rate) {
    this.date = Objects.requireNonNull(date, "date");
    this.notional = notional;
    this.accrualFactor = Objects.requireNonNull(accrualFactor, "accrualFactor");
    this.rate = rate;
  }

  public LocalDate getDate() {
    return date;
  }

  public double getNotional() {
    return notional;
  }

  public OptionalDouble getAccrualFactor() {
    return accrualFactor;
  }

  public double getRate() {
    return rate;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ExposureRow)) {
      return false;
    }
    ExposureRow other = (ExposureRow) obj;
    return date.equals(other.date) &&
        Double.compare(notional, other.notional) == 0 &&
        accrualFactor.equals(other.accrualFactor) &&
        Double.compare(rate, other.rate) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(date, notional, accrualFactor, rate);
  }

  @Override
  public String toString() {
    return date + ": " + notional + ", " + (accrualFactor.isPresent() ? accrualFactor.getAsDouble() : "-") + ", " + rate;
  }

}
