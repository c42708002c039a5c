/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;

/**
 * The fixing of a term rate: its date, its value without spread and its origin.
 * 
 * @author Marc Henrard
 */
public final class TermFixing {

  private final LocalDate fixingDate;
  private final double rate;
  private final FixingProvenance provenance;

  TermFixing(LocalDate fixingDate, double rate, FixingProvenance provenance) {
    this.fixingDate = fixingDate;
    this.rate = rate;
    this.provenance = provenance;
  }

  public LocalDate getFixingDate() {
    return fixingDate;
  }

  /**
   * Returns the fixed or projected rate, in percent, without the spread.
   * 
   * @return the rate
   */
  public double getRate() {
    return rate;
  }

  public FixingProvenance getProvenance() {
    return provenance;
  }

  @Override
  public String toString() {
    return "TermFixing[" + fixingDate + ", " + rate + ", " + provenance + "]";
  }

}
