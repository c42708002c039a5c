/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

/**
 * The exposure of a floating period to each of its fixings.
 * <p>
 * The rows are ordered by date. The aggregate row, when present, is dated on the payment date,
 * has the total projected cash flow as notional and the period rate as rate.
 * 
 * @author Marc Henrard
 */
public final class ExposureTable {

  private final ImmutableList<ExposureRow> rows;
  private final Optional<ExposureRow> aggregate;

  private ExposureTable(List<ExposureRow> rows, Optional<ExposureRow> aggregate) {
    ArgChecker.noNulls(rows, "rows");
    ArgChecker.notNull(aggregate, "aggregate");
    this.rows = ImmutableList.copyOf(rows);
    this.aggregate = aggregate;
  }

  /**
   * Creates a table.
   * 
   * @param rows  the rows
   * @param aggregate  the aggregate row, optional
   * @return the table
   */
  public static ExposureTable of(List<ExposureRow> rows, Optional<ExposureRow> aggregate) {
    return new ExposureTable(rows, aggregate);
  }

  public ImmutableList<ExposureRow> getRows() {
    return rows;
  }

  public Optional<ExposureRow> getAggregate() {
    return aggregate;
  }

  /**
   * Returns the number of rows, excluding the aggregate.
   * 
   * @return the size
   */
  public int size() {
    return rows.size();
  }

  public ImmutableList<LocalDate> dates() {
    return rows.stream().map(ExposureRow::getDate).collect(ImmutableList.toImmutableList());
  }

  public DoubleArray notionals() {
    return DoubleArray.of(rows.size(), i -> rows.get(i).getNotional());
  }

  public DoubleArray rates() {
    return DoubleArray.of(rows.size(), i -> rows.get(i).getRate());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ExposureTable)) {
      return false;
    }
    ExposureTable other = (ExposureTable) obj;
    return rows.equals(other.rows) && aggregate.equals(other.aggregate);
  }

  @Override
  public int hashCode() {
    return rows.hashCode() * 31 + aggregate.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("ExposureTable[\n");
    rows.forEach(row -> builder.append("  ").append(row).append('\n'));
    aggregate.ifPresent(row -> builder.append("  total ").append(row).append('\n'));
    return builder.append(']').toString();
  }

}
