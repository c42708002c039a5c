/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.product.period;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.collect.timeseries.LocalDateDoubleTimeSeries;

/**
 * Fixings overriding the projected rates of a floating period.
 * <p>
 * The fixings are one of: none, a single value, an ordered list of values for the first
 * observation dates or a series of values indexed by date. The dates of a series are kept in
 * the order provided; they are checked to be increasing when the fixings are used.
 * <p>
 * All values are rates in percent.
 * 
 * @author Marc Henrard
 */
public final class Fixings {

  /** The instance without fixings. */
  private static final Fixings NONE = new Fixings(FixingsType.NONE, DoubleArray.EMPTY, ImmutableList.of());

  /** The type. */
  private final FixingsType type;
  /** The values. */
  private final DoubleArray values;
  /** The dates, only for series. */
  private final ImmutableList<LocalDate> dates;

  private Fixings(FixingsType type, DoubleArray values, ImmutableList<LocalDate> dates) {
    this.type = type;
    this.values = values;
    this.dates = dates;
  }

  /**
   * Returns the fixings without any value.
   * 
   * @return the fixings
   */
  public static Fixings none() {
    return NONE;
  }

  /**
   * Creates a single value fixing.
   * 
   * @param value  the rate
   * @return the fixings
   */
  public static Fixings of(double value) {
    return new Fixings(FixingsType.SCALAR, DoubleArray.of(value), ImmutableList.of());
  }

  /**
   * Creates fixings for the first observation dates.
   * 
   * @param values  the rates, oldest first
   * @return the fixings
   */
  public static Fixings ofList(double... values) {
    return new Fixings(FixingsType.LIST, DoubleArray.copyOf(values), ImmutableList.of());
  }

  /**
   * Creates fixings indexed by date.
   * 
   * @param dates  the dates, expected to be increasing
   * @param values  the rates
   * @return the fixings
   */
  public static Fixings ofSeries(List<LocalDate> dates, DoubleArray values) {
    ArgChecker.noNulls(dates, "dates");
    ArgChecker.notNull(values, "values");
    ArgChecker.isTrue(dates.size() == values.size(),
        "fixings series requires the same number of dates and values, found {} and {}", dates.size(), values.size());
    return new Fixings(FixingsType.SERIES, values, ImmutableList.copyOf(dates));
  }

  /**
   * Creates fixings indexed by date from a time series.
   * 
   * @param timeSeries  the time series
   * @return the fixings
   */
  public static Fixings ofSeries(LocalDateDoubleTimeSeries timeSeries) {
    ArgChecker.notNull(timeSeries, "timeSeries");
    return new Fixings(
        FixingsType.SERIES,
        DoubleArray.copyOf(timeSeries.values().toArray()),
        timeSeries.dates().collect(ImmutableList.toImmutableList()));
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the type.
   * 
   * @return the type
   */
  public FixingsType getType() {
    return type;
  }

  /**
   * Returns the values, in the order provided.
   * 
   * @return the values
   */
  public DoubleArray getValues() {
    return values;
  }

  /**
   * Returns the dates of a series, in the order provided. Empty for other types.
   * 
   * @return the dates
   */
  public ImmutableList<LocalDate> getDates() {
    return dates;
  }

  /**
   * Returns the single value, for scalar fixings.
   * 
   * @return the value
   */
  public double getScalar() {
    ArgChecker.isTrue(type == FixingsType.SCALAR, "fixings are not a single value but {}", type);
    return values.get(0);
  }

  /**
   * Checks if the series dates are strictly increasing. True for other types.
   * 
   * @return true if increasing
   */
  public boolean isIncreasing() {
    for (int i = 1; i < dates.size(); i++) {
      if (!dates.get(i).isAfter(dates.get(i - 1))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the series value at a date. Empty if the date is not in the series or for other types.
   * 
   * @param date  the date
   * @return the value
   */
  public OptionalDouble seriesValue(LocalDate date) {
    int index = dates.indexOf(date);
    return index < 0 ? OptionalDouble.empty() : OptionalDouble.of(values.get(index));
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
    Fixings other = (Fixings) obj;
    return type == other.type && values.equals(other.values) && dates.equals(other.dates);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, values, dates);
  }

  @Override
  public String toString() {
    switch (type) {
      case NONE:
        return "Fixings[none]";
      case SERIES:
        return "Fixings[series, " + dates.size() + " dates]";
      default:
        return "Fixings[" + type + ", " + values + "]";
    }
  }

}
