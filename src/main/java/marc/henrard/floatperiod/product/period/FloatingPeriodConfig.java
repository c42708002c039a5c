/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.product.period;

import java.util.Objects;

import com.opengamma.strata.basics.date.HolidayCalendar;
import com.opengamma.strata.basics.date.HolidayCalendars;
import com.opengamma.strata.collect.ArgChecker;

/**
 * The configuration of the rate of a floating period.
 * <p>
 * Describes how the rate is fixed, the spread and the way it is compounded, the fixings known
 * and the calendar on which the observation dates are generated. The spread is in basis points.
 * <p>
 * This class is immutable. The configuration is validated when built.
 * 
 * @author Marc Henrard
 */
public final class FloatingPeriodConfig {

  /** The fixing method. */
  private final FixingMethod fixingMethod;
  /** The number of business days associated to the fixing method. */
  private final int methodParam;
  /** The spread compounding method. */
  private final SpreadCompoundMethod spreadCompoundMethod;
  /** The spread, in basis points. */
  private final double floatSpread;
  /** The fixings. */
  private final Fixings fixings;
  /** The calendar used for the observation and fixing dates. */
  private final HolidayCalendar fixingCalendar;

  private FloatingPeriodConfig(Builder builder) {
    ArgChecker.notNull(builder.fixingMethod, "fixingMethod");
    ArgChecker.notNull(builder.spreadCompoundMethod, "spreadCompoundMethod");
    ArgChecker.notNull(builder.fixings, "fixings");
    ArgChecker.notNull(builder.fixingCalendar, "fixingCalendar");
    ArgChecker.notNegative(builder.methodParam, "methodParam");
    ArgChecker.isFalse(Double.isNaN(builder.floatSpread), "floatSpread must not be NaN");
    if (builder.fixingMethod == FixingMethod.RFR_LOCKOUT) {
      ArgChecker.isTrue(builder.methodParam > 0, "methodParam must be > 0 for {}, found {}",
          builder.fixingMethod, builder.methodParam);
    }
    if (builder.fixingMethod == FixingMethod.IBOR) {
      ArgChecker.isFalse(builder.fixings.getType() == FixingsType.LIST,
          "fixings can only be a single value or a series for the {} fixing method", builder.fixingMethod);
    }
    this.fixingMethod = builder.fixingMethod;
    this.methodParam = builder.methodParam;
    this.spreadCompoundMethod = builder.spreadCompoundMethod;
    this.floatSpread = builder.floatSpread;
    this.fixings = builder.fixings;
    this.fixingCalendar = builder.fixingCalendar;
  }

  /**
   * Returns the default configuration: payment delay, no spread, no fixings.
   * 
   * @return the configuration
   */
  public static FloatingPeriodConfig defaults() {
    return builder().build();
  }

  /**
   * Returns a builder with the default values.
   * 
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder initialized with this configuration.
   * 
   * @return the builder
   */
  public Builder toBuilder() {
    return new Builder()
        .fixingMethod(fixingMethod)
        .methodParam(methodParam)
        .spreadCompoundMethod(spreadCompoundMethod)
        .floatSpread(floatSpread)
        .fixings(fixings)
        .fixingCalendar(fixingCalendar);
  }

  //-------------------------------------------------------------------------
  public FixingMethod getFixingMethod() {
    return fixingMethod;
  }

  public int getMethodParam() {
    return methodParam;
  }

  public SpreadCompoundMethod getSpreadCompoundMethod() {
    return spreadCompoundMethod;
  }

  public double getFloatSpread() {
    return floatSpread;
  }

  public Fixings getFixings() {
    return fixings;
  }

  public HolidayCalendar getFixingCalendar() {
    return fixingCalendar;
  }

  /**
   * Checks if the rate exposure requires the full compounding chain.
   * <p>
   * This is the case when the rates of some dates impact several compounding periods (lockout and
   * lookback) or when the spread is compounded with the rates.
   * 
   * @return true if complex
   */
  public boolean isComplex() {
    return fixingMethod == FixingMethod.RFR_LOCKOUT ||
        fixingMethod == FixingMethod.RFR_LOOKBACK ||
        spreadCompoundMethod != SpreadCompoundMethod.NONE_SIMPLE;
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
    FloatingPeriodConfig other = (FloatingPeriodConfig) obj;
    return fixingMethod == other.fixingMethod &&
        methodParam == other.methodParam &&
        spreadCompoundMethod == other.spreadCompoundMethod &&
        Double.compare(floatSpread, other.floatSpread) == 0 &&
        fixings.equals(other.fixings) &&
        fixingCalendar.equals(other.fixingCalendar);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fixingMethod, methodParam, spreadCompoundMethod, floatSpread, fixings, fixingCalendar);
  }

  @Override
  public String toString() {
    return "FloatingPeriodConfig[" + fixingMethod + "(" + methodParam + "), " + spreadCompoundMethod +
        ", spread=" + floatSpread + ", " + fixings + ", " + fixingCalendar.getName() + "]";
  }

  //-------------------------------------------------------------------------
  /**
   * Builder for {@link FloatingPeriodConfig}.
   */
  public static final class Builder {

    private FixingMethod fixingMethod = FixingMethod.RFR_PAYMENT_DELAY;
    private int methodParam;
    private SpreadCompoundMethod spreadCompoundMethod = SpreadCompoundMethod.NONE_SIMPLE;
    private double floatSpread;
    private Fixings fixings = Fixings.none();
    private HolidayCalendar fixingCalendar = HolidayCalendars.NO_HOLIDAYS;

    private Builder() {
    }

    public Builder fixingMethod(FixingMethod fixingMethod) {
      this.fixingMethod = fixingMethod;
      return this;
    }

    /**
     * Sets the fixing method from its name, e.g. 'rfr_lookback'.
     * 
     * @param name  the name of the method
     * @return this builder
     */
    public Builder fixingMethod(String name) {
      this.fixingMethod = FixingMethod.of(name);
      return this;
    }

    public Builder methodParam(int methodParam) {
      this.methodParam = methodParam;
      return this;
    }

    public Builder spreadCompoundMethod(SpreadCompoundMethod spreadCompoundMethod) {
      this.spreadCompoundMethod = spreadCompoundMethod;
      return this;
    }

    /**
     * Sets the spread compounding method from its name, e.g. 'isda_flat_compounding'.
     * 
     * @param name  the name of the method
     * @return this builder
     */
    public Builder spreadCompoundMethod(String name) {
      this.spreadCompoundMethod = SpreadCompoundMethod.of(name);
      return this;
    }

    public Builder floatSpread(double floatSpread) {
      this.floatSpread = floatSpread;
      return this;
    }

    public Builder fixings(Fixings fixings) {
      this.fixings = fixings;
      return this;
    }

    public Builder fixingCalendar(HolidayCalendar fixingCalendar) {
      this.fixingCalendar = fixingCalendar;
      return this;
    }

    public FloatingPeriodConfig build() {
      return new FloatingPeriodConfig(this);
    }

  }

}
