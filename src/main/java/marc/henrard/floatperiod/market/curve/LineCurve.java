/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.market.curve;

import java.time.LocalDate;
import java.util.Map.Entry;
import java.util.OptionalDouble;
import java.util.SortedMap;

import com.opengamma.strata.basics.date.DayCount;
import com.opengamma.strata.basics.date.DayCounts;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.market.curve.Curves;
import com.opengamma.strata.market.curve.InterpolatedNodalCurve;
import com.opengamma.strata.market.curve.interpolator.CurveExtrapolators;
import com.opengamma.strata.market.curve.interpolator.CurveInterpolators;
import com.opengamma.strata.market.param.UnitParameterSensitivity;

/**
 * Curve of rate values with nodes on dates, linearly interpolated.
 * <p>
 * An unbounded curve is extrapolated linearly on both sides. A bounded curve has no value
 * before its first node or after its last node.
 * 
 * @author Marc Henrard
 */
public final class LineCurve implements ValueCurve {

  /** The default curve name. */
  private static final String DEFAULT_NAME = "FWD";
  /** The day count used to measure time on the curve. */
  private static final DayCount TIME_DAY_COUNT = DayCounts.ACT_365F;

  /** The underlying interpolated curve, with time measured from the first node. */
  private final InterpolatedNodalCurve curve;
  /** The first node date. */
  private final LocalDate firstDate;
  /** The last node date. */
  private final LocalDate lastDate;
  /** Whether values are only available between the first and last nodes. */
  private final boolean bounded;
  /** The derivative order. */
  private int derivativeOrder;

  private LineCurve(InterpolatedNodalCurve curve, LocalDate firstDate, LocalDate lastDate, boolean bounded) {
    this.curve = curve;
    this.firstDate = firstDate;
    this.lastDate = lastDate;
    this.bounded = bounded;
  }

  /**
   * Creates a curve extrapolated linearly outside the nodes.
   * 
   * @param nodes  the rate values, in percent, by date, at least two
   * @return the curve
   */
  public static LineCurve of(SortedMap<LocalDate, Double> nodes) {
    return create(nodes, false);
  }

  /**
   * Creates a curve which has no value outside the node dates.
   * 
   * @param nodes  the rate values, in percent, by date, at least two
   * @return the curve
   */
  public static LineCurve bounded(SortedMap<LocalDate, Double> nodes) {
    return create(nodes, true);
  }

  private static LineCurve create(SortedMap<LocalDate, Double> nodes, boolean bounded) {
    ArgChecker.notNull(nodes, "nodes");
    ArgChecker.isTrue(nodes.size() >= 2, "line curve requires at least two nodes");
    LocalDate firstDate = nodes.firstKey();
    double[] times = new double[nodes.size()];
    double[] values = new double[nodes.size()];
    int loopnode = 0;
    for (Entry<LocalDate, Double> node : nodes.entrySet()) {
      times[loopnode] = TIME_DAY_COUNT.relativeYearFraction(firstDate, node.getKey());
      values[loopnode] = node.getValue();
      loopnode++;
    }
    InterpolatedNodalCurve curve = InterpolatedNodalCurve.of(
        Curves.forwardRates(DEFAULT_NAME, TIME_DAY_COUNT),
        DoubleArray.copyOf(times),
        DoubleArray.copyOf(values),
        CurveInterpolators.LINEAR,
        CurveExtrapolators.LINEAR,
        CurveExtrapolators.LINEAR);
    return new LineCurve(curve, firstDate, nodes.lastKey(), bounded);
  }

  //-------------------------------------------------------------------------
  @Override
  public OptionalDouble valueAt(LocalDate date) {
    if (!isAvailable(date)) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(curve.yValue(time(date)));
  }

  @Override
  public UnitParameterSensitivity valueSensitivity(LocalDate date) {
    ArgChecker.isTrue(derivativeOrder >= 1,
        "value sensitivity requires a derivative order of at least 1, current order is {}", derivativeOrder);
    ArgChecker.isTrue(isAvailable(date), "no curve value available on {}", date);
    return curve.yValueParameterSensitivity(time(date));
  }

  @Override
  public int getDerivativeOrder() {
    return derivativeOrder;
  }

  @Override
  public void setDerivativeOrder(int order) {
    ArgChecker.isTrue(order >= 0 && order <= 2, "derivative order must be 0, 1 or 2, found {}", order);
    this.derivativeOrder = order;
  }

  private boolean isAvailable(LocalDate date) {
    return !bounded || (!date.isBefore(firstDate) && !date.isAfter(lastDate));
  }

  private double time(LocalDate date) {
    return TIME_DAY_COUNT.relativeYearFraction(firstDate, date);
  }

  @Override
  public String toString() {
    return "LineCurve[" + firstDate + " to " + lastDate + (bounded ? ", bounded]" : "]");
  }

}
