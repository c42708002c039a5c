/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.market.curve;

import java.time.LocalDate;
import java.util.Map.Entry;
import java.util.OptionalDouble;
import java.util.SortedMap;

import com.opengamma.strata.basics.currency.Currency;
import com.opengamma.strata.basics.date.DayCount;
import com.opengamma.strata.basics.date.DayCounts;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.market.curve.CurveMetadata;
import com.opengamma.strata.market.curve.Curves;
import com.opengamma.strata.market.curve.InterpolatedNodalCurve;
import com.opengamma.strata.market.curve.interpolator.CurveExtrapolators;
import com.opengamma.strata.market.curve.interpolator.CurveInterpolators;
import com.opengamma.strata.market.param.CurrencyParameterSensitivities;
import com.opengamma.strata.pricer.DiscountFactors;
import com.opengamma.strata.pricer.SimpleDiscountFactors;
import com.opengamma.strata.pricer.ZeroRateSensitivity;

/**
 * Discount factor curve with nodes on dates.
 * <p>
 * The discount factors are interpolated log-linearly in time and extrapolated log-linearly on
 * both sides. The time is measured with ACT/365F from the first node, which is the valuation date.
 * 
 * @author Marc Henrard
 */
public final class DiscountFactorCurve implements DiscountCurve {

  /** The default curve name. */
  private static final String DEFAULT_NAME = "DSC";
  /** The day count used to measure time on the curve. */
  private static final DayCount TIME_DAY_COUNT = DayCounts.ACT_365F;

  /** The underlying discount factors. */
  private final DiscountFactors discountFactors;
  /** The derivative order. */
  private int derivativeOrder;

  private DiscountFactorCurve(DiscountFactors discountFactors) {
    this.discountFactors = discountFactors;
  }

  /**
   * Creates a USD curve from discount factor nodes.
   * 
   * @param nodes  the discount factors by date, at least two
   * @return the curve
   */
  public static DiscountFactorCurve of(SortedMap<LocalDate, Double> nodes) {
    return of(DEFAULT_NAME, Currency.USD, nodes);
  }

  /**
   * Creates a curve from discount factor nodes.
   * 
   * @param name  the curve name
   * @param currency  the currency of the discount factors
   * @param nodes  the discount factors by date, at least two
   * @return the curve
   */
  public static DiscountFactorCurve of(String name, Currency currency, SortedMap<LocalDate, Double> nodes) {
    ArgChecker.notNull(nodes, "nodes");
    ArgChecker.isTrue(nodes.size() >= 2, "discount factor curve requires at least two nodes");
    LocalDate valuationDate = nodes.firstKey();
    double[] times = new double[nodes.size()];
    double[] values = new double[nodes.size()];
    int loopnode = 0;
    for (Entry<LocalDate, Double> node : nodes.entrySet()) {
      ArgChecker.isTrue(node.getValue() > 0, "discount factor must be positive, found {} on {}",
          node.getValue(), node.getKey());
      times[loopnode] = TIME_DAY_COUNT.relativeYearFraction(valuationDate, node.getKey());
      values[loopnode] = node.getValue();
      loopnode++;
    }
    CurveMetadata metadata = Curves.discountFactors(name, TIME_DAY_COUNT);
    InterpolatedNodalCurve curve = InterpolatedNodalCurve.of(
        metadata,
        DoubleArray.copyOf(times),
        DoubleArray.copyOf(values),
        CurveInterpolators.LOG_LINEAR,
        CurveExtrapolators.LOG_LINEAR,
        CurveExtrapolators.LOG_LINEAR);
    return new DiscountFactorCurve(SimpleDiscountFactors.of(currency, valuationDate, curve));
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the valuation date of the curve, which is its first node.
   * 
   * @return the valuation date
   */
  public LocalDate getValuationDate() {
    return discountFactors.getValuationDate();
  }

  @Override
  public double discountFactor(LocalDate date) {
    return discountFactors.discountFactor(date);
  }

  /**
   * {@inheritDoc}
   * <p>
   * The rate is the simply compounded rate implied by the ratio of discount factors.
   */
  @Override
  public OptionalDouble forwardRate(LocalDate startDate, LocalDate endDate, DayCount dayCount) {
    double accrualFactor = dayCount.yearFraction(startDate, endDate);
    double dfStart = discountFactors.discountFactor(startDate);
    double dfEnd = discountFactors.discountFactor(endDate);
    return OptionalDouble.of((dfStart / dfEnd - 1.0d) * 100.0d / accrualFactor);
  }

  @Override
  public CurrencyParameterSensitivities discountFactorSensitivity(LocalDate date) {
    ArgChecker.isTrue(derivativeOrder >= 1,
        "discount factor sensitivity requires a derivative order of at least 1, current order is {}", derivativeOrder);
    ZeroRateSensitivity pointSensitivity = discountFactors.zeroRatePointSensitivity(date);
    return discountFactors.parameterSensitivity(pointSensitivity);
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

  @Override
  public String toString() {
    return "DiscountFactorCurve[" + discountFactors.getCurrency() + ", " + discountFactors.getValuationDate() + "]";
  }

}
