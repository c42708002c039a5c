/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import java.util.Arrays;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.floatperiod.product.period.SpreadCompoundMethod;

/**
 * Compounding of overnight rates with a spread.
 * <p>
 * The rates are in percent and the spread in basis points. With {@code a_i = r_i + s/100} and
 * {@code D} the sum of the accrual factors {@code d_i}, the compounded rate is
 * <ul>
 * <li>{@code NONE_SIMPLE}: (prod(1 + r_i d_i / 100) - 1) / D * 100 + s / 100
 * <li>{@code ISDA_COMPOUNDING}: (prod(1 + a_i d_i / 100) - 1) / D * 100
 * <li>{@code ISDA_FLAT_COMPOUNDING}: sum(inc_i) / D * 100 with
 * inc_i = a_i d_i / 100 + inc_{i-1} r_i d_i / 100 and inc_0 = 0
 * </ul>
 * The sensitivities are the derivatives of the compounded rate with respect to each rate,
 * computed by algorithmic differentiation in adjoint mode.
 * 
 * @author Marc Henrard
 */
public final class RateCompounder {

  /** Default implementation. */
  public static final RateCompounder DEFAULT = new RateCompounder();

  /**
   * Computes the compounded rate.
   * 
   * @param rates  the rates of each compounding entry, in percent
   * @param accrualFactors  the accrual factors of each compounding entry
   * @param spread  the spread, in basis points
   * @param method  the spread compounding method
   * @return the compounded rate, in percent
   */
  public double compound(
      DoubleArray rates,
      DoubleArray accrualFactors,
      double spread,
      SpreadCompoundMethod method) {

    checkInputs(rates, accrualFactors, method);
    double totalAccrual = accrualFactors.sum();
    double spreadPercent = spread / 100.0d;
    switch (method) {
      case NONE_SIMPLE:
        return (product(rates, accrualFactors, 0.0d) - 1.0d) / totalAccrual * 100.0d + spreadPercent;
      case ISDA_COMPOUNDING:
        return (product(rates, accrualFactors, spreadPercent) - 1.0d) / totalAccrual * 100.0d;
      case ISDA_FLAT_COMPOUNDING:
        double[] increments = flatIncrements(rates, accrualFactors, spreadPercent);
        return Arrays.stream(increments).sum() / totalAccrual * 100.0d;
      default:
        throw unknownMethod(method);
    }
  }

  /**
   * Computes the derivatives of the compounded rate with respect to each rate.
   * 
   * @param rates  the rates of each compounding entry, in percent
   * @param accrualFactors  the accrual factors of each compounding entry
   * @param spread  the spread, in basis points
   * @param method  the spread compounding method
   * @return the derivatives, one per compounding entry
   */
  public DoubleArray compoundSensitivity(
      DoubleArray rates,
      DoubleArray accrualFactors,
      double spread,
      SpreadCompoundMethod method) {

    checkInputs(rates, accrualFactors, method);
    int nbRates = rates.size();
    double totalAccrual = accrualFactors.sum();
    double spreadPercent = spread / 100.0d;
    switch (method) {
      case NONE_SIMPLE:
      case ISDA_COMPOUNDING: {
        double shift = method == SpreadCompoundMethod.ISDA_COMPOUNDING ? spreadPercent : 0.0d;
        double product = product(rates, accrualFactors, shift);
        return DoubleArray.of(nbRates, i -> accrualFactors.get(i) / totalAccrual * product /
            (1.0d + (rates.get(i) + shift) / 100.0d * accrualFactors.get(i)));
      }
      case ISDA_FLAT_COMPOUNDING: {
        // Forward sweep
        double[] increments = flatIncrements(rates, accrualFactors, spreadPercent);
        // Backward sweep
        double[] derivatives = new double[nbRates];
        double carryBar = 0.0d;
        for (int i = nbRates - 1; i >= 0; i--) {
          double incrementBar = 100.0d / totalAccrual + carryBar;
          double previous = i > 0 ? increments[i - 1] : 0.0d;
          derivatives[i] = incrementBar * (accrualFactors.get(i) / 100.0d + previous * accrualFactors.get(i) / 100.0d);
          carryBar = incrementBar * rates.get(i) / 100.0d * accrualFactors.get(i);
        }
        return DoubleArray.ofUnsafe(derivatives);
      }
      default:
        throw unknownMethod(method);
    }
  }

  //-------------------------------------------------------------------------
  private static double product(DoubleArray rates, DoubleArray accrualFactors, double shift) {
    double product = 1.0d;
    for (int i = 0; i < rates.size(); i++) {
      product *= 1.0d + (rates.get(i) + shift) / 100.0d * accrualFactors.get(i);
    }
    return product;
  }

  private static double[] flatIncrements(DoubleArray rates, DoubleArray accrualFactors, double spreadPercent) {
    double[] increments = new double[rates.size()];
    double previous = 0.0d;
    for (int i = 0; i < rates.size(); i++) {
      increments[i] = (rates.get(i) + spreadPercent) / 100.0d * accrualFactors.get(i) +
          previous * rates.get(i) / 100.0d * accrualFactors.get(i);
      previous = increments[i];
    }
    return increments;
  }

  private static void checkInputs(DoubleArray rates, DoubleArray accrualFactors, SpreadCompoundMethod method) {
    ArgChecker.notNull(rates, "rates");
    ArgChecker.notNull(accrualFactors, "accrualFactors");
    ArgChecker.notNull(method, "method");
    ArgChecker.isTrue(rates.size() == accrualFactors.size(),
        "rates and accrual factors must have the same size, found {} and {}", rates.size(), accrualFactors.size());
    ArgChecker.isTrue(rates.size() > 0, "at least one rate is required for compounding");
  }

  private static IllegalArgumentException unknownMethod(SpreadCompoundMethod method) {
    return new IllegalArgumentException("spread compound method must be in " +
        Arrays.toString(SpreadCompoundMethod.values()) + ", found " + method);
  }

}
