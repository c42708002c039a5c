/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import java.time.LocalDate;

import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.date.DayCounts;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.data.MarketDataNotFoundException;

import marc.henrard.floatperiod.dataset.PeriodCurvesDataSet;
import marc.henrard.floatperiod.market.curve.LineCurve;
import marc.henrard.floatperiod.market.curve.RateCurve;
import marc.henrard.floatperiod.product.period.AccrualPeriod;
import marc.henrard.floatperiod.product.period.FixingMethod;
import marc.henrard.floatperiod.product.period.Fixings;
import marc.henrard.floatperiod.product.period.FloatingPeriodConfig;
import marc.henrard.floatperiod.product.period.SpreadCompoundMethod;

/**
 * Tests {@link FixingResolver}.
 * 
 * @author Marc Henrard
 */
@Test
public class FixingResolverTest {

  private static final FixingResolver RESOLVER = FixingResolver.DEFAULT;
  private static final double TOLERANCE_RATE = 1.0E-10;

  /* Thursday 30 December 2021 to Monday 3 January 2022, all days open. */
  private static final AccrualPeriod PERIOD_YEAR_END = AccrualPeriod.builder()
      .startDate(LocalDate.of(2021, 12, 30))
      .endDate(LocalDate.of(2022, 1, 3))
      .paymentDate(LocalDate.of(2022, 1, 3))
      .dayCount(DayCounts.ACT_365F)
      .frequency(Frequency.P3M)
      .build();

  public void projected() {
    AccrualPeriod period = AccrualPeriod.builder()
        .startDate(LocalDate.of(2022, 1, 1))
        .endDate(LocalDate.of(2022, 1, 4))
        .paymentDate(LocalDate.of(2022, 1, 4))
        .dayCount(DayCounts.ACT_365F)
        .frequency(Frequency.P3M)
        .build();
    for (RateCurve curve : ImmutableList.of(PeriodCurvesDataSet.rfrCurve(), PeriodCurvesDataSet.lineCurve())) {
      ResolvedFixings fixings = RESOLVER.resolve(period, FloatingPeriodConfig.defaults(), curve);
      assertEquals(fixings.getRates().size(), 3);
      for (int i = 0; i < 3; i++) {
        assertEquals(fixings.getRates().get(i), i + 1.0d, TOLERANCE_RATE);
        assertEquals(fixings.getProvenances().get(i), FixingProvenance.PROJECTED);
      }
      assertFalse(fixings.getPeriodRateOverride().isPresent());
      assertTrue(fixings.getWarnings().isEmpty());
    }
  }

  public void list_overrides_first_dates() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(Fixings.ofList(1.5d, 2.5d)).build();
    ResolvedFixings fixings = RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.rfrCurve());
    assertEquals(fixings.getRates().subArray(0, 2), DoubleArray.of(1.5d, 2.5d));
    assertEquals(fixings.getProvenances(), ImmutableList.of(
        FixingProvenance.OVERRIDE, FixingProvenance.OVERRIDE, FixingProvenance.PROJECTED, FixingProvenance.PROJECTED));
    assertEquals(fixings.getRates().get(2), 1.0d, TOLERANCE_RATE);
    assertEquals(fixings.getRates().get(3), 2.0d, TOLERANCE_RATE);
  }

  public void list_too_long_fails() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixings(Fixings.ofList(1.0d, 1.0d, 1.0d, 1.0d, 1.0d))
        .build();
    assertThrows(IllegalArgumentException.class,
        () -> RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.rfrCurve()));
  }

  public void all_fixed_without_curve() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixings(Fixings.ofList(1.0d, 2.0d, 3.0d, 4.0d))
        .build();
    ResolvedFixings fixings = RESOLVER.resolve(PERIOD_YEAR_END, config, null);
    assertEquals(fixings.getRates(), DoubleArray.of(1.0d, 2.0d, 3.0d, 4.0d));
  }

  public void no_curve_fails() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(Fixings.ofList(1.0d)).build();
    MarketDataNotFoundException exception = expectThrows(MarketDataNotFoundException.class,
        () -> RESOLVER.resolve(PERIOD_YEAR_END, config, null));
    assertTrue(exception.getMessage().contains("RFRs could not be calculated"));
  }

  public void series_exact_dates() {
    Fixings series = Fixings.ofSeries(
        ImmutableList.of(
            LocalDate.of(1995, 1, 1), LocalDate.of(2021, 12, 29), LocalDate.of(2021, 12, 30), LocalDate.of(2021, 12, 31)),
        DoubleArray.of(99.0d, 99.0d, 1.5d, 2.5d));
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(series).build();
    ResolvedFixings fixings = RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.lineCurve());
    assertEquals(fixings.getRates().subArray(0, 2), DoubleArray.of(1.5d, 2.5d));
    assertEquals(fixings.getRates().get(2), 1.0d, TOLERANCE_RATE);
    assertEquals(fixings.getRates().get(3), 2.0d, TOLERANCE_RATE);
    assertTrue(fixings.getWarnings().isEmpty());
  }

  public void series_missing_date_warns_once() {
    Fixings series = Fixings.ofSeries(
        ImmutableList.of(LocalDate.of(1995, 12, 1), LocalDate.of(2021, 12, 30), LocalDate.of(2022, 1, 1)),
        DoubleArray.of(99.0d, 99.0d, 2.5d));
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(series).floatSpread(100.0d).build();
    ResolvedFixings fixings = RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.lineCurve());
    assertEquals(fixings.getWarnings().size(), 1);
    assertEquals(fixings.getProvenances().get(1), FixingProvenance.PROJECTED);
    assertEquals(fixings.getRates().get(1), -99.0d, TOLERANCE_RATE);
    assertEquals(fixings.getRates().get(2), 2.5d);
  }

  public void series_not_increasing_fails() {
    Fixings series = Fixings.ofSeries(
        ImmutableList.of(
            LocalDate.of(1995, 12, 1), LocalDate.of(2021, 12, 30), LocalDate.of(2022, 12, 31), LocalDate.of(2022, 1, 1)),
        DoubleArray.of(99.0d, 2.25d, 2.375d, 2.5d));
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(series).build();
    IllegalArgumentException exception = expectThrows(IllegalArgumentException.class,
        () -> RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.curve()));
    assertTrue(exception.getMessage().contains("fixings as a series must be increasing"));
  }

  public void scalar_is_period_rate() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(Fixings.of(1.0d)).build();
    ResolvedFixings fixings = RESOLVER.resolve(PERIOD_YEAR_END, config, null);
    assertEquals(fixings.getPeriodRateOverride().getAsDouble(), 1.0d);
    assertEquals(fixings.getRates(), DoubleArray.filled(4, 1.0d));
    assertTrue(fixings.getWarnings().isEmpty());
  }

  public void scalar_with_compounded_spread_warns() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixings(Fixings.of(1.0d))
        .floatSpread(100.0d)
        .spreadCompoundMethod(SpreadCompoundMethod.ISDA_COMPOUNDING)
        .build();
    ResolvedFixings fixings = RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.curve());
    assertEquals(fixings.getWarnings().size(), 1);
  }

  public void list_with_compounded_spread_warns() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixings(Fixings.ofList(1.5d, 2.5d))
        .floatSpread(100.0d)
        .spreadCompoundMethod(SpreadCompoundMethod.ISDA_COMPOUNDING)
        .build();
    ResolvedFixings fixings = RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.lineCurve());
    assertEquals(fixings.getWarnings().size(), 1);
    ResolvedFixings simple = RESOLVER.resolve(
        PERIOD_YEAR_END, config.toBuilder().spreadCompoundMethod(SpreadCompoundMethod.NONE_SIMPLE).build(),
        PeriodCurvesDataSet.lineCurve());
    assertTrue(simple.getWarnings().isEmpty());
    ResolvedFixings noSpread = RESOLVER.resolve(
        PERIOD_YEAR_END, config.toBuilder().floatSpread(0.0d).build(), PeriodCurvesDataSet.lineCurve());
    assertTrue(noSpread.getWarnings().isEmpty());
  }

  public void series_with_compounded_spread_warns() {
    Fixings series = Fixings.ofSeries(
        ImmutableList.of(LocalDate.of(2021, 12, 30), LocalDate.of(2021, 12, 31)),
        DoubleArray.of(1.5d, 2.5d));
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixings(series)
        .floatSpread(100.0d)
        .spreadCompoundMethod(SpreadCompoundMethod.ISDA_COMPOUNDING)
        .build();
    ResolvedFixings fixings = RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.lineCurve());
    assertEquals(fixings.getWarnings().size(), 1);
    // projected dates only, no fixing used
    ResolvedFixings projected = RESOLVER.resolve(
        PERIOD_YEAR_END, config.toBuilder().fixings(Fixings.none()).build(), PeriodCurvesDataSet.lineCurve());
    assertTrue(projected.getWarnings().isEmpty());
  }

  public void lockout_uses_list() {
    AccrualPeriod period = AccrualPeriod.builder()
        .startDate(LocalDate.of(2022, 1, 1))
        .endDate(LocalDate.of(2022, 1, 4))
        .paymentDate(LocalDate.of(2022, 1, 4))
        .dayCount(DayCounts.ACT_365F)
        .frequency(Frequency.P3M)
        .build();
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixingMethod(FixingMethod.RFR_LOCKOUT)
        .methodParam(2)
        .fixings(Fixings.ofList(10.0d, 8.0d))
        .build();
    ResolvedFixings fixings = RESOLVER.resolve(period, config, PeriodCurvesDataSet.rfrCurve());
    assertEquals(fixings.getRates().subArray(0, 2), DoubleArray.of(10.0d, 8.0d));
    assertEquals(fixings.compoundedRates(), DoubleArray.of(10.0d, 10.0d, 10.0d));
  }

  public void curve_without_value_fails() {
    AccrualPeriod period = AccrualPeriod.of(
        LocalDate.of(2022, 12, 28), LocalDate.of(2023, 1, 2), LocalDate.of(2023, 1, 2), Frequency.P1M);
    LineCurve curve = LineCurve.bounded(PeriodCurvesDataSet.nodes(
        LocalDate.of(2023, 1, 1), 3.0d,
        LocalDate.of(2023, 2, 1), 2.0d));
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(Fixings.ofList(1.19d, 1.19d)).build();
    MarketDataNotFoundException exception = expectThrows(MarketDataNotFoundException.class,
        () -> RESOLVER.resolve(period, config, curve));
    assertTrue(exception.getMessage().contains("RFRs could not be calculated"));
  }

  public void ibor_fails() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixingMethod(FixingMethod.IBOR).build();
    assertThrows(IllegalArgumentException.class,
        () -> RESOLVER.resolve(PERIOD_YEAR_END, config, PeriodCurvesDataSet.curve()));
  }

}
