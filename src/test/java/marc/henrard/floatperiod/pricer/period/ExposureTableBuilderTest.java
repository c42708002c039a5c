/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.pricer.period;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import java.time.LocalDate;
import java.util.OptionalDouble;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.date.DayCounts;
import com.opengamma.strata.basics.date.HolidayCalendars;
import com.opengamma.strata.basics.schedule.Frequency;
import com.opengamma.strata.data.MarketDataNotFoundException;

import marc.henrard.floatperiod.dataset.PeriodCurvesDataSet;
import marc.henrard.floatperiod.market.curve.DiscountFactorCurve;
import marc.henrard.floatperiod.market.curve.LineCurve;
import marc.henrard.floatperiod.market.curve.RateCurve;
import marc.henrard.floatperiod.product.period.AccrualPeriod;
import marc.henrard.floatperiod.product.period.FixingMethod;
import marc.henrard.floatperiod.product.period.Fixings;
import marc.henrard.floatperiod.product.period.FloatingPeriodConfig;
import marc.henrard.floatperiod.product.period.SpreadCompoundMethod;

/**
 * Tests {@link ExposureTableBuilder}.
 * 
 * @author Marc Henrard
 */
@Test
public class ExposureTableBuilderTest {

  private static final ExposureTableBuilder BUILDER = ExposureTableBuilder.DEFAULT;
  private static final double TOLERANCE_NOTIONAL = 1.0d;

  /* Wednesday 5 to Tuesday 11 January 2022, receiving 1m. */
  private static final AccrualPeriod PERIOD_WEEK = AccrualPeriod.builder()
      .startDate(LocalDate.of(2022, 1, 5))
      .endDate(LocalDate.of(2022, 1, 11))
      .paymentDate(LocalDate.of(2022, 1, 11))
      .notional(-1_000_000.0d)
      .dayCount(DayCounts.ACT_365F)
      .frequency(Frequency.P3M)
      .build();

  @DataProvider(name = "methods")
  public static Object[][] data_methods() {
    return new Object[][] {
        {FixingMethod.RFR_PAYMENT_DELAY, new double[] {1000616, 1000589, 1000328, 1000561}, LocalDate.of(2022, 1, 6)},
        {FixingMethod.RFR_OBSERVATION_SHIFT, new double[] {1500369, 1500328, 1500287, 1500246}, LocalDate.of(2022, 1, 4)},
        {FixingMethod.RFR_LOCKOUT, new double[] {1000548, 5001945, 0, 0}, LocalDate.of(2022, 1, 6)},
        {FixingMethod.RFR_LOOKBACK, new double[] {1000411, 1000383, 3000575, 1000328}, LocalDate.of(2022, 1, 4)},
    };
  }

  @Test(dataProvider = "methods")
  public void overnight_exposures(FixingMethod method, double[] expected, LocalDate expectedDate) {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixingMethod(method)
        .methodParam(2)
        .fixingCalendar(HolidayCalendars.SAT_SUN)
        .build();
    for (RateCurve curve : ImmutableList.of(
        PeriodCurvesDataSet.businessDayCurve(), PeriodCurvesDataSet.businessDayLineCurve())) {
      ExposureTable table = BUILDER.table(PERIOD_WEEK, config, curve, true);
      assertEquals(table.size(), 4);
      assertEquals(table.dates().get(1), expectedDate);
      for (int i = 0; i < expected.length; i++) {
        assertEquals(table.getRows().get(i).getNotional(), expected[i], TOLERANCE_NOTIONAL, method + " row " + i);
      }
      assertTrue(table.getAggregate().isPresent());
    }
  }

  @DataProvider(name = "single")
  public static Object[][] data_single() {
    return new Object[][] {
        {FixingMethod.RFR_PAYMENT_DELAY, 1_000_000.0d},
        {FixingMethod.RFR_OBSERVATION_SHIFT, 1_000_000.0d / 3.0d},
        {FixingMethod.RFR_LOOKBACK, 1_000_000.0d / 3.0d},
    };
  }

  /* One day period on Monday, the observation is the previous Friday for shift and lookback. */
  @Test(dataProvider = "single")
  public void single_date(FixingMethod method, double expected) {
    DiscountFactorCurve curve = DiscountFactorCurve.of(PeriodCurvesDataSet.nodes(
        LocalDate.of(2022, 1, 3), 1.0d,
        LocalDate.of(2022, 1, 15), 0.9995d));
    AccrualPeriod period = AccrualPeriod.builder()
        .startDate(LocalDate.of(2022, 1, 10))
        .endDate(LocalDate.of(2022, 1, 11))
        .paymentDate(LocalDate.of(2022, 1, 11))
        .notional(-1_000_000.0d)
        .dayCount(DayCounts.ACT_365F)
        .frequency(Frequency.P3M)
        .build();
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixingMethod(method)
        .methodParam(1)
        .fixingCalendar(HolidayCalendars.SAT_SUN)
        .build();
    ExposureTable table = BUILDER.table(period, config, curve, false);
    assertEquals(table.size(), 1);
    assertEquals(table.getRows().get(0).getNotional(), expected, TOLERANCE_NOTIONAL);
    assertFalse(table.getAggregate().isPresent());
  }

  public void fixings_list_table() {
    AccrualPeriod period = AccrualPeriod.of(
        LocalDate.of(2022, 12, 28), LocalDate.of(2023, 1, 2), LocalDate.of(2023, 1, 2), Frequency.P1M);
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(Fixings.ofList(1.19d, 1.19d, -8.81d)).build();
    DiscountFactorCurve curve = PeriodCurvesDataSet.curve();
    ExposureTable table = BUILDER.table(period, config, curve, false);
    assertEquals(table.dates(), ImmutableList.of(
        LocalDate.of(2022, 12, 28), LocalDate.of(2022, 12, 29), LocalDate.of(2022, 12, 30),
        LocalDate.of(2022, 12, 31), LocalDate.of(2023, 1, 1)));
    double[] notionals = {-1000011.27030, -1000011.27030, -1000289.11920, -999932.84380, -999932.84380};
    double[] rates = {1.19, 1.19, -8.81, 4.01364, 4.01364};
    for (int i = 0; i < 5; i++) {
      ExposureRow row = table.getRows().get(i);
      assertEquals(row.getNotional(), notionals[i], 1.0E-3);
      assertEquals(row.getRate(), rates[i], 1.0E-5);
      assertEquals(row.getAccrualFactor().getAsDouble(), 1.0d / 360.0d, 1.0E-15);
    }
    // values do not depend on the derivatives computed by the curve
    curve.setDerivativeOrder(1);
    assertEquals(BUILDER.table(period, config, curve, false), table);
  }

  public void spread_impacts_exposure_only_when_compounded() {
    AccrualPeriod period = AccrualPeriod.builder()
        .startDate(LocalDate.of(2022, 1, 1))
        .endDate(LocalDate.of(2022, 7, 1))
        .paymentDate(LocalDate.of(2022, 7, 1))
        .dayCount(DayCounts.ACT_365F)
        .frequency(Frequency.P6M)
        .build();
    DiscountFactorCurve curve = PeriodCurvesDataSet.curve();
    FloatingPeriodConfig simple = FloatingPeriodConfig.defaults();
    assertEquals(
        BUILDER.table(period, simple, curve, false).notionals().get(0),
        BUILDER.table(period, simple.toBuilder().floatSpread(200.0d).build(), curve, false).notionals().get(0));
    FloatingPeriodConfig isda = simple.toBuilder().spreadCompoundMethod(SpreadCompoundMethod.ISDA_COMPOUNDING).build();
    assertNotEquals(
        BUILDER.table(period, isda, curve, false).notionals().get(0),
        BUILDER.table(period, isda.toBuilder().floatSpread(200.0d).build(), curve, false).notionals().get(0));
  }

  public void complex_matches_simple_without_lookback() {
    FloatingPeriodConfig simple = FloatingPeriodConfig.builder()
        .fixingMethod(FixingMethod.RFR_OBSERVATION_SHIFT)
        .methodParam(2)
        .fixingCalendar(HolidayCalendars.SAT_SUN)
        .build();
    // zero spread compounded: same rate, exposures computed by the adjoint path
    FloatingPeriodConfig complex = simple.toBuilder().spreadCompoundMethod(SpreadCompoundMethod.ISDA_COMPOUNDING).build();
    DiscountFactorCurve curve = PeriodCurvesDataSet.businessDayCurve();
    ExposureTable tableSimple = BUILDER.table(PERIOD_WEEK, simple, curve, false);
    ExposureTable tableComplex = BUILDER.table(PERIOD_WEEK, complex, curve, false);
    for (int i = 0; i < tableSimple.size(); i++) {
      assertEquals(tableComplex.notionals().get(i), tableSimple.notionals().get(i), 1.0E-6);
    }
  }

  /* Wednesday 5 to Saturday 8 January 2022: the Friday fixing covers three days, its accrual one. */
  public void payment_delay_ending_on_holiday() {
    AccrualPeriod period = AccrualPeriod.builder()
        .startDate(LocalDate.of(2022, 1, 5))
        .endDate(LocalDate.of(2022, 1, 8))
        .paymentDate(LocalDate.of(2022, 1, 8))
        .notional(-1_000_000.0d)
        .dayCount(DayCounts.ACT_365F)
        .frequency(Frequency.P3M)
        .build();
    FloatingPeriodConfig simple = FloatingPeriodConfig.builder()
        .fixingCalendar(HolidayCalendars.SAT_SUN)
        .build();
    FloatingPeriodConfig complex = simple.toBuilder().spreadCompoundMethod(SpreadCompoundMethod.ISDA_COMPOUNDING).build();
    DiscountFactorCurve curve = PeriodCurvesDataSet.businessDayCurve();
    ExposureTable tableSimple = BUILDER.table(period, simple, curve, false);
    ExposureTable tableComplex = BUILDER.table(period, complex, curve, false);
    assertEquals(tableSimple.size(), 3);
    assertEquals(tableSimple.getRows().get(2).getAccrualFactor().getAsDouble(), 3.0d / 365.0d, 1.0E-15);
    double[] expected = {
        1.0E+6 * (1.0d + 0.04d / 365.0d) * (1.0d + 0.045d / 365.0d),
        1.0E+6 * (1.0d + 0.03d / 365.0d) * (1.0d + 0.045d / 365.0d),
        1.0E+6 / 3.0d * (1.0d + 0.03d / 365.0d) * (1.0d + 0.04d / 365.0d)};
    for (int i = 0; i < 3; i++) {
      assertEquals(tableSimple.notionals().get(i), expected[i], 1.0E-3);
      assertEquals(tableComplex.notionals().get(i), tableSimple.notionals().get(i), 1.0E-6);
    }
  }

  public void lockout_rows_repeat_locked_rate() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixingMethod(FixingMethod.RFR_LOCKOUT)
        .methodParam(2)
        .fixingCalendar(HolidayCalendars.SAT_SUN)
        .build();
    ExposureTable table = BUILDER.table(PERIOD_WEEK, config, PeriodCurvesDataSet.businessDayCurve(), false);
    assertEquals(table.rates().get(1), 4.0d, 1.0E-10);
    assertEquals(table.rates().get(2), table.rates().get(1));
    assertEquals(table.rates().get(3), table.rates().get(1));
    assertNotEquals(table.rates().get(0), table.rates().get(1));
  }

  public void aggregate_row() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixingCalendar(HolidayCalendars.SAT_SUN)
        .floatSpread(10.0d)
        .build();
    DiscountFactorCurve curve = PeriodCurvesDataSet.businessDayCurve();
    ExposureTable table = BUILDER.table(PERIOD_WEEK, config, curve, true);
    ExposureRow aggregate = table.getAggregate().get();
    double rate = FloatingRatePeriod.of(PERIOD_WEEK, config).rate(curve);
    assertEquals(aggregate.getDate(), PERIOD_WEEK.getPaymentDate());
    assertEquals(aggregate.getRate(), rate, 1.0E-12);
    assertEquals(aggregate.getNotional(), 1_000_000.0d * 6.0d / 365.0d * rate / 100.0d, 1.0E-6);
    assertFalse(aggregate.getAccrualFactor().isPresent());
  }

  public void scalar_fixing_no_exposure() {
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixingCalendar(HolidayCalendars.SAT_SUN)
        .fixings(Fixings.of(2.5d))
        .build();
    ExposureTable table = BUILDER.table(PERIOD_WEEK, config, null, false);
    assertEquals(table.size(), 4);
    for (ExposureRow row : table.getRows()) {
      assertEquals(row.getNotional(), 0.0d);
      assertEquals(row.getRate(), 2.5d);
    }
  }

  public void ibor_table() {
    AccrualPeriod period = AccrualPeriod.of(
        LocalDate.of(2022, 1, 4), LocalDate.of(2022, 4, 4), LocalDate.of(2022, 4, 4), Frequency.P3M);
    FloatingPeriodConfig config = FloatingPeriodConfig.builder()
        .fixingMethod(FixingMethod.IBOR)
        .methodParam(2)
        .build();
    LineCurve curve = PeriodCurvesDataSet.lineCurve();
    ExposureTable table = BUILDER.table(period, config, curve, false);
    assertEquals(table.size(), 1);
    ExposureRow row = table.getRows().get(0);
    assertEquals(row.getDate(), LocalDate.of(2022, 1, 2));
    assertEquals(row.getNotional(), -1_000_000.0d);
    assertEquals(row.getAccrualFactor(), OptionalDouble.empty());
    assertEquals(row.getRate(), 2.0d, 1.0E-12);
  }

  public void unavailable_rate_fails() {
    AccrualPeriod period = AccrualPeriod.of(
        LocalDate.of(2022, 12, 28), LocalDate.of(2023, 1, 2), LocalDate.of(2023, 1, 2), Frequency.P1M);
    FloatingPeriodConfig config = FloatingPeriodConfig.builder().fixings(Fixings.ofList(1.19d, 1.19d)).build();
    LineCurve curve = LineCurve.bounded(PeriodCurvesDataSet.nodes(
        LocalDate.of(2023, 1, 1), 3.0d,
        LocalDate.of(2023, 2, 1), 2.0d));
    MarketDataNotFoundException exception = expectThrows(MarketDataNotFoundException.class,
        () -> BUILDER.table(period, config, curve, false));
    assertTrue(exception.getMessage().contains("RFRs could not be calculated"));
  }

}
