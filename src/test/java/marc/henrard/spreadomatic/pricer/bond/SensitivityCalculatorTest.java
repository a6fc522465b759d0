/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.spreadomatic.basics.AnalyticsSettings;
import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.dataset.ZeroCurveDataSet;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;

/**
 * Tests {@link SensitivityCalculator}.
 * 
 * @author Marc Henrard
 */
public class SensitivityCalculatorTest {

  private static final SensitivityCalculator CALCULATOR = SensitivityCalculator.DEFAULT;
  private static final DoubleArray ZERO_TIMES = DoubleArray.of(5.0d);
  private static final DoubleArray ZERO_AMOUNTS = DoubleArray.of(100.0d);
  private static final ZeroCurve FLAT_3 = ZeroCurveDataSet.flat(0.03d);
  /* Nodes at the key rate tenors. */
  private static final ZeroCurve CURVE = ZeroCurve.of(
      DoubleArray.of(1.0d, 2.0d, 5.0d, 10.0d), DoubleArray.of(0.02d, 0.025d, 0.03d, 0.035d));
  private static final ImmutableList<Tenor> TENORS =
      ImmutableList.of(Tenor.TENOR_1Y, Tenor.TENOR_2Y, Tenor.TENOR_5Y, Tenor.TENOR_10Y);
  /* 10-year 4% annual bond. */
  private static final DoubleArray TIMES = DoubleArray.of(10, i -> i + 1.0d);
  private static final DoubleArray AMOUNTS = DoubleArray.of(10, i -> i == 9 ? 104.0d : 4.0d);

  /* For a zero coupon and continuous compounding, the duration is the maturity and the convexity its square. */
  @Test
  public void zero_coupon_continuous() {
    double duration = CALCULATOR.effectiveDuration(ZERO_TIMES, ZERO_AMOUNTS, FLAT_3, 0.0d, Compounding.CONTINUOUS);
    assertThat(duration).isCloseTo(5.0d, offset(1.0E-6));
    double convexity = CALCULATOR.convexity(ZERO_TIMES, ZERO_AMOUNTS, FLAT_3, 0.0d, Compounding.CONTINUOUS);
    assertThat(convexity).isCloseTo(25.0d, offset(1.0E-3));
    double spreadDuration =
        CALCULATOR.spreadDuration(ZERO_TIMES, ZERO_AMOUNTS, FLAT_3, 0.01d, Compounding.CONTINUOUS);
    assertThat(spreadDuration).isCloseTo(5.0d, offset(1.0E-6));
  }

  @Test
  public void coupon_bond() {
    double duration = CALCULATOR.effectiveDuration(TIMES, AMOUNTS, CURVE, 0.005d, Compounding.ANNUAL);
    assertThat(duration).isGreaterThan(7.0d).isLessThan(10.0d);
    double convexity = CALCULATOR.convexity(TIMES, AMOUNTS, CURVE, 0.005d, Compounding.ANNUAL);
    assertThat(convexity).isGreaterThan(0.0d);
    double price = DiscountingCashflowPricer.DEFAULT.presentValue(TIMES, AMOUNTS, CURVE, 0.005d, Compounding.ANNUAL);
    assertThat(CALCULATOR.dv01(duration, price)).isCloseTo(duration * price * 1.0E-4, offset(1.0E-12));
  }

  /* With nodes at the key rate times and linear interpolation, the key rate durations add up to the duration. */
  @Test
  public void key_rate_durations() {
    Map<Tenor, Double> krd = CALCULATOR.keyRateDurations(TIMES, AMOUNTS, CURVE, 0.0d, Compounding.ANNUAL, TENORS);
    assertThat(krd.keySet()).containsExactlyElementsOf(TENORS);
    double sum = krd.values().stream().mapToDouble(Double::doubleValue).sum();
    double duration = CALCULATOR.effectiveDuration(TIMES, AMOUNTS, CURVE, 0.0d, Compounding.ANNUAL);
    assertThat(sum).isCloseTo(duration, offset(1.0E-5));
    assertThat(krd.get(Tenor.TENOR_10Y)).isGreaterThan(krd.get(Tenor.TENOR_1Y));
  }

  /* A key rate beyond the last cash flow has no effect. */
  @Test
  public void key_rate_durations_inserted_nodes() {
    Map<Tenor, Double> krd = CALCULATOR.keyRateDurations(
        ZERO_TIMES, ZERO_AMOUNTS, CURVE, 0.0d, Compounding.CONTINUOUS, AnalyticsSettings.STANDARD_KEY_RATE_TENORS);
    assertThat(krd).hasSize(AnalyticsSettings.STANDARD_KEY_RATE_TENORS.size());
    assertThat(krd.get(Tenor.TENOR_5Y)).isCloseTo(5.0d, offset(1.0E-6));
    assertThat(krd.get(Tenor.TENOR_30Y)).isCloseTo(0.0d, offset(1.0E-10));
  }

  //-------------------------------------------------------------------------
  @Test
  public void macaulay_modified() {
    assertThat(CALCULATOR.macaulayDuration(ZERO_TIMES, ZERO_AMOUNTS, 0.03d, Compounding.ANNUAL))
        .isCloseTo(5.0d, offset(1.0E-12));
    assertThat(CALCULATOR.modifiedDuration(ZERO_TIMES, ZERO_AMOUNTS, 0.03d, Compounding.ANNUAL, 1))
        .isCloseTo(5.0d / 1.03d, offset(1.0E-12));
    assertThat(CALCULATOR.modifiedDuration(ZERO_TIMES, ZERO_AMOUNTS, 0.03d, Compounding.CONTINUOUS, 2))
        .isCloseTo(5.0d, offset(1.0E-12));
    double macaulay = CALCULATOR.macaulayDuration(TIMES, AMOUNTS, 0.04d, Compounding.ANNUAL);
    assertThat(macaulay).isLessThan(10.0d);
    assertThat(CALCULATOR.modifiedDurationFromEffective(macaulay, 0.04d, 1))
        .isCloseTo(macaulay / 1.04d, offset(1.0E-12));
  }

  /* With annual compounding the modified duration is the yield sensitivity of the price. */
  @Test
  public void modified_duration_yield_sensitivity() {
    DiscountingCashflowPricer pricer = DiscountingCashflowPricer.DEFAULT;
    double price = pricer.presentValue(TIMES, AMOUNTS, 0.04d, Compounding.ANNUAL);
    double derivative = pricer.presentValueYieldDerivative(TIMES, AMOUNTS, 0.04d, Compounding.ANNUAL);
    assertThat(CALCULATOR.modifiedDuration(TIMES, AMOUNTS, 0.04d, Compounding.ANNUAL, 1))
        .isCloseTo(-derivative / price, offset(1.0E-10));
  }

  @Test
  public void tenor_time() {
    assertThat(SensitivityCalculator.tenorTime(Tenor.TENOR_1M)).isCloseTo(1.0d / 12.0d, offset(1.0E-15));
    assertThat(SensitivityCalculator.tenorTime(Tenor.TENOR_10Y)).isEqualTo(10.0d);
    assertThat(SensitivityCalculator.tenorTime(Tenor.ofDays(73))).isCloseTo(0.2d, offset(1.0E-15));
  }

}
