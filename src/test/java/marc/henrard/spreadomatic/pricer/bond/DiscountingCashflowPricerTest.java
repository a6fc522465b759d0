/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.basics.DegenerateInputException;
import marc.henrard.spreadomatic.dataset.ZeroCurveDataSet;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;
import marc.henrard.spreadomatic.product.bond.Cashflow;

/**
 * Tests {@link DiscountingCashflowPricer}.
 */
public class DiscountingCashflowPricerTest {

  private static final DiscountingCashflowPricer PRICER = DiscountingCashflowPricer.DEFAULT;
  private static final DoubleArray TIMES = DoubleArray.of(1.0d, 2.0d);
  private static final DoubleArray AMOUNTS = DoubleArray.of(5.0d, 105.0d);
  private static final double TOLERANCE_PV = 1.0E-10;

  @Test
  public void times_amounts() {
    List<Cashflow> cashflows = ImmutableList.of(
        Cashflow.of(LocalDate.of(2025, 1, 15), 0.5d, 2.5d, 0.0d),
        Cashflow.of(LocalDate.of(2025, 7, 15), 1.0d, 2.5d, 100.0d));
    assertThat(DiscountingCashflowPricer.times(cashflows)).isEqualTo(DoubleArray.of(0.5d, 1.0d));
    assertThat(DiscountingCashflowPricer.amounts(cashflows)).isEqualTo(DoubleArray.of(2.5d, 102.5d));
  }

  @Test
  public void present_value_yield() {
    assertThat(PRICER.presentValue(TIMES, AMOUNTS, 0.05d, Compounding.ANNUAL)).isCloseTo(100.0d, offset(TOLERANCE_PV));
    double pvContinuous = 5.0d * Math.exp(-0.05d) + 105.0d * Math.exp(-0.10d);
    assertThat(PRICER.presentValue(TIMES, AMOUNTS, 0.05d, Compounding.CONTINUOUS))
        .isCloseTo(pvContinuous, offset(TOLERANCE_PV));
  }

  /* A flat curve with a spread prices as the flat yield of curve rate plus spread. */
  @Test
  public void present_value_curve_spread() {
    ZeroCurve curve = ZeroCurveDataSet.flat(0.04d);
    assertThat(PRICER.presentValue(TIMES, AMOUNTS, curve, 0.01d, Compounding.ANNUAL))
        .isCloseTo(100.0d, offset(TOLERANCE_PV));
    assertThat(PRICER.presentValue(TIMES, AMOUNTS, curve, 0.0d, Compounding.SEMIANNUAL))
        .isCloseTo(PRICER.presentValue(TIMES, AMOUNTS, 0.04d, Compounding.SEMIANNUAL), offset(TOLERANCE_PV));
  }

  @Test
  public void yield_derivative() {
    double shift = 1.0E-6;
    for (Compounding compounding : Compounding.values()) {
      double fd = (PRICER.presentValue(TIMES, AMOUNTS, 0.05d + shift, compounding) -
          PRICER.presentValue(TIMES, AMOUNTS, 0.05d - shift, compounding)) / (2.0d * shift);
      assertThat(PRICER.presentValueYieldDerivative(TIMES, AMOUNTS, 0.05d, compounding))
          .isCloseTo(fd, offset(1.0E-6));
    }
  }

  @Test
  public void size_mismatch() {
    assertThatThrownBy(() -> PRICER.presentValue(TIMES, DoubleArray.of(5.0d), 0.05d, Compounding.ANNUAL))
        .isInstanceOf(DegenerateInputException.class);
  }

}
