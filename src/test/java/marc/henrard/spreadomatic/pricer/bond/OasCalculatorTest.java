/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.basics.DayBasis;
import marc.henrard.spreadomatic.dataset.BondDataSet;
import marc.henrard.spreadomatic.dataset.ZeroCurveDataSet;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;
import marc.henrard.spreadomatic.math.rootfinding.SolverResult;
import marc.henrard.spreadomatic.product.bond.Cashflow;
import marc.henrard.spreadomatic.product.bond.CashflowScheduler;
import marc.henrard.spreadomatic.product.bond.FixedCouponBond;
import marc.henrard.spreadomatic.product.bond.ScheduledPayment;

/**
 * Tests {@link OasCalculator}.
 */
public class OasCalculatorTest {

  private static final OasCalculator CALCULATOR = OasCalculator.DEFAULT;
  private static final CashflowScheduler SCHEDULER = CashflowScheduler.DEFAULT;
  private static final FixedCouponBond CALLABLE = BondDataSet.CALLABLE_7Y_6PC;
  private static final List<ScheduledPayment> SCHEDULE = SCHEDULER.generateSchedule(CALLABLE);
  private static final LocalDate VALUATION_DATE = LocalDate.of(2024, 6, 1);
  private static final ZeroCurve CURVE = ZeroCurveDataSet.flat(0.04d);
  private static final double TOLERANCE_SPREAD = 1.0E-7;

  /* Price built from the stream to the next call with a known spread. */
  @Test
  public void spread_to_next_call() {
    LocalDate callDate = LocalDate.of(2025, 3, 1);
    List<Cashflow> toCall = SCHEDULER.cashflowsToCall(SCHEDULE, VALUATION_DATE, callDate, 101.0d, DayBasis.ACT_ACT);
    double price = DiscountingCashflowPricer.DEFAULT.presentValue(
        DiscountingCashflowPricer.times(toCall),
        DiscountingCashflowPricer.amounts(toCall),
        CURVE,
        0.0125d,
        Compounding.SEMIANNUAL);
    Optional<SolverResult> oas = CALCULATOR.computeOas(
        SCHEDULE, CALLABLE.getCallSchedule(), VALUATION_DATE, CURVE, DayBasis.ACT_ACT, price, Compounding.SEMIANNUAL);
    assertThat(oas).isPresent();
    assertThat(oas.get().getRoot()).isCloseTo(0.0125d, offset(TOLERANCE_SPREAD));
    Optional<SolverResult> explicit = CALCULATOR.computeOas(
        SCHEDULE, VALUATION_DATE, CURVE, DayBasis.ACT_ACT, price, callDate, 101.0d, Compounding.SEMIANNUAL);
    assertThat(explicit.get().getRoot()).isCloseTo(oas.get().getRoot(), offset(1.0E-12));
  }

  @Test
  public void no_call_after_valuation() {
    LocalDate valuationDate = LocalDate.of(2028, 6, 1);
    assertThat(CALCULATOR.computeOas(
        SCHEDULE, CALLABLE.getCallSchedule(), valuationDate, CURVE, DayBasis.ACT_ACT, 100.0d, Compounding.ANNUAL))
        .isEmpty();
  }

  @Test
  public void call_not_after_valuation() {
    assertThat(CALCULATOR.computeOas(
        SCHEDULE, VALUATION_DATE, CURVE, DayBasis.ACT_ACT, 100.0d, null, 100.0d, Compounding.ANNUAL)).isEmpty();
    assertThat(CALCULATOR.computeOas(
        SCHEDULE, VALUATION_DATE, CURVE, DayBasis.ACT_ACT, 100.0d, VALUATION_DATE, 100.0d, Compounding.ANNUAL))
        .isEmpty();
  }

}
