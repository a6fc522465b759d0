/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.basics.DayBasis;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;
import marc.henrard.spreadomatic.math.rootfinding.SolverResult;
import marc.henrard.spreadomatic.product.bond.CallScheduleEntry;
import marc.henrard.spreadomatic.product.bond.Cashflow;
import marc.henrard.spreadomatic.product.bond.CashflowScheduler;
import marc.henrard.spreadomatic.product.bond.ScheduledPayment;

/**
 * Option adjusted spread of a callable bond, assuming the bond is called at the next call date.
 * <p>
 * The payments are truncated at the next call date, where the call price replaces the redemption, and the
 * Z-spread of the truncated stream is solved. This is a deterministic proxy of the option adjusted spread:
 * it is close to the model value only when the bond is almost certainly called at that date.
 * 
 * @author Marc Henrard
 */
public class OasCalculator {

  /** The default instance. */
  public static final OasCalculator DEFAULT = new OasCalculator(YieldSolver.DEFAULT, CashflowScheduler.DEFAULT);

  private final YieldSolver yieldSolver;
  private final CashflowScheduler scheduler;

  /**
   * Creates an instance.
   *
   * @param yieldSolver  the solver of the spread
   * @param scheduler  the scheduler producing the truncated cash flows
   */
  public OasCalculator(YieldSolver yieldSolver, CashflowScheduler scheduler) {
    this.yieldSolver = ArgChecker.notNull(yieldSolver, "yieldSolver");
    this.scheduler = ArgChecker.notNull(scheduler, "scheduler");
  }

  /**
   * Computes the spread to the next call.
   *
   * @param schedule  the contractual payments
   * @param valuationDate  the valuation date
   * @param curve  the zero curve
   * @param dayBasis  the basis of the time to payment
   * @param dirtyPrice  the dirty price
   * @param nextCallDate  the next call date
   * @param nextCallPrice  the next call price
   * @param compounding  the compounding of the curve and spread
   * @return the result, empty if the call date is not after the valuation date
   * @throws com.opengamma.strata.math.MathException if no spread can be found
   */
  public Optional<SolverResult> computeOas(
      List<ScheduledPayment> schedule,
      LocalDate valuationDate,
      ZeroCurve curve,
      DayBasis dayBasis,
      double dirtyPrice,
      LocalDate nextCallDate,
      double nextCallPrice,
      Compounding compounding) {

    ArgChecker.notNull(valuationDate, "valuationDate");
    if (nextCallDate == null || !nextCallDate.isAfter(valuationDate)) {
      return Optional.empty();
    }
    List<Cashflow> toCall = scheduler.cashflowsToCall(schedule, valuationDate, nextCallDate, nextCallPrice, dayBasis);
    if (toCall.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(yieldSolver.solveZSpread(
        dirtyPrice,
        DiscountingCashflowPricer.times(toCall),
        DiscountingCashflowPricer.amounts(toCall),
        curve,
        compounding));
  }

  /**
   * Computes the spread to the first call after the valuation date.
   *
   * @param schedule  the contractual payments
   * @param callSchedule  the call schedule, sorted by date
   * @param valuationDate  the valuation date
   * @param curve  the zero curve
   * @param dayBasis  the basis of the time to payment
   * @param dirtyPrice  the dirty price
   * @param compounding  the compounding of the curve and spread
   * @return the result, empty if there is no call after the valuation date
   */
  public Optional<SolverResult> computeOas(
      List<ScheduledPayment> schedule,
      List<CallScheduleEntry> callSchedule,
      LocalDate valuationDate,
      ZeroCurve curve,
      DayBasis dayBasis,
      double dirtyPrice,
      Compounding compounding) {

    Optional<CallScheduleEntry> nextCall = callSchedule.stream()
        .filter(c -> c.getDate().isAfter(valuationDate))
        .findFirst();
    if (!nextCall.isPresent()) {
      return Optional.empty();
    }
    return computeOas(schedule, valuationDate, curve, dayBasis, dirtyPrice,
        nextCall.get().getDate(), nextCall.get().getPrice(), compounding);
  }

}
