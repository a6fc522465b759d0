/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.math.MathException;

import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.basics.DayBasis;
import marc.henrard.spreadomatic.product.bond.CallScheduleEntry;
import marc.henrard.spreadomatic.product.bond.Cashflow;
import marc.henrard.spreadomatic.product.bond.CashflowScheduler;
import marc.henrard.spreadomatic.product.bond.ScheduledPayment;
import marc.henrard.spreadomatic.pricer.bond.YieldToWorst.RedemptionType;

/**
 * Computes the yield to worst of a callable bond.
 * <p>
 * The yield is solved for the redemption at maturity and for the redemption at each call date after the
 * valuation date and before the last payment. The worst yield is the lowest one.
 * 
 * @author Marc Henrard
 */
public class YieldToWorstCalculator {

  private static final Logger LOGGER = LoggerFactory.getLogger(YieldToWorstCalculator.class);

  /** The default instance. */
  public static final YieldToWorstCalculator DEFAULT =
      new YieldToWorstCalculator(YieldSolver.DEFAULT, CashflowScheduler.DEFAULT);

  private final YieldSolver yieldSolver;
  private final CashflowScheduler scheduler;

  /**
   * Creates an instance.
   *
   * @param yieldSolver  the yield solver
   * @param scheduler  the scheduler producing the truncated cash flows
   */
  public YieldToWorstCalculator(YieldSolver yieldSolver, CashflowScheduler scheduler) {
    this.yieldSolver = ArgChecker.notNull(yieldSolver, "yieldSolver");
    this.scheduler = ArgChecker.notNull(scheduler, "scheduler");
  }

  /**
   * Computes the yield to worst.
   * <p>
   * A call for which the yield cannot be solved is skipped.
   *
   * @param schedule  the contractual payments, ordered by date
   * @param callSchedule  the call schedule, possibly empty
   * @param valuationDate  the valuation date
   * @param dayBasis  the basis of the time to payment
   * @param dirtyPrice  the dirty price
   * @param compounding  the compounding of the yields
   * @return the yield to worst
   * @throws MathException if the yield to maturity cannot be solved
   */
  public YieldToWorst calculate(
      List<ScheduledPayment> schedule,
      List<CallScheduleEntry> callSchedule,
      LocalDate valuationDate,
      DayBasis dayBasis,
      double dirtyPrice,
      Compounding compounding) {

    ArgChecker.notEmpty(schedule, "schedule");
    ArgChecker.notNull(callSchedule, "callSchedule");
    LocalDate maturityDate = schedule.get(schedule.size() - 1).getDate();
    ArgChecker.isTrue(maturityDate.isAfter(valuationDate),
        "valuation date {} must be before the last payment {}", valuationDate, maturityDate);
    List<Cashflow> toMaturity = scheduler.paymentsAfter(schedule, valuationDate, dayBasis);
    double ytm = solve(dirtyPrice, toMaturity, compounding);
    Map<LocalDate, Double> allYields = new LinkedHashMap<>();
    double worst = ytm;
    LocalDate worstDate = maturityDate;
    RedemptionType worstType = RedemptionType.MATURITY;
    for (CallScheduleEntry call : callSchedule) {
      if (!call.getDate().isAfter(valuationDate) || !call.getDate().isBefore(maturityDate)) {
        continue;
      }
      try {
        List<Cashflow> toCall =
            scheduler.cashflowsToCall(schedule, valuationDate, call.getDate(), call.getPrice(), dayBasis);
        double yieldToCall = solve(dirtyPrice, toCall, compounding);
        allYields.put(call.getDate(), yieldToCall);
        if (yieldToCall < worst) {
          worst = yieldToCall;
          worstDate = call.getDate();
          worstType = RedemptionType.CALL;
        }
      } catch (MathException ex) {
        LOGGER.warn("Yield to call {} could not be solved, call skipped: {}", call.getDate(), ex.getMessage());
      }
    }
    allYields.put(maturityDate, ytm);
    return YieldToWorst.of(worst, worstDate, worstType, allYields);
  }

  private double solve(double dirtyPrice, List<Cashflow> cashflows, Compounding compounding) {
    DoubleArray times = DiscountingCashflowPricer.times(cashflows);
    DoubleArray amounts = DiscountingCashflowPricer.amounts(cashflows);
    return yieldSolver.solveYtm(dirtyPrice, times, amounts, compounding, YieldSolver.DEFAULT_YIELD_GUESS).getRoot();
  }

}
