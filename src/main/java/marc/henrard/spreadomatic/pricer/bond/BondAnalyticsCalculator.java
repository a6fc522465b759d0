/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import static com.opengamma.strata.collect.Guavate.toImmutableList;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.collect.result.FailureReason;
import com.opengamma.strata.collect.result.Result;
import com.opengamma.strata.math.MathException;

import marc.henrard.spreadomatic.basics.AnalyticsSettings;
import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;
import marc.henrard.spreadomatic.math.rootfinding.SolverResult;
import marc.henrard.spreadomatic.product.bond.CallScheduleEntry;
import marc.henrard.spreadomatic.product.bond.Cashflow;
import marc.henrard.spreadomatic.product.bond.CashflowScheduler;
import marc.henrard.spreadomatic.product.bond.FixedCouponBond;
import marc.henrard.spreadomatic.product.bond.ScheduledPayment;

/**
 * Computes the analytics of a bond from its dirty price, its future cash flows and a zero curve.
 * <p>
 * Each measure is computed independently: a failure is reported in the measure result and the other measures
 * are still computed. The curve based sensitivities are computed on the curve shifted by the Z-spread, or on the
 * curve itself when the Z-spread cannot be solved.
 * <p>
 * The yield to worst and the option adjusted spread recompute the times of their truncated streams with the time
 * basis of the scheduler, the basis of the cash flows of the bonds, so that all the measures share one time grid.
 * The modified duration uses the compounding frequency of the yield.
 * 
 * @author Marc Henrard
 */
public class BondAnalyticsCalculator {

  private static final Logger LOGGER = LoggerFactory.getLogger(BondAnalyticsCalculator.class);

  /** The default instance. */
  public static final BondAnalyticsCalculator DEFAULT =
      new BondAnalyticsCalculator(AnalyticsSettings.DEFAULT, CashflowScheduler.DEFAULT);

  private final AnalyticsSettings settings;
  private final CashflowScheduler scheduler;

  /**
   * Creates an instance.
   *
   * @param settings  the settings used for the requests built from a bond
   * @param scheduler  the scheduler used for the requests built from a bond
   */
  public BondAnalyticsCalculator(AnalyticsSettings settings, CashflowScheduler scheduler) {
    this.settings = ArgChecker.notNull(settings, "settings");
    this.scheduler = ArgChecker.notNull(scheduler, "scheduler");
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the analytics of a bond, generating its cash flows.
   *
   * @param bond  the bond
   * @param valuationDate  the valuation date
   * @param dirtyPrice  the dirty price
   * @param curve  the zero curve
   * @return the analytics
   */
  public BondAnalytics calculate(FixedCouponBond bond, LocalDate valuationDate, double dirtyPrice, ZeroCurve curve) {
    List<Cashflow> cashflows = scheduler.futureCashflows(bond, valuationDate);
    BondAnalyticsRequest request = BondAnalyticsRequest.of(
        valuationDate,
        dirtyPrice,
        cashflows,
        curve,
        bond.getSchedule().getFrequency(),
        bond.getSchedule().getDayBasis(),
        bond.getCallSchedule(),
        settings);
    return calculate(request);
  }

  /**
   * Computes the analytics.
   *
   * @param request  the inputs
   * @return the analytics
   */
  public BondAnalytics calculate(BondAnalyticsRequest request) {
    ArgChecker.notNull(request, "request");
    AnalyticsSettings requestSettings = request.getSettings();
    Compounding compounding = requestSettings.getCompounding();
    YieldSolver solver = new YieldSolver(requestSettings.getNumericalConfig());
    SensitivityCalculator sensitivities = new SensitivityCalculator(requestSettings);
    double price = request.getDirtyPrice();
    ZeroCurve curve = request.getCurve();
    DoubleArray times = DiscountingCashflowPricer.times(request.getCashflows());
    DoubleArray amounts = DiscountingCashflowPricer.amounts(request.getCashflows());
    BondAnalytics.Builder builder = BondAnalytics.builder();

    Result<Double> ytm = solve("yield to maturity", builder,
        () -> solver.solveYtm(price, times, amounts, compounding, YieldSolver.DEFAULT_YIELD_GUESS));
    Result<Double> zSpread = solve("Z-spread", builder,
        () -> solver.solveZSpread(price, times, amounts, curve, compounding));
    double spread = 0.0d;
    if (zSpread.isSuccess()) {
      spread = zSpread.getValue();
    } else {
      LOGGER.warn("Z-spread not available, curve sensitivities computed without spread");
    }
    double modelSpread = spread;
    double maturityTime = times.get(times.size() - 1);
    builder.ytm(ytm).zSpread(zSpread);
    builder.gSpread(ytm.isSuccess() ?
        measure("G-spread", () -> solver.gSpread(
            ytm.getValue(), maturityTime, curve, compounding, compounding, requestSettings.getGSpreadBasis())) :
        Result.failure(ytm));

    Result<Double> effectiveDuration = measure("effective duration",
        () -> sensitivities.effectiveDuration(times, amounts, curve, modelSpread, compounding));
    builder.effectiveDuration(effectiveDuration);
    builder.modifiedDuration(ytm.isSuccess() ?
        measure("modified duration", () -> sensitivities.modifiedDuration(
            times, amounts, ytm.getValue(), compounding, compounding.getPeriodsPerYear())) :
        Result.failure(ytm));
    builder.convexity(measure("convexity",
        () -> sensitivities.convexity(times, amounts, curve, modelSpread, compounding)));
    builder.spreadDuration(measure("spread duration",
        () -> sensitivities.spreadDuration(times, amounts, curve, modelSpread, compounding)));
    builder.dv01(effectiveDuration.isSuccess() ?
        measure("DV01", () -> sensitivities.dv01(
            effectiveDuration.getValue(),
            DiscountingCashflowPricer.DEFAULT.presentValue(times, amounts, curve, modelSpread, compounding))) :
        Result.failure(effectiveDuration));
    Result<ImmutableMap<Tenor, Double>> keyRateDurations = measure("key rate durations",
        () -> sensitivities.keyRateDurations(
            times, amounts, curve, modelSpread, compounding, requestSettings.getKeyRateTenors()));
    builder.keyRateDurations(keyRateDurations);

    List<ScheduledPayment> payments = request.getCashflows().stream()
        .map(cf -> ScheduledPayment.of(cf.getDate(), cf.total()))
        .collect(toImmutableList());
    builder.oas(oas(request, solver, payments, builder));
    builder.yieldToWorst(measure("yield to worst",
        () -> new YieldToWorstCalculator(solver, scheduler).calculate(
            payments,
            request.getCallSchedule(),
            request.getValuationDate(),
            scheduler.getTimeBasis(),
            price,
            compounding)));
    return builder.build();
  }

  private Result<Double> oas(
      BondAnalyticsRequest request,
      YieldSolver solver,
      List<ScheduledPayment> payments,
      BondAnalytics.Builder builder) {

    Optional<CallScheduleEntry> nextCall = request.getCallSchedule().stream()
        .filter(c -> c.getDate().isAfter(request.getValuationDate()))
        .findFirst();
    if (!nextCall.isPresent()) {
      return Result.failure(FailureReason.MISSING_DATA,
          "No call date after valuation date {}, option adjusted spread not available", request.getValuationDate());
    }
    OasCalculator calculator = new OasCalculator(solver, scheduler);
    return solve("option adjusted spread", builder,
        () -> calculator.computeOas(
            payments,
            request.getValuationDate(),
            request.getCurve(),
            scheduler.getTimeBasis(),
            request.getDirtyPrice(),
            nextCall.get().getDate(),
            nextCall.get().getPrice(),
            request.getSettings().getCompounding())
            .orElseThrow(() -> new IllegalArgumentException("No cash flow before the call date")));
  }

  //-------------------------------------------------------------------------
  /* Solves and records the diagnostic of a non-converged solve; the best estimate is still a success. */
  private static Result<Double> solve(String name, BondAnalytics.Builder builder, Supplier<SolverResult> solve) {
    Result<SolverResult> result = measure(name, solve);
    if (result.isSuccess() && !result.getValue().isConverged()) {
      builder.addDiagnostic(name + ": " + result.getValue().getDiagnostic().orElse("not converged"));
    }
    return result.map(SolverResult::getRoot);
  }

  private static <T> Result<T> measure(String name, Supplier<T> calculation) {
    try {
      return Result.success(calculation.get());
    } catch (MathException | IllegalArgumentException ex) {
      LOGGER.warn("Unable to calculate {}: {}", name, ex.getMessage());
      return Result.failure(FailureReason.CALCULATION_FAILED, ex, "Unable to calculate {}: {}", name, ex.getMessage());
    }
  }

  /**
   * Returns the names of the measures which failed.
   *
   * @param analytics  the analytics
   * @return the failed measures
   */
  public static ImmutableList<String> failedMeasures(BondAnalytics analytics) {
    ImmutableMap<String, Result<?>> results = ImmutableMap.<String, Result<?>>builder()
        .put("ytm", analytics.getYtm())
        .put("zSpread", analytics.getZSpread())
        .put("gSpread", analytics.getGSpread())
        .put("effectiveDuration", analytics.getEffectiveDuration())
        .put("modifiedDuration", analytics.getModifiedDuration())
        .put("convexity", analytics.getConvexity())
        .put("spreadDuration", analytics.getSpreadDuration())
        .put("dv01", analytics.getDv01())
        .put("keyRateDurations", analytics.getKeyRateDurations())
        .put("oas", analytics.getOas())
        .put("yieldToWorst", analytics.getYieldToWorst())
        .build();
    return results.entrySet().stream()
        .filter(e -> e.getValue().isFailure())
        .map(e -> e.getKey())
        .collect(toImmutableList());
  }

}
