/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.basics.DegenerateInputException;
import marc.henrard.spreadomatic.basics.GSpreadBasis;
import marc.henrard.spreadomatic.basics.NumericalConfig;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;
import marc.henrard.spreadomatic.math.rootfinding.BrentRootFinder;
import marc.henrard.spreadomatic.math.rootfinding.RobustNewtonRaphsonRootFinder;
import marc.henrard.spreadomatic.math.rootfinding.RootFindingException;
import marc.henrard.spreadomatic.math.rootfinding.SolverResult;
import marc.henrard.spreadomatic.product.bond.FloatingPeriod;

/**
 * Solves the yield to maturity and the spreads of a bond from its dirty price.
 * <p>
 * The yield to maturity is solved by Newton-Raphson with the analytic derivative, on [0, 1], with Brent's method
 * on [0.001, 0.5] as fallback. The Z-spread is solved by Brent's method on [-0.1, 0.2]. The bounds of Brent's method
 * are expanded when they do not bracket the root. The discount margin of a floating rate note is linear in the
 * margin and computed in closed form.
 * 
 * @author Marc Henrard
 */
public class YieldSolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(YieldSolver.class);

  /** The default instance. */
  public static final YieldSolver DEFAULT = new YieldSolver(NumericalConfig.DEFAULT);

  /** Default initial guess of the yield. */
  public static final double DEFAULT_YIELD_GUESS = 0.05d;
  /** Default initial guess of the spread. */
  public static final double DEFAULT_SPREAD_GUESS = 0.01d;
  /** Default compounding of the yield. */
  public static final Compounding DEFAULT_COMPOUNDING = Compounding.SEMIANNUAL;

  private static final double YIELD_NEWTON_LOWER = 0.0d;
  private static final double YIELD_NEWTON_UPPER = 1.0d;
  private static final double YIELD_BRENT_LOWER = 0.001d;
  private static final double YIELD_BRENT_UPPER = 0.5d;
  private static final double SPREAD_LOWER = -0.1d;
  private static final double SPREAD_UPPER = 0.2d;
  /** Present value weight of the floating coupons below which the discount margin is not defined. */
  private static final double MIN_MARGIN_WEIGHT = 1.0E-14;

  private final DiscountingCashflowPricer pricer;
  private final RobustNewtonRaphsonRootFinder newton;
  private final BrentRootFinder brent;

  /**
   * Creates an instance.
   *
   * @param config  the numerical parameters
   */
  public YieldSolver(NumericalConfig config) {
    this.pricer = DiscountingCashflowPricer.DEFAULT;
    this.newton = new RobustNewtonRaphsonRootFinder(config);
    this.brent = new BrentRootFinder(config);
  }

  //-------------------------------------------------------------------------
  /**
   * Solves the yield to maturity, semi-annually compounded, from an initial guess of 5%.
   *
   * @param price  the dirty price
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @return the result, the root is the yield
   */
  public SolverResult solveYtm(double price, DoubleArray times, DoubleArray amounts) {
    return solveYtm(price, times, amounts, DEFAULT_COMPOUNDING, DEFAULT_YIELD_GUESS);
  }

  /**
   * Solves the yield to maturity.
   * <p>
   * The yield is the flat rate for which the discounted cash flows are equal to the price.
   *
   * @param price  the dirty price
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param compounding  the compounding of the yield
   * @param initialGuess  the initial guess
   * @return the result, the root is the yield
   * @throws com.opengamma.strata.math.MathException if no yield can be found
   */
  public SolverResult solveYtm(
      double price,
      DoubleArray times,
      DoubleArray amounts,
      Compounding compounding,
      double initialGuess) {

    ArgChecker.notNull(compounding, "compounding");
    DoubleUnaryOperator g = y -> pricer.presentValue(times, amounts, y, compounding) - price;
    DoubleUnaryOperator dg = y -> pricer.presentValueYieldDerivative(times, amounts, y, compounding);
    try {
      return newton.solve(g, dg, initialGuess, YIELD_NEWTON_LOWER, YIELD_NEWTON_UPPER);
    } catch (RootFindingException ex) {
      LOGGER.debug("Yield solve failed with Newton-Raphson ({}), retrying with Brent's method on [{}, {}]",
          ex.getNewtonFailure(), YIELD_BRENT_LOWER, YIELD_BRENT_UPPER);
      return brent.solve(g, initialGuess, YIELD_BRENT_LOWER, YIELD_BRENT_UPPER);
    }
  }

  /**
   * Solves the Z-spread: the spread added to all curve rates for which the discounted cash flows are equal
   * to the price.
   *
   * @param price  the dirty price
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param curve  the zero curve
   * @param compounding  the compounding of the curve rates and spread
   * @param initialGuess  the initial guess
   * @return the result, the root is the spread
   * @throws com.opengamma.strata.math.MathException if no spread can be found
   */
  public SolverResult solveZSpread(
      double price,
      DoubleArray times,
      DoubleArray amounts,
      ZeroCurve curve,
      Compounding compounding,
      double initialGuess) {

    ArgChecker.notNull(curve, "curve");
    ArgChecker.notNull(compounding, "compounding");
    DoubleUnaryOperator h = s -> pricer.presentValue(times, amounts, curve, s, compounding) - price;
    return brent.solve(h, initialGuess, SPREAD_LOWER, SPREAD_UPPER);
  }

  /**
   * Solves the Z-spread from an initial guess of 1%.
   *
   * @param price  the dirty price
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param curve  the zero curve
   * @param compounding  the compounding of the curve rates and spread
   * @return the result, the root is the spread
   */
  public SolverResult solveZSpread(
      double price,
      DoubleArray times,
      DoubleArray amounts,
      ZeroCurve curve,
      Compounding compounding) {

    return solveZSpread(price, times, amounts, curve, compounding, DEFAULT_SPREAD_GUESS);
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the G-spread: the yield to maturity minus a government rate at the bond maturity.
   * <p>
   * With the {@link GSpreadBasis#ZERO} basis, the government rate is the zero rate interpolated at maturity.
   * With the {@link GSpreadBasis#PAR} basis, it is the par yield of a bond maturing at that time and paying
   * coupons at the yield frequency (annually for a continuously compounded yield).
   * Both rates are converted to continuous compounding, then expressed in the yield compounding, before the
   * difference is taken.
   *
   * @param ytm  the yield to maturity
   * @param maturityTime  the time to maturity in years
   * @param curve  the government zero curve
   * @param ytmCompounding  the compounding of the yield
   * @param curveCompounding  the compounding of the curve rates
   * @param basis  the government rate basis
   * @return the spread, in the yield compounding
   */
  public double gSpread(
      double ytm,
      double maturityTime,
      ZeroCurve curve,
      Compounding ytmCompounding,
      Compounding curveCompounding,
      GSpreadBasis basis) {

    ArgChecker.notNegativeOrZero(maturityTime, "maturityTime");
    ArgChecker.notNull(basis, "basis");
    double governmentContinuous;
    switch (basis) {
      case ZERO:
        governmentContinuous = curveCompounding.toContinuous(curve.rateAt(maturityTime));
        break;
      case PAR:
        int frequency = ytmCompounding.isContinuous() ? 1 : ytmCompounding.getPeriodsPerYear();
        double parYield = parYield(maturityTime, curve, curveCompounding, frequency);
        governmentContinuous = Compounding.ofPeriodsPerYear(frequency).toContinuous(parYield);
        break;
      default:
        throw new IllegalArgumentException("Unsupported G-spread basis: " + basis);
    }
    double ytmContinuous = ytmCompounding.toContinuous(ytm);
    return ytmCompounding.fromContinuous(ytmContinuous) - ytmCompounding.fromContinuous(governmentContinuous);
  }

  /**
   * Computes the par yield of a bond maturing at the given time.
   * <p>
   * The coupons are paid at times {@code T - k/f} strictly after 0. The first coupon accrues from 0, so a short
   * front stub is weighted by its accrual {@code a_k = min(t_k, 1/f)}. The par yield is
   * {@code (1 - DF(T)) / sum a_k DF(t_k)}.
   *
   * @param maturityTime  the time to maturity
   * @param curve  the zero curve
   * @param curveCompounding  the compounding of the curve rates
   * @param frequency  the number of coupons per year
   * @return the par yield
   */
  public double parYield(double maturityTime, ZeroCurve curve, Compounding curveCompounding, int frequency) {
    ArgChecker.notNegativeOrZero(frequency, "frequency");
    double annuity = 0.0d;
    for (int k = 0; maturityTime - (double) k / frequency > 0.0d; k++) {
      double t = maturityTime - (double) k / frequency;
      double accrual = Math.min(t, 1.0d / frequency);
      annuity += accrual * curveCompounding.discountFactor(curve.rateAt(t), t);
    }
    double dfMaturity = curveCompounding.discountFactor(curve.rateAt(maturityTime), maturityTime);
    return (1.0d - dfMaturity) / annuity;
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the discount margin of a floating rate note.
   * <p>
   * The floating coupons are {@code (F + quotedSpread + dm) * accrual * notional}, where F is the forward rate of
   * the projection curve over the period. The coupons and the fixed amounts (usually the redemption) are
   * discounted on the discount curve. The present value is linear in the margin, so
   * {@code dm = (price - PV(0)) / sum DF(t_i) accrual_i notional_i}.
   *
   * @param price  the dirty price
   * @param fixedTimes  the times of the fixed amounts
   * @param fixedAmounts  the fixed amounts, including the redemption
   * @param floatingPeriods  the floating coupon periods
   * @param quotedSpread  the contractual spread over the forward rate
   * @param projectionCurve  the curve of the forward rates
   * @param discountCurve  the discount curve
   * @param compounding  the compounding of the curve rates
   * @return the discount margin
   * @throws DegenerateInputException if the floating coupons have no present value weight
   */
  public double discountMargin(
      double price,
      DoubleArray fixedTimes,
      DoubleArray fixedAmounts,
      List<FloatingPeriod> floatingPeriods,
      double quotedSpread,
      ZeroCurve projectionCurve,
      ZeroCurve discountCurve,
      Compounding compounding) {

    ArgChecker.noNulls(floatingPeriods, "floatingPeriods");
    ArgChecker.notNull(projectionCurve, "projectionCurve");
    ArgChecker.notNull(discountCurve, "discountCurve");
    ArgChecker.notNull(compounding, "compounding");
    double pvBase = fixedTimes.isEmpty() ?
        0.0d :
        pricer.presentValue(fixedTimes, fixedAmounts, discountCurve, 0.0d, compounding);
    double pvWeight = 0.0d;
    for (FloatingPeriod period : floatingPeriods) {
      double t = period.getEndTime();
      double df = compounding.discountFactor(discountCurve.rateAt(t), t);
      double forward = projectionCurve.forwardRate(period.getStartTime(), t, compounding);
      double weight = period.getAccrualFactor() * period.getNotional() * df;
      pvBase += (forward + quotedSpread) * weight;
      pvWeight += weight;
    }
    if (Math.abs(pvWeight) < MIN_MARGIN_WEIGHT) {
      throw new DegenerateInputException("Discount margin not defined: floating coupons with zero weight {}", pvWeight);
    }
    return (price - pvBase) / pvWeight;
  }

}
