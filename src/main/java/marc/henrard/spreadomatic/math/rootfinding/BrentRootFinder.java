/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.Messages;
import com.opengamma.strata.collect.tuple.DoublesPair;

import marc.henrard.spreadomatic.basics.NumericalConfig;

/**
 * Brent's method: a combination of bisection, secant and inverse quadratic interpolation.
 * <p>
 * The convergence is guaranteed once the root is bracketed. When no bounds are given, a bracket is searched
 * symmetrically around the initial guess. When the given bounds do not bracket a root, they are expanded
 * on the side of the smaller absolute function value.
 * <p>
 * Reference: Brent, R. P. (1973) Algorithms for Minimization without Derivatives, chapter 4.
 * 
 * @author Marc Henrard
 */
public final class BrentRootFinder implements RootFinder {

  private static final Logger LOGGER = LoggerFactory.getLogger(BrentRootFinder.class);

  /** The default instance. */
  public static final BrentRootFinder DEFAULT = new BrentRootFinder(NumericalConfig.DEFAULT);

  /** The maximal number of expansions of the symmetric bracket search. */
  private static final int MAX_AUTO_BRACKET_EXPANSIONS = 20;
  /** The maximal number of expansions of given bounds. */
  private static final int MAX_BOUNDS_EXPANSIONS = 10;
  /** The machine epsilon. */
  private static final double EPS = Math.ulp(1.0d);

  /** The numerical parameters. */
  private final NumericalConfig config;

  /**
   * Creates an instance.
   *
   * @param config  the numerical parameters
   */
  public BrentRootFinder(NumericalConfig config) {
    this.config = ArgChecker.notNull(config, "config");
  }

  /**
   * Returns the numerical parameters.
   *
   * @return the parameters
   */
  public NumericalConfig getConfig() {
    return config;
  }

  //-------------------------------------------------------------------------
  @Override
  public SolverResult solve(DoubleUnaryOperator function, double initialGuess, Optional<DoublesPair> bounds) {
    ArgChecker.notNull(function, "function");
    ArgChecker.notNull(bounds, "bounds");
    DoublesPair bracket = bounds.isPresent() ?
        expandBracket(function, bounds.get().getFirst(), bounds.get().getSecond()) :
        autoBracket(function, initialGuess);
    return solveBracketed(function, bracket.getFirst(), bracket.getSecond());
  }

  /**
   * Searches a bracket around the initial guess.
   * <p>
   * The bracket is {@code [x0 - h, x0 + h]} with {@code h = initialBracketSize * factor^k}, k = 0 to 20.
   *
   * @param function  the function
   * @param initialGuess  the center of the bracket
   * @return the bracket
   * @throws BracketingException if no sign change is found
   */
  DoublesPair autoBracket(DoubleUnaryOperator function, double initialGuess) {
    double h = config.getInitialBracketSize();
    for (int loopexp = 0; loopexp <= MAX_AUTO_BRACKET_EXPANSIONS; loopexp++) {
      double a = initialGuess - h;
      double b = initialGuess + h;
      if (isSignChange(function.applyAsDouble(a), function.applyAsDouble(b))) {
        return DoublesPair.of(a, b);
      }
      h *= config.getBracketExpansionFactor();
    }
    throw new BracketingException("Could not bracket root around {} after {} expansions",
        initialGuess, MAX_AUTO_BRACKET_EXPANSIONS);
  }

  /**
   * Expands the given bounds until the function changes sign.
   * <p>
   * At each try the end point with the smaller absolute function value is moved away by the bracket width.
   *
   * @param function  the function
   * @param lower  the lower bound
   * @param upper  the upper bound
   * @return the bracket
   * @throws BracketingException if no sign change is found
   */
  DoublesPair expandBracket(DoubleUnaryOperator function, double lower, double upper) {
    ArgChecker.isTrue(lower < upper, "lower bound {} must be below upper bound {}", lower, upper);
    double a = lower;
    double b = upper;
    double fa = function.applyAsDouble(a);
    double fb = function.applyAsDouble(b);
    for (int loopexp = 0; loopexp < MAX_BOUNDS_EXPANSIONS; loopexp++) {
      if (isSignChange(fa, fb)) {
        return DoublesPair.of(a, b);
      }
      double width = b - a;
      if (Math.abs(fa) < Math.abs(fb)) {
        a -= width;
        fa = function.applyAsDouble(a);
      } else {
        b += width;
        fb = function.applyAsDouble(b);
      }
    }
    if (isSignChange(fa, fb)) {
      return DoublesPair.of(a, b);
    }
    throw new BracketingException("Could not expand bracket [{}, {}] to a sign change, last tried [{}, {}]",
        lower, upper, a, b);
  }

  /**
   * Runs Brent's iteration on a bracket.
   *
   * @param function  the function
   * @param lower  one end of the bracket
   * @param upper  the other end of the bracket
   * @return the result
   */
  SolverResult solveBracketed(DoubleUnaryOperator function, double lower, double upper) {
    double tolerance = config.getTolerance();
    double a = lower;
    double b = upper;
    double fa = function.applyAsDouble(a);
    double fb = function.applyAsDouble(b);
    if (!isSignChange(fa, fb)) {
      throw new BracketingException("Bracket [{}, {}] does not contain a sign change: f={}, {}", a, b, fa, fb);
    }
    /* b is the best estimate: |f(b)| <= |f(a)| */
    if (Math.abs(fa) < Math.abs(fb)) {
      double tmp = a;
      a = b;
      b = tmp;
      tmp = fa;
      fa = fb;
      fb = tmp;
    }
    double c = a;
    double fc = fa;
    double d = b - a;
    double e = d;
    for (int loopiter = 0; loopiter < config.getMaxIterations(); loopiter++) {
      if (Math.abs(fb) < tolerance) {
        return SolverResult.converged(b, fb, loopiter);
      }
      if (Math.abs(fc) < Math.abs(fb)) {
        a = b;
        b = c;
        c = a;
        fa = fb;
        fb = fc;
        fc = fa;
      }
      double tol = 2.0d * EPS * Math.abs(b) + 0.5d * tolerance;
      double m = 0.5d * (c - b);
      if (Math.abs(m) <= tol || Math.abs(fb) < tolerance) {
        return SolverResult.converged(b, fb, loopiter);
      }
      if (Math.abs(e) >= tol && Math.abs(fa) > Math.abs(fb)) {
        double s = fb / fa;
        double p;
        double q;
        if (Math.abs(c - a) < EPS) { // secant
          p = 2.0d * m * s;
          q = 1.0d - s;
        } else { // inverse quadratic
          double qa = fa / fc;
          double r = fb / fc;
          p = s * (2.0d * m * qa * (qa - r) - (b - a) * (r - 1.0d));
          q = (qa - 1.0d) * (r - 1.0d) * (s - 1.0d);
        }
        if (p > 0.0d) {
          q = -q;
        } else {
          p = -p;
        }
        double ePrevious = e;
        e = d;
        if (2.0d * p < Math.min(3.0d * m * q - Math.abs(tol * q), Math.abs(ePrevious * q))) {
          d = p / q;
        } else {
          d = m;
          e = d;
        }
      } else {
        d = m;
        e = d;
      }
      a = b;
      fa = fb;
      b += Math.abs(d) > tol ? d : Math.copySign(tol, m);
      fb = function.applyAsDouble(b);
      if ((fb > 0.0d && fc > 0.0d) || (fb < 0.0d && fc < 0.0d)) {
        c = a;
        fc = fa;
        d = b - a;
        e = d;
      }
    }
    String diagnostic = Messages.format(
        "Brent's method did not converge after {} iterations, best estimate {} with function value {}",
        config.getMaxIterations(), b, fb);
    LOGGER.warn(diagnostic);
    return SolverResult.notConverged(b, fb, config.getMaxIterations(), diagnostic);
  }

  /* A zero at an end point counts as a sign change; non-finite values never bracket. */
  private static boolean isSignChange(double fa, double fb) {
    return Double.isFinite(fa) && Double.isFinite(fb) && fa * fb <= 0.0d;
  }

}
