/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.tuple.DoublesPair;

import marc.henrard.spreadomatic.basics.NumericalConfig;

/**
 * Newton-Raphson iteration with safeguards and a fallback to Brent's method.
 * <p>
 * The derivative is the one provided or a central finite difference with step {@code max(|x| 1.0E-8, 1.0E-8)}.
 * The iteration stops on a {@link NewtonFailure}: small derivative, step larger than {@code 100 |x|},
 * evaluation problem, stall at a bound or exhaustion of the iterations. In all those cases the root is searched
 * with {@link BrentRootFinder} from the same initial guess and bounds.
 * <p>
 * When bounds are provided, each Newton iterate is clamped into them. A clamped step that leaves the iterate
 * unchanged while the function is not yet below the tolerance is reported as {@link NewtonFailure#STALLED_AT_BOUND}
 * and also triggers the fallback; without this check the step size test would accept the bound as a root.
 * 
 * @author Marc Henrard
 */
public final class RobustNewtonRaphsonRootFinder implements RootFinder {

  private static final Logger LOGGER = LoggerFactory.getLogger(RobustNewtonRaphsonRootFinder.class);

  /** The default instance. */
  public static final RobustNewtonRaphsonRootFinder DEFAULT =
      new RobustNewtonRaphsonRootFinder(NumericalConfig.DEFAULT);

  /** Derivatives below this level in absolute value stop the iteration. */
  private static final double MIN_DERIVATIVE = 1.0E-14;
  /** Relative step of the finite difference derivative. */
  private static final double FD_RELATIVE_STEP = 1.0E-8;
  /** Steps larger than this multiple of |x| stop the iteration. */
  private static final double MAX_STEP_MULTIPLE = 100.0d;

  /** The numerical parameters. */
  private final NumericalConfig config;
  /** The fallback. */
  private final BrentRootFinder fallback;

  /**
   * Creates an instance.
   *
   * @param config  the numerical parameters, shared with the Brent fallback
   */
  public RobustNewtonRaphsonRootFinder(NumericalConfig config) {
    this.config = ArgChecker.notNull(config, "config");
    this.fallback = new BrentRootFinder(config);
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
    return solve(function, Optional.empty(), initialGuess, bounds);
  }

  /**
   * Finds a root of the function using its derivative.
   *
   * @param function  the function
   * @param derivative  the derivative, a finite difference is used if empty
   * @param initialGuess  the initial guess
   * @param bounds  the optional bounds
   * @return the result
   * @throws RootFindingException if both the Newton iteration and the Brent fallback fail
   */
  public SolverResult solve(
      DoubleUnaryOperator function,
      Optional<DoubleUnaryOperator> derivative,
      double initialGuess,
      Optional<DoublesPair> bounds) {

    ArgChecker.notNull(function, "function");
    ArgChecker.notNull(derivative, "derivative");
    ArgChecker.notNull(bounds, "bounds");
    DoubleUnaryOperator df = derivative.orElseGet(() -> finiteDifference(function));
    NewtonOutcome outcome = iterate(function, df, initialGuess, bounds);
    if (outcome.result != null) {
      return outcome.result;
    }
    LOGGER.debug("Newton-Raphson stopped ({}) from initial guess {}, falling back to Brent's method",
        outcome.failure, initialGuess);
    try {
      return fallback.solve(function, initialGuess, bounds);
    } catch (BracketingException ex) {
      throw new RootFindingException(outcome.failure, ex);
    }
  }

  /**
   * Finds a root of the function using its derivative, with bounds.
   *
   * @param function  the function
   * @param derivative  the derivative
   * @param initialGuess  the initial guess
   * @param lower  the lower bound
   * @param upper  the upper bound
   * @return the result
   * @throws RootFindingException if both the Newton iteration and the Brent fallback fail
   */
  public SolverResult solve(
      DoubleUnaryOperator function,
      DoubleUnaryOperator derivative,
      double initialGuess,
      double lower,
      double upper) {

    return solve(function, Optional.of(derivative), initialGuess, Optional.of(DoublesPair.of(lower, upper)));
  }

  //-------------------------------------------------------------------------
  /* The Newton iteration alone: either a result or the reason it stopped. */
  NewtonOutcome iterate(
      DoubleUnaryOperator function,
      DoubleUnaryOperator derivative,
      double initialGuess,
      Optional<DoublesPair> bounds) {

    double tolerance = config.getTolerance();
    double x = initialGuess;
    for (int loopiter = 0; loopiter < config.getMaxIterations(); loopiter++) {
      double fx = evaluate(function, x);
      if (!Double.isFinite(fx)) {
        return NewtonOutcome.failure(NewtonFailure.EVALUATION_ERROR);
      }
      if (Math.abs(fx) < tolerance) {
        return NewtonOutcome.success(SolverResult.converged(x, fx, loopiter));
      }
      double dfx = evaluate(derivative, x);
      if (!Double.isFinite(dfx)) {
        return NewtonOutcome.failure(NewtonFailure.EVALUATION_ERROR);
      }
      if (Math.abs(dfx) < MIN_DERIVATIVE) {
        return NewtonOutcome.failure(NewtonFailure.SMALL_DERIVATIVE);
      }
      double xNew = x - fx / dfx;
      boolean clamped = false;
      if (bounds.isPresent()) {
        double clampedValue = Math.max(bounds.get().getFirst(), Math.min(bounds.get().getSecond(), xNew));
        clamped = clampedValue != xNew;
        xNew = clampedValue;
      }
      if (!Double.isFinite(xNew)) {
        return NewtonOutcome.failure(NewtonFailure.EVALUATION_ERROR);
      }
      double step = Math.abs(xNew - x);
      if (step > MAX_STEP_MULTIPLE * Math.abs(x)) {
        return NewtonOutcome.failure(NewtonFailure.STEP_TOO_LARGE);
      }
      if (step < tolerance * (1.0d + Math.abs(x))) {
        if (clamped) {
          return NewtonOutcome.failure(NewtonFailure.STALLED_AT_BOUND);
        }
        return NewtonOutcome.success(SolverResult.converged(xNew, evaluate(function, xNew), loopiter + 1));
      }
      x = xNew;
    }
    return NewtonOutcome.failure(NewtonFailure.ITERATIONS_EXHAUSTED);
  }

  /* Arithmetic and domain problems of the function become a NaN, handled as an evaluation failure. */
  private static double evaluate(DoubleUnaryOperator function, double x) {
    try {
      return function.applyAsDouble(x);
    } catch (ArithmeticException | IllegalArgumentException ex) {
      LOGGER.debug("Function evaluation failed at {}: {}", x, ex.getMessage());
      return Double.NaN;
    }
  }

  private static DoubleUnaryOperator finiteDifference(DoubleUnaryOperator function) {
    return x -> {
      double h = Math.max(Math.abs(x) * FD_RELATIVE_STEP, FD_RELATIVE_STEP);
      return (function.applyAsDouble(x + h) - function.applyAsDouble(x - h)) / (2.0d * h);
    };
  }

  //-------------------------------------------------------------------------
  /**
   * The outcome of the Newton iteration: a result or a failure reason.
   */
  static final class NewtonOutcome {

    private final SolverResult result;
    private final NewtonFailure failure;

    private NewtonOutcome(SolverResult result, NewtonFailure failure) {
      this.result = result;
      this.failure = failure;
    }

    static NewtonOutcome success(SolverResult result) {
      return new NewtonOutcome(result, null);
    }

    static NewtonOutcome failure(NewtonFailure failure) {
      return new NewtonOutcome(null, failure);
    }

    Optional<SolverResult> getResult() {
      return Optional.ofNullable(result);
    }

    Optional<NewtonFailure> getFailure() {
      return Optional.ofNullable(failure);
    }
  }

}
