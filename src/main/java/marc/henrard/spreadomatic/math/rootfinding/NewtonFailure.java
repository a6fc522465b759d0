/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

/**
 * Reasons for which the Newton-Raphson iteration stops without a root.
 * <p>
 * Each of them triggers the fallback to Brent's method.
 * 
 * @author Marc Henrard
 */
public enum NewtonFailure {

  /** The absolute value of the derivative is below 1.0E-14. */
  SMALL_DERIVATIVE,
  /** The step is larger than 100 times the absolute value of the current point. */
  STEP_TOO_LARGE,
  /** The function or its derivative could not be evaluated, or returned a non-finite value. */
  EVALUATION_ERROR,
  /** The maximal number of iterations was reached without meeting the step-size test. */
  ITERATIONS_EXHAUSTED,
  /** The step was clamped to a bound and did not move, while the function is not zero there. */
  STALLED_AT_BOUND;

}
