/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

import com.opengamma.strata.math.MathException;

/**
 * Exception thrown when both the Newton-Raphson iteration and its Brent fallback fail.
 * 
 * @author Marc Henrard
 */
public class RootFindingException extends MathException {

  private static final long serialVersionUID = 1L;

  /** The reason of the Newton-Raphson failure. */
  private final NewtonFailure newtonFailure;

  /**
   * Creates an instance.
   *
   * @param newtonFailure  the reason of the Newton-Raphson failure
   * @param brentFailure  the exception of the Brent fallback
   */
  public RootFindingException(NewtonFailure newtonFailure, BracketingException brentFailure) {
    super("Both Newton-Raphson (" + newtonFailure + ") and Brent's method failed: " + brentFailure.getMessage(),
        brentFailure);
    this.newtonFailure = newtonFailure;
  }

  /**
   * Returns the reason of the Newton-Raphson failure.
   *
   * @return the reason
   */
  public NewtonFailure getNewtonFailure() {
    return newtonFailure;
  }

}
