/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

import com.opengamma.strata.collect.tuple.DoublesPair;

/**
 * Finds a root of a continuous real function.
 * <p>
 * Implementations are stateless; the numerical parameters are provided at construction.
 * 
 * @author Marc Henrard
 */
public interface RootFinder {

  /**
   * Finds a root of the function.
   * <p>
   * The bounds, when present, are (lower, upper). Their use depends on the implementation.
   *
   * @param function  the function
   * @param initialGuess  the initial guess
   * @param bounds  the optional bounds
   * @return the result
   * @throws BracketingException if the root cannot be bracketed
   */
  public abstract SolverResult solve(DoubleUnaryOperator function, double initialGuess, Optional<DoublesPair> bounds);

  /**
   * Finds a root of the function without bounds.
   *
   * @param function  the function
   * @param initialGuess  the initial guess
   * @return the result
   * @throws BracketingException if the root cannot be bracketed
   */
  public default SolverResult solve(DoubleUnaryOperator function, double initialGuess) {
    return solve(function, initialGuess, Optional.empty());
  }

  /**
   * Finds a root of the function with bounds.
   *
   * @param function  the function
   * @param initialGuess  the initial guess
   * @param lower  the lower bound
   * @param upper  the upper bound
   * @return the result
   * @throws BracketingException if the root cannot be bracketed
   */
  public default SolverResult solve(DoubleUnaryOperator function, double initialGuess, double lower, double upper) {
    return solve(function, initialGuess, Optional.of(DoublesPair.of(lower, upper)));
  }

}
