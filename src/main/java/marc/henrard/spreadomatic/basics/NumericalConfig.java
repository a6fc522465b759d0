/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

import java.util.Objects;

import com.opengamma.strata.collect.ArgChecker;

/**
 * Parameters of the numerical solvers.
 * <p>
 * The object is immutable and passed explicitly to each solver; there is no global configuration.
 * 
 * @author Marc Henrard
 */
public final class NumericalConfig {

  /** The default configuration: tolerance 1.0E-8, 100 iterations, expansion factor 2, initial bracket 0.01. */
  public static final NumericalConfig DEFAULT = new NumericalConfig(1.0E-8, 100, 2.0d, 0.01d);

  /** The absolute tolerance on the function value and on the root. */
  private final double tolerance;
  /** The maximal number of iterations of the iterative methods. */
  private final int maxIterations;
  /** The geometric growth factor of the bracket during the bracket search. */
  private final double bracketExpansionFactor;
  /** The half-width of the first bracket around the initial guess. */
  private final double initialBracketSize;

  private NumericalConfig(
      double tolerance,
      int maxIterations,
      double bracketExpansionFactor,
      double initialBracketSize) {

    this.tolerance = ArgChecker.notNegativeOrZero(tolerance, "tolerance");
    this.maxIterations = ArgChecker.notNegativeOrZero(maxIterations, "maxIterations");
    ArgChecker.isTrue(bracketExpansionFactor > 1.0d,
        "bracketExpansionFactor must be greater than 1, was {}", bracketExpansionFactor);
    this.bracketExpansionFactor = bracketExpansionFactor;
    this.initialBracketSize = ArgChecker.notNegativeOrZero(initialBracketSize, "initialBracketSize");
  }

  /**
   * Obtains an instance.
   *
   * @param tolerance  the tolerance
   * @param maxIterations  the maximal number of iterations
   * @param bracketExpansionFactor  the bracket expansion factor, greater than 1
   * @param initialBracketSize  the initial bracket half-width
   * @return the configuration
   */
  public static NumericalConfig of(
      double tolerance,
      int maxIterations,
      double bracketExpansionFactor,
      double initialBracketSize) {

    return new NumericalConfig(tolerance, maxIterations, bracketExpansionFactor, initialBracketSize);
  }

  //-------------------------------------------------------------------------
  public double getTolerance() {
    return tolerance;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public double getBracketExpansionFactor() {
    return bracketExpansionFactor;
  }

  public double getInitialBracketSize() {
    return initialBracketSize;
  }

  /**
   * Returns a copy with a different tolerance.
   *
   * @param tolerance  the new tolerance
   * @return the configuration
   */
  public NumericalConfig withTolerance(double tolerance) {
    return new NumericalConfig(tolerance, maxIterations, bracketExpansionFactor, initialBracketSize);
  }

  /**
   * Returns a copy with a different maximal number of iterations.
   *
   * @param maxIterations  the new maximal number of iterations
   * @return the configuration
   */
  public NumericalConfig withMaxIterations(int maxIterations) {
    return new NumericalConfig(tolerance, maxIterations, bracketExpansionFactor, initialBracketSize);
  }

  /**
   * Returns a copy with different bracket search parameters.
   *
   * @param bracketExpansionFactor  the new expansion factor
   * @param initialBracketSize  the new initial bracket half-width
   * @return the configuration
   */
  public NumericalConfig withBracketing(double bracketExpansionFactor, double initialBracketSize) {
    return new NumericalConfig(tolerance, maxIterations, bracketExpansionFactor, initialBracketSize);
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof NumericalConfig)) {
      return false;
    }
    NumericalConfig other = (NumericalConfig) obj;
    return Double.compare(tolerance, other.tolerance) == 0 &&
        maxIterations == other.maxIterations &&
        Double.compare(bracketExpansionFactor, other.bracketExpansionFactor) == 0 &&
        Double.compare(initialBracketSize, other.initialBracketSize) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(tolerance, maxIterations, bracketExpansionFactor, initialBracketSize);
  }

  @Override
  public String toString() {
    return "NumericalConfig[tolerance=" + tolerance + ", maxIterations=" + maxIterations +
        ", bracketExpansionFactor=" + bracketExpansionFactor + ", initialBracketSize=" + initialBracketSize + "]";
  }

}
