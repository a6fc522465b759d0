/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

import java.util.Objects;
import java.util.Optional;

import com.opengamma.strata.collect.ArgChecker;

/**
 * The result of a one-dimensional solve.
 * <p>
 * A result is returned also when the iteration budget is exhausted. In that case {@link #isConverged()} is false,
 * the root is the best estimate found and the diagnostic explains the situation.
 * 
 * @author Marc Henrard
 */
public final class SolverResult {

  private final double root;
  private final double functionValue;
  private final int iterations;
  private final boolean converged;
  private final String diagnostic;

  private SolverResult(double root, double functionValue, int iterations, boolean converged, String diagnostic) {
    this.root = root;
    this.functionValue = functionValue;
    this.iterations = iterations;
    this.converged = converged;
    this.diagnostic = diagnostic;
  }

  /**
   * Creates a converged result.
   *
   * @param root  the root
   * @param functionValue  the function value at the root
   * @param iterations  the number of iterations used
   * @return the result
   */
  public static SolverResult converged(double root, double functionValue, int iterations) {
    return new SolverResult(root, functionValue, iterations, true, null);
  }

  /**
   * Creates a non-converged result, carrying the best estimate.
   *
   * @param root  the best estimate of the root
   * @param functionValue  the function value at the estimate
   * @param iterations  the number of iterations used
   * @param diagnostic  the description of the problem
   * @return the result
   */
  public static SolverResult notConverged(double root, double functionValue, int iterations, String diagnostic) {
    ArgChecker.notBlank(diagnostic, "diagnostic");
    return new SolverResult(root, functionValue, iterations, false, diagnostic);
  }

  //-------------------------------------------------------------------------
  public double getRoot() {
    return root;
  }

  public double getFunctionValue() {
    return functionValue;
  }

  public int getIterations() {
    return iterations;
  }

  public boolean isConverged() {
    return converged;
  }

  /**
   * Returns the diagnostic of a non-converged result.
   *
   * @return the diagnostic, empty if converged
   */
  public Optional<String> getDiagnostic() {
    return Optional.ofNullable(diagnostic);
  }

  /**
   * Returns a result with the same convergence information and a transformed root.
   * <p>
   * Used when the solved variable is an intermediate of the requested quantity.
   *
   * @param newRoot  the new root
   * @return the result
   */
  public SolverResult withRoot(double newRoot) {
    return new SolverResult(newRoot, functionValue, iterations, converged, diagnostic);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SolverResult)) {
      return false;
    }
    SolverResult other = (SolverResult) obj;
    return Double.compare(root, other.root) == 0 &&
        Double.compare(functionValue, other.functionValue) == 0 &&
        iterations == other.iterations &&
        converged == other.converged &&
        Objects.equals(diagnostic, other.diagnostic);
  }

  @Override
  public int hashCode() {
    return Objects.hash(root, functionValue, iterations, converged, diagnostic);
  }

  @Override
  public String toString() {
    return "SolverResult[root=" + root + ", functionValue=" + functionValue + ", iterations=" + iterations +
        ", converged=" + converged + (diagnostic == null ? "" : ", diagnostic=" + diagnostic) + "]";
  }

}
