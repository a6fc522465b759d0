/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.integration;

import java.util.Objects;

/**
 * The value of a definite integral with an estimate of its error.
 * <p>
 * An infinite error estimate signals that the value comes from the fixed resolution fallback.
 * 
 * @author Marc Henrard
 */
public final class IntegrationResult {

  private final double value;
  private final double errorEstimate;

  private IntegrationResult(double value, double errorEstimate) {
    this.value = value;
    this.errorEstimate = errorEstimate;
  }

  /**
   * Creates a result.
   *
   * @param value  the integral value
   * @param errorEstimate  the error estimate, non-negative, possibly infinite
   * @return the result
   */
  public static IntegrationResult of(double value, double errorEstimate) {
    return new IntegrationResult(value, errorEstimate);
  }

  public double getValue() {
    return value;
  }

  public double getErrorEstimate() {
    return errorEstimate;
  }

  /**
   * Returns true if the value comes from the fallback rule.
   *
   * @return the flag
   */
  public boolean isFallback() {
    return Double.isInfinite(errorEstimate);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof IntegrationResult)) {
      return false;
    }
    IntegrationResult other = (IntegrationResult) obj;
    return Double.compare(value, other.value) == 0 && Double.compare(errorEstimate, other.errorEstimate) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, errorEstimate);
  }

  @Override
  public String toString() {
    return "IntegrationResult[value=" + value + ", errorEstimate=" + errorEstimate + "]";
  }

}
