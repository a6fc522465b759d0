/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.integration;

import java.util.function.DoubleUnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.math.impl.integration.Integrator1D;
import com.opengamma.strata.math.impl.integration.RungeKuttaIntegrator1D;

import marc.henrard.spreadomatic.basics.NumericalConfig;

/**
 * One dimensional definite integral with an adaptive primary integrator and a trapezoidal fallback.
 * <p>
 * The primary integrator is {@link RungeKuttaIntegrator1D} with absolute and relative tolerance equal to the
 * configured tolerance. If it fails, or returns a non-finite value, the integral is computed with the composite
 * trapezoidal rule on a fixed number of intervals and the error estimate is infinite.
 * 
 * @author Marc Henrard
 */
public final class AdaptiveIntegrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AdaptiveIntegrator.class);

  /** The default instance. */
  public static final AdaptiveIntegrator DEFAULT = new AdaptiveIntegrator(NumericalConfig.DEFAULT);

  /** Minimal number of steps of the primary integrator. */
  private static final int NB_INTEGRATION_STEPS_MIN = 10;
  /** Number of intervals of the fallback trapezoidal rule. */
  private static final int NB_TRAPEZOID_INTERVALS = 1000;

  private final NumericalConfig config;
  private final Integrator1D<Double, Double> integrator1D;

  /**
   * Creates an instance.
   *
   * @param config  the numerical parameters
   */
  public AdaptiveIntegrator(NumericalConfig config) {
    this(config, new RungeKuttaIntegrator1D(config.getTolerance(), config.getTolerance(), NB_INTEGRATION_STEPS_MIN));
  }

  /**
   * Creates an instance with a specific primary integrator.
   *
   * @param config  the numerical parameters
   * @param integrator1D  the primary integrator
   */
  public AdaptiveIntegrator(NumericalConfig config, Integrator1D<Double, Double> integrator1D) {
    this.config = ArgChecker.notNull(config, "config");
    this.integrator1D = ArgChecker.notNull(integrator1D, "integrator1D");
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the integral of the function between two bounds.
   * <p>
   * If the lower bound is above the upper bound, the integral is computed on the reversed interval and its sign
   * changed. Equal bounds give 0.
   *
   * @param f  the function
   * @param lower  the lower bound
   * @param upper  the upper bound
   * @return the integral and its error estimate
   */
  public IntegrationResult integrate(DoubleUnaryOperator f, double lower, double upper) {
    ArgChecker.notNull(f, "f");
    ArgChecker.isTrue(Double.isFinite(lower) && Double.isFinite(upper),
        "integration bounds must be finite, were {} and {}", lower, upper);
    if (lower == upper) {
      return IntegrationResult.of(0.0d, 0.0d);
    }
    if (lower > upper) {
      IntegrationResult reversed = integrateOrdered(f, upper, lower);
      return IntegrationResult.of(-reversed.getValue(), reversed.getErrorEstimate());
    }
    return integrateOrdered(f, lower, upper);
  }

  private IntegrationResult integrateOrdered(DoubleUnaryOperator f, double lower, double upper) {
    try {
      Double value = integrator1D.integrate(x -> f.applyAsDouble(x), lower, upper);
      if (value != null && Double.isFinite(value)) {
        double error = Math.max(config.getTolerance(), config.getTolerance() * Math.abs(value));
        return IntegrationResult.of(value, error);
      }
      LOGGER.warn("Adaptive integration on [{}, {}] returned {}, using trapezoidal rule", lower, upper, value);
    } catch (RuntimeException ex) {
      LOGGER.warn("Adaptive integration on [{}, {}] failed ({}), using trapezoidal rule",
          lower, upper, ex.getMessage());
    }
    return IntegrationResult.of(trapezoid(f, lower, upper), Double.POSITIVE_INFINITY);
  }

  /* Composite trapezoidal rule, exceptions of the function propagate. */
  static double trapezoid(DoubleUnaryOperator f, double lower, double upper) {
    double h = (upper - lower) / NB_TRAPEZOID_INTERVALS;
    double sum = 0.5d * (f.applyAsDouble(lower) + f.applyAsDouble(upper));
    for (int i = 1; i < NB_TRAPEZOID_INTERVALS; i++) {
      sum += f.applyAsDouble(lower + i * h);
    }
    return sum * h;
  }

}
