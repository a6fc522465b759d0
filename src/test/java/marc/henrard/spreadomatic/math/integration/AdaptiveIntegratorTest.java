/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.offset;

import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

import com.opengamma.strata.math.MathException;
import com.opengamma.strata.math.impl.integration.Integrator1D;

import marc.henrard.spreadomatic.basics.NumericalConfig;

/**
 * Tests {@link AdaptiveIntegrator}.
 */
public class AdaptiveIntegratorTest {

  private static final AdaptiveIntegrator INTEGRATOR = AdaptiveIntegrator.DEFAULT;
  private static final DoubleUnaryOperator GAUSSIAN = x -> Math.exp(-x * x);
  private static final double TOLERANCE_INTEGRAL = 1.0E-6;

  /* Primary integrator which always fails. */
  private static final Integrator1D<Double, Double> FAILING = new Integrator1D<Double, Double>() {
    @Override
    public Double integrate(Function<Double, Double> f, Double lower, Double upper) {
      throw new MathException("primary integrator failure");
    }
  };

  @Test
  public void gaussian() {
    IntegrationResult result = INTEGRATOR.integrate(GAUSSIAN, 0.0d, 5.0d);
    assertThat(result.getValue()).isCloseTo(0.5d * Math.sqrt(Math.PI), offset(TOLERANCE_INTEGRAL));
    assertThat(result.isFallback()).isFalse();
    assertThat(result.getErrorEstimate()).isLessThan(1.0E-7);
  }

  @Test
  public void polynomial() {
    IntegrationResult result = INTEGRATOR.integrate(x -> 3.0d * x * x, 1.0d, 2.0d);
    assertThat(result.getValue()).isCloseTo(7.0d, offset(TOLERANCE_INTEGRAL));
  }

  @Test
  public void reversed_bounds() {
    IntegrationResult result = INTEGRATOR.integrate(x -> x, 1.0d, 0.0d);
    assertThat(result.getValue()).isCloseTo(-0.5d, offset(TOLERANCE_INTEGRAL));
  }

  @Test
  public void equal_bounds() {
    assertThat(INTEGRATOR.integrate(GAUSSIAN, 2.0d, 2.0d)).isEqualTo(IntegrationResult.of(0.0d, 0.0d));
  }

  @Test
  public void infinite_bounds() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> INTEGRATOR.integrate(GAUSSIAN, 0.0d, Double.POSITIVE_INFINITY));
  }

  /* The trapezoidal rule is used with an infinite error estimate. */
  @Test
  public void fallback() {
    AdaptiveIntegrator integrator = new AdaptiveIntegrator(NumericalConfig.DEFAULT, FAILING);
    IntegrationResult result = integrator.integrate(x -> x * x, 0.0d, 1.0d);
    assertThat(result.getValue()).isCloseTo(1.0d / 3.0d, offset(TOLERANCE_INTEGRAL));
    assertThat(result.isFallback()).isTrue();
    assertThat(result.getErrorEstimate()).isEqualTo(Double.POSITIVE_INFINITY);
  }

  @Test
  public void trapezoid_linear_exact() {
    assertThat(AdaptiveIntegrator.trapezoid(x -> 2.0d * x + 1.0d, 0.0d, 2.0d)).isCloseTo(6.0d, offset(1.0E-12));
  }

}
