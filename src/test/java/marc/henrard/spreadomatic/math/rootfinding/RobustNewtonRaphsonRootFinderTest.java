/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.offset;

import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

import org.junit.jupiter.api.Test;

import com.opengamma.strata.collect.tuple.DoublesPair;

import marc.henrard.spreadomatic.basics.NumericalConfig;
import marc.henrard.spreadomatic.math.rootfinding.RobustNewtonRaphsonRootFinder.NewtonOutcome;

/**
 * Tests {@link RobustNewtonRaphsonRootFinder}.
 * 
 * @author Marc Henrard
 */
public class RobustNewtonRaphsonRootFinderTest {

  private static final RobustNewtonRaphsonRootFinder NEWTON = RobustNewtonRaphsonRootFinder.DEFAULT;
  /* x^3 - x - 1, root is the plastic number. */
  private static final DoubleUnaryOperator CUBIC = x -> x * x * x - x - 1.0d;
  private static final DoubleUnaryOperator CUBIC_DERIVATIVE = x -> 3.0d * x * x - 1.0d;
  private static final double CUBIC_ROOT = 1.3247179572447460;
  private static final double TOLERANCE_ROOT = 1.0E-8;

  @Test
  public void analytic_derivative() {
    SolverResult result = NEWTON.solve(CUBIC, Optional.of(CUBIC_DERIVATIVE), 1.5d, Optional.empty());
    assertThat(result.isConverged()).isTrue();
    assertThat(result.getRoot()).isCloseTo(CUBIC_ROOT, offset(TOLERANCE_ROOT));
    assertThat(result.getIterations()).isLessThan(10);
  }

  @Test
  public void finite_difference_derivative() {
    SolverResult result = NEWTON.solve(CUBIC, 1.5d);
    assertThat(result.isConverged()).isTrue();
    assertThat(result.getRoot()).isCloseTo(CUBIC_ROOT, offset(TOLERANCE_ROOT));
  }

  @Test
  public void with_bounds() {
    SolverResult result = NEWTON.solve(CUBIC, CUBIC_DERIVATIVE, 1.5d, 1.0d, 2.0d);
    assertThat(result.getRoot()).isCloseTo(CUBIC_ROOT, offset(TOLERANCE_ROOT));
  }

  //-------------------------------------------------------------------------
  /* Flat finite difference at 0, the Brent fallback finds the root. */
  @Test
  public void small_derivative_fallback() {
    DoubleUnaryOperator f = x -> x * x * x - 8.0d;
    NewtonOutcome outcome = NEWTON.iterate(f, x -> 3.0d * x * x, 0.0d, Optional.empty());
    assertThat(outcome.getResult()).isEmpty();
    assertThat(outcome.getFailure()).hasValue(NewtonFailure.SMALL_DERIVATIVE);
    SolverResult result = NEWTON.solve(f, 0.0d);
    assertThat(result.isConverged()).isTrue();
    assertThat(result.getRoot()).isCloseTo(2.0d, offset(TOLERANCE_ROOT));
  }

  @Test
  public void step_too_large_fallback() {
    DoubleUnaryOperator f = x -> x * x - 1.0E6;
    DoubleUnaryOperator df = x -> 2.0d * x;
    NewtonOutcome outcome = NEWTON.iterate(f, df, 0.01d, Optional.empty());
    assertThat(outcome.getFailure()).hasValue(NewtonFailure.STEP_TOO_LARGE);
    SolverResult result = NEWTON.solve(f, Optional.of(df), 0.01d, Optional.of(DoublesPair.of(1.0d, 10.0d)));
    assertThat(result.getRoot()).isCloseTo(1000.0d, offset(1.0E-6));
  }

  @Test
  public void evaluation_error() {
    NewtonOutcome outcome = NEWTON.iterate(Math::log, x -> 1.0d / x, -1.0d, Optional.empty());
    assertThat(outcome.getFailure()).hasValue(NewtonFailure.EVALUATION_ERROR);
  }

  @Test
  public void evaluation_exception() {
    DoubleUnaryOperator f = x -> {
      if (x < 0.0d) {
        throw new IllegalArgumentException("negative");
      }
      return x - 1.0d;
    };
    NewtonOutcome outcome = NEWTON.iterate(f, x -> 1.0d, -1.0d, Optional.empty());
    assertThat(outcome.getFailure()).hasValue(NewtonFailure.EVALUATION_ERROR);
  }

  @Test
  public void iterations_exhausted() {
    RobustNewtonRaphsonRootFinder newton =
        new RobustNewtonRaphsonRootFinder(NumericalConfig.DEFAULT.withMaxIterations(2));
    NewtonOutcome outcome = newton.iterate(CUBIC, CUBIC_DERIVATIVE, 1.5d, Optional.empty());
    assertThat(outcome.getFailure()).hasValue(NewtonFailure.ITERATIONS_EXHAUSTED);
  }

  /* The root is outside the bounds: the clamped iterate does not move, Brent expands the bounds. */
  @Test
  public void stalled_at_bound() {
    DoubleUnaryOperator f = x -> x + 1.0d;
    DoubleUnaryOperator df = x -> 1.0d;
    Optional<DoublesPair> bounds = Optional.of(DoublesPair.of(0.0d, 1.0d));
    NewtonOutcome outcome = NEWTON.iterate(f, df, 0.5d, bounds);
    assertThat(outcome.getFailure()).hasValue(NewtonFailure.STALLED_AT_BOUND);
    SolverResult result = NEWTON.solve(f, Optional.of(df), 0.5d, bounds);
    assertThat(result.getRoot()).isCloseTo(-1.0d, offset(TOLERANCE_ROOT));
  }

  @Test
  public void both_methods_fail() {
    DoubleUnaryOperator f = x -> x * x + 1.0d;
    DoubleUnaryOperator df = x -> 2.0d * x;
    RootFindingException ex = catchThrowableOfType(
        () -> NEWTON.solve(f, Optional.of(df), 0.0d, Optional.empty()),
        RootFindingException.class);
    assertThat(ex).isNotNull();
    assertThat(ex.getNewtonFailure()).isEqualTo(NewtonFailure.SMALL_DERIVATIVE);
    assertThat(ex.getCause()).isInstanceOf(BracketingException.class);
  }

}
