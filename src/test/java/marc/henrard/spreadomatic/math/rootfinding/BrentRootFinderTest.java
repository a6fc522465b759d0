/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.util.function.DoubleUnaryOperator;

import org.junit.jupiter.api.Test;

import com.opengamma.strata.collect.tuple.DoublesPair;

import marc.henrard.spreadomatic.basics.NumericalConfig;

/**
 * Tests {@link BrentRootFinder}.
 * 
 * @author Marc Henrard
 */
public class BrentRootFinderTest {

  private static final BrentRootFinder BRENT = BrentRootFinder.DEFAULT;
  private static final DoubleUnaryOperator SQUARE_2 = x -> x * x - 2.0d;
  private static final DoubleUnaryOperator CUBIC = x -> x * x * x - 2.0d * x - 5.0d;
  private static final double CUBIC_ROOT = 2.0945514815423265;
  private static final double TOLERANCE_ROOT = 1.0E-8;

  @Test
  public void bounds_bracketing() {
    SolverResult result = BRENT.solve(CUBIC, 2.5d, 2.0d, 3.0d);
    assertThat(result.isConverged()).isTrue();
    assertThat(result.getRoot()).isCloseTo(CUBIC_ROOT, offset(TOLERANCE_ROOT));
    assertThat(Math.abs(result.getFunctionValue())).isLessThan(NumericalConfig.DEFAULT.getTolerance());
    assertThat(result.getDiagnostic()).isEmpty();
  }

  @Test
  public void no_bounds_symmetric_search() {
    DoublesPair bracket = BRENT.autoBracket(SQUARE_2, 1.0d);
    assertThat(bracket.getFirst()).isCloseTo(0.36d, offset(1.0E-12));
    assertThat(bracket.getSecond()).isCloseTo(1.64d, offset(1.0E-12));
    SolverResult result = BRENT.solve(SQUARE_2, 1.0d);
    assertThat(result.isConverged()).isTrue();
    assertThat(result.getRoot()).isCloseTo(Math.sqrt(2.0d), offset(TOLERANCE_ROOT));
  }

  /* Bounds which do not bracket the root are expanded on the side of the smaller absolute value. */
  @Test
  public void bounds_expanded() {
    DoubleUnaryOperator f = x -> x - 3.0d;
    DoublesPair bracket = BRENT.expandBracket(f, 0.0d, 1.0d);
    assertThat(bracket.getFirst()).isEqualTo(0.0d);
    assertThat(bracket.getSecond()).isEqualTo(4.0d);
    SolverResult result = BRENT.solve(f, 0.5d, 0.0d, 1.0d);
    assertThat(result.getRoot()).isCloseTo(3.0d, offset(TOLERANCE_ROOT));
  }

  @Test
  public void root_at_end_point() {
    SolverResult result = BRENT.solve(x -> x - 1.0d, 1.5d, 1.0d, 2.0d);
    assertThat(result.isConverged()).isTrue();
    assertThat(result.getRoot()).isEqualTo(1.0d);
    assertThat(result.getIterations()).isEqualTo(0);
  }

  @Test
  public void no_root() {
    DoubleUnaryOperator f = x -> x * x + 1.0d;
    assertThatThrownBy(() -> BRENT.solve(f, 0.0d)).isInstanceOf(BracketingException.class);
    assertThatThrownBy(() -> BRENT.solve(f, 0.5d, 0.0d, 1.0d)).isInstanceOf(BracketingException.class);
  }

  @Test
  public void non_finite_values_do_not_bracket() {
    assertThatThrownBy(() -> BRENT.solveBracketed(x -> Double.NaN, 0.0d, 1.0d))
        .isInstanceOf(BracketingException.class);
  }

  /* The best estimate is returned with a diagnostic when the iterations are exhausted. */
  @Test
  public void iterations_exhausted() {
    BrentRootFinder brent = new BrentRootFinder(NumericalConfig.DEFAULT.withMaxIterations(1));
    SolverResult result = brent.solve(CUBIC, 2.5d, 2.0d, 3.0d);
    assertThat(result.isConverged()).isFalse();
    assertThat(result.getIterations()).isEqualTo(1);
    assertThat(result.getRoot()).isBetween(2.0d, 3.0d);
    assertThat(result.getDiagnostic()).isPresent();
    assertThat(result.getDiagnostic().get()).contains("did not converge");
  }

  @Test
  public void wrong_order_bounds() {
    assertThatIllegalArgumentException().isThrownBy(() -> BRENT.solve(CUBIC, 2.5d, 3.0d, 2.0d));
  }

}
