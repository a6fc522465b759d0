/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.Test;

/**
 * Tests {@link Compounding}.
 */
public class CompoundingTest {

  private static final double RATE = 0.05;
  private static final double TIME = 2.5;
  private static final double TOLERANCE_DF = 1.0E-14;

  @Test
  public void of_name_and_frequency() {
    assertThat(Compounding.of("annual")).isEqualTo(Compounding.ANNUAL);
    assertThat(Compounding.of("Semi-Annual")).isEqualTo(Compounding.SEMIANNUAL);
    assertThat(Compounding.of("QUARTERLY")).isEqualTo(Compounding.QUARTERLY);
    assertThat(Compounding.of(" continuous ")).isEqualTo(Compounding.CONTINUOUS);
    assertThat(Compounding.of("2")).isEqualTo(Compounding.SEMIANNUAL);
    assertThat(Compounding.of("12")).isEqualTo(Compounding.MONTHLY);
    assertThat(Compounding.ofPeriodsPerYear(4)).isEqualTo(Compounding.QUARTERLY);
  }

  @Test
  public void of_unknown() {
    assertThatIllegalArgumentException().isThrownBy(() -> Compounding.of("weekly"));
    assertThatIllegalArgumentException().isThrownBy(() -> Compounding.of("3"));
    assertThatIllegalArgumentException().isThrownBy(() -> Compounding.ofPeriodsPerYear(0));
  }

  @Test
  public void discount_factor() {
    assertThat(Compounding.ANNUAL.discountFactor(RATE, TIME))
        .isCloseTo(Math.pow(1.05, -TIME), offset(TOLERANCE_DF));
    assertThat(Compounding.SEMIANNUAL.discountFactor(RATE, TIME))
        .isCloseTo(Math.pow(1.025, -5.0), offset(TOLERANCE_DF));
    assertThat(Compounding.MONTHLY.discountFactor(RATE, TIME))
        .isCloseTo(Math.pow(1.0d + RATE / 12.0d, -30.0), offset(TOLERANCE_DF));
    assertThat(Compounding.CONTINUOUS.discountFactor(RATE, TIME))
        .isCloseTo(Math.exp(-RATE * TIME), offset(TOLERANCE_DF));
    assertThat(Compounding.QUARTERLY.discountFactor(RATE, 0.0d)).isEqualTo(1.0d);
  }

  /* Analytic derivative against central finite difference. */
  @Test
  public void discount_factor_derivative() {
    double shift = 1.0E-6;
    for (Compounding compounding : Compounding.values()) {
      double fd = (compounding.discountFactor(RATE + shift, TIME) - compounding.discountFactor(RATE - shift, TIME)) /
          (2.0d * shift);
      assertThat(compounding.discountFactorDerivative(RATE, TIME)).isCloseTo(fd, offset(1.0E-8));
    }
  }

  @Test
  public void continuous_conversion() {
    for (Compounding compounding : Compounding.values()) {
      double continuous = compounding.toContinuous(RATE);
      assertThat(compounding.fromContinuous(continuous)).isCloseTo(RATE, offset(1.0E-15));
      assertThat(Compounding.CONTINUOUS.discountFactor(continuous, TIME))
          .isCloseTo(compounding.discountFactor(RATE, TIME), offset(TOLERANCE_DF));
    }
  }

}
