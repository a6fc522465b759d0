/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.product.bond;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import org.junit.jupiter.api.Test;

/**
 * Tests {@link FloatingPeriod}.
 * 
 * @author Marc Henrard
 */
public class FloatingPeriodTest {

  @Test
  public void of() {
    FloatingPeriod period = FloatingPeriod.of(0.25d, 0.75d, 0.5d, 100.0d);
    assertThat(period.getStartTime()).isEqualTo(0.25d);
    assertThat(period.getEndTime()).isEqualTo(0.75d);
    assertThat(period.getAccrualFactor()).isEqualTo(0.5d);
    assertThat(period.getNotional()).isEqualTo(100.0d);
    assertThat(period).isEqualTo(FloatingPeriod.of(0.25d, 0.75d, 0.5d, 100.0d));
  }

  @Test
  public void invalid() {
    assertThatIllegalArgumentException().isThrownBy(() -> FloatingPeriod.of(-0.1d, 0.75d, 0.5d, 100.0d));
    assertThatIllegalArgumentException().isThrownBy(() -> FloatingPeriod.of(0.75d, 0.75d, 0.5d, 100.0d));
    assertThatIllegalArgumentException().isThrownBy(() -> FloatingPeriod.of(0.25d, 0.75d, -0.5d, 100.0d));
  }

}
