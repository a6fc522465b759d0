/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.Test;

import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.io.ResourceLocator;

/**
 * Tests {@link AnalyticsSettingsLoader}.
 */
public class AnalyticsSettingsLoaderTest {

  private static final String TEST_SETTINGS = "classpath:marc/henrard/spreadomatic/config/test-settings.ini";

  @Test
  public void load_default() {
    AnalyticsSettings settings = AnalyticsSettingsLoader.loadDefault();
    AnalyticsSettings expected = AnalyticsSettings.DEFAULT;
    assertThat(settings.getCompounding()).isEqualTo(expected.getCompounding());
    assertThat(settings.getDurationBump()).isEqualTo(expected.getDurationBump());
    assertThat(settings.getConvexityBump()).isCloseTo(expected.getConvexityBump(), offset(1.0E-16));
    assertThat(settings.getKeyRateTenors()).isEqualTo(expected.getKeyRateTenors());
    assertThat(settings.getGSpreadBasis()).isEqualTo(expected.getGSpreadBasis());
    assertThat(settings.getNumericalConfig()).isEqualTo(NumericalConfig.DEFAULT);
  }

  /* Keys missing from the file keep their default values. */
  @Test
  public void load_partial() {
    AnalyticsSettings settings = AnalyticsSettingsLoader.load(ResourceLocator.of(TEST_SETTINGS));
    assertThat(settings.getCompounding()).isEqualTo(Compounding.ANNUAL);
    assertThat(settings.getGSpreadBasis()).isEqualTo(GSpreadBasis.PAR);
    assertThat(settings.getKeyRateTenors()).containsExactly(Tenor.TENOR_2Y, Tenor.TENOR_5Y, Tenor.TENOR_10Y);
    assertThat(settings.getDurationBump()).isEqualTo(AnalyticsSettings.DEFAULT.getDurationBump());
    assertThat(settings.getConvexityBump()).isCloseTo(AnalyticsSettings.DEFAULT.getConvexityBump(), offset(1.0E-16));
    NumericalConfig numerical = settings.getNumericalConfig();
    assertThat(numerical.getTolerance()).isEqualTo(1.0E-10);
    assertThat(numerical.getMaxIterations()).isEqualTo(200);
    assertThat(numerical.getBracketExpansionFactor()).isEqualTo(2.0d);
    assertThat(numerical.getInitialBracketSize()).isEqualTo(0.01d);
  }

}
