/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.google.common.base.Splitter;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.Guavate;
import com.opengamma.strata.collect.io.IniFile;
import com.opengamma.strata.collect.io.PropertySet;
import com.opengamma.strata.collect.io.ResourceLocator;

/**
 * Loads {@link AnalyticsSettings} from an INI file.
 * <p>
 * The file has two optional sections. Missing keys take the values of {@link AnalyticsSettings#DEFAULT}.
 * <pre>
 * [numerical]
 * tolerance = 1.0E-8
 * maxIterations = 100
 * bracketExpansionFactor = 2.0
 * initialBracketSize = 0.01
 *
 * [analytics]
 * compounding = SEMIANNUAL
 * durationBump = 1.0E-4
 * convexityBump = 1.0E-3
 * keyRateTenors = 1M, 3M, 6M, 1Y, 2Y
 * gSpreadBasis = ZERO
 * </pre>
 * 
 * @author Marc Henrard
 */
public final class AnalyticsSettingsLoader {

  /** The location of the settings shipped with the library. */
  public static final String DEFAULT_SETTINGS = "classpath:marc/henrard/spreadomatic/config/analytics-settings.ini";

  private static final String SECTION_NUMERICAL = "numerical";
  private static final String SECTION_ANALYTICS = "analytics";

  /** Private constructor. */
  private AnalyticsSettingsLoader() {
  }

  /**
   * Loads the settings shipped with the library.
   *
   * @return the settings
   */
  public static AnalyticsSettings loadDefault() {
    return load(ResourceLocator.of(DEFAULT_SETTINGS));
  }

  /**
   * Loads the settings from a resource.
   *
   * @param locator  the resource locator
   * @return the settings
   */
  public static AnalyticsSettings load(ResourceLocator locator) {
    ArgChecker.notNull(locator, "locator");
    IniFile ini = IniFile.of(locator.getCharSource());
    return parse(ini);
  }

  /**
   * Parses the settings from an INI file.
   *
   * @param ini  the INI file
   * @return the settings
   */
  public static AnalyticsSettings parse(IniFile ini) {
    AnalyticsSettings defaults = AnalyticsSettings.DEFAULT;
    NumericalConfig numericalDefaults = defaults.getNumericalConfig();
    PropertySet numerical = ini.findSection(SECTION_NUMERICAL).orElse(PropertySet.empty());
    PropertySet analytics = ini.findSection(SECTION_ANALYTICS).orElse(PropertySet.empty());

    NumericalConfig numericalConfig = NumericalConfig.of(
        doubleValue(numerical, "tolerance").orElse(numericalDefaults.getTolerance()),
        intValue(numerical, "maxIterations").orElse(numericalDefaults.getMaxIterations()),
        doubleValue(numerical, "bracketExpansionFactor").orElse(numericalDefaults.getBracketExpansionFactor()),
        doubleValue(numerical, "initialBracketSize").orElse(numericalDefaults.getInitialBracketSize()));
    Compounding compounding = value(analytics, "compounding")
        .map(Compounding::of)
        .orElse(defaults.getCompounding());
    List<Tenor> tenors = value(analytics, "keyRateTenors")
        .map(AnalyticsSettingsLoader::parseTenors)
        .orElse(defaults.getKeyRateTenors());
    GSpreadBasis gSpreadBasis = value(analytics, "gSpreadBasis")
        .map(s -> GSpreadBasis.valueOf(s.trim().toUpperCase(Locale.ENGLISH)))
        .orElse(defaults.getGSpreadBasis());
    return AnalyticsSettings.of(
        compounding,
        doubleValue(analytics, "durationBump").orElse(defaults.getDurationBump()),
        doubleValue(analytics, "convexityBump").orElse(defaults.getConvexityBump()),
        tenors,
        gSpreadBasis,
        numericalConfig);
  }

  //-------------------------------------------------------------------------
  private static List<Tenor> parseTenors(String tenors) {
    return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(tenors).stream()
        .map(Tenor::parse)
        .collect(Guavate.toImmutableList());
  }

  private static Optional<String> value(PropertySet properties, String key) {
    if (!properties.contains(key)) {
      return Optional.empty();
    }
    return Optional.of(properties.value(key));
  }

  private static Optional<Double> doubleValue(PropertySet properties, String key) {
    return value(properties, key).map(s -> Double.parseDouble(s.trim()));
  }

  private static Optional<Integer> intValue(PropertySet properties, String key) {
    return value(properties, key).map(s -> Integer.parseInt(s.trim()));
  }

}
