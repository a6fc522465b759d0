/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;

/**
 * Settings of the bond analytics: compounding, bump sizes, key-rate tenors and solver parameters.
 * 
 * @author Marc Henrard
 */
public final class AnalyticsSettings {

  /** One basis point. */
  public static final double BP1 = 1.0E-4;

  /** The standard key-rate tenors. */
  public static final ImmutableList<Tenor> STANDARD_KEY_RATE_TENORS = ImmutableList.of(
      Tenor.ofMonths(1), Tenor.ofMonths(3), Tenor.ofMonths(6),
      Tenor.ofYears(1), Tenor.ofYears(2), Tenor.ofYears(3), Tenor.ofYears(4), Tenor.ofYears(5),
      Tenor.ofYears(7), Tenor.ofYears(10), Tenor.ofYears(20), Tenor.ofYears(30), Tenor.ofYears(50));

  /** The default settings. */
  public static final AnalyticsSettings DEFAULT = new AnalyticsSettings(
      Compounding.SEMIANNUAL, BP1, 10 * BP1, STANDARD_KEY_RATE_TENORS, GSpreadBasis.ZERO, NumericalConfig.DEFAULT);

  private final Compounding compounding;
  private final double durationBump;
  private final double convexityBump;
  private final ImmutableList<Tenor> keyRateTenors;
  private final GSpreadBasis gSpreadBasis;
  private final NumericalConfig numericalConfig;

  private AnalyticsSettings(
      Compounding compounding,
      double durationBump,
      double convexityBump,
      List<Tenor> keyRateTenors,
      GSpreadBasis gSpreadBasis,
      NumericalConfig numericalConfig) {

    this.compounding = ArgChecker.notNull(compounding, "compounding");
    this.durationBump = ArgChecker.notNegativeOrZero(durationBump, "durationBump");
    this.convexityBump = ArgChecker.notNegativeOrZero(convexityBump, "convexityBump");
    this.keyRateTenors = ImmutableList.copyOf(ArgChecker.notEmpty(keyRateTenors, "keyRateTenors"));
    this.gSpreadBasis = ArgChecker.notNull(gSpreadBasis, "gSpreadBasis");
    this.numericalConfig = ArgChecker.notNull(numericalConfig, "numericalConfig");
  }

  /**
   * Obtains an instance.
   *
   * @param compounding  the compounding used for discounting and yields
   * @param durationBump  the bump used for durations
   * @param convexityBump  the bump used for convexity
   * @param keyRateTenors  the key-rate tenors
   * @param gSpreadBasis  the G-spread reference basis
   * @param numericalConfig  the solver parameters
   * @return the settings
   */
  public static AnalyticsSettings of(
      Compounding compounding,
      double durationBump,
      double convexityBump,
      List<Tenor> keyRateTenors,
      GSpreadBasis gSpreadBasis,
      NumericalConfig numericalConfig) {

    return new AnalyticsSettings(compounding, durationBump, convexityBump, keyRateTenors, gSpreadBasis, numericalConfig);
  }

  //-------------------------------------------------------------------------
  public Compounding getCompounding() {
    return compounding;
  }

  public double getDurationBump() {
    return durationBump;
  }

  public double getConvexityBump() {
    return convexityBump;
  }

  public ImmutableList<Tenor> getKeyRateTenors() {
    return keyRateTenors;
  }

  public GSpreadBasis getGSpreadBasis() {
    return gSpreadBasis;
  }

  public NumericalConfig getNumericalConfig() {
    return numericalConfig;
  }

  /**
   * Returns a copy with a different compounding.
   *
   * @param compounding  the compounding
   * @return the settings
   */
  public AnalyticsSettings withCompounding(Compounding compounding) {
    return new AnalyticsSettings(compounding, durationBump, convexityBump, keyRateTenors, gSpreadBasis, numericalConfig);
  }

  /**
   * Returns a copy with a different G-spread basis.
   *
   * @param gSpreadBasis  the basis
   * @return the settings
   */
  public AnalyticsSettings withGSpreadBasis(GSpreadBasis gSpreadBasis) {
    return new AnalyticsSettings(compounding, durationBump, convexityBump, keyRateTenors, gSpreadBasis, numericalConfig);
  }

  /**
   * Returns a copy with different solver parameters.
   *
   * @param numericalConfig  the solver parameters
   * @return the settings
   */
  public AnalyticsSettings withNumericalConfig(NumericalConfig numericalConfig) {
    return new AnalyticsSettings(compounding, durationBump, convexityBump, keyRateTenors, gSpreadBasis, numericalConfig);
  }

  @Override
  public String toString() {
    return "AnalyticsSettings[compounding=" + compounding + ", durationBump=" + durationBump +
        ", convexityBump=" + convexityBump + ", keyRateTenors=" + keyRateTenors +
        ", gSpreadBasis=" + gSpreadBasis + ", numericalConfig=" + numericalConfig + "]";
  }

}
