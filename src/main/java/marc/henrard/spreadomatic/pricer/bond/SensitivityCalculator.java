/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.util.List;

import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.spreadomatic.basics.AnalyticsSettings;
import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;

/**
 * Price sensitivities of a cash flow stream by finite difference bumps of the curve or of the spread.
 * <p>
 * The curve based measures reprice with the curve shifted by the spread, usually the Z-spread, so that the
 * unbumped price is the dirty price. The bump sizes are the ones of the settings.
 * 
 * @author Marc Henrard
 */
public class SensitivityCalculator {

  /** The default instance. */
  public static final SensitivityCalculator DEFAULT = new SensitivityCalculator(AnalyticsSettings.DEFAULT);

  private final DiscountingCashflowPricer pricer;
  private final double durationBump;
  private final double convexityBump;

  /**
   * Creates an instance.
   *
   * @param settings  the settings providing the bump sizes
   */
  public SensitivityCalculator(AnalyticsSettings settings) {
    ArgChecker.notNull(settings, "settings");
    this.pricer = DiscountingCashflowPricer.DEFAULT;
    this.durationBump = settings.getDurationBump();
    this.convexityBump = settings.getConvexityBump();
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the effective duration: {@code (P(-d) - P(+d)) / (2 d P0)} for a parallel shift d of the curve.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param curve  the zero curve
   * @param spread  the spread over the curve
   * @param compounding  the compounding of the curve
   * @return the effective duration
   */
  public double effectiveDuration(
      DoubleArray times,
      DoubleArray amounts,
      ZeroCurve curve,
      double spread,
      Compounding compounding) {

    double p0 = pricer.presentValue(times, amounts, curve, spread, compounding);
    double pDown = pricer.presentValue(times, amounts, curve.withParallelShift(-durationBump), spread, compounding);
    double pUp = pricer.presentValue(times, amounts, curve.withParallelShift(durationBump), spread, compounding);
    return (pDown - pUp) / (2.0d * durationBump * p0);
  }

  /**
   * Computes the effective convexity: {@code (P(+d) + P(-d) - 2 P0) / (d^2 P0)} for a parallel shift d of the curve.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param curve  the zero curve
   * @param spread  the spread over the curve
   * @param compounding  the compounding of the curve
   * @return the convexity
   */
  public double convexity(
      DoubleArray times,
      DoubleArray amounts,
      ZeroCurve curve,
      double spread,
      Compounding compounding) {

    double p0 = pricer.presentValue(times, amounts, curve, spread, compounding);
    double pDown = pricer.presentValue(times, amounts, curve.withParallelShift(-convexityBump), spread, compounding);
    double pUp = pricer.presentValue(times, amounts, curve.withParallelShift(convexityBump), spread, compounding);
    return (pUp + pDown - 2.0d * p0) / (convexityBump * convexityBump * p0);
  }

  /**
   * Computes the spread duration, bumping the spread instead of the curve.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param curve  the zero curve
   * @param spread  the spread over the curve
   * @param compounding  the compounding of the curve
   * @return the spread duration
   */
  public double spreadDuration(
      DoubleArray times,
      DoubleArray amounts,
      ZeroCurve curve,
      double spread,
      Compounding compounding) {

    double p0 = pricer.presentValue(times, amounts, curve, spread, compounding);
    double pDown = pricer.presentValue(times, amounts, curve, spread - durationBump, compounding);
    double pUp = pricer.presentValue(times, amounts, curve, spread + durationBump, compounding);
    return (pDown - pUp) / (2.0d * durationBump * p0);
  }

  /**
   * Computes the key rate durations.
   * <p>
   * For each tenor, the curve is bumped at the tenor time only, the node being inserted if missing, and the
   * duration computed as for the effective duration.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param curve  the zero curve
   * @param spread  the spread over the curve
   * @param compounding  the compounding of the curve
   * @param tenors  the key rate tenors
   * @return the durations by tenor, in the order of the tenors
   */
  public ImmutableMap<Tenor, Double> keyRateDurations(
      DoubleArray times,
      DoubleArray amounts,
      ZeroCurve curve,
      double spread,
      Compounding compounding,
      List<Tenor> tenors) {

    ArgChecker.noNulls(tenors, "tenors");
    double p0 = pricer.presentValue(times, amounts, curve, spread, compounding);
    ImmutableMap.Builder<Tenor, Double> krd = ImmutableMap.builder();
    for (Tenor tenor : tenors) {
      double keyTime = tenorTime(tenor);
      double pDown = pricer.presentValue(
          times, amounts, curve.withKeyRateShift(keyTime, -durationBump), spread, compounding);
      double pUp = pricer.presentValue(
          times, amounts, curve.withKeyRateShift(keyTime, durationBump), spread, compounding);
      krd.put(tenor, (pDown - pUp) / (2.0d * durationBump * p0));
    }
    return krd.build();
  }

  /**
   * Computes the price change for a 1 basis point move, from the effective duration.
   *
   * @param effectiveDuration  the effective duration
   * @param price  the price
   * @return the DV01
   */
  public double dv01(double effectiveDuration, double price) {
    return effectiveDuration * price * AnalyticsSettings.BP1;
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the Macaulay duration: the present value weighted average time of the cash flows, discounted at
   * the yield.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param ytm  the yield
   * @param compounding  the compounding of the yield
   * @return the Macaulay duration
   */
  public double macaulayDuration(DoubleArray times, DoubleArray amounts, double ytm, Compounding compounding) {
    double pv = 0.0d;
    double weighted = 0.0d;
    for (int i = 0; i < times.size(); i++) {
      double pvi = amounts.get(i) * compounding.discountFactor(ytm, times.get(i));
      pv += pvi;
      weighted += times.get(i) * pvi;
    }
    ArgChecker.isTrue(pv != 0.0d, "present value of the cash flows must not be 0");
    return weighted / pv;
  }

  /**
   * Computes the modified duration: the Macaulay duration divided by {@code 1 + y/f}.
   * <p>
   * For continuous compounding the modified duration is the Macaulay duration.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param ytm  the yield
   * @param compounding  the compounding of the yield
   * @param frequency  the coupon frequency
   * @return the modified duration
   */
  public double modifiedDuration(
      DoubleArray times,
      DoubleArray amounts,
      double ytm,
      Compounding compounding,
      int frequency) {

    double macaulay = macaulayDuration(times, amounts, ytm, compounding);
    if (compounding.isContinuous()) {
      return macaulay;
    }
    return macaulay / (1.0d + ytm / frequency);
  }

  /**
   * Computes the modified duration from the effective duration: {@code ED / (1 + y/f)}.
   *
   * @param effectiveDuration  the effective duration
   * @param ytm  the yield
   * @param frequency  the coupon frequency
   * @return the modified duration
   */
  public double modifiedDurationFromEffective(double effectiveDuration, double ytm, int frequency) {
    ArgChecker.notNegativeOrZero(frequency, "frequency");
    return effectiveDuration / (1.0d + ytm / frequency);
  }

  /**
   * Returns the time in years of a tenor, 12 months being one year.
   *
   * @param tenor  the tenor
   * @return the time
   */
  public static double tenorTime(Tenor tenor) {
    return tenor.getPeriod().toTotalMonths() / 12.0d + tenor.getPeriod().getDays() / 365.0d;
  }

}
