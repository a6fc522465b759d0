/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.market.curve;

import java.util.Objects;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;
import com.opengamma.strata.market.curve.interpolator.BoundCurveInterpolator;
import com.opengamma.strata.market.curve.interpolator.CurveExtrapolators;
import com.opengamma.strata.market.curve.interpolator.CurveInterpolator;
import com.opengamma.strata.market.curve.interpolator.CurveInterpolators;

import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.basics.DegenerateInputException;

/**
 * Zero-coupon rate curve described by nodes (time in years, rate in decimal).
 * <p>
 * Between nodes the rate is interpolated, by default linearly. Outside the nodes the rate is extrapolated flat.
 * A curve with a single node is flat at that node's rate.
 * <p>
 * The rates are expressed in the compounding convention used to discount with the curve; the curve itself
 * does not carry the convention.
 * 
 * @author Marc Henrard
 */
public final class ZeroCurve {

  /** Tolerance used to identify an existing node time. */
  private static final double TIME_TOLERANCE = 1.0E-9;

  /** The node times, non-negative and strictly increasing. */
  private final DoubleArray times;
  /** The node rates. */
  private final DoubleArray rates;
  /** The interpolator. */
  private final CurveInterpolator interpolator;
  /** The interpolator bound to the nodes, null for a single node curve. */
  private final BoundCurveInterpolator boundInterpolator;

  private ZeroCurve(DoubleArray times, DoubleArray rates, CurveInterpolator interpolator) {
    ArgChecker.notNull(times, "times");
    ArgChecker.notNull(rates, "rates");
    ArgChecker.notNull(interpolator, "interpolator");
    if (times.size() != rates.size()) {
      throw new DegenerateInputException(
          "Curve times and rates must have the same size, were {} and {}", times.size(), rates.size());
    }
    if (times.isEmpty()) {
      throw new DegenerateInputException("Curve must have at least one node");
    }
    for (int i = 0; i < times.size(); i++) {
      if (!(times.get(i) >= 0.0d)) {
        throw new DegenerateInputException("Curve times must be non-negative, found {}", times.get(i));
      }
      if (i > 0 && times.get(i) <= times.get(i - 1)) {
        throw new DegenerateInputException(
            "Curve times must be strictly increasing, found {} after {}", times.get(i), times.get(i - 1));
      }
    }
    this.times = times;
    this.rates = rates;
    this.interpolator = interpolator;
    this.boundInterpolator = times.size() > 1 ?
        interpolator.bind(times, rates, CurveExtrapolators.FLAT, CurveExtrapolators.FLAT) :
        null;
  }

  /**
   * Obtains a linearly interpolated curve.
   *
   * @param times  the node times in years
   * @param rates  the node rates
   * @return the curve
   */
  public static ZeroCurve of(DoubleArray times, DoubleArray rates) {
    return new ZeroCurve(times, rates, CurveInterpolators.LINEAR);
  }

  /**
   * Obtains a curve with a specific interpolator, for example {@link CurveInterpolators#PCHIP}.
   *
   * @param times  the node times in years
   * @param rates  the node rates
   * @param interpolator  the interpolator
   * @return the curve
   */
  public static ZeroCurve of(DoubleArray times, DoubleArray rates, CurveInterpolator interpolator) {
    return new ZeroCurve(times, rates, interpolator);
  }

  /**
   * Obtains a flat curve.
   *
   * @param rate  the rate
   * @return the curve
   */
  public static ZeroCurve flat(double rate) {
    return new ZeroCurve(DoubleArray.of(0.0d), DoubleArray.of(rate), CurveInterpolators.LINEAR);
  }

  //-------------------------------------------------------------------------
  public DoubleArray getTimes() {
    return times;
  }

  public DoubleArray getRates() {
    return rates;
  }

  public CurveInterpolator getInterpolator() {
    return interpolator;
  }

  /**
   * Returns the number of nodes.
   *
   * @return the number of nodes
   */
  public int size() {
    return times.size();
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the rate at a given time.
   * <p>
   * Times before the first node or after the last node get the rate of that node.
   *
   * @param time  the time in years
   * @return the rate
   */
  public double rateAt(double time) {
    if (boundInterpolator == null) {
      return rates.get(0);
    }
    return boundInterpolator.interpolate(time);
  }

  /**
   * Returns the annualised forward rate between two times.
   * <p>
   * The forward rate is the simple rate {@code (DF(t1)/DF(t2) - 1) / (t2 - t1)}, where the discount factors use
   * the given compounding.
   *
   * @param startTime  the start time
   * @param endTime  the end time, after the start time
   * @param compounding  the compounding of the curve rates
   * @return the forward rate
   */
  public double forwardRate(double startTime, double endTime, Compounding compounding) {
    ArgChecker.isTrue(endTime > startTime, "end time {} must be after start time {}", endTime, startTime);
    double dfStart = compounding.discountFactor(rateAt(startTime), startTime);
    double dfEnd = compounding.discountFactor(rateAt(endTime), endTime);
    return (dfStart / dfEnd - 1.0d) / (endTime - startTime);
  }

  //-------------------------------------------------------------------------
  /**
   * Returns a curve with all rates shifted by the same amount.
   *
   * @param shift  the shift
   * @return the shifted curve
   */
  public ZeroCurve withParallelShift(double shift) {
    return new ZeroCurve(times, rates.plus(shift), interpolator);
  }

  /**
   * Returns a curve with the rate at one key time shifted, the other nodes unchanged.
   * <p>
   * If a node exists at the key time, its rate is shifted. Otherwise a node is inserted at the key time with the
   * currently interpolated rate plus the shift.
   *
   * @param keyTime  the key time
   * @param shift  the shift
   * @return the shifted curve
   */
  public ZeroCurve withKeyRateShift(double keyTime, double shift) {
    ArgChecker.notNegative(keyTime, "keyTime");
    int index = 0;
    while (index < times.size() && times.get(index) < keyTime - TIME_TOLERANCE) {
      index++;
    }
    if (index < times.size() && Math.abs(times.get(index) - keyTime) < TIME_TOLERANCE) {
      return new ZeroCurve(times, rates.with(index, rates.get(index) + shift), interpolator);
    }
    double baseRate = rateAt(keyTime);
    DoubleArray newTimes = times.subArray(0, index)
        .concat(DoubleArray.of(keyTime))
        .concat(times.subArray(index));
    DoubleArray newRates = rates.subArray(0, index)
        .concat(DoubleArray.of(baseRate + shift))
        .concat(rates.subArray(index));
    return new ZeroCurve(newTimes, newRates, interpolator);
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ZeroCurve)) {
      return false;
    }
    ZeroCurve other = (ZeroCurve) obj;
    return times.equals(other.times) && rates.equals(other.rates) && interpolator.equals(other.interpolator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(times, rates, interpolator);
  }

  @Override
  public String toString() {
    return "ZeroCurve[times=" + times + ", rates=" + rates + ", interpolator=" + interpolator + "]";
  }

}
