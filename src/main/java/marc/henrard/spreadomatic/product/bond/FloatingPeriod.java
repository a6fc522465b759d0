/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.product.bond;

import java.util.Objects;

import com.opengamma.strata.collect.ArgChecker;

/**
 * A floating coupon period of a floating rate note.
 * <p>
 * The rate is fixed over the period between the start time and the end time, measured in years from the
 * valuation date, and paid at the end time. The coupon is {@code rate * accrualFactor * notional}.
 * 
 * @author Marc Henrard
 */
public final class FloatingPeriod {

  private final double startTime;
  private final double endTime;
  private final double accrualFactor;
  private final double notional;

  private FloatingPeriod(double startTime, double endTime, double accrualFactor, double notional) {
    ArgChecker.notNegative(startTime, "startTime");
    ArgChecker.isTrue(endTime > startTime, "end time {} must be after start time {}", endTime, startTime);
    this.startTime = startTime;
    this.endTime = endTime;
    this.accrualFactor = ArgChecker.notNegative(accrualFactor, "accrualFactor");
    this.notional = notional;
  }

  /**
   * Obtains a period.
   *
   * @param startTime  the start of the rate period, not negative
   * @param endTime  the end of the rate period and payment time, after the start
   * @param accrualFactor  the accrual year fraction of the coupon
   * @param notional  the notional
   * @return the period
   */
  public static FloatingPeriod of(double startTime, double endTime, double accrualFactor, double notional) {
    return new FloatingPeriod(startTime, endTime, accrualFactor, notional);
  }

  public double getStartTime() {
    return startTime;
  }

  public double getEndTime() {
    return endTime;
  }

  public double getAccrualFactor() {
    return accrualFactor;
  }

  public double getNotional() {
    return notional;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FloatingPeriod)) {
      return false;
    }
    FloatingPeriod other = (FloatingPeriod) obj;
    return Double.compare(startTime, other.startTime) == 0 &&
        Double.compare(endTime, other.endTime) == 0 &&
        Double.compare(accrualFactor, other.accrualFactor) == 0 &&
        Double.compare(notional, other.notional) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(startTime, endTime, accrualFactor, notional);
  }

  @Override
  public String toString() {
    return "FloatingPeriod[" + startTime + ", " + endTime + ", " + accrualFactor + ", " + notional + "]";
  }

}
