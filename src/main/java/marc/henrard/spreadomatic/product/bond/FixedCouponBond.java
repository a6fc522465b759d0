/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.product.bond;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.opengamma.strata.collect.ArgChecker;

/**
 * A fixed coupon bond, possibly callable.
 * <p>
 * The coupon rate is in decimal. The call prices are expressed per 100 of notional.
 * 
 * @author Marc Henrard
 */
public final class FixedCouponBond {

  /** The default notional. */
  public static final double DEFAULT_NOTIONAL = 100.0d;

  private final BondSchedule schedule;
  private final double couponRate;
  private final double notional;
  /** The call dates and prices, sorted by date. */
  private final ImmutableList<CallScheduleEntry> callSchedule;

  private FixedCouponBond(
      BondSchedule schedule,
      double couponRate,
      double notional,
      List<CallScheduleEntry> callSchedule) {

    this.schedule = ArgChecker.notNull(schedule, "schedule");
    ArgChecker.notNegative(couponRate, "couponRate");
    this.couponRate = couponRate;
    this.notional = ArgChecker.notNegativeOrZero(notional, "notional");
    ArgChecker.noNulls(callSchedule, "callSchedule");
    this.callSchedule = ImmutableList.sortedCopyOf(Ordering.natural(), callSchedule);
  }

  /**
   * Obtains a non-callable bond with a notional of 100.
   *
   * @param schedule  the schedule
   * @param couponRate  the coupon rate
   * @return the bond
   */
  public static FixedCouponBond of(BondSchedule schedule, double couponRate) {
    return new FixedCouponBond(schedule, couponRate, DEFAULT_NOTIONAL, ImmutableList.of());
  }

  /**
   * Obtains a bond.
   *
   * @param schedule  the schedule
   * @param couponRate  the coupon rate
   * @param notional  the notional
   * @param callSchedule  the call schedule, possibly empty, in any order
   * @return the bond
   */
  public static FixedCouponBond of(
      BondSchedule schedule,
      double couponRate,
      double notional,
      List<CallScheduleEntry> callSchedule) {

    return new FixedCouponBond(schedule, couponRate, notional, callSchedule);
  }

  //-------------------------------------------------------------------------
  public BondSchedule getSchedule() {
    return schedule;
  }

  public double getCouponRate() {
    return couponRate;
  }

  public double getNotional() {
    return notional;
  }

  public ImmutableList<CallScheduleEntry> getCallSchedule() {
    return callSchedule;
  }

  public boolean isCallable() {
    return !callSchedule.isEmpty();
  }

  /**
   * Returns the coupon amount of a regular period.
   *
   * @return {@code notional * couponRate / frequency}
   */
  public double regularCoupon() {
    return notional * couponRate / schedule.getFrequency();
  }

  /**
   * Returns the first call strictly after the valuation date.
   *
   * @param valuationDate  the valuation date
   * @return the call, empty if none
   */
  public Optional<CallScheduleEntry> nextCall(LocalDate valuationDate) {
    return callSchedule.stream()
        .filter(c -> c.getDate().isAfter(valuationDate))
        .findFirst();
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FixedCouponBond)) {
      return false;
    }
    FixedCouponBond other = (FixedCouponBond) obj;
    return schedule.equals(other.schedule) &&
        Double.compare(couponRate, other.couponRate) == 0 &&
        Double.compare(notional, other.notional) == 0 &&
        callSchedule.equals(other.callSchedule);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schedule, couponRate, notional, callSchedule);
  }

  @Override
  public String toString() {
    return "FixedCouponBond[schedule=" + schedule + ", couponRate=" + couponRate + ", notional=" + notional +
        ", callSchedule=" + callSchedule + "]";
  }

}
