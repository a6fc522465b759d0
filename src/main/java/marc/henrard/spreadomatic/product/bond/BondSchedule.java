/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.product.bond;

import java.time.LocalDate;
import java.util.Objects;

import com.opengamma.strata.basics.date.BusinessDayAdjustment;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.spreadomatic.basics.DayBasis;

/**
 * The dates and conventions describing the coupon schedule of a fixed coupon bond.
 * <p>
 * The coupon dates are the first coupon date and the dates obtained by adding a whole number of coupon periods
 * to it, strictly before maturity. The last payment is on the maturity date.
 * 
 * @author Marc Henrard
 */
public final class BondSchedule {

  private final LocalDate issueDate;
  private final LocalDate firstCouponDate;
  private final LocalDate maturityDate;
  /** Number of coupon payments per year. */
  private final int frequency;
  private final DayBasis dayBasis;
  /** Adjustment of the payment dates. */
  private final BusinessDayAdjustment paymentAdjustment;

  private BondSchedule(
      LocalDate issueDate,
      LocalDate firstCouponDate,
      LocalDate maturityDate,
      int frequency,
      DayBasis dayBasis,
      BusinessDayAdjustment paymentAdjustment) {

    this.issueDate = ArgChecker.notNull(issueDate, "issueDate");
    this.firstCouponDate = ArgChecker.notNull(firstCouponDate, "firstCouponDate");
    this.maturityDate = ArgChecker.notNull(maturityDate, "maturityDate");
    this.dayBasis = ArgChecker.notNull(dayBasis, "dayBasis");
    this.paymentAdjustment = ArgChecker.notNull(paymentAdjustment, "paymentAdjustment");
    ArgChecker.isTrue(frequency >= 1 && 12 % frequency == 0,
        "coupon frequency must be 1, 2, 3, 4, 6 or 12, was {}", frequency);
    ArgChecker.inOrderNotEqual(issueDate, firstCouponDate, "issueDate", "firstCouponDate");
    ArgChecker.inOrderOrEqual(firstCouponDate, maturityDate, "firstCouponDate", "maturityDate");
    this.frequency = frequency;
  }

  /**
   * Obtains a schedule with unadjusted payment dates.
   *
   * @param issueDate  the issue date
   * @param firstCouponDate  the first coupon date
   * @param maturityDate  the maturity date
   * @param frequency  the number of coupons per year
   * @param dayBasis  the day count basis
   * @return the schedule
   */
  public static BondSchedule of(
      LocalDate issueDate,
      LocalDate firstCouponDate,
      LocalDate maturityDate,
      int frequency,
      DayBasis dayBasis) {

    return new BondSchedule(issueDate, firstCouponDate, maturityDate, frequency, dayBasis, BusinessDayAdjustment.NONE);
  }

  /**
   * Obtains a schedule with adjusted payment dates.
   *
   * @param issueDate  the issue date
   * @param firstCouponDate  the first coupon date
   * @param maturityDate  the maturity date
   * @param frequency  the number of coupons per year
   * @param dayBasis  the day count basis
   * @param paymentAdjustment  the payment date adjustment
   * @return the schedule
   */
  public static BondSchedule of(
      LocalDate issueDate,
      LocalDate firstCouponDate,
      LocalDate maturityDate,
      int frequency,
      DayBasis dayBasis,
      BusinessDayAdjustment paymentAdjustment) {

    return new BondSchedule(issueDate, firstCouponDate, maturityDate, frequency, dayBasis, paymentAdjustment);
  }

  //-------------------------------------------------------------------------
  public LocalDate getIssueDate() {
    return issueDate;
  }

  public LocalDate getFirstCouponDate() {
    return firstCouponDate;
  }

  public LocalDate getMaturityDate() {
    return maturityDate;
  }

  public int getFrequency() {
    return frequency;
  }

  public DayBasis getDayBasis() {
    return dayBasis;
  }

  public BusinessDayAdjustment getPaymentAdjustment() {
    return paymentAdjustment;
  }

  /**
   * Returns the number of months in a coupon period.
   *
   * @return the number of months
   */
  public int getPeriodMonths() {
    return 12 / frequency;
  }

  /**
   * Returns the k-th unadjusted coupon date, k = 0 being the first coupon date.
   * <p>
   * The date is computed from the first coupon date, so that month-end clamping does not accumulate.
   *
   * @param k  the coupon index
   * @return the date
   */
  public LocalDate couponDate(int k) {
    return firstCouponDate.plusMonths((long) k * getPeriodMonths());
  }

  //-------------------------------------------------------------------------
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof BondSchedule)) {
      return false;
    }
    BondSchedule other = (BondSchedule) obj;
    return issueDate.equals(other.issueDate) &&
        firstCouponDate.equals(other.firstCouponDate) &&
        maturityDate.equals(other.maturityDate) &&
        frequency == other.frequency &&
        dayBasis == other.dayBasis &&
        paymentAdjustment.equals(other.paymentAdjustment);
  }

  @Override
  public int hashCode() {
    return Objects.hash(issueDate, firstCouponDate, maturityDate, frequency, dayBasis, paymentAdjustment);
  }

  @Override
  public String toString() {
    return "BondSchedule[issue=" + issueDate + ", firstCoupon=" + firstCouponDate + ", maturity=" + maturityDate +
        ", frequency=" + frequency + ", dayBasis=" + dayBasis + "]";
  }

}
