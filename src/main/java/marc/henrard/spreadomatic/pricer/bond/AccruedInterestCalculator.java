/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.time.LocalDate;
import java.util.List;

import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.spreadomatic.basics.DayBasis;
import marc.henrard.spreadomatic.product.bond.FixedCouponBond;
import marc.henrard.spreadomatic.product.bond.ScheduledPayment;

/**
 * Accrued interest of a fixed coupon bond and the conversion between clean and dirty prices.
 * <p>
 * The accrued interest is the coupon of the current period times the fraction of the period elapsed, the
 * fractions being measured with the day basis of the bond.
 * 
 * @author Marc Henrard
 */
public class AccruedInterestCalculator {

  /** The default instance. */
  public static final AccruedInterestCalculator DEFAULT = new AccruedInterestCalculator();

  /**
   * Computes the accrued interest.
   * <p>
   * The accrued interest is 0 before issue, on payment dates and on or after the last payment.
   *
   * @param bond  the bond
   * @param schedule  the contractual payments of the bond, ordered by date
   * @param valuationDate  the valuation date
   * @return the accrued interest
   */
  public double accruedInterest(FixedCouponBond bond, List<ScheduledPayment> schedule, LocalDate valuationDate) {
    ArgChecker.notNull(bond, "bond");
    ArgChecker.notEmpty(schedule, "schedule");
    ArgChecker.notNull(valuationDate, "valuationDate");
    LocalDate issueDate = bond.getSchedule().getIssueDate();
    if (!valuationDate.isAfter(issueDate)) {
      return 0.0d;
    }
    LocalDate periodStart = issueDate;
    for (int i = 0; i < schedule.size(); i++) {
      ScheduledPayment payment = schedule.get(i);
      if (!payment.getDate().isAfter(valuationDate)) {
        periodStart = payment.getDate();
        continue;
      }
      if (periodStart.equals(valuationDate)) {
        return 0.0d;
      }
      boolean last = i == schedule.size() - 1;
      double coupon = last ? Math.max(0.0d, payment.getAmount() - bond.getNotional()) : payment.getAmount();
      DayBasis dayBasis = bond.getSchedule().getDayBasis();
      double period = dayBasis.yearFraction(periodStart, payment.getDate());
      if (period <= 0.0d) {
        return 0.0d;
      }
      double elapsed = dayBasis.yearFraction(periodStart, valuationDate);
      return coupon * Math.min(Math.max(elapsed / period, 0.0d), 1.0d);
    }
    return 0.0d;
  }

  /**
   * Computes the dirty price from the clean price.
   *
   * @param cleanPrice  the clean price
   * @param bond  the bond
   * @param schedule  the contractual payments
   * @param valuationDate  the valuation date
   * @return the dirty price
   */
  public double dirtyPrice(
      double cleanPrice,
      FixedCouponBond bond,
      List<ScheduledPayment> schedule,
      LocalDate valuationDate) {

    return cleanPrice + accruedInterest(bond, schedule, valuationDate);
  }

  /**
   * Computes the clean price from the dirty price.
   *
   * @param dirtyPrice  the dirty price
   * @param bond  the bond
   * @param schedule  the contractual payments
   * @param valuationDate  the valuation date
   * @return the clean price
   */
  public double cleanPrice(
      double dirtyPrice,
      FixedCouponBond bond,
      List<ScheduledPayment> schedule,
      LocalDate valuationDate) {

    return dirtyPrice - accruedInterest(bond, schedule, valuationDate);
  }

}
