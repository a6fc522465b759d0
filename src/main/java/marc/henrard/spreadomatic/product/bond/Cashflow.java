/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.product.bond;

import java.time.LocalDate;
import java.util.Objects;

import com.opengamma.strata.collect.ArgChecker;

/**
 * A future cash flow of a bond, split between coupon and principal.
 * <p>
 * The time is the year fraction between the valuation date and the payment date.
 * 
 * @author Marc Henrard
 */
public final class Cashflow {

  private final LocalDate date;
  private final double timeYears;
  private final double coupon;
  private final double principal;

  private Cashflow(LocalDate date, double timeYears, double coupon, double principal) {
    this.date = ArgChecker.notNull(date, "date");
    this.timeYears = timeYears;
    this.coupon = coupon;
    this.principal = principal;
  }

  /**
   * Creates a cash flow.
   *
   * @param date  the payment date
   * @param timeYears  the time to payment in years
   * @param coupon  the coupon part
   * @param principal  the principal part
   * @return the cash flow
   */
  public static Cashflow of(LocalDate date, double timeYears, double coupon, double principal) {
    return new Cashflow(date, timeYears, coupon, principal);
  }

  public LocalDate getDate() {
    return date;
  }

  public double getTimeYears() {
    return timeYears;
  }

  public double getCoupon() {
    return coupon;
  }

  public double getPrincipal() {
    return principal;
  }

  /**
   * Returns the total amount paid.
   *
   * @return coupon plus principal
   */
  public double total() {
    return coupon + principal;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Cashflow)) {
      return false;
    }
    Cashflow other = (Cashflow) obj;
    return date.equals(other.date) &&
        Double.compare(timeYears, other.timeYears) == 0 &&
        Double.compare(coupon, other.coupon) == 0 &&
        Double.compare(principal, other.principal) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(date, timeYears, coupon, principal);
  }

  @Override
  public String toString() {
    return "Cashflow[date=" + date + ", time=" + timeYears + ", coupon=" + coupon + ", principal=" + principal + "]";
  }

}
