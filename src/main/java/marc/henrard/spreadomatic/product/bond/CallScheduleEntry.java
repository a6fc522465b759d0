/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.product.bond;

import java.time.LocalDate;
import java.util.Objects;

import com.opengamma.strata.collect.ArgChecker;

/**
 * A call date of a callable bond and the price paid on exercise, per 100 notional.
 * 
 * @author Marc Henrard
 */
public final class CallScheduleEntry implements Comparable<CallScheduleEntry> {

  private final LocalDate date;
  private final double price;

  private CallScheduleEntry(LocalDate date, double price) {
    this.date = ArgChecker.notNull(date, "date");
    this.price = ArgChecker.notNegativeOrZero(price, "price");
  }

  public static CallScheduleEntry of(LocalDate date, double price) {
    return new CallScheduleEntry(date, price);
  }

  public LocalDate getDate() {
    return date;
  }

  public double getPrice() {
    return price;
  }

  @Override
  public int compareTo(CallScheduleEntry other) {
    return date.compareTo(other.date);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CallScheduleEntry)) {
      return false;
    }
    CallScheduleEntry other = (CallScheduleEntry) obj;
    return date.equals(other.date) && Double.compare(price, other.price) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(date, price);
  }

  @Override
  public String toString() {
    return "CallScheduleEntry[" + date + ", " + price + "]";
  }

}
