/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.product.bond;

import java.time.LocalDate;
import java.util.Objects;

import com.opengamma.strata.collect.ArgChecker;

/**
 * A contractual payment: a payment date and the total amount paid.
 * 
 * @author Marc Henrard
 */
public final class ScheduledPayment {

  private final LocalDate date;
  private final double amount;

  private ScheduledPayment(LocalDate date, double amount) {
    this.date = ArgChecker.notNull(date, "date");
    this.amount = amount;
  }

  public static ScheduledPayment of(LocalDate date, double amount) {
    return new ScheduledPayment(date, amount);
  }

  public LocalDate getDate() {
    return date;
  }

  public double getAmount() {
    return amount;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ScheduledPayment)) {
      return false;
    }
    ScheduledPayment other = (ScheduledPayment) obj;
    return date.equals(other.date) && Double.compare(amount, other.amount) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(date, amount);
  }

  @Override
  public String toString() {
    return "ScheduledPayment[" + date + ", " + amount + "]";
  }

}
