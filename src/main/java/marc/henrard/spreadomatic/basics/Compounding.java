/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

import java.util.Locale;

import com.opengamma.strata.collect.ArgChecker;

/**
 * Compounding convention of a rate.
 * <p>
 * The periodic conventions discount with {@code (1 + r/f)^(-f t)}, the continuous convention with {@code exp(-r t)}.
 * 
 * @author Marc Henrard
 */
public enum Compounding {

  /** Annual compounding. */
  ANNUAL(1),
  /** Semi-annual compounding. */
  SEMIANNUAL(2),
  /** Quarterly compounding. */
  QUARTERLY(4),
  /** Monthly compounding. */
  MONTHLY(12),
  /** Continuous compounding. */
  CONTINUOUS(0);

  /** The number of compounding periods per year, 0 for continuous. */
  private final int periodsPerYear;

  Compounding(int periodsPerYear) {
    this.periodsPerYear = periodsPerYear;
  }

  /**
   * Obtains the convention from a name or from the integer number of periods per year.
   * <p>
   * Names are case insensitive ("annual", "Semiannual", "CONTINUOUS", ...).
   * The accepted integers are 1, 2, 4 and 12.
   *
   * @param name  the name or the number of periods per year
   * @return the convention
   */
  public static Compounding of(String name) {
    ArgChecker.notBlank(name, "name");
    String normalized = name.trim().toUpperCase(Locale.ENGLISH).replace("-", "").replace("_", "");
    switch (normalized) {
      case "1":
        return ANNUAL;
      case "2":
        return SEMIANNUAL;
      case "4":
        return QUARTERLY;
      case "12":
        return MONTHLY;
      default:
        for (Compounding compounding : values()) {
          if (compounding.name().equals(normalized)) {
            return compounding;
          }
        }
        throw new IllegalArgumentException("Unsupported compounding convention: " + name);
    }
  }

  /**
   * Obtains the periodic convention with the given number of periods per year.
   *
   * @param periodsPerYear  the number of periods per year
   * @return the convention
   */
  public static Compounding ofPeriodsPerYear(int periodsPerYear) {
    for (Compounding compounding : values()) {
      if (compounding.periodsPerYear == periodsPerYear && compounding != CONTINUOUS) {
        return compounding;
      }
    }
    throw new IllegalArgumentException("Unsupported compounding frequency: " + periodsPerYear);
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the number of compounding periods per year.
   *
   * @return the number of periods, 0 for continuous compounding
   */
  public int getPeriodsPerYear() {
    return periodsPerYear;
  }

  /**
   * Returns true for continuous compounding.
   *
   * @return the flag
   */
  public boolean isContinuous() {
    return this == CONTINUOUS;
  }

  /**
   * Computes the discount factor for a rate and a time.
   *
   * @param rate  the rate in decimal
   * @param time  the time in years
   * @return the discount factor
   */
  public double discountFactor(double rate, double time) {
    if (isContinuous()) {
      return Math.exp(-rate * time);
    }
    return Math.pow(1.0d + rate / periodsPerYear, -periodsPerYear * time);
  }

  /**
   * Computes the derivative of the discount factor with respect to the rate.
   *
   * @param rate  the rate in decimal
   * @param time  the time in years
   * @return the derivative
   */
  public double discountFactorDerivative(double rate, double time) {
    if (isContinuous()) {
      return -time * Math.exp(-rate * time);
    }
    return -time * Math.pow(1.0d + rate / periodsPerYear, -periodsPerYear * time - 1.0d);
  }

  /**
   * Converts a rate in this convention to the equivalent continuously compounded rate.
   *
   * @param rate  the rate in this convention
   * @return the continuously compounded rate
   */
  public double toContinuous(double rate) {
    if (isContinuous()) {
      return rate;
    }
    return periodsPerYear * Math.log(1.0d + rate / periodsPerYear);
  }

  /**
   * Converts a continuously compounded rate to the equivalent rate in this convention.
   *
   * @param continuousRate  the continuously compounded rate
   * @return the rate in this convention
   */
  public double fromContinuous(double continuousRate) {
    if (isContinuous()) {
      return continuousRate;
    }
    return periodsPerYear * (Math.exp(continuousRate / periodsPerYear) - 1.0d);
  }

}
