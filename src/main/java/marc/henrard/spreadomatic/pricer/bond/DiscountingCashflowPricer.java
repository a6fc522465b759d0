/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.util.List;

import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.array.DoubleArray;

import marc.henrard.spreadomatic.basics.Compounding;
import marc.henrard.spreadomatic.basics.DegenerateInputException;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;
import marc.henrard.spreadomatic.product.bond.Cashflow;

/**
 * Present value of a stream of cash flows by discounting.
 * <p>
 * The cash flows are described by their times in years and their amounts. They are discounted either with a
 * zero curve plus a constant spread, or with a single flat yield.
 * 
 * @author Marc Henrard
 */
public class DiscountingCashflowPricer {

  /** The default instance. */
  public static final DiscountingCashflowPricer DEFAULT = new DiscountingCashflowPricer();

  /**
   * Returns the times of a list of cash flows.
   *
   * @param cashflows  the cash flows
   * @return the times
   */
  public static DoubleArray times(List<Cashflow> cashflows) {
    return DoubleArray.of(cashflows.size(), i -> cashflows.get(i).getTimeYears());
  }

  /**
   * Returns the total amounts of a list of cash flows.
   *
   * @param cashflows  the cash flows
   * @return the amounts
   */
  public static DoubleArray amounts(List<Cashflow> cashflows) {
    return DoubleArray.of(cashflows.size(), i -> cashflows.get(i).total());
  }

  //-------------------------------------------------------------------------
  /**
   * Computes the present value with a zero curve shifted by a spread.
   * <p>
   * Each amount is discounted at the curve rate interpolated at its time plus the spread.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param curve  the zero curve
   * @param spread  the spread added to the curve rates
   * @param compounding  the compounding of the curve rates and spread
   * @return the present value
   */
  public double presentValue(
      DoubleArray times,
      DoubleArray amounts,
      ZeroCurve curve,
      double spread,
      Compounding compounding) {

    checkSizes(times, amounts);
    ArgChecker.notNull(curve, "curve");
    double pv = 0.0d;
    for (int i = 0; i < times.size(); i++) {
      double t = times.get(i);
      pv += amounts.get(i) * compounding.discountFactor(curve.rateAt(t) + spread, t);
    }
    return pv;
  }

  /**
   * Computes the present value with a flat yield.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param yield  the yield
   * @param compounding  the compounding of the yield
   * @return the present value
   */
  public double presentValue(DoubleArray times, DoubleArray amounts, double yield, Compounding compounding) {
    checkSizes(times, amounts);
    double pv = 0.0d;
    for (int i = 0; i < times.size(); i++) {
      pv += amounts.get(i) * compounding.discountFactor(yield, times.get(i));
    }
    return pv;
  }

  /**
   * Computes the derivative of the flat yield present value with respect to the yield.
   *
   * @param times  the cash flow times
   * @param amounts  the cash flow amounts
   * @param yield  the yield
   * @param compounding  the compounding of the yield
   * @return the derivative
   */
  public double presentValueYieldDerivative(
      DoubleArray times,
      DoubleArray amounts,
      double yield,
      Compounding compounding) {

    checkSizes(times, amounts);
    double derivative = 0.0d;
    for (int i = 0; i < times.size(); i++) {
      derivative += amounts.get(i) * compounding.discountFactorDerivative(yield, times.get(i));
    }
    return derivative;
  }

  private static void checkSizes(DoubleArray times, DoubleArray amounts) {
    ArgChecker.notNull(times, "times");
    ArgChecker.notNull(amounts, "amounts");
    if (times.size() != amounts.size()) {
      throw new DegenerateInputException(
          "Cash flow times and amounts must have the same size, were {} and {}", times.size(), amounts.size());
    }
  }

}
