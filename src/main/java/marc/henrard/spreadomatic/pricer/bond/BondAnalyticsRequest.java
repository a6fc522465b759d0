/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.time.LocalDate;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.spreadomatic.basics.AnalyticsSettings;
import marc.henrard.spreadomatic.basics.DayBasis;
import marc.henrard.spreadomatic.basics.DegenerateInputException;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;
import marc.henrard.spreadomatic.product.bond.CallScheduleEntry;
import marc.henrard.spreadomatic.product.bond.Cashflow;

/**
 * The inputs of a bond analytics calculation, validated at construction.
 * <p>
 * The price is positive, there is at least one cash flow, all cash flow times are positive and the curve
 * has at least two nodes. Otherwise a {@link DegenerateInputException} is thrown.
 * 
 * @author Marc Henrard
 */
public final class BondAnalyticsRequest {

  private final LocalDate valuationDate;
  private final double dirtyPrice;
  private final ImmutableList<Cashflow> cashflows;
  private final ZeroCurve curve;
  private final int frequency;
  private final DayBasis dayBasis;
  private final ImmutableList<CallScheduleEntry> callSchedule;
  private final AnalyticsSettings settings;

  private BondAnalyticsRequest(
      LocalDate valuationDate,
      double dirtyPrice,
      List<Cashflow> cashflows,
      ZeroCurve curve,
      int frequency,
      DayBasis dayBasis,
      List<CallScheduleEntry> callSchedule,
      AnalyticsSettings settings) {

    this.valuationDate = ArgChecker.notNull(valuationDate, "valuationDate");
    ArgChecker.notNull(cashflows, "cashflows");
    this.curve = ArgChecker.notNull(curve, "curve");
    this.dayBasis = ArgChecker.notNull(dayBasis, "dayBasis");
    ArgChecker.noNulls(callSchedule, "callSchedule");
    this.settings = ArgChecker.notNull(settings, "settings");
    ArgChecker.notNegativeOrZero(frequency, "frequency");
    if (!(dirtyPrice > 0.0d)) {
      throw new DegenerateInputException("Price must be positive, was {}", dirtyPrice);
    }
    if (cashflows.isEmpty()) {
      throw new DegenerateInputException("At least one future cash flow is required");
    }
    for (Cashflow cashflow : cashflows) {
      if (!(cashflow.getTimeYears() > 0.0d)) {
        throw new DegenerateInputException(
            "Cash flow times must be positive, found {} for payment on {}", cashflow.getTimeYears(), cashflow.getDate());
      }
    }
    if (curve.size() < 2) {
      throw new DegenerateInputException("Curve must have at least 2 nodes, has {}", curve.size());
    }
    this.dirtyPrice = dirtyPrice;
    this.cashflows = ImmutableList.copyOf(cashflows);
    this.frequency = frequency;
    this.callSchedule = ImmutableList.sortedCopyOf(Ordering.natural(), callSchedule);
  }

  /**
   * Obtains a request.
   *
   * @param valuationDate  the valuation date
   * @param dirtyPrice  the dirty price
   * @param cashflows  the future cash flows, ordered by date
   * @param curve  the zero curve
   * @param frequency  the coupon frequency
   * @param dayBasis  the day basis of the bond
   * @param callSchedule  the call schedule, possibly empty
   * @param settings  the analytics settings
   * @return the request
   */
  public static BondAnalyticsRequest of(
      LocalDate valuationDate,
      double dirtyPrice,
      List<Cashflow> cashflows,
      ZeroCurve curve,
      int frequency,
      DayBasis dayBasis,
      List<CallScheduleEntry> callSchedule,
      AnalyticsSettings settings) {

    return new BondAnalyticsRequest(
        valuationDate, dirtyPrice, cashflows, curve, frequency, dayBasis, callSchedule, settings);
  }

  /**
   * Obtains a request for a non-callable bond with the default settings.
   *
   * @param valuationDate  the valuation date
   * @param dirtyPrice  the dirty price
   * @param cashflows  the future cash flows, ordered by date
   * @param curve  the zero curve
   * @param frequency  the coupon frequency
   * @param dayBasis  the day basis of the bond
   * @return the request
   */
  public static BondAnalyticsRequest of(
      LocalDate valuationDate,
      double dirtyPrice,
      List<Cashflow> cashflows,
      ZeroCurve curve,
      int frequency,
      DayBasis dayBasis) {

    return new BondAnalyticsRequest(
        valuationDate, dirtyPrice, cashflows, curve, frequency, dayBasis, ImmutableList.of(), AnalyticsSettings.DEFAULT);
  }

  //-------------------------------------------------------------------------
  public LocalDate getValuationDate() {
    return valuationDate;
  }

  public double getDirtyPrice() {
    return dirtyPrice;
  }

  public ImmutableList<Cashflow> getCashflows() {
    return cashflows;
  }

  public ZeroCurve getCurve() {
    return curve;
  }

  public int getFrequency() {
    return frequency;
  }

  public DayBasis getDayBasis() {
    return dayBasis;
  }

  public ImmutableList<CallScheduleEntry> getCallSchedule() {
    return callSchedule;
  }

  public AnalyticsSettings getSettings() {
    return settings;
  }

}
