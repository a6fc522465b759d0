/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.product.bond;

import static com.opengamma.strata.collect.Guavate.toImmutableList;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.opengamma.strata.basics.ReferenceData;
import com.opengamma.strata.collect.ArgChecker;

import marc.henrard.spreadomatic.basics.DayBasis;

/**
 * Generates the contractual payments of fixed coupon bonds and the future cash flows seen from a valuation date.
 * <p>
 * The payment dates are adjusted with the schedule's business day adjustment, using the reference data
 * provided at construction. The time to each future cash flow is measured with the time basis, by default
 * ACT/ACT.
 * 
 * @author Marc Henrard
 */
public final class CashflowScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(CashflowScheduler.class);

  /** The default instance, standard reference data and ACT/ACT times. */
  public static final CashflowScheduler DEFAULT = new CashflowScheduler(ReferenceData.standard(), DayBasis.ACT_ACT);

  /** Difference between the accrual fraction and the regular period above which a period is irregular. */
  private static final double IRREGULAR_PERIOD_TOLERANCE = 0.01d;
  /** Tolerance to identify a principal only payment. */
  private static final double PRINCIPAL_TOLERANCE = 0.01d;
  /** Maximal number of days between a coupon and a principal only maturity payment for them to be combined. */
  private static final long COMBINE_DAYS = 7;

  private final ReferenceData refData;
  private final DayBasis timeBasis;

  /**
   * Creates an instance.
   *
   * @param refData  the reference data used for payment date adjustments
   * @param timeBasis  the basis of the time to payment
   */
  public CashflowScheduler(ReferenceData refData, DayBasis timeBasis) {
    this.refData = ArgChecker.notNull(refData, "refData");
    this.timeBasis = ArgChecker.notNull(timeBasis, "timeBasis");
  }

  public DayBasis getTimeBasis() {
    return timeBasis;
  }

  //-------------------------------------------------------------------------
  /**
   * Generates the full contractual schedule of a bond.
   * <p>
   * Coupons are paid on the coupon dates before maturity. The last payment, at maturity, bundles the final coupon
   * and the notional. A regular period pays {@code notional * couponRate / frequency}; an irregular first or last
   * period pays the coupon rate times the accrual fraction.
   *
   * @param bond  the bond
   * @return the payments, ordered by date
   */
  public ImmutableList<ScheduledPayment> generateSchedule(FixedCouponBond bond) {
    BondSchedule schedule = bond.getSchedule();
    double regularPeriod = 1.0d / schedule.getFrequency();
    ImmutableList.Builder<ScheduledPayment> payments = ImmutableList.builder();
    LocalDate previous = schedule.getIssueDate();
    LocalDate couponDate = schedule.couponDate(0);
    for (int k = 1; couponDate.isBefore(schedule.getMaturityDate()); k++) {
      LocalDate paymentDate = schedule.getPaymentAdjustment().adjust(couponDate, refData);
      double amount = bond.regularCoupon();
      if (previous.equals(schedule.getIssueDate())) {
        double accrual = schedule.getDayBasis().yearFraction(previous, paymentDate);
        if (Math.abs(accrual - regularPeriod) > IRREGULAR_PERIOD_TOLERANCE) {
          amount = bond.getNotional() * bond.getCouponRate() * accrual;
        }
      }
      payments.add(ScheduledPayment.of(paymentDate, amount));
      previous = couponDate;
      couponDate = schedule.couponDate(k);
    }
    LocalDate maturityPayment = schedule.getPaymentAdjustment().adjust(schedule.getMaturityDate(), refData);
    double finalAccrual = schedule.getDayBasis().yearFraction(previous, maturityPayment);
    double finalCoupon = Math.abs(finalAccrual - regularPeriod) > IRREGULAR_PERIOD_TOLERANCE ?
        bond.getNotional() * bond.getCouponRate() * finalAccrual :
        bond.regularCoupon();
    payments.add(ScheduledPayment.of(maturityPayment, finalCoupon + bond.getNotional()));
    return payments.build();
  }

  /**
   * Returns the cash flows of the schedule paid strictly after the valuation date.
   * <p>
   * The last payment of the schedule is the maturity payment; it is split between the notional and the coupon.
   * A coupon paid at most 7 days before a principal only maturity payment is combined with it at the maturity
   * date. A principal only maturity payment which is not preceded by such a coupon gets the regular coupon
   * added back.
   *
   * @param bond  the bond
   * @param schedule  the contractual schedule, ordered by date
   * @param valuationDate  the valuation date
   * @return the cash flows, ordered by date
   */
  public ImmutableList<Cashflow> futureCashflows(
      FixedCouponBond bond,
      List<ScheduledPayment> schedule,
      LocalDate valuationDate) {

    ArgChecker.notNull(bond, "bond");
    ArgChecker.notEmpty(schedule, "schedule");
    ArgChecker.notNull(valuationDate, "valuationDate");
    double notional = bond.getNotional();
    ScheduledPayment maturity = schedule.get(schedule.size() - 1);
    List<ScheduledPayment> future = new ArrayList<>();
    for (ScheduledPayment payment : schedule) {
      if (payment.getDate().isAfter(valuationDate)) {
        future.add(payment);
      }
    }
    ImmutableList.Builder<Cashflow> cashflows = ImmutableList.builder();
    int i = 0;
    while (i < future.size()) {
      ScheduledPayment payment = future.get(i);
      if (payment == maturity) {
        double coupon;
        if (Math.abs(payment.getAmount() - notional) < PRINCIPAL_TOLERANCE) {
          coupon = bond.regularCoupon();
          LOGGER.warn("Maturity payment on {} only contains the notional, adding the final coupon {}",
              payment.getDate(), coupon);
        } else {
          coupon = Math.max(0.0d, payment.getAmount() - notional);
        }
        cashflows.add(cashflow(valuationDate, payment.getDate(), coupon, notional));
        i++;
      } else if (i + 1 < future.size() && future.get(i + 1) == maturity &&
          ChronoUnit.DAYS.between(payment.getDate(), maturity.getDate()) <= COMBINE_DAYS &&
          Math.abs(maturity.getAmount() - notional) < PRINCIPAL_TOLERANCE) {
        cashflows.add(cashflow(valuationDate, maturity.getDate(), payment.getAmount(), notional));
        i += 2;
      } else {
        cashflows.add(cashflow(valuationDate, payment.getDate(), payment.getAmount(), 0.0d));
        i++;
      }
    }
    return cashflows.build();
  }

  /**
   * Generates the schedule of the bond and returns the cash flows after the valuation date.
   *
   * @param bond  the bond
   * @param valuationDate  the valuation date
   * @return the cash flows, ordered by date
   */
  public ImmutableList<Cashflow> futureCashflows(FixedCouponBond bond, LocalDate valuationDate) {
    return futureCashflows(bond, generateSchedule(bond), valuationDate);
  }

  /**
   * Returns the payments of the schedule strictly after the valuation date, as coupons.
   * <p>
   * The time to payment is measured with the given basis.
   *
   * @param schedule  the contractual schedule, ordered by date
   * @param valuationDate  the valuation date
   * @param dayBasis  the basis of the time to payment
   * @return the cash flows, ordered by date
   */
  public ImmutableList<Cashflow> paymentsAfter(
      List<ScheduledPayment> schedule,
      LocalDate valuationDate,
      DayBasis dayBasis) {

    return schedule.stream()
        .filter(p -> p.getDate().isAfter(valuationDate))
        .map(p -> Cashflow.of(p.getDate(), dayBasis.yearFraction(valuationDate, p.getDate()), p.getAmount(), 0.0d))
        .collect(toImmutableList());
  }

  /**
   * Returns the cash flows of a bond assumed to be redeemed on a call date.
   * <p>
   * The payments strictly after the valuation date and on or before the call date are kept as coupons and the call
   * price is paid on the call date. A call on or after the last payment of the schedule does not shorten the bond;
   * the payments are then returned in full, as coupons.
   *
   * @param schedule  the contractual schedule, ordered by date
   * @param valuationDate  the valuation date
   * @param callDate  the call date
   * @param callPrice  the call price
   * @param dayBasis  the basis of the time to payment
   * @return the cash flows, ordered by date
   */
  public ImmutableList<Cashflow> cashflowsToCall(
      List<ScheduledPayment> schedule,
      LocalDate valuationDate,
      LocalDate callDate,
      double callPrice,
      DayBasis dayBasis) {

    ArgChecker.notEmpty(schedule, "schedule");
    ArgChecker.inOrderNotEqual(valuationDate, callDate, "valuationDate", "callDate");
    LocalDate lastPaymentDate = schedule.get(schedule.size() - 1).getDate();
    boolean truncated = callDate.isBefore(lastPaymentDate);
    ImmutableList.Builder<Cashflow> cashflows = ImmutableList.builder();
    boolean redeemed = false;
    for (ScheduledPayment payment : schedule) {
      LocalDate date = payment.getDate();
      if (!date.isAfter(valuationDate) || (truncated && date.isAfter(callDate))) {
        continue;
      }
      double time = dayBasis.yearFraction(valuationDate, date);
      if (truncated && date.equals(callDate)) {
        cashflows.add(Cashflow.of(date, time, payment.getAmount(), callPrice));
        redeemed = true;
      } else {
        cashflows.add(Cashflow.of(date, time, payment.getAmount(), 0.0d));
      }
    }
    if (truncated && !redeemed) {
      cashflows.add(Cashflow.of(callDate, dayBasis.yearFraction(valuationDate, callDate), 0.0d, callPrice));
    }
    return cashflows.build();
  }

  private Cashflow cashflow(LocalDate valuationDate, LocalDate paymentDate, double coupon, double principal) {
    return Cashflow.of(paymentDate, timeBasis.yearFraction(valuationDate, paymentDate), coupon, principal);
  }

}
