/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import marc.henrard.spreadomatic.basics.AnalyticsSettings;
import marc.henrard.spreadomatic.basics.GSpreadBasis;
import marc.henrard.spreadomatic.data.exporter.ExportUtils;
import marc.henrard.spreadomatic.dataset.BondDataSet;
import marc.henrard.spreadomatic.dataset.ZeroCurveDataSet;
import marc.henrard.spreadomatic.market.curve.ZeroCurve;
import marc.henrard.spreadomatic.product.bond.Cashflow;
import marc.henrard.spreadomatic.product.bond.CashflowScheduler;
import marc.henrard.spreadomatic.product.bond.FixedCouponBond;
import marc.henrard.spreadomatic.product.bond.ScheduledPayment;

/**
 * Spreads, durations and yield to worst of bonds across a range of prices, on an upward sloping and on an
 * inverted curve.
 * 
 * @author Marc Henrard
 */
public class BondSpreadAnalysis {

  private static final LocalDate ANALYSIS_DATE = LocalDate.of(2024, 6, 28);
  private static final ZeroCurve USD_CURVE = ZeroCurveDataSet.curve(ZeroCurveDataSet.USD_TREASURY_20240628);
  private static final ZeroCurve EUR_CURVE = ZeroCurveDataSet.curve(ZeroCurveDataSet.EUR_INVERTED_20230915);
  private static final FixedCouponBond BOND = BondDataSet.BOND_10Y_4PC;
  private static final FixedCouponBond CALLABLE = BondDataSet.CALLABLE_7Y_6PC;
  private static final CashflowScheduler SCHEDULER = CashflowScheduler.DEFAULT;
  private static final BondAnalyticsCalculator CALCULATOR = BondAnalyticsCalculator.DEFAULT;
  private static final BondAnalyticsCalculator CALCULATOR_PAR =
      new BondAnalyticsCalculator(AnalyticsSettings.DEFAULT.withGSpreadBasis(GSpreadBasis.PAR), SCHEDULER);

  private static final double[] PRICES = {90.0d, 94.0d, 98.0d, 100.0d, 102.0d, 106.0d, 110.0d};

  private static final String PATH_OUTPUT = "target/analysis/output/";

  /**
   * Spreads of the bullet bond against the price, G-spread on both government rate bases.
   * 
   * @throws IOException
   */
  @Test
  public void spreads_by_price() throws IOException {
    for (ZeroCurve curve : new ZeroCurve[] {USD_CURVE, EUR_CURVE}) {
      double[][] values = new double[PRICES.length][];
      for (int i = 0; i < PRICES.length; i++) {
        BondAnalytics analytics = CALCULATOR.calculate(BOND, ANALYSIS_DATE, PRICES[i], curve);
        BondAnalytics analyticsPar = CALCULATOR_PAR.calculate(BOND, ANALYSIS_DATE, PRICES[i], curve);
        values[i] = new double[] {
            PRICES[i],
            analytics.getYtm().getValue(),
            analytics.getZSpread().getValue(),
            analytics.getGSpread().getValue(),
            analyticsPar.getGSpread().getValue(),
            analytics.getEffectiveDuration().getValue(),
            analytics.getModifiedDuration().getValue(),
            analytics.getConvexity().getValue()};
      }
      StringBuilder builder = new StringBuilder();
      ExportUtils.exportArray(
          new String[] {"Price", "YTM", "Z-spread", "G-spread zero", "G-spread par", "ED", "MD", "Convexity"},
          values,
          builder);
      System.out.println(builder.toString());
    }
  }

  /**
   * Yield to each call and to maturity of the callable bond against the price.
   * 
   * @throws IOException
   */
  @Test
  public void yield_to_worst_by_price() throws IOException {
    List<ScheduledPayment> schedule = SCHEDULER.generateSchedule(CALLABLE);
    StringBuilder builder = new StringBuilder();
    builder.append("Price, Worst yield, Worst date, Type\n");
    for (double price : PRICES) {
      YieldToWorst ytw = YieldToWorstCalculator.DEFAULT.calculate(
          schedule,
          CALLABLE.getCallSchedule(),
          ANALYSIS_DATE,
          SCHEDULER.getTimeBasis(),
          price,
          AnalyticsSettings.DEFAULT.getCompounding());
      builder.append(price + ", " + ytw.getYield() + ", " + ytw.getDate() + ", " + ytw.getType() + "\n");
    }
    System.out.println(builder.toString());
    ExportUtils.exportString(builder.toString(), PATH_OUTPUT + "callable-ytw-" + ANALYSIS_DATE.toString() + ".csv");
  }

  /**
   * Cash flows and full analytics of the callable bond, exported to a csv file.
   * 
   * @throws IOException
   */
  @Test
  public void callable_analytics_export() throws IOException {
    List<Cashflow> cashflows = SCHEDULER.futureCashflows(CALLABLE, ANALYSIS_DATE);
    BondAnalytics analytics = CALCULATOR.calculate(CALLABLE, ANALYSIS_DATE, 103.5d, USD_CURVE);
    StringBuilder builder = new StringBuilder();
    ExportUtils.exportCashflows(cashflows, builder);
    builder.append("\n");
    ExportUtils.exportAnalytics(analytics, builder);
    System.out.println(builder.toString());
    ExportUtils.exportString(
        builder.toString(), PATH_OUTPUT + "callable-analytics-" + ANALYSIS_DATE.toString() + ".csv");
  }

}
