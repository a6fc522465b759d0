/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.collect.ArgChecker;

/**
 * The lowest yield among the yield to maturity and the yields to the future call dates.
 * 
 * @author Marc Henrard
 */
public final class YieldToWorst {

  /**
   * The redemption scenario giving the worst yield.
   */
  public enum RedemptionType {
    /** Redemption at maturity. */
    MATURITY,
    /** Redemption at a call date. */
    CALL
  }

  private final double yield;
  private final LocalDate date;
  private final RedemptionType type;
  /** The yield of each scenario, by redemption date, ordered by date. */
  private final ImmutableMap<LocalDate, Double> allYields;

  private YieldToWorst(double yield, LocalDate date, RedemptionType type, Map<LocalDate, Double> allYields) {
    this.yield = yield;
    this.date = ArgChecker.notNull(date, "date");
    this.type = ArgChecker.notNull(type, "type");
    this.allYields = ImmutableMap.copyOf(allYields);
  }

  public static YieldToWorst of(double yield, LocalDate date, RedemptionType type, Map<LocalDate, Double> allYields) {
    return new YieldToWorst(yield, date, type, allYields);
  }

  public double getYield() {
    return yield;
  }

  public LocalDate getDate() {
    return date;
  }

  public RedemptionType getType() {
    return type;
  }

  public ImmutableMap<LocalDate, Double> getAllYields() {
    return allYields;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof YieldToWorst)) {
      return false;
    }
    YieldToWorst other = (YieldToWorst) obj;
    return Double.compare(yield, other.yield) == 0 && date.equals(other.date) && type == other.type &&
        allYields.equals(other.allYields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(yield, date, type, allYields);
  }

  @Override
  public String toString() {
    return "YieldToWorst[yield=" + yield + ", date=" + date + ", type=" + type + ", allYields=" + allYields + "]";
  }

}
