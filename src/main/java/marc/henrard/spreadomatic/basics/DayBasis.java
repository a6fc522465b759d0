/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.basics.date.DayCount;
import com.opengamma.strata.basics.date.DayCounts;
import com.opengamma.strata.collect.ArgChecker;

/**
 * Day-count basis used to convert date differences into year fractions.
 * <p>
 * Each basis delegates to the corresponding Strata {@link DayCount}.
 * 
 * @author Marc Henrard
 */
public enum DayBasis {

  /** Actual/Actual, ISDA split by calendar year. */
  ACT_ACT(DayCounts.ACT_ACT_ISDA),
  /** Actual/360. */
  ACT_360(DayCounts.ACT_360),
  /** Actual/365 fixed. */
  ACT_365(DayCounts.ACT_365F),
  /** 30/360 ISDA (bond basis). */
  THIRTY_360(DayCounts.THIRTY_360_ISDA),
  /** 30E/360 (Eurobond basis). */
  THIRTY_E_360(DayCounts.THIRTY_E_360),
  /** 30/360 US. */
  THIRTY_360_US(DayCounts.THIRTY_U_360);

  /* Usual spellings found in static data, after upper-casing and removing spaces. */
  private static final Map<String, DayBasis> ALIASES = ImmutableMap.<String, DayBasis>builder()
      .put("ACT/ACT", ACT_ACT)
      .put("ACT", ACT_ACT)
      .put("ACT/ACT-ISDA", ACT_ACT)
      .put("ISDA", ACT_ACT)
      .put("ACT/360", ACT_360)
      .put("ACT/365", ACT_365)
      .put("ACT/365F", ACT_365)
      .put("30/360", THIRTY_360)
      .put("30/360ISDA", THIRTY_360)
      .put("30E/360", THIRTY_E_360)
      .put("30/360E", THIRTY_E_360)
      .put("30E", THIRTY_E_360)
      .put("30/360US", THIRTY_360_US)
      .put("30/360-US", THIRTY_360_US)
      .put("US30/360", THIRTY_360_US)
      .put("30/360U", THIRTY_360_US)
      .put("30U/360", THIRTY_360_US)
      .build();

  /** The underlying day count. */
  private final DayCount dayCount;

  DayBasis(DayCount dayCount) {
    this.dayCount = dayCount;
  }

  /**
   * Obtains the basis from its usual market spelling or from the enum name.
   *
   * @param name  the name, for example "ACT/ACT", "30/360 US" or "THIRTY_E_360"
   * @return the basis
   */
  public static DayBasis of(String name) {
    ArgChecker.notBlank(name, "name");
    String normalized = name.trim().toUpperCase(Locale.ENGLISH).replace(" ", "");
    return find(normalized)
        .orElseThrow(() -> new IllegalArgumentException("Unsupported day-count basis: " + name));
  }

  private static Optional<DayBasis> find(String normalized) {
    DayBasis alias = ALIASES.get(normalized);
    if (alias != null) {
      return Optional.of(alias);
    }
    for (DayBasis basis : values()) {
      if (basis.name().equals(normalized)) {
        return Optional.of(basis);
      }
    }
    return Optional.empty();
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the Strata day count.
   *
   * @return the day count
   */
  public DayCount getDayCount() {
    return dayCount;
  }

  /**
   * Computes the year fraction between two dates.
   * <p>
   * The result is negative when the end date is before the start date.
   *
   * @param start  the start date
   * @param end  the end date
   * @return the year fraction
   */
  public double yearFraction(LocalDate start, LocalDate end) {
    return dayCount.relativeYearFraction(start, end);
  }

}
