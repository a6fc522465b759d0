/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.pricer.bond;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.opengamma.strata.basics.date.Tenor;
import com.opengamma.strata.collect.ArgChecker;
import com.opengamma.strata.collect.result.Result;

/**
 * The analytics of a bond, one result per measure.
 * <p>
 * Each measure is a success or a failure independently of the others. The diagnostics list the solves which did
 * not reach the tolerance; their best estimates are still reported as successes.
 * 
 * @author Marc Henrard
 */
public final class BondAnalytics {

  private final Result<Double> ytm;
  private final Result<Double> zSpread;
  private final Result<Double> gSpread;
  private final Result<Double> effectiveDuration;
  private final Result<Double> modifiedDuration;
  private final Result<Double> convexity;
  private final Result<Double> spreadDuration;
  private final Result<Double> dv01;
  private final Result<ImmutableMap<Tenor, Double>> keyRateDurations;
  private final Result<Double> oas;
  private final Result<YieldToWorst> yieldToWorst;
  private final ImmutableList<String> diagnostics;

  private BondAnalytics(Builder builder) {
    this.ytm = ArgChecker.notNull(builder.ytm, "ytm");
    this.zSpread = ArgChecker.notNull(builder.zSpread, "zSpread");
    this.gSpread = ArgChecker.notNull(builder.gSpread, "gSpread");
    this.effectiveDuration = ArgChecker.notNull(builder.effectiveDuration, "effectiveDuration");
    this.modifiedDuration = ArgChecker.notNull(builder.modifiedDuration, "modifiedDuration");
    this.convexity = ArgChecker.notNull(builder.convexity, "convexity");
    this.spreadDuration = ArgChecker.notNull(builder.spreadDuration, "spreadDuration");
    this.dv01 = ArgChecker.notNull(builder.dv01, "dv01");
    this.keyRateDurations = ArgChecker.notNull(builder.keyRateDurations, "keyRateDurations");
    this.oas = ArgChecker.notNull(builder.oas, "oas");
    this.yieldToWorst = ArgChecker.notNull(builder.yieldToWorst, "yieldToWorst");
    this.diagnostics = ImmutableList.copyOf(builder.diagnostics);
  }

  static Builder builder() {
    return new Builder();
  }

  //-------------------------------------------------------------------------
  public Result<Double> getYtm() {
    return ytm;
  }

  public Result<Double> getZSpread() {
    return zSpread;
  }

  public Result<Double> getGSpread() {
    return gSpread;
  }

  public Result<Double> getEffectiveDuration() {
    return effectiveDuration;
  }

  public Result<Double> getModifiedDuration() {
    return modifiedDuration;
  }

  public Result<Double> getConvexity() {
    return convexity;
  }

  public Result<Double> getSpreadDuration() {
    return spreadDuration;
  }

  public Result<Double> getDv01() {
    return dv01;
  }

  public Result<ImmutableMap<Tenor, Double>> getKeyRateDurations() {
    return keyRateDurations;
  }

  public Result<Double> getOas() {
    return oas;
  }

  public Result<YieldToWorst> getYieldToWorst() {
    return yieldToWorst;
  }

  public ImmutableList<String> getDiagnostics() {
    return diagnostics;
  }

  @Override
  public String toString() {
    return "BondAnalytics[ytm=" + ytm + ", zSpread=" + zSpread + ", gSpread=" + gSpread +
        ", effectiveDuration=" + effectiveDuration + ", modifiedDuration=" + modifiedDuration +
        ", convexity=" + convexity + ", spreadDuration=" + spreadDuration + ", dv01=" + dv01 +
        ", keyRateDurations=" + keyRateDurations + ", oas=" + oas + ", yieldToWorst=" + yieldToWorst +
        ", diagnostics=" + diagnostics + "]";
  }

  //-------------------------------------------------------------------------
  /**
   * Mutable builder, used by the calculator.
   */
  static final class Builder {

    private Result<Double> ytm;
    private Result<Double> zSpread;
    private Result<Double> gSpread;
    private Result<Double> effectiveDuration;
    private Result<Double> modifiedDuration;
    private Result<Double> convexity;
    private Result<Double> spreadDuration;
    private Result<Double> dv01;
    private Result<ImmutableMap<Tenor, Double>> keyRateDurations;
    private Result<Double> oas;
    private Result<YieldToWorst> yieldToWorst;
    private final List<String> diagnostics = new ArrayList<>();

    private Builder() {
    }

    Builder ytm(Result<Double> ytm) {
      this.ytm = ytm;
      return this;
    }

    Builder zSpread(Result<Double> zSpread) {
      this.zSpread = zSpread;
      return this;
    }

    Builder gSpread(Result<Double> gSpread) {
      this.gSpread = gSpread;
      return this;
    }

    Builder effectiveDuration(Result<Double> effectiveDuration) {
      this.effectiveDuration = effectiveDuration;
      return this;
    }

    Builder modifiedDuration(Result<Double> modifiedDuration) {
      this.modifiedDuration = modifiedDuration;
      return this;
    }

    Builder convexity(Result<Double> convexity) {
      this.convexity = convexity;
      return this;
    }

    Builder spreadDuration(Result<Double> spreadDuration) {
      this.spreadDuration = spreadDuration;
      return this;
    }

    Builder dv01(Result<Double> dv01) {
      this.dv01 = dv01;
      return this;
    }

    Builder keyRateDurations(Result<ImmutableMap<Tenor, Double>> keyRateDurations) {
      this.keyRateDurations = keyRateDurations;
      return this;
    }

    Builder oas(Result<Double> oas) {
      this.oas = oas;
      return this;
    }

    Builder yieldToWorst(Result<YieldToWorst> yieldToWorst) {
      this.yieldToWorst = yieldToWorst;
      return this;
    }

    Builder addDiagnostic(String diagnostic) {
      this.diagnostics.add(diagnostic);
      return this;
    }

    BondAnalytics build() {
      return new BondAnalytics(this);
    }
  }

}
