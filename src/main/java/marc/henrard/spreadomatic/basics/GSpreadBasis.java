/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

/**
 * The government reference rate against which a G-spread is measured.
 * 
 * @author Marc Henrard
 */
public enum GSpreadBasis {

  /** The zero rate interpolated at the bond maturity. */
  ZERO,
  /** The par yield at the bond maturity, derived from the zero curve. */
  PAR;

}
