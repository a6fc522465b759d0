/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.basics;

import com.opengamma.strata.collect.Messages;

/**
 * Exception thrown when the inputs of a calculation are degenerate.
 * <p>
 * Examples are cashflows with non-positive times, arrays of different sizes or a curve with too few points.
 * 
 * @author Marc Henrard
 */
public class DegenerateInputException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates an instance with a message formatted with {@link Messages}.
   *
   * @param message  the message template, with {} placeholders
   * @param args  the message arguments
   */
  public DegenerateInputException(String message, Object... args) {
    super(Messages.format(message, args));
  }

}
