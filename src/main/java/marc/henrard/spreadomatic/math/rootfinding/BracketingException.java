/**
 * Copyright (C) 2025 - present by Marc Henrard.
 */
package marc.henrard.spreadomatic.math.rootfinding;

import com.opengamma.strata.collect.Messages;
import com.opengamma.strata.math.MathException;

/**
 * Exception thrown when no sign change of the function is found after the bounded bracket expansion.
 * 
 * @author Marc Henrard
 */
public class BracketingException extends MathException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates an instance with a message formatted with {@link Messages}.
   *
   * @param message  the message template, with {} placeholders
   * @param args  the message arguments
   */
  public BracketingException(String message, Object... args) {
    super(Messages.format(message, args));
  }

}
