package com.cliffc.proof;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Proof construction and elaboration engine.
 *
 *  Callers open a {@link Proof} on a goal, close its open positions one
 *  {@link Step} at a time, then elaborate the finished tree into a single
 *  term, or print it as a graph or a script.
 */
public abstract class PF {
  private static final Logger LOGGER = LogManager.getLogger();

  // Broken internal invariant; never caught.  Logged first, since callers
  // usually lose the message in the abort.
  public static AssertionError fatal( String msg ) {
    LOGGER.error(msg);
    return new AssertionError(msg);
  }
}
