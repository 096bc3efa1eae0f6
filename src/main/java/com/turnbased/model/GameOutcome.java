package com.turnbased.model;

/** How a finished game ended. */
public interface GameOutcome {
  /**
   * Whether this particular outcome value is a true terminal condition. Termination of a match is driven by
   * {@link GameState#outcome()} alone, this predicate is for the game and its callers.
   */
  boolean isFinal();
}
