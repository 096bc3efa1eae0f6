package com.turnbased.model;

/**
 * Binds the state, action and outcome types of one concrete game together, so that agents and the runner can be
 * written once for any game.
 */
public interface Game<S extends GameState<S, A, O>, A extends GameAction, O extends GameOutcome> {
  String name();

  /** A fresh start position. Each call returns a new state. */
  S initialState();
}
