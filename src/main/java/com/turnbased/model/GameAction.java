package com.turnbased.model;

/**
 * A single move proposed against a {@link GameState}. Implementations should be immutable values; the engine never
 * looks inside an action, it only hands it from an agent to the state.
 */
public interface GameAction {}
