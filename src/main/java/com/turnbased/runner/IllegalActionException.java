package com.turnbased.runner;

import com.turnbased.model.GameAction;
import com.turnbased.model.PlayerColor;

/** Thrown when an agent picks an action which was not among the legal actions it was offered. */
public class IllegalActionException extends RuntimeException {
  private final PlayerColor color;
  private final transient GameAction action;

  public IllegalActionException(PlayerColor color, GameAction action) {
    super("Agent for %s picked %s, which is not a legal action".formatted(color.name(), action));
    this.color = color;
    this.action = action;
  }

  public PlayerColor color() {
    return color;
  }

  public GameAction action() {
    return action;
  }
}
