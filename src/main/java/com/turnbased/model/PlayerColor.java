package com.turnbased.model;

/** The two seats of a match. Declaration order is the comparison order. */
public enum PlayerColor {
  BLACK, WHITE;

  public PlayerColor opponent() {
    return switch (this) {
      case BLACK -> WHITE;
      case WHITE -> BLACK;
    };
  }

  @Override
  public String toString() {
    return switch (this) {
      case BLACK -> "B";
      case WHITE -> "W";
    };
  }
}
