package com.turnbased.model;

import java.util.List;
import java.util.Optional;

/**
 * A complete game position. A state is advanced by applying one of its legal actions, either in place via
 * {@link #makeNext(GameAction)} or on a copy via {@link #next(GameAction)}.
 *
 * <p>Implementations must keep {@link #legalActions()} non-empty for as long as {@link #outcome()} is empty.
 *
 * @param <S> the concrete state type
 * @param <A> the action type of the game
 * @param <O> the outcome type of the game
 */
public interface GameState<S extends GameState<S, A, O>, A extends GameAction, O extends GameOutcome> {
  /** Returns a copy which is not affected by later changes to this state. */
  S copy();

  /**
   * Applies the action to this state. The action must be one of the current {@link #legalActions()}; what happens
   * otherwise is up to the implementation.
   */
  void makeNext(A action);

  /** Returns the state reached by applying the action, leaving this state unchanged. */
  default S next(A action) {
    S next = copy();
    next.makeNext(action);
    return next;
  }

  List<A> legalActions();

  /** The color to act next. Also defined for terminal states, where it has no further meaning to the runner. */
  PlayerColor currentPlayerTurn();

  /** Empty while the game is undecided. */
  Optional<O> outcome();

  default boolean isTerminal() {
    return outcome().isPresent();
  }
}
