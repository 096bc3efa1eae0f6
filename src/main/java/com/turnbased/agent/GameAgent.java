package com.turnbased.agent;

import com.turnbased.model.GameAction;
import com.turnbased.model.GameState;
import java.util.List;

/**
 * The decision policy of one seat. An agent is shown the current state together with its legal actions and returns
 * the action it wants to play. The call is synchronous and must return.
 *
 * <p>The state is only lent for the duration of the call. Agents must neither modify it nor keep a reference to it;
 * use {@link GameState#copy()} or {@link GameState#next(GameAction)} to look ahead.
 */
@FunctionalInterface
public interface GameAgent<S extends GameState<S, A, ?>, A extends GameAction> {
  /**
   * Picks the action to play.
   *
   * @param state the current state
   * @param actions the legal actions of {@code state}, never empty and not modifiable
   * @return one element of {@code actions}
   */
  A pickAction(S state, List<A> actions);
}
