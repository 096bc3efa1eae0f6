package com.turnbased.agent;

import static com.google.common.base.Preconditions.checkArgument;

import com.turnbased.model.GameAction;
import com.turnbased.model.GameState;
import java.util.List;

/** Always plays the first offered action. */
public final class FirstActionAgent<S extends GameState<S, A, ?>, A extends GameAction> implements GameAgent<S, A> {
  @Override
  public A pickAction(S state, List<A> actions) {
    checkArgument(!actions.isEmpty(), "No actions to pick from");
    return actions.get(0);
  }

  @Override
  public String toString() {
    return "first";
  }
}
