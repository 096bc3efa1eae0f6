package com.turnbased.agent;

import static com.google.common.base.Preconditions.checkArgument;

import com.turnbased.model.GameAction;
import com.turnbased.model.GameState;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/** Picks uniformly among the offered actions. Seed the random source for reproducible matches. */
public final class RandomAgent<S extends GameState<S, A, ?>, A extends GameAction> implements GameAgent<S, A> {
  private final Random random;

  public RandomAgent(Random random) {
    this.random = Objects.requireNonNull(random);
  }

  public RandomAgent(long seed) {
    this(new Random(seed));
  }

  @Override
  public A pickAction(S state, List<A> actions) {
    checkArgument(!actions.isEmpty(), "No actions to pick from");
    return actions.get(random.nextInt(actions.size()));
  }

  @Override
  public String toString() {
    return "random";
  }
}
