package com.turnbased.runner;

import com.turnbased.model.GameOutcome;
import com.turnbased.model.PlayerColor;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The result of a completed match.
 *
 * @param outcome the outcome reported by the final state
 * @param finalState the terminal state
 * @param turns the number of applied actions
 * @param movers the color which acted in each turn, in order
 */
public record MatchResult<S, O extends GameOutcome>(O outcome, S finalState, int turns, List<PlayerColor> movers) {
  public MatchResult {
    Objects.requireNonNull(outcome);
    Objects.requireNonNull(finalState);
    movers = List.copyOf(movers);
    assert movers.size() == turns;
  }

  public long turnsOf(PlayerColor color) {
    return movers.stream().filter(color::equals).count();
  }

  @Override
  public String toString() {
    return "%s after %d turns [%s]".formatted(outcome, turns,
        movers.stream().map(PlayerColor::toString).collect(Collectors.joining()));
  }
}
