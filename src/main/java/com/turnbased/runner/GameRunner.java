package com.turnbased.runner;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Stopwatch;
import com.turnbased.agent.GameAgent;
import com.turnbased.model.Game;
import com.turnbased.model.GameAction;
import com.turnbased.model.GameOutcome;
import com.turnbased.model.GameState;
import com.turnbased.model.PlayerColor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Plays one match between two agents. The runner owns the state for the whole match: it repeatedly asks the agent of
 * the color to move for an action and applies it, until the state reports an outcome.
 *
 * <p>A runner plays exactly once and is not thread-safe.
 */
public final class GameRunner<S extends GameState<S, A, O>, A extends GameAction, O extends GameOutcome> {
  private static final Logger log = Logger.getLogger(GameRunner.class.getName());

  private final GameAgent<S, A> blackAgent;
  private final GameAgent<S, A> whiteAgent;
  private final RunnerOptions options;
  private final S state;
  private boolean played = false;

  public GameRunner(GameAgent<S, A> blackAgent, GameAgent<S, A> whiteAgent, S startState) {
    this(blackAgent, whiteAgent, startState, RunnerOptions.DEFAULT);
  }

  public GameRunner(GameAgent<S, A> blackAgent, GameAgent<S, A> whiteAgent, S startState, RunnerOptions options) {
    this.blackAgent = Objects.requireNonNull(blackAgent);
    this.whiteAgent = Objects.requireNonNull(whiteAgent);
    this.state = Objects.requireNonNull(startState);
    this.options = Objects.requireNonNull(options);
  }

  public static <S extends GameState<S, A, O>, A extends GameAction, O extends GameOutcome> GameRunner<S, A, O> of(
      Game<S, A, O> game, GameAgent<S, A> blackAgent, GameAgent<S, A> whiteAgent) {
    return of(game, blackAgent, whiteAgent, RunnerOptions.DEFAULT);
  }

  public static <S extends GameState<S, A, O>, A extends GameAction, O extends GameOutcome> GameRunner<S, A, O> of(
      Game<S, A, O> game, GameAgent<S, A> blackAgent, GameAgent<S, A> whiteAgent, RunnerOptions options) {
    return new GameRunner<>(blackAgent, whiteAgent, game.initialState(), options);
  }

  private GameAgent<S, A> agent(PlayerColor color) {
    return switch (color) {
      case BLACK -> blackAgent;
      case WHITE -> whiteAgent;
    };
  }

  /**
   * Plays the match to completion.
   *
   * @return the outcome together with the final state
   * @throws IllegalActionException if validation is enabled and an agent picks an action it was not offered
   * @throws IllegalStateException if the runner already played, an undecided state has no legal actions or the
   *     turn limit is exceeded
   */
  public MatchResult<S, O> play() {
    checkState(!played, "Runner already played its match");
    played = true;

    log.log(Level.FINE, () -> "Starting match %s vs. %s".formatted(blackAgent, whiteAgent));
    Stopwatch timer = Stopwatch.createStarted();
    List<PlayerColor> movers = new ArrayList<>();
    Optional<O> outcome = state.outcome();
    while (outcome.isEmpty()) {
      PlayerColor color = state.currentPlayerTurn();
      List<A> legal = List.copyOf(state.legalActions());
      if (legal.isEmpty()) {
        log.log(Level.WARNING, "Undecided state {0} offers no legal actions", state);
        throw new IllegalStateException("Undecided state %s has no legal actions".formatted(state));
      }

      A action = agent(color).pickAction(state, legal);
      // List.copyOf rejects contains(null)
      if (options.validateActions() && (action == null || !legal.contains(action))) {
        log.log(Level.WARNING, () -> "Agent for %s picked %s, offered %s".formatted(color, action, legal));
        throw new IllegalActionException(color, action);
      }
      state.makeNext(action);
      movers.add(color);
      int turn = movers.size();
      log.log(Level.FINER, () -> "Turn %d: %s played %s".formatted(turn, color, action));

      outcome = state.outcome();
      if (outcome.isEmpty() && options.limited() && turn >= options.maxTurns()) {
        log.log(Level.WARNING, "Match still undecided at turn limit {0}", turn);
        throw new IllegalStateException("Match undecided after %d turns".formatted(turn));
      }
    }

    O result = outcome.get();
    if (!result.isFinal()) {
      log.log(Level.WARNING, "State reported outcome {0} which is not final", result);
    }
    log.log(Level.INFO, () -> "Match ended with %s after %d turns in %s".formatted(result, movers.size(), timer));
    return new MatchResult<>(result, state, movers.size(), movers);
  }
}
