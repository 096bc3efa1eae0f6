package com.turnbased.runner;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings of a {@link GameRunner}.
 *
 * @param validateActions whether a picked action is checked against the offered legal actions
 * @param maxTurns the number of actions after which an undecided match is aborted, {@code 0} for no limit
 */
public record RunnerOptions(boolean validateActions, int maxTurns) {
  public static final RunnerOptions DEFAULT = builder().build();

  public RunnerOptions {
    checkArgument(maxTurns >= 0, "Negative turn limit %s", maxTurns);
  }

  public boolean limited() {
    return maxTurns > 0;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private boolean validateActions = true;
    private int maxTurns = 0;

    private Builder() {}

    public Builder validateActions(boolean validateActions) {
      this.validateActions = validateActions;
      return this;
    }

    public Builder maxTurns(int maxTurns) {
      this.maxTurns = maxTurns;
      return this;
    }

    public RunnerOptions build() {
      return new RunnerOptions(validateActions, maxTurns);
    }
  }
}
