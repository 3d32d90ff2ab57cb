package com.gnovoa.domeball.sim;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.domeball.core.MatchFixtures;
import com.gnovoa.domeball.core.MatchPhase;
import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.core.TestPlayers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ActionSelectorTest {

  private static MatchState state(double... draws) {
    return MatchFixtures.state(
        TestPlayers.six("h", TestPlayers::runner), TestPlayers.six("a", TestPlayers::blocker),
        new ScriptedRandomSource(draws));
  }

  @Test
  @DisplayName("Cumulative weights are walked in run, pass, kick, defense order")
  void weightedOrder() {
    ActionSelector selector = new ActionSelector(BalanceConfig.ActionWeights.defaults());
    MatchState state = state(0.39, 0.41, 0.69, 0.71, 0.85);

    assertThat(selector.select(state)).isEqualTo(ActionType.RUN);
    assertThat(selector.select(state)).isEqualTo(ActionType.PASS);
    assertThat(selector.select(state)).isEqualTo(ActionType.PASS);
    assertThat(selector.select(state)).isEqualTo(ActionType.KICK);
    assertThat(selector.select(state)).isEqualTo(ActionType.DEFENSE);
  }

  @Test
  @DisplayName("Clutch time favours passing over kicking")
  void clutchMultipliers() {
    ActionSelector selector = new ActionSelector(BalanceConfig.ActionWeights.defaults());
    MatchState early = state(0.72);
    MatchState clutch = state(0.72);
    MatchFixtures.advanceClock(clutch, 2200);

    assertThat(clutch.phase()).isEqualTo(MatchPhase.CLUTCH);
    assertThat(selector.select(early)).isEqualTo(ActionType.KICK);
    assertThat(selector.select(clutch)).isEqualTo(ActionType.PASS);
  }

  @Test
  void zeroWeightIsNeverChosen() {
    ActionSelector selector = new ActionSelector(new BalanceConfig.ActionWeights(0, 1, 0, 0, 1, 1));
    MatchState state = state(0.0, 0.5, 0.999999);

    assertThat(selector.select(state)).isEqualTo(ActionType.PASS);
    assertThat(selector.select(state)).isEqualTo(ActionType.PASS);
    assertThat(selector.select(state)).isEqualTo(ActionType.PASS);
  }
}
