package com.gnovoa.domeball.sim;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import com.gnovoa.domeball.core.MatchFixtures;
import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.core.TestPlayers;
import com.gnovoa.domeball.model.Player;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StaminaUpdaterTest {

  private final StaminaUpdater updater = new StaminaUpdater(BalanceConfig.Stamina.defaults(), RaceProfiles.defaults());

  private static MatchState state(List<Player> home, RandomSource rng) {
    return MatchFixtures.state(home, TestPlayers.six("a", TestPlayers::blocker), rng);
  }

  @Test
  @DisplayName("Runners and passers drain 1.5 per tick, blockers 1.0")
  void roleDrain() {
    List<Player> home = new ArrayList<>(TestPlayers.six("h", TestPlayers::runner));
    home.set(0, TestPlayers.passer("h1").build());
    MatchState state = state(home, new ScriptedRandomSource());

    updater.update(state);

    assertThat(state.player("h1").currentStamina()).isEqualTo(28.5);
    assertThat(state.player("h2").currentStamina()).isEqualTo(28.5);
    assertThat(state.player("a1").currentStamina()).isEqualTo(29.0);
  }

  @Test
  @DisplayName("Gryll drain is scaled by 0.9")
  void gryllDrain() {
    List<Player> home = new ArrayList<>(TestPlayers.six("h", TestPlayers::runner));
    home.set(0, TestPlayers.blocker("h1").race("Gryll").build());
    home.set(1, TestPlayers.runner("h2").race("Gryll").build());
    MatchState state = state(home, new ScriptedRandomSource());

    updater.update(state);

    assertThat(state.player("h1").currentStamina()).isCloseTo(29.1, offset(1e-9));
    assertThat(state.player("h2").currentStamina()).isCloseTo(28.65, offset(1e-9));
  }

  @Test
  @DisplayName("Sylvan regeneration is checked before the drain, one draw per Sylvan")
  void sylvanRegeneration() {
    List<Player> home = new ArrayList<>(TestPlayers.six("h", TestPlayers::runner));
    home.set(0, TestPlayers.runner("h1").race("Sylvan").build());
    ScriptedRandomSource rng = new ScriptedRandomSource(0.05, 0.5);
    MatchState state = state(home, rng);
    PlayerState sylvan = state.player("h1");
    sylvan.setCurrentStamina(10);

    updater.update(state);
    assertThat(sylvan.currentStamina()).isEqualTo(10.5);

    updater.update(state);
    assertThat(sylvan.currentStamina()).isEqualTo(9.0);
    assertThat(rng.remaining()).isZero();
  }

  @Test
  @DisplayName("Stamina never drops below zero and the penalty is exactly maximal there")
  void clampAtZero() {
    MatchState state = state(TestPlayers.six("h", TestPlayers::runner), new ScriptedRandomSource());
    PlayerState p = state.player("h1");
    p.setCurrentStamina(1);

    updater.update(state);

    assertThat(p.currentStamina()).isZero();
    assertThat(p.fatiguePenalty()).isEqualTo(0.5);
  }

  @Test
  void benchIsNotDrained() {
    List<Player> home = new ArrayList<>(TestPlayers.six("h", TestPlayers::runner));
    home.add(TestPlayers.runner("h7").build());
    MatchState state = state(home, new ScriptedRandomSource());

    updater.update(state);

    assertThat(state.player("h7").isOnField()).isFalse();
    assertThat(state.player("h7").currentStamina()).isEqualTo(30.0);
  }

  @Test
  @DisplayName("Without regeneration stamina only goes down and the penalty stays within bounds")
  void monotonicWithoutRegeneration() {
    MatchState state = state(TestPlayers.six("h", t -> TestPlayers.runner(t).race("Umbra")), new ScriptedRandomSource());
    PlayerState p = state.player("h3");

    double previous = p.currentStamina();
    for (int tick = 0; tick < 40; tick++) {
      updater.update(state);
      assertThat(p.currentStamina()).isLessThanOrEqualTo(previous);
      assertThat(p.fatiguePenalty()).isBetween(0.0, 0.5);
      previous = p.currentStamina();
    }
    assertThat(p.currentStamina()).isZero();
  }
}
