package com.gnovoa.domeball.sim;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.domeball.core.MatchFixtures;
import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.core.TestPlayers;
import com.gnovoa.domeball.events.EventPriority;
import com.gnovoa.domeball.events.MatchEvent;
import com.gnovoa.domeball.events.MatchEventType;
import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.events.Play;
import com.gnovoa.domeball.events.PlayerStatDelta;
import com.gnovoa.domeball.model.Player;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RunResolverTest {

  private final RunResolver resolver =
      new RunResolver(BalanceConfig.Run.defaults(), new EffectiveStatsCalculator(RaceProfiles.defaults()));

  private static List<Player> fastRunners() {
    return TestPlayers.six("h", id -> TestPlayers.runner(id).speed(40).power(10));
  }

  private static List<Player> blockers(int power) {
    return TestPlayers.six("a", id -> TestPlayers.blocker(id).power(power).speed(10));
  }

  private static PlayerStatDelta delta(MatchEvent event, String playerId) {
    return event.stats().playerStats().stream().filter(d -> d.playerId().equals(playerId)).findFirst().orElseThrow();
  }

  @Test
  @DisplayName("Successful run gains yards from the speed contest")
  void successfulRun() {
    // carrier, success roll (10 < 50 - 30), yards roll, score roll
    ScriptedRandomSource rng = new ScriptedRandomSource(0.0, 0.1, 0.5, 0.9);
    MatchState state = MatchFixtures.state(fastRunners(), blockers(40), rng);

    MatchEvent event = resolver.resolve(state);

    assertThat(event.play()).isEqualTo(new Play.Run("h1", 8, false, false));
    assertThat(event.type()).isEqualTo(MatchEventType.ROUTINE_PLAY);
    assertThat(event.priority()).isEqualTo(EventPriority.STANDARD);
    assertThat(event.description()).isEmpty();
    assertThat(event.stats().turnover()).isFalse();
    assertThat(delta(event, "h1").get(MatchStat.PLAYS)).isEqualTo(1);
    assertThat(delta(event, "h1").get(MatchStat.RUSHING_ATTEMPTS)).isEqualTo(1);
    assertThat(delta(event, "h1").get(MatchStat.RUSHING_YARDS)).isEqualTo(8);
    assertThat(rng.remaining()).isZero();
  }

  @Test
  @DisplayName("Failed run is stuffed for at most two yards")
  void stuffedRun() {
    ScriptedRandomSource rng = new ScriptedRandomSource(0.99, 0.5, 0.99, 0.99);
    MatchState state = MatchFixtures.state(fastRunners(), blockers(40), rng);

    MatchEvent event = resolver.resolve(state);

    assertThat(event.play()).isEqualTo(new Play.Run("h6", 2, false, false));
  }

  @Test
  @DisplayName("Long fast run is a breakaway and may score")
  void breakawayScore() {
    ScriptedRandomSource rng = new ScriptedRandomSource(0.0, 0.1, 0.9, 0.3);
    MatchState state = MatchFixtures.state(fastRunners(), blockers(10), rng);

    MatchEvent event = resolver.resolve(state);

    assertThat(event.play()).isEqualTo(new Play.Run("h1", 13, true, true));
    assertThat(event.type()).isEqualTo(MatchEventType.SCORE);
    assertThat(event.priority()).isEqualTo(EventPriority.CRITICAL);
    assertThat(delta(event, "h1").get(MatchStat.BREAKAWAY_RUNS)).isEqualTo(1);
    assertThat(delta(event, "h1").get(MatchStat.SCORES)).isEqualTo(1);
  }

  @Test
  @DisplayName("Breakaway without a score is important")
  void breakawayOnly() {
    MatchState state = MatchFixtures.state(fastRunners(), blockers(10), new ScriptedRandomSource(0.0, 0.1, 0.9, 0.5));

    MatchEvent event = resolver.resolve(state);

    assertThat(event.type()).isEqualTo(MatchEventType.ROUTINE_PLAY);
    assertThat(event.priority()).isEqualTo(EventPriority.IMPORTANT);
  }

  @Test
  @DisplayName("Without a runner on the field any on-field player carries")
  void carrierFallback() {
    ScriptedRandomSource rng = new ScriptedRandomSource(0.5, 0.9, 0.0, 0.9);
    MatchState state = MatchFixtures.state(
        TestPlayers.six("h", TestPlayers::blocker), TestPlayers.six("a", TestPlayers::blocker), rng);

    MatchEvent event = resolver.resolve(state);

    assertThat(((Play.Run) event.play()).carrierId()).isEqualTo("h4");
    assertThat(rng.draws()).isEqualTo(4);
  }

  @Test
  @DisplayName("Run skills shift the success roll")
  void skillBonus() {
    List<Player> home = new ArrayList<>(fastRunners());
    home.set(0, TestPlayers.runner("h1").speed(40).power(10).skill("Juke Move").build());

    MatchState withSkill = MatchFixtures.state(home, blockers(40), new ScriptedRandomSource(0.0, 0.25, 0.5, 0.9));
    MatchState without = MatchFixtures.state(fastRunners(), blockers(40), new ScriptedRandomSource(0.0, 0.25, 0.5, 0.9));

    assertThat(((Play.Run) resolver.resolve(withSkill).play()).yards()).isEqualTo(8);
    assertThat(((Play.Run) resolver.resolve(without).play()).yards()).isEqualTo(1);
  }

  @Test
  @DisplayName("Yardage is never negative, even in hopeless mismatches")
  void neverNegative() {
    List<Player> slow = TestPlayers.six("h", id -> TestPlayers.runner(id).speed(0).power(0));
    List<Player> wall = TestPlayers.six("a", id -> TestPlayers.blocker(id).power(100));

    for (int seed = 0; seed < 50; seed++) {
      MatchState state = MatchFixtures.state(slow, wall, new DeterministicRandomSource("neg-" + seed));
      for (int i = 0; i < 40; i++) {
        Play.Run run = (Play.Run) resolver.resolve(state).play();
        assertThat(run.yards()).isGreaterThanOrEqualTo(0);
      }
    }
  }
}
