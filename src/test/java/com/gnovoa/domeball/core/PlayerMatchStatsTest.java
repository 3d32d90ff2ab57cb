package com.gnovoa.domeball.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.events.PlayerStatDelta;
import com.gnovoa.domeball.model.TeamSide;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlayerMatchStatsTest {

  @Test
  @DisplayName("A lost drop is a turnover without being charged as a lost fumble")
  void lostDropIsATurnover() {
    PlayerMatchStats stats = new PlayerMatchStats("h2");
    stats.apply(new PlayerStatDelta("h2", TeamSide.HOME, Map.of(MatchStat.DROPS, 1, MatchStat.DROPS_LOST, 1)));
    stats.apply(new PlayerStatDelta("h2", TeamSide.HOME, Map.of(MatchStat.DROPS, 1)));

    assertThat(stats.get(MatchStat.DROPS)).isEqualTo(2);
    assertThat(stats.get(MatchStat.FUMBLES_LOST)).isZero();
    assertThat(stats.turnovers()).isEqualTo(1);
  }

  @Test
  void turnoversAddUpEveryKind() {
    PlayerMatchStats stats = new PlayerMatchStats("h1");
    stats.apply(new PlayerStatDelta("h1", TeamSide.HOME, Map.of(MatchStat.FUMBLES_LOST, 1)));
    stats.apply(new PlayerStatDelta("h1", TeamSide.HOME, Map.of(MatchStat.DROPS_LOST, 1)));
    stats.apply(new PlayerStatDelta("h1", TeamSide.HOME, Map.of(MatchStat.INTERCEPTIONS_THROWN, 2)));

    assertThat(stats.turnovers()).isEqualTo(4);
  }
}
