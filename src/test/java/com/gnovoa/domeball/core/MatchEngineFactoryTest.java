package com.gnovoa.domeball.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.domeball.model.Player;
import com.gnovoa.domeball.model.Race;
import com.gnovoa.domeball.model.Role;
import com.gnovoa.domeball.model.Team;
import com.gnovoa.domeball.model.TeamSide;
import com.gnovoa.domeball.sim.BalanceConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MatchEngineFactoryTest {

  private final MatchEngineFactory factory = MatchFixtures.factory(BalanceConfig.defaults());

  private static List<Player> squad(String prefix, int size) {
    List<Player> players = new ArrayList<>();
    for (int i = 1; i <= size; i++) players.add(TestPlayers.runner(prefix + i).build());
    return players;
  }

  private static Team away() {
    return MatchFixtures.team("away", squad("a", 6));
  }

  @Test
  @DisplayName("Empty lineup starts the first six in roster order")
  void defaultLineup() {
    MatchEngine engine = factory.create("m1", MatchFixtures.team("home", squad("h", 8)), away());

    assertThat(engine.state().home().onField()).containsExactly("h1", "h2", "h3", "h4", "h5", "h6");
    assertThat(engine.state().home().players()).hasSize(8);
    assertThat(engine.state().maxTime()).isEqualTo(MatchFixtures.MATCH_SECONDS);
    assertThat(engine.state().possession()).isEqualTo(TeamSide.HOME);
  }

  @Test
  void explicitLineup() {
    Team home = new Team("home", "Home", squad("h", 8), List.of("h8", "h7", "h3", "h4", "h5", "h6"));
    MatchEngine engine = factory.create("m1", home, away());

    assertThat(engine.state().home().onField()).containsExactly("h8", "h7", "h3", "h4", "h5", "h6");
    assertThat(engine.state().player("h1").isOnField()).isFalse();
  }

  @Test
  @DisplayName("Unknown race and role tags degrade to UNKNOWN instead of failing")
  void unknownTags() {
    List<Player> players = squad("h", 6);
    players.set(0, TestPlayers.runner("h1").race("Dragonkin").role("Sweeper").bonus("luck", 5.0).build());
    MatchEngine engine = factory.create("m1", MatchFixtures.team("home", players), away());

    PlayerState p = engine.state().player("h1");
    assertThat(p.race()).isEqualTo(Race.UNKNOWN);
    assertThat(p.role()).isEqualTo(Role.UNKNOWN);
    assertThat(p.activeBonuses().isEmpty()).isTrue();
  }

  @Test
  void tooFewPlayers() {
    assertThatThrownBy(() -> factory.create("m1", MatchFixtures.team("home", squad("h", 5)), away()))
        .isInstanceOf(MatchConfigurationException.class)
        .hasMessageContaining("at least 6")
        .satisfies(e -> assertThat(((MatchConfigurationException) e).teamId()).isEqualTo("home"));
  }

  @Test
  void duplicatePlayerIds() {
    List<Player> players = squad("h", 6);
    players.add(TestPlayers.blocker("h2").build());

    assertThatThrownBy(() -> factory.create("m1", MatchFixtures.team("home", players), away()))
        .isInstanceOf(MatchConfigurationException.class)
        .hasMessageContaining("duplicate player id h2");
  }

  @Test
  void lineupMustHaveSixDistinctRosteredPlayers() {
    List<Player> players = squad("h", 7);

    assertThatThrownBy(() -> factory.create("m1",
        new Team("home", "Home", players, List.of("h1", "h2", "h3")), away()))
        .isInstanceOf(MatchConfigurationException.class)
        .hasMessageContaining("exactly 6");
    assertThatThrownBy(() -> factory.create("m1",
        new Team("home", "Home", players, List.of("h1", "h1", "h2", "h3", "h4", "h5")), away()))
        .isInstanceOf(MatchConfigurationException.class)
        .hasMessageContaining("repeats");
    assertThatThrownBy(() -> factory.create("m1",
        new Team("home", "Home", players, List.of("h1", "h2", "h3", "h4", "h5", "x9")), away()))
        .isInstanceOf(MatchConfigurationException.class)
        .hasMessageContaining("x9");
  }

  @Test
  void playerCannotPlayForBothSides() {
    assertThatThrownBy(() -> factory.create("m1",
        MatchFixtures.team("home", squad("p", 6)), MatchFixtures.team("away", squad("p", 6))))
        .isInstanceOf(MatchConfigurationException.class)
        .hasMessageContaining("also rostered");
  }

  @Test
  void invalidMatchParameters() {
    Team home = MatchFixtures.team("home", squad("h", 6));

    assertThatThrownBy(() -> factory.create(" ", home, away())).isInstanceOf(MatchConfigurationException.class);
    assertThatThrownBy(() -> factory.create("m1", home, away(), 0)).isInstanceOf(MatchConfigurationException.class);
    assertThatThrownBy(() -> factory.create("m1", home, null)).isInstanceOf(MatchConfigurationException.class);
  }

  @Test
  @DisplayName("A null roster entry is a configuration error for that team")
  void nullPlayerIsRejected() {
    List<Player> players = squad("h", 6);
    players.set(2, null);
    Team home = MatchFixtures.team("home", players);

    assertThatThrownBy(() -> factory.create("m1", home, away()))
        .isInstanceOf(MatchConfigurationException.class)
        .hasMessageContaining("needs an id")
        .extracting(e -> ((MatchConfigurationException) e).teamId())
        .isEqualTo("home");
  }

  @Test
  void nullLineupEntryIsRejected() {
    Team home = new Team("home", "Home", squad("h", 6), Arrays.asList("h1", "h2", "h3", "h4", "h5", null));

    assertThatThrownBy(() -> factory.create("m1", home, away()))
        .isInstanceOf(MatchConfigurationException.class)
        .hasMessageContaining("not on the roster");
  }

  @Test
  @DisplayName("Null skills and bonus values are dropped from the roster entry")
  void nullPlayerAttributesAreDropped() {
    Map<String, Double> bonuses = new HashMap<>();
    bonuses.put("power", 2.0);
    bonuses.put("speed", null);
    Player player = new Player("h1", "Hana", "Runner", "Human", 20, 20, 20, 20, 20, 30, 20, 20,
        Arrays.asList("Juke Move", null), bonuses);

    assertThat(player.skills()).containsExactly("Juke Move");
    assertThat(player.bonuses()).containsOnlyKeys("power");
  }
}
