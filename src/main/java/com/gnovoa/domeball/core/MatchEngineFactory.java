package com.gnovoa.domeball.core;

import com.gnovoa.domeball.commentary.CommentaryGenerator;
import com.gnovoa.domeball.model.Player;
import com.gnovoa.domeball.model.Race;
import com.gnovoa.domeball.model.Role;
import com.gnovoa.domeball.model.Team;
import com.gnovoa.domeball.model.TeamSide;
import com.gnovoa.domeball.sim.ActionResolver;
import com.gnovoa.domeball.sim.ActionSelector;
import com.gnovoa.domeball.sim.ActionType;
import com.gnovoa.domeball.sim.BalanceConfig;
import com.gnovoa.domeball.sim.DeterministicRandomSource;
import com.gnovoa.domeball.sim.EffectiveStatsCalculator;
import com.gnovoa.domeball.sim.FatigueCurve;
import com.gnovoa.domeball.sim.KickResolver;
import com.gnovoa.domeball.sim.PassResolver;
import com.gnovoa.domeball.sim.RunResolver;
import com.gnovoa.domeball.sim.Skill;
import com.gnovoa.domeball.sim.StaminaUpdater;
import com.gnovoa.domeball.sim.StatBonuses;
import com.gnovoa.domeball.sim.TackleResolver;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds ready-to-tick {@link MatchEngine}s from roster snapshots.
 *
 * <p>All validation happens here, before any tick runs:
 * <ul>
 *   <li>non-blank match id and a positive duration</li>
 *   <li>at least six players per team, with unique non-blank ids across both teams</li>
 *   <li>a lineup of exactly six distinct rostered ids (an empty lineup means the first six)</li>
 * </ul>
 * Violations throw {@link MatchConfigurationException}. Unknown race, role and bonus names are
 * tolerated: they resolve to no modifier and are logged.
 *
 * <p>Every match gets its own {@link DeterministicRandomSource} seeded with the match id.
 */
public final class MatchEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(MatchEngineFactory.class);

    private final BalanceConfig balance;
    private final EffectiveStatsCalculator calculator;
    private final CommentaryGenerator commentary;
    private final int matchDurationSeconds;

    public MatchEngineFactory(BalanceConfig balance, EffectiveStatsCalculator calculator,
                              CommentaryGenerator commentary, int matchDurationSeconds) {
        this.balance = balance;
        this.calculator = calculator;
        this.commentary = commentary;
        this.matchDurationSeconds = matchDurationSeconds;
    }

    public int matchDurationSeconds() { return matchDurationSeconds; }

    /** Creates a match lasting the configured duration. */
    public MatchEngine create(String matchId, Team home, Team away) {
        return create(matchId, home, away, matchDurationSeconds);
    }

    /**
     * @param matchId match identifier, also the RNG seed
     * @param maxTime match duration in game seconds
     * @throws MatchConfigurationException if the inputs cannot support a match
     */
    public MatchEngine create(String matchId, Team home, Team away, int maxTime) {
        if (matchId == null || matchId.isBlank()) {
            throw new MatchConfigurationException(null, "match id must not be blank");
        }
        if (maxTime <= 0) {
            throw new MatchConfigurationException(null, "match duration must be positive, got " + maxTime);
        }
        if (home == null || away == null) {
            throw new MatchConfigurationException(null, "both rosters are required");
        }

        FatigueCurve fatigue = FatigueCurve.from(balance.stamina());
        TeamState homeState = toTeamState(home, TeamSide.HOME, fatigue);
        TeamState awayState = toTeamState(away, TeamSide.AWAY, fatigue);
        for (String id : awayState.players().keySet()) {
            if (homeState.hasPlayer(id)) {
                throw new MatchConfigurationException(away.teamId(), "player " + id + " is also rostered by " + home.teamId());
            }
        }

        MatchState state = new MatchState(matchId, homeState, awayState, new DeterministicRandomSource(matchId), maxTime);

        Map<ActionType, ActionResolver> resolvers = new EnumMap<>(ActionType.class);
        List.of(
                new RunResolver(balance.run(), calculator),
                new PassResolver(balance.pass(), calculator),
                new KickResolver(balance.kick(), calculator),
                new TackleResolver(balance.tackle(), calculator)
        ).forEach(r -> resolvers.put(r.action(), r));

        log.info("Created match {}: {} vs {} ({}s)", matchId, homeState.name(), awayState.name(), maxTime);
        return new MatchEngine(
                state,
                new ActionSelector(balance.actions()),
                resolvers,
                new StaminaUpdater(balance.stamina(), calculator.races()),
                balance.clock(),
                commentary);
    }

    private TeamState toTeamState(Team team, TeamSide side, FatigueCurve fatigue) {
        String teamId = team.teamId();
        List<Player> players = team.players();
        if (players.size() < TeamState.ON_FIELD_COUNT) {
            throw new MatchConfigurationException(teamId,
                    "needs at least " + TeamState.ON_FIELD_COUNT + " players, has " + players.size());
        }

        Set<String> ids = new HashSet<>();
        List<PlayerState> roster = new ArrayList<>(players.size());
        for (Player p : players) {
            if (p == null || p.playerId() == null || p.playerId().isBlank()) {
                throw new MatchConfigurationException(teamId, "every player needs an id");
            }
            if (!ids.add(p.playerId())) {
                throw new MatchConfigurationException(teamId, "duplicate player id " + p.playerId());
            }
            roster.add(toPlayerState(teamId, p, side, fatigue));
        }

        List<String> lineup = team.lineup().isEmpty()
                ? players.subList(0, TeamState.ON_FIELD_COUNT).stream().map(Player::playerId).toList()
                : team.lineup();
        if (lineup.size() != TeamState.ON_FIELD_COUNT) {
            throw new MatchConfigurationException(teamId,
                    "lineup must name exactly " + TeamState.ON_FIELD_COUNT + " players, names " + lineup.size());
        }
        if (new HashSet<>(lineup).size() != lineup.size()) {
            throw new MatchConfigurationException(teamId, "lineup repeats a player");
        }
        for (String id : lineup) {
            if (!ids.contains(id)) {
                throw new MatchConfigurationException(teamId, "lineup player " + id + " is not on the roster");
            }
        }

        String name = team.name() == null || team.name().isBlank() ? teamId : team.name();
        return new TeamState(teamId, name, side, roster, lineup);
    }

    private PlayerState toPlayerState(String teamId, Player p, TeamSide side, FatigueCurve fatigue) {
        Race race = Race.fromTag(p.race());
        if (race == Race.UNKNOWN && !"unknown".equalsIgnoreCase(String.valueOf(p.race()).trim())) {
            log.warn("Team {}: player {} has unknown race '{}', no race modifiers apply", teamId, p.playerId(), p.race());
        }
        Role role = Role.fromTag(p.role());
        if (role == Role.UNKNOWN && !"unknown".equalsIgnoreCase(String.valueOf(p.role()).trim())) {
            log.warn("Team {}: player {} has unknown role '{}'", teamId, p.playerId(), p.role());
        }

        Set<Skill> skills = EnumSet.noneOf(Skill.class);
        p.skills().forEach(s -> Skill.fromName(s).ifPresent(skills::add));

        StatBonuses bonuses = StatBonuses.fromExternal(p.bonuses(),
                name -> log.warn("Team {}: player {} has bonus for unknown stat '{}', ignored", teamId, p.playerId(), name));

        return new PlayerState(p, side, role, race, skills, bonuses, fatigue);
    }
}
