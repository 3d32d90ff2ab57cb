package com.gnovoa.domeball.core;

import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.model.TeamSide;

/** Team totals derived from the players' {@link PlayerMatchStats}. */
public record TeamMatchStats(
        String teamId,
        TeamSide side,
        int score,
        int possessionSeconds,
        int plays,
        int rushingYards,
        int passingYards,
        int passCompletions,
        int passAttempts,
        int kickingYards,
        int tackles,
        int interceptions,
        int fumbleRecoveries,
        int turnovers,
        int breakawayRuns
) {

    static TeamMatchStats from(TeamState team, int score, int possessionSeconds) {
        int[] totals = new int[MatchStat.values().length];
        for (PlayerState p : team.players().values()) {
            for (MatchStat stat : MatchStat.values()) {
                totals[stat.ordinal()] += p.stats().get(stat);
            }
        }
        return new TeamMatchStats(
                team.teamId(),
                team.side(),
                score,
                possessionSeconds,
                totals[MatchStat.PLAYS.ordinal()],
                totals[MatchStat.RUSHING_YARDS.ordinal()],
                totals[MatchStat.PASSING_YARDS.ordinal()],
                totals[MatchStat.PASS_COMPLETIONS.ordinal()],
                totals[MatchStat.PASS_ATTEMPTS.ordinal()],
                totals[MatchStat.KICKING_YARDS.ordinal()],
                totals[MatchStat.TACKLES.ordinal()],
                totals[MatchStat.INTERCEPTIONS.ordinal()],
                totals[MatchStat.FUMBLE_RECOVERIES.ordinal()],
                team.players().values().stream().mapToInt(p -> p.stats().turnovers()).sum(),
                totals[MatchStat.BREAKAWAY_RUNS.ordinal()]);
    }
}
