package com.gnovoa.domeball.core;

import com.gnovoa.domeball.model.TeamSide;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One side of a match: every rostered player plus the fixed set of six on the field.
 *
 * <p>The on-field set is chosen at construction and never changes during the match.
 */
public final class TeamState {

    public static final int ON_FIELD_COUNT = 6;

    private final String teamId;
    private final String name;
    private final TeamSide side;
    private final Map<String, PlayerState> players;
    private final List<String> onField;
    private final List<PlayerState> onFieldPlayers;

    TeamState(String teamId, String name, TeamSide side, List<PlayerState> roster, List<String> onFieldIds) {
        this.teamId = teamId;
        this.name = name;
        this.side = side;

        Map<String, PlayerState> byId = new LinkedHashMap<>();
        roster.forEach(p -> byId.put(p.id(), p));
        this.players = Collections.unmodifiableMap(byId);

        this.onField = List.copyOf(onFieldIds);
        List<PlayerState> starters = new ArrayList<>(ON_FIELD_COUNT);
        for (String id : onField) {
            PlayerState p = byId.get(id);
            p.setOnField(true);
            starters.add(p);
        }
        this.onFieldPlayers = Collections.unmodifiableList(starters);
    }

    public String teamId() { return teamId; }
    public String name() { return name; }
    public TeamSide side() { return side; }
    public Map<String, PlayerState> players() { return players; }

    /** @return on-field ids in lineup order */
    public List<String> onField() { return onField; }

    /** @return on-field players in lineup order */
    public List<PlayerState> onFieldPlayers() { return onFieldPlayers; }

    public PlayerState player(String playerId) {
        PlayerState p = players.get(playerId);
        if (p == null) throw new IllegalArgumentException("Unknown player " + playerId + " in team " + teamId);
        return p;
    }

    public boolean hasPlayer(String playerId) {
        return players.containsKey(playerId);
    }

    public TeamMatchStats stats(int score, int possessionSeconds) {
        return TeamMatchStats.from(this, score, possessionSeconds);
    }
}
