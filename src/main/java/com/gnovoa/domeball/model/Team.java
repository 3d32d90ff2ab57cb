package com.gnovoa.domeball.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Roster snapshot for one side of a match.
 *
 * <p>Entries are copied as given, nulls included; {@code MatchEngineFactory} rejects them with a
 * configuration error.
 *
 * @param lineup ids of the six starters; empty means the first six players in roster order
 */
public record Team(String teamId, String name, List<Player> players, List<String> lineup) {

    public Team {
        players = players == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(players));
        lineup = lineup == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(lineup));
    }
}
