package com.gnovoa.domeball.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only roster entry for one player, as supplied by the roster owner.
 *
 * <p>{@code role} and {@code race} are raw tags; {@code bonuses} are named numeric adjustments
 * from tactics or items keyed by stat name. Both are resolved when the match is created. Null
 * skills and null bonus entries are dropped.
 */
public record Player(
    String playerId,
    String name,
    String role,
    String race,
    int speed,
    int power,
    int throwing,
    int catching,
    int kicking,
    int stamina,
    int agility,
    int leadership,
    List<String> skills,
    Map<String, Double> bonuses) {

    public Player {
        skills = skills == null ? List.of() : skills.stream().filter(Objects::nonNull).toList();
        Map<String, Double> known = new LinkedHashMap<>();
        if (bonuses != null) {
            bonuses.forEach((key, amount) -> {
                if (key != null && amount != null) known.put(key, amount);
            });
        }
        bonuses = Collections.unmodifiableMap(known);
    }

    public int stat(Stat stat) {
        return switch (stat) {
            case SPEED -> speed;
            case POWER -> power;
            case THROWING -> throwing;
            case CATCHING -> catching;
            case KICKING -> kicking;
            case STAMINA -> stamina;
            case AGILITY -> agility;
            case LEADERSHIP -> leadership;
        };
    }
}
