package com.gnovoa.domeball.core;

import com.gnovoa.domeball.model.Player;
import com.gnovoa.domeball.model.Race;
import com.gnovoa.domeball.model.Role;
import com.gnovoa.domeball.model.Stat;
import com.gnovoa.domeball.model.TeamSide;
import com.gnovoa.domeball.sim.FatigueCurve;
import com.gnovoa.domeball.sim.Skill;
import com.gnovoa.domeball.sim.StatBonuses;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One player during a match: immutable identity and base stats plus the dynamic fields the tick
 * loop mutates.
 *
 * <p>The fatigue penalty has no field of its own. It is recomputed from {@link #currentStamina()}
 * through the match's {@link FatigueCurve} on every call, so the two can never drift apart.
 */
public final class PlayerState {

    private final Player base;
    private final TeamSide side;
    private final Role role;
    private final Race race;
    private final Set<Skill> skills;
    private final StatBonuses activeBonuses;
    private final FatigueCurve fatigueCurve;
    private final PlayerMatchStats stats;

    private boolean onField;
    private double currentStamina;
    private FieldPosition position = FieldPosition.ORIGIN;

    public PlayerState(Player base, TeamSide side, Role role, Race race, Set<Skill> skills,
                       StatBonuses activeBonuses, FatigueCurve fatigueCurve) {
        this.base = base;
        this.side = side;
        this.role = role;
        this.race = race;
        this.skills = skills.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(skills));
        this.activeBonuses = activeBonuses;
        this.fatigueCurve = fatigueCurve;
        this.stats = new PlayerMatchStats(base.playerId());
        this.currentStamina = staminaCapacity();
    }

    public String id() { return base.playerId(); }
    public String name() { return base.name(); }
    public TeamSide side() { return side; }
    public Role role() { return role; }
    public Race race() { return race; }
    public Set<Skill> skills() { return skills; }
    public StatBonuses activeBonuses() { return activeBonuses; }
    public PlayerMatchStats stats() { return stats; }

    public int baseStat(Stat stat) {
        return base.stat(stat);
    }

    public boolean hasSkill(Skill skill) {
        return skills.contains(skill);
    }

    public boolean isOnField() { return onField; }

    void setOnField(boolean onField) { this.onField = onField; }

    public double staminaCapacity() {
        return Math.max(0, base.stamina());
    }

    public double currentStamina() { return currentStamina; }

    /** Sets stamina, clamped to {@code [0, staminaCapacity]}. */
    public void setCurrentStamina(double stamina) {
        this.currentStamina = Math.max(0, Math.min(staminaCapacity(), stamina));
    }

    /** @return penalty in {@code [0, maxPenalty]} derived from current stamina */
    public double fatiguePenalty() {
        return fatigueCurve.penaltyFor(currentStamina);
    }

    public FieldPosition position() { return position; }

    void moveTo(FieldPosition position) { this.position = position; }

    @Override
    public String toString() {
        return "PlayerState[" + id() + " " + role + "/" + race + " stamina=" + currentStamina + "]";
    }
}
