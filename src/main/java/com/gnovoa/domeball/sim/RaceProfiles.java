package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.model.Race;
import com.gnovoa.domeball.model.Stat;
import java.util.EnumMap;
import java.util.Map;

/** Lookup table of {@link RaceProfile}s keyed by the closed {@link Race} enum. */
public final class RaceProfiles {

    private final Map<Race, RaceProfile> profiles;

    public RaceProfiles(Map<Race, RaceProfile> profiles) {
        this.profiles = new EnumMap<>(Race.class);
        this.profiles.putAll(profiles);
    }

    /**
     * Standard table:
     * <ul>
     *   <li>Sylvan: +2 speed, +3 agility, 10% chance per tick to regain 2 stamina</li>
     *   <li>Gryll: +4 power, +2 stamina, -1 speed, drains at 90%</li>
     *   <li>Lumina: +3 throwing, +2 leadership</li>
     *   <li>Human, Umbra, Unknown: neutral</li>
     * </ul>
     */
    public static RaceProfiles defaults() {
        Map<Race, RaceProfile> table = new EnumMap<>(Race.class);
        table.put(Race.SYLVAN, new RaceProfile(
                StatBonuses.of(Stat.SPEED, 2).with(Stat.AGILITY, 3),
                1.0,
                new RaceProfile.Regeneration(0.10, 2)));
        table.put(Race.GRYLL, new RaceProfile(
                StatBonuses.of(Stat.POWER, 4).with(Stat.STAMINA, 2).with(Stat.SPEED, -1),
                0.9,
                RaceProfile.Regeneration.NONE));
        table.put(Race.LUMINA, new RaceProfile(
                StatBonuses.of(Stat.THROWING, 3).with(Stat.LEADERSHIP, 2),
                1.0,
                RaceProfile.Regeneration.NONE));
        return new RaceProfiles(table);
    }

    public RaceProfile profile(Race race) {
        return profiles.getOrDefault(race, RaceProfile.NEUTRAL);
    }
}
