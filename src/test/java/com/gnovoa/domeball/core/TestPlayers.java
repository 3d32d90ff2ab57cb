package com.gnovoa.domeball.core;

import com.gnovoa.domeball.model.Player;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Fluent roster entries for tests; every stat defaults to 20. */
public final class TestPlayers {

    private String id;
    private String name;
    private String role;
    private String race = "Human";
    private int speed = 20;
    private int power = 20;
    private int throwing = 20;
    private int catching = 20;
    private int kicking = 20;
    private int stamina = 30;
    private int agility = 20;
    private int leadership = 20;
    private final List<String> skills = new ArrayList<>();
    private final Map<String, Double> bonuses = new HashMap<>();

    private TestPlayers(String id, String role) {
        this.id = id;
        this.name = "Player " + id;
        this.role = role;
    }

    public static TestPlayers runner(String id) { return new TestPlayers(id, "Runner"); }
    public static TestPlayers passer(String id) { return new TestPlayers(id, "Passer"); }
    public static TestPlayers blocker(String id) { return new TestPlayers(id, "Blocker"); }

    public TestPlayers name(String v) { name = v; return this; }
    public TestPlayers role(String v) { role = v; return this; }
    public TestPlayers race(String v) { race = v; return this; }
    public TestPlayers speed(int v) { speed = v; return this; }
    public TestPlayers power(int v) { power = v; return this; }
    public TestPlayers throwing(int v) { throwing = v; return this; }
    public TestPlayers catching(int v) { catching = v; return this; }
    public TestPlayers kicking(int v) { kicking = v; return this; }
    public TestPlayers stamina(int v) { stamina = v; return this; }
    public TestPlayers agility(int v) { agility = v; return this; }
    public TestPlayers skill(String v) { skills.add(v); return this; }
    public TestPlayers bonus(String stat, double v) { bonuses.put(stat, v); return this; }

    public Player build() {
        return new Player(id, name, role, race, speed, power, throwing, catching, kicking, stamina, agility,
                leadership, skills, bonuses);
    }

    /** Six players {@code prefix1..prefix6} built from the same template. */
    public static List<Player> six(String prefix, Function<String, TestPlayers> template) {
        List<Player> out = new ArrayList<>();
        for (int i = 1; i <= 6; i++) out.add(template.apply(prefix + i).build());
        return out;
    }
}
