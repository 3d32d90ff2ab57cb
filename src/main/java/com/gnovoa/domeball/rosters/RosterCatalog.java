package com.gnovoa.domeball.rosters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.domeball.model.Team;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads roster snapshots from JSON.
 *
 * <p>Each document is a single {@link Team}. Locations go through Spring's resource abstraction, so
 * both {@code classpath:} and {@code file:} locations work. Loaded rosters are kept in memory by
 * location.
 *
 * <p>Only the document shape is checked here. Match-level rules (squad size, lineup) are enforced
 * when the match is created.
 */
public final class RosterCatalog {

  private static final Logger log = LoggerFactory.getLogger(RosterCatalog.class);

  private final ObjectMapper mapper;
  private final ResourceLoader resources = new DefaultResourceLoader();

  /** In-memory roster cache by location. */
  private final Map<String, Team> rosters = new ConcurrentHashMap<>();

  public RosterCatalog(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Returns the roster stored at the location, reading it on first use.
   *
   * @param location resource location of a JSON roster
   * @return parsed roster (never null)
   * @throws IllegalStateException if the file cannot be read or parsed
   * @throws IllegalArgumentException if the roster has no team id or no players
   */
  public Team load(String location) {
    return rosters.computeIfAbsent(location, this::read);
  }

  private Team read(String location) {
    Team team;
    try (InputStream in = resources.getResource(location).getInputStream()) {
      team = mapper.readValue(in, Team.class);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load roster from " + location, e);
    }
    validate(team, location);
    log.info("Loaded roster {} ({} players) from {}", team.teamId(), team.players().size(), location);
    return team;
  }

  private void validate(Team team, String location) {
    if (team.teamId() == null || team.teamId().isBlank()) {
      throw new IllegalArgumentException("Roster without teamId (" + location + ")");
    }
    if (team.players().isEmpty()) {
      throw new IllegalArgumentException(
          "Team " + team.teamId() + " has no players (" + location + ")");
    }
  }
}
