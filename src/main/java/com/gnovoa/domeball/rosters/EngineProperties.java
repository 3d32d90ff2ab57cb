package com.gnovoa.domeball.rosters;

import com.gnovoa.domeball.sim.BalanceConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from {@code engine.*}.
 *
 * @param matchDurationSeconds game seconds per match
 * @param parallelism worker threads of the fixture simulator
 * @param balance game balance constants; a section given in configuration must be given in full
 */
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
    int matchDurationSeconds, int parallelism, Commentary commentary, BalanceConfig balance) {

  public static final int LEAGUE_MATCH_SECONDS = 2400;

  public EngineProperties {
    if (matchDurationSeconds <= 0) matchDurationSeconds = LEAGUE_MATCH_SECONDS;
    if (parallelism <= 0) parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
    if (commentary == null) commentary = new Commentary(null, null, null);
    if (balance == null) balance = BalanceConfig.defaults();
  }

  /**
   * Unset thresholds take their defaults; zero is a valid setting.
   *
   * @param phraseBank location of the phrase bank JSON
   * @param umbraYardsThreshold minimum gain for the Umbra run pool
   * @param gryllYardsThreshold maximum gain for the Gryll run pool
   */
  public record Commentary(String phraseBank, Integer umbraYardsThreshold, Integer gryllYardsThreshold) {
    public Commentary {
      if (phraseBank == null || phraseBank.isBlank()) phraseBank = "classpath:commentary/phrases.json";
      if (umbraYardsThreshold == null) umbraYardsThreshold = 8;
      if (gryllYardsThreshold == null) gryllYardsThreshold = 3;
    }
  }
}
