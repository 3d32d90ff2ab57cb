package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.core.TeamState;
import com.gnovoa.domeball.model.TeamSide;

/**
 * Per-tick stamina drain and race regeneration for every on-field player, home side first.
 *
 * <p>The fatigue penalty is not touched here: {@link PlayerState#fatiguePenalty()} derives it from
 * current stamina on every read.
 */
public final class StaminaUpdater {

    private final BalanceConfig.Stamina config;
    private final RaceProfiles races;

    public StaminaUpdater(BalanceConfig.Stamina config, RaceProfiles races) {
        this.config = config;
        this.races = races;
    }

    public void update(MatchState state) {
        for (TeamSide side : TeamSide.values()) {
            TeamState team = state.team(side);
            for (PlayerState player : team.onFieldPlayers()) {
                drain(player, state.rng());
            }
        }
    }

    void drain(PlayerState player, RandomSource rng) {
        RaceProfile profile = races.profile(player.race());

        double drain = config.baseDrain();
        if (player.role().isDemanding()) {
            drain *= config.demandingRoleMultiplier();
        }

        RaceProfile.Regeneration regen = profile.regeneration();
        if (regen.isActive() && rng.nextDouble() < regen.chance()) {
            player.setCurrentStamina(player.currentStamina() + regen.amount());
        }
        drain *= profile.drainMultiplier();

        player.setCurrentStamina(player.currentStamina() - drain);
    }
}
