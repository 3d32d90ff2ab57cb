package com.gnovoa.domeball.commentary;

import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.events.MatchEvent;
import com.gnovoa.domeball.events.Play;
import com.gnovoa.domeball.model.Race;
import com.gnovoa.domeball.model.TeamSide;
import com.gnovoa.domeball.sim.Skill;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a resolved {@link MatchEvent} into a line of commentary.
 *
 * <p>The generator only reads the state: it never mutates it and its output never feeds back into
 * the simulation. Template selection uses the match's RNG, so a replayed match reproduces its
 * commentary along with its events. Each selected pool costs exactly one draw.
 *
 * <p>Run dispatch, first match wins:
 * <ol>
 *   <li>score</li>
 *   <li>Umbra carrier at or above {@code umbraYardsThreshold}</li>
 *   <li>Gryll carrier at or below {@code gryllYardsThreshold}</li>
 *   <li>breakaway</li>
 *   <li>run skill with a positive gain</li>
 *   <li>tired carrier with a short gain</li>
 *   <li>standard run when the gain is positive, otherwise stuffed</li>
 * </ol>
 */
public final class CommentaryGenerator {

    private final PhraseBank phrases;
    private final TemplateRenderer renderer = new TemplateRenderer();
    private final int umbraYardsThreshold;
    private final int gryllYardsThreshold;

    public CommentaryGenerator(PhraseBank phrases, int umbraYardsThreshold, int gryllYardsThreshold) {
        this.phrases = phrases;
        this.umbraYardsThreshold = umbraYardsThreshold;
        this.gryllYardsThreshold = gryllYardsThreshold;
    }

    public String describe(MatchEvent event, MatchState state) {
        Play play = event.play();
        if (play instanceof Play.Run run) return describeRun(run, event, state);
        if (play instanceof Play.Pass pass) return describePass(pass, event, state);
        if (play instanceof Play.Tackle tackle) return describeTackle(tackle, event, state);
        if (play instanceof Play.Kick kick) return describeKick(kick, event, state);
        throw new IllegalArgumentException("Unsupported play " + play);
    }

    private String describeRun(Play.Run run, MatchEvent event, MatchState state) {
        PlayerState carrier = state.player(run.carrierId());
        Map<String, String> values = values(state, event.offense());
        values.put("runnerName", carrier.name());
        values.put("playerName", carrier.name());
        values.put("yards", String.valueOf(run.yards()));

        PhraseCategory category;
        if (run.score()) {
            category = PhraseCategory.SCORE;
        } else if (carrier.race() == Race.UMBRA && run.yards() >= umbraYardsThreshold) {
            category = PhraseCategory.UMBRA_RUN;
        } else if (carrier.race() == Race.GRYLL && run.yards() <= gryllYardsThreshold) {
            category = PhraseCategory.GRYLL_RUN;
        } else if (run.breakaway()) {
            category = PhraseCategory.BREAKAWAY_RUN;
        } else if (run.yards() > 0 && runSkill(carrier) != null) {
            category = PhraseCategory.SKILL_RUN;
            values.put("skillName", runSkill(carrier).displayName());
        } else if (carrier.fatiguePenalty() > 0 && run.yards() <= 2) {
            category = PhraseCategory.FATIGUE_RUN;
        } else {
            category = run.yards() > 0 ? PhraseCategory.STANDARD_RUN : PhraseCategory.STUFFED_RUN;
        }
        return pick(category, values, state);
    }

    private String describePass(Play.Pass pass, MatchEvent event, MatchState state) {
        PlayerState passer = state.player(pass.passerId());
        PlayerState receiver = state.player(pass.receiverId());
        Map<String, String> values = values(state, event.offense());
        values.put("passerName", passer.name());
        values.put("receiverName", receiver.name());
        values.put("yards", String.valueOf(pass.yards()));

        switch (pass.outcome()) {
            case INTERCEPTED -> {
                values.put("defenderName", state.player(pass.interceptorId()).name());
                values.put("teamName", state.team(event.offense().opposite()).name());
                return pick(PhraseCategory.INTERCEPTION, values, state);
            }
            case DROPPED -> {
                String drop = pick(PhraseCategory.DROPPED_PASS, values, state);
                return drop + " " + describeScramble(pass.looseBall(), state);
            }
            case INCOMPLETE -> {
                return pick(PhraseCategory.INCOMPLETE_PASS, values, state);
            }
            default -> {
                values.put("playerName", receiver.name());
                PhraseCategory category;
                if (pass.score()) category = PhraseCategory.SCORE;
                else if (passer.race() == Race.LUMINA) category = PhraseCategory.LUMINA_PASS;
                else if (pass.deep()) category = PhraseCategory.DEEP_PASS;
                else category = PhraseCategory.STANDARD_COMPLETION;
                return pick(category, values, state);
            }
        }
    }

    private String describeTackle(Play.Tackle tackle, MatchEvent event, MatchState state) {
        Map<String, String> values = values(state, event.offense().opposite());
        values.put("tacklerName", state.player(tackle.tacklerId()).name());
        values.put("carrierName", state.player(tackle.carrierId()).name());
        values.put("yards", String.valueOf(tackle.yards()));

        if (tackle.forcedFumble()) {
            String hit = pick(PhraseCategory.FUMBLE, values, state);
            return hit + " " + describeScramble(tackle.looseBall(), state);
        }
        return pick(tackle.highPower() ? PhraseCategory.HIGH_POWER_TACKLE : PhraseCategory.STANDARD_TACKLE, values, state);
    }

    private String describeKick(Play.Kick kick, MatchEvent event, MatchState state) {
        Map<String, String> values = values(state, event.offense());
        values.put("kickerName", state.player(kick.kickerId()).name());
        values.put("playerName", state.player(kick.kickerId()).name());
        values.put("yards", String.valueOf(kick.yards()));
        return pick(kick.score() ? PhraseCategory.KICK_SCORE : PhraseCategory.KICK, values, state);
    }

    private String describeScramble(Play.LooseBall loose, MatchState state) {
        Map<String, String> values = values(state, loose.recoveringSide());
        values.put("playerName", state.player(loose.recoveredById()).name());
        return pick(loose.turnover() ? PhraseCategory.SCRAMBLE_DEFENSE : PhraseCategory.SCRAMBLE_OFFENSE, values, state);
    }

    private String pick(PhraseCategory category, Map<String, String> values, MatchState state) {
        List<String> pool = phrases.templates(category);
        return renderer.render(state.rng().choice(pool), values);
    }

    private static Map<String, String> values(MatchState state, TeamSide side) {
        Map<String, String> values = new HashMap<>();
        values.put("teamName", state.team(side).name());
        return values;
    }

    private static Skill runSkill(PlayerState carrier) {
        if (carrier.hasSkill(Skill.JUKE_MOVE)) return Skill.JUKE_MOVE;
        if (carrier.hasSkill(Skill.TRUCK_STICK)) return Skill.TRUCK_STICK;
        return null;
    }
}
