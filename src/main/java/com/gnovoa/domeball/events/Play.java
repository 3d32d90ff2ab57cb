package com.gnovoa.domeball.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.gnovoa.domeball.model.TeamSide;

/**
 * Outcome of one resolved action. Each variant carries only the fields relevant to it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Play.Run.class, name = "RUN"),
    @JsonSubTypes.Type(value = Play.Pass.class, name = "PASS"),
    @JsonSubTypes.Type(value = Play.Tackle.class, name = "TACKLE"),
    @JsonSubTypes.Type(value = Play.Kick.class, name = "KICK")
})
public sealed interface Play {

    /** Player credited with the play. */
    String primaryActorId();

    record Run(String carrierId, int yards, boolean breakaway, boolean score) implements Play {
        @Override public String primaryActorId() { return carrierId; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Pass(
            String passerId,
            String receiverId,
            PassOutcome outcome,
            int yards,
            boolean deep,
            boolean score,
            String interceptorId,
            LooseBall looseBall) implements Play {
        @Override public String primaryActorId() { return passerId; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Tackle(String tacklerId, String carrierId, int yards, boolean highPower, LooseBall looseBall)
            implements Play {
        @Override public String primaryActorId() { return tacklerId; }

        public boolean forcedFumble() { return looseBall != null; }
    }

    record Kick(String kickerId, int yards, boolean score) implements Play {
        @Override public String primaryActorId() { return kickerId; }
    }

    enum PassOutcome { COMPLETE, INCOMPLETE, INTERCEPTED, DROPPED }

    enum LooseBallCause { TACKLE, DROP }

    /** Result of the scramble for a ball that hit the turf. */
    record LooseBall(LooseBallCause cause, String fumblerId, String recoveredById, TeamSide recoveringSide,
                     boolean turnover) {}
}
