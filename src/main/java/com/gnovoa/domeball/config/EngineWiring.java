package com.gnovoa.domeball.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.domeball.commentary.CommentaryGenerator;
import com.gnovoa.domeball.commentary.PhraseBank;
import com.gnovoa.domeball.core.FixtureSimulator;
import com.gnovoa.domeball.core.MatchEngineFactory;
import com.gnovoa.domeball.out.EventPublisher;
import com.gnovoa.domeball.out.JsonLogEventPublisher;
import com.gnovoa.domeball.rosters.EngineProperties;
import com.gnovoa.domeball.rosters.RosterCatalog;
import com.gnovoa.domeball.sim.EffectiveStatsCalculator;
import com.gnovoa.domeball.sim.RaceProfiles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineWiring {

    @Bean
    public RaceProfiles raceProfiles() {
        return RaceProfiles.defaults();
    }

    @Bean
    public EffectiveStatsCalculator effectiveStatsCalculator(RaceProfiles races) {
        return new EffectiveStatsCalculator(races);
    }

    @Bean
    public PhraseBank phraseBank(ObjectMapper mapper, EngineProperties props) {
        return PhraseBank.load(mapper, props.commentary().phraseBank());
    }

    @Bean
    public CommentaryGenerator commentaryGenerator(PhraseBank phrases, EngineProperties props) {
        EngineProperties.Commentary c = props.commentary();
        return new CommentaryGenerator(phrases, c.umbraYardsThreshold(), c.gryllYardsThreshold());
    }

    @Bean
    public MatchEngineFactory matchEngineFactory(EffectiveStatsCalculator calculator, CommentaryGenerator commentary, EngineProperties props) {
        return new MatchEngineFactory(props.balance(), calculator, commentary, props.matchDurationSeconds());
    }

    @Bean
    public EventPublisher eventPublisher(ObjectMapper mapper) {
        return new JsonLogEventPublisher(mapper);
    }

    @Bean
    public FixtureSimulator fixtureSimulator(EventPublisher publisher, EngineProperties props) {
        return new FixtureSimulator(publisher, props.parallelism());
    }

    @Bean
    public RosterCatalog rosterCatalog(ObjectMapper mapper) {
        return new RosterCatalog(mapper);
    }
}
