package com.gnovoa.domeball.exhibition;

import com.gnovoa.domeball.core.FixtureSimulator;
import com.gnovoa.domeball.core.MatchEngine;
import com.gnovoa.domeball.core.MatchEngineFactory;
import com.gnovoa.domeball.core.MatchResult;
import com.gnovoa.domeball.model.Team;
import com.gnovoa.domeball.rosters.RosterCatalog;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Plays one exhibition match between the configured rosters once the application is up. */
@Component
public final class ExhibitionBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ExhibitionBootstrap.class);

    private final ExhibitionProperties props;
    private final RosterCatalog rosters;
    private final MatchEngineFactory factory;
    private final FixtureSimulator simulator;

    public ExhibitionBootstrap(ExhibitionProperties props, RosterCatalog rosters,
                               MatchEngineFactory factory, FixtureSimulator simulator) {
        this.props = props;
        this.rosters = rosters;
        this.factory = factory;
        this.simulator = simulator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.autoStartOnBoot()) return;
        play();
    }

    public MatchResult play() {
        Team home = rosters.load(props.homeRoster());
        Team away = rosters.load(props.awayRoster());
        MatchEngine engine = factory.create(props.matchId(), home, away);

        MatchResult result = simulator.simulate(List.of(engine)).get(0);
        log.info("Exhibition {} final: {} {} - {} {} ({} plays)",
                result.matchId(), home.name(), result.homeScore(), result.awayScore(), away.name(), result.ticks());
        return result;
    }
}
