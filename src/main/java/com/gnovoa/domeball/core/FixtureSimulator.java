package com.gnovoa.domeball.core;

import com.gnovoa.domeball.out.EventPublisher;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent matches to completion on a bounded pool, one engine per task.
 *
 * <p>Matches share nothing mutable, so the results equal a sequential run. Events of one match
 * reach the publisher in tick order; events of different matches interleave.
 */
public final class FixtureSimulator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FixtureSimulator.class);

    private final EventPublisher publisher;
    private final ExecutorService executor;

    public FixtureSimulator(EventPublisher publisher, int parallelism) {
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
        this.publisher = publisher;
        this.executor = Executors.newFixedThreadPool(parallelism);
    }

    /**
     * Simulates every engine until its match ends.
     *
     * @return one result per engine, in input order
     * @throws IllegalArgumentException if two engines share a match id
     */
    public List<MatchResult> simulate(List<MatchEngine> engines) {
        Set<String> ids = new HashSet<>();
        for (MatchEngine e : engines) {
            if (!ids.add(e.matchId())) throw new IllegalArgumentException("Duplicate match " + e.matchId());
        }

        log.info("Simulating {} matches", engines.size());
        List<CompletableFuture<MatchResult>> futures = engines.stream()
                .map(e -> CompletableFuture.supplyAsync(() -> runToCompletion(e), executor))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    /** Ticks one engine on the calling thread until the match ends, publishing each event. */
    public MatchResult runToCompletion(MatchEngine engine) {
        while (!engine.isFinished()) {
            publisher.publish(engine.simulateTick());
        }
        return engine.result();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
