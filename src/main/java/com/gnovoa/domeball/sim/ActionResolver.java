package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.events.MatchEvent;

/**
 * Resolves one kind of action against the current state.
 *
 * <p>Implementations only read the state and draw from its RNG. They return an event describing
 * what changed; applying it is the engine's job, and so is the commentary.
 */
public interface ActionResolver {

    ActionType action();

    MatchEvent resolve(MatchState state);
}
