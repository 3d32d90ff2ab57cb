package com.gnovoa.domeball.out;

import com.gnovoa.domeball.events.MatchEvent;

/** Receives every event a simulated match produces, in tick order. */
public interface EventPublisher {
    void publish(MatchEvent event);
}
