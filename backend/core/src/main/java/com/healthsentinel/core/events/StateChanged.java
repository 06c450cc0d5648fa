package com.healthsentinel.core.events;

import com.healthsentinel.core.model.StateTransition;

import java.time.Instant;

public record StateChanged(Instant timestamp, StateTransition transition) implements Event {
    @Override
    public String type() {
        return "StateChanged";
    }
}
