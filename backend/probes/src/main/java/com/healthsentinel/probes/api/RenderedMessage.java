package com.healthsentinel.probes.api;

import com.healthsentinel.core.model.StateTransition;

public record RenderedMessage(String subject, String body, StateTransition transition) {
}
