package com.healthsentinel.service.runtime;

import com.healthsentinel.core.model.ServiceSpec;

import java.time.Duration;
import java.time.Instant;

public record ProbeTiming(String serviceName, Duration interval, Instant lastProbeAt, Instant nextProbeAt) {
    static ProbeTiming of(ServiceSpec spec, Instant lastProbeAt) {
        Instant next = lastProbeAt == null ? null : lastProbeAt.plus(spec.interval());
        return new ProbeTiming(spec.name(), spec.interval(), lastProbeAt, next);
    }
}
