package com.healthsentinel.probes.api;

import com.healthsentinel.core.model.CheckOutcome;
import com.healthsentinel.core.model.ServiceSpec;

import java.util.concurrent.CompletableFuture;

/**
 * One probe kind. Implementations are stateless and shared by every service of their kind.
 * <p>
 * The returned future should complete within {@link ServiceSpec#timeout()}; the scheduler enforces the
 * deadline anyway and cancels the future when it passes, so implementations must release sockets and
 * connections on cancellation. Failures may be reported either as a {@code DOWN} outcome or by
 * completing exceptionally.
 */
public interface Prober {
    String kind();

    CompletableFuture<CheckOutcome> probe(ServiceSpec spec, ProbeContext ctx);

    default void validate(ServiceSpec spec) {
    }
}
