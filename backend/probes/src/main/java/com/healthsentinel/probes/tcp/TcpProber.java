package com.healthsentinel.probes.tcp;

import com.healthsentinel.core.model.CheckOutcome;
import com.healthsentinel.core.model.ServiceSpec;
import com.healthsentinel.probes.api.Failures;
import com.healthsentinel.probes.api.Params;
import com.healthsentinel.probes.api.ProbeContext;
import com.healthsentinel.probes.api.Prober;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens a TCP connection and optionally exchanges one line, which covers caches, databases and brokers
 * without a vendor driver: e.g. {@code send: "PING\r\n"} and {@code expect: "+PONG"} for Redis.
 * <p>
 * Parameters: {@code host} (required), {@code port} (required), {@code send}, {@code expect}.
 */
public class TcpProber implements Prober {
    public static final String KIND = "tcp";
    private static final int MAX_REPLY_BYTES = 512;

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public void validate(ServiceSpec spec) {
        Params.requiredString(spec.params(), "host");
        int port = Params.requiredInt(spec.params(), "port");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535, was " + port);
        }
    }

    @Override
    public CompletableFuture<CheckOutcome> probe(ServiceSpec spec, ProbeContext ctx) {
        return CompletableFuture.supplyAsync(() -> check(spec, ctx), ctx.blockingExecutor());
    }

    private CheckOutcome check(ServiceSpec spec, ProbeContext ctx) {
        Instant startedAt = ctx.clock().instant();
        String host = Params.requiredString(spec.params(), "host");
        int port = Params.requiredInt(spec.params(), "port");
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, spec.timeout().toMillis());

        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("remote", host + ":" + port);

            String send = Params.optionalString(spec.params(), "send", null);
            String expect = Params.optionalString(spec.params(), "expect", null);
            if (send != null) {
                OutputStream out = socket.getOutputStream();
                out.write(send.getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
            if (expect != null) {
                String reply = readReply(socket.getInputStream());
                if (!reply.startsWith(expect)) {
                    Instant at = ctx.clock().instant();
                    return CheckOutcome.down(spec.name(), KIND, Duration.between(startedAt, at).toMillis(),
                            "Unexpected reply: " + reply.strip(), at);
                }
                metadata.put("reply", reply.strip());
            }
            Instant at = ctx.clock().instant();
            return CheckOutcome.up(spec.name(), KIND, Duration.between(startedAt, at).toMillis(), metadata, at);
        } catch (IOException e) {
            Instant at = ctx.clock().instant();
            return CheckOutcome.down(spec.name(), KIND, Duration.between(startedAt, at).toMillis(),
                    Failures.describe(e), at);
        }
    }

    private static String readReply(InputStream in) throws IOException {
        byte[] buffer = new byte[MAX_REPLY_BYTES];
        int read = in.read(buffer);
        return read <= 0 ? "" : new String(buffer, 0, read, StandardCharsets.UTF_8);
    }
}
