package io.jobwarden.monitor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound/outbound state of a communication channel.
 *
 * @param statusIn    {@code "ok"} or {@code "error"}
 * @param statusOut   {@code "ok"} or {@code "error"}
 * @param options     channel options; {@code host}, {@code user} and {@code uid} are quoted in diagnostics
 * @param lastFetchAt last successful inbound fetch, if the channel tracks it
 */
public record ChannelStatus(
        String area,
        boolean active,
        String statusIn,
        String statusOut,
        String lastLogIn,
        String lastLogOut,
        Map<String, Object> options,
        Instant lastFetchAt
) {
    public static final String ERROR = "error";

    public ChannelStatus {
        // option documents may hold null values
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public boolean inboundFailing() {
        return ERROR.equals(statusIn);
    }

    public boolean outboundFailing() {
        return ERROR.equals(statusOut);
    }
}
