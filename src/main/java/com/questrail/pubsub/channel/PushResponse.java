package com.questrail.pubsub.channel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Status-tagged response to a {@link Push}.
 */
public record PushResponse(String status, Map<String, Object> response) {

    public static final String OK = "ok";
    public static final String ERROR = "error";
    public static final String TIMEOUT = "timeout";

    public PushResponse {
        Objects.requireNonNull(status, "status");
        response = response == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(response));
    }

    public static PushResponse ok() {
        return new PushResponse(OK, Map.of());
    }

    public static PushResponse timeout() {
        return new PushResponse(TIMEOUT, Map.of());
    }

    /**
     * Reads {@code status} and {@code response} out of a reply message payload.
     * A reply without a status is treated as an error.
     */
    @SuppressWarnings("unchecked")
    public static PushResponse fromMessage(Message message) {
        Objects.requireNonNull(message, "message");
        Object status = message.payload().get("status");
        Object response = message.payload().get("response");
        return new PushResponse(
                status instanceof String s ? s : ERROR,
                response instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of());
    }

    public boolean isOk() {
        return OK.equals(status);
    }

    public boolean isError() {
        return ERROR.equals(status);
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(status);
    }
}
