package org.accessroute.routing.heuristic;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a heuristic provider cannot be created for a weighted graph.
 *
 * <p>Messages are prefixed with the reason code.</p>
 */
@Getter
@Accessors(fluent = true)
public final class HeuristicConfigurationException extends RuntimeException {
    private final String reasonCode;

    public HeuristicConfigurationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
