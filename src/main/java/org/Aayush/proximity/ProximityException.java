package org.Aayush.proximity;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Reason-coded contract failure raised by projection, index construction and snapshot publication.
 *
 * <p>Messages are prefixed with deterministic reason-code text for observability.
 * Absent data is never reported through this exception; empty indexes answer with empty results.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ProximityException extends RuntimeException {
    public static final String REASON_NULL_POINTS = "PX_NULL_POINTS";
    public static final String REASON_NON_FINITE_COORDINATE = "PX_NON_FINITE_COORDINATE";
    public static final String REASON_NON_FINITE_RADIUS = "PX_NON_FINITE_RADIUS";
    public static final String REASON_INVALID_CONFIG = "PX_INVALID_CONFIG";
    public static final String REASON_NULL_EXECUTOR = "PX_NULL_EXECUTOR";

    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public ProximityException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public ProximityException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
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
