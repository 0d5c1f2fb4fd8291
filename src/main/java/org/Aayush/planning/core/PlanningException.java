package org.Aayush.planning.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Reason-coded planner failure surfaced to callers.
 */
@Getter
@Accessors(fluent = true)
public final class PlanningException extends RuntimeException {
    public static final String REASON_PLANNING_TIMEOUT = "P4_PLANNING_TIMEOUT";
    public static final String REASON_PLANNING_CANCELLED = "P4_PLANNING_CANCELLED";
    public static final String REASON_CONFIG_INVALID = "P4_CONFIG_INVALID";
    public static final String REASON_START_REJECTED = "P4_START_REJECTED";
    public static final String REASON_UNRECOVERABLE_REPAIR = "R5_UNRECOVERABLE_REPAIR";

    private final String reasonCode;

    /**
     * Creates a reason-coded planning failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public PlanningException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded planning failure with a cause.
     */
    public PlanningException(String reasonCode, String message, Throwable cause) {
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
