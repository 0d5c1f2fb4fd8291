package org.Aayush.planning.automaton;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a mission formula cannot be turned into an automaton.
 *
 * <p>Raised before any planning starts and fatal to the session. Parse failures carry the
 * character offset and offending token.</p>
 */
@Getter
@Accessors(fluent = true)
public final class FormulaException extends RuntimeException {
    public static final String REASON_PARSE_ERROR = "F1_PARSE_ERROR";
    public static final String REASON_UNEXPECTED_END = "F1_UNEXPECTED_END";
    public static final String REASON_UNSATISFIABLE = "F2_UNSATISFIABLE";
    public static final String REASON_TOO_MANY_PROPOSITIONS = "F2_TOO_MANY_PROPOSITIONS";

    private final String reasonCode;
    /** Character offset of the failure in the input, or {@code -1}. */
    private final int offset;
    /** Offending token, or {@code null}. */
    private final String token;

    public FormulaException(String reasonCode, String message) {
        this(reasonCode, message, -1, null);
    }

    /**
     * Creates a positioned parse failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param offset zero-based character offset, or {@code -1}.
     * @param token offending token (nullable).
     */
    public FormulaException(String reasonCode, String message, int offset, String token) {
        super(formatMessage(reasonCode, message, offset, token));
        this.reasonCode = requireReasonCode(reasonCode);
        this.offset = offset;
        this.token = token;
    }

    private static String formatMessage(String reasonCode, String message, int offset, String token) {
        StringBuilder sb = new StringBuilder()
                .append('[').append(requireReasonCode(reasonCode)).append("] ")
                .append(Objects.requireNonNull(message, "message"));
        if (offset >= 0) {
            sb.append(" at offset ").append(offset);
        }
        if (token != null) {
            sb.append(" near '").append(token).append('\'');
        }
        return sb.toString();
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
