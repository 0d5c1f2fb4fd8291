package org.Aayush.planning.workspace;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a region or workspace definition cannot be represented.
 *
 * <p>Messages are prefixed with a deterministic reason code. The failure is fatal for the
 * offending region only: the workspace is left exactly as it was before the rejected
 * definition or update.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GeometryException extends RuntimeException {
    public static final String REASON_DEGENERATE_REGION = "G1_DEGENERATE_REGION";
    public static final String REASON_SELF_INTERSECTING_REGION = "G1_SELF_INTERSECTING_REGION";
    public static final String REASON_NON_FINITE_COORDINATE = "G1_NON_FINITE_COORDINATE";
    public static final String REASON_INVALID_BOUNDS = "G1_INVALID_BOUNDS";
    public static final String REASON_DUPLICATE_REGION_ID = "G2_DUPLICATE_REGION_ID";
    public static final String REASON_UNKNOWN_REGION_ID = "G2_UNKNOWN_REGION_ID";
    public static final String REASON_DIMENSION_MISMATCH = "G3_DIMENSION_MISMATCH";
    public static final String REASON_START_NOT_FREE = "G3_START_NOT_FREE";

    private final String reasonCode;
    /** Offending region id, or {@code null} when the failure is not tied to one region. */
    private final String regionId;

    /**
     * Creates a reason-coded geometry failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public GeometryException(String reasonCode, String message) {
        this(reasonCode, message, null, null);
    }

    /**
     * Creates a reason-coded geometry failure bound to one region.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param regionId offending region id (nullable).
     * @param cause underlying cause (nullable).
     */
    public GeometryException(String reasonCode, String message, String regionId, Throwable cause) {
        super(formatMessage(reasonCode, message, regionId), cause);
        this.reasonCode = requireReasonCode(reasonCode);
        this.regionId = regionId;
    }

    /**
     * Re-issues a shape-level failure with the id of the region being defined.
     */
    GeometryException forRegion(String id) {
        if (regionId != null || id == null) {
            return this;
        }
        return new GeometryException(reasonCode, rawMessage(), id, this);
    }

    private String rawMessage() {
        String message = getMessage();
        int split = message.indexOf("] ");
        return split < 0 ? message : message.substring(split + 2);
    }

    private static String formatMessage(String reasonCode, String message, String regionId) {
        String base = "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
        return regionId == null ? base : base + " (region " + regionId + ")";
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
